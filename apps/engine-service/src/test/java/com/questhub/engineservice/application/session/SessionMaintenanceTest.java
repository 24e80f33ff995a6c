package com.questhub.engineservice.application.session;

import com.questhub.engineservice.domain.model.GameSession;
import com.questhub.engineservice.support.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class SessionMaintenanceTest {

    private EngineFixture fx;
    private SessionMaintenance maintenance;

    @BeforeEach
    void setUp() {
        fx = new EngineFixture();
        maintenance = fx.maintenance;
    }

    private GameSession dirtySession() {
        GameSession s = fx.engine.createSession("u1", "hero", null);
        fx.clock.advance(Duration.ofSeconds(5));
        s.setLastActivity(fx.clock.millis());
        return s;
    }

    private long storedSavedAt(String sessionId) {
        return fx.sessionRepository.findById(sessionId).orElseThrow().getLastSavedAt();
    }

    @Test
    void autoSaveSkipsBusySessionUntilReleased() {
        GameSession s = dirtySession();
        String token = fx.lock.acquire(s.getSessionId());

        assertThat(maintenance.autoSave()).isZero();
        assertThat(s.hasUnsavedChanges()).isTrue();

        fx.lock.release(s.getSessionId(), token);
        assertThat(maintenance.autoSave()).isEqualTo(1);
        assertThat(s.hasUnsavedChanges()).isFalse();
        assertThat(storedSavedAt(s.getSessionId())).isEqualTo(fx.clock.millis());
        assertThat(fx.lock.isLocked(s.getSessionId())).isFalse();
    }

    @Test
    void autoSaveRespectsSessionSetting() {
        GameSession s = dirtySession();
        s.getSettings().setAutoSave(false);

        assertThat(maintenance.autoSave()).isZero();
        // 停机保存不看会话设置
        assertThat(maintenance.saveAll()).isEqualTo(1);
    }

    @Test
    void cleanupEvictsOnlyInactiveSessions() {
        GameSession idle = fx.engine.createSession("u1", "a", null);
        fx.clock.advance(Duration.ofMinutes(31));
        GameSession fresh = fx.engine.createSession("u2", "b", null);

        assertThat(maintenance.cleanupInactive()).isEqualTo(1);

        assertThat(fx.cache.size()).isEqualTo(1);
        assertThat(fx.cache.all()).extracting(GameSession::getSessionId).containsExactly(fresh.getSessionId());
        // 移出内存后仍可从仓储读回
        assertThat(fx.cache.find(idle.getSessionId())).isPresent();
    }

    @Test
    void expiredLocalLocksAreCleaned() {
        fx.lock.acquire("s-1", Duration.ofSeconds(1));
        fx.clock.advance(Duration.ofSeconds(2));

        assertThat(maintenance.cleanupExpiredLocks()).isEqualTo(1);
        assertThat(fx.lock.getLockInfo("s-1")).isEmpty();
    }
}
