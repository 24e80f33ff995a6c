package com.questhub.engineservice.lock.impl;

import com.questhub.engineservice.common.error.LockBusyException;
import com.questhub.engineservice.common.error.LockNotHeldException;
import com.questhub.engineservice.config.EngineProperties;
import com.questhub.engineservice.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalSessionLockTest {

    private MutableClock clock;
    private LocalSessionLock lock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(1_000_000L);
        EngineProperties props = new EngineProperties();
        props.setLockTtlSeconds(30);
        lock = new LocalSessionLock(props, clock);
    }

    @Test
    @DisplayName("并发获取同一会话的锁，只有一个成功")
    void onlyOneConcurrentHolder() throws Exception {
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger acquired = new AtomicInteger();
        AtomicInteger busy = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                try {
                    lock.acquire("s1");
                    acquired.incrementAndGet();
                } catch (LockBusyException e) {
                    busy.incrementAndGet();
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get(5, TimeUnit.SECONDS);
        }
        pool.shutdownNow();

        assertThat(acquired).hasValue(1);
        assertThat(busy).hasValue(threads - 1);
    }

    @Test
    @DisplayName("不同会话的锁互不影响")
    void differentSessionsIndependent() {
        lock.acquire("s1");
        lock.acquire("s2");
        assertThat(lock.isLocked("s1")).isTrue();
        assertThat(lock.isLocked("s2")).isTrue();
    }

    @Test
    @DisplayName("锁过期后可被新持有者获取，旧令牌释放失败")
    void expiredLockCanBeTakenOver() {
        String first = lock.acquire("s1", Duration.ofSeconds(5));
        clock.advance(Duration.ofSeconds(6));

        assertThat(lock.isLocked("s1")).isFalse();
        String second = lock.acquire("s1");
        assertThat(second).isNotEqualTo(first);
        assertThatThrownBy(() -> lock.release("s1", first)).isInstanceOf(LockNotHeldException.class);
        lock.release("s1", second);
        assertThat(lock.isLocked("s1")).isFalse();
    }

    @Test
    @DisplayName("强制释放后立即可以重新获取")
    void forceReleaseFreesImmediately() {
        lock.acquire("s1");
        assertThat(lock.forceRelease("s1")).isTrue();
        assertThat(lock.isLocked("s1")).isFalse();
        assertThat(lock.acquire("s1")).isNotBlank();
        assertThat(lock.forceRelease("missing")).isFalse();
    }

    @Test
    @DisplayName("withLock 在动作抛错时也会释放锁")
    void withLockReleasesOnFailure() {
        assertThatThrownBy(() -> lock.withLock("s1", Duration.ofSeconds(5), () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);
        assertThat(lock.isLocked("s1")).isFalse();
    }

    @Test
    @DisplayName("锁信息包含持有时间与过期时间")
    void lockInfoExposesTimes() {
        lock.acquire("s1", Duration.ofSeconds(10));
        assertThat(lock.getLockInfo("s1")).hasValueSatisfying(info -> {
            assertThat(info.getAcquiredAt()).isEqualTo(1_000_000L);
            assertThat(info.getExpiresAt()).isEqualTo(1_010_000L);
        });
    }

    @Test
    @DisplayName("清理只移除过期记录")
    void cleanupRemovesOnlyExpired() {
        lock.acquire("old", Duration.ofSeconds(1));
        clock.advance(Duration.ofSeconds(2));
        lock.acquire("fresh", Duration.ofSeconds(30));

        assertThat(lock.cleanupExpired()).isEqualTo(1);
        assertThat(lock.isLocked("fresh")).isTrue();
    }
}
