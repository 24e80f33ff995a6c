package com.questhub.engineservice.lock.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.questhub.engineservice.common.error.LockBusyException;
import com.questhub.engineservice.common.error.LockNotHeldException;
import com.questhub.engineservice.config.EngineProperties;
import com.questhub.engineservice.infrastructure.redis.RedisOps;
import com.questhub.engineservice.lock.SessionLockInfo;
import com.questhub.engineservice.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisSessionLockTest {

    private static final String KEY = "questhub:lock:session:s1";

    @Mock
    private RedisOps ops;

    private final ObjectMapper mapper = new ObjectMapper();
    private MutableClock clock;
    private RedisSessionLock lock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(5_000L);
        lock = new RedisSessionLock(ops, mapper, new EngineProperties(), clock, "node-a");
    }

    @Test
    @DisplayName("SET NX 成功时写入带节点标识的锁记录")
    void acquireWritesRecord() throws Exception {
        when(ops.setStringNx(eq(KEY), anyString(), eq(Duration.ofSeconds(60)))).thenReturn(true);

        String token = lock.acquire("s1");

        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(ops).setStringNx(eq(KEY), payload.capture(), eq(Duration.ofSeconds(60)));
        SessionLockInfo info = mapper.readValue(payload.getValue(), SessionLockInfo.class);
        assertThat(info.getLockId()).isEqualTo(token);
        assertThat(info.getOwner()).isEqualTo("node-a");
        assertThat(info.getExpiresAt()).isEqualTo(65_000L);
    }

    @Test
    @DisplayName("键已存在且未过期时抛 LockBusy")
    void busyWhenHeld() throws Exception {
        when(ops.setStringNx(eq(KEY), anyString(), any())).thenReturn(false);
        when(ops.getString(KEY)).thenReturn(mapper.writeValueAsString(
                new SessionLockInfo("other", "node-b", 4_000L, 60_000L)));

        assertThatThrownBy(() -> lock.acquire("s1")).isInstanceOf(LockBusyException.class);
        verify(ops).getString(KEY);
    }

    @Test
    @DisplayName("释放脚本返回 0 或 -1 时抛 LockNotHeld")
    void releaseMismatch() {
        when(ops.evalString(eq(RedisSessionLock.RELEASE_SCRIPT), eq(List.of(KEY)), eq("stale"))).thenReturn(0L);
        assertThatThrownBy(() -> lock.release("s1", "stale")).isInstanceOf(LockNotHeldException.class);

        when(ops.evalString(eq(RedisSessionLock.RELEASE_SCRIPT), eq(List.of(KEY)), eq("gone"))).thenReturn(-1L);
        assertThatThrownBy(() -> lock.release("s1", "gone")).isInstanceOf(LockNotHeldException.class);
    }

    @Test
    @DisplayName("令牌匹配时释放成功")
    void releaseMatch() {
        when(ops.evalString(RedisSessionLock.RELEASE_SCRIPT, List.of(KEY), "t1")).thenReturn(1L);
        lock.release("s1", "t1");
        verify(ops).evalString(RedisSessionLock.RELEASE_SCRIPT, List.of(KEY), "t1");
    }

    @Test
    @DisplayName("强制释放直接删除键")
    void forceReleaseDeletes() {
        when(ops.del(KEY)).thenReturn(1L);
        assertThat(lock.forceRelease("s1")).isTrue();
    }

    @Test
    @DisplayName("已过期的记录不算持有")
    void expiredRecordIsNotLocked() throws Exception {
        when(ops.getString(KEY)).thenReturn(mapper.writeValueAsString(
                new SessionLockInfo("old", "node-b", 1_000L, 4_000L)));
        assertThat(lock.isLocked("s1")).isFalse();
    }
}
