package com.opencalsync.sync.lock;

import com.opencalsync.common.exception.ServiceUnavailableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class DistributedLockExecutorTest {

    @Mock
    private RedissonClient redissonClient;

    @Mock
    private RLock lock;

    @InjectMocks
    private DistributedLockExecutor lockExecutor;

    @Test
    @DisplayName("Connection lock: runs the action and releases the lock")
    void tryWithConnectionLock_acquired() {
        // given
        given(redissonClient.getLock("lock:sync:connection:100")).willReturn(lock);
        given(lock.tryLock()).willReturn(true);
        given(lock.isHeldByCurrentThread()).willReturn(true);

        // when
        Optional<String> result = lockExecutor.tryWithConnectionLock(100L, () -> "done");

        // then
        assertThat(result).contains("done");
        verify(lock).unlock();
    }

    @Test
    @DisplayName("Connection lock held elsewhere: the action is not run")
    void tryWithConnectionLock_busy() {
        // given
        given(redissonClient.getLock("lock:sync:connection:100")).willReturn(lock);
        given(lock.tryLock()).willReturn(false);

        // when
        Optional<String> result = lockExecutor.tryWithConnectionLock(100L, () -> {
            throw new AssertionError("must not run");
        });

        // then
        assertThat(result).isEmpty();
        verify(lock, never()).unlock();
    }

    @Test
    @DisplayName("Property lock: released even when the action throws")
    void withPropertyLock_releasesOnFailure() throws InterruptedException {
        // given
        given(redissonClient.getLock("lock:conflicts:property:10")).willReturn(lock);
        given(lock.tryLock(anyLong(), eq(TimeUnit.SECONDS))).willReturn(true);
        given(lock.isHeldByCurrentThread()).willReturn(true);

        // when / then
        assertThatThrownBy(() -> lockExecutor.withPropertyLock(10L, () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);
        verify(lock).unlock();
    }

    @Test
    @DisplayName("Property lock timeout surfaces as service unavailable")
    void withPropertyLock_timeout() throws InterruptedException {
        // given
        given(redissonClient.getLock("lock:conflicts:property:10")).willReturn(lock);
        given(lock.tryLock(anyLong(), eq(TimeUnit.SECONDS))).willReturn(false);
        given(lock.isHeldByCurrentThread()).willReturn(false);

        // when / then
        assertThatThrownBy(() -> lockExecutor.withPropertyLock(10L, () -> "never"))
                .isInstanceOf(ServiceUnavailableException.class);
        verify(lock, never()).unlock();
    }

    @Test
    @DisplayName("Waiting connection lock: runs the action once a running sync releases it")
    void withConnectionLock_waitsForSync() throws InterruptedException {
        // given
        given(redissonClient.getLock("lock:sync:connection:100")).willReturn(lock);
        given(lock.tryLock(anyLong(), eq(TimeUnit.SECONDS))).willReturn(true);
        given(lock.isHeldByCurrentThread()).willReturn(true);

        // when
        String result = lockExecutor.withConnectionLock(100L, () -> "removed");

        // then
        assertThat(result).isEqualTo("removed");
        verify(lock).tryLock(60L, TimeUnit.SECONDS);
        verify(lock).unlock();
    }

    @Test
    @DisplayName("Waiting connection lock: a sync that outlasts the wait surfaces as service unavailable")
    void withConnectionLock_timeout() throws InterruptedException {
        // given
        given(redissonClient.getLock("lock:sync:connection:100")).willReturn(lock);
        given(lock.tryLock(anyLong(), eq(TimeUnit.SECONDS))).willReturn(false);
        given(lock.isHeldByCurrentThread()).willReturn(false);

        // when / then
        assertThatThrownBy(() -> lockExecutor.withConnectionLock(100L, () -> "never"))
                .isInstanceOf(ServiceUnavailableException.class)
                .hasMessageContaining("being synced");
        verify(lock, never()).unlock();
    }
}
