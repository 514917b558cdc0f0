package io.mnemo.core.record;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.mnemo.core.error.ConcurrencyConflictException;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class OwnerLockRegistryTest {

    @Test
    void shouldRaiseConflictWhenWriteLockStaysHeld() throws Exception {
        OwnerLockRegistry locks = new OwnerLockRegistry(Duration.ofMillis(20), 2);
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<Integer> holder = executor.submit(() -> locks.write("alice", () -> {
                held.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return 1;
            }));
            assertThat(held.await(5, TimeUnit.SECONDS)).isTrue();

            assertThatThrownBy(() -> locks.read("alice", () -> 0))
                .isInstanceOf(ConcurrencyConflictException.class)
                .hasMessageContaining("2 attempts");
            assertThat(locks.read("bob", () -> 7)).isEqualTo(7);

            release.countDown();
            assertThat(holder.get(5, TimeUnit.SECONDS)).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void shouldReleaseLockWhenActionFails() throws Exception {
        OwnerLockRegistry locks = new OwnerLockRegistry(Duration.ofMillis(20), 1);

        assertThatThrownBy(() -> locks.write("alice", () -> {
            throw new IOException("boom");
        })).isInstanceOf(IOException.class);

        assertThat(locks.write("alice", () -> "ok")).isEqualTo("ok");
    }

    @Test
    void shouldDropOwnerLockAfterRelease() throws Exception {
        OwnerLockRegistry locks = new OwnerLockRegistry();
        locks.write("alice", () -> 1);
        locks.read("bob", () -> 1);

        assertThat(locks.writeAndRelease("alice", () -> 3)).isEqualTo(3);
        assertThat(locks.writeAndRelease("alice", () -> 0)).isZero();

        assertThat(locks.trackedOwners()).isEqualTo(1);
    }

    @Test
    void shouldMoveWaitersToFreshLockWhenOwnerIsReleased() throws Exception {
        OwnerLockRegistry locks = new OwnerLockRegistry(Duration.ofSeconds(5), 1);
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<Integer> purge = executor.submit(() -> locks.writeAndRelease("alice", () -> {
                held.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return 2;
            }));
            assertThat(held.await(5, TimeUnit.SECONDS)).isTrue();
            Future<String> waiter = executor.submit(() -> locks.write("alice", () -> "after"));

            release.countDown();

            assertThat(purge.get(5, TimeUnit.SECONDS)).isEqualTo(2);
            assertThat(waiter.get(5, TimeUnit.SECONDS)).isEqualTo("after");
            assertThat(locks.trackedOwners()).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }
}
