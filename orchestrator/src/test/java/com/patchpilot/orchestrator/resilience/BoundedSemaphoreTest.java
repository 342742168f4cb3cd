package com.patchpilot.orchestrator.resilience;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BoundedSemaphoreTest {

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new BoundedSemaphore(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void tryAcquire_failsOnceCapacityIsHeld() {
        BoundedSemaphore sem = new BoundedSemaphore(2);

        assertThat(sem.tryAcquire()).isTrue();
        assertThat(sem.tryAcquire()).isTrue();
        assertThat(sem.tryAcquire()).isFalse();
        assertThat(sem.getAcquired()).isEqualTo(2);
        assertThat(sem.getAvailable()).isZero();
    }

    @Test
    void release_withoutAcquire_isRejectedAndDoesNotGrowThePool() {
        BoundedSemaphore sem = new BoundedSemaphore(1);

        assertThatThrownBy(sem::release).isInstanceOf(IllegalStateException.class);
        assertThat(sem.getAvailable()).isEqualTo(1);
        assertThat(sem.tryAcquire()).isTrue();
        assertThat(sem.tryAcquire()).isFalse();
    }

    @Test
    void neverMoreHoldersThanCapacity() throws Exception {
        BoundedSemaphore sem = new BoundedSemaphore(3);
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger peak   = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(10);
        CountDownLatch done  = new CountDownLatch(30);

        for (int i = 0; i < 30; i++) {
            pool.submit(() -> {
                try {
                    sem.acquire();
                    try {
                        peak.accumulateAndGet(inside.incrementAndGet(), Math::max);
                        Thread.sleep(2);
                        inside.decrementAndGet();
                    } finally {
                        sem.release();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }

        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        pool.shutdownNow();
        assertThat(peak.get()).isLessThanOrEqualTo(3);
        assertThat(sem.getAcquired()).isZero();
    }

    @Test
    void waitersAreServedInArrivalOrder() throws Exception {
        BoundedSemaphore sem = new BoundedSemaphore(1);
        sem.acquire();
        List<Integer> order = new CopyOnWriteArrayList<>();
        List<Thread> threads = new ArrayList<>();

        for (int i = 0; i < 3; i++) {
            int id = i;
            Thread t = new Thread(() -> {
                try {
                    sem.acquire();
                    order.add(id);
                    sem.release();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            t.start();
            threads.add(t);
            // wait until this thread is parked before starting the next one
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (sem.getWaiting() < i + 1 && System.nanoTime() < deadline) {
                Thread.sleep(1);
            }
        }

        sem.release();
        for (Thread t : threads) {
            t.join(5_000);
        }
        assertThat(order).containsExactly(0, 1, 2);
    }
}
