package com.augment.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BoundedQueue<T>")
final class BoundedQueueTest {

    @Nested
    @DisplayName("Contract")
    class Contract {

        @Test
        @DisplayName("capacity must be >= 1")
        void capacityMustBePositive() {
            assertThrows(IllegalArgumentException.class, () -> new BoundedQueue<>(0));
            assertThrows(IllegalArgumentException.class, () -> new BoundedQueue<>(-3));
        }

        @Test
        @DisplayName("push(null) -> IllegalArgumentException")
        void pushNullRejected() {
            BoundedQueue<String> q = new BoundedQueue<>(2);
            assertThrows(IllegalArgumentException.class, () -> q.push(null));
        }

        @Test
        @DisplayName("FIFO order")
        void fifo() throws Exception {
            BoundedQueue<Integer> q = new BoundedQueue<>(3);
            q.push(1);
            q.push(2);
            q.push(3);
            assertEquals(3, q.size());
            assertEquals(Optional.of(1), q.pop());
            assertEquals(Optional.of(2), q.pop());
            assertEquals(Optional.of(3), q.pop());
        }

        @Test
        @DisplayName("push after close returns false and drops the item")
        void pushAfterCloseIsDropped() throws Exception {
            BoundedQueue<Integer> q = new BoundedQueue<>(2);
            q.close();
            assertFalse(q.push(1));
            assertEquals(0, q.size());
        }

        @Test
        @DisplayName("close is idempotent")
        void closeIsIdempotent() {
            BoundedQueue<Integer> q = new BoundedQueue<>(2);
            q.close();
            q.close();
            assertTrue(q.isClosed());
        }

        @Test
        @DisplayName("buffered items survive close, then pop signals end of stream")
        void drainAfterClose() throws Exception {
            BoundedQueue<Integer> q = new BoundedQueue<>(3);
            q.push(1);
            q.push(2);
            q.close();
            assertEquals(Optional.of(1), q.pop());
            assertEquals(Optional.of(2), q.pop());
            assertTrue(q.pop().isEmpty());
            assertTrue(q.pop().isEmpty());
        }
    }

    @Nested
    @DisplayName("Blocking")
    class Blocking {

        @Test
        @Timeout(5)
        @DisplayName("push blocks while full until a pop makes space")
        void backpressure() throws Exception {
            BoundedQueue<Integer> q = new BoundedQueue<>(1);
            q.push(1);
            AtomicBoolean pushed = new AtomicBoolean();
            Thread t = new Thread(() -> {
                try {
                    pushed.set(q.push(2));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            t.start();
            Thread.sleep(100);
            assertFalse(pushed.get());
            assertEquals(1, q.size());

            assertEquals(Optional.of(1), q.pop());
            t.join(2000);
            assertTrue(pushed.get());
            assertEquals(Optional.of(2), q.pop());
        }

        @Test
        @Timeout(5)
        @DisplayName("one pop releases exactly one of several blocked pushers")
        void popReleasesExactlyOnePusher() throws Exception {
            BoundedQueue<Integer> q = new BoundedQueue<>(2);
            q.push(0);
            q.push(1);
            AtomicInteger completed = new AtomicInteger();
            List<Thread> pushers = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                int item = 10 + i;
                Thread t = new Thread(() -> {
                    try {
                        if (q.push(item)) completed.incrementAndGet();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                });
                pushers.add(t);
                t.start();
            }
            Thread.sleep(100);
            assertEquals(0, completed.get());

            assertEquals(Optional.of(0), q.pop());
            while (completed.get() == 0) Thread.sleep(5);
            Thread.sleep(100);
            assertEquals(1, completed.get());
            assertEquals(q.capacity(), q.size());

            q.close();
            for (Thread t : pushers) t.join(2000);
            assertEquals(1, completed.get());
        }

        @Test
        @Timeout(5)
        @DisplayName("close wakes a blocked pusher, which reports the drop")
        void closeWakesPusher() throws Exception {
            BoundedQueue<Integer> q = new BoundedQueue<>(1);
            q.push(1);
            CountDownLatch started = new CountDownLatch(1);
            AtomicBoolean result = new AtomicBoolean(true);
            Thread t = new Thread(() -> {
                started.countDown();
                try {
                    result.set(q.push(2));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            t.start();
            started.await();
            Thread.sleep(50);
            q.close();
            t.join(2000);
            assertFalse(t.isAlive());
            assertFalse(result.get());
            assertEquals(1, q.size());
        }

        @Test
        @Timeout(5)
        @DisplayName("close wakes blocked poppers with end of stream")
        void closeWakesPoppers() throws Exception {
            BoundedQueue<Integer> q = new BoundedQueue<>(2);
            ExecutorService pool = Executors.newFixedThreadPool(3);
            try {
                List<Future<Optional<Integer>>> waiters = new ArrayList<>();
                for (int i = 0; i < 3; i++) waiters.add(pool.submit(q::pop));
                Thread.sleep(100);
                q.close();
                for (Future<Optional<Integer>> f : waiters) assertTrue(f.get(2, TimeUnit.SECONDS).isEmpty());
            } finally {
                pool.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class Concurrency {

        @Test
        @Timeout(20)
        @DisplayName("many producers, many consumers: every item delivered exactly once")
        void exactlyOnce() throws Exception {
            int producers = 4;
            int consumers = 3;
            int perProducer = 2_000;
            BoundedQueue<Integer> q = new BoundedQueue<>(8);
            BitSet seen = new BitSet(producers * perProducer);
            AtomicInteger duplicates = new AtomicInteger();

            ExecutorService pool = Executors.newFixedThreadPool(producers + consumers);
            try {
                List<Future<?>> prod = new ArrayList<>();
                for (int p = 0; p < producers; p++) {
                    int base = p * perProducer;
                    prod.add(pool.submit(() -> {
                        for (int i = 0; i < perProducer; i++) assertTrue(q.push(base + i));
                        return null;
                    }));
                }
                List<Future<?>> cons = new ArrayList<>();
                for (int c = 0; c < consumers; c++) {
                    cons.add(pool.submit(() -> {
                        Optional<Integer> next;
                        while ((next = q.pop()).isPresent()) {
                            int v = next.get();
                            synchronized (seen) {
                                if (seen.get(v)) duplicates.incrementAndGet();
                                seen.set(v);
                            }
                            assertTrue(q.size() <= q.capacity());
                        }
                        return null;
                    }));
                }
                for (Future<?> f : prod) f.get();
                q.close();
                for (Future<?> f : cons) f.get();
            } finally {
                pool.shutdownNow();
            }
            assertEquals(0, duplicates.get());
            assertEquals(producers * perProducer, seen.cardinality());
        }
    }
}
