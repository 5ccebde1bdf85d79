package com.augment.core;

import java.util.ArrayDeque;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Capacity-limited FIFO with blocking {@link #push} / {@link #pop} and a one-way {@link #close}.
 *
 * <p>One lock guards the deque; producers wait on {@code notFull}, consumers on {@code notEmpty}.
 * After {@link #close()} no new item is accepted, but whatever is already buffered is still handed
 * out by {@link #pop()} until the queue runs dry. {@code pop()} returns empty only when the queue is
 * both closed and drained, which is the end-of-stream signal for a consuming loop.
 *
 * @param <T> element type
 */
public final class BoundedQueue<T> {
    private final ArrayDeque<T> items;
    private final int capacity;
    private boolean closed;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();

    public BoundedQueue(int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
        this.capacity = capacity;
        this.items = new ArrayDeque<>(capacity);
    }

    /**
     * Appends {@code item}, waiting while the queue is full and open.
     *
     * @return {@code true} if the item was enqueued, {@code false} if the queue was closed first
     *     (the item is dropped)
     */
    public boolean push(T item) throws InterruptedException {
        if (item == null) throw new IllegalArgumentException("item must not be null");
        lock.lockInterruptibly();
        try {
            while (!closed && items.size() >= capacity) notFull.await();
            if (closed) return false;
            items.addLast(item);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the head, waiting while the queue is empty and open.
     *
     * @return the head item, or empty once the queue is closed and drained
     */
    public Optional<T> pop() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (!closed && items.isEmpty()) notEmpty.await();
            T head = items.pollFirst();
            if (head == null) return Optional.empty();
            notFull.signal();
            return Optional.of(head);
        } finally {
            lock.unlock();
        }
    }

    /** Marks the queue closed and wakes every waiting pusher and popper. Safe to call repeatedly. */
    public void close() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }
}
