package com.pairstream.server.pipeline.stream;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded reservoir between the producer and the batch assembler. Items are released only
 * once the buffer is full (or closed for draining), each time picking a uniformly random
 * resident. With capacity 1 this is a FIFO hand-off.
 */
class ShuffleBuffer<T> {

    private final int capacity;
    private final Random random;
    private final List<T> items;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notFull = lock.newCondition();
    private final Condition releasable = lock.newCondition();
    private boolean closed;
    private boolean cancelled;

    ShuffleBuffer(int capacity, Random random) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
        this.random = random;
        this.items = new ArrayList<>(capacity);
    }

    /**
     * Blocks while the buffer is full.
     *
     * @return false if the buffer was cancelled and the item discarded
     */
    boolean put(T item) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (items.size() >= capacity && !cancelled) {
                notFull.await();
            }
            if (cancelled) {
                return false;
            }
            if (closed) {
                throw new IllegalStateException("put after close");
            }
            items.add(item);
            if (items.size() == capacity) {
                releasable.signal();
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until the buffer is full or closed.
     *
     * @return a random resident, or null once closed and empty or cancelled
     */
    T take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (!cancelled && !closed && items.size() < capacity) {
                releasable.await();
            }
            if (cancelled || items.isEmpty()) {
                return null;
            }
            int idx = items.size() == 1 ? 0 : random.nextInt(items.size());
            int last = items.size() - 1;
            T picked = items.get(idx);
            items.set(idx, items.get(last));
            items.remove(last);
            notFull.signal();
            return picked;
        } finally {
            lock.unlock();
        }
    }

    /**
     * No more puts; remaining items drain through {@link #take()}.
     */
    void close() {
        lock.lock();
        try {
            closed = true;
            releasable.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops everything and wakes all waiters.
     */
    void cancel() {
        lock.lock();
        try {
            cancelled = true;
            items.clear();
            notFull.signalAll();
            releasable.signalAll();
        } finally {
            lock.unlock();
        }
    }

    int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    int capacity() {
        return capacity;
    }
}
