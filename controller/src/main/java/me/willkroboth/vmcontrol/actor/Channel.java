package me.willkroboth.vmcontrol.actor;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * FIFO queue with an explicit capacity that can be closed.
 * <p>
 * Closing stops new items from being sent, but items already queued can still be received. Once a closed channel is
 * empty every receive returns null immediately.
 */
public final class Channel<T> {
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    private final String name;
    private final int capacity;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Deque<T> queue = new ArrayDeque<>();
    private boolean closed = false;

    public Channel(String name, int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("Channel capacity must be positive, got " + capacity);
        this.name = name;
        this.capacity = capacity;
    }

    public static <T> Channel<T> bounded(String name, int capacity) {
        return new Channel<>(name, capacity);
    }

    public static <T> Channel<T> unbounded(String name) {
        return new Channel<>(name, UNBOUNDED);
    }

    /**
     * Queues {@code item} without waiting.
     *
     * @return False if the channel is full
     * @throws ChannelClosedException If the channel has been closed
     */
    public boolean offer(T item) {
        if (item == null) throw new NullPointerException("Channels do not accept null items");

        lock.lock();
        try {
            if (closed) throw new ChannelClosedException("Channel " + name + " is closed");
            if (queue.size() >= capacity) return false;

            queue.addLast(item);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits for the next item.
     *
     * @return The next item, or null once the channel is closed and empty
     */
    public T receive() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (queue.isEmpty()) {
                if (closed) return null;
                notEmpty.await();
            }
            return queue.removeFirst();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return The next item, or null if none arrived in time or the channel is closed and empty
     */
    public T poll(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();

        lock.lockInterruptibly();
        try {
            while (queue.isEmpty()) {
                if (closed || remaining <= 0) return null;
                remaining = notEmpty.awaitNanos(remaining);
            }
            return queue.removeFirst();
        } finally {
            lock.unlock();
        }
    }

    public void close() {
        lock.lock();
        try {
            closed = true;
            // Wake every receiver so they can see the channel is closed
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the channel and throws away anything still queued.
     *
     * @return How many items were discarded
     */
    public int closeAndDiscard() {
        lock.lock();
        try {
            closed = true;
            int discarded = queue.size();
            queue.clear();
            notEmpty.signalAll();
            return discarded;
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
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "Channel[" + name + "]";
    }
}
