package dev.rxcache.channel;

import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Many-producer, single-consumer channel feeding the cache writer.
 *
 * <p>Ordering is FIFO per producer; messages from different producers interleave
 * arbitrarily. The channel also counts writes sent and writes acknowledged by the consumer,
 * so the orchestrator can wait for the writer to catch up between phases
 * ({@link #awaitDrained(long, TimeUnit)}).
 */
public final class CacheWriteChannel {
    private final BlockingQueue<Message> queue = new LinkedBlockingQueue<>();
    private final Object drainLock = new Object();
    private long sent;
    private long acknowledged;

    public void send(Message message) {
        Objects.requireNonNull(message, "message cannot be null");
        if (message instanceof Message.CacheWrite) {
            synchronized (drainLock) {
                sent++;
            }
        }
        queue.add(message);
    }

    /**
     * Blocks until a message is available.
     */
    public Message receive() throws InterruptedException {
        return queue.take();
    }

    /**
     * Called by the consumer once a {@link Message.CacheWrite} is durable in the log.
     */
    public void acknowledge() {
        synchronized (drainLock) {
            acknowledged++;
            if (acknowledged >= sent) {
                drainLock.notifyAll();
            }
        }
    }

    /**
     * Blocks until every write sent so far has been acknowledged, or the timeout elapses.
     *
     * @return true if drained, false on timeout
     */
    public boolean awaitDrained(long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        synchronized (drainLock) {
            while (acknowledged < sent) {
                long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMillis <= 0) {
                    return false;
                }
                drainLock.wait(remainingMillis);
            }
            return true;
        }
    }

    public long sentCount() {
        synchronized (drainLock) {
            return sent;
        }
    }

    public long acknowledgedCount() {
        synchronized (drainLock) {
            return acknowledged;
        }
    }

    public int pending() {
        return queue.size();
    }
}
