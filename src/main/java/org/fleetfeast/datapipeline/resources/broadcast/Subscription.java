package org.fleetfeast.datapipeline.resources.broadcast;

import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

import org.fleetfeast.datapipeline.api.resources.broadcast.ISnapshotSubscription;

/**
 * Bounded per-subscriber buffer that evicts its oldest entry when full.
 */
final class Subscription<T> implements ISnapshotSubscription<T> {

    private final String name;
    private final ArrayBlockingQueue<T> buffer;
    private final Consumer<Subscription<T>> onClose;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong dropped = new AtomicLong();

    Subscription(String name, int capacity, Consumer<Subscription<T>> onClose) {
        this.name = name;
        this.buffer = new ArrayBlockingQueue<>(capacity);
        this.onClose = onClose;
    }

    /**
     * Called only from the publishing thread, so eviction and insert cannot interleave
     * with another delivery.
     */
    void deliver(T snapshot) {
        if (closed.get()) {
            return;
        }
        while (!buffer.offer(snapshot)) {
            if (buffer.poll() != null) {
                dropped.incrementAndGet();
            }
        }
    }

    @Override
    public Optional<T> poll(long timeout, TimeUnit unit) throws InterruptedException {
        if (closed.get()) {
            return Optional.empty();
        }
        return Optional.ofNullable(buffer.poll(timeout, unit));
    }

    @Override
    public long droppedCount() {
        return dropped.get();
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            buffer.clear();
            onClose.accept(this);
        }
    }

    @Override
    public String toString() {
        return "Subscription[" + name + "]";
    }
}
