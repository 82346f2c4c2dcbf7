package org.fleetfeast.datapipeline.resources.queues;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.fleetfeast.datapipeline.api.resources.queues.IInputQueueResource;
import org.fleetfeast.datapipeline.api.resources.queues.IOutputQueueResource;
import org.fleetfeast.datapipeline.resources.AbstractResource;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * A thread-safe, in-memory, bounded FIFO queue based on {@link ArrayBlockingQueue}.
 * Producers may enqueue concurrently; {@link #drainBatch(int)} is atomic with respect
 * to other drains, so consecutive batches never overlap.
 *
 * @param <T> The type of elements held in this queue.
 */
public class InMemoryBlockingQueue<T> extends AbstractResource implements IInputQueueResource<T>, IOutputQueueResource<T> {

    private final ArrayBlockingQueue<T> queue;
    private final int capacity;

    // Serializes drains across competing consumers
    private final Object drainLock = new Object();

    private final AtomicLong offeredCount = new AtomicLong();
    private final AtomicLong rejectedCount = new AtomicLong();
    private final AtomicLong drainedCount = new AtomicLong();

    /**
     * Constructs an InMemoryBlockingQueue with the specified name and configuration.
     *
     * @param name    The name of the resource.
     * @param options Queue options:
     *                <ul>
     *                  <li>{@code capacity} - Maximum queue size (default: 64)</li>
     *                </ul>
     * @throws IllegalArgumentException if the configuration is invalid (e.g., non-positive capacity).
     */
    public InMemoryBlockingQueue(String name, Config options) {
        super(name, options);
        Config defaults = ConfigFactory.parseMap(Map.of(
                "capacity", 64
        ));
        Config finalConfig = options.withFallback(defaults);

        try {
            this.capacity = finalConfig.getInt("capacity");
            if (capacity <= 0) {
                throw new IllegalArgumentException("Capacity must be positive for resource '" + name + "'.");
            }
            this.queue = new ArrayBlockingQueue<>(capacity);
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid configuration for InMemoryBlockingQueue '" + name + "'", e);
        }
    }

    @Override
    public boolean offer(T element) {
        if (element == null) {
            throw new NullPointerException("element cannot be null");
        }
        return record(queue.offer(element));
    }

    @Override
    public boolean offer(T element, long timeout, TimeUnit unit) throws InterruptedException {
        if (element == null) {
            throw new NullPointerException("element cannot be null");
        }
        return record(queue.offer(element, timeout, unit));
    }

    private boolean record(boolean accepted) {
        if (accepted) {
            offeredCount.incrementAndGet();
        } else {
            rejectedCount.incrementAndGet();
            log.debug("Queue '{}' is full (capacity {}), element rejected", name, capacity);
        }
        return accepted;
    }

    @Override
    public List<T> drainBatch(int maxSize) {
        List<T> batch = new ArrayList<>();
        synchronized (drainLock) {
            if (maxSize <= 0) {
                queue.drainTo(batch);
            } else {
                queue.drainTo(batch, maxSize);
            }
        }
        drainedCount.addAndGet(batch.size());
        return batch;
    }

    @Override
    public int size() {
        return queue.size();
    }

    public int getCapacity() {
        return capacity;
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("current_size", queue.size());
        metrics.put("capacity", capacity);
        metrics.put("offered_total", offeredCount.get());
        metrics.put("rejected_total", rejectedCount.get());
        metrics.put("drained_total", drainedCount.get());
    }
}
