package org.fleetfeast.datapipeline.resources.broadcast;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.fleetfeast.datapipeline.api.resources.broadcast.ISnapshotPublisher;
import org.fleetfeast.datapipeline.api.resources.broadcast.ISnapshotSource;
import org.fleetfeast.datapipeline.api.resources.broadcast.ISnapshotSubscription;
import org.fleetfeast.datapipeline.resources.AbstractResource;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Fans each published snapshot out to any number of independently paced subscribers.
 * <p>
 * {@link #publish(Object)} holds no lock while handing off: it swaps the latest reference
 * and offers the snapshot to every subscriber's bounded buffer. A subscriber whose buffer
 * is full loses its oldest unread snapshot, so a slow client can never stall the publisher.
 * <p>
 * Options:
 * <ul>
 *   <li>{@code subscriberBufferSize} - per-subscriber buffer, default 16</li>
 * </ul>
 *
 * @param <T> snapshot type
 */
public class SnapshotBroadcaster<T> extends AbstractResource implements ISnapshotPublisher<T>, ISnapshotSource<T> {

    private final int subscriberBufferSize;
    private final AtomicReference<T> latest = new AtomicReference<>();
    private final List<Subscription<T>> subscribers = new CopyOnWriteArrayList<>();
    private final AtomicLong publishedCount = new AtomicLong();

    public SnapshotBroadcaster(String name, Config options) {
        super(name, options);
        Config finalConfig = options.withFallback(ConfigFactory.parseMap(Map.of("subscriberBufferSize", 16)));
        this.subscriberBufferSize = finalConfig.getInt("subscriberBufferSize");
        if (subscriberBufferSize <= 0) {
            throw new IllegalArgumentException("subscriberBufferSize must be positive for resource '" + name + "'.");
        }
    }

    @Override
    public void publish(T snapshot) {
        if (snapshot == null) {
            throw new NullPointerException("snapshot cannot be null");
        }
        latest.set(snapshot);
        publishedCount.incrementAndGet();
        for (Subscription<T> subscription : subscribers) {
            subscription.deliver(snapshot);
        }
    }

    @Override
    public Optional<T> latest() {
        return Optional.ofNullable(latest.get());
    }

    @Override
    public ISnapshotSubscription<T> subscribe(String subscriberName) {
        Subscription<T> subscription = new Subscription<>(subscriberName, subscriberBufferSize, subscribers::remove);
        subscribers.add(subscription);
        log.debug("Subscriber '{}' attached to '{}' ({} active)", subscriberName, name, subscribers.size());
        return subscription;
    }

    @Override
    public int subscriberCount() {
        return subscribers.size();
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("published_total", publishedCount.get());
        metrics.put("subscribers", subscribers.size());
        metrics.put("dropped_total", subscribers.stream().mapToLong(Subscription::droppedCount).sum());
    }
}
