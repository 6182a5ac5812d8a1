package com.phillippitts.duplexvoice.service.duplex;

import com.phillippitts.duplexvoice.domain.DuplexEvent;
import com.phillippitts.duplexvoice.domain.DuplexEventType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Fan-out of {@link DuplexEvent}s to any number of subscribers.
 *
 * <p>Each subscriber owns a bounded queue. Publishing never blocks a loop: when a subscriber
 * falls behind, its oldest event is dropped. Within one subscriber, events arrive in publication
 * order. {@link #close()} terminates every subscriber stream once its queue drains.
 */
public final class DuplexEventBus {

    private static final Logger LOG = LogManager.getLogger(DuplexEventBus.class);

    static final int DEFAULT_CAPACITY = 256;

    // Marker that ends a subscriber stream; never delivered
    private static final DuplexEvent END = new DuplexEvent(
            DuplexEventType.RESPONSE, Map.of(), Instant.EPOCH);

    private final int capacity;
    private final CopyOnWriteArrayList<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private boolean open = true;

    public DuplexEventBus() {
        this(DEFAULT_CAPACITY);
    }

    public DuplexEventBus(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
    }

    /**
     * Reopens the bus so new subscribers receive events. Called on controller start.
     */
    public synchronized void open() {
        open = true;
    }

    /**
     * Subscribes to future events.
     *
     * <p>The returned stream blocks while waiting for the next event and ends when the bus closes.
     * Closing the stream cancels the subscription. If the bus is closed, the stream is empty.
     */
    public synchronized Stream<DuplexEvent> subscribe() {
        if (!open) {
            return Stream.empty();
        }
        Subscription subscription = new Subscription(capacity);
        subscriptions.add(subscription);
        LOG.debug("Event subscriber added (total={})", subscriptions.size());
        return StreamSupport.stream(subscription, false)
                .onClose(() -> cancel(subscription));
    }

    /**
     * Delivers {@code event} to every current subscriber.
     */
    public void publish(DuplexEvent event) {
        Objects.requireNonNull(event, "event");
        for (Subscription subscription : subscriptions) {
            subscription.offer(event);
        }
    }

    /**
     * Ends every subscriber stream and rejects new subscriptions until {@link #open()}.
     */
    public synchronized void close() {
        open = false;
        for (Subscription subscription : subscriptions) {
            subscription.end();
        }
        subscriptions.clear();
    }

    public int subscriberCount() {
        return subscriptions.size();
    }

    private void cancel(Subscription subscription) {
        if (subscriptions.remove(subscription)) {
            subscription.end();
            LOG.debug("Event subscriber removed (total={})", subscriptions.size());
        }
    }

    private static final class Subscription extends Spliterators.AbstractSpliterator<DuplexEvent> {
        // One extra slot so the end marker always fits
        private final BlockingQueue<DuplexEvent> queue;
        private final int capacity;
        private volatile boolean ended;

        Subscription(int capacity) {
            super(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL);
            this.capacity = capacity;
            this.queue = new LinkedBlockingQueue<>(capacity + 1);
        }

        synchronized void offer(DuplexEvent event) {
            if (ended) {
                return;
            }
            while (queue.size() >= capacity) {
                queue.poll();
            }
            queue.offer(event);
        }

        synchronized void end() {
            if (ended) {
                return;
            }
            ended = true;
            queue.offer(END);
        }

        @Override
        public boolean tryAdvance(Consumer<? super DuplexEvent> action) {
            DuplexEvent next;
            try {
                next = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
            if (next == END) {
                // Leave the marker for any later call
                queue.offer(END);
                return false;
            }
            action.accept(next);
            return true;
        }
    }
}
