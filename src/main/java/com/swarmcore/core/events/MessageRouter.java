package com.swarmcore.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * In-process publish/subscribe channel for coordination events.
 * <p>
 * Each subscriber owns a bounded queue drained by its own dispatch thread, so a slow
 * subscriber never blocks a publisher or another subscriber, and every subscriber sees
 * events in emission order. When a subscriber's queue is full the oldest queued event
 * is dropped to make room; drops are counted per subscriber.
 */
public class MessageRouter {

    private static final Logger log = LoggerFactory.getLogger(MessageRouter.class);

    private final int queueCapacity;
    private final CopyOnWriteArrayList<Subscriber> subscribers = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean();

    public MessageRouter(int queueCapacity) {
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be positive");
        }
        this.queueCapacity = queueCapacity;
    }

    /**
     * Registers a subscriber for the given event types.
     *
     * @param name     used for the dispatch thread name and in stats
     * @param types    event types to receive; empty means all
     * @param consumer callback, invoked on the subscriber's dispatch thread
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String name, Set<CoordinationEventType> types, Consumer<CoordinationEvent> consumer) {
        if (closed.get()) {
            throw new IllegalStateException("Router is shut down");
        }
        Set<CoordinationEventType> accepted = types.isEmpty()
                ? EnumSet.allOf(CoordinationEventType.class)
                : EnumSet.copyOf(types);
        var subscriber = new Subscriber(name, accepted, consumer, queueCapacity);
        subscribers.add(subscriber);
        subscriber.thread.start();
        log.debug("Subscriber {} registered for {}", name, accepted);
        return () -> {
            if (subscribers.remove(subscriber)) {
                subscriber.stop();
            }
        };
    }

    /**
     * Enqueues the event for every matching subscriber. Never blocks.
     */
    public void publish(CoordinationEvent event) {
        if (closed.get()) {
            log.debug("Router shut down, discarding {} for task {}", event.type(), event.taskId());
            return;
        }
        for (Subscriber subscriber : subscribers) {
            if (subscriber.types.contains(event.type())) {
                subscriber.offer(event);
            }
        }
    }

    /**
     * Waits until every subscriber has processed its queued events.
     *
     * @return true if all queues drained within the timeout
     */
    public boolean flush(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        for (Subscriber subscriber : subscribers) {
            while (subscriber.outstanding.get() > 0) {
                if (System.nanoTime() >= deadline) {
                    return false;
                }
                try {
                    Thread.sleep(5);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Stops accepting events, delivers what is queued within {@code timeout}, then stops
     * every dispatch thread.
     */
    public void shutdown(Duration timeout) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (!flush(timeout)) {
            log.warn("Router shutdown timed out with undelivered events: {}", stats());
        }
        for (Subscriber subscriber : subscribers) {
            subscriber.stop();
        }
        subscribers.clear();
    }

    public List<SubscriberStats> stats() {
        var result = new ArrayList<SubscriberStats>();
        for (Subscriber subscriber : subscribers) {
            result.add(new SubscriberStats(subscriber.name, subscriber.queue.size(),
                    subscriber.delivered.get(), subscriber.dropped.get()));
        }
        return result;
    }

    public long totalDropped() {
        return subscribers.stream().mapToLong(s -> s.dropped.get()).sum();
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private static final class Subscriber {
        private final String name;
        private final Set<CoordinationEventType> types;
        private final Consumer<CoordinationEvent> consumer;
        private final LinkedBlockingDeque<CoordinationEvent> queue;
        private final AtomicInteger outstanding = new AtomicInteger();
        private final AtomicLong delivered = new AtomicLong();
        private final AtomicLong dropped = new AtomicLong();
        private final Thread thread;
        private volatile boolean running = true;

        Subscriber(String name, Set<CoordinationEventType> types, Consumer<CoordinationEvent> consumer, int capacity) {
            this.name = name;
            this.types = types;
            this.consumer = consumer;
            this.queue = new LinkedBlockingDeque<>(capacity);
            this.thread = new Thread(this::dispatchLoop, "router-" + name);
            this.thread.setDaemon(true);
        }

        void offer(CoordinationEvent event) {
            outstanding.incrementAndGet();
            while (!queue.offerLast(event)) {
                CoordinationEvent evicted = queue.pollFirst();
                if (evicted != null) {
                    outstanding.decrementAndGet();
                    dropped.incrementAndGet();
                    log.debug("Subscriber {} full, dropped {} for task {}", name, evicted.type(), evicted.taskId());
                }
            }
        }

        void stop() {
            running = false;
            thread.interrupt();
        }

        private void dispatchLoop() {
            while (running) {
                CoordinationEvent event;
                try {
                    event = queue.poll(100, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                if (event == null) {
                    continue;
                }
                deliverSafely(event);
            }
        }

        private void deliverSafely(CoordinationEvent event) {
            try {
                consumer.accept(event);
                delivered.incrementAndGet();
            } catch (Exception e) {
                log.warn("Subscriber {} threw exception processing event {}: {}",
                        name, event.type(), e.getMessage(), e);
            } finally {
                outstanding.decrementAndGet();
            }
        }
    }
}
