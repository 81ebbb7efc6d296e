package io.opsmesh.bus;

import com.fasterxml.jackson.databind.JsonNode;
import io.opsmesh.model.Message;
import io.opsmesh.model.Priority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * In-process publish/subscribe hub.
 *
 * <p>Each topic owns a bounded pending queue ordered by priority, then insertion order.
 * Topics drain independently on a bounded worker pool; within a topic one drain runs at a
 * time so subscribers observe the queue order. Publishing never blocks: a full queue drops
 * its lowest-priority pending message (or the incoming one when nothing ranks below it)
 * and counts the drop as backpressure.
 */
public final class MessageBus implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MessageBus.class);
    public static final int DEFAULT_QUEUE_CAPACITY = 1_000;
    public static final int DEFAULT_WORKER_THREADS = 4;
    public static final int DEFAULT_DELIVERY_ATTEMPTS = 2;

    private static final Comparator<Pending> DELIVERY_ORDER = Comparator
            .comparingInt((Pending p) -> p.message().priority().rank())
            .thenComparingLong(Pending::sequence);

    private final int queueCapacity;
    private final int maxDeliveryAttempts;
    private final LongSupplier clock;
    private final ExecutorService workers;
    private final ConcurrentMap<String, TopicQueue> queues;
    private final ConcurrentMap<String, CopyOnWriteArrayList<Subscription>> subscriptionsByTopic;
    private final ConcurrentMap<String, Subscription> subscriptionsById;
    private final AtomicLong sequence;
    private final AtomicLong published;
    private final AtomicLong delivered;
    private final AtomicLong expired;
    private final AtomicLong backpressureDropped;
    private final AtomicLong handlerFailures;
    private volatile boolean paused;
    private volatile boolean closed;

    public MessageBus() {
        this(DEFAULT_QUEUE_CAPACITY, DEFAULT_WORKER_THREADS, DEFAULT_DELIVERY_ATTEMPTS, System::currentTimeMillis);
    }

    public MessageBus(int queueCapacity, int workerThreads, int maxDeliveryAttempts, LongSupplier clock) {
        this.queueCapacity = Math.max(1, queueCapacity);
        this.maxDeliveryAttempts = Math.max(1, maxDeliveryAttempts);
        this.clock = clock;
        this.workers = Executors.newFixedThreadPool(Math.max(1, workerThreads), new BusThreadFactory());
        this.queues = new ConcurrentHashMap<>();
        this.subscriptionsByTopic = new ConcurrentHashMap<>();
        this.subscriptionsById = new ConcurrentHashMap<>();
        this.sequence = new AtomicLong(0L);
        this.published = new AtomicLong(0L);
        this.delivered = new AtomicLong(0L);
        this.expired = new AtomicLong(0L);
        this.backpressureDropped = new AtomicLong(0L);
        this.handlerFailures = new AtomicLong(0L);
        this.paused = false;
        this.closed = false;
    }

    public String publish(String topic, JsonNode payload, Priority priority, long ttlMs) {
        return publish(Message.create(topic, payload, priority, "system", clock.getAsLong(), ttlMs));
    }

    public String publish(Message message) {
        return offer(message).messageId();
    }

    public PublishResult offer(Message message) {
        if (closed) {
            throw new IllegalStateException("Message bus is closed");
        }
        TopicQueue queue = queues.computeIfAbsent(message.topic(), TopicQueue::new);
        Pending incoming = new Pending(message, sequence.incrementAndGet());
        PublishResult result = queue.offer(incoming, queueCapacity);
        published.incrementAndGet();
        if (result.backpressure()) {
            backpressureDropped.incrementAndGet();
            log.debug("Backpressure on topic {}: dropped {}", message.topic(), result.droppedMessageId());
        }
        if (result.accepted()) {
            scheduleDrain(queue);
        }
        return result;
    }

    public String subscribe(String topic, MessageHandler handler) {
        return subscribe(topic, null, handler);
    }

    /**
     * Subscribes {@code handler} to {@code topic}. Targeted messages (non-null recipient) reach
     * only subscriptions whose {@code subscriberId} matches the recipient.
     */
    public String subscribe(String topic, String subscriberId, MessageHandler handler) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic is required");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler is required");
        }
        String subscriptionId = "sub_" + UUID.randomUUID();
        String owner = subscriberId == null || subscriberId.isBlank() ? subscriptionId : subscriberId.trim();
        Subscription subscription = new Subscription(subscriptionId, owner, topic, handler);
        subscriptionsById.put(subscriptionId, subscription);
        subscriptionsByTopic.computeIfAbsent(topic, ignored -> new CopyOnWriteArrayList<>()).add(subscription);
        log.debug("Subscriber {} subscribed to {} ({})", owner, topic, subscriptionId);
        return subscriptionId;
    }

    public boolean unsubscribe(String subscriptionId) {
        Subscription removed = subscriptionsById.remove(subscriptionId);
        if (removed == null) {
            return false;
        }
        removed.active = false;
        List<Subscription> list = subscriptionsByTopic.get(removed.topic);
        if (list != null) {
            list.remove(removed);
        }
        log.debug("Subscription {} removed", subscriptionId);
        return true;
    }

    public void pause() {
        paused = true;
    }

    public void resume() {
        paused = false;
        for (TopicQueue queue : queues.values()) {
            scheduleDrain(queue);
        }
    }

    public boolean isPaused() {
        return paused;
    }

    /**
     * Waits until every topic queue is empty and no drain is running.
     *
     * @return {@code false} when the timeout elapsed first
     */
    public boolean awaitIdle(long timeoutMs) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(Math.max(0L, timeoutMs));
        while (true) {
            if (isIdle()) {
                return true;
            }
            if (System.nanoTime() >= deadline) {
                return false;
            }
            Thread.sleep(2L);
        }
    }

    public int pending(String topic) {
        TopicQueue queue = queues.get(topic);
        return queue == null ? 0 : queue.size();
    }

    public BusStats stats() {
        int pendingTotal = 0;
        for (TopicQueue queue : queues.values()) {
            pendingTotal += queue.size();
        }
        List<BusStats.SubscriptionStats> subscribers = new ArrayList<>();
        for (Subscription s : subscriptionsById.values()) {
            subscribers.add(new BusStats.SubscriptionStats(
                    s.id, s.subscriberId, s.topic, s.delivered.get(), s.failed.get()));
        }
        subscribers.sort(Comparator.comparing(BusStats.SubscriptionStats::topic)
                .thenComparing(BusStats.SubscriptionStats::subscriptionId));
        return new BusStats(
                published.get(),
                delivered.get(),
                expired.get(),
                backpressureDropped.get(),
                handlerFailures.get(),
                pendingTotal,
                subscriptionsById.size(),
                subscribers
        );
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        workers.shutdown();
        try {
            if (!workers.awaitTermination(2, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private boolean isIdle() {
        for (TopicQueue queue : queues.values()) {
            if (!queue.isIdle()) {
                return false;
            }
        }
        return true;
    }

    private void scheduleDrain(TopicQueue queue) {
        if (paused || closed || !queue.claimDrain()) {
            return;
        }
        try {
            workers.execute(() -> drain(queue));
        } catch (RejectedExecutionException e) {
            queue.releaseDrain();
            log.warn("Drain for topic {} rejected: bus is shutting down", queue.topic);
        }
    }

    private void drain(TopicQueue queue) {
        while (true) {
            Pending next = queue.pollOrRelease(paused || closed);
            if (next == null) {
                return;
            }
            try {
                deliver(next.message());
            } catch (RuntimeException e) {
                log.error("Unexpected failure delivering {} on {}", next.message().id(), queue.topic, e);
            }
        }
    }

    private void deliver(Message message) {
        if (message.isExpired(clock.getAsLong())) {
            expired.incrementAndGet();
            log.debug("Message {} on {} expired before delivery", message.id(), message.topic());
            return;
        }
        List<Subscription> targets = subscriptionsByTopic.get(message.topic());
        if (targets == null || targets.isEmpty()) {
            log.debug("No subscribers for topic {}", message.topic());
            return;
        }
        for (Subscription subscription : targets) {
            if (message.recipientId() != null && !message.recipientId().equals(subscription.subscriberId)) {
                continue;
            }
            deliverTo(subscription, message);
        }
    }

    private void deliverTo(Subscription subscription, Message message) {
        for (int attempt = 1; attempt <= maxDeliveryAttempts; attempt++) {
            if (!subscription.active) {
                return;
            }
            if (message.isExpired(clock.getAsLong())) {
                expired.incrementAndGet();
                return;
            }
            try {
                subscription.handler.onMessage(message);
                subscription.delivered.incrementAndGet();
                delivered.incrementAndGet();
                return;
            } catch (Exception e) {
                subscription.failed.incrementAndGet();
                handlerFailures.incrementAndGet();
                log.warn("Handler {} failed on message {} ({}), attempt {}/{}: {}",
                        subscription.subscriberId, message.id(), message.topic(), attempt, maxDeliveryAttempts,
                        e.toString());
            }
        }
    }

    private record Pending(Message message, long sequence) {
    }

    private static final class Subscription {
        private final String id;
        private final String subscriberId;
        private final String topic;
        private final MessageHandler handler;
        private final AtomicLong delivered = new AtomicLong(0L);
        private final AtomicLong failed = new AtomicLong(0L);
        private volatile boolean active = true;

        private Subscription(String id, String subscriberId, String topic, MessageHandler handler) {
            this.id = id;
            this.subscriberId = subscriberId;
            this.topic = topic;
            this.handler = handler;
        }
    }

    private static final class TopicQueue {
        private final String topic;
        private final PriorityQueue<Pending> pending;
        private boolean draining;

        private TopicQueue(String topic) {
            this.topic = topic;
            this.pending = new PriorityQueue<>(DELIVERY_ORDER);
            this.draining = false;
        }

        synchronized PublishResult offer(Pending incoming, int capacity) {
            String incomingId = incoming.message().id();
            if (pending.size() < capacity) {
                pending.add(incoming);
                return new PublishResult(incomingId, true, null);
            }
            Pending weakest = weakest();
            if (weakest != null && incoming.message().priority().outranks(weakest.message().priority())) {
                pending.remove(weakest);
                pending.add(incoming);
                return new PublishResult(incomingId, true, weakest.message().id());
            }
            return new PublishResult(incomingId, false, incomingId);
        }

        synchronized boolean claimDrain() {
            if (draining || pending.isEmpty()) {
                return false;
            }
            draining = true;
            return true;
        }

        synchronized void releaseDrain() {
            draining = false;
        }

        synchronized Pending pollOrRelease(boolean stop) {
            if (stop || pending.isEmpty()) {
                draining = false;
                return null;
            }
            return pending.poll();
        }

        synchronized int size() {
            return pending.size();
        }

        synchronized boolean isIdle() {
            return !draining && pending.isEmpty();
        }

        // lowest priority band, newest entry within it
        private Pending weakest() {
            Pending weakest = null;
            for (Pending p : pending) {
                if (weakest == null || DELIVERY_ORDER.compare(p, weakest) > 0) {
                    weakest = p;
                }
            }
            return weakest;
        }
    }

    private static final class BusThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(0);

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "opsmesh-bus-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
