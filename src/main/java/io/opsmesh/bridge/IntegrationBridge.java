package io.opsmesh.bridge;

import io.opsmesh.bus.MessageBus;
import io.opsmesh.model.Message;
import io.opsmesh.model.Priority;
import io.opsmesh.observability.AuditLogger;
import io.opsmesh.storage.DeadLetterStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Resilient channel to the external validator.
 *
 * <p>Outbound messages are contract-checked, then sent through the circuit breaker with
 * bounded retries. Contract failures, exhausted retries, permanent rejections and
 * open-circuit fail-fasts all end in the dead-letter store, keyed by message id. Inbound
 * validator messages are contract-checked and published on the bus.
 */
public final class IntegrationBridge implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(IntegrationBridge.class);
    public static final String INBOUND_CHANNEL_SUFFIX = "/inbound";

    private final String bridgeId;
    private final ValidatorClient client;
    private final ContractRegistry contracts;
    private final CircuitBreaker breaker;
    private final RetryPolicy retryPolicy;
    private final long callTimeoutMs;
    private final DeadLetterStore deadLetters;
    private final MessageBus bus;
    private final AuditLogger auditLogger;
    private final LongSupplier clock;
    private final Sleeper sleeper;
    private final ExecutorService callExecutor;
    private final ExecutorService submitExecutor;
    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong retried = new AtomicLong();
    private final AtomicLong deadLettered = new AtomicLong();
    private final AtomicLong contractRejected = new AtomicLong();
    private final AtomicLong processingMsTotal = new AtomicLong();
    private volatile boolean closed;

    public IntegrationBridge(
            String bridgeId,
            ValidatorClient client,
            ContractRegistry contracts,
            CircuitBreaker breaker,
            RetryPolicy retryPolicy,
            long callTimeoutMs,
            DeadLetterStore deadLetters,
            MessageBus bus,
            AuditLogger auditLogger,
            LongSupplier clock,
            Sleeper sleeper
    ) {
        this.bridgeId = bridgeId;
        this.client = client;
        this.contracts = contracts;
        this.breaker = breaker;
        this.retryPolicy = retryPolicy == null ? RetryPolicy.defaults() : retryPolicy;
        this.callTimeoutMs = Math.max(1L, callTimeoutMs);
        this.deadLetters = deadLetters;
        this.bus = bus;
        this.auditLogger = auditLogger;
        this.clock = clock == null ? System::currentTimeMillis : clock;
        this.sleeper = sleeper == null ? Thread::sleep : sleeper;
        this.callExecutor = Executors.newCachedThreadPool(new BridgeThreadFactory(bridgeId + "-call"));
        this.submitExecutor = Executors.newSingleThreadExecutor(new BridgeThreadFactory(bridgeId + "-submit"));
    }

    public boolean validatorConfigured() {
        return client != null;
    }

    /**
     * Queues a message for delivery on the bridge's own thread, so callers never block on I/O.
     */
    public CompletableFuture<DeliveryOutcome> submit(Message message) {
        ensureOpen();
        return CompletableFuture.supplyAsync(() -> deliver(message), submitExecutor);
    }

    /**
     * Delivers synchronously, blocking across retries.
     */
    public DeliveryOutcome deliver(Message message) {
        ensureOpen();
        if (client == null) {
            throw new IllegalStateException("No validator endpoint configured for bridge " + bridgeId);
        }
        long startedAt = clock.getAsLong();
        ContractRegistry.Validation validation = contracts.validate(message);
        if (!validation.valid()) {
            contractRejected.incrementAndGet();
            log.warn("Message {} on {} failed contract validation: {}", message.id(), message.topic(), validation.reason());
            return deadLetter(message, DeadLetterEntry.FailureKind.CONTRACT, validation.reason(), 0, breaker.channel());
        }
        String lastError = "no attempt made";
        int attempt = 0;
        while (attempt < retryPolicy.maxAttempts()) {
            attempt++;
            if (attempt > 1) {
                retried.incrementAndGet();
                long delay = retryPolicy.delayBeforeAttempt(attempt);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return deadLetter(message, DeadLetterEntry.FailureKind.RETRIES_EXHAUSTED,
                            "interrupted before attempt " + attempt + ": " + lastError, attempt - 1, breaker.channel());
                }
            }
            if (!breaker.tryAcquire()) {
                log.debug("Circuit {} open, failing message {} fast", breaker.channel(), message.id());
                return deadLetter(message, DeadLetterEntry.FailureKind.CIRCUIT_OPEN,
                        "circuit open: " + lastError, attempt - 1, breaker.channel());
            }
            try {
                Optional<Message> reply = call(message);
                breaker.onSuccess();
                processed.incrementAndGet();
                processingMsTotal.addAndGet(Math.max(0L, clock.getAsLong() - startedAt));
                log.debug("Message {} delivered to validator on attempt {}", message.id(), attempt);
                String replyId = null;
                if (reply.isPresent()) {
                    receive(reply.get());
                    replyId = reply.get().id();
                }
                return new DeliveryOutcome(message.id(), DeliveryOutcome.Status.DELIVERED, attempt, "ok", replyId);
            } catch (ValidatorException e) {
                if (!e.transientFailure()) {
                    // The validator answered, so the channel itself is healthy.
                    breaker.onSuccess();
                    log.warn("Validator permanently rejected message {}: {}", message.id(), e.getMessage());
                    return deadLetter(message, DeadLetterEntry.FailureKind.PERMANENT, e.getMessage(), attempt,
                            breaker.channel());
                }
                breaker.onFailure();
                lastError = e.getMessage();
                log.warn("Attempt {}/{} for message {} failed: {}", attempt, retryPolicy.maxAttempts(), message.id(), lastError);
            } catch (TimeoutException e) {
                breaker.onFailure();
                lastError = "timeout after " + callTimeoutMs + " ms";
                log.warn("Attempt {}/{} for message {} timed out", attempt, retryPolicy.maxAttempts(), message.id());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                breaker.onFailure();
                return deadLetter(message, DeadLetterEntry.FailureKind.RETRIES_EXHAUSTED,
                        "interrupted during attempt " + attempt, attempt, breaker.channel());
            }
        }
        return deadLetter(message, DeadLetterEntry.FailureKind.RETRIES_EXHAUSTED,
                "retries exhausted after " + attempt + " attempts: " + lastError, attempt, breaker.channel());
    }

    /**
     * Accepts a message coming back from the validator and publishes it on the bus.
     */
    public DeliveryOutcome receive(Message message) {
        ContractRegistry.Validation validation = contracts.validate(message);
        if (!validation.valid()) {
            contractRejected.incrementAndGet();
            log.warn("Inbound message {} on {} failed contract validation: {}", message.id(), message.topic(), validation.reason());
            return deadLetter(message, DeadLetterEntry.FailureKind.CONTRACT, validation.reason(), 0,
                    breaker.channel() + INBOUND_CHANNEL_SUFFIX);
        }
        Message inbound = message.priority().rank() <= Priority.HIGH.rank() ? message : new Message(
                message.id(), message.topic(), message.payload(), Priority.HIGH, message.senderId(),
                message.recipientId(), message.createdAtMs(), message.ttlMs(), message.contractVersion());
        if (bus != null) {
            bus.publish(inbound);
        }
        log.info("Inbound {} {} published", message.topic(), message.id());
        return new DeliveryOutcome(message.id(), DeliveryOutcome.Status.DELIVERED, 0, "published", null);
    }

    /**
     * Re-runs one dead letter through its original path. Success removes the entry; failure
     * leaves it in place with the retry count and reason updated.
     */
    public DeliveryOutcome replay(String messageId) {
        Optional<DeadLetterEntry> found = deadLetters.find(messageId);
        if (found.isEmpty()) {
            return new DeliveryOutcome(messageId, DeliveryOutcome.Status.NOT_FOUND, 0, "no dead letter with this id", null);
        }
        DeadLetterEntry entry = found.get();
        DeliveryOutcome outcome = entry.channel().endsWith(INBOUND_CHANNEL_SUFFIX)
                ? receive(entry.message())
                : deliver(entry.message());
        if (outcome.delivered()) {
            deadLetters.remove(messageId);
            log.info("Dead letter {} replayed", messageId);
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("topic", entry.message().topic());
        details.put("previous_failure", entry.kind().label());
        details.put("status", outcome.status().name().toLowerCase());
        details.put("reason", outcome.reason());
        audit("bridge.dead_letter.replay", messageId, outcome.delivered() ? "replayed" : "still_failing", details);
        return outcome;
    }

    public List<DeliveryOutcome> replayAll(int limit) {
        List<DeliveryOutcome> out = new ArrayList<>();
        for (DeadLetterEntry entry : deadLetters.list(limit)) {
            out.add(replay(entry.messageId()));
        }
        return out;
    }

    public boolean discard(String messageId, String reason) {
        Optional<DeadLetterEntry> found = deadLetters.find(messageId);
        if (found.isEmpty() || !deadLetters.remove(messageId)) {
            return false;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("topic", found.get().message().topic());
        details.put("failure", found.get().kind().label());
        details.put("reason", reason == null ? "" : reason);
        audit("bridge.dead_letter.discard", messageId, "discarded", details);
        log.info("Dead letter {} discarded: {}", messageId, reason);
        return true;
    }

    public List<DeadLetterEntry> deadLetters(int limit) {
        return deadLetters.list(limit);
    }

    public BridgeHealth health() {
        CircuitBreakerState state = breaker.state();
        int depth = deadLetters.depth();
        BridgeStatus status;
        if (closed) {
            status = BridgeStatus.STOPPED;
        } else if (state.state() == CircuitState.OPEN) {
            status = BridgeStatus.CIRCUIT_OPEN;
        } else if (state.state() == CircuitState.HALF_OPEN || state.consecutiveFailures() > 0 || depth > 0) {
            status = BridgeStatus.DEGRADED;
        } else {
            status = BridgeStatus.HEALTHY;
        }
        long done = processed.get();
        return new BridgeHealth(
                bridgeId,
                status,
                validatorConfigured(),
                state.state(),
                state.consecutiveFailures(),
                state.trips(),
                breaker.rejectedCalls(),
                depth,
                done,
                failed.get(),
                retried.get(),
                deadLettered.get(),
                contractRejected.get(),
                done == 0L ? 0.0d : (double) processingMsTotal.get() / done,
                clock.getAsLong()
        );
    }

    public String bridgeId() {
        return bridgeId;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        submitExecutor.shutdown();
        try {
            if (!submitExecutor.awaitTermination(callTimeoutMs * retryPolicy.maxAttempts(), TimeUnit.MILLISECONDS)) {
                submitExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            submitExecutor.shutdownNow();
        }
        callExecutor.shutdownNow();
        log.info("Bridge {} stopped", bridgeId);
    }

    private Optional<Message> call(Message message) throws ValidatorException, TimeoutException, InterruptedException {
        Duration timeout = Duration.ofMillis(callTimeoutMs);
        Future<Optional<Message>> future = callExecutor.submit(() -> client.send(message, timeout));
        try {
            Optional<Message> reply = future.get(callTimeoutMs, TimeUnit.MILLISECONDS);
            return reply == null ? Optional.empty() : reply;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ValidatorException validatorException) {
                throw validatorException;
            }
            throw ValidatorException.transientFailure("validator client failed: " + cause, cause);
        }
    }

    private DeliveryOutcome deadLetter(
            Message message,
            DeadLetterEntry.FailureKind kind,
            String reason,
            int attempts,
            String channel
    ) {
        long now = clock.getAsLong();
        int retries = Math.max(0, attempts - 1);
        failed.incrementAndGet();
        boolean created = deadLetters.upsert(new DeadLetterEntry(message, kind, reason, retries, now, now, channel));
        if (created) {
            deadLettered.incrementAndGet();
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("topic", message.topic());
        details.put("contract_version", message.contractVersion());
        details.put("failure", kind.label());
        details.put("reason", reason);
        details.put("retries", retries);
        details.put("channel", channel);
        audit("bridge.dead_letter.add", message.id(), created ? "created" : "updated", details);
        log.warn("Message {} dead-lettered ({}): {}", message.id(), kind.label(), reason);
        return new DeliveryOutcome(message.id(), DeliveryOutcome.Status.DEAD_LETTERED, attempts, reason, null);
    }

    private void audit(String action, String resource, String result, Map<String, Object> details) {
        if (auditLogger != null) {
            auditLogger.log(AuditLogger.AuditEvent.of(action, bridgeId, resource, result, details));
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Bridge " + bridgeId + " is stopped");
        }
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private static final class BridgeThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        private BridgeThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
