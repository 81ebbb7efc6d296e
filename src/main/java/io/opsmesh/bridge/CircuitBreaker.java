package io.opsmesh.bridge;

import io.opsmesh.storage.CircuitStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Closed / open / half-open breaker for one channel. All transitions happen under the
 * instance lock; every change is written through to the store when one is attached.
 *
 * <p>Closed counts consecutive failures and opens at the threshold. Open rejects every call
 * until the recovery timeout has elapsed, then admits a fixed budget of half-open trial calls.
 * Any trial failure reopens and restarts the timer; once every trial in the budget has
 * succeeded the breaker closes with the failure count reset.
 */
public final class CircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String channel;
    private final int failureThreshold;
    private final long recoveryTimeoutMs;
    private final int halfOpenTrials;
    private final LongSupplier clock;
    private final CircuitStateStore store;
    private final Consumer<Transition> listener;
    private CircuitBreakerState current;
    private long rejected;

    public CircuitBreaker(String channel, int failureThreshold, long recoveryTimeoutMs, int halfOpenTrials, LongSupplier clock) {
        this(channel, failureThreshold, recoveryTimeoutMs, halfOpenTrials, clock, null, null);
    }

    public CircuitBreaker(
            String channel,
            int failureThreshold,
            long recoveryTimeoutMs,
            int halfOpenTrials,
            LongSupplier clock,
            CircuitStateStore store,
            Consumer<Transition> listener
    ) {
        this.channel = channel;
        this.failureThreshold = Math.max(1, failureThreshold);
        this.recoveryTimeoutMs = Math.max(0L, recoveryTimeoutMs);
        this.halfOpenTrials = Math.max(1, halfOpenTrials);
        this.clock = clock == null ? System::currentTimeMillis : clock;
        this.store = store;
        this.listener = listener;
        long now = this.clock.getAsLong();
        this.current = store == null
                ? CircuitBreakerState.closed(channel, now)
                : store.load(channel).orElse(CircuitBreakerState.closed(channel, now));
        if (current.state() != CircuitState.CLOSED) {
            log.info("Circuit {} restored in state {}", channel, current.state().label());
        }
    }

    /**
     * Asks for permission to make one call. In half-open each grant consumes one trial.
     */
    public synchronized boolean tryAcquire() {
        long now = clock.getAsLong();
        if (current.state() == CircuitState.OPEN) {
            if (now - current.openedAtMs() < recoveryTimeoutMs) {
                rejected++;
                return false;
            }
            transition(new CircuitBreakerState(channel, CircuitState.HALF_OPEN, current.consecutiveFailures(),
                    current.openedAtMs(), halfOpenTrials, 0, current.trips(), now), "recovery_timeout_elapsed");
        }
        if (current.state() == CircuitState.HALF_OPEN) {
            if (current.halfOpenTrialBudget() <= 0) {
                rejected++;
                return false;
            }
            update(new CircuitBreakerState(channel, CircuitState.HALF_OPEN, current.consecutiveFailures(),
                    current.openedAtMs(), current.halfOpenTrialBudget() - 1, current.halfOpenSuccesses(),
                    current.trips(), now));
        }
        return true;
    }

    public synchronized void onSuccess() {
        long now = clock.getAsLong();
        switch (current.state()) {
            case CLOSED -> {
                if (current.consecutiveFailures() != 0) {
                    update(new CircuitBreakerState(channel, CircuitState.CLOSED, 0, 0L, 0, 0, current.trips(), now));
                }
            }
            case HALF_OPEN -> {
                int successes = current.halfOpenSuccesses() + 1;
                if (successes >= halfOpenTrials) {
                    transition(new CircuitBreakerState(channel, CircuitState.CLOSED, 0, 0L, 0, 0, current.trips(), now),
                            "trials_succeeded");
                } else {
                    update(new CircuitBreakerState(channel, CircuitState.HALF_OPEN, current.consecutiveFailures(),
                            current.openedAtMs(), current.halfOpenTrialBudget(), successes, current.trips(), now));
                }
            }
            case OPEN -> {
                // Late result from a call admitted before the breaker opened.
            }
        }
    }

    public synchronized void onFailure() {
        long now = clock.getAsLong();
        switch (current.state()) {
            case CLOSED -> {
                int failures = current.consecutiveFailures() + 1;
                if (failures >= failureThreshold) {
                    transition(new CircuitBreakerState(channel, CircuitState.OPEN, failures, now, 0, 0,
                            current.trips() + 1, now), "failure_threshold_reached");
                } else {
                    update(new CircuitBreakerState(channel, CircuitState.CLOSED, failures, 0L, 0, 0, current.trips(), now));
                }
            }
            case HALF_OPEN -> transition(new CircuitBreakerState(channel, CircuitState.OPEN,
                    current.consecutiveFailures() + 1, now, 0, 0, current.trips() + 1, now), "trial_failed");
            case OPEN -> update(new CircuitBreakerState(channel, CircuitState.OPEN, current.consecutiveFailures() + 1,
                    current.openedAtMs(), 0, 0, current.trips(), now));
        }
    }

    public synchronized CircuitBreakerState state() {
        return current;
    }

    public synchronized long rejectedCalls() {
        return rejected;
    }

    public String channel() {
        return channel;
    }

    private void transition(CircuitBreakerState next, String reason) {
        CircuitState from = current.state();
        update(next);
        log.info("Circuit {} {} -> {} ({})", channel, from.label(), next.state().label(), reason);
        if (listener != null) {
            listener.accept(new Transition(channel, from, next.state(), reason, next.updatedAtMs()));
        }
    }

    private void update(CircuitBreakerState next) {
        current = next;
        if (store != null) {
            store.save(next);
        }
    }

    public record Transition(String channel, CircuitState from, CircuitState to, String reason, long atMs) {
    }
}
