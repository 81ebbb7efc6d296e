package io.opsmesh.bridge;

import io.opsmesh.config.OpsMeshConfig;
import io.opsmesh.storage.CircuitStateStore;
import io.opsmesh.storage.Database;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

final class CircuitBreakerTest {

    @Test
    void opensAtThresholdAndRejectsUntilRecovery() {
        AtomicLong clock = new AtomicLong(0L);
        CircuitBreaker breaker = new CircuitBreaker("validator", 3, 1_000L, 2, clock::get);

        for (int i = 0; i < 2; i++) {
            Assertions.assertTrue(breaker.tryAcquire());
            breaker.onFailure();
        }
        Assertions.assertEquals(CircuitState.CLOSED, breaker.state().state());
        Assertions.assertEquals(2, breaker.state().consecutiveFailures());

        Assertions.assertTrue(breaker.tryAcquire());
        breaker.onFailure();
        Assertions.assertEquals(CircuitState.OPEN, breaker.state().state());
        Assertions.assertEquals(1L, breaker.state().trips());

        clock.set(999L);
        Assertions.assertFalse(breaker.tryAcquire());
        Assertions.assertEquals(1L, breaker.rejectedCalls());
    }

    @Test
    void successResetsFailureCountWhileClosed() {
        CircuitBreaker breaker = new CircuitBreaker("validator", 3, 1_000L, 1, () -> 0L);
        breaker.onFailure();
        breaker.onFailure();
        breaker.onSuccess();
        breaker.onFailure();
        breaker.onFailure();
        Assertions.assertEquals(CircuitState.CLOSED, breaker.state().state());
    }

    @Test
    void halfOpenClosesAfterAllTrialsSucceed() {
        AtomicLong clock = new AtomicLong(0L);
        List<CircuitBreaker.Transition> transitions = new ArrayList<>();
        CircuitBreaker breaker = new CircuitBreaker("validator", 1, 1_000L, 2, clock::get, null, transitions::add);

        breaker.onFailure();
        clock.set(1_000L);

        Assertions.assertTrue(breaker.tryAcquire());
        Assertions.assertEquals(CircuitState.HALF_OPEN, breaker.state().state());
        Assertions.assertTrue(breaker.tryAcquire());
        Assertions.assertFalse(breaker.tryAcquire());

        breaker.onSuccess();
        Assertions.assertEquals(CircuitState.HALF_OPEN, breaker.state().state());
        breaker.onSuccess();
        Assertions.assertEquals(CircuitState.CLOSED, breaker.state().state());
        Assertions.assertEquals(0, breaker.state().consecutiveFailures());

        Assertions.assertEquals(3, transitions.size());
        Assertions.assertEquals(CircuitState.OPEN, transitions.get(0).to());
        Assertions.assertEquals(CircuitState.HALF_OPEN, transitions.get(1).to());
        Assertions.assertEquals("trials_succeeded", transitions.get(2).reason());
    }

    @Test
    void trialFailureReopensAndRestartsTimer() {
        AtomicLong clock = new AtomicLong(0L);
        CircuitBreaker breaker = new CircuitBreaker("validator", 1, 1_000L, 3, clock::get);
        breaker.onFailure();

        clock.set(1_500L);
        Assertions.assertTrue(breaker.tryAcquire());
        breaker.onFailure();
        Assertions.assertEquals(CircuitState.OPEN, breaker.state().state());
        Assertions.assertEquals(1_500L, breaker.state().openedAtMs());
        Assertions.assertEquals(2L, breaker.state().trips());

        clock.set(2_000L);
        Assertions.assertFalse(breaker.tryAcquire());
        clock.set(2_500L);
        Assertions.assertTrue(breaker.tryAcquire());
    }

    @Test
    void stateSurvivesRestartThroughStore() throws Exception {
        Path root = Files.createTempDirectory("opsmesh-test-breaker-");
        try {
            Database db = new Database(OpsMeshConfig.fromRoot(root.toString()));
            db.init();
            CircuitStateStore store = new CircuitStateStore(db);
            AtomicLong clock = new AtomicLong(10_000L);

            CircuitBreaker first = new CircuitBreaker("validator", 2, 5_000L, 1, clock::get, store, null);
            first.onFailure();
            first.onFailure();
            Assertions.assertEquals(CircuitState.OPEN, first.state().state());

            clock.set(12_000L);
            CircuitBreaker restored = new CircuitBreaker("validator", 2, 5_000L, 1, clock::get, store, null);
            Assertions.assertEquals(CircuitState.OPEN, restored.state().state());
            Assertions.assertEquals(10_000L, restored.state().openedAtMs());
            Assertions.assertFalse(restored.tryAcquire());

            CircuitBreaker other = new CircuitBreaker("other-channel", 2, 5_000L, 1, clock::get, store, null);
            Assertions.assertEquals(CircuitState.CLOSED, other.state().state());
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
