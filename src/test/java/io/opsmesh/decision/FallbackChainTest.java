package io.opsmesh.decision;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

final class FallbackChainTest {

    @Test
    void firstProducingCandidateWins() {
        FallbackChain<Integer, String> chain = FallbackChain.<Integer, String>named("sizing")
                .then("skipped", 0.9d, input -> false, input -> Optional.of("never"))
                .then("empty", 0.8d, input -> Optional.empty())
                .then("rule", 0.5d, input -> input > 10 ? Optional.of("large") : Optional.empty())
                .orElse("unknown");

        FallbackChain.Decision<String> large = chain.decide(42);
        Assertions.assertEquals("large", large.value());
        Assertions.assertEquals("rule", large.source());
        Assertions.assertEquals(0.5d, large.confidence(), 1e-9);

        FallbackChain.Decision<String> fallback = chain.decide(3);
        Assertions.assertEquals("unknown", fallback.value());
        Assertions.assertEquals(FallbackChain.DEFAULT_SOURCE, fallback.source());
        Assertions.assertEquals(List.of("skipped", "empty", "rule"), chain.candidateNames());
    }

    @Test
    void failingCandidatesAreSkipped() {
        FallbackChain<String, Integer> chain = FallbackChain.<String, Integer>named("parse")
                .then("guard-throws", 0.9d, input -> {
                    throw new IllegalStateException("guard broken");
                }, input -> Optional.of(1))
                .then("strict", 0.7d, input -> Optional.of(Integer.parseInt(input)))
                .then("length", 0.2d, input -> Optional.of(input.length()))
                .orElse(-1);

        Assertions.assertEquals(12, chain.decide("12").value());
        FallbackChain.Decision<Integer> lenient = chain.decide("abc");
        Assertions.assertEquals(3, lenient.value());
        Assertions.assertEquals("length", lenient.source());
    }
}
