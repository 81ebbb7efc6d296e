package io.opsmesh.decision;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Ordered chain of decision functions sharing one signature. The first available candidate
 * that produces a value wins; when none does the chain answers with its default.
 */
public final class FallbackChain<I, O> {
    private static final Logger log = LoggerFactory.getLogger(FallbackChain.class);
    public static final String DEFAULT_SOURCE = "default";

    private final String name;
    private final List<Candidate<I, O>> candidates;
    private final O defaultValue;

    private FallbackChain(String name, List<Candidate<I, O>> candidates, O defaultValue) {
        this.name = name;
        this.candidates = List.copyOf(candidates);
        this.defaultValue = defaultValue;
    }

    public static <I, O> Builder<I, O> named(String name) {
        return new Builder<>(name);
    }

    public Decision<O> decide(I input) {
        for (Candidate<I, O> candidate : candidates) {
            boolean available;
            try {
                available = candidate.available().test(input);
            } catch (RuntimeException e) {
                log.warn("{}: availability check for '{}' failed: {}", name, candidate.name(), e.toString());
                continue;
            }
            if (!available) {
                continue;
            }
            try {
                Optional<O> value = candidate.function().apply(input);
                if (value != null && value.isPresent()) {
                    return new Decision<>(value.get(), candidate.name(), candidate.confidence());
                }
            } catch (RuntimeException e) {
                log.warn("{}: candidate '{}' failed, falling back: {}", name, candidate.name(), e.toString());
            }
        }
        return new Decision<>(defaultValue, DEFAULT_SOURCE, 0.0d);
    }

    public List<String> candidateNames() {
        List<String> names = new ArrayList<>();
        for (Candidate<I, O> candidate : candidates) {
            names.add(candidate.name());
        }
        return names;
    }

    public record Candidate<I, O>(
            String name,
            double confidence,
            Predicate<I> available,
            Function<I, Optional<O>> function
    ) {
    }

    public record Decision<O>(O value, String source, double confidence) {
    }

    public static final class Builder<I, O> {
        private final String name;
        private final List<Candidate<I, O>> candidates = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder<I, O> then(String candidateName, double confidence, Predicate<I> available,
                                  Function<I, Optional<O>> function) {
            candidates.add(new Candidate<>(candidateName, confidence, available, function));
            return this;
        }

        public Builder<I, O> then(String candidateName, double confidence, Function<I, Optional<O>> function) {
            return then(candidateName, confidence, input -> true, function);
        }

        public FallbackChain<I, O> orElse(O defaultValue) {
            return new FallbackChain<>(name, candidates, defaultValue);
        }
    }
}
