package io.opsmesh.decision;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;

/**
 * Black-box reasoning collaborator (typically an LLM endpoint). Only intervention logic
 * consults it; the bus and the coordination loop never do.
 */
public interface ReasoningService {
    /**
     * Returns a textual decision for {@code purpose} given {@code context}.
     *
     * @throws Exception on transport failure or when {@code timeout} elapses
     */
    String complete(String purpose, JsonNode context, Duration timeout) throws Exception;

    default boolean available() {
        return true;
    }
}
