package io.opsmesh.bridge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.opsmesh.bus.Topics;
import io.opsmesh.model.Message;
import io.opsmesh.model.Priority;
import io.opsmesh.util.Jsons;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * POSTs each message as JSON to {@code <endpoint>/<topic>}.
 *
 * <p>2xx is success. 408, 429, 5xx and I/O errors are transient; any other status is a permanent
 * rejection. A 2xx body carrying {@code "topic": "deployment_notification"} is returned as a reply.
 */
public final class HttpValidatorClient implements ValidatorClient {
    private final String endpoint;
    private final HttpClient http;
    private final LongSupplier clock;

    public HttpValidatorClient(String endpoint, Duration connectTimeout) {
        this(endpoint, connectTimeout, System::currentTimeMillis);
    }

    public HttpValidatorClient(String endpoint, Duration connectTimeout, LongSupplier clock) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("validator endpoint is required");
        }
        String trimmed = endpoint.trim();
        this.endpoint = trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
        this.http = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .build();
        this.clock = clock == null ? System::currentTimeMillis : clock;
    }

    @Override
    public Optional<Message> send(Message message, Duration timeout) throws ValidatorException {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(endpoint + "/" + message.topic()))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("X-Message-Id", message.id());
        if (message.contractVersion() != null) {
            builder.header("X-Contract-Version", message.contractVersion());
        }
        HttpRequest request = builder
                .POST(HttpRequest.BodyPublishers.ofString(Jsons.toCompactJson(envelope(message)), StandardCharsets.UTF_8))
                .build();
        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw ValidatorException.transientFailure("validator timed out after " + timeout.toMillis() + " ms", e);
        } catch (IOException e) {
            throw ValidatorException.transientFailure("validator unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ValidatorException.transientFailure("interrupted while calling validator", e);
        }
        int status = response.statusCode();
        if (status / 100 == 2) {
            return parseReply(response.body(), clock.getAsLong());
        }
        if (status == 408 || status == 429 || status / 100 == 5) {
            throw new ValidatorException("validator returned status=" + status, true);
        }
        throw ValidatorException.permanent("validator rejected message status=" + status);
    }

    static ObjectNode envelope(Message message) {
        ObjectNode out = Jsons.object();
        out.put("message_id", message.id());
        out.put("topic", message.topic());
        out.put("contract_version", message.contractVersion());
        out.put("priority", message.priority().label());
        out.put("sender_id", message.senderId());
        out.put("created_at_ms", message.createdAtMs());
        out.set("payload", message.payload());
        return out;
    }

    /**
     * Reads a validator reply. A reply without {@code contract_version} keeps it unset so the
     * contract check rejects it.
     */
    static Optional<Message> parseReply(String body, long receivedAtMs) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        JsonNode node;
        try {
            node = Jsons.readTree(body);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        if (!Topics.DEPLOYMENT_NOTIFICATION.equals(node.path("topic").asText())) {
            return Optional.empty();
        }
        String id = node.path("message_id").asText("");
        return Optional.of(new Message(
                id.isBlank() ? Message.newId() : id,
                Topics.DEPLOYMENT_NOTIFICATION,
                node.path("payload"),
                Priority.HIGH,
                node.path("sender_id").asText("validator"),
                null,
                receivedAtMs,
                0L,
                node.hasNonNull("contract_version") ? node.get("contract_version").asText() : null
        ));
    }
}
