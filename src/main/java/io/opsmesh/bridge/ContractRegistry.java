package io.opsmesh.bridge;

import com.fasterxml.jackson.databind.JsonNode;
import io.opsmesh.model.Message;
import io.opsmesh.util.Jsons;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Compatibility table of message contracts.
 *
 * <p>A message declaring {@code M.m} is accepted when the table holds a contract for its topic
 * with major {@code M} and minor {@code >= m}; it is checked against the lowest such contract.
 * Contracts are only ever added, so a version accepted once stays decodable.
 */
public final class ContractRegistry {
    public static final String DEFAULT_RESOURCE = "/contracts.json";

    private final Map<String, TreeMap<MessageContract.Version, MessageContract>> byTopic = new ConcurrentHashMap<>();

    public static ContractRegistry fromClasspath() {
        return fromClasspath(DEFAULT_RESOURCE);
    }

    public static ContractRegistry fromClasspath(String resource) {
        try (InputStream in = ContractRegistry.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Contract resource not found: " + resource);
            }
            return fromJson(Jsons.mapper().readTree(in));
        } catch (IOException e) {
            throw new RuntimeException("Failed to load contracts: " + resource, e);
        }
    }

    static ContractRegistry fromJson(JsonNode root) {
        ContractRegistry registry = new ContractRegistry();
        JsonNode contracts = root.path("contracts");
        if (!contracts.isArray()) {
            throw new IllegalArgumentException("contracts must be an array");
        }
        for (JsonNode row : contracts) {
            List<String> required = new ArrayList<>();
            row.path("schema").path("required").forEach(n -> required.add(n.asText()));
            Map<String, String> types = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> props = row.path("schema").path("properties").fields();
            while (props.hasNext()) {
                Map.Entry<String, JsonNode> prop = props.next();
                types.put(prop.getKey(), prop.getValue().path("type").asText("any"));
            }
            registry.register(new MessageContract(row.path("topic").asText(), row.path("version").asText(), required, types));
        }
        return registry;
    }

    public void register(MessageContract contract) {
        byTopic.compute(contract.topic(), (topic, versions) -> {
            TreeMap<MessageContract.Version, MessageContract> next = versions == null ? new TreeMap<>() : new TreeMap<>(versions);
            if (next.putIfAbsent(contract.parsedVersion(), contract) != null) {
                throw new IllegalArgumentException("Contract already registered: " + topic + "@" + contract.version());
            }
            return next;
        });
    }

    public Optional<MessageContract> resolve(String topic, String version) {
        TreeMap<MessageContract.Version, MessageContract> versions = byTopic.get(topic);
        if (versions == null) {
            return Optional.empty();
        }
        MessageContract.Version wanted = MessageContract.Version.parse(version);
        Map.Entry<MessageContract.Version, MessageContract> lowest = versions.ceilingEntry(wanted);
        if (lowest == null || lowest.getKey().major() != wanted.major()) {
            return Optional.empty();
        }
        return Optional.of(lowest.getValue());
    }

    public List<MessageContract> contracts() {
        List<MessageContract> out = new ArrayList<>();
        for (TreeMap<MessageContract.Version, MessageContract> versions : new TreeMap<>(byTopic).values()) {
            out.addAll(versions.values());
        }
        return out;
    }

    public Validation validate(Message message) {
        if (message.contractVersion() == null) {
            return Validation.invalid("missing contract_version");
        }
        MessageContract.Version version;
        try {
            version = MessageContract.Version.parse(message.contractVersion());
        } catch (IllegalArgumentException e) {
            return Validation.invalid("unparseable contract version '" + message.contractVersion() + "'");
        }
        if (!byTopic.containsKey(message.topic())) {
            return Validation.invalid("no contract for topic '" + message.topic() + "'");
        }
        Optional<MessageContract> contract = resolve(message.topic(), version.toString());
        if (contract.isEmpty()) {
            return Validation.invalid("incompatible contract version " + message.contractVersion()
                    + " for topic '" + message.topic() + "'");
        }
        JsonNode payload = message.payload();
        if (payload == null || !payload.isObject()) {
            return Validation.invalid("payload must be a JSON object", contract.get());
        }
        for (String field : contract.get().required()) {
            JsonNode value = payload.get(field);
            if (value == null || value.isNull()) {
                return Validation.invalid("missing required field '" + field + "'", contract.get());
            }
        }
        for (Map.Entry<String, String> prop : contract.get().propertyTypes().entrySet()) {
            JsonNode value = payload.get(prop.getKey());
            if (value == null || value.isNull()) {
                continue;
            }
            if (!matchesType(value, prop.getValue())) {
                return Validation.invalid("field '" + prop.getKey() + "' must be " + prop.getValue(), contract.get());
            }
        }
        return new Validation(true, "ok", contract.get());
    }

    private static boolean matchesType(JsonNode value, String type) {
        return switch (type) {
            case "string" -> value.isTextual();
            case "number" -> value.isNumber();
            case "integer" -> value.isIntegralNumber();
            case "boolean" -> value.isBoolean();
            case "object" -> value.isObject();
            case "array" -> value.isArray();
            default -> true;
        };
    }

    /**
     * @param contract the contract the message was checked against, or {@code null} if none matched
     */
    public record Validation(boolean valid, String reason, MessageContract contract) {
        static Validation invalid(String reason) {
            return new Validation(false, reason, null);
        }

        static Validation invalid(String reason, MessageContract contract) {
            return new Validation(false, reason, contract);
        }
    }
}
