package io.opsmesh.conflict;

import io.opsmesh.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Picks one winner among contradictory action requests.
 *
 * <p>Ranking: highest priority score, then earliest request, then the lexicographically smallest
 * source id. Losing requests stay in the record with their rank.
 */
public final class ConflictResolver {
    private static final Logger log = LoggerFactory.getLogger(ConflictResolver.class);
    private static final int HISTORY_LIMIT = 200;

    static final Comparator<ActionRequest> RANKING = Comparator
            .comparingDouble(ActionRequest::priorityScore).reversed()
            .thenComparingLong(ActionRequest::requestedAtMs)
            .thenComparing(ActionRequest::sourceId)
            .thenComparing(ActionRequest::action);

    private final Deque<ConflictRecord> recent = new ArrayDeque<>();

    public ConflictRecord resolve(List<ActionRequest> requests, long nowMs) {
        if (requests == null || requests.isEmpty()) {
            throw new IllegalArgumentException("At least one request is required");
        }
        List<ActionRequest> ordered = new ArrayList<>(requests);
        ordered.sort(RANKING);
        ActionRequest winner = ordered.get(0);
        List<RequestOutcome> outcomes = new ArrayList<>();
        for (int i = 0; i < ordered.size(); i++) {
            ActionRequest request = ordered.get(i);
            if (i == 0) {
                outcomes.add(new RequestOutcome(request, true, 1, "highest_rank"));
            } else {
                outcomes.add(new RequestOutcome(request, false, i + 1, loseReason(winner, request)));
            }
        }
        ConflictRecord record = new ConflictRecord(recordId(ordered), winner.resourceId(), outcomes,
                winner.action(), winner.sourceId(), nowMs);
        synchronized (recent) {
            recent.addLast(record);
            while (recent.size() > HISTORY_LIMIT) {
                recent.removeFirst();
            }
        }
        log.info("Conflict {} on {}: '{}' from {} wins over {} request(s)", record.id(), record.resourceId(),
                record.resolution(), record.winningSourceId(), ordered.size() - 1);
        return record;
    }

    /**
     * Groups one cycle's requests by resource. Only groups proposing two or more distinct actions
     * are conflicts; everything else is returned as uncontested.
     */
    public Detection detect(List<ActionRequest> requests) {
        Map<String, List<ActionRequest>> byResource = new LinkedHashMap<>();
        for (ActionRequest request : requests) {
            byResource.computeIfAbsent(request.resourceId(), k -> new ArrayList<>()).add(request);
        }
        List<List<ActionRequest>> conflicts = new ArrayList<>();
        List<ActionRequest> uncontested = new ArrayList<>();
        for (List<ActionRequest> group : byResource.values()) {
            Set<String> actions = new HashSet<>();
            for (ActionRequest request : group) {
                actions.add(request.action());
            }
            if (actions.size() > 1) {
                conflicts.add(List.copyOf(group));
            } else {
                uncontested.addAll(group);
            }
        }
        return new Detection(List.copyOf(conflicts), List.copyOf(uncontested));
    }

    public List<ConflictRecord> recent(int limit) {
        synchronized (recent) {
            List<ConflictRecord> all = new ArrayList<>(recent);
            int from = Math.max(0, all.size() - Math.max(0, limit));
            return List.copyOf(all.subList(from, all.size()));
        }
    }

    private static String loseReason(ActionRequest winner, ActionRequest loser) {
        if (Double.compare(winner.priorityScore(), loser.priorityScore()) != 0) {
            return "lower_priority_score";
        }
        if (winner.requestedAtMs() != loser.requestedAtMs()) {
            return "later_request";
        }
        return "source_id_tiebreak";
    }

    private static String recordId(List<ActionRequest> ordered) {
        StringBuilder canonical = new StringBuilder();
        for (ActionRequest request : ordered) {
            canonical.append(request.resourceId()).append('|')
                    .append(request.sourceId()).append('|')
                    .append(request.action()).append('|')
                    .append(request.priorityScore()).append('|')
                    .append(request.requestedAtMs()).append('\n');
        }
        return "cfl_" + Hashing.sha256Hex(canonical.toString()).substring(0, 16);
    }

    public record Detection(List<List<ActionRequest>> conflicts, List<ActionRequest> uncontested) {
    }
}
