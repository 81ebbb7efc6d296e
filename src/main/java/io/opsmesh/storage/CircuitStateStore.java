package io.opsmesh.storage;

import io.opsmesh.bridge.CircuitBreakerState;
import io.opsmesh.bridge.CircuitState;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

public final class CircuitStateStore {
    private final Database database;

    public CircuitStateStore(Database database) {
        this.database = database;
    }

    public Optional<CircuitBreakerState> load(String channel) {
        String sql = """
                SELECT channel,state,consecutive_failures,opened_at_ms,half_open_trial_budget,half_open_successes,trips,updated_at_ms
                FROM circuit_breakers WHERE channel=?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, channel);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new CircuitBreakerState(
                        rs.getString("channel"),
                        CircuitState.valueOf(rs.getString("state")),
                        rs.getInt("consecutive_failures"),
                        rs.getLong("opened_at_ms"),
                        rs.getInt("half_open_trial_budget"),
                        rs.getInt("half_open_successes"),
                        rs.getLong("trips"),
                        rs.getLong("updated_at_ms")
                ));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load circuit state: " + channel, e);
        }
    }

    public void save(CircuitBreakerState state) {
        String sql = """
                INSERT INTO circuit_breakers(channel,state,consecutive_failures,opened_at_ms,half_open_trial_budget,half_open_successes,trips,updated_at_ms)
                VALUES(?,?,?,?,?,?,?,?)
                ON CONFLICT(channel) DO UPDATE SET
                    state=excluded.state,
                    consecutive_failures=excluded.consecutive_failures,
                    opened_at_ms=excluded.opened_at_ms,
                    half_open_trial_budget=excluded.half_open_trial_budget,
                    half_open_successes=excluded.half_open_successes,
                    trips=excluded.trips,
                    updated_at_ms=excluded.updated_at_ms
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, state.channel());
            ps.setString(2, state.state().name());
            ps.setInt(3, state.consecutiveFailures());
            ps.setLong(4, state.openedAtMs());
            ps.setInt(5, state.halfOpenTrialBudget());
            ps.setInt(6, state.halfOpenSuccesses());
            ps.setLong(7, state.trips());
            ps.setLong(8, state.updatedAtMs());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save circuit state: " + state.channel(), e);
        }
    }
}
