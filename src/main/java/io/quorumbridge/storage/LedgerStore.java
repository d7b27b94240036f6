package io.quorumbridge.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import io.quorumbridge.config.DeploymentConfig;
import io.quorumbridge.ledger.LedgerState;
import io.quorumbridge.ledger.TokenAccounts;
import io.quorumbridge.observability.LedgerEvent;
import io.quorumbridge.util.Jsons;

import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One row per deployment holding its config and last committed state, plus the append-only event table.
 * State and the events that produced it are written in the same transaction.
 */
public final class LedgerStore {
    private static final TypeReference<Map<String, Object>> FIELDS_TYPE = new TypeReference<>() {
    };

    private final Database database;
    private final String namespace;

    public LedgerStore(Database database) {
        this.database = database;
        this.namespace = database.namespace();
    }

    public void create(DeploymentConfig config, LedgerState state, TokenAccounts.State origin, long nowMs) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "INSERT INTO deployments(name,namespace,variant,chain_id,ledger_address,config_json,state_json,origin_json,version,created_at_ms,updated_at_ms) VALUES(?,?,?,?,?,?,?,?,1,?,?)")) {
            ps.setString(1, config.name());
            ps.setString(2, namespace);
            ps.setString(3, config.variant().name());
            ps.setLong(4, config.chainId());
            ps.setString(5, config.ledgerAddress().value());
            ps.setString(6, Jsons.toCompactJson(config));
            ps.setString(7, Jsons.toCompactJson(state));
            ps.setString(8, origin == null ? null : Jsons.toCompactJson(origin));
            ps.setLong(9, nowMs);
            ps.setLong(10, nowMs);
            ps.executeUpdate();
        } catch (SQLException e) {
            if (find(config.name()).isPresent()) {
                throw new IllegalArgumentException("Deployment already exists: " + config.name());
            }
            throw new RuntimeException("Failed to create deployment " + config.name(), e);
        }
    }

    public Optional<StoredDeployment> find(String name) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT name,config_json,state_json,origin_json,version,created_at_ms,updated_at_ms FROM deployments WHERE name=? AND namespace=?")) {
            ps.setString(1, name);
            ps.setString(2, namespace);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(readDeployment(rs));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load deployment " + name, e);
        }
    }

    public List<StoredDeployment> list() {
        List<StoredDeployment> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT name,config_json,state_json,origin_json,version,created_at_ms,updated_at_ms FROM deployments WHERE namespace=? ORDER BY name")) {
            ps.setString(1, namespace);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readDeployment(rs));
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list deployments", e);
        }
        return out;
    }

    /**
     * Stores a new state if the row is still at {@code expectedVersion}, appending {@code events} in the
     * same transaction.
     *
     * @return the new version
     */
    public long save(
            String name,
            long expectedVersion,
            LedgerState state,
            TokenAccounts.State origin,
            List<LedgerEvent> events,
            long nowMs
    ) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                try (PreparedStatement up = c.prepareStatement(
                        "UPDATE deployments SET state_json=?,origin_json=?,version=version+1,updated_at_ms=? WHERE name=? AND namespace=? AND version=?");
                     PreparedStatement ev = c.prepareStatement(
                             "INSERT INTO ledger_events(namespace,deployment,event,event_time,fields_json,created_at_ms) VALUES(?,?,?,?,?,?)")) {
                    up.setString(1, Jsons.toCompactJson(state));
                    up.setString(2, origin == null ? null : Jsons.toCompactJson(origin));
                    up.setLong(3, nowMs);
                    up.setString(4, name);
                    up.setString(5, namespace);
                    up.setLong(6, expectedVersion);
                    if (up.executeUpdate() != 1) {
                        throw new IllegalStateException(
                                "Deployment " + name + " changed concurrently (expected version " + expectedVersion + ")");
                    }
                    for (LedgerEvent event : events) {
                        ev.setString(1, namespace);
                        ev.setString(2, name);
                        ev.setString(3, event.name());
                        ev.setLong(4, event.timestamp());
                        ev.setString(5, Jsons.toCompactJson(event.fields()));
                        ev.setLong(6, nowMs);
                        ev.addBatch();
                    }
                    if (!events.isEmpty()) {
                        ev.executeBatch();
                    }
                }
                c.commit();
                return expectedVersion + 1;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save deployment " + name, e);
        }
    }

    public List<EventRow> events(String name, String eventName, int limit) {
        int safeLimit = limit <= 0 ? 100 : Math.min(limit, 10_000);
        boolean filtered = eventName != null && !eventName.isBlank();
        String sql = "SELECT id,deployment,event,event_time,fields_json FROM ledger_events WHERE namespace=? AND deployment=?"
                + (filtered ? " AND event=?" : "")
                + " ORDER BY id DESC LIMIT ?";
        List<EventRow> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int i = 1;
            ps.setString(i++, namespace);
            ps.setString(i++, name);
            if (filtered) {
                ps.setString(i++, eventName.trim());
            }
            ps.setInt(i, safeLimit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new EventRow(
                            rs.getLong("id"),
                            rs.getString("deployment"),
                            rs.getString("event"),
                            rs.getLong("event_time"),
                            Jsons.compact().readValue(rs.getString("fields_json"), FIELDS_TYPE)
                    ));
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list events for " + name, e);
        } catch (IOException e) {
            throw new RuntimeException("Failed to parse stored event fields for " + name, e);
        }
        Collections.reverse(out);
        return out;
    }

    private StoredDeployment readDeployment(ResultSet rs) throws SQLException {
        String originJson = rs.getString("origin_json");
        return new StoredDeployment(
                rs.getString("name"),
                Jsons.fromJson(rs.getString("config_json"), DeploymentConfig.class),
                Jsons.fromJson(rs.getString("state_json"), LedgerState.class),
                originJson == null ? null : Jsons.fromJson(originJson, TokenAccounts.State.class),
                rs.getLong("version"),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }

    public record StoredDeployment(
            String name,
            DeploymentConfig config,
            LedgerState state,
            TokenAccounts.State origin,
            long version,
            long createdAtMs,
            long updatedAtMs
    ) {
    }

    public record EventRow(long id, String deployment, String event, long eventTime, Map<String, Object> fields) {
    }
}
