package io.artifactmesh.relation;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Relation channel backed by a SQLite file reachable by every unit of the group. Stands in for the
 * orchestration framework's peer data when running the CLI outside of it.
 */
public final class SqliteRelationDataAccessor implements RelationDataAccessor {
    private final RelationDatabase database;
    private final String localUnit;
    private final boolean leader;
    private final Clock clock;

    public SqliteRelationDataAccessor(RelationDatabase database, String localUnit, boolean leader) {
        this(database, localUnit, leader, Clock.systemUTC());
    }

    public SqliteRelationDataAccessor(RelationDatabase database, String localUnit, boolean leader, Clock clock) {
        if (localUnit == null || localUnit.isBlank()) {
            throw new IllegalArgumentException("localUnit must not be blank");
        }
        this.database = database;
        this.localUnit = localUnit.trim();
        this.leader = leader;
        this.clock = clock;
    }

    public void join() {
        String sql = "INSERT INTO members(unit,joined_at_ms) VALUES(?,?) ON CONFLICT(unit) DO NOTHING";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, localUnit);
            ps.setLong(2, clock.millis());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to join relation as " + localUnit, e);
        }
    }

    @Override
    public String localUnit() {
        return localUnit;
    }

    @Override
    public void setUnitData(String key, String value) {
        String sql = """
                INSERT INTO unit_data(unit,data_key,data_value,updated_at_ms) VALUES(?,?,?,?)
                ON CONFLICT(unit,data_key) DO UPDATE SET data_value=excluded.data_value, updated_at_ms=excluded.updated_at_ms
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, localUnit);
            ps.setString(2, key);
            ps.setString(3, value == null ? "" : value);
            ps.setLong(4, clock.millis());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to set unit data " + key + " for " + localUnit, e);
        }
    }

    @Override
    public Optional<String> getUnitData(String unit, String key) {
        String sql = "SELECT data_value FROM unit_data WHERE unit=? AND data_key=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, unit);
            ps.setString(2, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read unit data " + key + " of " + unit, e);
        }
    }

    @Override
    public List<String> allUnits() {
        List<String> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT unit FROM members ORDER BY unit");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(rs.getString(1));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list relation members", e);
        }
    }

    @Override
    public void setApplicationData(Map<String, String> values) {
        if (!leader) {
            throw new IllegalStateException("Only the leader may write application data, " + localUnit + " is not leader");
        }
        String sql = """
                INSERT INTO app_data(data_key,data_value,updated_at_ms) VALUES(?,?,?)
                ON CONFLICT(data_key) DO UPDATE SET data_value=excluded.data_value, updated_at_ms=excluded.updated_at_ms
                """;
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                long now = clock.millis();
                for (Map.Entry<String, String> entry : values.entrySet()) {
                    ps.setString(1, entry.getKey());
                    ps.setString(2, entry.getValue() == null ? "" : entry.getValue());
                    ps.setLong(3, now);
                    ps.addBatch();
                }
                ps.executeBatch();
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to write application data " + values.keySet(), e);
        }
    }

    @Override
    public Optional<String> getApplicationData(String key) {
        String sql = "SELECT data_value FROM app_data WHERE data_key=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read application data " + key, e);
        }
    }

    @Override
    public Map<String, String> applicationData() {
        Map<String, String> out = new LinkedHashMap<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT data_key,data_value FROM app_data ORDER BY data_key");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.put(rs.getString(1), rs.getString(2));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read application data", e);
        }
    }
}
