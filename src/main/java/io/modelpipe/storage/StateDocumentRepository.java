package io.modelpipe.storage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * One JSON state document per scope, versioned by a content revision. Writes are compare-and-set on that revision.
 */
public final class StateDocumentRepository {
    private final Database database;

    public StateDocumentRepository(Database database) {
        this.database = database;
    }

    public String loadRevision(String scope) {
        String sql = "SELECT revision FROM pipeline_state WHERE scope=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, scope);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getString("revision") : null;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load state revision: " + scope, e);
        }
    }

    public StateRecord load(String scope) {
        String sql = "SELECT revision,document_version,state_json,updated_at_ms FROM pipeline_state WHERE scope=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, scope);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return null;
                }
                return new StateRecord(
                        rs.getString("revision"),
                        rs.getInt("document_version"),
                        rs.getString("state_json"),
                        rs.getLong("updated_at_ms")
                );
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load state document: " + scope, e);
        }
    }

    /**
     * Writes the document only if the stored revision still equals {@code expectedRevision}
     * ({@code null} meaning no document exists yet).
     *
     * @return false when another writer got there first
     */
    public boolean saveIfRevision(String scope, String expectedRevision, String nextRevision, int documentVersion,
                                  String stateJson, long nowMs) {
        if (expectedRevision == null) {
            String sql = """
                    INSERT OR IGNORE INTO pipeline_state(scope,revision,document_version,state_json,created_at_ms,updated_at_ms)
                    VALUES(?,?,?,?,?,?)
                    """;
            try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, scope);
                ps.setString(2, nextRevision);
                ps.setInt(3, documentVersion);
                ps.setString(4, stateJson);
                ps.setLong(5, nowMs);
                ps.setLong(6, nowMs);
                return ps.executeUpdate() == 1;
            } catch (SQLException e) {
                throw new RuntimeException("Failed to insert state document: " + scope, e);
            }
        }
        String sql = """
                UPDATE pipeline_state
                SET revision=?, document_version=?, state_json=?, updated_at_ms=?
                WHERE scope=? AND revision=?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, nextRevision);
            ps.setInt(2, documentVersion);
            ps.setString(3, stateJson);
            ps.setLong(4, nowMs);
            ps.setString(5, scope);
            ps.setString(6, expectedRevision);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update state document: " + scope, e);
        }
    }

    public record StateRecord(String revision, int documentVersion, String stateJson, long updatedAtMs) {
    }
}
