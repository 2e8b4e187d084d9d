package io.quorumesh.storage;

import io.quorumesh.model.GroupMember;
import io.quorumesh.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Group roster fed by presence and capabilities envelopes.
 */
public final class RosterStore {
    private final Database database;

    public RosterStore(Database database) {
        this.database = database;
    }

    /**
     * Inserts or refreshes a member. An empty capability list keeps the stored capabilities, so presence
     * heartbeats do not erase what a capabilities envelope announced.
     */
    public void upsertGroupMember(GroupMember m) {
        String sql = """
                INSERT INTO group_members(group_name,member_id,instance_id,status,capabilities_json,last_seen_ms)
                VALUES(?,?,?,?,?,?)
                ON CONFLICT(group_name, member_id) DO UPDATE SET
                    instance_id=CASE WHEN excluded.instance_id='' THEN group_members.instance_id ELSE excluded.instance_id END,
                    status=excluded.status,
                    capabilities_json=CASE WHEN excluded.capabilities_json='[]' THEN group_members.capabilities_json ELSE excluded.capabilities_json END,
                    last_seen_ms=MAX(group_members.last_seen_ms, excluded.last_seen_ms)
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, m.group());
            ps.setString(2, m.memberId());
            ps.setString(3, m.instanceId() == null ? "" : m.instanceId());
            ps.setString(4, m.status() == null || m.status().isBlank() ? GroupMember.STATUS_ACTIVE : m.status().trim().toLowerCase());
            ps.setString(5, Jsons.toCompactJson(m.capabilities()));
            ps.setLong(6, m.lastSeenAtMs());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to upsert group member", e);
        }
    }

    public List<GroupMember> listGroupMembers(String group, boolean activeOnly) {
        String sql = "SELECT group_name,member_id,instance_id,status,capabilities_json,last_seen_ms FROM group_members WHERE group_name=?"
                + (activeOnly ? " AND status=?" : "")
                + " ORDER BY member_id";
        List<GroupMember> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, group);
            if (activeOnly) {
                ps.setString(2, GroupMember.STATUS_ACTIVE);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new GroupMember(
                            rs.getString("group_name"),
                            rs.getString("member_id"),
                            rs.getString("instance_id"),
                            rs.getString("status"),
                            Jsons.readStringList(rs.getString("capabilities_json")),
                            rs.getLong("last_seen_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list group members", e);
        }
    }

    public int countActiveMembers(String group) {
        String sql = "SELECT COUNT(*) FROM group_members WHERE group_name=? AND status=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, group);
            ps.setString(2, GroupMember.STATUS_ACTIVE);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count group members", e);
        }
    }
}
