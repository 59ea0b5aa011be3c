package com.monitoring.customgraph.repository;

import com.monitoring.customgraph.access.AccessModels.GroupMembership;
import com.monitoring.customgraph.access.AccessModels.ProfileGrant;
import com.monitoring.customgraph.access.AccessModels.UserAccount;
import com.monitoring.customgraph.access.Privilege;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Repository
public class AccessJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public AccessJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<UserAccount> findUser(String userId) {
        List<UserAccount> rows = jdbcTemplate.query(
                "SELECT user_id, is_admin FROM user_account WHERE user_id = ?",
                (rs, n) -> new UserAccount(rs.getString(1), rs.getBoolean(2)),
                userId);
        return rows.stream().findFirst();
    }

    public List<GroupMembership> loadGroups() {
        return jdbcTemplate.query(
                "SELECT group_id, name FROM monitoring_group ORDER BY group_id",
                (rs, n) -> new GroupMembership(rs.getInt(1), rs.getString(2)));
    }

    public List<ProfileGrant> loadProfileGrants(String userId) {
        return jdbcTemplate.query(
                "SELECT up.group_id, p.* FROM user_profile up JOIN access_profile p ON p.profile_id = up.profile_id WHERE up.user_id = ? ORDER BY up.id",
                (rs, n) -> new ProfileGrant(rs.getInt("group_id"), grantedPrivileges(rs)),
                userId);
    }

    private static Set<Privilege> grantedPrivileges(ResultSet rs) throws SQLException {
        Set<Privilege> granted = EnumSet.noneOf(Privilege.class);
        for (Privilege privilege : Privilege.values()) {
            if (rs.getBoolean(privilege.column())) {
                granted.add(privilege);
            }
        }
        return granted;
    }
}
