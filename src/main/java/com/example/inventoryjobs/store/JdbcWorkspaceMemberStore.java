package com.example.inventoryjobs.store;

import com.example.inventoryjobs.tx.TxManager;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcWorkspaceMemberStore implements WorkspaceMemberStore {

    private final TxManager txManager;
    private final JdbcTemplate jdbcTemplate;

    @Override
    public List<UUID> findUserIdsByRoles(UUID workspaceId, Collection<String> roles) {
        if (roles.isEmpty()) {
            return List.of();
        }
        var named = new NamedParameterJdbcTemplate(txManager.getTransactionOrDefault(jdbcTemplate));
        var params = new MapSqlParameterSource()
                .addValue("workspaceId", workspaceId)
                .addValue("roles", roles);
        return named.query("""
                SELECT m.user_id FROM auth.workspace_members m
                WHERE m.workspace_id = :workspaceId
                  AND CAST(m.role AS VARCHAR) IN (:roles)
                ORDER BY m.created_at ASC
                """, params, (rs, rowNum) -> rs.getObject("user_id", UUID.class));
    }
}
