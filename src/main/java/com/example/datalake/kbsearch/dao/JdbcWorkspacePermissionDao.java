package com.example.datalake.kbsearch.dao;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcWorkspacePermissionDao implements WorkspacePermissionDao {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public boolean hasAnyPermission(String userId, String workspaceId) {
        if (userId == null || userId.isBlank() || workspaceId == null || workspaceId.isBlank()) {
            return false;
        }

        final String sql = """
                select exists(
                    select 1
                    from public.permissions
                    where entity_type = 'workspace'
                      and entity_id = ?
                      and user_id = ?
                )
                """;

        Boolean found = jdbcTemplate.queryForObject(sql, Boolean.class, workspaceId, userId);
        return Boolean.TRUE.equals(found);
    }
}
