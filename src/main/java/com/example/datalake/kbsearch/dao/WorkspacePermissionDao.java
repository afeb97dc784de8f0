package com.example.datalake.kbsearch.dao;

public interface WorkspacePermissionDao {

    /**
     * Whether the user holds any permission (read, write or admin) on the workspace.
     */
    boolean hasAnyPermission(String userId, String workspaceId);
}
