package com.example.datalake.kbsearch.service;

import com.example.datalake.kbsearch.dao.WorkflowRepository;
import com.example.datalake.kbsearch.dao.WorkspacePermissionDao;
import com.example.datalake.kbsearch.entity.WorkflowEntity;
import com.example.datalake.kbsearch.exception.SearchAccessException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class JpaWorkflowAccessGate implements WorkflowAccessGate {

    private final WorkflowRepository workflowRepository;
    private final WorkspacePermissionDao workspacePermissionDao;

    @Override
    public void authorizeRead(String workflowId, String userId) {
        WorkflowEntity workflow = workflowRepository.findById(workflowId)
                .orElseThrow(SearchAccessException::workflowNotFound);

        if (userId != null && userId.equals(workflow.getUserId())) {
            return;
        }
        if (workflow.getWorkspaceId() != null
                && workspacePermissionDao.hasAnyPermission(userId, workflow.getWorkspaceId())) {
            return;
        }
        throw SearchAccessException.workflowForbidden();
    }
}
