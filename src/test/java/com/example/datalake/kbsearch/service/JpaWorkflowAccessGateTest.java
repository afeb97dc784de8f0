package com.example.datalake.kbsearch.service;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.datalake.kbsearch.dao.WorkflowRepository;
import com.example.datalake.kbsearch.dao.WorkspacePermissionDao;
import com.example.datalake.kbsearch.entity.WorkflowEntity;
import com.example.datalake.kbsearch.exception.SearchAccessException;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class JpaWorkflowAccessGateTest {

  private final WorkflowRepository repository = mock(WorkflowRepository.class);
  private final WorkspacePermissionDao permissions = mock(WorkspacePermissionDao.class);
  private final JpaWorkflowAccessGate gate = new JpaWorkflowAccessGate(repository, permissions);

  @Test
  void unknownWorkflowIsNotFound() {
    when(repository.findById("wf-1")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> gate.authorizeRead("wf-1", "user-1"))
        .isInstanceOf(SearchAccessException.class)
        .hasMessage("Workflow not found");
  }

  @Test
  void workspaceMemberMayRead() {
    when(repository.findById("wf-1")).thenReturn(Optional.of(workflow("owner", "ws-1")));
    when(permissions.hasAnyPermission("user-1", "ws-1")).thenReturn(true);

    assertThatCode(() -> gate.authorizeRead("wf-1", "user-1")).doesNotThrowAnyException();
  }

  @Test
  void nonMemberIsForbidden() {
    when(repository.findById("wf-1")).thenReturn(Optional.of(workflow("owner", "ws-1")));

    assertThatThrownBy(() -> gate.authorizeRead("wf-1", "user-1"))
        .isInstanceOf(SearchAccessException.class)
        .hasMessage("Access denied");
  }

  private static WorkflowEntity workflow(String userId, String workspaceId) {
    WorkflowEntity entity = new WorkflowEntity();
    entity.setId("wf-1");
    entity.setUserId(userId);
    entity.setWorkspaceId(workspaceId);
    return entity;
  }
}
