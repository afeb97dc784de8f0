package com.example.datalake.kbsearch.service;

import com.example.datalake.kbsearch.dao.KnowledgeBaseRepository;
import com.example.datalake.kbsearch.dao.WorkspacePermissionDao;
import com.example.datalake.kbsearch.entity.KnowledgeBaseEntity;
import com.example.datalake.kbsearch.model.KnowledgeBaseAccess;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Grants read access to the owner of a knowledge base and to any member of its workspace.
 * Soft-deleted knowledge bases are reported as not found.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaKnowledgeBaseAccessGate implements KnowledgeBaseAccessGate {

    private final KnowledgeBaseRepository knowledgeBaseRepository;
    private final WorkspacePermissionDao workspacePermissionDao;

    @Override
    public KnowledgeBaseAccess checkAccess(String knowledgeBaseId, String userId) {
        Optional<KnowledgeBaseEntity> found = knowledgeBaseRepository.findByIdAndDeletedAtIsNull(knowledgeBaseId);
        if (found.isEmpty()) {
            return KnowledgeBaseAccess.missing(knowledgeBaseId);
        }

        KnowledgeBaseEntity kb = found.get();
        if (userId != null && userId.equals(kb.getUserId())) {
            return KnowledgeBaseAccess.granted(knowledgeBaseId);
        }
        if (kb.getWorkspaceId() != null && workspacePermissionDao.hasAnyPermission(userId, kb.getWorkspaceId())) {
            return KnowledgeBaseAccess.granted(knowledgeBaseId);
        }

        log.debug("User {} has no access to knowledge base {}", userId, knowledgeBaseId);
        return KnowledgeBaseAccess.denied(knowledgeBaseId);
    }
}
