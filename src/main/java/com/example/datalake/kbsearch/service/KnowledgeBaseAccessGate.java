package com.example.datalake.kbsearch.service;

import com.example.datalake.kbsearch.model.KnowledgeBaseAccess;

/** Decides whether a caller may read a knowledge base. Blocking; callers schedule it. */
public interface KnowledgeBaseAccessGate {

    KnowledgeBaseAccess checkAccess(String knowledgeBaseId, String userId);
}
