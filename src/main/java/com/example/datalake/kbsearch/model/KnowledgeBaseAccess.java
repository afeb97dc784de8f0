package com.example.datalake.kbsearch.model;

/**
 * Access decision for one knowledge base and one caller.
 *
 * @param knowledgeBaseId the requested id
 * @param hasAccess whether the caller may read it
 * @param notFound the knowledge base does not exist or is soft-deleted
 */
public record KnowledgeBaseAccess(String knowledgeBaseId, boolean hasAccess, boolean notFound) {

  public static KnowledgeBaseAccess granted(String knowledgeBaseId) {
    return new KnowledgeBaseAccess(knowledgeBaseId, true, false);
  }

  public static KnowledgeBaseAccess denied(String knowledgeBaseId) {
    return new KnowledgeBaseAccess(knowledgeBaseId, false, false);
  }

  public static KnowledgeBaseAccess missing(String knowledgeBaseId) {
    return new KnowledgeBaseAccess(knowledgeBaseId, false, true);
  }
}
