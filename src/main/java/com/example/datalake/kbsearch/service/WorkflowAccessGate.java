package com.example.datalake.kbsearch.service;

/** Authorizes a search issued on behalf of a workflow. */
public interface WorkflowAccessGate {

    /**
     * @throws com.example.datalake.kbsearch.exception.SearchAccessException if the workflow is
     *     unknown or the caller cannot read its workspace
     */
    void authorizeRead(String workflowId, String userId);
}
