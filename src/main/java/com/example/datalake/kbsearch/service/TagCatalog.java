package com.example.datalake.kbsearch.service;

import com.example.datalake.kbsearch.model.TagDefinition;
import java.util.List;

/** Per knowledge base mapping from user-facing tag names to typed slots. */
public interface TagCatalog {

    List<TagDefinition> getTagDefinitions(String knowledgeBaseId);
}
