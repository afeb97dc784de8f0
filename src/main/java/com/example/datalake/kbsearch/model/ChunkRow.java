package com.example.datalake.kbsearch.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Chunk projection returned by the storage layer, with its distance to the query vector. Tag-only
 * rows carry a distance of zero.
 */
public record ChunkRow(
    String id,
    String knowledgeBaseId,
    String documentId,
    int chunkIndex,
    String content,
    Map<TagSlot, Object> tags,
    double distance) {

  public ChunkRow {
    tags = tags == null || tags.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new EnumMap<>(tags));
  }
}
