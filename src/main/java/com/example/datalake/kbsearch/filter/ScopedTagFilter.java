package com.example.datalake.kbsearch.filter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tag filter compiled separately for each knowledge base, since every knowledge base maps tag
 * names to slots through its own catalog. A knowledge base absent from the scope cannot match
 * the filter at all.
 */
public final class ScopedTagFilter {

  private static final ScopedTagFilter NONE = new ScopedTagFilter(Map.of());

  private final Map<String, CompiledTagFilter> byKnowledgeBase;

  private ScopedTagFilter(Map<String, CompiledTagFilter> byKnowledgeBase) {
    this.byKnowledgeBase = byKnowledgeBase;
  }

  /** Matches nothing. */
  public static ScopedTagFilter none() {
    return NONE;
  }

  public static ScopedTagFilter of(Map<String, CompiledTagFilter> byKnowledgeBase) {
    if (byKnowledgeBase == null || byKnowledgeBase.isEmpty()) {
      return NONE;
    }
    return new ScopedTagFilter(Collections.unmodifiableMap(new LinkedHashMap<>(byKnowledgeBase)));
  }

  /** The same filter on every listed knowledge base. */
  public static ScopedTagFilter uniform(List<String> knowledgeBaseIds, CompiledTagFilter filter) {
    Map<String, CompiledTagFilter> scoped = new LinkedHashMap<>();
    for (String kbId : knowledgeBaseIds) {
      scoped.put(kbId, filter);
    }
    return of(scoped);
  }

  public List<String> knowledgeBaseIds() {
    return List.copyOf(byKnowledgeBase.keySet());
  }

  public CompiledTagFilter forKnowledgeBase(String knowledgeBaseId) {
    return byKnowledgeBase.get(knowledgeBaseId);
  }

  public ScopedTagFilter restrictTo(String knowledgeBaseId) {
    CompiledTagFilter filter = byKnowledgeBase.get(knowledgeBaseId);
    return filter == null ? NONE : new ScopedTagFilter(Map.of(knowledgeBaseId, filter));
  }

  /**
   * Knowledge bases sharing an identical filter, grouped so the storage layer can render each
   * distinct filter once. Order follows the first knowledge base of each group.
   */
  public Map<CompiledTagFilter, List<String>> knowledgeBasesByFilter() {
    Map<CompiledTagFilter, List<String>> grouped = new LinkedHashMap<>();
    byKnowledgeBase.forEach((kbId, filter) ->
        grouped.computeIfAbsent(filter, f -> new ArrayList<>()).add(kbId));
    return grouped;
  }

  public boolean isEmpty() {
    return byKnowledgeBase.isEmpty();
  }

  public int predicateCount() {
    return byKnowledgeBase.values().stream().mapToInt(CompiledTagFilter::predicateCount).sum();
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof ScopedTagFilter other && byKnowledgeBase.equals(other.byKnowledgeBase));
  }

  @Override
  public int hashCode() {
    return byKnowledgeBase.hashCode();
  }

  @Override
  public String toString() {
    return "ScopedTagFilter" + byKnowledgeBase;
  }
}
