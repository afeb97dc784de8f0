package com.example.datalake.kbsearch.filter;

import com.example.datalake.kbsearch.model.TagSlot;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Predicates grouped by slot. Predicates inside one group are OR'd; groups are AND'd. Group
 * order follows the first appearance of each slot in the request.
 */
public final class CompiledTagFilter {

  private static final CompiledTagFilter EMPTY = new CompiledTagFilter(Map.of());

  private final Map<TagSlot, List<TagPredicate>> groups;

  private CompiledTagFilter(Map<TagSlot, List<TagPredicate>> groups) {
    this.groups = groups;
  }

  public static CompiledTagFilter empty() {
    return EMPTY;
  }

  public static CompiledTagFilter of(List<TagPredicate> predicates) {
    Map<TagSlot, List<TagPredicate>> grouped = new LinkedHashMap<>();
    for (TagPredicate predicate : predicates) {
      grouped.computeIfAbsent(predicate.slot(), slot -> new ArrayList<>()).add(predicate);
    }
    Map<TagSlot, List<TagPredicate>> frozen = new LinkedHashMap<>();
    grouped.forEach((slot, list) -> frozen.put(slot, List.copyOf(list)));
    return new CompiledTagFilter(Collections.unmodifiableMap(frozen));
  }

  public Map<TagSlot, List<TagPredicate>> groups() {
    return groups;
  }

  public boolean isEmpty() {
    return groups.isEmpty();
  }

  public int predicateCount() {
    return groups.values().stream().mapToInt(List::size).sum();
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof CompiledTagFilter other && groups.equals(other.groups));
  }

  @Override
  public int hashCode() {
    return groups.hashCode();
  }

  @Override
  public String toString() {
    return "CompiledTagFilter" + groups;
  }
}
