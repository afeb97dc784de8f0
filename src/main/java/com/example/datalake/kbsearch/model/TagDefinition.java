package com.example.datalake.kbsearch.model;

import java.util.Objects;

/** One tag catalog entry: a user-facing name bound to a typed slot of one knowledge base. */
public record TagDefinition(TagSlot tagSlot, String displayName, TagFieldType fieldType) {

  public TagDefinition {
    Objects.requireNonNull(tagSlot, "tagSlot");
    Objects.requireNonNull(displayName, "displayName");
    fieldType = fieldType == null ? tagSlot.fieldType() : fieldType;
  }
}
