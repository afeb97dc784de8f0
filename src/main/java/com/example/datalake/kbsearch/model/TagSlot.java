package com.example.datalake.kbsearch.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Fixed-width typed tag columns on a chunk: 7 text, 5 number, 2 date and 3 boolean slots.
 * What a slot means is decided per knowledge base by its tag catalog.
 */
public enum TagSlot {
  TAG1("tag1", TagFieldType.TEXT),
  TAG2("tag2", TagFieldType.TEXT),
  TAG3("tag3", TagFieldType.TEXT),
  TAG4("tag4", TagFieldType.TEXT),
  TAG5("tag5", TagFieldType.TEXT),
  TAG6("tag6", TagFieldType.TEXT),
  TAG7("tag7", TagFieldType.TEXT),
  NUMBER1("number1", TagFieldType.NUMBER),
  NUMBER2("number2", TagFieldType.NUMBER),
  NUMBER3("number3", TagFieldType.NUMBER),
  NUMBER4("number4", TagFieldType.NUMBER),
  NUMBER5("number5", TagFieldType.NUMBER),
  DATE1("date1", TagFieldType.DATE),
  DATE2("date2", TagFieldType.DATE),
  BOOLEAN1("boolean1", TagFieldType.BOOLEAN),
  BOOLEAN2("boolean2", TagFieldType.BOOLEAN),
  BOOLEAN3("boolean3", TagFieldType.BOOLEAN);

  private final String key;
  private final TagFieldType fieldType;

  TagSlot(String key, TagFieldType fieldType) {
    this.key = key;
    this.fieldType = fieldType;
  }

  /** Column name on the chunk table, also the raw metadata key. */
  public String key() {
    return key;
  }

  public TagFieldType fieldType() {
    return fieldType;
  }

  public static Optional<TagSlot> fromKey(String key) {
    if (key == null || key.isBlank()) {
      return Optional.empty();
    }
    String normalized = key.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values()).filter(slot -> slot.key.equals(normalized)).findFirst();
  }
}
