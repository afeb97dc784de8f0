package com.example.datalake.kbsearch.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

/**
 * A user-facing tag filter. {@code value} and {@code valueTo} arrive as JSON strings, numbers or
 * booleans; their type is checked against the tag catalog during compilation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true, fluent = false)
public class TagFilterRequest {
  private String tagName;
  private String fieldType;
  private String operator;
  private Object value;
  private Object valueTo;
}
