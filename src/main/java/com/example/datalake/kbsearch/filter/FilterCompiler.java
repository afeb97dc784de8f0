package com.example.datalake.kbsearch.filter;

import com.example.datalake.kbsearch.model.FilterOperator;
import com.example.datalake.kbsearch.model.TagDefinition;
import com.example.datalake.kbsearch.model.TagFieldType;
import com.example.datalake.kbsearch.request.TagFilterRequest;
import com.example.datalake.kbsearch.validation.ValidationError;
import com.example.datalake.kbsearch.validation.ValidationException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Compiles user-facing tag filters into a {@link CompiledTagFilter}.
 *
 * <p>Runs in three passes over the whole list:
 *
 * <ol>
 *   <li>resolve every tag name against the catalog; any unknown name fails compilation
 *   <li>check operator and value types per field type; any mismatch fails compilation
 *   <li>convert values into typed predicates; a value that still cannot be converted drops only
 *       its own predicate, and a bad {@code between} upper bound degrades to equality
 * </ol>
 *
 * <p>Over several knowledge bases the filters are compiled once per knowledge base against its
 * own catalog, because the same slot may carry a different tag in each of them.
 */
@Slf4j
@Component
public class FilterCompiler {

  private static final Pattern DATE_PATTERN = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");

  /**
   * Compiles {@code filters} for each knowledge base in {@code catalogs}, keyed by knowledge
   * base id in request order.
   *
   * <p>A tag name no catalog defines is an error. A knowledge base whose catalog lacks one of
   * the names cannot satisfy the filter and is left out of the scope. Type errors from any
   * knowledge base that stays in scope fail the whole request.
   *
   * @throws ValidationException with every undefined name or type error collected
   */
  public ScopedTagFilter compileForKnowledgeBases(
      List<TagFilterRequest> filters, Map<String, List<TagDefinition>> catalogs) {
    if (filters == null || filters.isEmpty()) {
      throw new IllegalArgumentException("filters must not be empty");
    }
    Map<String, Map<String, TagDefinition>> byKnowledgeBase = new LinkedHashMap<>();
    catalogs.forEach((kbId, definitions) -> byKnowledgeBase.put(kbId, byDisplayName(definitions)));

    List<ValidationError> undefined = new ArrayList<>();
    for (int i = 0; i < filters.size(); i++) {
      String tagName = trimToNull(filters.get(i).getTagName());
      boolean known = tagName != null
          && byKnowledgeBase.values().stream().anyMatch(catalog -> catalog.containsKey(tagName));
      if (!known) {
        undefined.add(undefinedTag(i, filters.get(i)));
      }
    }
    if (!undefined.isEmpty()) {
      throw new ValidationException(undefined);
    }

    Map<String, CompiledTagFilter> scoped = new LinkedHashMap<>();
    LinkedHashSet<ValidationError> errors = new LinkedHashSet<>();
    byKnowledgeBase.forEach((kbId, catalog) -> {
      List<String> missing = filters.stream()
          .map(filter -> filter.getTagName().trim())
          .filter(name -> !catalog.containsKey(name))
          .distinct()
          .toList();
      if (!missing.isEmpty()) {
        log.debug("Knowledge base {} does not define {}, excluded from the tag filter", kbId, missing);
        return;
      }
      FilterCompilation compilation = compile(filters, catalog);
      if (compilation.isValid()) {
        scoped.put(kbId, compilation.filter());
      } else {
        errors.addAll(compilation.errors());
      }
    });
    if (!errors.isEmpty()) {
      throw new ValidationException(List.copyOf(errors));
    }
    return ScopedTagFilter.of(scoped);
  }

  public FilterCompilation compile(List<TagFilterRequest> filters, Map<String, TagDefinition> catalog) {
    if (filters == null || filters.isEmpty()) {
      return new FilterCompilation(CompiledTagFilter.empty(), List.of(), List.of());
    }
    Map<String, TagDefinition> safeCatalog = catalog == null ? Map.of() : catalog;

    List<ValidationError> undefined = new ArrayList<>();
    List<TagDefinition> resolved = new ArrayList<>(filters.size());
    for (int i = 0; i < filters.size(); i++) {
      String tagName = trimToNull(filters.get(i).getTagName());
      TagDefinition definition = tagName == null ? null : safeCatalog.get(tagName);
      if (definition == null) {
        undefined.add(undefinedTag(i, filters.get(i)));
      }
      resolved.add(definition);
    }
    if (!undefined.isEmpty()) {
      return FilterCompilation.failed(undefined);
    }

    List<ValidationError> mismatches = new ArrayList<>();
    List<FilterOperator> operators = new ArrayList<>(filters.size());
    for (int i = 0; i < filters.size(); i++) {
      operators.add(checkTypes(i, filters.get(i), resolved.get(i), mismatches));
    }
    if (!mismatches.isEmpty()) {
      return FilterCompilation.failed(mismatches);
    }

    List<TagPredicate> predicates = new ArrayList<>(filters.size());
    List<String> dropped = new ArrayList<>();
    for (int i = 0; i < filters.size(); i++) {
      TagFilterRequest filter = filters.get(i);
      TagDefinition definition = resolved.get(i);
      Optional<TagPredicate> predicate = buildPredicate(definition, operators.get(i), filter);
      if (predicate.isPresent()) {
        predicates.add(predicate.get());
      } else {
        dropped.add(definition.displayName() + " " + operators.get(i).wireName() + " " + filter.getValue());
      }
    }
    if (!dropped.isEmpty()) {
      log.debug("Dropped {} unparsable tag predicate(s): {}", dropped.size(), dropped);
    }
    return new FilterCompilation(CompiledTagFilter.of(predicates), List.of(), dropped);
  }

  private static ValidationError undefinedTag(int index, TagFilterRequest filter) {
    return new ValidationError(field(index, "tagName"),
        "Tag \"" + filter.getTagName() + "\" is not defined for the selected knowledge bases");
  }

  private static Map<String, TagDefinition> byDisplayName(List<TagDefinition> definitions) {
    Map<String, TagDefinition> catalog = new LinkedHashMap<>();
    if (definitions != null) {
      for (TagDefinition definition : definitions) {
        catalog.putIfAbsent(definition.displayName(), definition);
      }
    }
    return catalog;
  }

  private FilterOperator checkTypes(
      int index, TagFilterRequest filter, TagDefinition definition, List<ValidationError> errors) {
    TagFieldType fieldType = definition.fieldType();

    String requestedType = trimToNull(filter.getFieldType());
    if (requestedType != null) {
      Optional<TagFieldType> parsed = TagFieldType.fromWire(requestedType);
      if (parsed.isEmpty()) {
        errors.add(new ValidationError(field(index, "fieldType"), "Unknown field type: " + requestedType));
      } else if (parsed.get() != fieldType) {
        errors.add(new ValidationError(field(index, "fieldType"),
            String.format("Tag \"%s\" is of type %s, not %s",
                definition.displayName(), fieldType.wireName(), parsed.get().wireName())));
      }
    }

    FilterOperator operator = FilterOperator.EQ;
    String requestedOperator = trimToNull(filter.getOperator());
    if (requestedOperator != null) {
      Optional<FilterOperator> parsed = FilterOperator.fromWire(requestedOperator);
      if (parsed.isEmpty()) {
        errors.add(new ValidationError(field(index, "operator"), "Unknown operator: " + requestedOperator));
      } else if (!fieldType.supports(parsed.get())) {
        errors.add(new ValidationError(field(index, "operator"),
            String.format("Operator %s is not supported for %s tags",
                parsed.get().wireName(), fieldType.wireName())));
      } else {
        operator = parsed.get();
      }
    }

    String problem = describeValueProblem(fieldType, filter.getValue());
    if (problem != null) {
      errors.add(new ValidationError(field(index, "value"),
          String.format("Tag \"%s\" %s", definition.displayName(), problem)));
    }
    return operator;
  }

  private static String describeValueProblem(TagFieldType fieldType, Object value) {
    switch (fieldType) {
      case TEXT:
        return value == null || value.toString().isBlank() ? "requires a non-empty text value" : null;
      case NUMBER:
        return parseNumber(value).isPresent() ? null : "requires a numeric value";
      case DATE:
        return value instanceof String text && DATE_PATTERN.matcher(text.trim()).matches()
            ? null
            : "requires a date in YYYY-MM-DD format";
      case BOOLEAN:
        return parseBoolean(value).isPresent() ? null : "requires true or false";
      default:
        throw new IllegalStateException("Unhandled field type " + fieldType);
    }
  }

  private Optional<TagPredicate> buildPredicate(
      TagDefinition definition, FilterOperator operator, TagFilterRequest filter) {
    Optional<Object> lower = convert(definition.fieldType(), filter.getValue());
    if (lower.isEmpty()) {
      return Optional.empty();
    }
    if (operator != FilterOperator.BETWEEN) {
      return Optional.of(new TagPredicate(definition.tagSlot(), operator, lower.get(), null));
    }

    Optional<Object> upper = filter.getValueTo() == null
        ? Optional.empty()
        : convert(definition.fieldType(), filter.getValueTo());
    if (upper.isEmpty()) {
      log.debug("Tag \"{}\" between has no usable upper bound, matching {} exactly",
          definition.displayName(), lower.get());
      return Optional.of(new TagPredicate(definition.tagSlot(), FilterOperator.EQ, lower.get(), null));
    }
    return Optional.of(new TagPredicate(definition.tagSlot(), operator, lower.get(), upper.get()));
  }

  private static Optional<Object> convert(TagFieldType fieldType, Object value) {
    switch (fieldType) {
      case TEXT:
        return value == null ? Optional.empty() : Optional.of(value.toString().trim());
      case NUMBER:
        return parseNumber(value).map(Object.class::cast);
      case DATE:
        return parseDate(value).map(Object.class::cast);
      case BOOLEAN:
        return parseBoolean(value).map(Object.class::cast);
      default:
        throw new IllegalStateException("Unhandled field type " + fieldType);
    }
  }

  static Optional<Double> parseNumber(Object value) {
    if (value instanceof Number number) {
      double d = number.doubleValue();
      return Double.isFinite(d) ? Optional.of(d) : Optional.empty();
    }
    if (value instanceof String text && !text.isBlank()) {
      try {
        double d = Double.parseDouble(text.trim());
        return Double.isFinite(d) ? Optional.of(d) : Optional.empty();
      } catch (NumberFormatException e) {
        return Optional.empty();
      }
    }
    return Optional.empty();
  }

  static Optional<LocalDate> parseDate(Object value) {
    if (!(value instanceof String text) || !DATE_PATTERN.matcher(text.trim()).matches()) {
      return Optional.empty();
    }
    try {
      return Optional.of(LocalDate.parse(text.trim()));
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }

  static Optional<Boolean> parseBoolean(Object value) {
    if (value instanceof Boolean bool) {
      return Optional.of(bool);
    }
    if (value instanceof String text) {
      String normalized = text.trim().toLowerCase(Locale.ROOT);
      if ("true".equals(normalized)) {
        return Optional.of(Boolean.TRUE);
      }
      if ("false".equals(normalized)) {
        return Optional.of(Boolean.FALSE);
      }
    }
    return Optional.empty();
  }

  private static String field(int index, String name) {
    return "tagFilters[" + index + "]." + name;
  }

  private static String trimToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
