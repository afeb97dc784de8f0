package com.example.datalake.kbsearch.dao;

import com.example.datalake.kbsearch.filter.CompiledTagFilter;
import com.example.datalake.kbsearch.filter.ScopedTagFilter;
import com.example.datalake.kbsearch.filter.TagPredicate;
import com.example.datalake.kbsearch.model.TagSlot;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

/**
 * Lowers a {@link CompiledTagFilter} into a PostgreSQL boolean expression over the chunk table.
 * Column names come from {@link TagSlot} keys; every value is bound as a named parameter.
 */
final class TagPredicateSqlRenderer {

    private final String alias;
    private final String paramPrefix;
    private int counter;

    TagPredicateSqlRenderer(String alias, String paramPrefix) {
        this.alias = alias;
        this.paramPrefix = paramPrefix;
    }

    /**
     * Each distinct filter applies only to the knowledge bases it was compiled for:
     * {@code (kb IN (:kb0) AND (a OR b)) OR (kb IN (:kb1) AND (c))}.
     *
     * @return the expression, or {@code FALSE} when no knowledge base is in scope
     */
    String render(ScopedTagFilter filter, MapSqlParameterSource params) {
        if (filter == null || filter.isEmpty()) {
            return "FALSE";
        }
        List<String> scopes = new ArrayList<>();
        for (Map.Entry<CompiledTagFilter, List<String>> entry : filter.knowledgeBasesByFilter().entrySet()) {
            String kbParam = "kb" + scopes.size();
            params.addValue(kbParam, entry.getValue());
            String scope = alias + ".knowledge_base_id IN (:" + kbParam + ")";
            String predicate = render(entry.getKey(), params);
            scopes.add(predicate.isEmpty() ? "(" + scope + ")" : "(" + scope + " AND " + predicate + ")");
        }
        return String.join(" OR ", scopes);
    }

    /**
     * @return {@code (a OR b) AND (c)} style expression, or an empty string for an empty filter
     */
    String render(CompiledTagFilter filter, MapSqlParameterSource params) {
        if (filter == null || filter.isEmpty()) {
            return "";
        }
        List<String> groups = new ArrayList<>();
        for (Map.Entry<TagSlot, List<TagPredicate>> entry : filter.groups().entrySet()) {
            List<String> alternatives = new ArrayList<>();
            for (TagPredicate predicate : entry.getValue()) {
                alternatives.add(renderPredicate(predicate, params));
            }
            groups.add("(" + String.join(" OR ", alternatives) + ")");
        }
        return String.join(" AND ", groups);
    }

    private String renderPredicate(TagPredicate predicate, MapSqlParameterSource params) {
        String column = alias + "." + predicate.slot().key();
        switch (predicate.slot().fieldType()) {
            case TEXT:
                return renderText(column, predicate, params);
            case NUMBER:
                return renderComparable(column, predicate, params);
            case DATE:
                return renderComparable("CAST(" + column + " AS DATE)", predicate, params);
            case BOOLEAN:
                return renderBoolean(column, predicate, params);
            default:
                throw new IllegalStateException("Unhandled field type " + predicate.slot().fieldType());
        }
    }

    private String renderText(String column, TagPredicate predicate, MapSqlParameterSource params) {
        String value = predicate.value().toString();
        switch (predicate.operator()) {
            case EQ:
                return "LOWER(" + column + ") = LOWER(:" + bind(params, value) + ")";
            case NEQ:
                return "LOWER(" + column + ") <> LOWER(:" + bind(params, value) + ")";
            case CONTAINS:
                return column + " ILIKE :" + bind(params, "%" + escapeLike(value) + "%");
            case NOT_CONTAINS:
                return column + " NOT ILIKE :" + bind(params, "%" + escapeLike(value) + "%");
            case STARTS_WITH:
                return column + " ILIKE :" + bind(params, escapeLike(value) + "%");
            case ENDS_WITH:
                return column + " ILIKE :" + bind(params, "%" + escapeLike(value));
            default:
                throw new IllegalStateException("Unsupported text operator " + predicate.operator());
        }
    }

    private String renderComparable(String column, TagPredicate predicate, MapSqlParameterSource params) {
        switch (predicate.operator()) {
            case EQ:
                return column + " = :" + bind(params, predicate.value());
            case NEQ:
                return column + " <> :" + bind(params, predicate.value());
            case GT:
                return column + " > :" + bind(params, predicate.value());
            case GTE:
                return column + " >= :" + bind(params, predicate.value());
            case LT:
                return column + " < :" + bind(params, predicate.value());
            case LTE:
                return column + " <= :" + bind(params, predicate.value());
            case BETWEEN:
                return column + " BETWEEN :" + bind(params, predicate.value())
                        + " AND :" + bind(params, predicate.valueTo());
            default:
                throw new IllegalStateException("Unsupported comparison operator " + predicate.operator());
        }
    }

    private String renderBoolean(String column, TagPredicate predicate, MapSqlParameterSource params) {
        switch (predicate.operator()) {
            case EQ:
                return column + " = :" + bind(params, predicate.value());
            case NEQ:
                return column + " <> :" + bind(params, predicate.value());
            default:
                throw new IllegalStateException("Unsupported boolean operator " + predicate.operator());
        }
    }

    private String bind(MapSqlParameterSource params, Object value) {
        String name = paramPrefix + counter++;
        params.addValue(name, value);
        return name;
    }

    static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
