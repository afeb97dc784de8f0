package com.example.datalake.kbsearch.dao;

import com.example.datalake.kbsearch.filter.ScopedTagFilter;
import com.example.datalake.kbsearch.model.ChunkRow;
import com.example.datalake.kbsearch.model.TagSlot;
import com.pgvector.PGvector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.support.AbstractSqlTypeValue;
import org.springframework.stereotype.Repository;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * pgvector-backed {@link ChunkSearchDao}. Chunks live in {@code embedding}, joined to
 * {@code document} for the eligibility rule. Distances use the cosine operator {@code <=>}.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcChunkSearchDao implements ChunkSearchDao {

    static final String ELIGIBLE = """
            e.enabled = TRUE
              AND d.deleted_at IS NULL
              AND d.enabled = TRUE
              AND d.processing_status = 'completed'
            """;

    private static final String TAG_COLUMNS = Arrays.stream(TagSlot.values())
            .map(slot -> "e." + slot.key())
            .collect(Collectors.joining(", "));

    private static final String CHUNK_COLUMNS =
            "e.id, e.knowledge_base_id, e.document_id, e.chunk_index, e.content, " + TAG_COLUMNS;

    private final NamedParameterJdbcTemplate jdbcTemplate;

    @Override
    public List<ChunkRow> findByTags(ScopedTagFilter filter, int limit) {
        if (filter.isEmpty()) {
            return List.of();
        }
        MapSqlParameterSource params = new MapSqlParameterSource();
        StringBuilder sql = new StringBuilder("SELECT ").append(CHUNK_COLUMNS).append("""

                FROM embedding e
                JOIN document d ON d.id = e.document_id
                WHERE """).append(' ').append(ELIGIBLE);

        appendTagFilter(sql, filter, params);

        sql.append(" LIMIT :limit");
        params.addValue("limit", limit);

        log.debug("Tag query over {} knowledge base(s), {} predicate(s), limit {}",
                filter.knowledgeBaseIds().size(), filter.predicateCount(), limit);
        return jdbcTemplate.query(sql.toString(), params, chunkRowMapper(false));
    }

    @Override
    public List<String> findIdsByTags(ScopedTagFilter filter) {
        if (filter.isEmpty()) {
            return List.of();
        }
        MapSqlParameterSource params = new MapSqlParameterSource();
        StringBuilder sql = new StringBuilder("""
                SELECT e.id
                FROM embedding e
                JOIN document d ON d.id = e.document_id
                WHERE """).append(' ').append(ELIGIBLE);

        appendTagFilter(sql, filter, params);

        return jdbcTemplate.query(sql.toString(), params, (rs, rowNum) -> rs.getString("id"));
    }

    @Override
    public List<ChunkRow> findNearest(List<String> knowledgeBaseIds,
                                      float[] queryVector,
                                      double distanceThreshold,
                                      int limit,
                                      Collection<String> candidateIds) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        StringBuilder sql = new StringBuilder("SELECT ").append(CHUNK_COLUMNS).append("""
                , e.embedding <=> :queryVector AS distance
                FROM embedding e
                JOIN document d ON d.id = e.document_id
                WHERE e.knowledge_base_id IN (:kbIds)
                  AND """).append(' ').append(ELIGIBLE);
        params.addValue("kbIds", knowledgeBaseIds);
        params.addValue("queryVector", new PGvector(queryVector));

        if (candidateIds != null) {
            sql.append(" AND e.id = ANY(:candidateIds)");
            params.addValue("candidateIds", textArray(candidateIds), Types.ARRAY);
        }

        sql.append(" AND (e.embedding <=> :queryVector) < :threshold");
        params.addValue("threshold", distanceThreshold);

        sql.append(" ORDER BY e.embedding <=> :queryVector ASC LIMIT :limit");
        params.addValue("limit", limit);

        log.debug("Vector query over {} knowledge base(s), threshold {}, limit {}, candidates {}",
                knowledgeBaseIds.size(), distanceThreshold, limit,
                candidateIds == null ? "all" : candidateIds.size());
        return jdbcTemplate.query(sql.toString(), params, chunkRowMapper(true));
    }

    private static void appendTagFilter(StringBuilder sql, ScopedTagFilter filter, MapSqlParameterSource params) {
        sql.append(" AND (").append(new TagPredicateSqlRenderer("e", "tag").render(filter, params)).append(")");
    }

    private static AbstractSqlTypeValue textArray(Collection<String> values) {
        Object[] elements = values.toArray();
        return new AbstractSqlTypeValue() {
            @Override
            protected Object createTypeValue(Connection con, int sqlType, String typeName) throws SQLException {
                return con.createArrayOf("text", elements);
            }
        };
    }

    static RowMapper<ChunkRow> chunkRowMapper(boolean ranked) {
        return (rs, rowNum) -> new ChunkRow(
                rs.getString("id"),
                rs.getString("knowledge_base_id"),
                rs.getString("document_id"),
                rs.getInt("chunk_index"),
                rs.getString("content"),
                readTags(rs),
                ranked ? rs.getDouble("distance") : 0d);
    }

    private static Map<TagSlot, Object> readTags(ResultSet rs) throws SQLException {
        Map<TagSlot, Object> tags = new EnumMap<>(TagSlot.class);
        for (TagSlot slot : TagSlot.values()) {
            Object value = switch (slot.fieldType()) {
                case TEXT -> rs.getString(slot.key());
                case NUMBER -> {
                    double d = rs.getDouble(slot.key());
                    yield rs.wasNull() ? null : d;
                }
                case DATE -> {
                    Timestamp ts = rs.getTimestamp(slot.key());
                    yield ts == null ? null : ts.toLocalDateTime().toLocalDate();
                }
                case BOOLEAN -> {
                    boolean b = rs.getBoolean(slot.key());
                    yield rs.wasNull() ? null : b;
                }
            };
            if (value != null) {
                tags.put(slot, value);
            }
        }
        return tags;
    }
}
