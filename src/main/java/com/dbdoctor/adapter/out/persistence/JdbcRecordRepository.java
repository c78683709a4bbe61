package com.dbdoctor.adapter.out.persistence;

import com.dbdoctor.application.port.out.RecordQuery;
import com.dbdoctor.application.port.out.RecordQuery.Predicate;
import com.dbdoctor.application.port.out.RecordRepository;
import com.dbdoctor.infrastructure.config.DbDoctorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.ColumnMapRowMapper;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

@Repository
public class JdbcRecordRepository implements RecordRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcRecordRepository.class);

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    // Lower-cased keys in a case-insensitive map, whatever case the driver reports
    private static final ColumnMapRowMapper ROW_MAPPER = new ColumnMapRowMapper() {
        @Override
        protected String getColumnKey(String columnName) {
            return columnName.toLowerCase(Locale.ROOT);
        }
    };

    private final NamedParameterJdbcTemplate jdbc;
    private final int chunkSize;

    public JdbcRecordRepository(NamedParameterJdbcTemplate jdbc, DbDoctorProperties properties) {
        this.jdbc = jdbc;
        this.chunkSize = Math.max(1, properties.getQuery().getChunkSize());
    }

    @Override
    public List<Map<String, Object>> find(RecordQuery query) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        String sql = toSelect(query, params);
        log.debug("Executing {}", sql);
        return jdbc.query(sql, params, ROW_MAPPER);
    }

    @Override
    @Transactional(readOnly = true)
    public void stream(RecordQuery query, Consumer<Map<String, Object>> consumer) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        String sql = toSelect(query, params);
        log.debug("Streaming {}", sql);
        RowCallbackHandler handler = rs -> consumer.accept(ROW_MAPPER.mapRow(rs, rs.getRow()));
        jdbc.query(sql, params, handler);
    }

    @Override
    public List<Map<String, Object>> findByUids(String table, Collection<String> fields, Collection<Integer> uids) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (List<Integer> chunk : chunks(uids)) {
            rows.addAll(find(RecordQuery.from(table).select(fields).in("uid", chunk).build()));
        }
        return rows;
    }

    @Override
    public Set<Integer> findExistingUids(String table, Collection<Integer> uids) {
        String sql = "SELECT uid FROM " + identifier(table) + " WHERE uid IN (:uids)";
        Set<Integer> existing = new LinkedHashSet<>();
        for (List<Integer> chunk : chunks(uids)) {
            existing.addAll(jdbc.queryForList(sql, new MapSqlParameterSource("uids", chunk), Integer.class));
        }
        return existing;
    }

    @Override
    @Transactional
    public int deleteByUids(String table, Collection<Integer> uids) {
        String sql = "DELETE FROM " + identifier(table) + " WHERE uid IN (:uids)";
        int deleted = 0;
        for (List<Integer> chunk : chunks(uids)) {
            deleted += jdbc.update(sql, new MapSqlParameterSource("uids", chunk));
        }
        log.debug("Deleted {} rows from {}", deleted, table);
        return deleted;
    }

    @Override
    @Transactional
    public int updateByUids(String table, Map<String, Object> values, Collection<Integer> uids) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Nothing to update in \"" + table + "\"");
        }
        MapSqlParameterSource params = new MapSqlParameterSource();
        List<String> assignments = new ArrayList<>();
        int index = 0;
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            String name = "v" + index++;
            assignments.add(identifier(entry.getKey()) + " = :" + name);
            params.addValue(name, entry.getValue());
        }
        String sql = "UPDATE " + identifier(table) + " SET " + String.join(", ", assignments)
            + " WHERE uid IN (:uids)";
        int updated = 0;
        for (List<Integer> chunk : chunks(uids)) {
            params.addValue("uids", chunk);
            updated += jdbc.update(sql, params);
        }
        log.debug("Updated {} rows in {}", updated, table);
        return updated;
    }

    String toSelect(RecordQuery query, MapSqlParameterSource params) {
        String columns = query.fields().stream()
            .map(JdbcRecordRepository::identifier)
            .collect(Collectors.joining(", "));
        List<String> conditions = new ArrayList<>();
        for (Predicate predicate : query.predicates()) {
            conditions.add(toCondition(predicate, "p" + conditions.size(), params));
        }
        if (query.deletedField() != null) {
            conditions.add(identifier(query.deletedField()) + " = 0");
        }
        StringBuilder sql = new StringBuilder("SELECT ").append(columns)
            .append(" FROM ").append(identifier(query.table()));
        if (!conditions.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", conditions));
        }
        return sql.append(" ORDER BY uid").toString();
    }

    private static String toCondition(Predicate predicate, String name, MapSqlParameterSource params) {
        String field = identifier(predicate.field());
        if (predicate instanceof Predicate.Equals eq) {
            params.addValue(name, eq.value());
            return field + " = :" + name;
        }
        if (predicate instanceof Predicate.NotEquals neq) {
            params.addValue(name, neq.value());
            return field + " <> :" + name;
        }
        if (predicate instanceof Predicate.LessThan lt) {
            params.addValue(name, lt.value());
            return field + " < :" + name;
        }
        if (predicate instanceof Predicate.GreaterThan gt) {
            params.addValue(name, gt.value());
            return field + " > :" + name;
        }
        if (predicate instanceof Predicate.In in) {
            if (in.values().isEmpty()) {
                return "1 = 0";
            }
            params.addValue(name, in.values());
            return field + " IN (:" + name + ")";
        }
        if (predicate instanceof Predicate.NotIn notIn) {
            if (notIn.values().isEmpty()) {
                return "1 = 1";
            }
            params.addValue(name, notIn.values());
            return field + " NOT IN (:" + name + ")";
        }
        throw new IllegalArgumentException("Unsupported predicate: " + predicate);
    }

    private List<List<Integer>> chunks(Collection<Integer> uids) {
        List<Integer> all = new ArrayList<>(uids);
        List<List<Integer>> chunks = new ArrayList<>();
        for (int from = 0; from < all.size(); from += chunkSize) {
            chunks.add(all.subList(from, Math.min(all.size(), from + chunkSize)));
        }
        return chunks;
    }

    /**
     * Table and field names come from the catalog and end up verbatim in SQL.
     */
    static String identifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid SQL identifier: " + name);
        }
        return name;
    }
}
