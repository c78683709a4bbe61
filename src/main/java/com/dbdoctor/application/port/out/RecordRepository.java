package com.dbdoctor.application.port.out;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Port for reading and repairing rows of catalog tables.
 * Rows are returned as column maps with case-insensitive keys.
 * Storage failures surface as Spring's {@code DataAccessException}.
 */
public interface RecordRepository {

    List<Map<String, Object>> find(RecordQuery query);

    /**
     * Same as {@link #find(RecordQuery)} but hands rows to the consumer one by one while they are fetched.
     */
    void stream(RecordQuery query, Consumer<Map<String, Object>> consumer);

    List<Map<String, Object>> findByUids(String table, Collection<String> fields, Collection<Integer> uids);

    /**
     * Returns the subset of the given uids that exist in the table, soft-deleted rows included.
     */
    Set<Integer> findExistingUids(String table, Collection<Integer> uids);

    /**
     * Hard-deletes the given rows. Returns the number of rows removed.
     */
    int deleteByUids(String table, Collection<Integer> uids);

    /**
     * Sets the given column values on the given rows. Returns the number of rows changed.
     */
    int updateByUids(String table, Map<String, Object> values, Collection<Integer> uids);
}
