package com.dbdoctor.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Snapshot of one detection pass: offending records grouped by table, tables in detection order,
 * records ordered by uid. Never updated; the next pass produces a new set.
 */
public final class FindingSet {

    private static final FindingSet EMPTY = new FindingSet(Map.of());

    private final Map<String, List<InconsistentRecord>> recordsByTable;

    private FindingSet(Map<String, List<InconsistentRecord>> recordsByTable) {
        this.recordsByTable = recordsByTable;
    }

    public static FindingSet empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return recordsByTable.isEmpty();
    }

    public Set<String> tables() {
        return recordsByTable.keySet();
    }

    public List<InconsistentRecord> records(String table) {
        return recordsByTable.getOrDefault(table, List.of());
    }

    public List<Integer> uids(String table) {
        return records(table).stream().map(InconsistentRecord::uid).toList();
    }

    public boolean contains(String table, int uid) {
        return records(table).stream().anyMatch(record -> record.uid() == uid);
    }

    public int tableCount() {
        return recordsByTable.size();
    }

    public int recordCount() {
        return recordsByTable.values().stream().mapToInt(List::size).sum();
    }

    /**
     * Records grouped by the page they live on, ordered by page uid.
     */
    public Map<Integer, List<InconsistentRecord>> recordsByPage() {
        return recordsByTable.values().stream()
            .flatMap(List::stream)
            .collect(Collectors.groupingBy(InconsistentRecord::pid, TreeMap::new, Collectors.toList()));
    }

    @Override
    public String toString() {
        return recordsByTable.entrySet().stream()
            .map(entry -> entry.getKey() + "=" + entry.getValue().size())
            .collect(Collectors.joining(", ", "FindingSet{", "}"));
    }

    public static final class Builder {

        private final Map<String, Map<Integer, InconsistentRecord>> records = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder add(InconsistentRecord record) {
            records.computeIfAbsent(record.table(), table -> new TreeMap<>()).put(record.uid(), record);
            return this;
        }

        public FindingSet build() {
            if (records.isEmpty()) {
                return EMPTY;
            }
            Map<String, List<InconsistentRecord>> byTable = new LinkedHashMap<>();
            records.forEach((table, rows) -> {
                List<InconsistentRecord> sorted = new ArrayList<>(rows.values());
                sorted.sort(Comparator.comparingInt(InconsistentRecord::uid));
                byTable.put(table, Collections.unmodifiableList(sorted));
            });
            return new FindingSet(Collections.unmodifiableMap(byTable));
        }
    }
}
