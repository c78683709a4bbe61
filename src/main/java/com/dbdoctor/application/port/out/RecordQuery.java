package com.dbdoctor.application.port.out;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Declarative read against one table: projected fields, AND-ed predicates, ordered by uid.
 *
 * <p>By default no restriction is applied, so soft-deleted rows are returned as well.
 * {@link Builder#withoutDeleted(String)} adds the soft-delete restriction for the given flag field.
 */
public record RecordQuery(
    String table,
    List<String> fields,
    List<Predicate> predicates,
    String deletedField
) {

    public RecordQuery {
        fields = List.copyOf(fields);
        predicates = List.copyOf(predicates);
    }

    public static Builder from(String table) {
        return new Builder(table);
    }

    public sealed interface Predicate {
        String field();

        record Equals(String field, Object value) implements Predicate {}

        record NotEquals(String field, Object value) implements Predicate {}

        record LessThan(String field, Object value) implements Predicate {}

        record GreaterThan(String field, Object value) implements Predicate {}

        record In(String field, Collection<?> values) implements Predicate {
            public In {
                values = List.copyOf(values);
            }
        }

        record NotIn(String field, Collection<?> values) implements Predicate {
            public NotIn {
                values = List.copyOf(values);
            }
        }
    }

    public static final class Builder {

        private final String table;
        private final List<String> fields = new ArrayList<>();
        private final List<Predicate> predicates = new ArrayList<>();
        private String deletedField;

        private Builder(String table) {
            this.table = table;
        }

        public Builder select(String... names) {
            fields.addAll(List.of(names));
            return this;
        }

        public Builder select(Collection<String> names) {
            fields.addAll(names);
            return this;
        }

        public Builder where(Predicate predicate) {
            predicates.add(predicate);
            return this;
        }

        public Builder eq(String field, Object value) {
            return where(new Predicate.Equals(field, value));
        }

        public Builder neq(String field, Object value) {
            return where(new Predicate.NotEquals(field, value));
        }

        public Builder lt(String field, Object value) {
            return where(new Predicate.LessThan(field, value));
        }

        public Builder gt(String field, Object value) {
            return where(new Predicate.GreaterThan(field, value));
        }

        public Builder in(String field, Collection<?> values) {
            return where(new Predicate.In(field, values));
        }

        public Builder notIn(String field, Collection<?> values) {
            return where(new Predicate.NotIn(field, values));
        }

        public Builder withoutDeleted(String deletedField) {
            this.deletedField = deletedField;
            return this;
        }

        public RecordQuery build() {
            if (fields.isEmpty()) {
                throw new IllegalStateException("A query on \"" + table + "\" needs at least one field");
            }
            return new RecordQuery(table, fields, predicates, deletedField);
        }
    }
}
