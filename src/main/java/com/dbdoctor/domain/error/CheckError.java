package com.dbdoctor.domain.error;

import com.dbdoctor.domain.schema.CtrlRole;

/**
 * Sealed type representing the expected reasons a health check could not be evaluated.
 * Storage failures are not modelled here: they terminate the whole run.
 */
public sealed interface CheckError {

    record SchemaIncomplete(String table, CtrlRole role) implements CheckError {
        @Override
        public String message() {
            return "Table \"" + table + "\" has no \"" + role.ctrlKey() + "\" configured in the schema catalog";
        }

        @Override
        public String code() {
            return "SCHEMA_INCOMPLETE";
        }
    }

    String message();

    String code();
}
