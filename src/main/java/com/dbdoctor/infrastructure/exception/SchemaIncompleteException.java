package com.dbdoctor.infrastructure.exception;

import com.dbdoctor.domain.error.CheckError;
import com.dbdoctor.domain.schema.CtrlRole;

public class SchemaIncompleteException extends DbDoctorException {

    private final transient CheckError.SchemaIncomplete error;

    public SchemaIncompleteException(String table, CtrlRole role) {
        this(new CheckError.SchemaIncomplete(table, role));
    }

    private SchemaIncompleteException(CheckError.SchemaIncomplete error) {
        super(error.code(), error.message());
        this.error = error;
    }

    public CheckError.SchemaIncomplete getError() {
        return error;
    }
}
