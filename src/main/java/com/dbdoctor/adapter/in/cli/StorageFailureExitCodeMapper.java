package com.dbdoctor.adapter.in.cli;

import org.springframework.boot.ExitCodeExceptionMapper;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Maps startup failures to process exit codes: 2 for storage failures, 1 for anything else.
 */
@Component
public class StorageFailureExitCodeMapper implements ExitCodeExceptionMapper {

    static final int STORAGE_FAILURE = 2;

    @Override
    public int getExitCode(Throwable exception) {
        Throwable current = exception;
        while (current != null) {
            if (current instanceof DataAccessException) {
                return STORAGE_FAILURE;
            }
            current = current.getCause();
        }
        return 1;
    }
}
