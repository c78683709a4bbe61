package com.dbdoctor.infrastructure.exception;

/**
 * Base class for exceptions that carry a stable error code.
 */
public abstract class DbDoctorException extends RuntimeException {

    private final String errorCode;

    protected DbDoctorException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
