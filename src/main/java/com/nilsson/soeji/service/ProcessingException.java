package com.nilsson.soeji.service;

/**
 An ingestion could not be completed. The error code tells which step failed.
 */
public class ProcessingException extends Exception {

    public enum ErrorCode {
        NOT_PNG,
        STORAGE_FAILED,
        PERSISTENCE_FAILED,
        DERIVATIVE_FAILED,
        INDEX_FAILED,
        TAG_CONFLICT
    }

    private final ErrorCode code;

    public ProcessingException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ProcessingException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
