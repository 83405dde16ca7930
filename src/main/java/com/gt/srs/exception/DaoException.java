package com.gt.srs.exception;

// Unchecked wrapper for data access failures. Callers on the async persistence path see it as the failure cause.
public class DaoException extends RuntimeException {

    public DaoException(String errMsg, Throwable cause) {
        super(errMsg, cause);
    }
}
