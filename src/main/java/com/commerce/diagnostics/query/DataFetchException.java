package com.commerce.diagnostics.query;

/**
 * A tenant query failed or could not be issued. Fatal to the current run.
 */
public class DataFetchException extends RuntimeException {

    public DataFetchException(String message) {
        super(message);
    }

    public DataFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
