package com.commerce.diagnostics.query;

public class QueryTimeoutException extends DataFetchException {

    public QueryTimeoutException(String message) {
        super(message);
    }

    public QueryTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
