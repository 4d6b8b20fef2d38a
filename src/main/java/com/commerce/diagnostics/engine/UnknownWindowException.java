package com.commerce.diagnostics.engine;

public class UnknownWindowException extends IllegalArgumentException {

    public UnknownWindowException(String token) {
        super("Unknown window definition: " + token);
    }
}
