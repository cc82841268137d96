package com.mtsa.findings.service;

public class SchemaViolationException extends RuntimeException {

    public SchemaViolationException(String message) {
        super(message);
    }
}
