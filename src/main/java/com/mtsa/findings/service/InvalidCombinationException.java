package com.mtsa.findings.service;

/**
 * Raised before any lookup when a tool, source or language is outside the catalog, or the source
 * set is empty.
 */
public class InvalidCombinationException extends RuntimeException {

    public InvalidCombinationException(String message) {
        super(message);
    }
}
