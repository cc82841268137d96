package com.mtsa.findings.service;

import com.mtsa.findings.model.CombinationKey;

/**
 * Live generation for a combination did not produce a usable record. Nothing was stored.
 */
public class GenerationFailedException extends RuntimeException {

    private final transient CombinationKey key;

    public GenerationFailedException(CombinationKey key, String message) {
        super(message);
        this.key = key;
    }

    public GenerationFailedException(CombinationKey key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    public CombinationKey getKey() {
        return key;
    }
}
