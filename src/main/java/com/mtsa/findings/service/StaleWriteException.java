package com.mtsa.findings.service;

public class StaleWriteException extends RuntimeException {

    private final String combinationHash;

    public StaleWriteException(String combinationHash, String message) {
        super(message);
        this.combinationHash = combinationHash;
    }

    public StaleWriteException(String combinationHash, String message, Throwable cause) {
        super(message, cause);
        this.combinationHash = combinationHash;
    }

    public String getCombinationHash() {
        return combinationHash;
    }
}
