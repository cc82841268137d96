package com.mtsa.findings.service;

public class CombinationCollisionException extends RuntimeException {

    public CombinationCollisionException(String hash, String requested, String stored) {
        super("Hash " + hash + " maps to " + stored + " but " + requested + " was requested");
    }
}
