package com.mtsa.findings.model;

public enum ValidationStatus {

    VALID,
    /** Usable, but returned with a degraded-quality flag. */
    PARTIAL,
    /** Never returned to callers. */
    INVALID;

    public boolean isUsable() {
        return this != INVALID;
    }
}
