package com.mtsa.findings.service;

public class ThrottledException extends GeneratorException {
    /**
     * Creates an exception describing a throttled upstream call.
     */
    public ThrottledException(String m) { super(Reason.RATE_LIMITED, m); }
    /**
     * Creates an exception that preserves the originating cause.
     */
    public ThrottledException(String m, Throwable c) { super(Reason.RATE_LIMITED, m, c); }
}
