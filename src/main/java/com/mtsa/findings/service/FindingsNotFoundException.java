package com.mtsa.findings.service;

public class FindingsNotFoundException extends RuntimeException {

    public FindingsNotFoundException(String message) {
        super(message);
    }
}
