package com.example.policy.analyzer.service;

import lombok.Getter;

@Getter
public class LlmCallException extends Exception {

    private final int statusCode;
    private final boolean transientFailure;

    public LlmCallException(String message, int statusCode, boolean transientFailure) {
        super(message);
        this.statusCode = statusCode;
        this.transientFailure = transientFailure;
    }
}
