package io.pulse4j.core;

public enum BackoffType {
    FIXED,
    EXPONENTIAL
}
