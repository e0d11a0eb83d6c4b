package io.pulse4j.core;

public enum JobEventType {
    START,
    SUCCESS,
    FAIL,
    RETRY,
    COMPLETE
}
