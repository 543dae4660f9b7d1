package io.sendflow.core;

public enum MessageStatus {
    SENT,
    FAILED
}
