package io.sendflow.core;

public enum TargetType {
    INDIVIDUAL,
    GROUP
}
