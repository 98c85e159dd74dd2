package org.example.analyzer.model;

public enum PassStatus {
    NOT_STARTED,
    IN_PROGRESS,
    DONE,
    FAILED
}
