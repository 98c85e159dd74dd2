package org.example.analyzer.service.analysis;

/**
 * A stored checkpoint exists but cannot be read back.
 */
public class CorruptCheckpointException extends RuntimeException {

    public CorruptCheckpointException(String message, Throwable cause) {
        super(message, cause);
    }
}
