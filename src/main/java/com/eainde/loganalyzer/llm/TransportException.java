package com.eainde.loganalyzer.llm;

/**
 * The model could not be reached, or every attempt timed out.
 */
public class TransportException extends RuntimeException {

    private final int attempts;

    public TransportException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
