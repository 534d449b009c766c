package com.pagerwatch.core.error;

/**
 * The decoder stream ended or failed after startup. Restarting is left to the process supervisor.
 */
public class IngestionLostException extends RuntimeException {
    private final long linesRead;

    public IngestionLostException(String message, long linesRead, Throwable cause) {
        super(message, cause);
        this.linesRead = linesRead;
    }

    public long linesRead() {
        return linesRead;
    }
}
