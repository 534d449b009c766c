package com.pagerwatch.core.error;

import java.nio.file.Path;

/**
 * The capcode file could not be read at all. Fatal at startup; on reload the previous table stays active.
 */
public class CapcodeLoadException extends RuntimeException {
    private final transient Path source;

    public CapcodeLoadException(Path source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public Path source() {
        return source;
    }
}
