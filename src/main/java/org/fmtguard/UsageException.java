package org.fmtguard;

import java.io.Serial;

/**
 * Thrown when the command line cannot be understood.
 */
public class UsageException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    public UsageException(String message) {
        super(message);
    }
}
