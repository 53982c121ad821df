package com.z254.noc.domain.error;

import lombok.Value;

/**
 * Error attached to a result at the point where a stage degraded.
 */
@Value
public class StageError {

    ErrorKind kind;
    String message;

    public static StageError of(ErrorKind kind, String message) {
        return new StageError(kind, message);
    }

    /**
     * Build from a throwable, keeping the kind of a {@link NocException}.
     */
    public static StageError of(ErrorKind fallbackKind, Throwable error) {
        if (error instanceof NocException nocException) {
            return new StageError(nocException.getKind(), describe(error));
        }
        return new StageError(fallbackKind, describe(error));
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
