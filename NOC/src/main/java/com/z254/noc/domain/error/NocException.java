package com.z254.noc.domain.error;

import lombok.Getter;

/**
 * Base exception for pipeline failures, tagged with an {@link ErrorKind}.
 */
@Getter
public class NocException extends RuntimeException {

    private final ErrorKind kind;

    public NocException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public NocException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static NocException upstreamUnavailable(String message, Throwable cause) {
        return new NocException(ErrorKind.UPSTREAM_UNAVAILABLE, message, cause);
    }

    public static NocException decisionUnavailable(String message, Throwable cause) {
        return new NocException(ErrorKind.DECISION_UNAVAILABLE, message, cause);
    }
}
