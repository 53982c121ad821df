package com.z254.noc.domain.error;

/**
 * Raised when an event or an analysis request is malformed.
 */
public class InvalidInputException extends NocException {

    public InvalidInputException(String message) {
        super(ErrorKind.INVALID_INPUT, message);
    }
}
