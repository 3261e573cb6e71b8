package com.dmarcradar.classification.sender;

import lombok.Getter;

/**
 * Thrown by ThirdPartySenderService. API layer maps SENDER_NOT_FOUND to 404 and INVALID_PATTERN to 400.
 */
@Getter
public class ThirdPartySenderException extends RuntimeException {

    public static final String SENDER_NOT_FOUND = "SENDER_NOT_FOUND";
    public static final String INVALID_PATTERN = "INVALID_PATTERN";

    private final String errorCode;

    public ThirdPartySenderException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
