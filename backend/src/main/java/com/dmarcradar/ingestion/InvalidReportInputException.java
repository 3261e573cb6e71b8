package com.dmarcradar.ingestion;

/**
 * Uploaded report cannot be used: empty or corrupt buffer, unsupported file type, empty archive, or bytes
 * that are not XML. Always user-facing (API maps it to 400 INVALID_REPORT); never retried.
 */
public class InvalidReportInputException extends RuntimeException {

    public InvalidReportInputException(String message) {
        super(message);
    }

    public InvalidReportInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
