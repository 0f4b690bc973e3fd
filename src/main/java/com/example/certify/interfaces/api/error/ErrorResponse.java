package com.example.certify.interfaces.api.error;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * Error payload returned by the certification API. {@code details} names the affected transcript
 * when the failure concerns one upload and is omitted otherwise.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        Instant timestamp,
        int status,
        String error,
        String message,
        String path,
        Map<String, String> details
) {

    public ErrorResponse {
        details = details == null || details.isEmpty() ? null : Map.copyOf(details);
    }

    public static ErrorResponse of(int status, String error, String message, String path) {
        return of(status, error, message, path, null);
    }

    /**
     * @param status  HTTP status code
     * @param error   stable error code, e.g. {@code TRANSCRIPT_UNUSABLE}
     * @param message human readable explanation
     * @param path    request path that produced the error
     * @param details extra attributes such as the transcript name, may be {@code null}
     * @return response stamped with the current time
     */
    public static ErrorResponse of(int status, String error, String message, String path, Map<String, String> details) {
        return new ErrorResponse(Instant.now(), status, error, message, path, details);
    }
}
