package com.example.plantreport.interfaces.api.error;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * JSON body returned when a report cannot be produced.
 * {@code details} carries machine-readable context, such as the measured heights of an image that does not
 * fit on a page, and is omitted when there is none.
 *
 * @param timestamp when the failure was reported
 * @param status    HTTP status code
 * @param error     stable error code, e.g. {@code IMAGE_TOO_TALL}
 * @param message   explanation the browser can show to the user
 * @param path      request path that failed
 * @param details   optional values the client can act on
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        Instant timestamp,
        int status,
        String error,
        String message,
        String path,
        Map<String, Object> details
) {

    public static ErrorResponse of(int status, String error, String message, String path) {
        return new ErrorResponse(Instant.now(), status, error, message, path, null);
    }

    /**
     * @param details values to expose, copied
     * @return same error with the given details attached
     */
    public ErrorResponse withDetails(Map<String, Object> details) {
        return new ErrorResponse(timestamp, status, error, message, path, Map.copyOf(details));
    }
}
