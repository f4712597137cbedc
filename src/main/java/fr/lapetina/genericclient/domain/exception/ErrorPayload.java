package fr.lapetina.genericclient.domain.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Structured application error decoded from a non-2xx response body,
 * i.e. {@code {"status": "error", "cls": "<tag>", ...}}.
 */
public record ErrorPayload(
        String tag,
        int httpStatus,
        String message,
        Map<String, Object> body
) {
    public ErrorPayload {
        Objects.requireNonNull(tag, "Error tag is required");
        // JSON bodies may hold null values
        body = body != null ? Collections.unmodifiableMap(new LinkedHashMap<>(body)) : Map.of();
    }
}
