package fr.lapetina.genericclient.infrastructure.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared Jackson setup for request bodies and response decoding.
 */
public final class JsonSupport {

    private static final ObjectMapper DEFAULT = create();

    private JsonSupport() {
        // Utility class
    }

    public static ObjectMapper create() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Process-wide mapper. Thread-safe once configured; do not reconfigure.
     */
    public static ObjectMapper defaultMapper() {
        return DEFAULT;
    }
}
