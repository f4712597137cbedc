package fr.lapetina.genericclient.infrastructure.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Per-request options: headers, query parameters, body and timeout override.
 * Immutable.
 */
public final class RequestOptions {

    public static final RequestOptions NONE = builder().build();

    private final Map<String, String> headers;
    private final Map<String, String> queryParams;
    private final byte[] body;
    private final Duration timeout;

    private RequestOptions(Builder builder) {
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.queryParams = Collections.unmodifiableMap(new LinkedHashMap<>(builder.queryParams));
        this.body = builder.body;
        this.timeout = builder.timeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RequestOptions none() {
        return NONE;
    }

    public Map<String, String> headers() {
        return headers;
    }

    public Map<String, String> queryParams() {
        return queryParams;
    }

    /**
     * @return The body, or null when the request has none
     */
    public byte[] body() {
        return body;
    }

    /**
     * @return Per-request timeout, or null to use the client's
     */
    public Duration timeout() {
        return timeout;
    }

    /**
     * Appends the query string, if any, to a URL.
     */
    public String applyQuery(String url) {
        if (queryParams.isEmpty()) {
            return url;
        }
        String query = queryParams.entrySet().stream()
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));
        return url + (url.contains("?") ? "&" : "?") + query;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    public static final class Builder {
        // Insertion order keeps query strings predictable
        private final Map<String, String> headers = new LinkedHashMap<>();
        private final Map<String, String> queryParams = new LinkedHashMap<>();
        private byte[] body;
        private Duration timeout;

        private Builder() {
        }

        public Builder header(String name, String value) {
            headers.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder queryParam(String name, Object value) {
            queryParams.put(Objects.requireNonNull(name, "name"), String.valueOf(value));
            return this;
        }

        public Builder body(byte[] body) {
            this.body = body;
            return this;
        }

        public Builder body(String body) {
            this.body = body != null ? body.getBytes(StandardCharsets.UTF_8) : null;
            return this;
        }

        /**
         * Serializes the value as JSON and sets the content type.
         */
        public Builder json(Object value) {
            return json(value, JsonSupport.defaultMapper());
        }

        public Builder json(Object value, ObjectMapper mapper) {
            try {
                this.body = mapper.writeValueAsBytes(value);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("Failed to serialize request body: " + e.getOriginalMessage(), e);
            }
            headers.putIfAbsent("Content-Type", "application/json");
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public RequestOptions build() {
            return new RequestOptions(this);
        }
    }
}
