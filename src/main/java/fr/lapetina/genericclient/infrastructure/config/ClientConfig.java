package fr.lapetina.genericclient.infrastructure.config;

import fr.lapetina.genericclient.domain.classify.ErrorClassifier;
import fr.lapetina.genericclient.domain.classify.StatusPatterns;
import fr.lapetina.genericclient.domain.exception.ConfigurationException;
import fr.lapetina.genericclient.domain.model.ErrorKind;
import fr.lapetina.genericclient.domain.retry.BackoffPolicy;
import fr.lapetina.genericclient.domain.retry.StopStrategy;
import fr.lapetina.genericclient.domain.retry.WaitStrategy;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Retry and timeout configuration of a client. Immutable once built.
 *
 * Can be built programmatically or from a plain key-value map (as produced by
 * YAML loading):
 * <pre>{@code
 * retryStatusPatterns: [5xx, 429]
 * retryableErrorKinds: [RESOLUTION]
 * retryOnConnectionError: true
 * timeout: 30            # seconds, or an ISO-8601 duration such as PT2.5S
 * backoff:
 *   wait: {type: exponential, multiplier: 1, max: 10}
 *   stop: {afterDelay: 30, afterAttempt: 5}
 * }</pre>
 */
public final class ClientConfig {

    public static final Set<String> DEFAULT_RETRY_STATUS_PATTERNS = Set.of("5xx");
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    /** Kinds added when {@code retryOnConnectionError} is on. */
    public static final Set<ErrorKind> CONNECTION_ERROR_KINDS = Set.of(ErrorKind.CONNECTION, ErrorKind.TIMEOUT);

    static final String RETRY_STATUS_PATTERNS = "retryStatusPatterns";
    static final String RETRYABLE_ERROR_KINDS = "retryableErrorKinds";
    static final String RETRYABLE_EXCEPTION_TYPES = "retryableExceptionTypes";
    static final String RETRY_ON_CONNECTION_ERROR = "retryOnConnectionError";
    static final String TIMEOUT = "timeout";
    static final String BACKOFF = "backoff";

    private static final Set<String> KNOWN_KEYS = Set.of(
            RETRY_STATUS_PATTERNS, RETRYABLE_ERROR_KINDS, RETRYABLE_EXCEPTION_TYPES,
            RETRY_ON_CONNECTION_ERROR, TIMEOUT, BACKOFF
    );

    private final Set<String> retryStatusPatterns;
    private final Set<ErrorKind> retryableErrorKinds;
    private final List<Class<? extends Throwable>> retryableExceptionTypes;
    private final boolean retryOnConnectionError;
    private final Duration timeout;
    private final BackoffPolicy backoff;

    private ClientConfig(Builder builder) {
        this.retryStatusPatterns = Set.copyOf(StatusPatterns.normalize(builder.retryStatusPatterns));
        this.retryableErrorKinds = Set.copyOf(builder.retryableErrorKinds);
        this.retryableExceptionTypes = List.copyOf(builder.retryableExceptionTypes);
        this.retryOnConnectionError = builder.retryOnConnectionError;
        this.timeout = Objects.requireNonNull(builder.timeout, "timeout");
        this.backoff = Objects.requireNonNull(builder.backoff, "backoff");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new ConfigurationException("timeout must be positive: " + timeout);
        }
    }

    /**
     * Default configuration: retry on 5xx and connection errors, 30s timeout,
     * exponential backoff for up to 30s.
     */
    public static ClientConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds a configuration from any accepted shape.
     *
     * @param source {@code null}, a {@code Map} of recognized keys, or a {@code ClientConfig}
     * @throws ConfigurationException for any other shape or an invalid map
     */
    public static ClientConfig from(Object source) {
        if (source == null) {
            return defaults();
        }
        if (source instanceof ClientConfig config) {
            return config;
        }
        if (source instanceof Map<?, ?> map) {
            return builder().apply(map).build();
        }
        throw new ConfigurationException("Config type " + source.getClass().getName()
                + " could not be recognized, use a Map or " + ClientConfig.class.getName());
    }

    public Set<String> getRetryStatusPatterns() {
        return retryStatusPatterns;
    }

    /**
     * Error kinds as configured, without the connection-error family.
     */
    public Set<ErrorKind> getRetryableErrorKinds() {
        return retryableErrorKinds;
    }

    /**
     * Error kinds that actually trigger a retry.
     */
    public Set<ErrorKind> getEffectiveErrorKinds() {
        EnumSet<ErrorKind> kinds = EnumSet.noneOf(ErrorKind.class);
        kinds.addAll(retryableErrorKinds);
        if (retryOnConnectionError) {
            kinds.addAll(CONNECTION_ERROR_KINDS);
        }
        return Set.copyOf(kinds);
    }

    public List<Class<? extends Throwable>> getRetryableExceptionTypes() {
        return retryableExceptionTypes;
    }

    public boolean isRetryOnConnectionError() {
        return retryOnConnectionError;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public BackoffPolicy getBackoff() {
        return backoff;
    }

    public ErrorClassifier toClassifier() {
        return new ErrorClassifier(retryStatusPatterns, getEffectiveErrorKinds(), retryableExceptionTypes);
    }

    public Builder toBuilder() {
        return new Builder()
                .retryStatusPatterns(retryStatusPatterns)
                .retryableErrorKinds(retryableErrorKinds)
                .retryableExceptionTypes(retryableExceptionTypes)
                .retryOnConnectionError(retryOnConnectionError)
                .timeout(timeout)
                .backoff(backoff);
    }

    /**
     * Returns a copy with the given map's keys applied on top of this configuration.
     */
    public ClientConfig withOverrides(Map<?, ?> overrides) {
        return toBuilder().apply(overrides).build();
    }

    @Override
    public String toString() {
        return "ClientConfig{" +
                "retryStatusPatterns=" + retryStatusPatterns +
                ", retryableErrorKinds=" + getEffectiveErrorKinds() +
                ", timeout=" + timeout +
                '}';
    }

    public static final class Builder {
        private Collection<?> retryStatusPatterns = DEFAULT_RETRY_STATUS_PATTERNS;
        private Set<ErrorKind> retryableErrorKinds = Set.of();
        private List<Class<? extends Throwable>> retryableExceptionTypes = List.of();
        private boolean retryOnConnectionError = true;
        private Duration timeout = DEFAULT_TIMEOUT;
        private BackoffPolicy backoff = BackoffPolicy.defaults();

        private Builder() {
        }

        /**
         * Status codes or families ({@code 503}, {@code "50x"}, {@code "5xx"}).
         */
        public Builder retryStatusPatterns(Collection<?> patterns) {
            this.retryStatusPatterns = StatusPatterns.normalize(patterns);
            return this;
        }

        public Builder retryStatusPatterns(Object... patterns) {
            return retryStatusPatterns(List.of(patterns));
        }

        public Builder retryableErrorKinds(Collection<ErrorKind> kinds) {
            this.retryableErrorKinds = Set.copyOf(kinds);
            return this;
        }

        public Builder retryableErrorKinds(ErrorKind... kinds) {
            return retryableErrorKinds(List.of(kinds));
        }

        public Builder retryableExceptionTypes(Collection<Class<? extends Throwable>> types) {
            this.retryableExceptionTypes = List.copyOf(types);
            return this;
        }

        public Builder retryOnConnectionError(boolean retryOnConnectionError) {
            this.retryOnConnectionError = retryOnConnectionError;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = Objects.requireNonNull(timeout, "timeout");
            return this;
        }

        public Builder backoff(BackoffPolicy backoff) {
            this.backoff = Objects.requireNonNull(backoff, "backoff");
            return this;
        }

        /**
         * Applies every key of a configuration map.
         *
         * @throws ConfigurationException on unknown keys or malformed values
         */
        public Builder apply(Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = String.valueOf(entry.getKey());
                if (!KNOWN_KEYS.contains(key)) {
                    throw new ConfigurationException("Unrecognized config option: '" + key
                            + "', expected one of " + KNOWN_KEYS);
                }
                Object value = entry.getValue();
                switch (key) {
                    case RETRY_STATUS_PATTERNS -> retryStatusPatterns(asCollection(key, value));
                    case RETRYABLE_ERROR_KINDS -> retryableErrorKinds(parseErrorKinds(value));
                    case RETRYABLE_EXCEPTION_TYPES -> retryableExceptionTypes(parseExceptionTypes(value));
                    case RETRY_ON_CONNECTION_ERROR -> retryOnConnectionError(asBoolean(key, value));
                    case TIMEOUT -> timeout(parseDuration(key, value));
                    case BACKOFF -> backoff(parseBackoff(value));
                    default -> throw new IllegalStateException("Unhandled config key: " + key);
                }
            }
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(this);
        }
    }

    // Value parsing

    static Collection<?> asCollection(String key, Object value) {
        if (value instanceof Collection<?> collection) {
            return collection;
        }
        if (value instanceof Object[] array) {
            return List.of(array);
        }
        if (value instanceof String || value instanceof Number) {
            return List.of(value);
        }
        throw new ConfigurationException("'" + key + "' must be a collection, got: " + describe(value));
    }

    private static boolean asBoolean(String key, Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof String text && (text.equalsIgnoreCase("true") || text.equalsIgnoreCase("false"))) {
            return Boolean.parseBoolean(text);
        }
        throw new ConfigurationException("'" + key + "' must be a boolean, got: " + describe(value));
    }

    private static Set<ErrorKind> parseErrorKinds(Object value) {
        Set<ErrorKind> kinds = new LinkedHashSet<>();
        for (Object item : asCollection(RETRYABLE_ERROR_KINDS, value)) {
            if (item instanceof ErrorKind kind) {
                kinds.add(kind);
                continue;
            }
            try {
                kinds.add(ErrorKind.valueOf(String.valueOf(item).trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Unknown error kind: '" + item + "'", e);
            }
        }
        return kinds;
    }

    @SuppressWarnings("unchecked")
    private static List<Class<? extends Throwable>> parseExceptionTypes(Object value) {
        List<Class<? extends Throwable>> types = new ArrayList<>();
        for (Object item : asCollection(RETRYABLE_EXCEPTION_TYPES, value)) {
            Class<?> type;
            if (item instanceof Class<?> clazz) {
                type = clazz;
            } else {
                try {
                    type = Class.forName(String.valueOf(item).trim());
                } catch (ClassNotFoundException e) {
                    throw new ConfigurationException("Unknown exception type: '" + item + "'", e);
                }
            }
            if (!Throwable.class.isAssignableFrom(type)) {
                throw new ConfigurationException("Not an exception type: " + type.getName());
            }
            types.add((Class<? extends Throwable>) type);
        }
        return types;
    }

    /**
     * Numbers are seconds; strings are either numbers or ISO-8601 durations.
     */
    static Duration parseDuration(String key, Object value) {
        if (value instanceof Duration duration) {
            return duration;
        }
        if (value instanceof Number number) {
            return Duration.ofMillis(Math.round(number.doubleValue() * 1000));
        }
        if (value instanceof String text) {
            String trimmed = text.trim();
            try {
                return Duration.ofMillis(Math.round(Double.parseDouble(trimmed) * 1000));
            } catch (NumberFormatException notANumber) {
                try {
                    return Duration.parse(trimmed);
                } catch (DateTimeParseException e) {
                    throw new ConfigurationException("'" + key + "' is not a valid duration: '" + text + "'", e);
                }
            }
        }
        throw new ConfigurationException("'" + key + "' must be a duration, got: " + describe(value));
    }

    private static BackoffPolicy parseBackoff(Object value) {
        if (value instanceof BackoffPolicy policy) {
            return policy;
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw new ConfigurationException("'backoff' must be a map with 'wait' and/or 'stop', got: " + describe(value));
        }
        BackoffPolicy policy = BackoffPolicy.defaults();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = String.valueOf(entry.getKey());
            switch (key) {
                case "wait" -> policy = policy.withWait(parseWait(entry.getValue()));
                case "stop" -> policy = policy.withStop(parseStop(entry.getValue()));
                default -> throw new ConfigurationException("Unrecognized backoff option: '" + key + "'");
            }
        }
        return policy;
    }

    private static WaitStrategy parseWait(Object value) {
        if (value instanceof WaitStrategy strategy) {
            return strategy;
        }
        Map<?, ?> options = asMap("backoff.wait", value);
        String type = String.valueOf(options.containsKey("type") ? options.get("type") : "exponential")
                .trim().toLowerCase(Locale.ROOT);
        Duration multiplier = durationOr(options, "multiplier", Duration.ofSeconds(1));
        Duration max = durationOr(options, "max", Duration.ofDays(1));
        return switch (type) {
            case "fixed" -> WaitStrategy.fixed(durationOr(options, "delay", Duration.ofSeconds(1)));
            case "exponential" -> WaitStrategy.exponential(multiplier, durationOr(options, "min", Duration.ZERO), max);
            case "random-exponential" -> WaitStrategy.randomExponential(multiplier, max);
            case "exponential-jitter" -> WaitStrategy.exponentialJitter(multiplier, max,
                    durationOr(options, "jitter", Duration.ofSeconds(1)));
            default -> throw new ConfigurationException("Unknown wait strategy: '" + type
                    + "', expected fixed, exponential, random-exponential or exponential-jitter");
        };
    }

    private static StopStrategy parseStop(Object value) {
        if (value instanceof StopStrategy strategy) {
            return strategy;
        }
        Map<?, ?> options = asMap("backoff.stop", value);
        List<StopStrategy> strategies = new ArrayList<>();
        for (Map.Entry<?, ?> entry : options.entrySet()) {
            String key = String.valueOf(entry.getKey());
            switch (key) {
                case "afterDelay" -> strategies.add(StopStrategy.afterDelay(parseDuration("backoff.stop.afterDelay", entry.getValue())));
                case "afterAttempt" -> {
                    if (!(entry.getValue() instanceof Number number) || number.intValue() < 1) {
                        throw new ConfigurationException("'backoff.stop.afterAttempt' must be a number >= 1");
                    }
                    strategies.add(StopStrategy.afterAttempt(number.intValue()));
                }
                case "never" -> {
                    if (asBoolean("backoff.stop.never", entry.getValue())) {
                        strategies.add(StopStrategy.never());
                    }
                }
                default -> throw new ConfigurationException("Unrecognized stop option: '" + key + "'");
            }
        }
        if (strategies.isEmpty()) {
            throw new ConfigurationException("'backoff.stop' must set afterDelay, afterAttempt or never");
        }
        return strategies.size() == 1 ? strategies.get(0) : StopStrategy.any(strategies.toArray(new StopStrategy[0]));
    }

    private static Map<?, ?> asMap(String key, Object value) {
        if (value instanceof Map<?, ?> map) {
            return map;
        }
        throw new ConfigurationException("'" + key + "' must be a map, got: " + describe(value));
    }

    private static Duration durationOr(Map<?, ?> options, String key, Duration fallback) {
        Object value = options.get(key);
        return value != null ? parseDuration(key, value) : fallback;
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName() + " " + value;
    }
}
