package fr.lapetina.genericclient.domain.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Registry mapping error payload tags to domain exception factories.
 *
 * Thread-safe. Populated at client construction and extended through
 * explicit {@link #register} calls; read whenever a non-2xx response carries
 * a structured error payload.
 */
public final class ExceptionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ExceptionRegistry.class);

    private final Map<String, Function<ErrorPayload, ? extends DomainException>> factories = new ConcurrentHashMap<>();

    /**
     * Registers a factory for a tag, replacing any previous one.
     *
     * @param tag     Value of the payload's {@code cls} field
     * @param factory Builds the exception to raise
     */
    public ExceptionRegistry register(String tag, Function<ErrorPayload, ? extends DomainException> factory) {
        if (tag == null || tag.isBlank()) {
            throw new ConfigurationException("Error tag must not be blank");
        }
        if (factory == null) {
            throw new ConfigurationException("Error factory must not be null for tag: " + tag);
        }
        if (factories.put(tag, factory) != null) {
            log.info("Error mapping replaced: tag={}", tag);
        } else {
            log.debug("Error mapping registered: tag={}", tag);
        }
        return this;
    }

    /**
     * Registers a tag that maps to a plain {@link DomainException}.
     */
    public ExceptionRegistry register(String tag) {
        return register(tag, DomainException::new);
    }

    /**
     * Removes a mapping. Payloads with that tag fall through as raw responses.
     */
    public boolean unregister(String tag) {
        return factories.remove(tag) != null;
    }

    public boolean isRegistered(String tag) {
        return tag != null && factories.containsKey(tag);
    }

    /**
     * Builds the mapped exception for a payload, if its tag is registered.
     * A factory returning {@code null} counts as no mapping.
     */
    public Optional<DomainException> resolve(ErrorPayload payload) {
        Function<ErrorPayload, ? extends DomainException> factory = factories.get(payload.tag());
        if (factory == null) {
            return Optional.empty();
        }
        DomainException exception = factory.apply(payload);
        if (exception == null) {
            log.warn("Error factory returned no exception: tag={}", payload.tag());
        }
        return Optional.ofNullable(exception);
    }

    public Set<String> getRegisteredTags() {
        return Set.copyOf(factories.keySet());
    }
}
