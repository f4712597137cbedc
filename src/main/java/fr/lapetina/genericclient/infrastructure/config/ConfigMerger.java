package fr.lapetina.genericclient.infrastructure.config;

import fr.lapetina.genericclient.domain.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Merges a {@link ClientTemplate} with instance-level arguments.
 *
 * Rules:
 * <ul>
 *   <li>{@code serviceName} and {@code prefix} identify the client and may be set
 *       at one level only; setting both is an error.</li>
 *   <li>An instance {@code host} wins over the template's.</li>
 *   <li>Config maps merge key by key with the instance winning; an instance
 *       {@link ClientConfig} object replaces the template config entirely.</li>
 *   <li>Without a host, both {@code serviceName} and {@code env} are required.</li>
 * </ul>
 */
public final class ConfigMerger {

    private static final Logger log = LoggerFactory.getLogger(ConfigMerger.class);

    private ConfigMerger() {
        // Utility class
    }

    public static ClientSettings merge(
            ClientTemplate template,
            String env,
            String serviceName,
            String host,
            String prefix,
            Object config
    ) {
        ClientTemplate defaults = template != null ? template : ClientTemplate.EMPTY;

        if (isSet(defaults.serviceName()) && isSet(serviceName)) {
            throw new ConfigurationException("'serviceName' specified at both template and instance level");
        }
        if (isSet(defaults.prefix()) && isSet(prefix)) {
            throw new ConfigurationException("'prefix' specified at both template and instance level");
        }

        ClientConfig mergedConfig = mergeConfig(defaults.config(), config);

        String effectiveServiceName = isSet(serviceName) ? serviceName : blankToNull(defaults.serviceName());
        String effectiveHost = isSet(host) ? host : blankToNull(defaults.host());
        String effectivePrefix = isSet(prefix) ? prefix : defaults.prefix();
        String effectiveEnv = blankToNull(env);

        if (effectiveHost == null) {
            if (effectiveServiceName == null || effectiveEnv == null) {
                throw new ConfigurationException(
                        "In auto-resolve mode both 'serviceName' and 'env' must be provided");
            }
            log.info("Running in auto-resolve mode: serviceName={}, env={}", effectiveServiceName, effectiveEnv);
        } else {
            log.info("Running in static mode: host={}", effectiveHost);
        }

        return new ClientSettings(effectiveHost, effectiveServiceName, effectiveEnv, effectivePrefix, mergedConfig);
    }

    static ClientConfig mergeConfig(Object templateConfig, Object instanceConfig) {
        ClientConfig base = ClientConfig.from(templateConfig);
        if (instanceConfig == null) {
            return base;
        }
        if (instanceConfig instanceof ClientConfig config) {
            return config;
        }
        if (instanceConfig instanceof Map<?, ?> overrides) {
            return base.withOverrides(overrides);
        }
        // Rejects the shape with the standard message
        return ClientConfig.from(instanceConfig);
    }

    private static boolean isSet(String value) {
        return value != null && !value.isEmpty();
    }

    private static String blankToNull(String value) {
        return isSet(value) ? value : null;
    }
}
