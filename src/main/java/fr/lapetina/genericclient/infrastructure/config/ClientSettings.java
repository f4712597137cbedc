package fr.lapetina.genericclient.infrastructure.config;

import java.util.Objects;

/**
 * Fully merged and validated construction arguments of one client.
 *
 * @param host        Explicit host, or null in auto-resolve mode
 * @param serviceName Service to resolve when no host is given
 * @param env         Discovery namespace
 * @param prefix      Path prefix applied to every request, never null
 * @param config      Retry and timeout configuration
 */
public record ClientSettings(
        String host,
        String serviceName,
        String env,
        String prefix,
        ClientConfig config
) {
    public ClientSettings {
        prefix = prefix != null ? prefix : "";
        Objects.requireNonNull(config, "config");
    }

    public boolean isStatic() {
        return host != null;
    }
}
