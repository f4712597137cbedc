package fr.lapetina.genericclient.infrastructure.config;

import fr.lapetina.genericclient.domain.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Set;

/**
 * Loads a {@link ClientTemplate} from YAML.
 *
 * Supports loading from the file system first, then from the classpath.
 * Expected layout:
 * <pre>{@code
 * serviceName: billing-api
 * prefix: /v2
 * config:
 *   retryStatusPatterns: [5xx, 429]
 *   timeout: 10
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final Set<String> KNOWN_KEYS = Set.of("host", "serviceName", "prefix", "config");

    private final Yaml yaml;

    public ConfigLoader() {
        this.yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
    }

    /**
     * Loads a template from a file path or classpath resource.
     *
     * @throws ConfigurationException if the file is missing or invalid
     */
    public ClientTemplate load(String location) {
        Path path = Paths.get(location);
        if (Files.exists(path)) {
            log.info("Loading client configuration from file: {}", path);
            try (InputStream is = Files.newInputStream(path)) {
                return loadFromStream(is);
            } catch (IOException e) {
                throw new ConfigurationException("Failed to load configuration from: " + path, e);
            }
        }

        String classpathResource = location.startsWith("/") ? location.substring(1) : location;
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading client configuration from classpath: {}", classpathResource);
                return loadFromStream(is);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + location);
    }

    /**
     * Loads a template from an input stream.
     */
    public ClientTemplate loadFromStream(InputStream inputStream) {
        Object document;
        try {
            document = yaml.load(inputStream);
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid YAML configuration: " + e.getMessage(), e);
        }
        if (document == null) {
            return ClientTemplate.EMPTY;
        }
        if (!(document instanceof Map<?, ?> root)) {
            throw new ConfigurationException("Configuration root must be a mapping, got: "
                    + document.getClass().getSimpleName());
        }

        for (Object key : root.keySet()) {
            if (!KNOWN_KEYS.contains(String.valueOf(key))) {
                throw new ConfigurationException("Unrecognized configuration key: '" + key
                        + "', expected one of " + KNOWN_KEYS);
            }
        }

        Object config = root.get("config");
        // Fail fast on a bad config block rather than at client construction
        ClientConfig.from(config);

        return new ClientTemplate(
                asString(root.get("host")),
                asString(root.get("serviceName")),
                asString(root.get("prefix")),
                config
        );
    }

    private static String asString(Object value) {
        return value != null ? value.toString() : null;
    }
}
