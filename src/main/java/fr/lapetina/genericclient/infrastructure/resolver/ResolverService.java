package fr.lapetina.genericclient.infrastructure.resolver;

import java.io.IOException;

/**
 * Naming backend that maps service names to hosts.
 *
 * A session is opened for each resolution and closed right after it;
 * no connection is held between resolutions.
 */
@FunctionalInterface
public interface ResolverService {

    /**
     * Opens a session against the naming backend of an environment.
     *
     * @param env Discovery namespace
     * @throws IOException if the backend cannot be reached
     */
    ResolverSession open(String env) throws IOException;

    /**
     * One scoped connection to the naming backend.
     */
    interface ResolverSession extends AutoCloseable {

        /**
         * Looks up the host of a service, e.g. {@code http://10.0.0.12:8080}.
         *
         * @return The host, or null if the name is unknown
         * @throws IOException if the lookup fails
         */
        String lookup(String serviceName) throws IOException;

        @Override
        void close() throws IOException;
    }
}
