package fr.lapetina.genericclient.infrastructure.resolver;

import java.util.Objects;

/**
 * How a client finds its host. Decided once, at construction.
 */
public sealed interface HostState permits HostState.Static, HostState.Dynamic {

    /**
     * Host given explicitly; discovery disabled.
     */
    record Static(String host) implements HostState {
        public Static {
            Objects.requireNonNull(host, "host");
        }
    }

    /**
     * Host looked up by service name in a discovery namespace.
     */
    record Dynamic(String serviceName, String env) implements HostState {
        public Dynamic {
            Objects.requireNonNull(serviceName, "serviceName");
            Objects.requireNonNull(env, "env");
        }
    }
}
