package fr.lapetina.genericclient.infrastructure.config;

/**
 * Declarative defaults shared by every instance of a client type.
 *
 * A client subclass holds one template as a constant and passes it to its
 * builder; instance-level arguments are then merged on top by {@link ConfigMerger}.
 * The {@code config} slot accepts the same shapes as {@link ClientConfig#from(Object)}.
 */
public record ClientTemplate(
        String host,
        String serviceName,
        String prefix,
        Object config
) {
    public static final ClientTemplate EMPTY = new ClientTemplate(null, null, null, null);

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String host;
        private String serviceName;
        private String prefix;
        private Object config;

        private Builder() {
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder serviceName(String serviceName) {
            this.serviceName = serviceName;
            return this;
        }

        public Builder prefix(String prefix) {
            this.prefix = prefix;
            return this;
        }

        public Builder config(Object config) {
            this.config = config;
            return this;
        }

        public ClientTemplate build() {
            return new ClientTemplate(host, serviceName, prefix, config);
        }
    }
}
