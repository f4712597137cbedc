package fr.lapetina.genericclient.domain.exception;

import fr.lapetina.genericclient.domain.model.ErrorKind;

/**
 * Raised when a service name could not be resolved to a host.
 */
public class ResolutionException extends ClientException {

    private final String serviceName;
    private final String env;

    public ResolutionException(String serviceName, String env, String message, Throwable cause) {
        super(ErrorKind.RESOLUTION, message, cause);
        this.serviceName = serviceName;
        this.env = env;
    }

    public ResolutionException(String serviceName, String env, String message) {
        this(serviceName, env, message, null);
    }

    public String getServiceName() {
        return serviceName;
    }

    public String getEnv() {
        return env;
    }
}
