package fr.lapetina.genericclient.domain.exception;

import fr.lapetina.genericclient.domain.model.ErrorKind;

/**
 * Exception for bad or ambiguous client configuration.
 * Always fatal, never retried.
 */
public class ConfigurationException extends ClientException {

    public ConfigurationException(String message) {
        super(ErrorKind.CONFIGURATION, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ErrorKind.CONFIGURATION, message, cause);
    }
}
