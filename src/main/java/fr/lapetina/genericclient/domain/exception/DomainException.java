package fr.lapetina.genericclient.domain.exception;

import fr.lapetina.genericclient.domain.model.ErrorKind;

/**
 * Application-level error reconstructed from a structured error payload.
 *
 * Subclass it for typed handling and register the subclass under its tag in
 * {@link ExceptionRegistry}. Never retried.
 */
public class DomainException extends ClientException {

    private final ErrorPayload payload;

    public DomainException(ErrorPayload payload) {
        super(ErrorKind.DOMAIN, describe(payload));
        this.payload = payload;
    }

    public ErrorPayload getPayload() {
        return payload;
    }

    public String getTag() {
        return payload.tag();
    }

    public int getHttpStatus() {
        return payload.httpStatus();
    }

    private static String describe(ErrorPayload payload) {
        String base = payload.tag() + " (HTTP " + payload.httpStatus() + ")";
        return payload.message() != null ? base + ": " + payload.message() : base;
    }
}
