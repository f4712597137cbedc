package fr.lapetina.genericclient.domain.exception;

import fr.lapetina.genericclient.domain.model.ErrorKind;

/**
 * Base class for every failure raised by the client.
 *
 * Unchecked, like the rest of the client's error surface; the {@link ErrorKind}
 * is what retry classification keys on.
 */
public abstract class ClientException extends RuntimeException {

    private final ErrorKind kind;

    protected ClientException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected ClientException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
