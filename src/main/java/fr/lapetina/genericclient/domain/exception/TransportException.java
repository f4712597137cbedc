package fr.lapetina.genericclient.domain.exception;

import fr.lapetina.genericclient.domain.model.ErrorKind;

/**
 * Connection-level failure of a single attempt.
 *
 * Kind is either {@link ErrorKind#CONNECTION} or {@link ErrorKind#TIMEOUT}.
 */
public class TransportException extends ClientException {

    private final String method;
    private final String url;

    public TransportException(ErrorKind kind, String method, String url, String message, Throwable cause) {
        super(kind, method + " " + url + ": " + message, cause);
        this.method = method;
        this.url = url;
    }

    /**
     * Wraps a transport-level cause, deriving the kind from it.
     */
    public static TransportException wrap(String method, String url, Throwable cause) {
        Throwable root = ErrorKind.unwrap(cause);
        if (root instanceof TransportException transportException) {
            return transportException;
        }
        ErrorKind kind = ErrorKind.of(root) == ErrorKind.TIMEOUT ? ErrorKind.TIMEOUT : ErrorKind.CONNECTION;
        String message = root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
        return new TransportException(kind, method, url, message, root);
    }

    public String getMethod() {
        return method;
    }

    public String getUrl() {
        return url;
    }
}
