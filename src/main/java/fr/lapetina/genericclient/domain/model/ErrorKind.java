package fr.lapetina.genericclient.domain.model;

import fr.lapetina.genericclient.domain.exception.ClientException;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Error taxonomy for request attempts.
 * Drives retry classification and metrics tagging.
 */
public enum ErrorKind {
    /** Connection-level failure (refused, reset, unreachable) */
    CONNECTION,

    /** Attempt exceeded its timeout */
    TIMEOUT,

    /** Naming backend unreachable or service name unknown */
    RESOLUTION,

    /** Bad or ambiguous construction arguments */
    CONFIGURATION,

    /** Application error mapped from a structured error payload */
    DOMAIN,

    /** Anything else */
    INTERNAL;

    /**
     * Classifies a throwable, looking through future wrappers.
     */
    public static ErrorKind of(Throwable error) {
        Throwable cause = unwrap(error);

        if (cause instanceof ClientException clientException) {
            return clientException.getKind();
        }
        if (cause instanceof HttpTimeoutException || cause instanceof TimeoutException) {
            return TIMEOUT;
        }
        if (cause instanceof IOException) {
            return CONNECTION;
        }
        return INTERNAL;
    }

    /**
     * Strips {@link CompletionException} and {@link ExecutionException} layers.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}
