package fr.lapetina.genericclient.domain.model;

/**
 * Lifecycle of a client.
 *
 * {@code CONSTRUCTED -> OPENING -> READY -> CLOSED}, or
 * {@code OPENING -> CLOSED} when the initial host resolution fails.
 * There is no way back from {@code CLOSED}.
 */
public enum ClientState {
    /** Built, host not resolved yet */
    CONSTRUCTED,

    /** Initial host resolution in progress */
    OPENING,

    /** Host known, serving requests */
    READY,

    /** Transport released */
    CLOSED
}
