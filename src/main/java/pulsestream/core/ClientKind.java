package pulsestream.core;

/**
 * The two populations of live receivers.
 */
public enum ClientKind {
    /** Newline-delimited JSON over a plain TCP connection. */
    STREAM,
    /** One JSON text frame per event over a WebSocket. */
    MESSAGE
}
