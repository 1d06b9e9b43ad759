package com.phillippitts.liveagent.service.connection;

/**
 * A WebSocket-style dependency that {@link ResilientConnection} can (re)open.
 */
public interface StreamingConnection {

    /** Service name used in logs, events and errors. */
    String connectionName();

    /**
     * Connection-state check. Must be cheap and non-blocking.
     */
    boolean isOpen();

    /**
     * Performs one connection attempt. Returning normally does not imply success; the wrapper
     * confirms with {@link #isOpen()}.
     *
     * @throws Exception if the attempt was rejected (for example HTTP 429 on upgrade)
     */
    void connect() throws Exception;
}
