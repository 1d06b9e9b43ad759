package com.phillippitts.liveagent.service.connection;

/** Connection lifecycle owned by one {@link ResilientConnection}. */
public enum ConnectionState {
    IDLE,
    CONNECTING,
    OPEN,
    FAILED
}
