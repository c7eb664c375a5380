package com.phillippitts.platemate.service.session;

/**
 * Lifecycle of the assistant session.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED
}
