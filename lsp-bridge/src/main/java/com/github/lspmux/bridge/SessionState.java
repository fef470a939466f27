package com.github.lspmux.bridge;

/**
 * Lifecycle of one sidecar session.
 * {@code STARTING -> HANDSHAKING -> READY -> SHUTTING_DOWN -> TERMINATED}; a failed start or
 * handshake and an unexpected reader exit both go straight to {@code TERMINATED}.
 */
public enum SessionState {
    STARTING,
    HANDSHAKING,
    READY,
    SHUTTING_DOWN,
    TERMINATED
}
