package com.github.lspmux.bridge;

/**
 * Exception thrown when the sidecar process cannot be spawned or the LSP handshake fails.
 * No session exists after this error.
 */
public class SidecarException extends LspException {

    public SidecarException(String message) {
        super(message, null, false);
    }

    public SidecarException(String message, Throwable cause) {
        super(message, cause, false);
    }
}
