package com.github.lspmux.bridge;

import com.google.gson.JsonObject;
import org.jetbrains.annotations.Nullable;

/**
 * Exception thrown when a request or notification to the language server fails.
 */
public class LspException extends Exception {
    private final boolean recoverable;
    @Nullable
    private final transient JsonObject error;

    public LspException(String message) {
        this(message, null, true);
    }

    public LspException(String message, Throwable cause) {
        this(message, cause, true);
    }

    public LspException(String message, @Nullable Throwable cause, boolean recoverable) {
        this(message, cause, recoverable, null);
    }

    public LspException(String message, @Nullable Throwable cause, boolean recoverable, @Nullable JsonObject error) {
        super(message, cause);
        this.recoverable = recoverable;
        this.error = error;
    }

    /**
     * Whether the session is still usable after this error (e.g. request timeout vs. dead sidecar).
     */
    public boolean isRecoverable() {
        return recoverable;
    }

    /**
     * The JSON-RPC {@code error} object when the server answered with an error response.
     */
    @Nullable
    public JsonObject getError() {
        return error;
    }
}
