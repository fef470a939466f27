package com.github.lspmux.bridge;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drains the sidecar's stdout for the lifetime of a session.
 * Responses go to {@link PendingRequests}; notifications are logged and dropped;
 * requests from the server are refused with a method-not-found error.
 * On exit the liveness flag is cleared and every pending caller is failed.
 */
final class ResponseReader implements Runnable {
    private static final Logger LOG = Logger.getLogger(ResponseReader.class.getName());
    private static final int METHOD_NOT_FOUND = -32601;

    private final MessageReader reader;
    private final MessageWriter writer;
    private final PendingRequests pending;
    private final AtomicBoolean alive;
    private final Runnable onExit;

    ResponseReader(MessageReader reader, MessageWriter writer, PendingRequests pending,
                   AtomicBoolean alive, Runnable onExit) {
        this.reader = reader;
        this.writer = writer;
        this.pending = pending;
        this.alive = alive;
        this.onExit = onExit;
    }

    @Override
    public void run() {
        Throwable failure = null;
        try (reader) {
            JsonElement message;
            while ((message = reader.read()) != null) {
                dispatch(message);
            }
            LOG.info("LSP stdout closed");
        } catch (IOException | RuntimeException e) {
            failure = e;
            LOG.log(Level.SEVERE, "LSP reader loop error: " + e.getMessage(), e);
        } finally {
            alive.set(false);
            int count = pending.drainAll(
                new LspException("LSP response channel closed (server may have crashed)", failure, false));
            if (count > 0) {
                LOG.warning("Reader loop exited with " + count + " pending request(s)");
            }
            onExit.run();
        }
    }

    private void dispatch(JsonElement message) {
        if (!message.isJsonObject()) {
            LOG.warning(() -> "Ignoring non-object LSP message: " + message);
            return;
        }
        JsonObject msg = message.getAsJsonObject();
        boolean hasId = msg.has(JsonRpc.ID) && !msg.get(JsonRpc.ID).isJsonNull();
        boolean hasMethod = msg.has(JsonRpc.METHOD);

        if (hasId && hasMethod) {
            refuseServerRequest(msg);
        } else if (hasId) {
            handleResponse(msg);
        } else {
            String method = methodOf(msg);
            LOG.fine(() -> "LSP notification: " + method);
        }
    }

    private void handleResponse(JsonObject msg) {
        JsonElement id = msg.get(JsonRpc.ID);
        if (id instanceof JsonPrimitive primitive && primitive.isNumber()) {
            try {
                pending.resolve(primitive.getAsBigDecimal().longValueExact(), msg);
                return;
            } catch (ArithmeticException | NumberFormatException e) {
                LOG.warning(() -> "received response with non-integer id " + id);
                return;
            }
        }
        LOG.warning(() -> "received response with non-numeric id " + id);
    }

    /**
     * @return the message's method name, or {@code "?"} when it is missing or not a string
     */
    static String methodOf(JsonObject msg) {
        JsonElement method = msg.get(JsonRpc.METHOD);
        return method instanceof JsonPrimitive primitive && primitive.isString() ? primitive.getAsString() : "?";
    }

    private void refuseServerRequest(JsonObject msg) {
        String method = methodOf(msg);
        LOG.fine(() -> "LSP server request not supported: " + method);
        try {
            writer.write(JsonRpc.errorResponse(msg.get(JsonRpc.ID), METHOD_NOT_FOUND, "Method not supported: " + method));
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to answer LSP server request " + method, e);
        }
    }
}
