package com.github.lspmux.bridge;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * In-process language server speaking {@code Content-Length} framed JSON-RPC over pipes.
 * <p>
 * Handlers receive the message {@code params} ({@link JsonNull} when absent) and return the
 * {@code result}. Returning Java {@code null} sends no response at all (use {@link #respond}
 * later); returning {@link JsonNull} answers with a null result; throwing {@link ResponseError}
 * answers with an error object.
 */
public class MockLspServer implements Closeable {
    private static final int PIPE_BUFFER = 64 * 1024;

    /**
     * Thrown from a handler to answer with a JSON-RPC error.
     */
    public static class ResponseError extends RuntimeException {
        final int code;

        public ResponseError(int code, String message) {
            super(message);
            this.code = code;
        }
    }

    private final PipedOutputStream clientToServer = new PipedOutputStream();
    private final PipedInputStream serverFromClient;
    private final PipedOutputStream serverToClient = new PipedOutputStream();
    private final PipedInputStream clientFromServer;
    private final MessageWriter out;

    private final Map<String, Function<JsonElement, JsonElement>> handlers = new ConcurrentHashMap<>();
    private final List<JsonObject> received = new CopyOnWriteArrayList<>();
    private Thread readerThread;
    private volatile boolean running = true;

    public MockLspServer() throws IOException {
        serverFromClient = new PipedInputStream(clientToServer, PIPE_BUFFER);
        clientFromServer = new PipedInputStream(serverToClient, PIPE_BUFFER);
        out = new MessageWriter(serverToClient);

        registerHandler("initialize", params -> {
            JsonObject serverInfo = new JsonObject();
            serverInfo.addProperty("name", "mock-lsp");
            serverInfo.addProperty("version", "1.0.0");
            JsonObject result = new JsonObject();
            result.add("capabilities", new JsonObject());
            result.add("serverInfo", serverInfo);
            return result;
        });
        registerHandler("shutdown", params -> JsonNull.INSTANCE);
        registerHandler("exit", params -> {
            closeOutput();
            return null;
        });
    }

    public void registerHandler(String method, Function<JsonElement, JsonElement> handler) {
        handlers.put(method, handler);
    }

    public void start() {
        readerThread = new Thread(this::readLoop, "mock-lsp-server");
        readerThread.setDaemon(true);
        readerThread.start();
    }

    private void readLoop() {
        MessageReader reader = new MessageReader(serverFromClient, Integer.MAX_VALUE);
        try {
            JsonElement message;
            while (running && (message = reader.read()) != null) {
                handle(message.getAsJsonObject());
            }
        } catch (IOException e) {
            if (running) System.err.println("MockLspServer reader ended: " + e.getMessage());
        }
    }

    private void handle(JsonObject msg) {
        received.add(msg);
        if (!msg.has("method")) return;
        String method = msg.get("method").getAsString();
        boolean hasId = msg.has("id");
        Function<JsonElement, JsonElement> handler = handlers.get(method);
        if (handler == null) {
            if (hasId) sendQuietly(error(msg.get("id"), -32601, "method not found: " + method));
            return;
        }
        JsonElement params = msg.has("params") ? msg.get("params") : JsonNull.INSTANCE;
        try {
            JsonElement result = handler.apply(params);
            if (hasId && result != null) {
                sendQuietly(response(msg.get("id"), result));
            }
        } catch (ResponseError e) {
            if (hasId) sendQuietly(error(msg.get("id"), e.code, e.getMessage()));
        }
    }

    /**
     * Answer a request whose handler returned {@code null}.
     */
    public void respond(long id, JsonElement result) throws IOException {
        sendMessage(response(new JsonPrimitive(id), result));
    }

    public void sendMessage(JsonElement message) throws IOException {
        out.write(message);
    }

    /**
     * Write raw bytes to the client, bypassing framing.
     */
    public void sendRaw(byte[] bytes) throws IOException {
        synchronized (this) {
            serverToClient.write(bytes);
            serverToClient.flush();
        }
    }

    public void sendNotification(String method, JsonElement params) throws IOException {
        JsonObject msg = new JsonObject();
        msg.addProperty("jsonrpc", "2.0");
        msg.addProperty("method", method);
        msg.add("params", params);
        sendMessage(msg);
    }

    public void sendServerRequest(long id, String method, JsonElement params) throws IOException {
        JsonObject msg = new JsonObject();
        msg.addProperty("jsonrpc", "2.0");
        msg.addProperty("id", id);
        msg.addProperty("method", method);
        msg.add("params", params);
        sendMessage(msg);
    }

    public List<JsonObject> getReceived() {
        return Collections.unmodifiableList(received);
    }

    public List<JsonObject> getReceived(String method) {
        return received.stream()
            .filter(m -> m.has("method") && method.equals(m.get("method").getAsString()))
            .toList();
    }

    /**
     * Messages the client sent without a method: replies to server-initiated requests.
     */
    public List<JsonObject> getReplies() {
        return received.stream().filter(m -> !m.has("method")).toList();
    }

    /**
     * Wait until at least {@code count} messages with {@code method} arrived.
     */
    public List<JsonObject> awaitReceived(String method, int count, long timeoutMillis) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        List<JsonObject> matching = getReceived(method);
        while (matching.size() < count && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
            matching = getReceived(method);
        }
        return matching;
    }

    public OutputStream getProcessStdin() {
        return clientToServer;
    }

    public InputStream getProcessStdout() {
        return clientFromServer;
    }

    /**
     * Close the server's stdout, as if the process had exited.
     */
    public void closeOutput() {
        try {
            out.close();
        } catch (IOException ignored) { // already closed
        }
    }

    @Override
    public void close() {
        running = false;
        closeOutput();
        try {
            clientToServer.close();
        } catch (IOException ignored) { // streams closing on shutdown
        }
        if (readerThread != null) readerThread.interrupt();
    }

    private static JsonObject response(JsonElement id, JsonElement result) {
        JsonObject response = new JsonObject();
        response.addProperty("jsonrpc", "2.0");
        response.add("id", id);
        response.add("result", result);
        return response;
    }

    private static JsonObject error(JsonElement id, int code, String message) {
        JsonObject error = new JsonObject();
        error.addProperty("code", code);
        error.addProperty("message", message);
        JsonObject response = new JsonObject();
        response.addProperty("jsonrpc", "2.0");
        response.add("id", id);
        response.add("error", error);
        return response;
    }

    private void sendQuietly(JsonObject message) {
        try {
            sendMessage(message);
        } catch (IOException e) {
            System.err.println("MockLspServer send failed: " + e.getMessage());
        }
    }
}
