package com.github.lspmux.bridge;

import com.github.lspmux.bridge.model.Diagnostic;
import com.github.lspmux.bridge.model.Hover;
import com.github.lspmux.bridge.model.Location;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Client for a language server running as a sidecar process.
 * Speaks JSON-RPC 2.0 with {@code Content-Length} framing over the child's stdin/stdout.
 * <p>
 * Instances are only handed out after a successful {@code initialize}/{@code initialized}
 * handshake. Any number of threads may issue requests concurrently; responses are matched
 * to callers by id, in whatever order they arrive.
 */
public final class LspClient implements CodeIntelligence, LspNotifier, Closeable {
    private static final Logger LOG = Logger.getLogger(LspClient.class.getName());

    static final String CLIENT_NAME = "lspmux-cc-mcp";
    static final String CLIENT_VERSION = "0.1.0";

    private static final String TEXT_DOCUMENT = "textDocument";
    private static final String POSITION = "position";

    private final LspClientConfig config;
    @Nullable
    private final Process process;
    private final MessageWriter writer;
    private final PendingRequests pending = new PendingRequests();
    private final AtomicBoolean alive = new AtomicBoolean(true);
    private final AtomicBoolean shutdownStarted = new AtomicBoolean(false);
    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.STARTING);
    private final DocumentSyncTracker documents;
    private final Thread readerThread;

    private LspClient(@NotNull InputStream in, @NotNull OutputStream out, @Nullable Process process,
                      @NotNull LspClientConfig config) {
        this.config = config;
        this.process = process;
        this.writer = new MessageWriter(out);
        this.documents = new DocumentSyncTracker(this);
        MessageReader reader = new MessageReader(in, config.maxMessageSize());
        this.readerThread = new Thread(new ResponseReader(reader, writer, pending, alive, this::onReaderExit),
            "lsp-reader");
        this.readerThread.setDaemon(true);
    }

    /**
     * Spawn the sidecar described by {@code config} and perform the handshake.
     *
     * @throws SidecarException if the process cannot be started or the handshake fails;
     *                          the process is killed in the latter case
     */
    @NotNull
    public static LspClient start(@NotNull LspClientConfig config) throws SidecarException {
        if (config.command().isEmpty()) {
            throw new SidecarException("LSP server command is empty");
        }
        ProcessBuilder pb = new ProcessBuilder(config.command());
        pb.environment().putAll(config.environment());
        pb.redirectErrorStream(false);

        Process process;
        try {
            LOG.info("Starting LSP server: " + String.join(" ", config.command()));
            process = pb.start();
        } catch (IOException e) {
            throw new SidecarException("Failed to start LSP server " + config.command().get(0) + ": " + e.getMessage(), e);
        }
        startStderrDrain(process);
        return connect(process.getInputStream(), process.getOutputStream(), process, config);
    }

    /**
     * Perform the handshake over already-connected streams.
     *
     * @param process the owning process, killed if the handshake fails and on shutdown; may be null
     */
    @NotNull
    public static LspClient connect(@NotNull InputStream in, @NotNull OutputStream out, @Nullable Process process,
                                    @NotNull LspClientConfig config) throws SidecarException {
        LspClient client = new LspClient(in, out, process, config);
        client.handshake();
        return client;
    }

    private void handshake() throws SidecarException {
        state.set(SessionState.HANDSHAKING);
        readerThread.start();
        try {
            JsonElement result = request("initialize", initializeParams());
            notify("initialized", new JsonObject());
            LOG.info(() -> "LSP initialized: " + serverName(result));
        } catch (LspException e) {
            shutdownStarted.set(true);
            terminate();
            throw new SidecarException("LSP handshake failed: " + e.getMessage(), e);
        }
        state.compareAndSet(SessionState.HANDSHAKING, SessionState.READY);
    }

    private JsonObject initializeParams() throws SidecarException {
        JsonObject params = new JsonObject();
        params.addProperty("processId", ProcessHandle.current().pid());
        String root = config.workspaceRoot();
        if (root != null) {
            try {
                params.addProperty("rootUri", FileUris.toUri(root));
            } catch (IllegalArgumentException e) {
                throw new SidecarException("invalid workspace root URI: " + e.getMessage(), e);
            }
        } else {
            params.add("rootUri", JsonNull.INSTANCE);
        }
        JsonObject clientInfo = new JsonObject();
        clientInfo.addProperty("name", CLIENT_NAME);
        clientInfo.addProperty("version", CLIENT_VERSION);
        params.add("clientInfo", clientInfo);
        params.add("capabilities", new JsonObject());
        return params;
    }

    private static String serverName(JsonElement result) {
        if (result.isJsonObject() && result.getAsJsonObject().has("serverInfo")) {
            return result.getAsJsonObject().get("serverInfo").toString();
        }
        return "unknown server";
    }

    /**
     * Send a request and wait for its response.
     *
     * @return the {@code result} member, {@link JsonNull} when absent or null
     * @throws LspException on timeout or an error response (recoverable), or when the
     *                      server is gone (not recoverable)
     */
    @NotNull
    public JsonElement request(@NotNull String method, @Nullable JsonElement params) throws LspException {
        PendingRequests.PendingRequest call = pending.register();
        if (!alive.get()) {
            pending.abandon(call.id());
            throw new LspException("LSP server is not running (cannot send " + method + ")", null, false);
        }

        JsonObject response;
        try {
            writer.write(JsonRpc.request(call.id(), method, params));
            response = call.response().get(config.requestTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.abandon(call.id());
            throw new LspException("LSP request timed out after " + describe(config.requestTimeout()) + ": " + method,
                e, true);
        } catch (ExecutionException e) {
            pending.abandon(call.id());
            Throwable cause = e.getCause();
            boolean recoverable = cause instanceof LspException lspException && lspException.isRecoverable();
            throw new LspException(cause.getMessage(), cause, recoverable);
        } catch (InterruptedException e) {
            pending.abandon(call.id());
            Thread.currentThread().interrupt();
            throw new LspException("LSP request interrupted: " + method, e, true);
        } catch (IOException e) {
            pending.abandon(call.id());
            throw new LspException("Failed to send LSP request " + method + ": " + e.getMessage(), e, false);
        }

        JsonElement error = response.get(JsonRpc.ERROR);
        if (error != null && !error.isJsonNull()) {
            JsonObject errorObject = error.isJsonObject() ? error.getAsJsonObject() : null;
            JsonElement errorMessage = errorObject != null ? errorObject.get("message") : null;
            String message = errorMessage instanceof JsonPrimitive primitive && primitive.isString()
                ? primitive.getAsString()
                : error.toString();
            throw new LspException("LSP error response to " + method + ": " + message, null, true, errorObject);
        }
        JsonElement result = response.get(JsonRpc.RESULT);
        return result == null ? JsonNull.INSTANCE : result;
    }

    @Override
    public void notify(@NotNull String method, @Nullable JsonElement params) throws LspException {
        if (!alive.get()) {
            throw new LspException("LSP server is not running (cannot send " + method + ")", null, false);
        }
        try {
            writer.write(JsonRpc.notification(method, params));
        } catch (IOException e) {
            throw new LspException("Failed to send LSP notification " + method + ": " + e.getMessage(), e, false);
        }
    }

    // ---- typed operations ----

    @NotNull
    @Override
    public SyncAction ensureSynced(@NotNull String path) throws LspException {
        return documents.ensureSynced(path);
    }

    /**
     * The last version sent to the server for {@code path}.
     */
    @NotNull
    public OptionalInt documentVersion(@NotNull String path) {
        return documents.version(path);
    }

    @NotNull
    @Override
    public List<Diagnostic> diagnostics(@NotNull String path) throws LspException {
        JsonElement result = request("textDocument/diagnostic", textDocumentParams(path));
        if (!result.isJsonObject()) return List.of();
        JsonObject report = result.getAsJsonObject();
        if (report.has("kind") && "unchanged".equals(report.get("kind").getAsString())) return List.of();
        JsonElement items = report.get("items");
        if (items == null || !items.isJsonArray()) return List.of();

        List<Diagnostic> diagnostics = new ArrayList<>();
        for (JsonElement item : items.getAsJsonArray()) {
            diagnostics.add(Diagnostic.fromJson(item.getAsJsonObject()));
        }
        return diagnostics;
    }

    @Nullable
    @Override
    public Hover hover(@NotNull String path, int line, int character) throws LspException {
        JsonElement result = request("textDocument/hover", positionParams(path, line, character));
        return result.isJsonObject() ? Hover.fromJson(result.getAsJsonObject()) : null;
    }

    @Nullable
    @Override
    public List<Location> definition(@NotNull String path, int line, int character) throws LspException {
        JsonElement result = request("textDocument/definition", positionParams(path, line, character));
        if (result.isJsonObject()) return List.of(Location.fromJson(result.getAsJsonObject()));
        return locations(result);
    }

    @Nullable
    @Override
    public List<Location> references(@NotNull String path, int line, int character) throws LspException {
        JsonObject params = positionParams(path, line, character);
        JsonObject context = new JsonObject();
        context.addProperty("includeDeclaration", true);
        params.add("context", context);
        return locations(request("textDocument/references", params));
    }

    @Nullable
    private static List<Location> locations(JsonElement result) {
        if (!result.isJsonArray()) return null;
        JsonArray array = result.getAsJsonArray();
        List<Location> locations = new ArrayList<>(array.size());
        for (JsonElement element : array) {
            locations.add(Location.fromJson(element.getAsJsonObject()));
        }
        return locations;
    }

    private static JsonObject textDocumentParams(String path) throws LspException {
        JsonObject identifier = new JsonObject();
        try {
            identifier.addProperty("uri", FileUris.toUri(path));
        } catch (IllegalArgumentException e) {
            throw new LspException(e.getMessage(), e, false);
        }
        JsonObject params = new JsonObject();
        params.add(TEXT_DOCUMENT, identifier);
        return params;
    }

    private static JsonObject positionParams(String path, int line, int character) throws LspException {
        JsonObject params = textDocumentParams(path);
        JsonObject position = new JsonObject();
        position.addProperty("line", line);
        position.addProperty("character", character);
        params.add(POSITION, position);
        return params;
    }

    // ---- lifecycle ----

    public boolean isAlive() {
        return alive.get();
    }

    @NotNull
    public SessionState getState() {
        return state.get();
    }

    int pendingRequestCount() {
        return pending.size();
    }

    /**
     * Shut the session down: {@code shutdown} request, {@code exit} notification, then wait
     * for the process to exit and kill it once the grace period has passed.
     * Failures are logged, never thrown. Later calls do nothing.
     */
    public void shutdown() {
        if (!shutdownStarted.compareAndSet(false, true)) return;
        state.compareAndSet(SessionState.READY, SessionState.SHUTTING_DOWN);

        try {
            request("shutdown", null);
        } catch (LspException e) {
            LOG.warning("LSP shutdown request failed: " + e.getMessage());
        }
        try {
            notify("exit", null);
        } catch (LspException e) {
            LOG.warning("LSP exit notification failed: " + e.getMessage());
        }

        closeWriter();
        if (process != null) {
            awaitExit(process, config.shutdownGracePeriod());
        }
        state.set(SessionState.TERMINATED);
        LOG.info("LSP client shut down");
    }

    @Override
    public void close() {
        shutdown();
    }

    private void terminate() {
        closeWriter();
        if (process != null && process.isAlive()) {
            process.destroyForcibly();
        }
        state.set(SessionState.TERMINATED);
    }

    private void closeWriter() {
        try {
            writer.close();
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to close LSP server stdin", e);
        }
    }

    private static void awaitExit(Process process, Duration gracePeriod) {
        try {
            if (!process.waitFor(gracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warning("LSP server did not exit within " + describe(gracePeriod) + ", killing it");
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
    }

    private void onReaderExit() {
        SessionState previous = state.getAndUpdate(
            s -> s == SessionState.SHUTTING_DOWN ? s : SessionState.TERMINATED);
        if (previous == SessionState.READY) {
            LOG.warning("LSP server connection lost");
        }
    }

    private static String describe(Duration duration) {
        long millis = duration.toMillis();
        return millis % 1000 == 0 ? (millis / 1000) + "s" : millis + "ms";
    }

    private static void startStderrDrain(Process process) {
        Thread drain = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    String text = line;
                    LOG.info(() -> "LSP stderr: " + text);
                }
            } catch (IOException e) {
                LOG.fine(() -> "LSP stderr drain ended: " + e.getMessage());
            }
        }, "lsp-stderr");
        drain.setDaemon(true);
        drain.start();
    }
}
