package com.github.lspmux.mcp;

import com.github.lspmux.bridge.CodeIntelligence;
import com.github.lspmux.bridge.LspClient;
import com.github.lspmux.bridge.SidecarException;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * MCP (Model Context Protocol) stdio server exposing rust-analyzer through an lspmux sidecar.
 * Reads newline-delimited JSON-RPC from stdin and writes one response per line to stdout.
 * <pre>
 * MCP client &lt;-stdio-&gt; McpServer &lt;-LSP over child stdio-&gt; lspmux client &lt;-&gt; lspmux server -&gt; rust-analyzer
 * </pre>
 */
public class McpServer {

    private static final Logger LOG = Logger.getLogger(McpServer.class.getName());
    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    static final String SERVER_NAME = "lspmux-cc-mcp";
    static final String SERVER_VERSION = "0.1.0";
    static final String PROTOCOL_VERSION = "2025-03-26";

    static final int INVALID_PARAMS = -32602;
    static final int METHOD_NOT_FOUND = -32601;
    static final int INTERNAL_ERROR = -32603;

    private static final int TOOL_THREADS = 4;
    private static final long DRAIN_SECONDS = 60;

    private final RustAnalyzerTools tools;
    private final Object outputLock = new Object();

    public McpServer(@NotNull CodeIntelligence lsp) {
        this.tools = new RustAnalyzerTools(lsp);
    }

    public static void main(String[] args) {
        McpLogging.configure(System.getenv());

        ServerConfig config;
        try {
            config = ServerConfig.fromEnvironment(System.getenv(), Path.of("").toAbsolutePath());
        } catch (IllegalArgumentException e) {
            LOG.severe("Invalid configuration: " + e.getMessage());
            System.exit(1);
            return;
        }

        LOG.info("Starting " + SERVER_NAME + " server");
        LOG.info("lspmux binary: " + config.lspmuxBinary());
        LOG.info("rust-analyzer binary: " + config.rustAnalyzerBinary());

        LspClient client;
        try {
            client = LspClient.start(config.toClientConfig());
        } catch (SidecarException e) {
            LOG.log(Level.SEVERE, "failed to initialize LSP client: " + e.getMessage(), e);
            System.exit(1);
            return;
        }
        Runtime.getRuntime().addShutdownHook(new Thread(client::shutdown, "lsp-shutdown"));

        try {
            new McpServer(client).serve(System.in, System.out);
        } catch (IOException e) {
            LOG.log(Level.SEVERE, "MCP transport error", e);
        } finally {
            client.shutdown();
        }
    }

    /**
     * Serve until {@code in} reaches end of stream. Tool calls run on a worker pool;
     * everything else is answered inline. Returns once in-flight tool calls have answered.
     */
    public void serve(@NotNull InputStream in, @NotNull OutputStream out) throws IOException {
        ExecutorService workers = Executors.newFixedThreadPool(TOOL_THREADS, toolThreads());
        try {
            BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
            String line;
            while ((line = reader.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty()) continue;
                JsonObject msg = parse(line);
                if (msg == null) continue;

                if (isToolCall(msg)) {
                    workers.execute(() -> send(out, handleMessage(msg)));
                } else {
                    send(out, handleMessage(msg));
                }
            }
            LOG.info("MCP stdin closed");
        } finally {
            workers.shutdown();
            try {
                if (!workers.awaitTermination(DRAIN_SECONDS, TimeUnit.SECONDS)) {
                    LOG.warning("Tool calls still running after stdin closed");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Nullable
    private static JsonObject parse(String line) {
        try {
            JsonElement element = JsonParser.parseString(line);
            if (element.isJsonObject()) return element.getAsJsonObject();
            LOG.warning(() -> "Ignoring non-object MCP message: " + line);
        } catch (JsonParseException e) {
            LOG.log(Level.SEVERE, "MCP Server error: unparsable message", e);
        }
        return null;
    }

    private static boolean isToolCall(JsonObject msg) {
        return "tools/call".equals(methodOf(msg));
    }

    @Nullable
    private static String methodOf(JsonObject msg) {
        JsonElement method = msg.get("method");
        return method != null && method.isJsonPrimitive() && method.getAsJsonPrimitive().isString()
            ? method.getAsString() : null;
    }

    private static String stringOrEmpty(@Nullable JsonElement value) {
        return value != null && value.isJsonPrimitive() && value.getAsJsonPrimitive().isString()
            ? value.getAsString() : "";
    }

    private void send(OutputStream out, @Nullable JsonObject response) {
        if (response == null) return;
        byte[] line = (GSON.toJson(response) + "\n").getBytes(StandardCharsets.UTF_8);
        synchronized (outputLock) {
            try {
                out.write(line);
                out.flush();
            } catch (IOException e) {
                LOG.log(Level.SEVERE, "Failed to write MCP response", e);
            }
        }
    }

    @Nullable
    JsonObject handleMessage(@NotNull JsonObject msg) {
        String method = methodOf(msg);
        boolean hasId = msg.has("id") && !msg.get("id").isJsonNull();
        JsonObject params = msg.has("params") && msg.get("params").isJsonObject()
            ? msg.getAsJsonObject("params") : new JsonObject();

        if (method == null) return null;

        return switch (method) {
            case "initialize" -> hasId ? respond(msg, handleInitialize()) : null;
            case "initialized", "notifications/initialized" -> null;
            case "tools/list" -> hasId ? respond(msg, handleToolsList()) : null;
            case "tools/call" -> hasId ? handleToolsCall(msg, params) : null;
            case "ping" -> hasId ? respond(msg, new JsonObject()) : null;
            default -> hasId ? respondError(msg, METHOD_NOT_FOUND, "Method not found: " + method) : null;
        };
    }

    private static JsonObject respond(JsonObject request, JsonObject result) {
        JsonObject response = new JsonObject();
        response.addProperty("jsonrpc", "2.0");
        response.add("id", request.get("id"));
        response.add("result", result);
        return response;
    }

    private static JsonObject respondError(JsonObject request, int code, String message) {
        JsonObject response = new JsonObject();
        response.addProperty("jsonrpc", "2.0");
        response.add("id", request.get("id"));
        JsonObject error = new JsonObject();
        error.addProperty("code", code);
        error.addProperty("message", message);
        response.add("error", error);
        return response;
    }

    private static JsonObject handleInitialize() {
        JsonObject result = new JsonObject();
        result.addProperty("protocolVersion", PROTOCOL_VERSION);
        JsonObject serverInfo = new JsonObject();
        serverInfo.addProperty("name", SERVER_NAME);
        serverInfo.addProperty("version", SERVER_VERSION);
        result.add("serverInfo", serverInfo);
        JsonObject capabilities = new JsonObject();
        JsonObject toolsCapability = new JsonObject();
        toolsCapability.addProperty("listChanged", false);
        capabilities.add("tools", toolsCapability);
        result.add("capabilities", capabilities);
        result.addProperty("instructions", """
            Provides rust-analyzer intelligence via lspmux. \
            Use rust_diagnostics to check for errors, rust_hover for type info, \
            rust_goto_definition to find definitions, and rust_find_references \
            to find all usages. Lines and characters are zero-based in arguments \
            and one-based in results.""");
        return result;
    }

    private JsonObject handleToolsList() {
        JsonObject result = new JsonObject();
        result.add("tools", tools.list());
        return result;
    }

    private JsonObject handleToolsCall(JsonObject msg, JsonObject params) {
        String toolName = stringOrEmpty(params.get("name"));
        JsonObject arguments = params.has("arguments") && params.get("arguments").isJsonObject()
            ? params.getAsJsonObject("arguments") : new JsonObject();
        try {
            return respond(msg, tools.call(toolName, arguments));
        } catch (InvalidParamsException e) {
            LOG.fine(() -> "MCP: invalid params for " + toolName + ": " + e.getMessage());
            return respondError(msg, INVALID_PARAMS, e.getMessage());
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, "MCP: tool '" + toolName + "' threw", e);
            return respondError(msg, INTERNAL_ERROR, "Internal error: " + e.getMessage());
        }
    }

    private static ThreadFactory toolThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "mcp-tool-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
