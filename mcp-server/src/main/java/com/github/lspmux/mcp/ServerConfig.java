package com.github.lspmux.mcp;

import com.github.lspmux.bridge.LspClientConfig;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Where the sidecar binaries live and how the client is tuned, resolved from environment variables.
 */
public record ServerConfig(@NotNull String lspmuxBinary,
                           @NotNull String rustAnalyzerBinary,
                           @NotNull String workspaceRoot,
                           @NotNull Duration requestTimeout,
                           long maxMessageSize) {

    static final String RUST_ANALYZER_PATH = "RUST_ANALYZER_PATH";
    static final String XDG_DATA_HOME = "XDG_DATA_HOME";
    static final String WORKSPACE_ROOT = "WORKSPACE_ROOT";
    static final String REQUEST_TIMEOUT_SECS = "LSPMUX_MCP_REQUEST_TIMEOUT_SECS";
    static final String MAX_MESSAGE_BYTES = "LSPMUX_MCP_MAX_MESSAGE_BYTES";

    /**
     * @param cwd used as the workspace root when {@code WORKSPACE_ROOT} is unset
     * @throws IllegalArgumentException if a numeric override is not a positive integer
     */
    @NotNull
    public static ServerConfig fromEnvironment(@NotNull Map<String, String> env, @NotNull Path cwd) {
        String rustAnalyzer = value(env, RUST_ANALYZER_PATH);
        if (rustAnalyzer == null) {
            String xdgData = value(env, XDG_DATA_HOME);
            if (xdgData == null) xdgData = env.getOrDefault(LspmuxLocator.HOME, "") + "/.local/share";
            rustAnalyzer = xdgData + "/lspmux-rust-analyzer/current/rust-analyzer";
        }

        String workspaceRoot = value(env, WORKSPACE_ROOT);
        if (workspaceRoot == null) workspaceRoot = cwd.toAbsolutePath().toString();

        Duration timeout = LspClientConfig.DEFAULT_REQUEST_TIMEOUT;
        String timeoutValue = value(env, REQUEST_TIMEOUT_SECS);
        if (timeoutValue != null) {
            timeout = Duration.ofSeconds(positive(REQUEST_TIMEOUT_SECS, timeoutValue, Long.MAX_VALUE / 1000));
        }

        long maxMessageSize = LspClientConfig.DEFAULT_MAX_MESSAGE_SIZE;
        String sizeValue = value(env, MAX_MESSAGE_BYTES);
        if (sizeValue != null) {
            maxMessageSize = positive(MAX_MESSAGE_BYTES, sizeValue, Integer.MAX_VALUE);
        }

        return new ServerConfig(LspmuxLocator.locate(env), rustAnalyzer, workspaceRoot, timeout, maxMessageSize);
    }

    /**
     * {@code lspmux client --server-path <rust-analyzer>}
     */
    @NotNull
    public List<String> command() {
        return List.of(lspmuxBinary, "client", "--server-path", rustAnalyzerBinary);
    }

    @NotNull
    public LspClientConfig toClientConfig() {
        return LspClientConfig.defaults(command(), workspaceRoot)
            .withRequestTimeout(requestTimeout)
            .withMaxMessageSize(maxMessageSize);
    }

    @Nullable
    static String value(Map<String, String> env, String name) {
        String value = env.get(name);
        return value == null || value.isBlank() ? null : value;
    }

    private static long positive(String name, String value, long max) {
        long parsed;
        try {
            parsed = Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a positive integer, got: " + value, e);
        }
        if (parsed <= 0 || parsed > max) {
            throw new IllegalArgumentException(name + " must be a positive integer up to " + max + ", got: " + value);
        }
        return parsed;
    }
}
