package com.github.lspmux.bridge;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable settings for one {@link LspClient} session.
 *
 * @param command             sidecar executable and its arguments
 * @param environment         extra variables for the child, on top of the inherited environment
 * @param workspaceRoot       absolute workspace path sent as {@code rootUri}, or null
 * @param requestTimeout      upper bound on waiting for any single response
 * @param shutdownGracePeriod how long {@code shutdown()} waits for the process before killing it
 * @param maxMessageSize      largest accepted {@code Content-Length}, in bytes
 */
public record LspClientConfig(@NotNull List<String> command,
                              @NotNull Map<String, String> environment,
                              @Nullable String workspaceRoot,
                              @NotNull Duration requestTimeout,
                              @NotNull Duration shutdownGracePeriod,
                              long maxMessageSize) {

    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_SHUTDOWN_GRACE_PERIOD = Duration.ofSeconds(5);
    public static final long DEFAULT_MAX_MESSAGE_SIZE = 100L * 1024 * 1024;

    public LspClientConfig {
        command = List.copyOf(command);
        environment = Map.copyOf(environment);
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive: " + requestTimeout);
        }
        if (shutdownGracePeriod.isNegative()) {
            throw new IllegalArgumentException("shutdownGracePeriod must not be negative: " + shutdownGracePeriod);
        }
        if (maxMessageSize <= 0 || maxMessageSize > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("maxMessageSize out of range: " + maxMessageSize);
        }
    }

    @NotNull
    public static LspClientConfig defaults(@NotNull List<String> command, @Nullable String workspaceRoot) {
        return new LspClientConfig(command, Map.of(), workspaceRoot,
            DEFAULT_REQUEST_TIMEOUT, DEFAULT_SHUTDOWN_GRACE_PERIOD, DEFAULT_MAX_MESSAGE_SIZE);
    }

    @NotNull
    public LspClientConfig withEnvironment(@NotNull Map<String, String> extra) {
        Map<String, String> merged = new HashMap<>(environment);
        merged.putAll(extra);
        return new LspClientConfig(command, merged, workspaceRoot, requestTimeout, shutdownGracePeriod, maxMessageSize);
    }

    @NotNull
    public LspClientConfig withRequestTimeout(@NotNull Duration timeout) {
        return new LspClientConfig(command, environment, workspaceRoot, timeout, shutdownGracePeriod, maxMessageSize);
    }

    @NotNull
    public LspClientConfig withShutdownGracePeriod(@NotNull Duration gracePeriod) {
        return new LspClientConfig(command, environment, workspaceRoot, requestTimeout, gracePeriod, maxMessageSize);
    }

    @NotNull
    public LspClientConfig withMaxMessageSize(long bytes) {
        return new LspClientConfig(command, environment, workspaceRoot, requestTimeout, shutdownGracePeriod, bytes);
    }
}
