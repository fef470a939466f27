package com.github.lspmux.mcp;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * java.util.logging setup. Everything goes to stderr because stdout carries the MCP protocol.
 */
final class McpLogging {
    static final String CONFIG_RESOURCE = "/lspmux-mcp-logging.properties";
    static final String LEVEL_ENV = "LSPMUX_MCP_LOG";

    private McpLogging() {}

    /**
     * Load the bundled configuration unless {@code java.util.logging.config.file} is set,
     * then apply {@code LSPMUX_MCP_LOG} to the root logger.
     */
    @SuppressWarnings("java:S106") // logging is not configured yet
    static void configure(@NotNull Map<String, String> env) {
        if (System.getProperty("java.util.logging.config.file") == null) {
            try (InputStream in = McpLogging.class.getResourceAsStream(CONFIG_RESOURCE)) {
                if (in != null) {
                    LogManager.getLogManager().readConfiguration(in);
                }
            } catch (IOException e) {
                System.err.println("Failed to load logging configuration: " + e.getMessage());
            }
        }

        String value = env.get(LEVEL_ENV);
        if (value == null || value.isBlank()) return;
        Level level = parseLevel(value);
        if (level == null) {
            Logger.getLogger(McpLogging.class.getName()).warning("Ignoring unknown " + LEVEL_ENV + " level: " + value);
            return;
        }
        Logger.getLogger("").setLevel(level);
    }

    @Nullable
    static Level parseLevel(@NotNull String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "off" -> Level.OFF;
            case "severe", "error" -> Level.SEVERE;
            case "warning", "warn" -> Level.WARNING;
            case "info" -> Level.INFO;
            case "fine", "debug" -> Level.FINE;
            case "finest", "trace" -> Level.FINEST;
            case "all" -> Level.ALL;
            default -> null;
        };
    }
}
