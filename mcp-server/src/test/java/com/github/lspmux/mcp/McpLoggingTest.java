package com.github.lspmux.mcp;

import org.junit.jupiter.api.Test;

import java.util.logging.Level;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

class McpLoggingTest {

    @Test
    void testParseLevel() {
        assertEquals(Level.WARNING, McpLogging.parseLevel("warn"));
        assertEquals(Level.FINE, McpLogging.parseLevel(" DEBUG "));
        assertEquals(Level.SEVERE, McpLogging.parseLevel("error"));
        assertEquals(Level.OFF, McpLogging.parseLevel("off"));
        assertNull(McpLogging.parseLevel("loud"));
    }

    @Test
    void testBundledConfigurationExists() {
        assertNotNull(McpLogging.class.getResourceAsStream(McpLogging.CONFIG_RESOURCE));
    }
}
