package com.github.lspmux.mcp;

/**
 * Tool arguments failed validation. Reported to the MCP client as JSON-RPC error {@code -32602}.
 */
public class InvalidParamsException extends Exception {

    public InvalidParamsException(String message) {
        super(message);
    }
}
