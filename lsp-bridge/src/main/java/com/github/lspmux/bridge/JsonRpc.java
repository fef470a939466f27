package com.github.lspmux.bridge;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * JSON-RPC 2.0 message shapes.
 */
final class JsonRpc {
    static final String JSONRPC = "jsonrpc";
    static final String VERSION = "2.0";
    static final String ID = "id";
    static final String METHOD = "method";
    static final String PARAMS = "params";
    static final String RESULT = "result";
    static final String ERROR = "error";

    private JsonRpc() {}

    @NotNull
    static JsonObject request(long id, @NotNull String method, @Nullable JsonElement params) {
        JsonObject request = new JsonObject();
        request.addProperty(JSONRPC, VERSION);
        request.addProperty(ID, id);
        request.addProperty(METHOD, method);
        if (params != null && !params.isJsonNull()) {
            request.add(PARAMS, params);
        }
        return request;
    }

    @NotNull
    static JsonObject notification(@NotNull String method, @Nullable JsonElement params) {
        JsonObject message = new JsonObject();
        message.addProperty(JSONRPC, VERSION);
        message.addProperty(METHOD, method);
        if (params != null && !params.isJsonNull()) {
            message.add(PARAMS, params);
        }
        return message;
    }

    @NotNull
    static JsonObject errorResponse(@NotNull JsonElement id, int code, @NotNull String message) {
        JsonObject response = new JsonObject();
        response.addProperty(JSONRPC, VERSION);
        response.add(ID, id);
        JsonObject error = new JsonObject();
        error.addProperty("code", code);
        error.addProperty("message", message);
        response.add(ERROR, error);
        return response;
    }
}
