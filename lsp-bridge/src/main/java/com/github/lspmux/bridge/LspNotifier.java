package com.github.lspmux.bridge;

import com.google.gson.JsonElement;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Sends one-way JSON-RPC notifications to the language server.
 */
@FunctionalInterface
public interface LspNotifier {
    void notify(@NotNull String method, @Nullable JsonElement params) throws LspException;
}
