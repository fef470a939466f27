package com.github.lspmux.bridge;

import com.google.gson.JsonObject;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * Correlates outgoing request ids with the futures their callers wait on.
 * Ids start at 1, increase monotonically and are never reused within a session.
 * Each entry is removed exactly once: on resolution, abandonment or drain.
 */
final class PendingRequests {
    private static final Logger LOG = Logger.getLogger(PendingRequests.class.getName());

    record PendingRequest(long id, CompletableFuture<JsonObject> response) {
    }

    private final Object lock = new Object();
    private final Map<Long, CompletableFuture<JsonObject>> pending = new HashMap<>();
    private long nextId = 1;

    @NotNull
    PendingRequest register() {
        CompletableFuture<JsonObject> future = new CompletableFuture<>();
        synchronized (lock) {
            long id = nextId++;
            pending.put(id, future);
            return new PendingRequest(id, future);
        }
    }

    /**
     * Complete the waiter for {@code id} with the full response message.
     *
     * @return false if nobody was waiting (late, duplicate or spurious response)
     */
    boolean resolve(long id, @NotNull JsonObject response) {
        CompletableFuture<JsonObject> future;
        synchronized (lock) {
            future = pending.remove(id);
        }
        if (future == null) {
            LOG.warning(() -> "received response for unknown request id " + id);
            return false;
        }
        future.complete(response);
        return true;
    }

    void abandon(long id) {
        synchronized (lock) {
            pending.remove(id);
        }
    }

    /**
     * Fail every outstanding waiter with {@code reason} and empty the map.
     *
     * @return the number of waiters that were failed
     */
    int drainAll(@NotNull Throwable reason) {
        List<CompletableFuture<JsonObject>> drained;
        synchronized (lock) {
            drained = new ArrayList<>(pending.values());
            pending.clear();
        }
        for (CompletableFuture<JsonObject> future : drained) {
            future.completeExceptionally(reason);
        }
        return drained.size();
    }

    int size() {
        synchronized (lock) {
            return pending.size();
        }
    }
}
