package com.github.lspmux.bridge;

import com.google.gson.JsonObject;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class PendingRequestsTest {

    private static JsonObject response(long id) {
        JsonObject response = new JsonObject();
        response.addProperty("id", id);
        return response;
    }

    @Test
    void testIdsStartAtOneAndIncrease() {
        PendingRequests pending = new PendingRequests();
        assertEquals(1, pending.register().id());
        assertEquals(2, pending.register().id());
        assertEquals(3, pending.register().id());
        assertEquals(3, pending.size());
    }

    @Test
    void testConcurrentRegistrationsAreDistinct() throws Exception {
        PendingRequests pending = new PendingRequests();
        int threads = 8;
        int perThread = 500;
        List<Long> ids = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    go.await();
                    List<Long> local = new ArrayList<>();
                    for (int i = 0; i < perThread; i++) {
                        local.add(pending.register().id());
                    }
                    for (int i = 1; i < local.size(); i++) {
                        assertTrue(local.get(i) > local.get(i - 1), "ids increase within a thread");
                    }
                    ids.addAll(local);
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdown();
            assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
        }

        Set<Long> distinct = new HashSet<>(ids);
        assertEquals(threads * perThread, distinct.size());
        assertEquals(1L, Collections.min(distinct));
        assertEquals((long) threads * perThread, Collections.max(distinct));
    }

    @Test
    void testResolveCompletesOnlyMatchingWaiter() throws Exception {
        PendingRequests pending = new PendingRequests();
        PendingRequests.PendingRequest first = pending.register();
        PendingRequests.PendingRequest second = pending.register();

        assertTrue(pending.resolve(second.id(), response(second.id())));

        assertFalse(first.response().isDone());
        assertEquals(second.id(), second.response().get().get("id").getAsLong());
        assertEquals(1, pending.size());
    }

    @Test
    void testUnknownAndDuplicateResponsesAreDropped() {
        PendingRequests pending = new PendingRequests();
        PendingRequests.PendingRequest request = pending.register();

        assertFalse(pending.resolve(42, response(42)));
        assertTrue(pending.resolve(request.id(), response(request.id())));
        assertFalse(pending.resolve(request.id(), response(request.id())), "second response for the same id");
        assertEquals(0, pending.size());
    }

    @Test
    void testAbandonRemovesEntrySoLateResponseIsDropped() {
        PendingRequests pending = new PendingRequests();
        PendingRequests.PendingRequest request = pending.register();

        pending.abandon(request.id());

        assertEquals(0, pending.size());
        assertFalse(pending.resolve(request.id(), response(request.id())));
        assertFalse(request.response().isDone());
    }

    @Test
    void testDrainAllFailsEveryWaiter() {
        PendingRequests pending = new PendingRequests();
        PendingRequests.PendingRequest a = pending.register();
        PendingRequests.PendingRequest b = pending.register();
        LspException reason = new LspException("gone", null, false);

        assertEquals(2, pending.drainAll(reason));

        assertEquals(0, pending.size());
        ExecutionException e = assertThrows(ExecutionException.class, () -> a.response().get());
        assertSame(reason, e.getCause());
        assertTrue(b.response().isCompletedExceptionally());
        assertEquals(0, pending.drainAll(reason));
    }

    @Test
    void testIdsAreNotReusedAfterDrain() {
        PendingRequests pending = new PendingRequests();
        pending.register();
        pending.register();
        pending.drainAll(new LspException("gone"));
        assertEquals(3, pending.register().id());
    }
}
