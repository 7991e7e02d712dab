package com.capsulo.cms.core.concurrent;

import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

import com.capsulo.cms.util.ApiException;

/**
 * Collapses concurrent calls for the same key into one execution. The first caller runs the work
 * on its own thread; callers arriving while it runs wait for and share its outcome, value or
 * exception. The key is released as soon as the run finishes, so a failure is not remembered.
 */
public final class SingleFlight<V> {

    private final Map<String, CompletableFuture<V>> inFlight = new ConcurrentHashMap<>();

    public V run(String key, Supplier<V> work) {
        CompletableFuture<V> mine = new CompletableFuture<>();
        CompletableFuture<V> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) return await(existing);

        try {
            V value = work.get();
            mine.complete(value);
            return value;
        } catch (RuntimeException | Error e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    public boolean isInFlight(String key) {
        return inFlight.containsKey(key);
    }

    private static <V> V await(CompletableFuture<V> f) {
        try {
            return f.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new ApiException(500, "shared operation failed: " + cause, cause);
        } catch (CancellationException e) {
            throw new ApiException(500, "shared operation was cancelled", e);
        }
    }
}
