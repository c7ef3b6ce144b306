package com.flagship.trade_finance.coordinator;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Runs tasks one at a time per key and in submission order, on a shared executor.
 *
 * Each key keeps the future of its last queued task; a new task is chained
 * behind it whether the previous one succeeded or failed. Different keys run
 * in parallel. The entry for a key is dropped once its last task completes.
 */
@Slf4j
public class KeyedSequencer {

    private static final CompletableFuture<Object> DONE = CompletableFuture.completedFuture(null);

    private final Executor executor;
    private final Map<String, CompletableFuture<?>> tails = new ConcurrentHashMap<>();
    private final Object lock = new Object();

    public KeyedSequencer(Executor executor) {
        this.executor = executor;
    }

    public <T> CompletableFuture<T> enqueue(String key, Supplier<T> task) {
        CompletableFuture<T> next;
        synchronized (lock) {
            CompletableFuture<?> previous = tails.getOrDefault(key, DONE);
            next = previous
                    .handle((ignored, error) -> null)
                    .thenApplyAsync(ignored -> task.get(), executor);
            tails.put(key, next);
        }
        CompletableFuture<T> queued = next;
        queued.whenComplete((result, error) -> tails.remove(key, queued));
        return queued;
    }

    /**
     * Number of keys with queued or running work.
     */
    public int activeKeys() {
        return tails.size();
    }
}
