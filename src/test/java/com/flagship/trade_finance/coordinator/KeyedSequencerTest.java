package com.flagship.trade_finance.coordinator;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class KeyedSequencerTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(4);
    private final KeyedSequencer sequencer = new KeyedSequencer(executor);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Tasks with the same key run one at a time in submission order")
    void sameKeyRunsInOrder() throws Exception {
        List<Integer> order = new CopyOnWriteArrayList<>();
        CountDownLatch firstStarted = new CountDownLatch(1);
        CountDownLatch releaseFirst = new CountDownLatch(1);

        CompletableFuture<Integer> first = sequencer.enqueue("acct|ship", () -> {
            firstStarted.countDown();
            await(releaseFirst);
            order.add(1);
            return 1;
        });
        assertTrue(firstStarted.await(5, TimeUnit.SECONDS));
        CompletableFuture<Integer> second = sequencer.enqueue("acct|ship", () -> {
            order.add(2);
            return 2;
        });

        Thread.sleep(100);
        assertFalse(second.isDone(), "Second task must wait for the first");

        releaseFirst.countDown();
        assertEquals(2, second.get(5, TimeUnit.SECONDS));
        assertEquals(1, first.get());
        assertEquals(List.of(1, 2), order);
    }

    @Test
    @DisplayName("Different keys run in parallel")
    void differentKeysRunInParallel() throws Exception {
        CountDownLatch bothRunning = new CountDownLatch(2);

        CompletableFuture<Boolean> a = sequencer.enqueue("a", () -> arriveAndWait(bothRunning));
        CompletableFuture<Boolean> b = sequencer.enqueue("b", () -> arriveAndWait(bothRunning));

        assertTrue(a.get(5, TimeUnit.SECONDS));
        assertTrue(b.get(5, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("A failed task does not block the next one for its key")
    void failureDoesNotBlockSuccessor() throws Exception {
        CompletableFuture<String> failing = sequencer.enqueue("k", () -> {
            throw new IllegalStateException("boom");
        });
        CompletableFuture<String> next = sequencer.enqueue("k", () -> "ran");

        ExecutionException e = assertThrows(ExecutionException.class, () -> failing.get(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertEquals("ran", next.get(5, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("Idle keys are dropped")
    void idleKeysAreDropped() throws Exception {
        sequencer.enqueue("k1", () -> 1).get(5, TimeUnit.SECONDS);
        sequencer.enqueue("k2", () -> 2).get(5, TimeUnit.SECONDS);

        long deadline = System.currentTimeMillis() + 2000;
        while (sequencer.activeKeys() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(0, sequencer.activeKeys());
    }

    private static boolean arriveAndWait(CountDownLatch latch) {
        latch.countDown();
        return await(latch);
    }

    private static boolean await(CountDownLatch latch) {
        try {
            return latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
