/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.foreststate.serial;

import dev.mars.foreststate.storage.ValidationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ProjectOperationSerializer}.
 * <p>
 * These tests verify:
 * <ul>
 *   <li>Same-project operations never overlap and start in submission order</li>
 *   <li>Different projects proceed independently</li>
 *   <li>A failing operation fails only its own future</li>
 *   <li>The lock table is emptied once a project goes idle</li>
 * </ul>
 */
class ProjectOperationSerializerTest {

    private final ExecutorService workers = Executors.newFixedThreadPool(8);
    private final ProjectOperationSerializer serializer = new ProjectOperationSerializer();

    @AfterEach
    void tearDown() {
        serializer.close();
        workers.shutdownNow();
    }

    private CompletableFuture<Integer> slowTask(int value, long sleepMillis) {
        return CompletableFuture.supplyAsync(() -> {
            sleep(sleepMillis);
            return value;
        }, workers);
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private void awaitIdle() throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!serializer.activeProjects().isEmpty() && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
    }

    // ========================================================================
    // Ordering
    // ========================================================================

    @Test
    void testSameProject_RunsOneAtATimeInSubmissionOrder() throws Exception {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        List<Integer> startOrder = Collections.synchronizedList(new ArrayList<>());
        List<CompletableFuture<Integer>> results = new ArrayList<>();

        for (int i = 0; i < 20; i++) {
            int n = i;
            results.add(serializer.run("p1", () -> {
                startOrder.add(n);
                maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                // Later operations are faster, so overlap would reorder completions
                return slowTask(n, 20 - n).whenComplete((v, e) -> running.decrementAndGet());
            }));
        }

        for (int i = 0; i < 20; i++) {
            assertEquals(i, results.get(i).get(5, TimeUnit.SECONDS));
        }
        assertEquals(1, maxRunning.get());
        List<Integer> expected = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            expected.add(i);
        }
        assertEquals(expected, startOrder);
    }

    @Test
    void testReadModifyWrite_NoLostUpdates() throws Exception {
        int[] counter = {0};
        List<CompletableFuture<Void>> all = new ArrayList<>();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService submitters = Executors.newFixedThreadPool(4);
        try {
            List<CompletableFuture<CompletableFuture<Void>>> submitted = new ArrayList<>();
            for (int i = 0; i < 100; i++) {
                submitted.add(CompletableFuture.supplyAsync(() -> {
                    try {
                        start.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return serializer.run("p1", () -> CompletableFuture.supplyAsync(() -> counter[0], workers)
                            .thenApplyAsync(read -> {
                                counter[0] = read + 1;
                                return (Void) null;
                            }, workers));
                }, submitters));
            }
            start.countDown();
            for (CompletableFuture<CompletableFuture<Void>> s : submitted) {
                all.add(s.get(5, TimeUnit.SECONDS));
            }
            CompletableFuture.allOf(all.toArray(new CompletableFuture[0])).get(10, TimeUnit.SECONDS);
        } finally {
            submitters.shutdownNow();
        }

        assertEquals(100, counter[0]);
    }

    @Test
    void testDifferentProjects_DoNotWaitForEachOther() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CompletableFuture<String> blocked = serializer.run("p1",
                () -> CompletableFuture.supplyAsync(() -> {
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return "p1";
                }, workers));

        String other = serializer.run("p2", () -> CompletableFuture.completedFuture("p2")).get(5, TimeUnit.SECONDS);

        assertEquals("p2", other);
        assertFalse(blocked.isDone());
        release.countDown();
        assertEquals("p1", blocked.get(5, TimeUnit.SECONDS));
    }

    // ========================================================================
    // Failure Isolation
    // ========================================================================

    @Test
    void testFailedOperation_DoesNotBlockQueue() throws Exception {
        CompletableFuture<Integer> failing = serializer.run("p1",
                () -> CompletableFuture.failedFuture(new IllegalStateException("boom")));
        CompletableFuture<Integer> next = serializer.run("p1", () -> CompletableFuture.completedFuture(7));

        ExecutionException e = assertThrows(ExecutionException.class, () -> failing.get(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertEquals(7, next.get(5, TimeUnit.SECONDS));
    }

    @Test
    void testSynchronousThrow_FailsOnlyThatOperation() throws Exception {
        CompletableFuture<Integer> throwing = serializer.run("p1", () -> {
            throw new IllegalArgumentException("thrown before returning a stage");
        });
        CompletableFuture<Integer> next = serializer.run("p1", () -> CompletableFuture.completedFuture(1));

        ExecutionException e = assertThrows(ExecutionException.class, () -> throwing.get(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
        assertEquals(1, next.get(5, TimeUnit.SECONDS));
    }

    @Test
    void testNullStage_IsAFailure() throws Exception {
        CompletableFuture<Integer> nullStage = serializer.run("p1", () -> null);

        ExecutionException e = assertThrows(ExecutionException.class, () -> nullStage.get(5, TimeUnit.SECONDS));
        assertInstanceOf(NullPointerException.class, e.getCause());
        assertEquals(2, serializer.run("p1", () -> CompletableFuture.completedFuture(2)).get(5, TimeUnit.SECONDS));
    }

    @Test
    void testInvalidProjectId_RejectedImmediately() {
        assertThrows(ValidationException.class,
                () -> serializer.run("../escape", () -> CompletableFuture.completedFuture(1)));
    }

    // ========================================================================
    // Lock Table
    // ========================================================================

    @Test
    void testLockTable_EmptiedWhenIdle() throws Exception {
        List<CompletableFuture<Integer>> results = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            results.add(serializer.run("project-" + (i % 5), () -> slowTask(1, 1)));
        }
        for (CompletableFuture<Integer> r : results) {
            r.get(5, TimeUnit.SECONDS);
        }

        awaitIdle();

        assertTrue(serializer.activeProjects().isEmpty());
        assertEquals(0, serializer.pendingOperations("project-0"));
    }

    @Test
    void testPendingOperations_CountsQueuedWork() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CompletableFuture<Integer> first = serializer.run("p1", () -> CompletableFuture.supplyAsync(() -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return 1;
        }, workers));
        CompletableFuture<Integer> second = serializer.run("p1", () -> CompletableFuture.completedFuture(2));

        assertEquals(2, serializer.pendingOperations("p1"));
        assertTrue(serializer.activeProjects().contains("p1"));

        release.countDown();
        first.get(5, TimeUnit.SECONDS);
        second.get(5, TimeUnit.SECONDS);
        awaitIdle();
        assertEquals(0, serializer.pendingOperations("p1"));
    }

    @Test
    void testClosed_RejectsNewOperations() {
        serializer.close();

        CompletableFuture<Integer> rejected = serializer.run("p1", () -> CompletableFuture.completedFuture(1));

        ExecutionException e = assertThrows(ExecutionException.class, () -> rejected.get(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }
}
