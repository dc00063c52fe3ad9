/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Quarry.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.quarry.engine.aggregate;

import com.hellblazer.quarry.engine.EngineException.ConfigurationException;
import com.hellblazer.quarry.engine.EngineException.WorkerExecutionException;
import com.hellblazer.quarry.engine.EngineException.WorkerLostException;
import com.hellblazer.quarry.engine.partition.Chunk;
import com.hellblazer.quarry.engine.submit.TaskHandle;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ResultAggregator
 */
@Timeout(value = 10, unit = TimeUnit.SECONDS)
public class ResultAggregatorTest {

    private final ResultAggregator aggregator = new ResultAggregator("test", true);

    private static <R> TaskHandle<R> done(int index, R value) {
        return new TaskHandle<>(new Chunk(index, index, index + 1), CompletableFuture.completedFuture(value));
    }

    private static <R> TaskHandle<R> failed(int index, RuntimeException failure) {
        var future = new CompletableFuture<R>();
        future.completeExceptionally(failure);
        return new TaskHandle<>(new Chunk(index, index, index + 1), future);
    }

    private static <R> TaskHandle<R> pending(int index) {
        return new TaskHandle<>(new Chunk(index, index, index + 1), new CompletableFuture<>());
    }

    @Test
    void testMergesInSubmissionOrder() {
        var first = new CompletableFuture<ChunkOutput>();
        var handles = List.of(new TaskHandle<>(new Chunk(0, 0, 2), first),
                              done(1, ChunkOutput.single(List.of(3, 4))));
        // The later chunk completes first
        CompletableFuture.runAsync(() -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            first.complete(ChunkOutput.single(List.of(1, 2)));
        });

        var result = aggregator.merge(handles, 1);
        assertEquals(1, result.bucketCount());
        assertEquals(List.of(1, 2, 3, 4), result.bucket(0));
    }

    @Test
    void testAbsentBucketIsDropped() {
        var handles = List.of(done(0, ChunkOutput.of(List.of("a"), null)),
                              done(1, ChunkOutput.of(List.of("b", "c"), null)));
        var result = aggregator.merge(handles, 2);

        assertEquals(1, result.bucketCount());
        assertEquals(1, result.droppedBucketCount());
        assertEquals(0, result.sourceIndex(0));
        assertEquals(List.of("a", "b", "c"), result.bucket(0));
    }

    @Test
    void testLeadingAbsentBucketIsDropped() {
        var handles = List.of(done(0, ChunkOutput.of(null, List.of(1.0))));
        var result = aggregator.merge(handles, 2);
        assertEquals(1, result.bucketCount());
        assertEquals(1, result.sourceIndex(0));
    }

    @Test
    void testPresentButEmptyBucketIsKept() {
        var handles = List.of(done(0, ChunkOutput.of(List.of(), List.of(1))),
                              done(1, ChunkOutput.of(List.of(), List.of(2))));
        var result = aggregator.merge(handles, 2);
        assertEquals(2, result.bucketCount());
        assertTrue(result.bucket(0).isEmpty());
        assertEquals(List.of(1, 2), result.bucket(1));
    }

    @Test
    void testNoChunksYieldsEmptyBuckets() {
        var result = aggregator.merge(List.of(), 3);
        assertEquals(3, result.bucketCount());
        for (int k = 0; k < 3; k++) {
            assertTrue(result.bucket(k).isEmpty());
        }
    }

    @Test
    void testMixedPresenceIsRejected() {
        var handles = List.of(done(0, ChunkOutput.of(List.of(1), List.of(2))),
                              done(1, ChunkOutput.of(List.of(3), null)));
        var e = assertThrows(WorkerExecutionException.class, () -> aggregator.merge(handles, 2));
        assertEquals(1, e.getChunkIndex());
    }

    @Test
    void testWrongDimensionIsRejected() {
        var handles = List.of(done(0, ChunkOutput.single(List.of(1))));
        assertThrows(WorkerExecutionException.class, () -> aggregator.merge(handles, 2));
        assertThrows(ConfigurationException.class, () -> aggregator.merge(handles, 0));
    }

    @Test
    void testNullOutputIsRejected() {
        List<TaskHandle<ChunkOutput>> handles = List.of(done(0, null));
        assertThrows(WorkerExecutionException.class, () -> aggregator.merge(handles, 1));
    }

    @Test
    void testFailureAbortsBeforeLaterHandles() {
        // The third handle never completes; resolving it would hang
        List<TaskHandle<ChunkOutput>> handles = List.of(done(0, ChunkOutput.single(List.of(1))),
                                                        failed(1, new WorkerExecutionException(1, "boom")),
                                                        pending(2));
        var e = assertThrows(WorkerExecutionException.class, () -> aggregator.merge(handles, 1));
        assertEquals(1, e.getChunkIndex());
        assertEquals("boom", e.getMessage());
    }

    @Test
    void testWorkerLossKeepsItsClass() {
        List<TaskHandle<List<Integer>>> handles = List.of(failed(0, new WorkerLostException(0, 2, new Error())));
        var e = assertThrows(WorkerLostException.class, () -> aggregator.concat(handles));
        assertEquals(2, e.getSlot());
    }

    @Test
    void testConcat() {
        var handles = List.of(done(0, List.of("x")), done(1, List.<String>of()), done(2, List.of("y", "z")));
        assertEquals(List.of("x", "y", "z"), aggregator.concat(handles));
    }

    @Test
    void testChunkOutput() {
        var output = ChunkOutput.of(List.of(1), null);
        assertEquals(2, output.dimension());
        assertFalse(output.isAbsent(0));
        assertTrue(output.isAbsent(1));
        assertNull(output.bucket(1));
        assertEquals(3, ChunkOutput.absent(3).dimension());
        assertThrows(IllegalArgumentException.class, () -> ChunkOutput.of());
        assertThrows(IllegalArgumentException.class, () -> ChunkOutput.absent(0));
    }
}
