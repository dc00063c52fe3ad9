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
package com.hellblazer.quarry.engine.submit;

import com.hellblazer.quarry.engine.EngineException.ConfigurationException;
import com.hellblazer.quarry.engine.EngineException.WorkerExecutionException;
import com.hellblazer.quarry.engine.device.DeviceAffinity;
import com.hellblazer.quarry.engine.partition.Chunk;
import com.hellblazer.quarry.engine.partition.Partitioner;
import com.hellblazer.quarry.engine.progress.ProgressChannel;
import com.hellblazer.quarry.engine.progress.ProgressSink;
import com.hellblazer.quarry.engine.worker.WorkerInitializer;
import com.hellblazer.quarry.engine.worker.WorkerPool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@Timeout(value = 30, unit = TimeUnit.SECONDS)
public class TaskSubmitterTest {

    private WorkerPool pool;

    @BeforeEach
    void setUp() {
        pool = WorkerPool.start("submitter", 1, 50, DeviceAffinity.none(), WorkerInitializer.NONE);
    }

    @AfterEach
    void tearDown() {
        pool.close();
    }

    @Test
    void testUnthrottledKeepsSubmissionOrder() {
        var submitter = new TaskSubmitter<Integer>(pool, 0, null);
        for (var chunk : Partitioner.bySize(50, 10)) {
            submitter.submit(chunk, context -> chunk.start());
        }
        assertFalse(submitter.isThrottled());
        assertEquals(5, submitter.submittedCount());
        var handles = submitter.handles();
        for (int i = 0; i < handles.size(); i++) {
            assertEquals(i, handles.get(i).chunk().index());
            assertEquals(i * 10, handles.get(i).await());
        }
        assertThrows(UnsupportedOperationException.class, () -> handles.remove(0));
    }

    @Test
    void testThrottledBoundsOutstandingHandles() {
        var submitter = new TaskSubmitter<Integer>(pool, 2, null);
        for (var chunk : Partitioner.bySize(6, 1)) {
            submitter.submit(chunk, context -> {
                Thread.sleep(50);
                return chunk.index();
            });
            assertTrue(submitter.peakOutstanding() <= 2);
        }
        assertEquals(6, submitter.submittedCount());
        assertTrue(submitter.throttleWaits() > 0);
        for (var handle : submitter.handles()) {
            assertEquals(handle.chunk().index(), handle.await());
        }
    }

    @Test
    void testThrottledWaitFailsFast() {
        var submitter = new TaskSubmitter<Integer>(pool, 1, null);
        submitter.submit(new Chunk(0, 0, 1), context -> {
            throw new IllegalArgumentException("bad");
        });
        var e = assertThrows(WorkerExecutionException.class,
                             () -> submitter.submit(new Chunk(1, 1, 2), context -> 1));
        assertEquals(0, e.getChunkIndex());
        assertEquals(1, submitter.submittedCount());
    }

    @Test
    void testProgressCountsEveryResolvedHandle() {
        var sink = mock(ProgressSink.class);
        var progress = ProgressChannel.open("submit", 4, sink);
        var submitter = new TaskSubmitter<Integer>(pool, 0, progress);
        for (var chunk : Partitioner.bySize(4, 1)) {
            submitter.submit(chunk, context -> chunk.index());
        }
        submitter.handles().forEach(TaskHandle::await);
        progress.close();

        assertEquals(4, progress.completedCount());
        verify(sink).onStart("submit", 4);
        verify(sink).onFinish(4, 4);
    }

    @Test
    void testNegativeBound() {
        assertThrows(ConfigurationException.class, () -> new TaskSubmitter<Integer>(pool, -1, null));
    }

    @Test
    void testHandleUnwrapsForeignFailure() {
        var future = new CompletableFuture<Integer>();
        future.completeExceptionally(new IllegalStateException("foreign"));
        var handle = new TaskHandle<>(new Chunk(3, 0, 1), future);
        var e = assertThrows(WorkerExecutionException.class, handle::await);
        assertEquals(3, e.getChunkIndex());
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    void testInterruptedAwaitIsReportedAgainstCoordinator() {
        var pending = new CompletableFuture<Integer>();
        var handle = new TaskHandle<>(new Chunk(5, 0, 1), pending);
        Thread.currentThread().interrupt();
        try {
            var e = assertThrows(WorkerExecutionException.class, handle::await);
            assertEquals(5, e.getChunkIndex());
            assertTrue(e.getMessage().contains("interrupted while waiting for chunk 5"), e.getMessage());
            assertTrue(e.getMessage().contains("did not report a failure"), e.getMessage());
            assertInstanceOf(InterruptedException.class, e.getCause());
        } finally {
            // Also clears the flag for the remaining tests
            assertTrue(Thread.interrupted());
        }
        assertFalse(pending.isDone());
    }
}
