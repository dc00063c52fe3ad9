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

import com.hellblazer.quarry.engine.EngineException;
import com.hellblazer.quarry.engine.EngineException.WorkerExecutionException;
import com.hellblazer.quarry.engine.partition.Chunk;

import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * The pending result of one submitted chunk.
 *
 * @param chunk  the chunk the task works on
 * @param future completed by the worker
 * @param <R>    result type
 * @author hal.hildebrand
 */
public record TaskHandle<R>(Chunk chunk, CompletableFuture<R> future) {

    public TaskHandle {
        Objects.requireNonNull(chunk, "chunk cannot be null");
        Objects.requireNonNull(future, "future cannot be null");
    }

    /**
     * Block until the task completes.
     *
     * @return the task's result
     * @throws EngineException the failure reported by the worker, unwrapped. If the calling thread is interrupted the
     *                         chunk may still be running; the exception says so and the interrupt flag is restored
     */
    public R await() {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkerExecutionException(chunk.index(), "Coordinator thread " + Thread.currentThread().getName()
                                                              + " interrupted while waiting for chunk " + chunk.index()
                                                              + "; the worker did not report a failure", e);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        } catch (CancellationException e) {
            throw new WorkerExecutionException(chunk.index(), "Chunk " + chunk.index() + " was cancelled", e);
        }
    }

    public boolean isDone() {
        return future.isDone();
    }

    private EngineException unwrap(Throwable cause) {
        if (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof EngineException engineException) {
            return engineException;
        }
        return new WorkerExecutionException(chunk.index(), "Chunk " + chunk.index() + " failed", cause);
    }
}
