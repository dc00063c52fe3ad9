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
package com.hellblazer.quarry.engine;

import com.hellblazer.quarry.engine.partition.Chunk;
import com.hellblazer.quarry.engine.progress.ProgressChannel;
import com.hellblazer.quarry.engine.progress.ProgressSink;
import com.hellblazer.quarry.engine.submit.TaskHandle;
import com.hellblazer.quarry.engine.submit.TaskSubmitter;
import com.hellblazer.quarry.engine.worker.WorkerCallable;
import com.hellblazer.quarry.engine.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * State owned by the coordinator for the duration of one run: the pool, the submitter with its outstanding handles,
 * the optional progress channel and the run state. Nothing here is shared between runs.
 *
 * @author hal.hildebrand
 */
final class RunContext<R> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RunContext.class);

    private final String           label;
    private final WorkerPool       pool;
    private final ProgressChannel  progress;
    private final TaskSubmitter<R> submitter;
    private       RunState         state = RunState.CREATED;

    private RunContext(String label, WorkerPool pool, ProgressChannel progress, TaskSubmitter<R> submitter) {
        this.label = label;
        this.pool = pool;
        this.progress = progress;
        this.submitter = submitter;
    }

    /**
     * @param label         run label
     * @param pool          the run's pool, released when the context closes
     * @param inFlightBound outstanding handle bound, 0 for unthrottled
     * @param sink          progress observer, null to disable progress tracking
     * @param total         number of chunks the run will submit
     */
    static <R> RunContext<R> open(String label, WorkerPool pool, int inFlightBound, ProgressSink sink, int total) {
        Objects.requireNonNull(label, "label cannot be null");
        Objects.requireNonNull(pool, "pool cannot be null");
        var progress = sink == null ? null : ProgressChannel.open(label, total, sink);
        return new RunContext<>(label, pool, progress, new TaskSubmitter<>(pool, inFlightBound, progress));
    }

    TaskHandle<R> submit(Chunk chunk, WorkerCallable<R> work) {
        if (state == RunState.CREATED) {
            advance(RunState.SUBMITTING);
        }
        if (state != RunState.SUBMITTING) {
            throw new IllegalStateException("Cannot submit chunk " + chunk.index() + " in state " + state);
        }
        return submitter.submit(chunk, work);
    }

    /**
     * Finish submission.
     *
     * @return all handles in submission order
     */
    List<TaskHandle<R>> drain() {
        advance(RunState.DRAINING);
        return submitter.handles();
    }

    /**
     * Release the pool and close the progress channel. Runs on every exit path; idempotent.
     */
    @Override
    public void close() {
        if (state == RunState.CLOSED) {
            return;
        }
        try {
            pool.shutdown();
        } finally {
            if (progress != null) {
                progress.close();
            }
            advance(RunState.CLOSED);
        }
    }

    RunState state() {
        return state;
    }

    WorkerPool pool() {
        return pool;
    }

    TaskSubmitter<R> submitter() {
        return submitter;
    }

    ProgressChannel progress() {
        return progress;
    }

    private void advance(RunState next) {
        if (!state.canAdvanceTo(next)) {
            throw new IllegalStateException("Illegal transition " + state + " -> " + next);
        }
        if (state != next) {
            log.trace("[{}] {} -> {}", label, state, next);
            state = next;
        }
    }
}
