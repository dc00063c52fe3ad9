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
import com.hellblazer.quarry.engine.partition.Chunk;
import com.hellblazer.quarry.engine.progress.ProgressChannel;
import com.hellblazer.quarry.engine.worker.WorkerCallable;
import com.hellblazer.quarry.engine.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Submits one task per chunk to a {@link WorkerPool}, keeping the handles in submission order.
 *
 * <p>With a positive in-flight bound the submitter throttles: before each submission it drops handles that have
 * already completed and, while the number of outstanding handles is still at the bound, blocks on the oldest one.
 * This caps the handles buffered by the coordinator, not the pool's concurrency. A failed handle seen while
 * throttling aborts submission immediately.
 *
 * <p>With a {@link ProgressChannel} each handle reports its completion to the channel before it becomes resolvable,
 * so every resolved handle has been counted.
 *
 * <p>Not thread safe: owned by the coordinator of a single run.
 *
 * @param <R> per-chunk result type
 * @author hal.hildebrand
 */
public final class TaskSubmitter<R> {
    private static final Logger log = LoggerFactory.getLogger(TaskSubmitter.class);

    private final WorkerPool            pool;
    private final int                   inFlightBound;
    private final ProgressChannel       progress;
    private final List<TaskHandle<R>>   handles     = new ArrayList<>();
    private final Deque<TaskHandle<R>>  outstanding = new ArrayDeque<>();
    private       int                   peakOutstanding;
    private       int                   throttleWaits;

    /**
     * @param pool          the pool to submit to
     * @param inFlightBound maximum outstanding handles, 0 for unthrottled
     * @param progress      progress channel, or null when progress is not tracked
     */
    public TaskSubmitter(WorkerPool pool, int inFlightBound, ProgressChannel progress) {
        this.pool = Objects.requireNonNull(pool, "pool cannot be null");
        if (inFlightBound < 0) {
            throw new ConfigurationException("inFlightBound must be non-negative: " + inFlightBound);
        }
        this.inFlightBound = inFlightBound;
        this.progress = progress;
    }

    /**
     * Submit the work for one chunk, throttling first when bounded.
     *
     * @param chunk the chunk, submitted in partition order
     * @param work  the work to run
     * @return the handle of the task
     */
    public TaskHandle<R> submit(Chunk chunk, WorkerCallable<R> work) {
        Objects.requireNonNull(chunk, "chunk cannot be null");
        if (inFlightBound > 0) {
            throttle();
        } else {
            outstanding.removeIf(TaskHandle::isDone);
        }
        var future = pool.submit(chunk.index(), work);
        if (progress != null) {
            var channel = progress;
            future = future.whenComplete((value, failure) -> channel.completed());
        }
        var handle = new TaskHandle<>(chunk, future);
        handles.add(handle);
        outstanding.addLast(handle);
        peakOutstanding = Math.max(peakOutstanding, outstanding.size());
        return handle;
    }

    /**
     * Every handle submitted so far, in submission order.
     */
    public List<TaskHandle<R>> handles() {
        return Collections.unmodifiableList(handles);
    }

    public int submittedCount() {
        return handles.size();
    }

    public int inFlightBound() {
        return inFlightBound;
    }

    public boolean isThrottled() {
        return inFlightBound > 0;
    }

    /**
     * Largest number of unresolved handles observed right after a submission.
     */
    public int peakOutstanding() {
        return peakOutstanding;
    }

    /**
     * How many times submission blocked on the oldest outstanding handle.
     */
    public int throttleWaits() {
        return throttleWaits;
    }

    private void throttle() {
        pruneCompleted();
        while (outstanding.size() >= inFlightBound) {
            var oldest = outstanding.pollFirst();
            throttleWaits++;
            log.trace("Throttling on chunk {} with {} outstanding", oldest.chunk().index(), outstanding.size() + 1);
            oldest.await();
            pruneCompleted();
        }
    }

    // A handle that already failed surfaces here instead of at aggregation
    private void pruneCompleted() {
        for (var it = outstanding.iterator(); it.hasNext(); ) {
            var handle = it.next();
            if (handle.isDone()) {
                it.remove();
                if (handle.future().isCompletedExceptionally()) {
                    handle.await();
                }
            }
        }
    }
}
