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
import com.hellblazer.quarry.engine.submit.TaskHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Resolves task handles in submission order and merges their outputs.
 *
 * <p>Handles are awaited strictly in the order they were submitted, regardless of which finishes first, so merged
 * buckets line up with the workload. The first failing handle aborts the merge and its exception propagates; nothing
 * merged so far is returned.
 *
 * @author hal.hildebrand
 */
public final class ResultAggregator {
    private static final Logger log = LoggerFactory.getLogger(ResultAggregator.class);

    private final String  label;
    private final boolean verbose;

    public ResultAggregator(String label, boolean verbose) {
        this.label = Objects.requireNonNull(label, "label cannot be null");
        this.verbose = verbose;
    }

    /**
     * Merge multi-bucket chunk outputs.
     *
     * @param handles   handles in submission order
     * @param outputDim number of buckets every chunk output must carry
     * @return the present buckets
     * @throws WorkerExecutionException if a chunk failed, returned no output, returned the wrong number of buckets,
     *                                  or marked a bucket absent that other chunks filled
     */
    public AggregatedResult merge(List<TaskHandle<ChunkOutput>> handles, int outputDim) {
        if (outputDim <= 0) {
            throw new ConfigurationException("outputDim must be positive: " + outputDim);
        }
        var buckets = new ArrayList<List<Object>>(outputDim);
        for (int k = 0; k < outputDim; k++) {
            buckets.add(new ArrayList<>());
        }
        // null until the first chunk decides presence of the bucket
        var present = new Boolean[outputDim];

        int resolved = 0;
        for (var handle : handles) {
            var chunk = handle.chunk();
            var output = handle.await();
            if (output == null) {
                throw new WorkerExecutionException(chunk.index(), "Chunk " + chunk.index() + " returned no output");
            }
            if (output.dimension() != outputDim) {
                throw new WorkerExecutionException(chunk.index(), String.format(
                "Chunk %d returned %d buckets, expected %d", chunk.index(), output.dimension(), outputDim));
            }
            for (int k = 0; k < outputDim; k++) {
                boolean absent = output.isAbsent(k);
                if (present[k] == null) {
                    present[k] = !absent;
                } else if (present[k] == absent) {
                    throw new WorkerExecutionException(chunk.index(), String.format(
                    "Bucket %d is %s in chunk %d but not in earlier chunks", k, absent ? "absent" : "present",
                    chunk.index()));
                }
                if (!absent) {
                    buckets.get(k).addAll(output.bucket(k));
                }
            }
            resolved++;
            if (verbose) {
                log.debug("[{}] Done chunk {}/{}", label, resolved, handles.size());
            }
        }

        var kept = new ArrayList<List<Object>>(outputDim);
        var keptIndices = new ArrayList<Integer>(outputDim);
        for (int k = 0; k < outputDim; k++) {
            // No chunks at all: every bucket is present and empty
            if (present[k] == null || present[k]) {
                kept.add(buckets.get(k));
                keptIndices.add(k);
            }
        }
        if (kept.size() < outputDim) {
            log.debug("[{}] Dropped {} absent bucket(s)", label, outputDim - kept.size());
        }
        return new AggregatedResult(outputDim, kept, keptIndices);
    }

    /**
     * Concatenate flat per-chunk lists in submission order.
     *
     * @param handles handles in submission order
     * @return the concatenation
     */
    public <R> List<R> concat(List<TaskHandle<List<R>>> handles) {
        var merged = new ArrayList<R>();
        int resolved = 0;
        for (var handle : handles) {
            var chunk = handle.chunk();
            var output = handle.await();
            if (output == null) {
                throw new WorkerExecutionException(chunk.index(), "Chunk " + chunk.index() + " returned no output");
            }
            merged.addAll(output);
            resolved++;
            if (verbose) {
                log.debug("[{}] Done chunk {}/{}", label, resolved, handles.size());
            }
        }
        return merged;
    }
}
