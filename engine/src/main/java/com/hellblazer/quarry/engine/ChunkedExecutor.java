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

import com.hellblazer.quarry.engine.aggregate.AggregatedResult;
import com.hellblazer.quarry.engine.aggregate.ChunkOutput;
import com.hellblazer.quarry.engine.aggregate.ResultAggregator;
import com.hellblazer.quarry.engine.device.DeviceAffinity;
import com.hellblazer.quarry.engine.partition.Chunk;
import com.hellblazer.quarry.engine.partition.LabeledWorkload;
import com.hellblazer.quarry.engine.partition.Partitioner;
import com.hellblazer.quarry.engine.progress.ProgressSink;
import com.hellblazer.quarry.engine.submit.TaskHandle;
import com.hellblazer.quarry.engine.worker.WorkerCallable;
import com.hellblazer.quarry.engine.worker.WorkerInitializer;
import com.hellblazer.quarry.engine.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Chunked execution of a workload over a fresh pool of workers.
 *
 * <p>Each invocation partitions the workload, starts a {@link WorkerPool}, submits one task per chunk in partition
 * order, merges the results in that same order and releases the pool, on success and on failure alike. Pools are
 * never shared between invocations, so a single executor may run any number of invocations one after another.
 *
 * <pre>{@code
 * var executor = new ChunkedExecutor(EngineConfiguration.defaultConfig().withChunkSize(10))
 *     .withProgressSink(new LoggingProgressSink());
 * List<Integer> doubled = executor.map(items, (chunk, factor) -> scale(chunk, factor), 2);
 * }</pre>
 *
 * <p>Failures are fail-fast: the first chunk that fails, in submission order, aborts the run with its
 * {@link EngineException}; no partial result is returned.
 *
 * @author hal.hildebrand
 */
public final class ChunkedExecutor {
    private static final Logger log = LoggerFactory.getLogger(ChunkedExecutor.class);

    private final EngineConfiguration  config;
    private       WorkerInitializer    initializer  = WorkerInitializer.NONE;
    private       ProgressSink         progressSink;
    private       Consumer<WorkerPool> poolListener = pool -> {
    };

    public ChunkedExecutor(EngineConfiguration config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    public ChunkedExecutor() {
        this(EngineConfiguration.defaultConfig());
    }

    /**
     * Initializer run once per worker start, including recycled workers.
     */
    public ChunkedExecutor withInitializer(WorkerInitializer initializer) {
        this.initializer = Objects.requireNonNull(initializer, "initializer cannot be null");
        return this;
    }

    /**
     * Enable progress tracking. Without a sink no progress events are produced.
     */
    public ChunkedExecutor withProgressSink(ProgressSink sink) {
        this.progressSink = sink;
        return this;
    }

    /**
     * Observe each pool right after it starts.
     */
    public ChunkedExecutor withPoolListener(Consumer<WorkerPool> listener) {
        this.poolListener = Objects.requireNonNull(listener, "listener cannot be null");
        return this;
    }

    public EngineConfiguration configuration() {
        return config;
    }

    /**
     * Run a multi-output task over the workload split into chunks of the configured size.
     *
     * @param workload the items, read-only for the duration of the run
     * @param task     invoked once per chunk on a worker
     * @param params   passed unchanged to every invocation
     * @return the present output buckets
     */
    public <T, P> RunResult<AggregatedResult> run(List<T> workload, ChunkTask<T, P> task, P params) {
        Objects.requireNonNull(workload, "workload cannot be null");
        Objects.requireNonNull(task, "task cannot be null");
        var chunks = Partitioner.bySize(workload.size(), config.chunkSize());
        var aggregator = new ResultAggregator(config.label(), config.verbose());
        Function<Chunk, WorkerCallable<ChunkOutput>> work = chunk -> context -> task.apply(chunk.slice(workload),
                                                                                               params);
        return execute(chunks, workload.size(), config.workerCount(), DeviceAffinity.none(), work,
                       handles -> aggregator.merge(handles, config.outputDim()));
    }

    /**
     * Single-output form of {@link #run}: concatenates the per-chunk lists.
     */
    public <T, P, R> List<R> map(List<T> workload, ChunkFunction<T, P, R> function, P params) {
        Objects.requireNonNull(workload, "workload cannot be null");
        Objects.requireNonNull(function, "function cannot be null");
        var chunks = Partitioner.bySize(workload.size(), config.chunkSize());
        var aggregator = new ResultAggregator(config.label(), config.verbose());
        Function<Chunk, WorkerCallable<List<R>>> work = chunk -> context -> function.apply(chunk.slice(workload),
                                                                                             params);
        return execute(chunks, workload.size(), config.workerCount(), DeviceAffinity.none(), work,
                       aggregator::concat).value();
    }

    /**
     * Run a task over a paired workload split into one share per device.
     *
     * <p>With more than one device the pool has one worker per device and worker slot {@code i} is bound to device
     * {@code i % deviceCount}. With zero or one device a single unbound worker processes the whole workload.
     *
     * @param workload    features and labels
     * @param deviceCount number of accelerator devices, 0 when there are none
     * @param task        invoked once per share on a device-bound worker
     * @param params      passed unchanged to every invocation
     * @return the concatenated results
     */
    public <F, L, P, R> RunResult<List<R>> runOnDevices(LabeledWorkload<F, L> workload, int deviceCount,
                                                        DeviceTask<F, L, P, R> task, P params) {
        Objects.requireNonNull(workload, "workload cannot be null");
        Objects.requireNonNull(task, "task cannot be null");
        var chunks = Partitioner.byDevices(workload.size(), deviceCount);
        int workers = Math.max(1, deviceCount);
        var affinity = deviceCount > 1 ? DeviceAffinity.roundRobin(deviceCount, workers) : DeviceAffinity.none();
        var aggregator = new ResultAggregator(config.label(), config.verbose());
        Function<Chunk, WorkerCallable<List<R>>> work = chunk -> context -> task.apply(workload.slice(chunk), params,
                                                                                         context);
        return execute(chunks, workload.size(), workers, affinity, work, aggregator::concat);
    }

    private <R, V> RunResult<V> execute(List<Chunk> chunks, int items, int workers, DeviceAffinity affinity,
                                        Function<Chunk, WorkerCallable<R>> work,
                                        Function<List<TaskHandle<R>>, V> merge) {
        var label = config.label();
        if (chunks.isEmpty()) {
            log.info("[{}] Empty workload, no pool started", label);
            return new RunResult<>(merge.apply(List.of()), RunStatistics.empty(label));
        }

        int bound = config.effectiveInFlightBound(workers);
        long start = System.nanoTime();
        log.info("[{}] Running {} items in {} chunks on {} workers{}", label, items, chunks.size(), workers,
                 bound > 0 ? ", in-flight bound " + bound : "");
        var poolName = label.isEmpty() ? "quarry" : label;
        try (var pool = WorkerPool.start(poolName, workers, config.recycleThreshold(), affinity, initializer);
             var run = RunContext.<R>open(label, pool, bound, progressSink, chunks.size())) {
            poolListener.accept(pool);
            for (var chunk : chunks) {
                run.submit(chunk, work.apply(chunk));
            }
            var value = merge.apply(run.drain());
            run.close();

            var statistics = new RunStatistics(label, chunks.size(), workers, items, System.nanoTime() - start,
                                               pool.recycledWorkerCount(), pool.lostWorkerCount());
            log.info("[{}] Completed: {}", label, statistics);
            return new RunResult<>(value, statistics);
        } catch (EngineException e) {
            log.warn("[{}] Run aborted after {} ms: {}", label, (System.nanoTime() - start) / 1_000_000,
                     e.getMessage());
            throw e;
        }
    }
}
