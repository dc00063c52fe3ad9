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
package com.hellblazer.quarry.engine.worker;

import com.hellblazer.quarry.engine.EngineException.ConfigurationException;
import com.hellblazer.quarry.engine.EngineException.PoolClosedException;
import com.hellblazer.quarry.engine.EngineException.WorkerExecutionException;
import com.hellblazer.quarry.engine.EngineException.WorkerLostException;
import com.hellblazer.quarry.engine.device.DeviceAffinity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed-capacity pool of long-lived workers fed from one shared FIFO queue.
 *
 * <p>Each worker is a dedicated thread bound to a slot. On start it runs the {@link WorkerInitializer} exactly once
 * with a fresh {@link WorkerContext}. After {@code recycleThreshold} tasks the worker retires and a new worker for
 * the same slot (next generation) starts and re-runs the initializer; the device bound to the slot does not change.
 * Once shutdown has begun and no task is left in the queue, a retiring worker is not replaced.
 *
 * <p>Workers are threads in the coordinator's process and share its heap. Recycling resets whatever state the
 * initializer builds per worker, but it does not bound heap growth: memory a task leaks stays leaked after its worker
 * retires. There is no crash isolation either; a task that crashes the JVM, for example in native code, takes the
 * coordinator and every other worker down with it.
 *
 * <p>Failure handling:
 * <ul>
 *   <li>an exception thrown by a task completes its handle with {@link WorkerExecutionException}; the worker
 *       continues</li>
 *   <li>an exception thrown by the initializer leaves the worker unusable; every task it picks up is completed with
 *       {@link WorkerExecutionException} until it is recycled</li>
 *   <li>an {@link Error} escaping a task, or an interrupt, terminates the worker; the task it held is completed with
 *       {@link WorkerLostException} and a replacement starts in the same slot. Nothing is resubmitted.</li>
 * </ul>
 *
 * <p>{@link #shutdown()} stops accepting work, lets every queued task finish, then releases all workers. It is
 * idempotent and safe to call from every exit path.
 *
 * @author hal.hildebrand
 */
public final class WorkerPool implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private static final PoolTask<Void> SHUTDOWN_SIGNAL = new PoolTask<>(-1, null, null);

    private final String                   name;
    private final int                      workerCount;
    private final int                      recycleThreshold;
    private final DeviceAffinity           affinity;
    private final WorkerInitializer        initializer;
    private final BlockingQueue<PoolTask<?>> queue = new LinkedBlockingQueue<>();

    private final Object lifecycleLock = new Object();
    // Guarded by lifecycleLock
    private       int     liveWorkers;
    private       boolean shutdownStarted;
    private       boolean released;
    private       int     releaseCount;

    // Statistics
    private final AtomicLong completedTasks  = new AtomicLong();
    private final AtomicLong startedWorkers  = new AtomicLong();
    private final AtomicLong recycledWorkers = new AtomicLong();
    private final AtomicLong lostWorkers     = new AtomicLong();

    private WorkerPool(String name, int workerCount, int recycleThreshold, DeviceAffinity affinity,
                       WorkerInitializer initializer) {
        this.name = name;
        this.workerCount = workerCount;
        this.recycleThreshold = recycleThreshold;
        this.affinity = affinity;
        this.initializer = initializer;
    }

    /**
     * Create a pool and start all of its workers.
     *
     * @param name             name used for worker threads and log lines
     * @param workerCount      number of worker slots
     * @param recycleThreshold completed tasks after which a worker is replaced
     * @param affinity         device assignment per slot
     * @param initializer      run once per worker start
     * @return the running pool
     * @throws ConfigurationException if a setting is invalid; no worker has been started in that case
     */
    public static WorkerPool start(String name, int workerCount, int recycleThreshold, DeviceAffinity affinity,
                                   WorkerInitializer initializer) {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(affinity, "affinity cannot be null");
        Objects.requireNonNull(initializer, "initializer cannot be null");
        if (workerCount <= 0) {
            throw new ConfigurationException("workerCount must be positive: " + workerCount);
        }
        if (recycleThreshold <= 0) {
            throw new ConfigurationException("recycleThreshold must be positive: " + recycleThreshold);
        }
        if (affinity.isBound() && affinity.assignments().size() < workerCount) {
            throw new ConfigurationException(
            String.format("Device affinity covers %d slots, pool needs %d", affinity.assignments().size(),
                          workerCount));
        }

        var pool = new WorkerPool(name, workerCount, recycleThreshold, affinity, initializer);
        synchronized (pool.lifecycleLock) {
            for (int slot = 0; slot < workerCount; slot++) {
                pool.spawn(slot, 0);
            }
        }
        log.info("Worker pool {} started: {} workers, recycle after {} tasks, {}", name, workerCount,
                 recycleThreshold, affinity);
        return pool;
    }

    /**
     * Enqueue a task. Never blocks.
     *
     * @param chunkIndex submission index of the chunk the task works on, reported with failures
     * @param work       the work to run on a worker
     * @return handle completed with the task's result or failure
     * @throws PoolClosedException if shutdown has begun
     */
    public <R> CompletableFuture<R> submit(int chunkIndex, WorkerCallable<R> work) {
        Objects.requireNonNull(work, "work cannot be null");
        var task = new PoolTask<>(chunkIndex, work, new CompletableFuture<R>());
        synchronized (lifecycleLock) {
            if (shutdownStarted) {
                throw new PoolClosedException(name);
            }
            if (liveWorkers == 0) {
                task.future().completeExceptionally(
                new WorkerLostException(chunkIndex, "Worker pool " + name + " has no live workers"));
                return task.future();
            }
            queue.add(task);
        }
        return task.future();
    }

    /**
     * Stop accepting submissions, wait for every queued task to complete, then release the workers. Subsequent
     * calls wait for the release and return.
     */
    public void shutdown() {
        synchronized (lifecycleLock) {
            if (!shutdownStarted) {
                shutdownStarted = true;
                // One signal per slot, queued behind all submitted work
                for (int i = 0; i < workerCount; i++) {
                    queue.add(SHUTDOWN_SIGNAL);
                }
                log.debug("Worker pool {} shutting down with {} queued entries", name, queue.size());
            }
            try {
                while (liveWorkers > 0) {
                    lifecycleLock.wait();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for {} workers of pool {} to finish", liveWorkers, name);
                return;
            }
            if (!released) {
                released = true;
                releaseCount++;
                failOrphanedTasks();
                log.info("Worker pool {} released: {} tasks completed, {} workers started, {} recycled, {} lost",
                         name, completedTasks.get(), startedWorkers.get(), recycledWorkers.get(), lostWorkers.get());
            }
        }
    }

    @Override
    public void close() {
        shutdown();
    }

    public String name() {
        return name;
    }

    public int workerCount() {
        return workerCount;
    }

    public int recycleThreshold() {
        return recycleThreshold;
    }

    public DeviceAffinity affinity() {
        return affinity;
    }

    /**
     * Number of worker threads currently alive. Zero once the pool is released.
     */
    public int liveWorkerCount() {
        synchronized (lifecycleLock) {
            return liveWorkers;
        }
    }

    public boolean isShutdown() {
        synchronized (lifecycleLock) {
            return shutdownStarted;
        }
    }

    public boolean isReleased() {
        synchronized (lifecycleLock) {
            return released;
        }
    }

    /**
     * How many times the workers were actually released. Stays at one no matter how often shutdown is called.
     */
    public int releaseCount() {
        synchronized (lifecycleLock) {
            return releaseCount;
        }
    }

    public long completedTaskCount() {
        return completedTasks.get();
    }

    public long startedWorkerCount() {
        return startedWorkers.get();
    }

    public long recycledWorkerCount() {
        return recycledWorkers.get();
    }

    public long lostWorkerCount() {
        return lostWorkers.get();
    }

    @Override
    public String toString() {
        return String.format("WorkerPool[%s, workers=%d, live=%d, completed=%d, shutdown=%s]", name, workerCount,
                             liveWorkerCount(), completedTasks.get(), isShutdown());
    }

    // Caller holds lifecycleLock
    private void spawn(int slot, int generation) {
        liveWorkers++;
        startedWorkers.incrementAndGet();
        var thread = new Thread(() -> runWorker(slot, generation),
                                String.format("%s-worker-%d.%d", name, slot, generation));
        thread.setDaemon(true);
        thread.start();
    }

    private void runWorker(int slot, int generation) {
        var context = new WorkerContext(slot, generation, affinity.deviceFor(slot), affinity.deviceCount());
        var exit = Exit.FAILED;
        try {
            Exception initFailure = null;
            try {
                initializer.initialize(context);
                log.debug("Initialized {} in pool {}", context, name);
            } catch (Exception e) {
                initFailure = e;
                log.error("Initializer failed for slot {} generation {} of pool {}", slot, generation, name, e);
            }
            exit = serve(context, initFailure);
        } finally {
            workerExited(context, exit);
        }
    }

    private Exit serve(WorkerContext context, Exception initFailure) {
        while (true) {
            PoolTask<?> task;
            try {
                task = queue.take();
            } catch (InterruptedException e) {
                lostWorkers.incrementAndGet();
                log.warn("Worker {} of pool {} interrupted while idle", context, name);
                return Exit.LOST;
            }
            if (task == SHUTDOWN_SIGNAL) {
                return Exit.SHUTDOWN;
            }

            if (initFailure != null) {
                task.future().completeExceptionally(
                new WorkerExecutionException(task.chunkIndex(), String.format(
                "Worker slot %d of pool %s failed to initialize", context.slot(), name), initFailure));
            } else {
                try {
                    execute(task, context);
                } catch (Error e) {
                    lostWorkers.incrementAndGet();
                    log.warn("Worker {} of pool {} lost while executing chunk {}", context, name,
                             task.chunkIndex(), e);
                    task.future().completeExceptionally(
                    new WorkerLostException(task.chunkIndex(), context.slot(), e));
                    return Exit.LOST;
                }
            }

            completedTasks.incrementAndGet();
            context.taskCompleted();
            if (context.completedTasks() >= recycleThreshold) {
                return Exit.RECYCLE;
            }
        }
    }

    private <R> void execute(PoolTask<R> task, WorkerContext context) {
        R value;
        try {
            value = task.work().call(context);
        } catch (Exception e) {
            log.error("Chunk {} failed on worker slot {} of pool {}", task.chunkIndex(), context.slot(), name, e);
            task.future().completeExceptionally(new WorkerExecutionException(task.chunkIndex(), String.format(
            "Chunk %d failed on worker slot %d: %s", task.chunkIndex(), context.slot(), e.getMessage()), e));
            return;
        }
        task.future().complete(value);
    }

    private void workerExited(WorkerContext context, Exit exit) {
        synchronized (lifecycleLock) {
            liveWorkers--;
            switch (exit) {
                case RECYCLE -> {
                    recycledWorkers.incrementAndGet();
                    log.debug("Recycling {} of pool {}", context, name);
                    replace(context);
                }
                case LOST -> replace(context);
                case FAILED -> log.warn("Worker {} of pool {} terminated abnormally, slot not refilled", context,
                                        name);
                case SHUTDOWN -> log.debug("Worker {} of pool {} exiting", context, name);
            }
            if (liveWorkers == 0) {
                if (!shutdownStarted) {
                    failOrphanedTasks();
                }
                lifecycleLock.notifyAll();
            }
        }
    }

    // Caller holds lifecycleLock
    private void replace(WorkerContext context) {
        if (shutdownStarted && !hasQueuedWork()) {
            // Only shutdown signals remain; a leftover signal is drained on release
            log.debug("Slot {} of pool {} left empty during shutdown", context.slot(), name);
            return;
        }
        spawn(context.slot(), context.generation() + 1);
    }

    // Caller holds lifecycleLock. Nothing is submitted after shutdown starts, so this only goes from true to false
    private boolean hasQueuedWork() {
        for (var task : queue) {
            if (task != SHUTDOWN_SIGNAL) {
                return true;
            }
        }
        return false;
    }

    // Caller holds lifecycleLock
    private void failOrphanedTasks() {
        var orphans = new ArrayList<PoolTask<?>>();
        queue.drainTo(orphans);
        for (var task : orphans) {
            if (task != SHUTDOWN_SIGNAL) {
                task.future().completeExceptionally(
                new WorkerLostException(task.chunkIndex(), "Worker pool " + name + " has no live workers"));
            }
        }
    }

    private enum Exit {
        SHUTDOWN, RECYCLE, LOST, FAILED
    }

    private record PoolTask<R>(int chunkIndex, WorkerCallable<R> work, CompletableFuture<R> future) {
    }
}
