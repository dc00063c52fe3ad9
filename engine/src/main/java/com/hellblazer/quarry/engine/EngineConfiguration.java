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

import com.hellblazer.quarry.engine.EngineException.ConfigurationException;

import java.util.Objects;

/**
 * Configuration for chunked execution runs.
 *
 * <p>Controls the size of the worker pool, how the workload is cut into chunks, how often workers are recycled,
 * and whether submission is throttled by the number of outstanding handles.
 *
 * <p>Thread-safe and immutable after construction.
 *
 * @author hal.hildebrand
 */
public final class EngineConfiguration {

    /** Default number of items handed to one task */
    public static final int DEFAULT_CHUNK_SIZE = 1000;

    /** Default number of completed tasks after which a worker is replaced */
    public static final int DEFAULT_RECYCLE_THRESHOLD = 50;

    /** Default number of result streams produced by each task */
    public static final int DEFAULT_OUTPUT_DIM = 1;

    private final int     workerCount;
    private final int     chunkSize;
    private final int     recycleThreshold;
    private final boolean throttled;
    private final int     inFlightBound;
    private final int     outputDim;
    private final String  label;
    private final boolean verbose;

    /**
     * Create a new engine configuration.
     *
     * @param workerCount      number of workers in the pool
     * @param chunkSize        number of items per chunk in CPU mode
     * @param recycleThreshold completed tasks after which a worker is replaced
     * @param throttled        whether submission blocks once the in-flight bound is reached
     * @param inFlightBound    maximum outstanding handles when throttled, 0 to derive it from the worker count
     * @param outputDim        number of output buckets each task returns
     * @param label            label used in log lines and progress reports
     * @param verbose          whether each resolved chunk is logged
     * @throws ConfigurationException if any value is out of range
     */
    public EngineConfiguration(int workerCount, int chunkSize, int recycleThreshold, boolean throttled,
                               int inFlightBound, int outputDim, String label, boolean verbose) {
        if (label == null) {
            throw new ConfigurationException("label cannot be null");
        }
        if (workerCount <= 0) {
            throw new ConfigurationException("workerCount must be positive: " + workerCount);
        }
        if (chunkSize <= 0) {
            throw new ConfigurationException("chunkSize must be positive: " + chunkSize);
        }
        if (recycleThreshold <= 0) {
            throw new ConfigurationException("recycleThreshold must be positive: " + recycleThreshold);
        }
        if (inFlightBound < 0) {
            throw new ConfigurationException("inFlightBound must be non-negative: " + inFlightBound);
        }
        if (outputDim <= 0) {
            throw new ConfigurationException("outputDim must be positive: " + outputDim);
        }

        this.workerCount = workerCount;
        this.chunkSize = chunkSize;
        this.recycleThreshold = recycleThreshold;
        this.throttled = throttled;
        this.inFlightBound = inFlightBound;
        this.outputDim = outputDim;
        this.label = label;
        this.verbose = verbose;
    }

    /**
     * Create a configuration with default values: one worker per available processor, unthrottled, one output.
     *
     * @return a default configuration
     */
    public static EngineConfiguration defaultConfig() {
        return new EngineConfiguration(Runtime.getRuntime().availableProcessors(), DEFAULT_CHUNK_SIZE,
                                       DEFAULT_RECYCLE_THRESHOLD, false, 0, DEFAULT_OUTPUT_DIM, "", false);
    }

    public int workerCount() {
        return workerCount;
    }

    public int chunkSize() {
        return chunkSize;
    }

    public int recycleThreshold() {
        return recycleThreshold;
    }

    public boolean throttled() {
        return throttled;
    }

    /**
     * Get the configured in-flight bound.
     *
     * @return the bound, or 0 when it is derived from the worker count
     */
    public int inFlightBound() {
        return inFlightBound;
    }

    public int outputDim() {
        return outputDim;
    }

    public String label() {
        return label;
    }

    public boolean verbose() {
        return verbose;
    }

    /**
     * Get the maximum number of outstanding handles for a pool of the given size.
     *
     * @param workers the number of workers actually started
     * @return the bound, or 0 when submission is not throttled
     */
    public int effectiveInFlightBound(int workers) {
        if (!throttled) {
            return 0;
        }
        return inFlightBound > 0 ? inFlightBound : workers + 1;
    }

    public EngineConfiguration withWorkerCount(int newWorkerCount) {
        return new EngineConfiguration(newWorkerCount, chunkSize, recycleThreshold, throttled, inFlightBound,
                                       outputDim, label, verbose);
    }

    public EngineConfiguration withChunkSize(int newChunkSize) {
        return new EngineConfiguration(workerCount, newChunkSize, recycleThreshold, throttled, inFlightBound,
                                       outputDim, label, verbose);
    }

    public EngineConfiguration withRecycleThreshold(int newRecycleThreshold) {
        return new EngineConfiguration(workerCount, chunkSize, newRecycleThreshold, throttled, inFlightBound,
                                       outputDim, label, verbose);
    }

    /**
     * Create a new configuration with throttling switched on or off.
     *
     * @param newThrottled whether submission blocks at the in-flight bound
     * @return a new configuration with the updated value
     */
    public EngineConfiguration withThrottling(boolean newThrottled) {
        return new EngineConfiguration(workerCount, chunkSize, recycleThreshold, newThrottled, inFlightBound,
                                       outputDim, label, verbose);
    }

    public EngineConfiguration withInFlightBound(int newInFlightBound) {
        return new EngineConfiguration(workerCount, chunkSize, recycleThreshold, throttled, newInFlightBound,
                                       outputDim, label, verbose);
    }

    public EngineConfiguration withOutputDim(int newOutputDim) {
        return new EngineConfiguration(workerCount, chunkSize, recycleThreshold, throttled, inFlightBound,
                                       newOutputDim, label, verbose);
    }

    public EngineConfiguration withLabel(String newLabel) {
        return new EngineConfiguration(workerCount, chunkSize, recycleThreshold, throttled, inFlightBound,
                                       outputDim, newLabel, verbose);
    }

    public EngineConfiguration withVerbose(boolean newVerbose) {
        return new EngineConfiguration(workerCount, chunkSize, recycleThreshold, throttled, inFlightBound,
                                       outputDim, label, newVerbose);
    }

    @Override
    public String toString() {
        return String.format(
        "EngineConfiguration[workers=%d, chunkSize=%d, recycleThreshold=%d, throttled=%s, inFlightBound=%d, outputDim=%d, label='%s', verbose=%s]",
        workerCount, chunkSize, recycleThreshold, throttled, inFlightBound, outputDim, label, verbose);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        var other = (EngineConfiguration) obj;
        return workerCount == other.workerCount &&
               chunkSize == other.chunkSize &&
               recycleThreshold == other.recycleThreshold &&
               throttled == other.throttled &&
               inFlightBound == other.inFlightBound &&
               outputDim == other.outputDim &&
               verbose == other.verbose &&
               label.equals(other.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(workerCount, chunkSize, recycleThreshold, throttled, inFlightBound, outputDim, label,
                            verbose);
    }
}
