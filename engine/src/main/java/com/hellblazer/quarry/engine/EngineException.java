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

/**
 * Sealed exception hierarchy for chunked execution runs.
 * <p>
 * Every failure of a run surfaces synchronously at the coordinator's call site as one of:
 * <ul>
 * <li>{@link ConfigurationException} - invalid chunk size, worker count, device count or other setting, reported
 * before any worker is started</li>
 * <li>{@link PoolClosedException} - a task was submitted after the worker pool began shutting down</li>
 * <li>{@link WorkerExecutionException} - the work callback or the worker initializer threw</li>
 * <li>{@link WorkerLostException} - a worker died while holding a task</li>
 * </ul>
 * The engine never retries; a failed run is all-or-nothing.
 *
 * @author hal.hildebrand
 */
public sealed class EngineException extends RuntimeException
    permits EngineException.ConfigurationException,
            EngineException.PoolClosedException,
            EngineException.WorkerExecutionException,
            EngineException.WorkerLostException {

    /**
     * Constructs a new engine exception with the specified detail message.
     *
     * @param message the detail message
     */
    public EngineException(String message) {
        super(message);
    }

    /**
     * Constructs a new engine exception with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause   the cause
     */
    public EngineException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Invalid configuration.
     * <p>
     * Thrown before any work starts; no workers have been spawned when this is raised.
     */
    public static final class ConfigurationException extends EngineException {

        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Submission after shutdown began. This is a programming error in the caller.
     */
    public static final class PoolClosedException extends EngineException {

        public PoolClosedException(String poolName) {
            super("Worker pool " + poolName + " is shut down");
        }
    }

    /**
     * The work callback raised inside a worker, or the worker could not be initialized.
     * <p>
     * Raised when the handle of the affected chunk is resolved.
     */
    public static final class WorkerExecutionException extends EngineException {
        private final int chunkIndex;

        /**
         * @param chunkIndex index of the chunk whose task failed, in submission order
         * @param message    the detail message
         * @param cause      the exception raised by the callback
         */
        public WorkerExecutionException(int chunkIndex, String message, Throwable cause) {
            super(message, cause);
            this.chunkIndex = chunkIndex;
        }

        public WorkerExecutionException(int chunkIndex, String message) {
            super(message);
            this.chunkIndex = chunkIndex;
        }

        /**
         * Gets the submission index of the failed chunk.
         *
         * @return the chunk index
         */
        public int getChunkIndex() {
            return chunkIndex;
        }
    }

    /**
     * A worker terminated unexpectedly, outside of normal recycling, while executing a task.
     * <p>
     * The affected task is not resubmitted. The worker slot is refilled by a fresh worker.
     */
    public static final class WorkerLostException extends EngineException {
        private final int chunkIndex;
        private final int slot;

        public WorkerLostException(int chunkIndex, int slot, Throwable cause) {
            super(String.format("Worker in slot %d was lost while executing chunk %d", slot, chunkIndex), cause);
            this.chunkIndex = chunkIndex;
            this.slot = slot;
        }

        public WorkerLostException(int chunkIndex, String message) {
            super(message);
            this.chunkIndex = chunkIndex;
            this.slot = -1;
        }

        public int getChunkIndex() {
            return chunkIndex;
        }

        /**
         * Gets the worker slot that was lost.
         *
         * @return the slot, or -1 when no specific slot was involved
         */
        public int getSlot() {
            return slot;
        }
    }
}
