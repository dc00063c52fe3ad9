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

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Per-worker execution context.
 *
 * <p>Created when a worker starts, handed to the {@link WorkerInitializer} once and then to every task the worker
 * runs. The initializer stores whatever per-worker state it establishes (a bound device session, thread settings)
 * as attributes; tasks read them back. Confined to the worker's thread, so it is not synchronized.
 *
 * @author hal.hildebrand
 */
public final class WorkerContext {

    private final int                 slot;
    private final int                 generation;
    private final OptionalInt         deviceId;
    private final int                 deviceCount;
    private final Map<String, Object> attributes = new HashMap<>();
    private       int                 completedTasks;

    public WorkerContext(int slot, int generation, OptionalInt deviceId, int deviceCount) {
        this.slot = slot;
        this.generation = generation;
        this.deviceId = deviceId;
        this.deviceCount = deviceCount;
    }

    /**
     * Fixed position of this worker in the pool roster.
     */
    public int slot() {
        return slot;
    }

    /**
     * How many workers occupied this slot before this one. Zero for the first worker.
     */
    public int generation() {
        return generation;
    }

    /**
     * Device bound to this worker's slot, empty when the pool runs without device affinity.
     */
    public OptionalInt deviceId() {
        return deviceId;
    }

    public int deviceCount() {
        return deviceCount;
    }

    public int completedTasks() {
        return completedTasks;
    }

    void taskCompleted() {
        completedTasks++;
    }

    public void put(String key, Object value) {
        attributes.put(key, value);
    }

    public <T> Optional<T> get(String key, Class<T> type) {
        var value = attributes.get(key);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }

    public boolean contains(String key) {
        return attributes.containsKey(key);
    }

    @Override
    public String toString() {
        return String.format("WorkerContext[slot=%d, generation=%d, device=%s, completed=%d]", slot, generation,
                             deviceId.isPresent() ? String.valueOf(deviceId.getAsInt()) : "none", completedTasks);
    }
}
