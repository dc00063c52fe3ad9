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

/**
 * Runs once each time a worker starts, including the replacement started when a worker is recycled.
 * <p>
 * Binds the worker to {@link WorkerContext#deviceId()} and sets up any per-worker execution state. Must tolerate
 * being run again for the same slot.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface WorkerInitializer {

    WorkerInitializer NONE = context -> {
    };

    void initialize(WorkerContext context) throws Exception;
}
