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

import com.hellblazer.quarry.engine.aggregate.ChunkOutput;

import java.util.List;

/**
 * Work callback for CPU runs. Receives a read-only view of one chunk and the run's shared parameters and returns
 * one sequence per output bucket.
 *
 * @param <T> workload item type
 * @param <P> parameter type
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface ChunkTask<T, P> {

    ChunkOutput apply(List<T> chunk, P params) throws Exception;
}
