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

import com.hellblazer.quarry.engine.partition.LabeledChunk;
import com.hellblazer.quarry.engine.worker.WorkerContext;

import java.util.List;

/**
 * Work callback for accelerator runs. Runs on a worker bound to {@link WorkerContext#deviceId()} and reads whatever
 * the {@link com.hellblazer.quarry.engine.worker.WorkerInitializer} stored in the context.
 *
 * @param <F> feature type
 * @param <L> label type
 * @param <P> parameter type
 * @param <R> result item type
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface DeviceTask<F, L, P, R> {

    List<R> apply(LabeledChunk<F, L> chunk, P params, WorkerContext context) throws Exception;
}
