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
package com.hellblazer.quarry.engine.partition;

import java.util.List;

/**
 * The slice of a {@link LabeledWorkload} handed to one accelerator task.
 *
 * @param chunk    the range this slice covers
 * @param features read-only feature view
 * @param labels   read-only label view, aligned with {@code features}
 * @author hal.hildebrand
 */
public record LabeledChunk<F, L>(Chunk chunk, List<F> features, List<L> labels) {

    public int size() {
        return features.size();
    }
}
