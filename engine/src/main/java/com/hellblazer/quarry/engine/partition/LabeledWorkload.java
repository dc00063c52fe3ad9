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

import com.hellblazer.quarry.engine.EngineException.ConfigurationException;

import java.util.List;
import java.util.Objects;

/**
 * Paired feature/label workload for accelerator-bound runs. Both sequences have the same length and are read-only
 * for the duration of a run.
 *
 * @param features the feature items
 * @param labels   the label for each feature, aligned by index
 * @param <F>      feature type
 * @param <L>      label type
 * @author hal.hildebrand
 */
public record LabeledWorkload<F, L>(List<F> features, List<L> labels) {

    public LabeledWorkload {
        Objects.requireNonNull(features, "features cannot be null");
        Objects.requireNonNull(labels, "labels cannot be null");
        if (features.size() != labels.size()) {
            throw new ConfigurationException(
            String.format("features and labels must have the same length: %d != %d", features.size(),
                          labels.size()));
        }
    }

    public static <F, L> LabeledWorkload<F, L> of(List<F> features, List<L> labels) {
        return new LabeledWorkload<>(features, labels);
    }

    public int size() {
        return features.size();
    }

    /**
     * Aligned read-only views of both sequences over the chunk's range.
     */
    public LabeledChunk<F, L> slice(Chunk chunk) {
        return new LabeledChunk<>(chunk, chunk.slice(features), chunk.slice(labels));
    }
}
