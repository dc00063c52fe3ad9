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
package com.hellblazer.quarry.engine.aggregate;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The result of one chunk: a tuple of {@code outputDim} ordered sequences, one per output bucket. A null entry
 * marks the bucket as absent for this chunk.
 *
 * @author hal.hildebrand
 */
public final class ChunkOutput {

    private final List<List<?>> buckets;

    private ChunkOutput(List<List<?>> buckets) {
        this.buckets = buckets;
    }

    /**
     * @param buckets one sequence per output bucket, null for an absent bucket
     */
    public static ChunkOutput of(List<?>... buckets) {
        if (buckets == null || buckets.length == 0) {
            throw new IllegalArgumentException("A chunk output needs at least one bucket");
        }
        return new ChunkOutput(Collections.unmodifiableList(new ArrayList<>(Arrays.asList(buckets))));
    }

    public static ChunkOutput single(List<?> bucket) {
        return of(bucket);
    }

    /**
     * An output in which every bucket is absent.
     */
    public static ChunkOutput absent(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive: " + dimension);
        }
        return of(new List<?>[dimension]);
    }

    public int dimension() {
        return buckets.size();
    }

    public boolean isAbsent(int bucket) {
        return buckets.get(bucket) == null;
    }

    /**
     * @return the sequence for the bucket, null when absent
     */
    public List<?> bucket(int bucket) {
        return buckets.get(bucket);
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("ChunkOutput[");
        for (int i = 0; i < buckets.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(buckets.get(i) == null ? "absent" : buckets.get(i).size());
        }
        return sb.append(']').toString();
    }
}
