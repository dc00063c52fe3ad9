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
import java.util.Collections;
import java.util.List;

/**
 * Merged output of a run: the present buckets, in bucket order, each holding the concatenation of every chunk's
 * slice in submission order. Buckets that were absent in every chunk are dropped, so {@link #bucketCount()} may be
 * smaller than the configured output dimension.
 *
 * @author hal.hildebrand
 */
public final class AggregatedResult {

    private final int                outputDim;
    private final List<List<Object>> buckets;
    private final List<Integer>      sourceIndices;

    AggregatedResult(int outputDim, List<List<Object>> buckets, List<Integer> sourceIndices) {
        this.outputDim = outputDim;
        var frozen = new ArrayList<List<Object>>(buckets.size());
        for (var bucket : buckets) {
            frozen.add(Collections.unmodifiableList(bucket));
        }
        this.buckets = Collections.unmodifiableList(frozen);
        this.sourceIndices = List.copyOf(sourceIndices);
    }

    public int outputDim() {
        return outputDim;
    }

    public int bucketCount() {
        return buckets.size();
    }

    public int droppedBucketCount() {
        return outputDim - buckets.size();
    }

    /**
     * The {@code i}th present bucket.
     *
     * @param i position among the present buckets
     * @param <T> element type the caller's callback produced for this bucket
     */
    @SuppressWarnings("unchecked")
    public <T> List<T> bucket(int i) {
        return (List<T>) buckets.get(i);
    }

    /**
     * Output index, in {@code 0..outputDim-1}, of the {@code i}th present bucket.
     */
    public int sourceIndex(int i) {
        return sourceIndices.get(i);
    }

    public List<List<Object>> buckets() {
        return buckets;
    }

    @Override
    public String toString() {
        var sizes = new ArrayList<Integer>(buckets.size());
        for (var bucket : buckets) {
            sizes.add(bucket.size());
        }
        return String.format("AggregatedResult[outputDim=%d, present=%s, sizes=%s]", outputDim, sourceIndices, sizes);
    }
}
