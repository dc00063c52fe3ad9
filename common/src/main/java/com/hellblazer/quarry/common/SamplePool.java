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
package com.hellblazer.quarry.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * A fixed pool of candidate items from which samples are acquired over successive rounds.
 *
 * <p>The candidates are held in an immutable backing list; acquisition never removes or moves them. Instead the pool
 * owns an exclusion set of acquired backing indices plus the order in which they were acquired. The
 * <em>view</em> is the remaining candidates in backing order; callers score the view (for example with a chunked
 * run), pick positions in it and {@link #acquire(int...) acquire} them.
 *
 * <p>Not thread safe. A pool belongs to the coordinator of an acquisition loop; the view it hands out is an immutable
 * snapshot that may be shared with workers.
 *
 * @param <T> candidate type
 * @author hal.hildebrand
 */
public final class SamplePool<T> {
    private static final Logger log = LoggerFactory.getLogger(SamplePool.class);

    private final List<T> candidates;
    private final BitSet  acquired;
    // Backing indices in acquisition order; only the first acquiredCount slots are meaningful
    private final int[]   acquisitionOrder;
    private       int     acquiredCount;

    private SamplePool(List<T> candidates) {
        this.candidates = Collections.unmodifiableList(new ArrayList<>(candidates));
        this.acquired = new BitSet(candidates.size());
        this.acquisitionOrder = new int[this.candidates.size()];
    }

    public static <T> SamplePool<T> of(List<T> candidates) {
        Objects.requireNonNull(candidates, "candidates cannot be null");
        return new SamplePool<>(candidates);
    }

    /**
     * Total number of candidates, acquired or not.
     */
    public int size() {
        return candidates.size();
    }

    /**
     * Number of candidates not yet acquired.
     */
    public int remaining() {
        return candidates.size() - acquired.cardinality();
    }

    public int acquiredCount() {
        return acquiredCount;
    }

    /**
     * Whether at least {@code k} candidates remain, i.e. whether another round of {@code k} acquisitions is
     * possible.
     */
    public boolean hasAtLeast(int k) {
        return remaining() >= k;
    }

    /**
     * Remaining candidates in backing order. An immutable snapshot: later acquisitions do not change it.
     */
    public List<T> view() {
        var remaining = new ArrayList<T>(remaining());
        for (int i = acquired.nextClearBit(0); i < candidates.size(); i = acquired.nextClearBit(i + 1)) {
            remaining.add(candidates.get(i));
        }
        return Collections.unmodifiableList(remaining);
    }

    /**
     * Acquire candidates by their positions in the current {@link #view()}.
     *
     * @param viewPositions distinct positions in {@code [0, remaining())}
     * @return the acquired items, in argument order
     * @throws IllegalArgumentException if a position is out of range or repeated; nothing is acquired in that case
     */
    public List<T> acquire(int... viewPositions) {
        Objects.requireNonNull(viewPositions, "viewPositions cannot be null");
        var remainingIndices = remainingIndices();
        var chosen = new BitSet(remainingIndices.length);
        var backing = new int[viewPositions.length];
        for (int i = 0; i < viewPositions.length; i++) {
            int position = viewPositions[i];
            if (position < 0 || position >= remainingIndices.length) {
                throw new IllegalArgumentException(
                String.format("View position %d out of range [0, %d)", position, remainingIndices.length));
            }
            if (chosen.get(position)) {
                throw new IllegalArgumentException("Duplicate view position " + position);
            }
            chosen.set(position);
            backing[i] = remainingIndices[position];
        }
        return take(backing);
    }

    /**
     * Acquire {@code k} candidates chosen uniformly at random, without replacement, from the remaining ones.
     *
     * @param k      how many to draw
     * @param random source of randomness
     * @return the drawn items, in draw order
     * @throws IllegalArgumentException if {@code k} is negative or exceeds {@link #remaining()}
     */
    public List<T> drawRandom(int k, Random random) {
        Objects.requireNonNull(random, "random cannot be null");
        var remainingIndices = remainingIndices();
        if (k < 0 || k > remainingIndices.length) {
            throw new IllegalArgumentException(
            String.format("Cannot draw %d of %d remaining candidates", k, remainingIndices.length));
        }
        // Partial Fisher-Yates over the remaining indices
        for (int i = 0; i < k; i++) {
            int j = i + random.nextInt(remainingIndices.length - i);
            int swap = remainingIndices[i];
            remainingIndices[i] = remainingIndices[j];
            remainingIndices[j] = swap;
        }
        var backing = new int[k];
        System.arraycopy(remainingIndices, 0, backing, 0, k);
        return take(backing);
    }

    /**
     * Backing indices of every acquired candidate, in acquisition order.
     */
    public List<Integer> acquiredIndices() {
        var indices = new ArrayList<Integer>(acquiredCount);
        for (int i = 0; i < acquiredCount; i++) {
            indices.add(acquisitionOrder[i]);
        }
        return Collections.unmodifiableList(indices);
    }

    /**
     * Acquired candidates, in acquisition order.
     */
    public List<T> acquiredItems() {
        var items = new ArrayList<T>(acquiredCount);
        for (int i = 0; i < acquiredCount; i++) {
            items.add(candidates.get(acquisitionOrder[i]));
        }
        return Collections.unmodifiableList(items);
    }

    public boolean isAcquired(int backingIndex) {
        Objects.checkIndex(backingIndex, candidates.size());
        return acquired.get(backingIndex);
    }

    @Override
    public String toString() {
        return String.format("SamplePool[size=%d, remaining=%d]", size(), remaining());
    }

    private int[] remainingIndices() {
        var indices = new int[remaining()];
        int n = 0;
        for (int i = acquired.nextClearBit(0); i < candidates.size(); i = acquired.nextClearBit(i + 1)) {
            indices[n++] = i;
        }
        return indices;
    }

    private List<T> take(int[] backingIndices) {
        var items = new ArrayList<T>(backingIndices.length);
        for (int index : backingIndices) {
            acquired.set(index);
            items.add(candidates.get(index));
        }
        System.arraycopy(backingIndices, 0, acquisitionOrder, acquiredCount, backingIndices.length);
        acquiredCount += backingIndices.length;
        log.debug("Acquired {} candidates, {} of {} remaining", backingIndices.length, remaining(), size());
        return Collections.unmodifiableList(items);
    }
}
