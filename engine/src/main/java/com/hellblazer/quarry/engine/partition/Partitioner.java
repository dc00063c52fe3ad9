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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits a workload of known length into contiguous chunks.
 *
 * <p>Chunks are returned in submission order, never overlap, and together cover exactly {@code [0, length)}.
 * Zero-length chunks are never produced, so the work callback is never invoked on empty input.
 *
 * @author hal.hildebrand
 */
public final class Partitioner {

    private Partitioner() {
    }

    /**
     * Partition by a fixed chunk size. Chunk {@code i} covers {@code [i*S, min((i+1)*S, N))}; there are
     * {@code ceil(N / S)} of them.
     *
     * @param length    workload length N
     * @param chunkSize target chunk size S
     * @return the chunks in submission order
     * @throws ConfigurationException if the chunk size is not positive or the length is negative
     */
    public static List<Chunk> bySize(int length, int chunkSize) {
        if (chunkSize <= 0) {
            throw new ConfigurationException("chunkSize must be positive: " + chunkSize);
        }
        checkLength(length);

        int steps = length / chunkSize + (length % chunkSize > 0 ? 1 : 0);
        var chunks = new ArrayList<Chunk>(steps);
        for (int i = 0; i < steps; i++) {
            int start = i * chunkSize;
            int end = (int) Math.min((long) start + chunkSize, length);
            chunks.add(new Chunk(i, start, end));
        }
        return Collections.unmodifiableList(chunks);
    }

    /**
     * Partition into per-device shares. With more than one device the share is {@code floor(N / D)} and there are
     * {@code D} chunks plus one for the remainder; the final chunk always extends to {@code N}. With one device or
     * none the whole workload is a single chunk.
     *
     * @param length      workload length N
     * @param deviceCount number of accelerator devices D
     * @return the non-empty chunks in submission order
     * @throws ConfigurationException if the device count or length is negative
     */
    public static List<Chunk> byDevices(int length, int deviceCount) {
        if (deviceCount < 0) {
            throw new ConfigurationException("deviceCount must be non-negative: " + deviceCount);
        }
        checkLength(length);
        if (length == 0) {
            return List.of();
        }
        if (deviceCount <= 1) {
            return List.of(new Chunk(0, 0, length));
        }

        int share = length / deviceCount;
        int steps = deviceCount + (length % deviceCount != 0 ? 1 : 0);
        var chunks = new ArrayList<Chunk>(steps);
        for (int i = 0; i < steps; i++) {
            int start = (int) Math.min((long) i * share, length);
            int end = i == steps - 1 ? length : (int) Math.min((long) (i + 1) * share, length);
            if (end > start) {
                chunks.add(new Chunk(chunks.size(), start, end));
            }
        }
        return Collections.unmodifiableList(chunks);
    }

    private static void checkLength(int length) {
        if (length < 0) {
            throw new ConfigurationException("length must be non-negative: " + length);
        }
    }
}
