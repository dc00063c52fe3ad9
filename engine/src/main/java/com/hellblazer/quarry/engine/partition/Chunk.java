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

import java.util.Collections;
import java.util.List;

/**
 * A contiguous half-open range {@code [start, end)} of a workload, assigned to one task.
 *
 * @param index position of this chunk in submission order
 * @param start first workload index covered (inclusive)
 * @param end   last workload index covered (exclusive)
 * @author hal.hildebrand
 */
public record Chunk(int index, int start, int end) {

    public Chunk {
        if (index < 0) {
            throw new IllegalArgumentException("index must be non-negative: " + index);
        }
        if (start < 0 || end < start) {
            throw new IllegalArgumentException(String.format("Invalid chunk range [%d, %d)", start, end));
        }
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    /**
     * Read-only view of the items this chunk covers.
     *
     * @param workload the workload the chunk was cut from
     * @return an unmodifiable view of {@code workload[start, end)}
     */
    public <T> List<T> slice(List<T> workload) {
        return Collections.unmodifiableList(workload.subList(start, end));
    }

    @Override
    public String toString() {
        return String.format("Chunk[%d: [%d, %d)]", index, start, end);
    }
}
