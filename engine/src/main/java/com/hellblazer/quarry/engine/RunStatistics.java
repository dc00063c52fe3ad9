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

/**
 * Statistics of a completed run.
 *
 * @param label           run label
 * @param chunks          chunks submitted
 * @param workers         worker slots in the pool
 * @param items           workload length
 * @param elapsedNanos    wall time from pool start to release
 * @param recycledWorkers workers retired after reaching the recycle threshold
 * @param lostWorkers     workers that died unexpectedly
 * @author hal.hildebrand
 */
public record RunStatistics(String label, int chunks, int workers, int items, long elapsedNanos,
                            long recycledWorkers, long lostWorkers) {

    public static RunStatistics empty(String label) {
        return new RunStatistics(label, 0, 0, 0, 0L, 0L, 0L);
    }

    public double elapsedMillis() {
        return elapsedNanos / 1_000_000.0;
    }

    /**
     * Items processed per second, 0 when nothing ran.
     */
    public double throughput() {
        return elapsedNanos > 0 ? items * 1_000_000_000.0 / elapsedNanos : 0.0;
    }

    @Override
    public String toString() {
        return String.format("RunStatistics[%s: %d items, %d chunks, %d workers, %.2fms, %.0f items/s, recycled=%d, lost=%d]",
                             label, items, chunks, workers, elapsedMillis(), throughput(), recycledWorkers,
                             lostWorkers);
    }
}
