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
package com.hellblazer.quarry.engine.progress;

/**
 * Observer of run progress. Purely observational: a sink cannot influence the run.
 * <p>
 * All calls are made from the single consumer thread of a {@link ProgressChannel}, so implementations need not be
 * thread safe.
 *
 * @author hal.hildebrand
 */
public interface ProgressSink {

    /**
     * Called once before the first completion.
     *
     * @param label the run label, may be empty
     * @param total number of chunks in the run
     */
    void onStart(String label, int total);

    /**
     * Called once per completed chunk, in completion order.
     *
     * @param completed chunks completed so far, strictly increasing
     * @param total     number of chunks in the run
     */
    void onAdvance(int completed, int total);

    /**
     * Called once when the channel closes.
     */
    void onFinish(int completed, int total);
}
