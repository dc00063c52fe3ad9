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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders progress as log lines, one per percentage step.
 *
 * @author hal.hildebrand
 */
public final class LoggingProgressSink implements ProgressSink {
    private static final Logger log = LoggerFactory.getLogger(LoggingProgressSink.class);

    private final int    stepPercent;
    private       String label = "";
    private       int    lastReported;
    private       long   startNanos;

    public LoggingProgressSink() {
        this(10);
    }

    public LoggingProgressSink(int stepPercent) {
        if (stepPercent <= 0 || stepPercent > 100) {
            throw new IllegalArgumentException("stepPercent must be in (0, 100]: " + stepPercent);
        }
        this.stepPercent = stepPercent;
    }

    @Override
    public void onStart(String label, int total) {
        this.label = label;
        this.lastReported = 0;
        this.startNanos = System.nanoTime();
        log.info("[{}] 0/{} chunks", label, total);
    }

    @Override
    public void onAdvance(int completed, int total) {
        int percent = total == 0 ? 100 : (int) (100L * completed / total);
        if (percent - lastReported >= stepPercent && completed < total) {
            lastReported = percent - percent % stepPercent;
            log.info("[{}] {}/{} chunks ({}%)", label, completed, total, percent);
        }
    }

    @Override
    public void onFinish(int completed, int total) {
        log.info("[{}] {}/{} chunks in {} ms", label, completed, total, (System.nanoTime() - startNanos) / 1_000_000);
    }

    public int stepPercent() {
        return stepPercent;
    }
}
