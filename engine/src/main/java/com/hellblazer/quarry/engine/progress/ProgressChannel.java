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

import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Queue-based progress channel. Task completions, arriving on worker threads, push events onto a queue; a single
 * consumer thread drains it, owns the completion counter and is the only caller of the {@link ProgressSink}.
 *
 * @author hal.hildebrand
 */
public final class ProgressChannel implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ProgressChannel.class);

    private final String              label;
    private final int                 total;
    private final ProgressSink        sink;
    private final BlockingQueue<Event> events = new LinkedBlockingQueue<>();
    private final AtomicBoolean       closed = new AtomicBoolean();
    private final Thread              consumer;
    // Written only by the consumer thread
    private volatile int completed;

    private ProgressChannel(String label, int total, ProgressSink sink) {
        this.label = label;
        this.total = total;
        this.sink = sink;
        this.consumer = new Thread(this::consume, "quarry-progress" + (label.isEmpty() ? "" : "-" + label));
        consumer.setDaemon(true);
    }

    /**
     * Open a channel and start its consumer.
     *
     * @param label run label passed to the sink
     * @param total total number of chunks
     * @param sink  the observer
     * @return the open channel
     */
    public static ProgressChannel open(String label, int total, ProgressSink sink) {
        Objects.requireNonNull(label, "label cannot be null");
        Objects.requireNonNull(sink, "sink cannot be null");
        if (total < 0) {
            throw new IllegalArgumentException("total must be non-negative: " + total);
        }
        var channel = new ProgressChannel(label, total, sink);
        channel.consumer.start();
        return channel;
    }

    /**
     * Record one completed chunk. Safe to call from any thread; never blocks. Ignored once the channel is closed.
     */
    public void completed() {
        if (!closed.get()) {
            events.add(Event.ADVANCE);
        }
    }

    /**
     * Number of completions the consumer has processed so far.
     */
    public int completedCount() {
        return completed;
    }

    public int total() {
        return total;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Deliver every pending event, notify the sink that the run finished and stop the consumer. Idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        events.add(Event.END);
        try {
            consumer.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while closing progress channel {}", label);
        }
    }

    private void consume() {
        notifySink(() -> sink.onStart(label, total));
        try {
            while (events.take() != Event.END) {
                completed++;
                int snapshot = completed;
                notifySink(() -> sink.onAdvance(snapshot, total));
            }
        } catch (InterruptedException e) {
            log.warn("Progress consumer for {} interrupted at {}/{}", label, completed, total);
        }
        int snapshot = completed;
        notifySink(() -> sink.onFinish(snapshot, total));
    }

    private void notifySink(Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) {
            log.warn("Progress sink failed for {}", label, e);
        }
    }

    private enum Event {
        ADVANCE, END
    }
}
