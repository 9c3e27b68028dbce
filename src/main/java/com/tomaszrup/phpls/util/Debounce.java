////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.phpls.util;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Coalesces rapid successive events. Each {@link #handle(Object)} replaces
 * the pending event and restarts the delay; the consumer receives only the
 * latest event, once the delay passes without another one.
 *
 * @param <T> the event type
 */
public class Debounce<T> {
    private static final Logger logger = LoggerFactory.getLogger(Debounce.class);

    private final Consumer<T> handler;
    private final long delayMs;
    private final ScheduledExecutorService executor;

    private T pending;
    private ScheduledFuture<?> scheduled;

    public Debounce(Consumer<T> handler, long delayMs, ScheduledExecutorService executor) {
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs must not be negative: " + delayMs);
        }
        this.handler = handler;
        this.delayMs = delayMs;
        this.executor = executor;
    }

    public synchronized void handle(T event) {
        pending = event;
        if (scheduled != null) {
            scheduled.cancel(false);
        }
        scheduled = executor.schedule(this::fire, delayMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Delivers the pending event now, on the calling thread.
     */
    public void flush() {
        T event;
        synchronized (this) {
            if (scheduled != null) {
                scheduled.cancel(false);
                scheduled = null;
            }
            event = pending;
            pending = null;
        }
        if (event != null) {
            deliver(event);
        }
    }

    /**
     * Drops the pending event without delivering it.
     */
    public synchronized void clear() {
        if (scheduled != null) {
            scheduled.cancel(false);
            scheduled = null;
        }
        pending = null;
    }

    public synchronized boolean hasPending() {
        return pending != null;
    }

    private void fire() {
        T event;
        synchronized (this) {
            event = pending;
            pending = null;
            scheduled = null;
        }
        if (event != null) {
            deliver(event);
        }
    }

    private void deliver(T event) {
        try {
            handler.accept(event);
        } catch (RuntimeException e) {
            logger.error("Error handling debounced event {}: {}", event, e.getMessage(), e);
        }
    }
}
