/*
 * Copyright (c) 2025 Polaris Sentiment
 * Licensed under the Apache License, Version 2.0
 */
package com.polaris.sentiment.api.context;

import com.polaris.sentiment.api.exceptions.CancelledException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Per-request cancellation signal with an optional deadline.
 *
 * <p>A context is <em>done</em> once it has been cancelled explicitly or its
 * deadline has passed. Work that holds a remote resource registers a listener
 * through {@link #onCancel(Runnable)} so that an explicit cancel releases it.
 * Deadline expiry does not fire listeners; callers bound their waits with
 * {@link #boundTimeout(Duration)} instead.
 *
 * <h2>Thread Safety</h2>
 * <p>All methods may be called from any thread. Listeners run at most once,
 * on the thread that calls {@link #cancel()}.
 */
public final class RequestContext {

    private static final Logger logger = Logger.getLogger(RequestContext.class.getName());

    private final Clock clock;
    private final Instant deadline;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    private RequestContext(Clock clock, Instant deadline) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.deadline = deadline;
    }

    /**
     * Context without a deadline. Still cancellable.
     */
    public static RequestContext background() {
        return new RequestContext(Clock.systemUTC(), null);
    }

    public static RequestContext withTimeout(Duration timeout) {
        return withTimeout(timeout, Clock.systemUTC());
    }

    public static RequestContext withTimeout(Duration timeout, Clock clock) {
        Objects.requireNonNull(timeout, "timeout cannot be null");
        return new RequestContext(clock, clock.instant().plus(timeout));
    }

    /**
     * Cancels the context and runs registered listeners. Idempotent.
     */
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        for (Runnable listener : listeners) {
            runListener(listener);
        }
        listeners.clear();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isDeadlineExceeded() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    public boolean isDone() {
        return isCancelled() || isDeadlineExceeded();
    }

    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    /**
     * Time left until the deadline, never negative. Empty when there is no deadline.
     */
    public Optional<Duration> remaining() {
        if (deadline == null) {
            return Optional.empty();
        }
        Duration left = Duration.between(clock.instant(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    /**
     * The smaller of {@code limit} and the remaining time.
     */
    public Duration boundTimeout(Duration limit) {
        Objects.requireNonNull(limit, "limit cannot be null");
        return remaining()
                .filter(left -> left.compareTo(limit) < 0)
                .orElse(limit);
    }

    /**
     * @throws CancelledException if the context is done
     */
    public void ensureActive() {
        if (isCancelled()) {
            throw new CancelledException("Request context cancelled");
        }
        if (isDeadlineExceeded()) {
            throw new CancelledException("Request deadline exceeded");
        }
    }

    /**
     * Registers a listener fired by {@link #cancel()}. If the context is already
     * cancelled the listener runs immediately.
     *
     * @return handle that unregisters the listener when closed
     */
    public Registration onCancel(Runnable listener) {
        Objects.requireNonNull(listener, "listener cannot be null");
        listeners.add(listener);
        // cancel() may have drained the list between the check and the add
        if (cancelled.get() && listeners.remove(listener)) {
            runListener(listener);
        }
        return () -> listeners.remove(listener);
    }

    private void runListener(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Cancel listener failed", e);
        }
    }

    @Override
    public String toString() {
        return "RequestContext{deadline=" + deadline + ", cancelled=" + cancelled.get() + "}";
    }

    /**
     * Handle returned by {@link #onCancel(Runnable)}.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
