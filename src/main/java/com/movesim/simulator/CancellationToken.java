package com.movesim.simulator;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hierarchical, one-shot cancellation signal.
 *
 * <p>A session owns one root token and derives a {@link #child()} per generator. Cancelling a
 * token cancels all of its descendants with the same cause; cancelling a child leaves the parent
 * untouched. Only the first {@link #cancel(CancellationCause)} has any effect, so competing
 * stop paths (manual stop, new session, deadline) can all call it safely.
 *
 * <p>Threads wait on the token with {@link #awaitCancellation(long)}, which doubles as an
 * interruptible sleep that ends early when the token fires.
 */
public final class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private final CountDownLatch signal = new CountDownLatch(1);
    private final AtomicReference<CancellationCause> cause = new AtomicReference<>();
    private final List<CancellationToken> children = new CopyOnWriteArrayList<>();
    private final List<Consumer<CancellationCause>> listeners = new CopyOnWriteArrayList<>();

    private CancellationToken() {}

    public static CancellationToken root() {
        return new CancellationToken();
    }

    /**
     * Derives a token that fires whenever this one does. A child derived from an already
     * cancelled token is returned cancelled.
     */
    public CancellationToken child() {
        CancellationToken child = new CancellationToken();
        children.add(child);
        // cancel() may have iterated the children before the add above
        CancellationCause current = cause.get();
        if (current != null) {
            child.cancel(current);
        }
        return child;
    }

    /**
     * Fires the token. Returns {@code true} only for the call that actually cancelled it.
     */
    public boolean cancel(CancellationCause reason) {
        if (reason == null) {
            throw new IllegalArgumentException("Cancellation cause is required");
        }
        if (!cause.compareAndSet(null, reason)) {
            return false;
        }
        signal.countDown();
        for (CancellationToken child : children) {
            child.cancel(reason);
        }
        for (Consumer<CancellationCause> listener : listeners) {
            notifyOnce(listener, reason);
        }
        return true;
    }

    /**
     * Registers a callback run exactly once with the cause, on the cancelling thread. Runs
     * immediately on the caller's thread if the token has already fired.
     */
    public void onCancel(Consumer<CancellationCause> listener) {
        listeners.add(listener);
        CancellationCause current = cause.get();
        if (current != null) {
            notifyOnce(listener, current);
        }
    }

    public boolean isCancelled() {
        return cause.get() != null;
    }

    public Optional<CancellationCause> getCause() {
        return Optional.ofNullable(cause.get());
    }

    /**
     * Blocks for at most {@code timeoutMs} or until the token fires.
     *
     * @return true if the token is cancelled
     */
    public boolean awaitCancellation(long timeoutMs) throws InterruptedException {
        return signal.await(timeoutMs, TimeUnit.MILLISECONDS);
    }

    private void notifyOnce(Consumer<CancellationCause> listener, CancellationCause reason) {
        // remove() succeeds for exactly one caller, whichever of cancel() and onCancel() gets there first
        if (!listeners.remove(listener)) {
            return;
        }
        try {
            listener.accept(reason);
        } catch (RuntimeException e) {
            log.error("Cancellation listener failed for cause {}: {}", reason, e.getMessage(), e);
        }
    }
}
