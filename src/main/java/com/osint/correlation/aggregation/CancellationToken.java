package com.osint.correlation.aggregation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Caller-held handle for cancelling a batch. Cancellation propagates to in-flight adapter calls
 * and stops pending correlation work; whatever completed before is still returned.
 */
public final class CancellationToken {

    private volatile boolean cancelled;
    private final List<Runnable> listeners = new ArrayList<>();

    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * A fresh token for callers that do not cancel.
     */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Cancels the token and runs every registered listener once. Idempotent.
     */
    public void cancel() {
        List<Runnable> toRun;
        synchronized (listeners) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            toRun = new ArrayList<>(listeners);
            listeners.clear();
        }
        toRun.forEach(Runnable::run);
    }

    /**
     * Registers a listener run on cancellation, immediately if already cancelled.
     *
     * @return handle that unregisters the listener; a token reused across batches must not
     *         keep every batch's listener alive
     */
    public Registration onCancel(Runnable listener) {
        Objects.requireNonNull(listener, "listener is required");
        synchronized (listeners) {
            if (!cancelled) {
                listeners.add(listener);
                return () -> {
                    synchronized (listeners) {
                        listeners.remove(listener);
                    }
                };
            }
        }
        listener.run();
        return () -> { };
    }

    int listenerCount() {
        synchronized (listeners) {
            return listeners.size();
        }
    }

    /**
     * Unregisters a cancellation listener. Closing twice, or after the token fired, does nothing.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
