package com.findex.backend.util;

import com.findex.backend.exception.ExportCancelledException;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Shared cancellation flag for one export. Children observe their parent, so a
 * caller cancel reaches every region worker, while a worker-side abort only
 * stops its own subtree.
 */
public final class CancellationToken {

    private final CancellationToken parent;
    private final AtomicReference<String> reason = new AtomicReference<>();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    public CancellationToken() {
        this(null);
    }

    private CancellationToken(CancellationToken parent) {
        this.parent = parent;
    }

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public CancellationToken child() {
        CancellationToken child = new CancellationToken(this);
        onCancel(() -> child.cancel(reason()));
        return child;
    }

    public boolean cancel(String why) {
        if (!reason.compareAndSet(null, why != null ? why : "cancelled")) {
            return false;
        }
        for (Runnable listener : listeners) {
            listener.run();
        }
        return true;
    }

    public boolean isCancelled() {
        return reason.get() != null || (parent != null && parent.isCancelled());
    }

    public String reason() {
        String own = reason.get();
        if (own == null && parent != null) {
            return parent.reason();
        }
        return own;
    }

    /**
     * Registers a callback run once on cancellation. Runs immediately when the
     * token is already cancelled. The returned handle removes the callback.
     */
    public Runnable onCancel(Runnable listener) {
        listeners.add(listener);
        if (isCancelled()) {
            listener.run();
        }
        return () -> listeners.remove(listener);
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new ExportCancelledException("Export cancelled: " + reason());
        }
    }
}
