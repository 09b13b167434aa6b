package net.scanorama.core.model;

import java.util.concurrent.atomic.AtomicBoolean;

/** Cooperative cancellation shared by every job body started under one scheduler run. */
public final class CancellationSignal {
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() { cancelled.set(true); }

    public boolean isCancelled() { return cancelled.get(); }
}
