package com.example.automatacurve;

import java.util.concurrent.atomic.AtomicBoolean;

/** Cooperative stop flag shared between a computation and whoever may stop it. */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
