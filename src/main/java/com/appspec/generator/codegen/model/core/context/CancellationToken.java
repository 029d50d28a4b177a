package com.appspec.generator.codegen.model.core.context;

import java.util.concurrent.atomic.AtomicBoolean;

import com.appspec.generator.codegen.exception.BuildCancelledException;

/**
 * Cooperative cancellation flag. The engine checks it between units, never inside one.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled(String nextComponentId) {
        if (cancelled.get()) {
            throw new BuildCancelledException(nextComponentId);
        }
    }
}
