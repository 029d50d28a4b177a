package com.appspec.generator.codegen.hook;

import com.appspec.generator.codegen.exception.HookException;

/**
 * Base class for hooks holding the descriptor.
 */
public abstract class AbstractHook implements Hook {

    private final HookDescriptor descriptor;

    protected AbstractHook(HookDescriptor descriptor) {
        this.descriptor = descriptor;
    }

    @Override
    public final HookDescriptor descriptor() {
        return descriptor;
    }

    protected HookException fail(String message) {
        return new HookException(id(), message);
    }

    protected HookException fail(String message, Throwable cause) {
        return new HookException(id(), message, cause);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + id() + "]";
    }
}
