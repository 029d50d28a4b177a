package com.appspec.generator.codegen.exception;

import java.time.Duration;

import com.appspec.generator.codegen.model.core.context.DiagnosticKind;

/**
 * A hook failed. Fatal in the pre-build phase and for critical hooks, demoted to a warning
 * otherwise.
 */
public class HookException extends StackBuildException {

    private static final long serialVersionUID = 1L;

    public HookException(String hookId, String message) {
        this(hookId, message, null);
    }

    public HookException(String hookId, String message, Throwable cause) {
        super(DiagnosticKind.HOOK, hookId, message, cause);
    }

    private HookException(DiagnosticKind kind, String hookId, String message, Throwable cause) {
        super(kind, hookId, message, cause);
    }

    public static HookException timedOut(String hookId, Duration timeout) {
        return new HookException(DiagnosticKind.TIMEOUT, hookId,
                "Hook '" + hookId + "' exceeded its timeout of " + timeout.toMillis() + " ms", null);
    }

    /**
     * Attributes an engine failure raised inside a hook to that hook, keeping its kind.
     */
    public static HookException raisedBy(String hookId, StackBuildException cause) {
        return new HookException(cause.getKind(), hookId, "Hook '" + hookId + "' failed: " + cause.getMessage(), cause);
    }

    public String getHookId() {
        return getComponentId();
    }
}
