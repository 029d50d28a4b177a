package com.appspec.generator.codegen.exception;

import com.appspec.generator.codegen.model.core.context.DiagnosticKind;
import com.appspec.generator.ir.IrNodeRef;

/**
 * Base of every failure raised by the build engine.
 *
 * Carries the machine-readable kind and the id of the component (generator, hook or backend)
 * the failure is attributed to, so the orchestrator can turn it into a diagnostic without
 * inspecting the concrete type.
 */
public abstract class StackBuildException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final DiagnosticKind kind;
    private final String componentId;

    protected StackBuildException(DiagnosticKind kind, String componentId, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.componentId = componentId;
    }

    public DiagnosticKind getKind() {
        return kind;
    }

    public String getComponentId() {
        return componentId;
    }

    /**
     * IR node implicated by the failure, or null.
     */
    public IrNodeRef getNode() {
        return null;
    }
}
