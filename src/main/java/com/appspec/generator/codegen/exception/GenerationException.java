package com.appspec.generator.codegen.exception;

import java.time.Duration;

import com.appspec.generator.codegen.model.core.context.DiagnosticKind;
import com.appspec.generator.ir.IrNodeRef;

/**
 * A generator failed against otherwise valid IR.
 */
public class GenerationException extends StackBuildException {

    private static final long serialVersionUID = 1L;

    private final transient IrNodeRef node;

    public GenerationException(String generatorId, IrNodeRef node, String message) {
        this(generatorId, node, message, null);
    }

    public GenerationException(String generatorId, IrNodeRef node, String message, Throwable cause) {
        this(DiagnosticKind.GENERATION, generatorId, node, message, cause);
    }

    private GenerationException(DiagnosticKind kind, String generatorId, IrNodeRef node, String message,
            Throwable cause) {
        super(kind, generatorId, message, cause);
        this.node = node;
    }

    public static GenerationException timedOut(String generatorId, Duration timeout) {
        return new GenerationException(DiagnosticKind.TIMEOUT, generatorId, null,
                "Generator '" + generatorId + "' exceeded its timeout of " + timeout.toMillis() + " ms", null);
    }

    public String getGeneratorId() {
        return getComponentId();
    }

    @Override
    public IrNodeRef getNode() {
        return node;
    }
}
