package com.appspec.generator.codegen.model.core.context;

import com.appspec.generator.ir.IrNodeRef;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One structured diagnostic (error or warning) produced during a build run.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Value
@Builder(toBuilder = true)
public class Diagnostic {

    @NonNull
    BuildStage stage;

    /** Id of the generator, hook or backend the diagnostic is attributed to. */
    @NonNull
    String componentId;

    @NonNull
    DiagnosticKind kind;

    @NonNull
    String message;

    /** Implicated IR node, when one is known. */
    IrNodeRef node;

    public static Diagnostic warning(BuildStage stage, String componentId, String message) {
        return Diagnostic.builder()
                .stage(stage)
                .componentId(componentId)
                .kind(DiagnosticKind.WARNING)
                .message(message)
                .build();
    }

    @Override
    public String toString() {
        String text = "[" + stage + "/" + kind + "] " + componentId + ": " + message;
        return node != null ? text + " (" + node + ")" : text;
    }
}
