package com.appspec.generator.codegen;

import java.util.List;

import com.appspec.generator.codegen.model.core.context.BuildStage;
import com.appspec.generator.codegen.model.core.context.Diagnostic;
import com.appspec.generator.codegen.model.core.context.DiagnosticKind;
import com.appspec.generator.codegen.model.output.WrittenFile;
import com.appspec.generator.ir.IrNodeRef;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Why a build run failed and what it left on disk.
 *
 * {@link #writtenFiles} and {@link #completedGenerators} describe exactly the output of the
 * generators that committed before the failure, so a caller can clean up partial output.
 */
@Value
@Builder
public class BuildError {

    @NonNull
    Diagnostic diagnostic;

    @Singular
    List<WrittenFile> writtenFiles;

    @Singular
    List<String> completedGenerators;

    public BuildStage getStage() {
        return diagnostic.getStage();
    }

    public String getComponentId() {
        return diagnostic.getComponentId();
    }

    public DiagnosticKind getKind() {
        return diagnostic.getKind();
    }

    public String getMessage() {
        return diagnostic.getMessage();
    }

    public IrNodeRef getNode() {
        return diagnostic.getNode();
    }
}
