package com.appspec.generator.codegen;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.appspec.generator.codegen.model.core.context.BuildStage;
import com.appspec.generator.codegen.model.core.context.DeprecationNotice;
import com.appspec.generator.codegen.model.core.context.Diagnostic;
import com.appspec.generator.codegen.model.output.WrittenFile;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Result of one build run.
 */
@Value
@Builder
public class BuildResult {

    boolean success;

    @NonNull
    String stackId;

    /** {@link BuildStage#DONE} or {@link BuildStage#FAILED}. */
    @NonNull
    BuildStage finalStage;

    /** Every flushed file, in resolved generator order. */
    @Singular
    List<WrittenFile> writtenFiles;

    @Singular
    List<String> completedGenerators;

    /** Artifacts whose key is flagged for display to the caller, e.g. generated credentials. */
    @Singular
    Map<String, Object> displayedArtifacts;

    /** Sorted snapshot of the artifact registry; empty when generation did not complete. */
    @Singular
    Map<String, Object> artifacts;

    @Singular
    List<Diagnostic> warnings;

    @Singular
    List<DeprecationNotice> deprecationNotices;

    /** Present whenever {@link #success} is false. */
    BuildError error;

    long durationMillis;

    public Optional<BuildError> getError() {
        return Optional.ofNullable(error);
    }
}
