package com.appspec.generator.codegen.model.core.context;

import java.nio.file.Path;
import java.util.List;

import com.appspec.generator.codegen.artifact.ArtifactKey;
import com.appspec.generator.codegen.artifact.ArtifactView;
import com.appspec.generator.codegen.model.output.WrittenFile;
import com.appspec.generator.ir.AppSpec;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * What a single generator or hook sees while it runs: the IR, the run options and the
 * artifacts it declared as requirements.
 *
 * Tests construct one directly with an {@link ArtifactView} over a registry holding only the
 * required artifacts.
 */
@Value
@Builder
public class UnitContext {

    @NonNull
    String componentId;

    @NonNull
    String stackId;

    @NonNull
    AppSpec ir;

    @NonNull
    BuildOptions options;

    @NonNull
    ArtifactView artifacts;

    /** Output root; hooks use it for side effects next to the generated tree. */
    @NonNull
    Path outputRoot;

    /** Files flushed before this unit started. */
    @Singular
    List<WrittenFile> writtenFiles;

    public <T> T artifact(ArtifactKey<T> key) {
        return artifacts.get(key);
    }
}
