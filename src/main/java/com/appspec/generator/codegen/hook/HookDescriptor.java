package com.appspec.generator.codegen.hook;

import java.time.Duration;
import java.util.Set;

import com.appspec.generator.codegen.artifact.ArtifactKey;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class HookDescriptor {

    @NonNull
    String id;

    @NonNull
    HookPhase phase;

    String description;

    @Singular("require")
    Set<ArtifactKey<?>> requires;

    @Singular("produce")
    Set<ArtifactKey<?>> produces;

    /**
     * A failing critical post-build hook fails the build. Pre-build hooks are always fatal.
     */
    boolean critical;

    Duration timeout;
}
