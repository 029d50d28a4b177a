package com.appspec.generator.codegen.artifact;

import lombok.NonNull;

/**
 * An artifact payload paired with its key, as returned by a pipeline unit.
 */
public record ArtifactValue<T>(@NonNull ArtifactKey<T> key, @NonNull T value) {

    public static <T> ArtifactValue<T> of(ArtifactKey<T> key, T value) {
        return new ArtifactValue<>(key, value);
    }
}
