package com.appspec.generator.codegen.generator;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;

import com.appspec.generator.codegen.artifact.ArtifactKey;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Static declaration of a generator: what it reads, what it writes.
 */
@Value
@Builder(toBuilder = true)
public class GeneratorDescriptor {

    @NonNull
    String id;

    /** Artifacts that must exist before the generator runs. */
    @Singular("require")
    Set<ArtifactKey<?>> requires;

    /** Artifacts the generator writes. */
    @Singular("produce")
    Set<ArtifactKey<?>> produces;

    /**
     * Artifacts the generator rewrites although another unit already produced them. The
     * generator is ordered after the original writer.
     */
    @Singular("override")
    Set<ArtifactKey<?>> overrides;

    /**
     * Glob patterns ({@code *}, {@code **}, {@code ?}) of the relative paths the generator may
     * emit. Patterns of different generators must not overlap.
     */
    @Singular("output")
    Set<String> outputs;

    /** Overrides the run-wide unit timeout; null to inherit it. */
    Duration timeout;

    /**
     * Keys the generator may write: {@link #produces} plus {@link #overrides}.
     */
    public Set<ArtifactKey<?>> writes() {
        Set<ArtifactKey<?>> all = new LinkedHashSet<>(produces);
        all.addAll(overrides);
        return all;
    }
}
