package com.appspec.generator.codegen.model.core.context;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Options of one build run. Generators may read them; they are part of the inputs a
 * generator's output is a function of.
 */
@Value
@Builder(toBuilder = true)
public class BuildOptions {

    /**
     * Version of the target toolchain the generated tree is meant for.
     */
    @Builder.Default
    int targetVersion = 3;

    /**
     * Free-form stack-specific options ({@code --option key=value} on the command line).
     */
    @Singular
    Map<String, String> properties;

    /**
     * Generators left out of this run. Their dependants then fail to resolve.
     */
    @Singular
    Set<String> excludedGenerators;

    /**
     * Number of generators allowed to run at the same time. 1 means strictly sequential.
     */
    @Builder.Default
    int parallelism = 1;

    /**
     * Default time budget of each generator and hook; null means unbounded.
     */
    Duration unitTimeout;

    @NonNull
    @Builder.Default
    CancellationToken cancellationToken = new CancellationToken();

    public static BuildOptions defaults() {
        return BuildOptions.builder().build();
    }

    public Optional<String> property(String key) {
        return Optional.ofNullable(properties.get(key));
    }

    public boolean isParallel() {
        return parallelism > 1;
    }
}
