package com.appspec.generator.codegen.backend;

import java.util.List;
import java.util.Map;
import java.util.Set;

import com.appspec.generator.codegen.generator.Generator;
import com.appspec.generator.codegen.hook.Hook;

import lombok.NonNull;
import lombok.Value;

/**
 * Resolved execution order of one backend for one run.
 */
@Value
public class ExecutionPlan {

    @NonNull
    String stackId;

    @NonNull
    List<Hook> preBuildHooks;

    /** Generators in topological order, ties broken by declaration index. */
    @NonNull
    List<Generator> generators;

    @NonNull
    List<Hook> postBuildHooks;

    /** Direct prerequisites of each generator, by id. */
    @NonNull
    Map<String, Set<String>> dependencies;

    public Set<String> dependenciesOf(String generatorId) {
        return dependencies.getOrDefault(generatorId, Set.of());
    }

    public List<String> generatorIds() {
        return generators.stream().map(Generator::id).toList();
    }
}
