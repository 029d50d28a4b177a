package com.appspec.generator.codegen.backend;

import java.util.List;
import java.util.Optional;

import com.appspec.generator.codegen.generator.Generator;
import com.appspec.generator.codegen.hook.Hook;
import com.appspec.generator.codegen.hook.HookPhase;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A named target stack: its generators, its hooks and its metadata.
 *
 * Generators are declared without an order; their position in {@link #generators} is the
 * stable index used to break ties between independent generators. Hooks run in declaration
 * order within their phase.
 */
@Value
@Builder(toBuilder = true)
public class Backend {

    @NonNull
    String id;

    String description;

    @Singular
    List<Generator> generators;

    @Singular
    List<Hook> hooks;

    Deprecation deprecation;

    /** Formats the stack can emit, e.g. {@code yaml}; the first one is the default. */
    @Singular
    List<String> outputFormats;

    /** Whether the stack can regenerate only what changed since a previous run. */
    boolean incremental;

    public List<Hook> hooksFor(HookPhase phase) {
        return hooks.stream().filter(h -> h.phase() == phase).toList();
    }

    public Optional<Deprecation> getDeprecation() {
        return Optional.ofNullable(deprecation);
    }

    public boolean isDeprecated() {
        return deprecation != null;
    }
}
