package com.appspec.generator.codegen.backend;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Introspection view of a registered backend, consumed by the CLI.
 */
@Value
@Builder
public class BackendSummary {

    @NonNull
    String id;

    String description;

    boolean deprecated;

    /** Generator ids in resolved order. */
    @Singular
    List<String> generators;

    /** Hook ids, pre-build first, each phase in declared order. */
    @Singular
    List<String> hooks;

    @Singular
    List<String> outputFormats;

    boolean incremental;
}
