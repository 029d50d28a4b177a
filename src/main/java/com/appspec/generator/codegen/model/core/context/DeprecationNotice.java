package com.appspec.generator.codegen.model.core.context;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Structured notice emitted before a deprecated stack runs.
 */
@Value
@Builder
public class DeprecationNotice {

    @NonNull
    String stackId;

    @NonNull
    String since;

    @NonNull
    String removal;

    @NonNull
    String migrationHint;
}
