package com.appspec.generator.codegen.backend;

import lombok.NonNull;
import lombok.Value;

/**
 * Deprecation metadata of a stack. Advisory only: a deprecated stack still runs.
 */
@Value
public class Deprecation {

    @NonNull
    String since;

    @NonNull
    String removal;

    @NonNull
    String migrationHint;
}
