package com.appspec.generator.codegen.model.core.context;

/**
 * Machine-readable category of a diagnostic.
 */
public enum DiagnosticKind {
    CONFIGURATION,
    GENERATION,
    HOOK,
    IO,
    CANCELLED,
    TIMEOUT,
    WARNING
}
