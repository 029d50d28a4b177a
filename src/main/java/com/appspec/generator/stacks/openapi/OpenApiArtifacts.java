package com.appspec.generator.stacks.openapi;

import java.util.List;
import java.util.Map;

import com.appspec.generator.codegen.artifact.ArtifactKey;

/**
 * Artifacts exchanged between the units of the {@code openapi} stack.
 */
public final class OpenApiArtifacts {

    /** Entity name to the relative {@code $ref} of its schema file. */
    public static final ArtifactKey<Map<String, String>> SCHEMA_REFS =
            ArtifactKey.mapOf("openapi.schema_refs", String.class, String.class);

    /** Operation ids of the generated document, in document order. */
    public static final ArtifactKey<List<String>> OPERATION_IDS =
            ArtifactKey.listOf("openapi.operation_ids", String.class);

    public static final ArtifactKey<String> API_KEY = ArtifactKey.of("openapi.api_key", String.class).displayed();

    private OpenApiArtifacts() {
    }
}
