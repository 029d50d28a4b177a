package com.appspec.generator.codegen.model.output;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A generated file buffered in memory (relative path + contents).
 *
 * Pure structure only.
 */
@Value
@Builder(toBuilder = true)
public class GeneratedFile {

    /** Path relative to the output root, using {@code /} as separator. */
    @NonNull
    String relativePath;

    @NonNull
    String contents;

    public static GeneratedFile of(String relativePath, String contents) {
        return new GeneratedFile(relativePath, contents);
    }
}
