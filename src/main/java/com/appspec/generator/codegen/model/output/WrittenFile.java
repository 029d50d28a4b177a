package com.appspec.generator.codegen.model.output;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A file flushed to the output location during a build run.
 */
@Value
@Builder
public class WrittenFile {

    @NonNull
    String relativePath;

    long byteLength;

    /** Lower-case hex SHA-256 of the written bytes. */
    @NonNull
    String checksum;

    /** Generator that produced the file. */
    @NonNull
    String generatorId;
}
