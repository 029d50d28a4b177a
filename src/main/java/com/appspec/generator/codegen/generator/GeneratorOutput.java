package com.appspec.generator.codegen.generator;

import java.util.List;

import com.appspec.generator.codegen.artifact.ArtifactKey;
import com.appspec.generator.codegen.artifact.ArtifactValue;
import com.appspec.generator.codegen.model.output.GeneratedFile;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Everything one generator run produced: buffered files, artifacts, warnings.
 */
@Value
@Builder
public class GeneratorOutput {

    @Singular("generatedFile")
    List<GeneratedFile> files;

    @Singular("artifactValue")
    List<ArtifactValue<?>> artifacts;

    @Singular
    List<String> warnings;

    public static GeneratorOutput empty() {
        return GeneratorOutput.builder().build();
    }

    public static class GeneratorOutputBuilder {

        public GeneratorOutputBuilder file(String relativePath, String contents) {
            return generatedFile(GeneratedFile.of(relativePath, contents));
        }

        public <T> GeneratorOutputBuilder artifact(ArtifactKey<T> key, T value) {
            return artifactValue(ArtifactValue.of(key, value));
        }
    }
}
