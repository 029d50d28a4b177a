package com.appspec.generator.codegen.hook;

import java.util.List;

import com.appspec.generator.codegen.artifact.ArtifactKey;
import com.appspec.generator.codegen.artifact.ArtifactValue;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class HookOutput {

    @Builder.Default
    boolean success = true;

    String message;

    @Singular("artifactValue")
    List<ArtifactValue<?>> artifacts;

    @Singular
    List<String> warnings;

    public static HookOutput ok(String message) {
        return HookOutput.builder().message(message).build();
    }

    public static HookOutput failed(String message) {
        return HookOutput.builder().success(false).message(message).build();
    }

    public static class HookOutputBuilder {

        public <T> HookOutputBuilder artifact(ArtifactKey<T> key, T value) {
            return artifactValue(ArtifactValue.of(key, value));
        }
    }
}
