package com.appspec.generator.cli.model;

import java.nio.file.Path;

import com.appspec.generator.codegen.model.core.context.BuildOptions;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the build command. Keeps BuildCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedBuildOptions {
    String stackId;
    Path irFile;
    Path outputDir;
    BuildOptions buildOptions;
    boolean cleanOnFailure;
}
