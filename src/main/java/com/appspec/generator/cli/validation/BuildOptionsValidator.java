package com.appspec.generator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.appspec.generator.cli.exception.OptionsValidationException;
import com.appspec.generator.cli.model.BuildCommandOptions;
import com.appspec.generator.cli.model.ValidatedBuildOptions;
import com.appspec.generator.codegen.backend.BackendRegistry;
import com.appspec.generator.codegen.model.core.context.BuildOptions;

public class BuildOptionsValidator {

    private final BackendRegistry registry;

    public BuildOptionsValidator(BackendRegistry registry) {
        this.registry = registry;
    }

    public ValidatedBuildOptions validate(BuildCommandOptions o) {
        List<String> errors = new ArrayList<>();

        if (isBlank(o.getStack())) {
            errors.add("Stack id is required (--stack / -s).");
        } else if (registry.find(o.getStack()).isEmpty()) {
            errors.add("Unknown stack '" + o.getStack() + "'. Run 'appspec-gen backends' to list the available stacks.");
        }

        if (o.getIrFile() == null) {
            errors.add("IR document is required (--ir / -i).");
        } else if (!Files.isRegularFile(o.getIrFile())) {
            errors.add("IR document does not exist or is not a file: " + o.getIrFile());
        }

        Path outputDir = (o.getOutputDir() == null ? Path.of(".") : o.getOutputDir()).toAbsolutePath().normalize();
        if (Files.exists(outputDir) && !Files.isDirectory(outputDir)) {
            errors.add("Output location exists and is not a directory: " + outputDir);
        }

        if (o.getTargetVersion() < 1) {
            errors.add("Target version must be >= 1. Got: " + o.getTargetVersion());
        }
        if (o.getParallelism() < 1) {
            errors.add("Parallelism must be >= 1. Got: " + o.getParallelism());
        }
        if (o.getUnitTimeoutMillis() < 0) {
            errors.add("Unit timeout must be >= 0. Got: " + o.getUnitTimeoutMillis());
        }
        for (Map.Entry<String, String> e : o.getProperties().entrySet()) {
            if (isBlank(e.getKey())) {
                errors.add("Option keys must not be blank (--option key=value).");
            }
        }
        for (String id : o.getExcludedGenerators()) {
            if (isBlank(id)) {
                errors.add("Excluded generator ids must not be blank.");
            }
        }

        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }

        BuildOptions buildOptions = BuildOptions.builder()
                .targetVersion(o.getTargetVersion())
                .properties(o.getProperties())
                .excludedGenerators(o.getExcludedGenerators())
                .parallelism(o.getParallelism())
                .unitTimeout(o.getUnitTimeoutMillis() == 0 ? null : Duration.ofMillis(o.getUnitTimeoutMillis()))
                .build();
        return new ValidatedBuildOptions(o.getStack(), o.getIrFile(), outputDir, buildOptions, o.isCleanOnFailure());
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
