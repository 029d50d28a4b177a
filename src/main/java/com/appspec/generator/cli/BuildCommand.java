package com.appspec.generator.cli;

import java.io.IOException;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.appspec.generator.cli.exception.OptionsValidationException;
import com.appspec.generator.cli.model.BuildCommandOptions;
import com.appspec.generator.cli.model.ValidatedBuildOptions;
import com.appspec.generator.cli.output.BuildResultsPrinter;
import com.appspec.generator.cli.validation.BuildOptionsValidator;
import com.appspec.generator.codegen.BuildError;
import com.appspec.generator.codegen.BuildOrchestrator;
import com.appspec.generator.codegen.BuildResult;
import com.appspec.generator.codegen.backend.BackendRegistry;
import com.appspec.generator.codegen.model.output.WrittenFile;
import com.appspec.generator.codegen.util.FileWriteUtil;
import com.appspec.generator.ir.AppSpec;
import com.appspec.generator.ir.io.IrSnapshotReader;
import com.appspec.generator.stacks.BuiltinStacks;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * Runs one build of a stack against an IR document.
 */
@Command(
        name = "build",
        mixinStandardHelpOptions = true,
        description = "Builds the source tree of one stack from an AppSpec IR document."
)
public class BuildCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(BuildCommand.class);

    @Mixin
    private BuildCommandOptions options = new BuildCommandOptions();

    private final BackendRegistry registry;
    private final BuildResultsPrinter printer = new BuildResultsPrinter();

    public BuildCommand() {
        this(BuiltinStacks.registry());
    }

    public BuildCommand(BackendRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Integer call() {
        ValidatedBuildOptions validated;
        try {
            validated = new BuildOptionsValidator(registry).validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        }

        AppSpec ir;
        try {
            ir = new IrSnapshotReader().read(validated.getIrFile());
        } catch (IOException e) {
            log.error("Could not read IR document {}: {}", validated.getIrFile(), e.getMessage());
            return 1;
        }

        printer.printBanner(validated, ir);
        BuildResult result = new BuildOrchestrator(registry)
                .build(validated.getStackId(), ir, validated.getOutputDir(), validated.getBuildOptions());

        if (result.isSuccess()) {
            printer.printSuccess(result);
            return 0;
        }
        printer.printFailure(result);
        if (validated.isCleanOnFailure()) {
            cleanUp(validated, result.getError().orElseThrow());
        }
        return 1;
    }

    private void cleanUp(ValidatedBuildOptions validated, BuildError error) {
        try {
            int deleted = FileWriteUtil.deleteFiles(validated.getOutputDir(),
                    error.getWrittenFiles().stream().map(WrittenFile::getRelativePath).toList());
            printer.printCleanup(deleted);
        } catch (IOException e) {
            log.error("Cleanup of {} failed: {}", validated.getOutputDir(), e.getMessage());
        }
    }
}
