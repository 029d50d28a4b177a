package com.appspec.generator.cli.output;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.appspec.generator.cli.model.ValidatedBuildOptions;
import com.appspec.generator.codegen.BuildError;
import com.appspec.generator.codegen.BuildResult;
import com.appspec.generator.codegen.backend.BackendSummary;
import com.appspec.generator.codegen.model.core.context.DeprecationNotice;
import com.appspec.generator.codegen.model.core.context.Diagnostic;
import com.appspec.generator.ir.AppSpec;

/**
 * Responsible only for printing CLI output. No validation, no execution.
 */
public class BuildResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(BuildResultsPrinter.class);

    public void printBanner(ValidatedBuildOptions v, AppSpec ir) {
        log.info("=================================================");
        log.info("AppSpec Stack Generator");
        log.info("=================================================");
        log.info("Specification: {} ({})", ir.displayTitle(), ir.getVersion());
        log.info("IR Document: {}", v.getIrFile().toAbsolutePath());
        log.info("Stack: {}", v.getStackId());
        log.info("Target Version: {}", v.getBuildOptions().getTargetVersion());
        log.info("Output Directory: {}", v.getOutputDir());
        if (v.getBuildOptions().isParallel()) {
            log.info("Parallelism: {}", v.getBuildOptions().getParallelism());
        }
        if (!v.getBuildOptions().getExcludedGenerators().isEmpty()) {
            log.info("Excluded Generators: {}", v.getBuildOptions().getExcludedGenerators());
        }
        log.info("=================================================");
    }

    public void printSuccess(BuildResult result) {
        log.info("");
        log.info("=================================================");
        log.info("BUILD SUCCESSFUL");
        log.info("=================================================");
        log.info("Stack: {}", result.getStackId());
        log.info("Generators: {}", String.join(", ", result.getCompletedGenerators()));
        log.info("Files Written: {}", result.getWrittenFiles().size());
        result.getWrittenFiles().forEach(f -> log.info("  {} ({} bytes)", f.getRelativePath(), f.getByteLength()));
        printNotices(result);
        if (!result.getDisplayedArtifacts().isEmpty()) {
            log.info("");
            log.info("Generated Values:");
            result.getDisplayedArtifacts().forEach((key, value) -> log.info("  {}: {}", key, value));
        }
        log.info("");
        log.info("Completed in {} ms", result.getDurationMillis());
        log.info("=================================================");
    }

    public void printFailure(BuildResult result) {
        BuildError error = result.getError().orElseThrow();
        log.error("Build failed in stage {} ({}): {}", error.getStage(), error.getKind(), error.getMessage());
        if (error.getComponentId() != null) {
            log.error("Failing component: {}", error.getComponentId());
        }
        if (error.getNode() != null) {
            log.error("IR node: {}", error.getNode());
        }
        if (!error.getWrittenFiles().isEmpty()) {
            log.error("Files left on disk by completed generators {}: {}",
                    error.getCompletedGenerators(), error.getWrittenFiles().size());
        }
        printNotices(result);
    }

    public void printCleanup(int deleted) {
        log.info("Removed {} file(s) written before the failure", deleted);
    }

    public void printBackends(List<BackendSummary> backends) {
        log.info("Available stacks:");
        for (BackendSummary backend : backends) {
            log.info("  {}{} - {}", backend.getId(), backend.isDeprecated() ? " (deprecated)" : "",
                    backend.getDescription() == null ? "" : backend.getDescription());
            log.info("      generators: {}", String.join(", ", backend.getGenerators()));
            if (!backend.getOutputFormats().isEmpty()) {
                log.info("      formats: {}{}", String.join(", ", backend.getOutputFormats()),
                        backend.isIncremental() ? " (incremental)" : "");
            }
            if (!backend.getHooks().isEmpty()) {
                log.info("      hooks: {}", String.join(", ", backend.getHooks()));
            }
        }
    }

    private void printNotices(BuildResult result) {
        for (DeprecationNotice notice : result.getDeprecationNotices()) {
            log.warn("Stack '{}' is deprecated since {} and will be removed in {}: {}",
                    notice.getStackId(), notice.getSince(), notice.getRemoval(), notice.getMigrationHint());
        }
        for (Diagnostic warning : result.getWarnings()) {
            log.warn("[{}] {}", warning.getComponentId(), warning.getMessage());
        }
    }
}
