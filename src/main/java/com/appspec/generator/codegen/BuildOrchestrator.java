package com.appspec.generator.codegen;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.appspec.generator.codegen.artifact.ArtifactKey;
import com.appspec.generator.codegen.artifact.ArtifactValue;
import com.appspec.generator.codegen.backend.Backend;
import com.appspec.generator.codegen.backend.BackendRegistry;
import com.appspec.generator.codegen.backend.BackendSummary;
import com.appspec.generator.codegen.backend.Deprecation;
import com.appspec.generator.codegen.backend.ExecutionPlan;
import com.appspec.generator.codegen.exception.BuildCancelledException;
import com.appspec.generator.codegen.exception.HookException;
import com.appspec.generator.codegen.exception.StackBuildException;
import com.appspec.generator.codegen.execution.GeneratorPipeline;
import com.appspec.generator.codegen.execution.OutputWriter;
import com.appspec.generator.codegen.execution.UnitInvoker;
import com.appspec.generator.codegen.hook.Hook;
import com.appspec.generator.codegen.hook.HookDescriptor;
import com.appspec.generator.codegen.hook.HookOutput;
import com.appspec.generator.codegen.model.core.context.BuildContext;
import com.appspec.generator.codegen.model.core.context.BuildOptions;
import com.appspec.generator.codegen.model.core.context.BuildStage;
import com.appspec.generator.codegen.model.core.context.DeprecationNotice;
import com.appspec.generator.codegen.model.core.context.Diagnostic;
import com.appspec.generator.ir.AppSpec;

/**
 * Drives one build run through its stages:
 * {@code INIT -> RESOLVE_ORDER -> PRE_BUILD -> GENERATE -> POST_BUILD -> DONE}, or
 * {@code FAILED} from any stage before {@code DONE}.
 *
 * Build failures never escape as exceptions; they are reported in the returned
 * {@link BuildResult}. The engine never retries: generation is a deterministic function of
 * its input.
 */
public class BuildOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(BuildOrchestrator.class);

    private final BackendRegistry registry;
    private final OutputWriter writer;

    public BuildOrchestrator(BackendRegistry registry) {
        this(registry, new OutputWriter());
    }

    public BuildOrchestrator(BackendRegistry registry, OutputWriter writer) {
        this.registry = registry;
        this.writer = writer;
    }

    public List<BackendSummary> listBackends() {
        return registry.list();
    }

    public BuildResult build(String stackId, AppSpec ir, Path outputDir, BuildOptions options) {
        long started = System.nanoTime();
        BuildContext ctx = new BuildContext(stackId, outputDir, ir, options);
        log.info("Starting build of '{}' for stack '{}' into {}", ir.getName(), stackId, outputDir);

        try (UnitInvoker invoker = new UnitInvoker()) {
            Backend backend = initialize(ctx);

            ctx.transition(BuildStage.RESOLVE_ORDER);
            ExecutionPlan plan = options.getExcludedGenerators().isEmpty()
                    ? registry.planFor(stackId)
                    : registry.resolver().resolve(backend, options.getExcludedGenerators());
            log.info("Resolved order: {}", plan.generatorIds());

            ctx.transition(BuildStage.PRE_BUILD);
            for (Hook hook : plan.getPreBuildHooks()) {
                ctx.checkCancelled(hook.id());
                runHook(ctx, invoker, hook);
            }

            ctx.transition(BuildStage.GENERATE);
            new GeneratorPipeline(invoker, writer).run(ctx, plan);

            ctx.transition(BuildStage.POST_BUILD);
            BuildError postBuildError = runPostBuild(ctx, invoker, plan);
            if (postBuildError != null) {
                return result(ctx, started, postBuildError, true);
            }

            ctx.transition(BuildStage.DONE);
            BuildResult result = result(ctx, started, null, true);
            log.info("Build of stack '{}' done: {} file(s) in {} ms", stackId, result.getWrittenFiles().size(),
                    result.getDurationMillis());
            return result;
        } catch (StackBuildException e) {
            BuildStage failedStage = ctx.getStage();
            log.error("Build of stack '{}' failed in {} at '{}': {}", stackId, failedStage, e.getComponentId(),
                    e.getMessage());
            log.debug("Failure detail", e);
            return result(ctx, started, toError(ctx, failedStage, e), failedStage == BuildStage.POST_BUILD);
        }
    }

    private Backend initialize(BuildContext ctx) {
        Backend backend = registry.require(ctx.getStackId());
        writer.checkUsable(ctx.getStackId(), ctx.getOutputRoot());
        backend.getDeprecation().ifPresent(deprecation -> announceDeprecation(ctx, deprecation));
        return backend;
    }

    private void announceDeprecation(BuildContext ctx, Deprecation deprecation) {
        DeprecationNotice notice = DeprecationNotice.builder()
                .stackId(ctx.getStackId())
                .since(deprecation.getSince())
                .removal(deprecation.getRemoval())
                .migrationHint(deprecation.getMigrationHint())
                .build();
        log.warn("Stack '{}' is deprecated since {} and will be removed in {}. {}", notice.getStackId(),
                notice.getSince(), notice.getRemoval(), notice.getMigrationHint());
        ctx.addDeprecationNotice(notice);
    }

    /**
     * Runs the post-build hooks. Returns the error of a failed critical hook, or null; failures
     * of non-critical hooks become warnings.
     */
    private BuildError runPostBuild(BuildContext ctx, UnitInvoker invoker, ExecutionPlan plan) {
        for (Hook hook : plan.getPostBuildHooks()) {
            ctx.checkCancelled(hook.id());
            try {
                runHook(ctx, invoker, hook);
            } catch (HookException e) {
                if (hook.descriptor().isCritical()) {
                    log.error("Critical hook '{}' failed: {}", hook.id(), e.getMessage());
                    return toError(ctx, BuildStage.POST_BUILD, e);
                }
                ctx.addWarning(Diagnostic.builder()
                        .stage(BuildStage.POST_BUILD)
                        .componentId(hook.id())
                        .kind(e.getKind())
                        .message(e.getMessage())
                        .build());
            }
        }
        return null;
    }

    private void runHook(BuildContext ctx, UnitInvoker invoker, Hook hook) {
        HookDescriptor descriptor = hook.descriptor();
        Duration timeout = descriptor.getTimeout() != null ? descriptor.getTimeout() : ctx.getOptions().getUnitTimeout();
        HookOutput output;
        try {
            output = invoker.invoke(hook.id(), timeout,
                    () -> hook.run(ctx.hookContext(hook.id(), descriptor.getRequires())),
                    t -> HookException.timedOut(hook.id(), t));
        } catch (HookException | BuildCancelledException e) {
            throw e;
        } catch (StackBuildException e) {
            // undeclared reads and I/O errors count as failures of the hook itself
            throw HookException.raisedBy(hook.id(), e);
        } catch (RuntimeException e) {
            throw new HookException(hook.id(), "Hook '" + hook.id() + "' failed: " + e.getMessage(), e);
        }
        if (output == null || !output.isSuccess()) {
            String message = output != null && output.getMessage() != null ? output.getMessage() : "reported failure";
            throw new HookException(hook.id(), "Hook '" + hook.id() + "' failed: " + message);
        }
        publishHookArtifacts(ctx, hook, output);
        for (String warning : output.getWarnings()) {
            ctx.addWarning(Diagnostic.warning(ctx.getStage(), hook.id(), warning));
        }
        if (output.getMessage() != null) {
            log.info("Hook '{}': {}", hook.id(), output.getMessage());
        }
    }

    private static void publishHookArtifacts(BuildContext ctx, Hook hook, HookOutput output) {
        Set<ArtifactKey<?>> declared = hook.descriptor().getProduces();
        Set<ArtifactKey<?>> published = new HashSet<>();
        for (ArtifactValue<?> artifact : output.getArtifacts()) {
            if (!declared.contains(artifact.key())) {
                throw new HookException(hook.id(),
                        "Hook '" + hook.id() + "' produced undeclared artifact '" + artifact.key() + "'");
            }
            put(ctx, artifact, hook.id());
            published.add(artifact.key());
        }
        for (ArtifactKey<?> key : declared) {
            if (!published.contains(key)) {
                throw new HookException(hook.id(),
                        "Hook '" + hook.id() + "' did not produce declared artifact '" + key + "'");
            }
        }
    }

    private static <T> void put(BuildContext ctx, ArtifactValue<T> artifact, String writerId) {
        ctx.getArtifacts().put(artifact.key(), artifact.value(), writerId);
    }

    private static BuildError toError(BuildContext ctx, BuildStage stage, StackBuildException e) {
        Diagnostic diagnostic = Diagnostic.builder()
                .stage(stage)
                .componentId(e.getComponentId() != null ? e.getComponentId() : ctx.getStackId())
                .kind(e.getKind())
                .message(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                .node(e.getNode())
                .build();
        return BuildError.builder()
                .diagnostic(diagnostic)
                .writtenFiles(ctx.getWrittenFiles())
                .completedGenerators(ctx.getCompletedGenerators())
                .build();
    }

    /**
     * @param generationCompleted whether every generator committed; artifacts are only
     *        reported in that case
     */
    private static BuildResult result(BuildContext ctx, long started, BuildError error, boolean generationCompleted) {
        BuildResult.BuildResultBuilder result = BuildResult.builder()
                .success(error == null)
                .stackId(ctx.getStackId())
                .finalStage(error == null ? BuildStage.DONE : BuildStage.FAILED)
                .writtenFiles(ctx.getWrittenFiles())
                .completedGenerators(ctx.getCompletedGenerators())
                .warnings(ctx.getWarnings())
                .deprecationNotices(ctx.getDeprecationNotices())
                .error(error)
                .durationMillis(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
        if (generationCompleted) {
            result.artifacts(ctx.getArtifacts().snapshot())
                    .displayedArtifacts(ctx.getArtifacts().displayed());
        }
        return result.build();
    }
}
