package com.appspec.generator.codegen.execution;

import java.time.Duration;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.appspec.generator.codegen.artifact.ArtifactKey;
import com.appspec.generator.codegen.artifact.ArtifactValue;
import com.appspec.generator.codegen.backend.ExecutionPlan;
import com.appspec.generator.codegen.exception.BuildCancelledException;
import com.appspec.generator.codegen.exception.ConfigurationException;
import com.appspec.generator.codegen.exception.GenerationException;
import com.appspec.generator.codegen.exception.StackBuildException;
import com.appspec.generator.codegen.generator.Generator;
import com.appspec.generator.codegen.generator.GeneratorDescriptor;
import com.appspec.generator.codegen.generator.GeneratorOutput;
import com.appspec.generator.codegen.model.core.context.BuildContext;
import com.appspec.generator.codegen.model.core.context.BuildStage;
import com.appspec.generator.codegen.model.core.context.Diagnostic;
import com.appspec.generator.codegen.model.output.GeneratedFile;
import com.appspec.generator.codegen.model.output.WrittenFile;
import com.appspec.generator.codegen.util.OutputPatterns;

/**
 * Runs the generators of an execution plan and commits their output.
 *
 * Each generator goes through two steps. <em>Prepare</em> runs it, validates its output
 * against its descriptor and publishes its artifacts. <em>Commit</em> flushes its files and
 * records it as completed. Commits always happen in resolved order on the calling thread, so
 * a concurrent run writes the same files in the same order as a sequential one and stops at
 * the same generator when one fails.
 */
public class GeneratorPipeline {

    private static final Logger log = LoggerFactory.getLogger(GeneratorPipeline.class);

    private final UnitInvoker invoker;
    private final OutputWriter writer;

    public GeneratorPipeline(UnitInvoker invoker, OutputWriter writer) {
        this.invoker = invoker;
        this.writer = writer;
    }

    public void run(BuildContext ctx, ExecutionPlan plan) {
        if (ctx.getOptions().isParallel() && plan.getGenerators().size() > 1) {
            runConcurrently(ctx, plan);
        } else {
            runSequentially(ctx, plan);
        }
    }

    private void runSequentially(BuildContext ctx, ExecutionPlan plan) {
        Set<String> claimedPaths = new HashSet<>();
        for (Generator generator : plan.getGenerators()) {
            ctx.checkCancelled(generator.id());
            GeneratorOutput output = prepare(ctx, generator);
            commit(ctx, generator, output, claimedPaths);
        }
    }

    private void runConcurrently(BuildContext ctx, ExecutionPlan plan) {
        int threads = Math.min(ctx.getOptions().getParallelism(), plan.getGenerators().size());
        log.info("Running {} generator(s) with parallelism {}", plan.getGenerators().size(), threads);
        ExecutorService pool = Executors.newFixedThreadPool(threads, UnitInvoker.daemonThreads("generator"));
        AtomicBoolean aborted = new AtomicBoolean();
        try {
            Map<String, CompletableFuture<GeneratorOutput>> futures = new LinkedHashMap<>();
            for (Generator generator : plan.getGenerators()) {
                CompletableFuture<?>[] prerequisites = plan.dependenciesOf(generator.id()).stream()
                        .map(futures::get)
                        .toArray(CompletableFuture<?>[]::new);
                futures.put(generator.id(), CompletableFuture.allOf(prerequisites).thenApplyAsync(ignored -> {
                    if (aborted.get()) {
                        throw new BuildCancelledException(generator.id());
                    }
                    ctx.checkCancelled(generator.id());
                    return prepare(ctx, generator);
                }, pool));
            }

            Set<String> claimedPaths = new HashSet<>();
            for (Generator generator : plan.getGenerators()) {
                GeneratorOutput output = await(futures.get(generator.id()), generator);
                ctx.checkCancelled(generator.id());
                commit(ctx, generator, output, claimedPaths);
            }
        } catch (RuntimeException e) {
            aborted.set(true);
            throw e;
        } finally {
            pool.shutdownNow();
        }
    }

    private static GeneratorOutput await(CompletableFuture<GeneratorOutput> future, Generator generator) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof StackBuildException failure) {
                throw failure;
            }
            throw new GenerationException(generator.id(), null,
                    "Generator '" + generator.id() + "' failed: " + cause, cause);
        }
    }

    private GeneratorOutput prepare(BuildContext ctx, Generator generator) {
        GeneratorDescriptor descriptor = generator.descriptor();
        Duration timeout = descriptor.getTimeout() != null ? descriptor.getTimeout() : ctx.getOptions().getUnitTimeout();
        GeneratorOutput output;
        try {
            output = invoker.invoke(generator.id(), timeout,
                    () -> generator.run(ctx.generatorContext(generator.id(), descriptor.getRequires())),
                    t -> GenerationException.timedOut(generator.id(), t));
        } catch (StackBuildException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new GenerationException(generator.id(), null,
                    "Generator '" + generator.id() + "' failed: " + e.getMessage(), e);
        }
        if (output == null) {
            throw new GenerationException(generator.id(), null, "Generator '" + generator.id() + "' returned no output");
        }
        validateFiles(generator, output.getFiles());
        publishArtifacts(ctx, generator, output.getArtifacts());
        return output;
    }

    private void commit(BuildContext ctx, Generator generator, GeneratorOutput output, Set<String> claimedPaths) {
        for (GeneratedFile file : output.getFiles()) {
            if (!claimedPaths.add(file.getRelativePath())) {
                throw new ConfigurationException(generator.id(), "Generator '" + generator.id() + "' emitted '"
                        + file.getRelativePath() + "', already written by an earlier generator in this run");
            }
        }
        List<WrittenFile> written = writer.flush(ctx.getOutputRoot(), generator.id(), output.getFiles());
        for (String warning : output.getWarnings()) {
            ctx.addWarning(Diagnostic.warning(BuildStage.GENERATE, generator.id(), warning));
        }
        ctx.recordCompleted(generator.id(), written);
        log.info("Generator '{}' completed: {} file(s)", generator.id(), written.size());
    }

    private static void validateFiles(Generator generator, List<GeneratedFile> files) {
        Set<String> outputs = generator.descriptor().getOutputs();
        Set<String> seen = new HashSet<>();
        for (GeneratedFile file : files) {
            String path = file.getRelativePath();
            if (path.isBlank() || path.startsWith("/") || path.contains("\\") || path.matches("(.*/)?\\.\\.?(/.*)?")) {
                throw new ConfigurationException(generator.id(),
                        "Generator '" + generator.id() + "' emitted invalid relative path '" + path + "'");
            }
            if (outputs.stream().noneMatch(pattern -> OutputPatterns.matches(pattern, path))) {
                throw new ConfigurationException(generator.id(), "Generator '" + generator.id() + "' emitted '" + path
                        + "' outside its declared outputs " + outputs);
            }
            if (!seen.add(path)) {
                throw new ConfigurationException(generator.id(),
                        "Generator '" + generator.id() + "' emitted '" + path + "' twice");
            }
        }
    }

    private static void publishArtifacts(BuildContext ctx, Generator generator, List<ArtifactValue<?>> artifacts) {
        GeneratorDescriptor descriptor = generator.descriptor();
        Set<ArtifactKey<?>> declared = descriptor.writes();
        Set<ArtifactKey<?>> published = new HashSet<>();
        for (ArtifactValue<?> artifact : artifacts) {
            if (!declared.contains(artifact.key())) {
                throw new ConfigurationException(generator.id(), "Generator '" + generator.id()
                        + "' produced undeclared artifact '" + artifact.key() + "'");
            }
            put(ctx, artifact, generator.id(), descriptor.getOverrides().contains(artifact.key()));
            published.add(artifact.key());
        }
        for (ArtifactKey<?> key : descriptor.getProduces()) {
            if (!published.contains(key)) {
                throw new ConfigurationException(generator.id(),
                        "Generator '" + generator.id() + "' did not produce declared artifact '" + key + "'");
            }
        }
    }

    private static <T> void put(BuildContext ctx, ArtifactValue<T> artifact, String writerId, boolean override) {
        ctx.getArtifacts().put(artifact.key(), artifact.value(), writerId, override);
    }
}
