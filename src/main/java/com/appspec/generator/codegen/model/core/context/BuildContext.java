package com.appspec.generator.codegen.model.core.context;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.appspec.generator.codegen.artifact.ArtifactKey;
import com.appspec.generator.codegen.artifact.ArtifactRegistry;
import com.appspec.generator.codegen.artifact.ArtifactView;
import com.appspec.generator.codegen.model.output.WrittenFile;
import com.appspec.generator.ir.AppSpec;

import lombok.Getter;
import lombok.NonNull;

/**
 * Mutable state of one build run. Created fresh for every invocation and discarded at the
 * end; nothing in it outlives the run.
 */
@Getter
public final class BuildContext {

    private static final Logger log = LoggerFactory.getLogger(BuildContext.class);

    private final String stackId;
    private final Path outputRoot;
    private final AppSpec ir;
    private final BuildOptions options;
    private final ArtifactRegistry artifacts = new ArtifactRegistry();

    private final List<WrittenFile> writtenFiles = new CopyOnWriteArrayList<>();
    private final List<String> completedGenerators = new CopyOnWriteArrayList<>();
    private final List<Diagnostic> warnings = new CopyOnWriteArrayList<>();
    private final List<DeprecationNotice> deprecationNotices = new ArrayList<>();

    private volatile BuildStage stage = BuildStage.INIT;

    public BuildContext(@NonNull String stackId, @NonNull Path outputRoot, @NonNull AppSpec ir,
            @NonNull BuildOptions options) {
        this.stackId = stackId;
        this.outputRoot = outputRoot;
        this.ir = ir;
        this.options = options;
    }

    public void transition(BuildStage next) {
        log.info("[{}] {} -> {}", stackId, stage, next);
        this.stage = next;
    }

    /**
     * Context of a generator. Generators do not see the files flushed so far, which keeps
     * their output independent of scheduling.
     */
    public UnitContext generatorContext(String generatorId, Set<ArtifactKey<?>> requires) {
        return unitContext(generatorId, requires).build();
    }

    public UnitContext hookContext(String hookId, Set<ArtifactKey<?>> requires) {
        return unitContext(hookId, requires).writtenFiles(writtenFiles).build();
    }

    private UnitContext.UnitContextBuilder unitContext(String componentId, Set<ArtifactKey<?>> requires) {
        return UnitContext.builder()
                .componentId(componentId)
                .stackId(stackId)
                .ir(ir)
                .options(options)
                .artifacts(new ArtifactView(artifacts, componentId, requires))
                .outputRoot(outputRoot);
    }

    public void checkCancelled(String nextComponentId) {
        options.getCancellationToken().throwIfCancelled(nextComponentId);
    }

    public void recordCompleted(String generatorId, List<WrittenFile> files) {
        writtenFiles.addAll(files);
        completedGenerators.add(generatorId);
    }

    public void addWarning(Diagnostic warning) {
        log.warn("{}", warning);
        warnings.add(warning);
    }

    public void addDeprecationNotice(DeprecationNotice notice) {
        deprecationNotices.add(notice);
    }

    public List<WrittenFile> getWrittenFiles() {
        return Collections.unmodifiableList(writtenFiles);
    }

    public List<String> getCompletedGenerators() {
        return Collections.unmodifiableList(completedGenerators);
    }
}
