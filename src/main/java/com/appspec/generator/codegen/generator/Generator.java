package com.appspec.generator.codegen.generator;

import com.appspec.generator.codegen.model.core.context.UnitContext;

/**
 * A pipeline unit producing a bounded slice of the output tree.
 *
 * {@link #run(UnitContext)} must be a pure function of the IR, the values of the declared
 * requirements and the run options. It returns files and artifacts instead of writing them;
 * the orchestrator flushes the files only when the generator succeeded.
 */
public interface Generator {

    GeneratorDescriptor descriptor();

    /**
     * @throws com.appspec.generator.codegen.exception.GenerationException when the IR cannot be
     *         rendered by this generator
     */
    GeneratorOutput run(UnitContext context);

    default String id() {
        return descriptor().getId();
    }
}
