package com.appspec.generator.codegen.hook;

import com.appspec.generator.codegen.model.core.context.UnitContext;

/**
 * A pipeline unit with side effects outside the generated file tree, bound to one phase.
 */
public interface Hook {

    HookDescriptor descriptor();

    /**
     * Runs the hook. Failure is reported either by throwing or by returning an unsuccessful
     * {@link HookOutput}; the orchestrator treats both the same way.
     */
    HookOutput run(UnitContext context);

    default String id() {
        return descriptor().getId();
    }

    default HookPhase phase() {
        return descriptor().getPhase();
    }
}
