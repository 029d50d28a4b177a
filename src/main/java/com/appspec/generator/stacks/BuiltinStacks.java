package com.appspec.generator.stacks;

import com.appspec.generator.codegen.backend.BackendRegistry;
import com.appspec.generator.stacks.docs.DocsStack;
import com.appspec.generator.stacks.openapi.OpenApiStack;

/**
 * The stacks shipped with the generator.
 */
public final class BuiltinStacks {

    private BuiltinStacks() {
    }

    /**
     * Process-wide registry of the built-in stacks, built and frozen on first use.
     */
    public static BackendRegistry registry() {
        return Holder.REGISTRY;
    }

    public static BackendRegistry registerAll(BackendRegistry registry) {
        registry.register(OpenApiStack.create());
        registry.register(DocsStack.create());
        registry.register(DocsStack.createLegacyAlias());
        return registry;
    }

    private static final class Holder {
        static final BackendRegistry REGISTRY = registerAll(new BackendRegistry()).freeze();
    }
}
