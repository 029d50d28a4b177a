package com.appspec.generator.stacks;

import static org.assertj.core.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.appspec.generator.codegen.backend.Backend;
import com.appspec.generator.codegen.backend.BackendRegistry;
import com.appspec.generator.codegen.backend.BackendSummary;

class BuiltinStacksTest {

    @Test
    void testSharedRegistryIsFrozenAndComplete() {
        BackendRegistry registry = BuiltinStacks.registry();

        assertThat(registry.isFrozen()).isTrue();
        assertThat(registry).isSameAs(BuiltinStacks.registry());
        assertThat(registry.list()).extracting(BackendSummary::getId).containsExactly("openapi", "docs", "markdown");
        assertThatThrownBy(() -> registry.register(Backend.builder().id("extra").build()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testSummariesExposeResolvedOrder() {
        BackendSummary docs = BuiltinStacks.registerAll(new BackendRegistry()).list().get(1);

        assertThat(docs.isDeprecated()).isFalse();
        assertThat(docs.getGenerators()).containsExactly("docs-entities", "docs-surfaces", "docs-workspaces", "docs-index");
        assertThat(docs.getHooks()).containsExactly("check-target-version", "docs-instructions");
    }

    @Test
    void testSummariesExposeOutputFormats() {
        List<BackendSummary> summaries = BuiltinStacks.registerAll(new BackendRegistry()).list();
        BackendSummary openapi = summaries.get(0);

        assertThat(openapi.getOutputFormats()).containsExactly("yaml", "json");
        assertThat(openapi.getHooks()).startsWith("check-openapi-format");
        assertThat(summaries.get(1).getOutputFormats()).containsExactly("markdown");
        assertThat(summaries).noneMatch(BackendSummary::isIncremental);
    }
}
