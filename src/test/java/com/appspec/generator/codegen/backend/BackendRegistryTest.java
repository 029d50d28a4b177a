package com.appspec.generator.codegen.backend;

import static com.appspec.generator.testing.TestUnits.A;
import static com.appspec.generator.testing.TestUnits.chainGenerator;
import static com.appspec.generator.testing.TestUnits.fileGenerator;
import static com.appspec.generator.testing.TestUnits.hook;
import static org.assertj.core.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.appspec.generator.codegen.exception.ConfigurationException;
import com.appspec.generator.codegen.hook.HookDescriptor;
import com.appspec.generator.codegen.hook.HookOutput;
import com.appspec.generator.codegen.hook.HookPhase;

class BackendRegistryTest {

    @Test
    void testConflictingWritersFailAtRegistration() {
        BackendRegistry registry = new BackendRegistry();
        Backend conflicting = Backend.builder()
                .id("conflicting")
                .generator(chainGenerator("one", List.of(), List.of(A)))
                .generator(chainGenerator("two", List.of(), List.of(A)))
                .build();

        assertThatThrownBy(() -> registry.register(conflicting)).isInstanceOf(ConfigurationException.class);
        assertThat(registry.find("conflicting")).isEmpty();
    }

    @Test
    void testDuplicateStackIdIsRejected() {
        BackendRegistry registry = new BackendRegistry()
                .register(Backend.builder().id("web").generator(fileGenerator("g")).build());

        assertThatThrownBy(() -> registry.register(Backend.builder().id("web").build()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("already registered");
    }

    @Test
    void testFrozenRegistryRejectsRegistration() {
        BackendRegistry registry = new BackendRegistry().freeze();

        assertThat(registry.isFrozen()).isTrue();
        assertThatThrownBy(() -> registry.register(Backend.builder().id("late").build()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testUnknownStackNamesRegisteredOnes() {
        BackendRegistry registry = new BackendRegistry()
                .register(Backend.builder().id("web").build())
                .register(Backend.builder().id("api").build());

        assertThatThrownBy(() -> registry.require("mobile"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessage("Unknown stack 'mobile'. Registered stacks: web, api");
    }

    @Test
    void testListSummarizesResolvedOrderAndHooks() {
        Backend backend = Backend.builder()
                .id("web")
                .description("Web stack")
                .generator(chainGenerator("pages", List.of(A), List.of()))
                .generator(chainGenerator("model", List.of(), List.of(A)))
                .hook(hook(HookDescriptor.builder().id("notify").phase(HookPhase.POST_BUILD).build(),
                        ctx -> HookOutput.ok("ok")))
                .hook(hook(HookDescriptor.builder().id("check").phase(HookPhase.PRE_BUILD).build(),
                        ctx -> HookOutput.ok("ok")))
                .deprecation(new Deprecation("0.2.0", "1.0.0", "use web2"))
                .build();

        List<BackendSummary> summaries = new BackendRegistry().register(backend).list();

        assertThat(summaries).hasSize(1);
        BackendSummary summary = summaries.get(0);
        assertThat(summary.getId()).isEqualTo("web");
        assertThat(summary.getDescription()).isEqualTo("Web stack");
        assertThat(summary.isDeprecated()).isTrue();
        assertThat(summary.getGenerators()).containsExactly("model", "pages");
        assertThat(summary.getHooks()).containsExactly("check", "notify");
    }
}
