package com.appspec.generator.stacks.common;

import java.util.List;
import java.util.Locale;

import com.appspec.generator.codegen.hook.AbstractHook;
import com.appspec.generator.codegen.hook.HookDescriptor;
import com.appspec.generator.codegen.hook.HookOutput;
import com.appspec.generator.codegen.hook.HookPhase;
import com.appspec.generator.codegen.model.core.context.UnitContext;

/**
 * Pre-build check that a stack option, when given, holds one of the accepted values.
 */
public class OptionValueCheckHook extends AbstractHook {

    private final String option;
    private final List<String> accepted;

    public OptionValueCheckHook(String option, List<String> accepted) {
        super(HookDescriptor.builder()
                .id("check-" + option.replace('.', '-').replace('_', '-'))
                .phase(HookPhase.PRE_BUILD)
                .description("Require " + option + " to be one of " + String.join(", ", accepted))
                .build());
        this.option = option;
        this.accepted = List.copyOf(accepted);
    }

    @Override
    public HookOutput run(UnitContext context) {
        String value = context.getOptions().property(option).orElse(null);
        if (value == null) {
            return HookOutput.ok(option + " not set; using " + accepted.get(0));
        }
        if (!accepted.contains(value.toLowerCase(Locale.ROOT))) {
            return HookOutput.failed("Invalid " + option + ": '" + value + "'. Must be one of "
                    + String.join(", ", accepted));
        }
        return HookOutput.ok(option + " = " + value);
    }
}
