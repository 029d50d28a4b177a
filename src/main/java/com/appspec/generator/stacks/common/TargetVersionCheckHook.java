package com.appspec.generator.stacks.common;

import com.appspec.generator.codegen.hook.AbstractHook;
import com.appspec.generator.codegen.hook.HookDescriptor;
import com.appspec.generator.codegen.hook.HookOutput;
import com.appspec.generator.codegen.hook.HookPhase;
import com.appspec.generator.codegen.model.core.context.UnitContext;

/**
 * Pre-build check that the requested target format version is one the stack can emit.
 */
public class TargetVersionCheckHook extends AbstractHook {

    public static final String ID = "check-target-version";

    private final int minimumVersion;

    public TargetVersionCheckHook(int minimumVersion) {
        super(HookDescriptor.builder()
                .id(ID)
                .phase(HookPhase.PRE_BUILD)
                .description("Require target version " + minimumVersion + " or later")
                .build());
        this.minimumVersion = minimumVersion;
    }

    @Override
    public HookOutput run(UnitContext context) {
        int requested = context.getOptions().getTargetVersion();
        if (requested < minimumVersion) {
            return HookOutput.failed("Target version " + requested + " is not supported; "
                    + context.getStackId() + " requires " + minimumVersion + " or later");
        }
        return HookOutput.ok("Target version " + requested + " supported");
    }
}
