package com.appspec.generator.stacks.docs;

import com.appspec.generator.codegen.backend.Backend;
import com.appspec.generator.codegen.backend.Deprecation;
import com.appspec.generator.stacks.common.TargetVersionCheckHook;

/**
 * Markdown reference documentation rendered from FreeMarker templates.
 */
public final class DocsStack {

    public static final String ID = "docs";

    /** Former name of the stack, kept as a deprecated alias. */
    public static final String LEGACY_ID = "markdown";

    static final int MINIMUM_TARGET_VERSION = 2;

    private DocsStack() {
    }

    public static Backend create() {
        return Backend.builder()
                .id(ID)
                .description("Markdown reference documentation")
                .outputFormat("markdown")
                .hook(new TargetVersionCheckHook(MINIMUM_TARGET_VERSION))
                .generator(new IndexGenerator())
                .generator(new EntityPagesGenerator())
                .generator(new SurfacePagesGenerator())
                .generator(new WorkspacePagesGenerator())
                .hook(new DocsInstructionsHook())
                .build();
    }

    public static Backend createLegacyAlias() {
        return create().toBuilder()
                .id(LEGACY_ID)
                .description("Deprecated alias of '" + ID + "'")
                .deprecation(new Deprecation("0.3.0", "1.0.0", "use " + ID))
                .build();
    }
}
