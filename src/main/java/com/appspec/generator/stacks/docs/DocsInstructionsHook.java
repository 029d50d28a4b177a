package com.appspec.generator.stacks.docs;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.appspec.generator.codegen.hook.AbstractHook;
import com.appspec.generator.codegen.hook.HookDescriptor;
import com.appspec.generator.codegen.hook.HookOutput;
import com.appspec.generator.codegen.hook.HookPhase;
import com.appspec.generator.codegen.model.core.context.UnitContext;

public class DocsInstructionsHook extends AbstractHook {

    private static final Logger log = LoggerFactory.getLogger(DocsInstructionsHook.class);

    public static final String ID = "docs-instructions";

    public DocsInstructionsHook() {
        super(HookDescriptor.builder()
                .id(ID)
                .phase(HookPhase.POST_BUILD)
                .description("Print next steps")
                .require(DocsArtifacts.ENTITY_PAGES)
                .build());
    }

    @Override
    public HookOutput run(UnitContext context) {
        List<DocPage> entities = context.artifact(DocsArtifacts.ENTITY_PAGES);
        log.info("=================================================");
        log.info("NEXT STEPS");
        log.info("=================================================");
        log.info("1. Open the index:");
        log.info("   {}", context.getOutputRoot().resolve("docs/index.md"));
        log.info("2. Publish with any Markdown site generator, e.g. mkdocs or docsify");
        log.info("=================================================");
        return HookOutput.ok(entities.size() + " entity page(s) documented");
    }
}
