package com.appspec.generator.stacks.docs;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.appspec.generator.codegen.generator.AbstractGenerator;
import com.appspec.generator.codegen.generator.GeneratorDescriptor;
import com.appspec.generator.codegen.generator.GeneratorOutput;
import com.appspec.generator.codegen.model.core.context.UnitContext;
import com.appspec.generator.ir.AppSpec;

/**
 * Writes {@code docs/index.md} linking every page written by the other documentation generators.
 */
public class IndexGenerator extends AbstractGenerator {

    public static final String ID = "docs-index";

    public IndexGenerator() {
        super(GeneratorDescriptor.builder()
                .id(ID)
                .require(DocsArtifacts.ENTITY_PAGES)
                .require(DocsArtifacts.SURFACE_PAGES)
                .require(DocsArtifacts.WORKSPACE_PAGES)
                .output("docs/index.md")
                .build());
    }

    @Override
    public GeneratorOutput run(UnitContext context) {
        AppSpec ir = context.getIr();
        Map<String, Object> model = new HashMap<>();
        model.put("title", ir.displayTitle());
        model.put("version", ir.getVersion());
        model.put("entities", pages(context.artifact(DocsArtifacts.ENTITY_PAGES)));
        model.put("surfaces", pages(context.artifact(DocsArtifacts.SURFACE_PAGES)));
        model.put("workspaces", pages(context.artifact(DocsArtifacts.WORKSPACE_PAGES)));

        return GeneratorOutput.builder()
                .file("docs/index.md", render("docs/index.md.ftl", model, null))
                .build();
    }

    private static List<Map<String, Object>> pages(List<DocPage> pages) {
        return pages.stream().map(DocPage::toModel).toList();
    }
}
