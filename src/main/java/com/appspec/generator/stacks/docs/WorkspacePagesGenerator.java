package com.appspec.generator.stacks.docs;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.appspec.generator.codegen.generator.AbstractGenerator;
import com.appspec.generator.codegen.generator.GeneratorDescriptor;
import com.appspec.generator.codegen.generator.GeneratorOutput;
import com.appspec.generator.codegen.model.core.context.UnitContext;
import com.appspec.generator.ir.IrNodeRef;
import com.appspec.generator.ir.WorkspaceRegion;
import com.appspec.generator.ir.WorkspaceSpec;

public class WorkspacePagesGenerator extends AbstractGenerator {

    public static final String ID = "docs-workspaces";

    public WorkspacePagesGenerator() {
        super(GeneratorDescriptor.builder()
                .id(ID)
                .produce(DocsArtifacts.WORKSPACE_PAGES)
                .output("docs/workspaces/*.md")
                .build());
    }

    @Override
    public GeneratorOutput run(UnitContext context) {
        GeneratorOutput.GeneratorOutputBuilder output = GeneratorOutput.builder();
        List<DocPage> pages = new ArrayList<>();

        for (WorkspaceSpec workspace : context.getIr().allWorkspaces()) {
            String path = "workspaces/" + EntityPagesGenerator.pageName(workspace.getName());
            if (workspace.getRegions().isEmpty()) {
                output.warning("Workspace '" + workspace.getName() + "' has no regions");
            }

            Map<String, Object> model = new HashMap<>();
            model.put("title", workspace.displayTitle());
            model.put("purpose", workspace.getPurpose() == null ? "" : workspace.getPurpose());
            model.put("regions", workspace.getRegions().stream().map(this::region).toList());
            output.file("docs/" + path, render("docs/workspace.md.ftl", model, IrNodeRef.workspace(workspace)));
            pages.add(new DocPage(workspace.displayTitle(), path));
        }
        return output.artifact(DocsArtifacts.WORKSPACE_PAGES, List.copyOf(pages)).build();
    }

    private Map<String, Object> region(WorkspaceRegion region) {
        return Map.of(
                "name", region.getName(),
                "source", region.getSource(),
                "display", region.getDisplay() == null ? "list" : region.getDisplay(),
                "limit", region.getLimit() == null ? "" : String.valueOf(region.getLimit()));
    }
}
