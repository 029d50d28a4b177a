package com.appspec.generator.stacks.docs;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.appspec.generator.codegen.generator.AbstractGenerator;
import com.appspec.generator.codegen.generator.GeneratorDescriptor;
import com.appspec.generator.codegen.generator.GeneratorOutput;
import com.appspec.generator.codegen.model.core.context.UnitContext;
import com.appspec.generator.ir.IrNodeRef;
import com.appspec.generator.ir.SurfaceElement;
import com.appspec.generator.ir.SurfaceSection;
import com.appspec.generator.ir.SurfaceSpec;

public class SurfacePagesGenerator extends AbstractGenerator {

    public static final String ID = "docs-surfaces";

    public SurfacePagesGenerator() {
        super(GeneratorDescriptor.builder()
                .id(ID)
                .produce(DocsArtifacts.SURFACE_PAGES)
                .output("docs/surfaces/*.md")
                .build());
    }

    @Override
    public GeneratorOutput run(UnitContext context) {
        GeneratorOutput.GeneratorOutputBuilder output = GeneratorOutput.builder();
        List<DocPage> pages = new ArrayList<>();

        for (SurfaceSpec surface : context.getIr().allSurfaces()) {
            String path = "surfaces/" + EntityPagesGenerator.pageName(surface.getName());

            Map<String, Object> model = new HashMap<>();
            model.put("title", surface.displayTitle());
            model.put("mode", surface.getMode().name().toLowerCase(Locale.ROOT));
            model.put("entity", surface.getEntityRef() == null ? "" : surface.getEntityRef());
            model.put("entityPage", surface.getEntityRef() == null
                    ? "" : "../entities/" + EntityPagesGenerator.pageName(surface.getEntityRef()));
            model.put("sections", surface.getSections().stream().map(this::section).toList());
            output.file("docs/" + path, render("docs/surface.md.ftl", model, IrNodeRef.surface(surface)));
            pages.add(new DocPage(surface.displayTitle(), path));
        }
        return output.artifact(DocsArtifacts.SURFACE_PAGES, List.copyOf(pages)).build();
    }

    private Map<String, Object> section(SurfaceSection section) {
        String title = section.getTitle() != null ? section.getTitle() : section.getName();
        List<Map<String, Object>> elements = new ArrayList<>();
        for (SurfaceElement element : section.getElements()) {
            elements.add(Map.of("field", element.getFieldName(), "label", element.displayLabel()));
        }
        return Map.of("title", title, "elements", elements);
    }
}
