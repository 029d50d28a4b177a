package com.appspec.generator.stacks.docs;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.appspec.generator.codegen.generator.AbstractGenerator;
import com.appspec.generator.codegen.generator.GeneratorDescriptor;
import com.appspec.generator.codegen.generator.GeneratorOutput;
import com.appspec.generator.codegen.model.core.context.UnitContext;
import com.appspec.generator.codegen.util.NamingUtil;
import com.appspec.generator.ir.AppSpec;
import com.appspec.generator.ir.EntitySpec;
import com.appspec.generator.ir.FieldSpec;
import com.appspec.generator.ir.FieldTypeKind;
import com.appspec.generator.ir.IrNodeRef;
import com.appspec.generator.ir.ModuleSpec;

/**
 * One Markdown page per entity with its field table.
 */
public class EntityPagesGenerator extends AbstractGenerator {

    public static final String ID = "docs-entities";

    public EntityPagesGenerator() {
        super(GeneratorDescriptor.builder()
                .id(ID)
                .produce(DocsArtifacts.ENTITY_PAGES)
                .output("docs/entities/*.md")
                .build());
    }

    @Override
    public GeneratorOutput run(UnitContext context) {
        AppSpec ir = context.getIr();
        GeneratorOutput.GeneratorOutputBuilder output = GeneratorOutput.builder();
        List<DocPage> pages = new ArrayList<>();

        for (ModuleSpec module : ir.getModules()) {
            for (EntitySpec entity : module.getEntities()) {
                IrNodeRef node = IrNodeRef.entity(entity);
                String path = "entities/" + pageName(entity.getName());

                Map<String, Object> model = new HashMap<>();
                model.put("title", entity.displayTitle());
                model.put("module", module.getName());
                model.put("rows", entity.getFields().stream().map(f -> row(ir, entity, f)).toList());
                output.file("docs/" + path, render("docs/entity.md.ftl", model, node));
                pages.add(new DocPage(entity.displayTitle(), path));
            }
        }
        return output.artifact(DocsArtifacts.ENTITY_PAGES, List.copyOf(pages)).build();
    }

    static String pageName(String irName) {
        return NamingUtil.toKebabCase(irName) + ".md";
    }

    private Map<String, Object> row(AppSpec ir, EntitySpec entity, FieldSpec field) {
        List<String> notes = new ArrayList<>();
        if (field.isPrimaryKey()) {
            notes.add("primary key");
        }
        if (field.isUnique() && !field.isPrimaryKey()) {
            notes.add("unique");
        }
        if (field.getDefaultValue() != null) {
            notes.add("default `" + field.getDefaultValue() + "`");
        }
        if (field.getType().getKind() == FieldTypeKind.REF) {
            String target = field.getType().getRefEntity();
            if (target == null || ir.findEntity(target).isEmpty()) {
                throw fail(IrNodeRef.field(entity, field), "Reference to unknown entity '" + target + "'");
            }
            notes.add("see [" + target + "](" + pageName(target) + ")");
        }
        return Map.of(
                "name", field.getName(),
                "type", field.getType().describe(),
                "required", field.isRequired(),
                "notes", String.join(", ", notes));
    }
}
