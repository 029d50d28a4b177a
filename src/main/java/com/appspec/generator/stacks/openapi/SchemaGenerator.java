package com.appspec.generator.stacks.openapi;

import java.util.LinkedHashMap;
import java.util.Map;

import com.appspec.generator.codegen.generator.AbstractGenerator;
import com.appspec.generator.codegen.generator.GeneratorDescriptor;
import com.appspec.generator.codegen.generator.GeneratorOutput;
import com.appspec.generator.codegen.model.core.context.UnitContext;
import com.appspec.generator.ir.AppSpec;
import com.appspec.generator.ir.EntitySpec;
import com.appspec.generator.ir.FieldSpec;
import com.appspec.generator.ir.FieldType;
import com.appspec.generator.ir.IrNodeRef;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Writes one OpenAPI schema component per entity under {@code openapi/schemas/}, in the
 * format selected by {@link OpenApiFormat}.
 */
public class SchemaGenerator extends AbstractGenerator {

    public static final String ID = "openapi-schemas";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    public SchemaGenerator() {
        super(GeneratorDescriptor.builder()
                .id(ID)
                .produce(OpenApiArtifacts.SCHEMA_REFS)
                .output("openapi/schemas/*")
                .build());
    }

    @Override
    public GeneratorOutput run(UnitContext context) {
        AppSpec ir = context.getIr();
        OpenApiFormat format = OpenApiFormat.of(context.getOptions());
        GeneratorOutput.GeneratorOutputBuilder output = GeneratorOutput.builder();
        Map<String, String> refs = new LinkedHashMap<>();

        for (EntitySpec entity : ir.allEntities()) {
            if (entity.getFields().isEmpty()) {
                throw fail(IrNodeRef.entity(entity), "Entity '" + entity.getName() + "' has no fields to map to a schema");
            }
            String fileName = entity.getName() + "." + format.extension();
            try {
                output.file("openapi/schemas/" + fileName, format.write(schemaFor(ir, entity)));
            } catch (JsonProcessingException e) {
                throw fail(IrNodeRef.entity(entity), "Cannot serialize schema: " + e.getOriginalMessage(), e);
            }
            refs.put(entity.getName(), "./schemas/" + fileName);
        }
        if (refs.isEmpty()) {
            output.warning("Application '" + ir.getName() + "' declares no entities; no schemas written");
        }
        return output.artifact(OpenApiArtifacts.SCHEMA_REFS, Map.copyOf(refs)).build();
    }

    private ObjectNode schemaFor(AppSpec ir, EntitySpec entity) {
        ObjectNode schema = NODES.objectNode();
        schema.put("title", entity.displayTitle());
        schema.put("type", "object");
        ArrayNode required = NODES.arrayNode();
        entity.getFields().stream()
                .filter(FieldSpec::isRequired)
                .map(FieldSpec::getName)
                .forEach(required::add);
        if (!required.isEmpty()) {
            schema.set("required", required);
        }
        ObjectNode properties = schema.putObject("properties");
        for (FieldSpec field : entity.getFields()) {
            ObjectNode property = properties.putObject(field.getName());
            describeType(property, ir, entity, field);
            if (field.isPrimaryKey()) {
                property.put("readOnly", true);
            }
            if (field.getDefaultValue() != null) {
                property.put("default", field.getDefaultValue());
            }
        }
        return schema;
    }

    private void describeType(ObjectNode property, AppSpec ir, EntitySpec entity, FieldSpec field) {
        FieldType type = field.getType();
        switch (type.getKind()) {
            case STR -> {
                property.put("type", "string");
                if (type.getMaxLength() != null) {
                    property.put("maxLength", type.getMaxLength());
                }
            }
            case TEXT -> property.put("type", "string");
            case INT -> property.put("type", "integer").put("format", "int64");
            case DECIMAL -> property.put("type", "number");
            case BOOL -> property.put("type", "boolean");
            case DATE -> property.put("type", "string").put("format", "date");
            case DATETIME -> property.put("type", "string").put("format", "date-time");
            case UUID -> property.put("type", "string").put("format", "uuid");
            case EMAIL -> property.put("type", "string").put("format", "email");
            case ENUM -> {
                if (type.getEnumValues().isEmpty()) {
                    throw fail(IrNodeRef.field(entity, field), "Enum field declares no values");
                }
                property.put("type", "string");
                type.getEnumValues().forEach(property.putArray("enum")::add);
            }
            case REF -> {
                if (type.getRefEntity() == null || ir.findEntity(type.getRefEntity()).isEmpty()) {
                    throw fail(IrNodeRef.field(entity, field),
                            "Reference to unknown entity '" + type.getRefEntity() + "'");
                }
                property.put("type", "string").put("format", "uuid");
                property.put("description", "Identifier of a " + type.getRefEntity());
            }
        }
    }
}
