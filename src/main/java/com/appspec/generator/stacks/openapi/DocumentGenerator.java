package com.appspec.generator.stacks.openapi;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.appspec.generator.codegen.generator.AbstractGenerator;
import com.appspec.generator.codegen.generator.GeneratorDescriptor;
import com.appspec.generator.codegen.generator.GeneratorOutput;
import com.appspec.generator.codegen.model.core.context.UnitContext;
import com.appspec.generator.codegen.util.NamingUtil;
import com.appspec.generator.ir.AppSpec;
import com.appspec.generator.ir.IrNodeRef;
import com.appspec.generator.ir.SurfaceSpec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Writes {@code openapi/openapi.yaml} (or {@code .json}): one operation per entity-bound
 * surface, schemas referenced from the files written by {@link SchemaGenerator}.
 *
 * Surface modes map to operations as follows: list to {@code GET /things}, view to
 * {@code GET /things/{id}}, create to {@code POST /things}, edit to {@code PUT /things/{id}}.
 * Custom surfaces have no REST counterpart and are skipped with a warning.
 */
public class DocumentGenerator extends AbstractGenerator {

    public static final String ID = "openapi-document";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    public DocumentGenerator() {
        super(GeneratorDescriptor.builder()
                .id(ID)
                .require(OpenApiArtifacts.SCHEMA_REFS)
                .produce(OpenApiArtifacts.OPERATION_IDS)
                .output("openapi/openapi.*")
                .build());
    }

    /**
     * Path of the document for the given format, relative to the output root.
     */
    public static String documentPath(OpenApiFormat format) {
        return "openapi/openapi." + format.extension();
    }

    @Override
    public GeneratorOutput run(UnitContext context) {
        AppSpec ir = context.getIr();
        OpenApiFormat format = OpenApiFormat.of(context.getOptions());
        Map<String, String> schemaRefs = context.artifact(OpenApiArtifacts.SCHEMA_REFS);
        GeneratorOutput.GeneratorOutputBuilder output = GeneratorOutput.builder();

        Map<String, List<Operation>> paths = new LinkedHashMap<>();
        Set<String> operationIds = new LinkedHashSet<>();
        for (SurfaceSpec surface : ir.allSurfaces()) {
            if (surface.getEntityRef() == null) {
                continue;
            }
            if (!schemaRefs.containsKey(surface.getEntityRef())) {
                throw fail(IrNodeRef.surface(surface),
                        "Surface is bound to entity '" + surface.getEntityRef() + "' which has no schema");
            }
            Operation operation = operationFor(surface);
            if (operation == null) {
                output.warning("Surface '" + surface.getName() + "' has mode " + surface.getMode()
                        + " and no REST operation; skipped");
                continue;
            }
            if (!operationIds.add(operation.operationId())) {
                output.warning("Surface '" + surface.getName() + "' duplicates operation '"
                        + operation.operationId() + "'; skipped");
                continue;
            }
            paths.computeIfAbsent(operation.path(), p -> new ArrayList<>()).add(operation);
        }

        ObjectNode document = document(ir, schemaRefs, paths, context.getOptions().getTargetVersion());
        try {
            output.file(documentPath(format), format.write(document));
        } catch (JsonProcessingException e) {
            throw fail(null, "Cannot serialize document: " + e.getOriginalMessage(), e);
        }
        return output.artifact(OpenApiArtifacts.OPERATION_IDS, List.copyOf(operationIds)).build();
    }

    private Operation operationFor(SurfaceSpec surface) {
        String entity = surface.getEntityRef();
        String plural = NamingUtil.pluralize(entity);
        String collection = "/" + NamingUtil.toKebabCase(plural);
        String item = collection + "/{id}";
        return switch (surface.getMode()) {
            case LIST -> new Operation(collection, "get", operationId("list", plural), entity, surface, true);
            case VIEW -> new Operation(item, "get", operationId("get", entity), entity, surface, false);
            case CREATE -> new Operation(collection, "post", operationId("create", entity), entity, surface, false);
            case EDIT -> new Operation(item, "put", operationId("update", entity), entity, surface, false);
            case CUSTOM -> null;
        };
    }

    private static String operationId(String verb, String name) {
        return NamingUtil.toCamelCase(verb + "_" + name);
    }

    private ObjectNode document(AppSpec ir, Map<String, String> schemaRefs, Map<String, List<Operation>> paths,
            int targetVersion) {
        ObjectNode document = NODES.objectNode();
        document.put("openapi", targetVersion >= 3 ? "3.0.3" : "3.0.0");
        document.putObject("info")
                .put("title", ir.displayTitle())
                .put("version", ir.getVersion());

        ObjectNode pathsNode = document.putObject("paths");
        paths.forEach((path, operations) -> {
            ObjectNode pathItem = pathsNode.putObject(path);
            operations.forEach(op -> pathItem.set(op.method(), operation(op)));
        });

        ObjectNode components = document.putObject("components");
        ObjectNode schemas = components.putObject("schemas");
        schemaRefs.keySet().stream().sorted()
                .forEach(entity -> schemas.putObject(entity).put("$ref", schemaRefs.get(entity)));
        boolean apiKeyAuth = ir.allServices().stream().anyMatch(s -> "api_key".equals(s.getAuthKind()));
        if (apiKeyAuth) {
            components.putObject("securitySchemes").putObject("ApiKeyAuth")
                    .put("type", "apiKey")
                    .put("in", "header")
                    .put("name", "X-API-Key");
        }
        return document;
    }

    private ObjectNode operation(Operation op) {
        String schemaRef = "#/components/schemas/" + op.entity();
        ObjectNode operation = NODES.objectNode();
        operation.put("operationId", op.operationId());
        operation.put("summary", op.surface().displayTitle());
        operation.putArray("tags").add(op.entity());
        if (op.path().endsWith("{id}")) {
            operation.putArray("parameters").addObject()
                    .put("name", "id")
                    .put("in", "path")
                    .put("required", true)
                    .putObject("schema")
                    .put("type", "string")
                    .put("format", "uuid");
        }
        if (op.method().equals("post") || op.method().equals("put")) {
            ObjectNode requestBody = operation.putObject("requestBody").put("required", true);
            jsonContent(requestBody).put("$ref", schemaRef);
        }
        ObjectNode response = operation.putObject("responses")
                .putObject(op.method().equals("post") ? "201" : "200")
                .put("description", "Successful response");
        ObjectNode schema = jsonContent(response);
        if (op.collection()) {
            schema.put("type", "array").putObject("items").put("$ref", schemaRef);
        } else {
            schema.put("$ref", schemaRef);
        }
        return operation;
    }

    private static ObjectNode jsonContent(ObjectNode parent) {
        return parent.putObject("content").putObject("application/json").putObject("schema");
    }

    private record Operation(String path, String method, String operationId, String entity, SurfaceSpec surface,
            boolean collection) {
    }
}
