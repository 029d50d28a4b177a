package com.appspec.generator.stacks.openapi;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.appspec.generator.codegen.BuildError;
import com.appspec.generator.codegen.BuildOrchestrator;
import com.appspec.generator.codegen.BuildResult;
import com.appspec.generator.codegen.artifact.ArtifactRegistry;
import com.appspec.generator.codegen.artifact.ArtifactView;
import com.appspec.generator.codegen.backend.BackendRegistry;
import com.appspec.generator.codegen.exception.GenerationException;
import com.appspec.generator.codegen.model.core.context.BuildOptions;
import com.appspec.generator.codegen.model.core.context.BuildStage;
import com.appspec.generator.codegen.model.core.context.UnitContext;
import com.appspec.generator.codegen.model.output.WrittenFile;
import com.appspec.generator.ir.IrNodeRef;
import com.appspec.generator.stacks.BuiltinStacks;
import com.appspec.generator.testing.SampleIr;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

class OpenApiStackTest {

    @TempDir
    Path tempDir;

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper JSON = new ObjectMapper();

    private BuildOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        orchestrator = new BuildOrchestrator(BuiltinStacks.registerAll(new BackendRegistry()));
    }

    @Test
    void testBuildWritesSchemasThenDocument() throws IOException {
        BuildResult result = orchestrator.build(OpenApiStack.ID, SampleIr.taskTracker(), tempDir,
                BuildOptions.defaults());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getCompletedGenerators()).containsExactly(SchemaGenerator.ID, DocumentGenerator.ID);
        assertThat(result.getWrittenFiles()).extracting(WrittenFile::getRelativePath)
                .containsExactly("openapi/schemas/User.yaml", "openapi/schemas/Task.yaml", "openapi/openapi.yaml");

        JsonNode task = readYaml("openapi/schemas/Task.yaml");
        assertThat(task.path("title").asText()).isEqualTo("Task");
        assertThat(texts(task.path("required"))).containsExactly("title");
        JsonNode properties = task.path("properties");
        assertThat(properties.path("title").path("maxLength").asInt()).isEqualTo(200);
        assertThat(texts(properties.path("status").path("enum")))
                .containsExactly("todo", "in_progress", "done");
        assertThat(properties.path("status").path("default").asText()).isEqualTo("todo");
        assertThat(properties.path("created_at").path("format").asText()).isEqualTo("date-time");
        assertThat(properties.path("assignee").path("description").asText()).isEqualTo("Identifier of a User");
        assertThat(properties.path("id").path("readOnly").asBoolean()).isTrue();

        JsonNode document = readYaml("openapi/openapi.yaml");
        assertThat(document.path("openapi").asText()).isEqualTo("3.0.3");
        assertThat(document.path("info").path("title").asText()).isEqualTo("Task Tracker");
        assertThat(document.path("info").path("version").asText()).isEqualTo("1.2.0");
        assertThat(fieldNames(document.path("paths"))).containsExactly("/tasks", "/tasks/{id}");
        assertThat(document.at("/paths/~1tasks/get/operationId").asText()).isEqualTo("listTasks");
        assertThat(document.at("/paths/~1tasks/post/operationId").asText()).isEqualTo("createTask");
        assertThat(document.at("/paths/~1tasks~1{id}/get/operationId").asText()).isEqualTo("getTask");
        assertThat(document.at("/components/schemas/Task/$ref").asText()).isEqualTo("./schemas/Task.yaml");
        assertThat(document.at("/components/securitySchemes/ApiKeyAuth/in").asText()).isEqualTo("header");
    }

    @Test
    void testJsonFormatWritesJsonFiles() throws IOException {
        BuildResult result = orchestrator.build(OpenApiStack.ID, SampleIr.taskTracker(), tempDir,
                BuildOptions.builder().property(OpenApiFormat.OPTION, "JSON").build());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getWrittenFiles()).extracting(WrittenFile::getRelativePath)
                .containsExactly("openapi/schemas/User.json", "openapi/schemas/Task.json", "openapi/openapi.json");
        assertThat(tempDir.resolve("openapi/openapi.yaml")).doesNotExist();

        JsonNode document = JSON.readTree(Files.readString(tempDir.resolve("openapi/openapi.json")));
        assertThat(document.at("/components/schemas/User/$ref").asText()).isEqualTo("./schemas/User.json");
        assertThat(document.at("/paths/~1tasks/get/operationId").asText()).isEqualTo("listTasks");
        JsonNode user = JSON.readTree(Files.readString(tempDir.resolve("openapi/schemas/User.json")));
        assertThat(user.path("title").asText()).isEqualTo("Team Member");
    }

    @Test
    void testUnknownFormatFailsBeforeGeneration() {
        BuildResult result = orchestrator.build(OpenApiStack.ID, SampleIr.taskTracker(), tempDir,
                BuildOptions.builder().property(OpenApiFormat.OPTION, "xml").build());

        BuildError error = result.getError().orElseThrow();
        assertThat(error.getStage()).isEqualTo(BuildStage.PRE_BUILD);
        assertThat(error.getComponentId()).isEqualTo("check-openapi-format");
        assertThat(error.getMessage()).contains("'xml'").contains("yaml, json");
        assertThat(result.getCompletedGenerators()).isEmpty();
        assertThat(tempDir.resolve("openapi")).doesNotExist();
    }

    @Test
    void testArtifactsAndWarnings() {
        BuildResult result = orchestrator.build(OpenApiStack.ID, SampleIr.taskTracker(), tempDir,
                BuildOptions.builder().property("openapi.api_key_prefix", "test_").build());

        assertThat(result.getArtifacts().get("openapi.operation_ids"))
                .asInstanceOf(InstanceOfAssertFactories.LIST)
                .containsExactly("listTasks", "createTask", "getTask");
        assertThat(result.getDisplayedArtifacts()).containsOnlyKeys("openapi.api_key");
        assertThat((String) result.getDisplayedArtifacts().get("openapi.api_key")).startsWith("test_").hasSize(37);
        assertThat(result.getWarnings()).singleElement().satisfies(w -> {
            assertThat(w.getComponentId()).isEqualTo(DocumentGenerator.ID);
            assertThat(w.getMessage()).contains("task_board");
        });
    }

    @Test
    void testDanglingReferenceIsAttributedToField() {
        BuildResult result = orchestrator.build(OpenApiStack.ID, SampleIr.withDanglingReference(), tempDir,
                BuildOptions.defaults());

        BuildError error = result.getError().orElseThrow();
        assertThat(error.getStage()).isEqualTo(BuildStage.GENERATE);
        assertThat(error.getComponentId()).isEqualTo(SchemaGenerator.ID);
        assertThat(error.getNode()).isEqualTo(new IrNodeRef("field", "Invalid.owner"));
        assertThat(error.getWrittenFiles()).isEmpty();
        assertThat(tempDir.resolve("openapi")).doesNotExist();
    }

    @Test
    void testEmptySpecificationStillProducesDocument() throws IOException {
        BuildResult result = orchestrator.build(OpenApiStack.ID, SampleIr.empty(), tempDir,
                BuildOptions.builder().targetVersion(2).build());

        assertThat(result.isSuccess()).isTrue();
        JsonNode document = readYaml("openapi/openapi.yaml");
        assertThat(document.path("openapi").asText()).isEqualTo("3.0.0");
        assertThat(document.path("paths").isObject()).isTrue();
        assertThat(document.path("paths").isEmpty()).isTrue();
        assertThat(document.at("/components/securitySchemes").isMissingNode()).isTrue();
        assertThat(result.getWarnings()).extracting(w -> w.getComponentId()).contains(SchemaGenerator.ID);
    }

    @Test
    void testDocumentGeneratorRejectsSurfaceWithoutSchema() {
        ArtifactRegistry artifacts = new ArtifactRegistry();
        artifacts.put(OpenApiArtifacts.SCHEMA_REFS, Map.of("User", "./schemas/User.yaml"), SchemaGenerator.ID);
        UnitContext context = UnitContext.builder()
                .componentId(DocumentGenerator.ID)
                .stackId(OpenApiStack.ID)
                .ir(SampleIr.taskTracker())
                .options(BuildOptions.defaults())
                .artifacts(new ArtifactView(artifacts, DocumentGenerator.ID, Set.of(OpenApiArtifacts.SCHEMA_REFS)))
                .outputRoot(tempDir)
                .build();

        assertThatThrownBy(() -> new DocumentGenerator().run(context))
                .isInstanceOfSatisfying(GenerationException.class, e -> {
                    assertThat(e.getGeneratorId()).isEqualTo(DocumentGenerator.ID);
                    assertThat(e.getNode()).isEqualTo(new IrNodeRef("surface", "task_list"));
                });
    }

    private JsonNode readYaml(String relativePath) throws IOException {
        return YAML.readTree(Files.readString(tempDir.resolve(relativePath)));
    }

    private static List<String> texts(JsonNode array) {
        List<String> texts = new ArrayList<>();
        array.forEach(element -> texts.add(element.asText()));
        return texts;
    }

    private static List<String> fieldNames(JsonNode object) {
        List<String> names = new ArrayList<>();
        object.fieldNames().forEachRemaining(names::add);
        return names;
    }
}
