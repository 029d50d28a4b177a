package com.appspec.generator.ir.io;

import static org.assertj.core.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import com.appspec.generator.ir.AppSpec;
import com.appspec.generator.ir.EntitySpec;
import com.appspec.generator.ir.FieldModifier;
import com.appspec.generator.ir.FieldSpec;
import com.appspec.generator.ir.FieldTypeKind;
import com.appspec.generator.ir.SurfaceMode;
import com.appspec.generator.ir.SurfaceSpec;
import com.appspec.generator.ir.WorkspaceRegion;
import com.fasterxml.jackson.core.JsonProcessingException;

class IrSnapshotReaderTest {

    private final IrSnapshotReader reader = new IrSnapshotReader();

    @Test
    void testReadsSnakeCaseSnapshot() throws IOException {
        AppSpec spec;
        try (InputStream in = getClass().getResourceAsStream("/ir/task-tracker.json")) {
            spec = reader.read(in);
        }

        assertThat(spec.getName()).isEqualTo("task_tracker");
        assertThat(spec.displayTitle()).isEqualTo("Task Tracker");
        assertThat(spec.getVersion()).isEqualTo("1.2.0");
        assertThat(spec.allEntities()).extracting(EntitySpec::getName).containsExactly("User", "Task");

        EntitySpec task = spec.findEntity("Task").orElseThrow();
        assertThat(task.primaryKey()).map(FieldSpec::getName).contains("id");
        FieldSpec status = task.findField("status").orElseThrow();
        assertThat(status.getType().getKind()).isEqualTo(FieldTypeKind.ENUM);
        assertThat(status.getType().getEnumValues()).containsExactly("todo", "in_progress", "done");
        assertThat(status.getDefaultValue()).isEqualTo("todo");
        assertThat(task.findField("estimate").orElseThrow().getType().describe()).isEqualTo("decimal(6,2)");
        assertThat(task.findField("assignee").orElseThrow().getType().getRefEntity()).isEqualTo("User");
        assertThat(task.findField("created_at").orElseThrow().getModifiers()).containsExactly(FieldModifier.AUTO_ADD);
        assertThat(spec.findEntity("User").orElseThrow().findField("email").orElseThrow().isUnique()).isTrue();

        SurfaceSpec list = spec.allSurfaces().get(0);
        assertThat(list.getMode()).isEqualTo(SurfaceMode.LIST);
        assertThat(list.getEntityRef()).isEqualTo("Task");
        assertThat(list.getSections().get(0).getElements().get(1).displayLabel()).isEqualTo("status");

        assertThat(spec.allWorkspaces().get(0).getRegions())
                .extracting(WorkspaceRegion::getDisplay)
                .containsExactly("list", "grid");
        assertThat(spec.allServices().get(0).getAuthKind()).isEqualTo("api_key");
    }

    @Test
    void testMinimalSnapshotUsesDefaults() throws IOException {
        AppSpec spec = read("{\"name\": \"bare\", \"modules\": []}");

        assertThat(spec.displayTitle()).isEqualTo("bare");
        assertThat(spec.getVersion()).isEqualTo("0.1.0");
        assertThat(spec.getModules()).isEmpty();
    }

    @Test
    void testMalformedSnapshotFails() {
        assertThatThrownBy(() -> read("{\"name\": "))
                .isInstanceOf(JsonProcessingException.class);
    }

    private AppSpec read(String json) throws IOException {
        return reader.read(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }
}
