package com.appspec.generator.testing;

import java.util.List;

import com.appspec.generator.ir.AppSpec;
import com.appspec.generator.ir.EntitySpec;
import com.appspec.generator.ir.FieldModifier;
import com.appspec.generator.ir.FieldSpec;
import com.appspec.generator.ir.FieldType;
import com.appspec.generator.ir.FieldTypeKind;
import com.appspec.generator.ir.ModuleSpec;
import com.appspec.generator.ir.ServiceSpec;
import com.appspec.generator.ir.SurfaceElement;
import com.appspec.generator.ir.SurfaceMode;
import com.appspec.generator.ir.SurfaceSection;
import com.appspec.generator.ir.SurfaceSpec;
import com.appspec.generator.ir.WorkspaceRegion;
import com.appspec.generator.ir.WorkspaceSpec;

/**
 * A small task tracker used across tests.
 */
public final class SampleIr {

    private SampleIr() {
    }

    public static AppSpec taskTracker() {
        EntitySpec user = EntitySpec.builder()
                .name("User")
                .title("Team Member")
                .field(field("id", FieldType.of(FieldTypeKind.UUID), FieldModifier.PK))
                .field(field("email", FieldType.of(FieldTypeKind.EMAIL), FieldModifier.REQUIRED, FieldModifier.UNIQUE))
                .field(field("name", FieldType.str(120), FieldModifier.REQUIRED))
                .build();
        EntitySpec task = EntitySpec.builder()
                .name("Task")
                .field(field("id", FieldType.of(FieldTypeKind.UUID), FieldModifier.PK))
                .field(field("title", FieldType.str(200), FieldModifier.REQUIRED))
                .field(FieldSpec.builder()
                        .name("status")
                        .type(FieldType.enumOf(List.of("todo", "in_progress", "done")))
                        .defaultValue("todo")
                        .build())
                .field(field("assignee", FieldType.ref("User")))
                .field(field("created_at", FieldType.of(FieldTypeKind.DATETIME), FieldModifier.AUTO_ADD))
                .build();

        SurfaceSpec taskList = surface("task_list", "Tasks", SurfaceMode.LIST, "title", "status");
        SurfaceSpec taskCreate = surface("task_create", "New Task", SurfaceMode.CREATE, "title", "assignee");
        SurfaceSpec taskDetail = surface("task_detail", "Task", SurfaceMode.VIEW, "title", "status", "assignee");
        SurfaceSpec board = SurfaceSpec.builder()
                .name("task_board")
                .title("Board")
                .entityRef("Task")
                .mode(SurfaceMode.CUSTOM)
                .build();

        WorkspaceSpec dashboard = WorkspaceSpec.builder()
                .name("dashboard")
                .title("Dashboard")
                .purpose("Daily overview of open work")
                .region(WorkspaceRegion.builder().name("open_tasks").source("task_list").limit(10).build())
                .region(WorkspaceRegion.builder().name("team").source("User").display("grid").build())
                .build();

        ServiceSpec notifier = ServiceSpec.builder()
                .name("notifier")
                .title("Notification Service")
                .authKind("api_key")
                .build();

        return AppSpec.builder()
                .name("task_tracker")
                .title("Task Tracker")
                .version("1.2.0")
                .module(ModuleSpec.builder()
                        .name("core")
                        .entity(user)
                        .entity(task)
                        .surface(taskList)
                        .surface(taskCreate)
                        .surface(taskDetail)
                        .surface(board)
                        .workspace(dashboard)
                        .service(notifier)
                        .build())
                .build();
    }

    /**
     * Same application with an entity whose field references an entity that does not exist.
     */
    public static AppSpec withDanglingReference() {
        EntitySpec invalid = EntitySpec.builder()
                .name("Invalid")
                .field(field("id", FieldType.of(FieldTypeKind.UUID), FieldModifier.PK))
                .field(field("owner", FieldType.ref("Ghost")))
                .build();
        AppSpec base = taskTracker();
        return base.toBuilder()
                .module(ModuleSpec.builder().name("broken").entity(invalid).build())
                .build();
    }

    public static AppSpec empty() {
        return AppSpec.builder().name("empty").build();
    }

    private static FieldSpec field(String name, FieldType type, FieldModifier... modifiers) {
        FieldSpec.FieldSpecBuilder field = FieldSpec.builder().name(name).type(type);
        for (FieldModifier modifier : modifiers) {
            field.modifier(modifier);
        }
        return field.build();
    }

    private static SurfaceSpec surface(String name, String title, SurfaceMode mode, String... fields) {
        SurfaceSection.SurfaceSectionBuilder section = SurfaceSection.builder().name("main");
        for (String fieldName : fields) {
            section.element(SurfaceElement.builder().fieldName(fieldName).build());
        }
        return SurfaceSpec.builder()
                .name(name)
                .title(title)
                .entityRef("Task")
                .mode(mode)
                .section(section.build())
                .build();
    }
}
