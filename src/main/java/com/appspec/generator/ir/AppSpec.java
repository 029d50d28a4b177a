package com.appspec.generator.ir;

import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Root of the IR snapshot handed to the build engine.
 *
 * The snapshot is produced upstream, already linked and validated, and is never mutated
 * during a build run. Aggregating accessors flatten the module graph in declaration order.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class AppSpec {

    @NonNull
    String name;

    String title;

    /** Version of the specified application, e.g. {@code 1.2.0}. */
    @Builder.Default
    String version = "0.1.0";

    @NonNull
    @Singular
    List<ModuleSpec> modules;

    public String displayTitle() {
        return title != null && !title.isBlank() ? title : name;
    }

    public List<EntitySpec> allEntities() {
        return modules.stream().flatMap(m -> m.getEntities().stream()).toList();
    }

    public List<SurfaceSpec> allSurfaces() {
        return modules.stream().flatMap(m -> m.getSurfaces().stream()).toList();
    }

    public List<ServiceSpec> allServices() {
        return modules.stream().flatMap(m -> m.getServices().stream()).toList();
    }

    public List<WorkspaceSpec> allWorkspaces() {
        return modules.stream().flatMap(m -> m.getWorkspaces().stream()).toList();
    }

    public Optional<EntitySpec> findEntity(String entityName) {
        return modules.stream()
                .flatMap(m -> m.getEntities().stream())
                .filter(e -> e.getName().equals(entityName))
                .findFirst();
    }
}
