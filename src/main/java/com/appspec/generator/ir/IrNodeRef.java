package com.appspec.generator.ir;

import lombok.NonNull;

/**
 * Points at one node of the IR snapshot, used to attribute generation failures.
 *
 * @param kind node kind, e.g. {@code entity}, {@code field}, {@code surface}
 * @param name node name; fields are qualified as {@code Entity.field}
 */
public record IrNodeRef(@NonNull String kind, @NonNull String name) {

    public static IrNodeRef entity(EntitySpec entity) {
        return new IrNodeRef("entity", entity.getName());
    }

    public static IrNodeRef field(EntitySpec entity, FieldSpec field) {
        return new IrNodeRef("field", entity.getName() + "." + field.getName());
    }

    public static IrNodeRef surface(SurfaceSpec surface) {
        return new IrNodeRef("surface", surface.getName());
    }

    public static IrNodeRef workspace(WorkspaceSpec workspace) {
        return new IrNodeRef("workspace", workspace.getName());
    }

    public static IrNodeRef service(ServiceSpec service) {
        return new IrNodeRef("service", service.getName());
    }

    @Override
    public String toString() {
        return kind + " '" + name + "'";
    }
}
