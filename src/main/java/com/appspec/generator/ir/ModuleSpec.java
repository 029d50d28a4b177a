package com.appspec.generator.ir;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One module of the application, grouping the elements declared together.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ModuleSpec {

    @NonNull
    String name;

    @NonNull
    @Singular
    List<EntitySpec> entities;

    @NonNull
    @Singular
    List<SurfaceSpec> surfaces;

    @NonNull
    @Singular
    List<ServiceSpec> services;

    @NonNull
    @Singular
    List<WorkspaceSpec> workspaces;
}
