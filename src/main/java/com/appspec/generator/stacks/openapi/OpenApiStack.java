package com.appspec.generator.stacks.openapi;

import com.appspec.generator.codegen.backend.Backend;
import com.appspec.generator.stacks.common.OptionValueCheckHook;

/**
 * OpenAPI 3 description of the entities and surfaces of an application, as YAML (default)
 * or JSON depending on {@value OpenApiFormat#OPTION}.
 */
public final class OpenApiStack {

    public static final String ID = "openapi";

    private OpenApiStack() {
    }

    public static Backend create() {
        return Backend.builder()
                .id(ID)
                .description("OpenAPI 3 document with one schema file per entity")
                .outputFormats(OpenApiFormat.names())
                .hook(new OptionValueCheckHook(OpenApiFormat.OPTION, OpenApiFormat.names()))
                .generator(new DocumentGenerator())
                .generator(new SchemaGenerator())
                .hook(new ApiCredentialsHook())
                .hook(new OpenApiInstructionsHook())
                .build();
    }
}
