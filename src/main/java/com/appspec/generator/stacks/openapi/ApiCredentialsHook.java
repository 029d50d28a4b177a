package com.appspec.generator.stacks.openapi;

import java.security.SecureRandom;
import java.util.Base64;

import com.appspec.generator.codegen.hook.AbstractHook;
import com.appspec.generator.codegen.hook.HookDescriptor;
import com.appspec.generator.codegen.hook.HookOutput;
import com.appspec.generator.codegen.hook.HookPhase;
import com.appspec.generator.codegen.model.core.context.UnitContext;

/**
 * Generates a development API key for the documented API and hands it to the caller.
 */
public class ApiCredentialsHook extends AbstractHook {

    public static final String ID = "api-credentials";

    private static final int KEY_BYTES = 24;

    private final SecureRandom random = new SecureRandom();

    public ApiCredentialsHook() {
        super(HookDescriptor.builder()
                .id(ID)
                .phase(HookPhase.POST_BUILD)
                .description("Generate a development API key")
                .produce(OpenApiArtifacts.API_KEY)
                .build());
    }

    @Override
    public HookOutput run(UnitContext context) {
        byte[] bytes = new byte[KEY_BYTES];
        random.nextBytes(bytes);
        String prefix = context.getOptions().property("openapi.api_key_prefix").orElse("dev_");
        String apiKey = prefix + Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
        return HookOutput.builder()
                .message("Development API key generated; change it before deploying")
                .artifact(OpenApiArtifacts.API_KEY, apiKey)
                .build();
    }
}
