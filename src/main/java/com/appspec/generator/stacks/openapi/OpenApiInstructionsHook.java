package com.appspec.generator.stacks.openapi;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.appspec.generator.codegen.hook.AbstractHook;
import com.appspec.generator.codegen.hook.HookDescriptor;
import com.appspec.generator.codegen.hook.HookOutput;
import com.appspec.generator.codegen.hook.HookPhase;
import com.appspec.generator.codegen.model.core.context.UnitContext;
import com.appspec.generator.codegen.util.NamingUtil;

public class OpenApiInstructionsHook extends AbstractHook {

    private static final Logger log = LoggerFactory.getLogger(OpenApiInstructionsHook.class);

    public static final String ID = "openapi-instructions";

    public OpenApiInstructionsHook() {
        super(HookDescriptor.builder()
                .id(ID)
                .phase(HookPhase.POST_BUILD)
                .description("Print next steps")
                .require(OpenApiArtifacts.OPERATION_IDS)
                .build());
    }

    @Override
    public HookOutput run(UnitContext context) {
        List<String> operations = context.artifact(OpenApiArtifacts.OPERATION_IDS);
        String document = DocumentGenerator.documentPath(OpenApiFormat.of(context.getOptions()));
        String keyVariable = NamingUtil.toScreamingSnakeCase(context.getIr().getName()) + "_API_KEY";
        log.info("=================================================");
        log.info("NEXT STEPS");
        log.info("=================================================");
        log.info("1. Inspect the document:");
        log.info("   {}", context.getOutputRoot().resolve(document));
        log.info("2. Generate a client, e.g.:");
        log.info("   openapi-generator-cli generate -i {} -g java", document);
        log.info("3. Export the generated API key as {} for local testing", keyVariable);
        log.info("=================================================");
        return HookOutput.ok(operations.size() + " operation(s) documented in " + document);
    }
}
