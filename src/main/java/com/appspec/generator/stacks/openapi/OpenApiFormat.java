package com.appspec.generator.stacks.openapi;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import com.appspec.generator.codegen.model.core.context.BuildOptions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

/**
 * Serialization of the generated documents, chosen with the {@code openapi.format} option.
 */
public enum OpenApiFormat {

    YAML("yaml", new ObjectMapper(YAMLFactory.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .build())),
    JSON("json", JsonMapper.builder().enable(SerializationFeature.INDENT_OUTPUT).build());

    public static final String OPTION = "openapi.format";

    private final String extension;
    private final ObjectMapper mapper;

    OpenApiFormat(String extension, ObjectMapper mapper) {
        this.extension = extension;
        this.mapper = mapper;
    }

    public String extension() {
        return extension;
    }

    public String write(JsonNode document) throws JsonProcessingException {
        String text = mapper.writeValueAsString(document);
        return text.endsWith("\n") ? text : text + "\n";
    }

    ObjectMapper mapper() {
        return mapper;
    }

    /**
     * Format requested by the run options; YAML when none is given.
     *
     * @throws IllegalArgumentException for any value other than {@code yaml} or {@code json}
     */
    public static OpenApiFormat of(BuildOptions options) {
        String requested = options.property(OPTION).orElse(YAML.extension);
        return Arrays.stream(values())
                .filter(f -> f.extension.equals(requested.toLowerCase(Locale.ROOT)))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Invalid format: " + requested
                        + ". Must be one of " + names()));
    }

    public static List<String> names() {
        return Arrays.stream(values()).map(OpenApiFormat::extension).toList();
    }
}
