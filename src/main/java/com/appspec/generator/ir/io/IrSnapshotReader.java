package com.appspec.generator.ir.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.appspec.generator.ir.AppSpec;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Reads an IR snapshot exported by the front end as JSON.
 *
 * Property names are snake_case and enum values are matched case-insensitively, so
 * {@code "mode": "list"} and {@code "entity_ref"} map onto the IR value classes. No semantic
 * validation happens here; the front end has already linked and validated the document.
 */
public class IrSnapshotReader {

    private static final Logger log = LoggerFactory.getLogger(IrSnapshotReader.class);

    private final ObjectMapper mapper;

    public IrSnapshotReader() {
        this.mapper = JsonMapper.builder()
                .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    public AppSpec read(Path file) throws IOException {
        log.debug("Reading IR snapshot from {}", file);
        try (InputStream in = Files.newInputStream(file)) {
            return read(in);
        }
    }

    public AppSpec read(InputStream in) throws IOException {
        AppSpec spec = mapper.readValue(in, AppSpec.class);
        log.debug("Loaded IR '{}' with {} module(s)", spec.getName(), spec.getModules().size());
        return spec;
    }
}
