package com.appspec.generator.ir;

import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A domain entity with its ordered fields.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class EntitySpec {

    @NonNull
    String name;

    String title;

    @NonNull
    @Singular
    List<FieldSpec> fields;

    public String displayTitle() {
        return title != null && !title.isBlank() ? title : name;
    }

    public Optional<FieldSpec> primaryKey() {
        return fields.stream().filter(FieldSpec::isPrimaryKey).findFirst();
    }

    public Optional<FieldSpec> findField(String fieldName) {
        return fields.stream().filter(f -> f.getName().equals(fieldName)).findFirst();
    }
}
