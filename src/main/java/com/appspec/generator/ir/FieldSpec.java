package com.appspec.generator.ir;

import java.util.Set;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class FieldSpec {

    @NonNull
    String name;

    @NonNull
    FieldType type;

    @NonNull
    @Singular
    Set<FieldModifier> modifiers;

    /**
     * Literal default value as written in the DSL source, or null.
     */
    String defaultValue;

    public boolean isRequired() {
        return modifiers.contains(FieldModifier.REQUIRED) || modifiers.contains(FieldModifier.PK);
    }

    public boolean isPrimaryKey() {
        return modifiers.contains(FieldModifier.PK);
    }

    public boolean isUnique() {
        return modifiers.contains(FieldModifier.UNIQUE) || modifiers.contains(FieldModifier.PK);
    }
}
