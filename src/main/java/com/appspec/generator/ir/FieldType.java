package com.appspec.generator.ir;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Type of a field. Only the attributes relevant to {@link #kind} are populated.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class FieldType {

    @NonNull
    FieldTypeKind kind;

    /** For STR. */
    Integer maxLength;

    /** For DECIMAL. */
    Integer precision;

    /** For DECIMAL. */
    Integer scale;

    /** For ENUM. */
    @Singular
    List<String> enumValues;

    /** For REF. */
    String refEntity;

    public static FieldType of(FieldTypeKind kind) {
        return FieldType.builder().kind(kind).build();
    }

    public static FieldType str(int maxLength) {
        return FieldType.builder().kind(FieldTypeKind.STR).maxLength(maxLength).build();
    }

    public static FieldType ref(String entityName) {
        return FieldType.builder().kind(FieldTypeKind.REF).refEntity(entityName).build();
    }

    public static FieldType enumOf(List<String> values) {
        return FieldType.builder().kind(FieldTypeKind.ENUM).enumValues(values).build();
    }

    /**
     * Compact textual form, e.g. {@code str(200)}, {@code decimal(10,2)}, {@code ref Client}.
     */
    public String describe() {
        return switch (kind) {
            case STR -> maxLength != null ? "str(" + maxLength + ")" : "str";
            case DECIMAL -> precision != null
                    ? "decimal(" + precision + "," + (scale != null ? scale : 0) + ")"
                    : "decimal";
            case ENUM -> "enum[" + String.join(",", enumValues) + "]";
            case REF -> "ref " + refEntity;
            default -> kind.name().toLowerCase();
        };
    }
}
