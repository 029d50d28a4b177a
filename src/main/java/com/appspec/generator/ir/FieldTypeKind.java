package com.appspec.generator.ir;

/**
 * Primitive kinds a field type can take.
 */
public enum FieldTypeKind {
    STR,
    TEXT,
    INT,
    DECIMAL,
    BOOL,
    DATE,
    DATETIME,
    UUID,
    EMAIL,
    ENUM,
    REF
}
