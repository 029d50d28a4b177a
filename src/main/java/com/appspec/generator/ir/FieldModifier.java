package com.appspec.generator.ir;

public enum FieldModifier {
    REQUIRED,
    OPTIONAL,
    PK,
    UNIQUE,
    AUTO_ADD,
    AUTO_UPDATE
}
