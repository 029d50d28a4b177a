package com.appspec.generator.ir;

public enum SurfaceMode {
    LIST,
    VIEW,
    CREATE,
    EDIT,
    CUSTOM
}
