package com.appspec.generator.ir;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A user-facing surface (screen or form) bound to an optional entity.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class SurfaceSpec {

    @NonNull
    String name;

    String title;

    /** Name of the entity the surface operates on, or null for free-standing surfaces. */
    String entityRef;

    @NonNull
    SurfaceMode mode;

    @NonNull
    @Singular
    List<SurfaceSection> sections;

    public String displayTitle() {
        return title != null && !title.isBlank() ? title : name;
    }
}
