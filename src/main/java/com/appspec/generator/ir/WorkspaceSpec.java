package com.appspec.generator.ir;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A workspace composing several regions into one dashboard-like view.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class WorkspaceSpec {

    @NonNull
    String name;

    String title;

    String purpose;

    @NonNull
    @Singular
    List<WorkspaceRegion> regions;

    public String displayTitle() {
        return title != null && !title.isBlank() ? title : name;
    }
}
