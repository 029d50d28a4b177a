package com.appspec.generator.ir;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class WorkspaceRegion {

    @NonNull
    String name;

    /** Entity or surface name feeding the region. */
    @NonNull
    String source;

    Integer limit;

    @Builder.Default
    String display = "list";
}
