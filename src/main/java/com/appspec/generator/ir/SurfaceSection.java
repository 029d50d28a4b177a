package com.appspec.generator.ir;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class SurfaceSection {

    @NonNull
    String name;

    String title;

    @NonNull
    @Singular
    List<SurfaceElement> elements;
}
