package com.appspec.generator.ir;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class SurfaceElement {

    @NonNull
    String fieldName;

    String label;

    public String displayLabel() {
        return label != null && !label.isBlank() ? label : fieldName;
    }
}
