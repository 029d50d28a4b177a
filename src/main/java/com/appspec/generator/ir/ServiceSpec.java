package com.appspec.generator.ir;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * An external service the application integrates with.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ServiceSpec {

    @NonNull
    String name;

    String title;

    String specUrl;

    /** Authentication profile kind, e.g. {@code api_key}, {@code oauth2}, {@code none}. */
    @Builder.Default
    String authKind = "none";

    String owner;
}
