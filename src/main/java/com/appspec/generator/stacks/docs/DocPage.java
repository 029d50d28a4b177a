package com.appspec.generator.stacks.docs;

import java.util.Map;

/**
 * One written documentation page; {@code path} is relative to the {@code docs/} directory.
 */
public record DocPage(String title, String path) {

    Map<String, Object> toModel() {
        return Map.of("title", title, "path", path);
    }
}
