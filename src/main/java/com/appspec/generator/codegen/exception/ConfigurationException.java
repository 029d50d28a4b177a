package com.appspec.generator.codegen.exception;

import java.util.List;

import com.appspec.generator.codegen.model.core.context.DiagnosticKind;

/**
 * Invalid backend or run configuration: cyclic generator graph, unresolved requirement,
 * conflicting artifact writers or output paths, unknown stack id.
 *
 * Always detected before the failing unit touches the file system and never retried.
 */
public class ConfigurationException extends StackBuildException {

    private static final long serialVersionUID = 1L;

    private final List<String> members;

    public ConfigurationException(String componentId, String message) {
        this(componentId, message, List.of());
    }

    public ConfigurationException(String componentId, String message, List<String> members) {
        super(DiagnosticKind.CONFIGURATION, componentId, message, null);
        this.members = List.copyOf(members);
    }

    /**
     * Components involved in the problem, e.g. every generator of a dependency cycle.
     */
    public List<String> getMembers() {
        return members;
    }
}
