package com.appspec.generator.codegen.exception;

import com.appspec.generator.codegen.model.core.context.DiagnosticKind;

/**
 * The caller cancelled the run. Raised between units, never in the middle of one.
 */
public class BuildCancelledException extends StackBuildException {

    private static final long serialVersionUID = 1L;

    public BuildCancelledException(String componentId) {
        super(DiagnosticKind.CANCELLED, componentId, "Build cancelled before '" + componentId + "' started", null);
    }
}
