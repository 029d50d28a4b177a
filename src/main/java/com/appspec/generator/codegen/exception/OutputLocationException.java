package com.appspec.generator.codegen.exception;

import java.nio.file.Path;

import com.appspec.generator.codegen.model.core.context.DiagnosticKind;

/**
 * The output location cannot be created or written.
 */
public class OutputLocationException extends StackBuildException {

    private static final long serialVersionUID = 1L;

    private final transient Path path;

    public OutputLocationException(String componentId, Path path, String message, Throwable cause) {
        super(DiagnosticKind.IO, componentId, message + ": " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
