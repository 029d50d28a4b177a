package com.appspec.generator.codegen.generator;

import java.io.IOException;
import java.util.Map;

import com.appspec.generator.codegen.exception.GenerationException;
import com.appspec.generator.codegen.util.TemplateRenderer;
import com.appspec.generator.ir.IrNodeRef;

import freemarker.template.TemplateException;

/**
 * Base class for generators: holds the descriptor and offers template rendering and failure
 * helpers that attribute errors to this generator.
 */
public abstract class AbstractGenerator implements Generator {

    private final GeneratorDescriptor descriptor;
    private final TemplateRenderer templates;

    protected AbstractGenerator(GeneratorDescriptor descriptor) {
        this(descriptor, TemplateRenderer.shared());
    }

    protected AbstractGenerator(GeneratorDescriptor descriptor, TemplateRenderer templates) {
        this.descriptor = descriptor;
        this.templates = templates;
    }

    @Override
    public final GeneratorDescriptor descriptor() {
        return descriptor;
    }

    /**
     * Renders a FreeMarker template from {@code /templates}; failures are attributed to
     * {@code node}.
     */
    protected String render(String templateName, Map<String, Object> model, IrNodeRef node) {
        try {
            return templates.render(templateName, model);
        } catch (IOException | TemplateException e) {
            throw new GenerationException(id(), node,
                    "Failed to render template '" + templateName + "': " + e.getMessage(), e);
        }
    }

    protected GenerationException fail(IrNodeRef node, String message) {
        return new GenerationException(id(), node, message);
    }

    protected GenerationException fail(IrNodeRef node, String message, Throwable cause) {
        return new GenerationException(id(), node, message, cause);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + id() + "]";
    }
}
