package com.appspec.generator.codegen.util;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Map;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders FreeMarker templates loaded from {@code /templates} on the class path.
 *
 * The FreeMarker configuration is thread-safe once built, so one shared instance serves
 * every generator of every run.
 */
public class TemplateRenderer {

    private static final TemplateRenderer SHARED = new TemplateRenderer("/templates");

    private final Configuration freemarkerConfig;

    public TemplateRenderer(String basePackagePath) {
        this.freemarkerConfig = createFreemarkerConfig(basePackagePath);
    }

    public static TemplateRenderer shared() {
        return SHARED;
    }

    private Configuration createFreemarkerConfig(String basePackagePath) {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), basePackagePath);
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        cfg.setFallbackOnNullLoopVariable(false);
        return cfg;
    }

    public String render(String templateName, Map<String, Object> model) throws IOException, TemplateException {
        Template template = freemarkerConfig.getTemplate(templateName);
        StringWriter out = new StringWriter();
        template.process(model, out);
        return out.toString();
    }
}
