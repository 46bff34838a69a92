package com.metamodel.generator.codegen.emit;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Map;

import com.metamodel.generator.codegen.GeneratorConfig;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders the fixed header of a generated file from the {@code header.ftl} template.
 */
public class HeaderRenderer {

    private static final String TEMPLATE_NAME = "header.ftl";

    private final Configuration freemarkerConfig;

    public HeaderRenderer() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public String render(GeneratorConfig config) {
        Map<String, Object> model = Map.of(
                "generatorName", config.getGeneratorName(),
                "propertiesModule", config.getPropertiesModule());
        try {
            Template template = freemarkerConfig.getTemplate(TEMPLATE_NAME);
            StringWriter out = new StringWriter();
            template.process(model, out);
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new IllegalStateException("Failed to render header template " + TEMPLATE_NAME, e);
        }
    }
}
