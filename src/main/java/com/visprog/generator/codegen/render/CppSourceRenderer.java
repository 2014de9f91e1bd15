package com.visprog.generator.codegen.render;

import java.io.IOException;
import java.io.StringWriter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.visprog.generator.codegen.exception.CodeGenerationException;

import freemarker.core.PlainTextOutputFormat;
import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Lays out a {@link CppTranslationUnit} as C++ source with the
 * {@code templates/cpp/program.ftl} FreeMarker template.
 */
public class CppSourceRenderer {
    private static final Logger log = LoggerFactory.getLogger(CppSourceRenderer.class);

    static final String PROGRAM_TEMPLATE = "cpp/program.ftl";

    private final Configuration freemarkerConfig;

    public CppSourceRenderer() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setOutputFormat(PlainTextOutputFormat.INSTANCE);
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public String render(CppTranslationUnit unit) {
        try {
            Template template = freemarkerConfig.getTemplate(PROGRAM_TEMPLATE);
            StringWriter out = new StringWriter();
            template.process(unit.toTemplateModel(), out);
            log.debug("Rendered {} main lines and {} function units", unit.getMainLines().size(),
                    unit.getFunctionUnits().size());
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new CodeGenerationException("Failed to render " + PROGRAM_TEMPLATE, e);
        }
    }
}
