package com.calor.compiler.codegen.template;

import java.io.IOException;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders the C# file envelopes from FreeMarker templates under {@code /templates/csharp}.
 *
 * Bodies arrive already formatted; the templates only add the header, the using block and
 * the namespace braces.
 */
public class CompilationUnitRenderer {
    private static final Logger log = LoggerFactory.getLogger(CompilationUnitRenderer.class);

    static final String COMPILATION_UNIT = "csharp/compilation-unit.ftl";
    static final String CONTRACT_RUNTIME = "csharp/contract-runtime.ftl";

    private final Configuration freemarkerConfig;

    public CompilationUnitRenderer() {
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

    /**
     * One C# file: header comment, sorted usings, then {@code body} inside the namespace block.
     */
    public String renderCompilationUnit(String namespace, List<String> usings, String body) {
        Map<String, Object> data = new HashMap<>();
        data.put("namespace", namespace);
        data.put("usings", usings);
        data.put("body", body);
        return render(COMPILATION_UNIT, data);
    }

    /**
     * Runtime support types referenced by emitted guards and Option/Result values.
     */
    public String renderContractRuntime() {
        return render(CONTRACT_RUNTIME, new HashMap<>());
    }

    private String render(String templateName, Map<String, Object> data) {
        try {
            Template template = freemarkerConfig.getTemplate(templateName);
            StringWriter out = new StringWriter();
            template.process(data, out);
            log.debug("Rendered template {}", templateName);
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new CodegenException("Failed to render template " + templateName, e);
        }
    }
}
