package fun.fengwk.fleet.core.configuration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.ClassUtils;

import java.util.Locale;

/**
 * Template engine for tool replies.
 *
 * @author fengwk
 */
@Configuration
public class FreeMarkerConfiguration {

    static final String TEMPLATE_PATH = "/mcp/templates/";

    @Bean(name = "mcpTemplateConfiguration")
    public freemarker.template.Configuration mcpTemplateConfiguration() {
        return createMcpTemplateConfiguration();
    }

    public static freemarker.template.Configuration createMcpTemplateConfiguration() {
        freemarker.template.Configuration cfg = new freemarker.template.Configuration(
            freemarker.template.Configuration.VERSION_2_3_34);
        cfg.setClassLoaderForTemplateLoading(ClassUtils.getDefaultClassLoader(), TEMPLATE_PATH);
        cfg.setDefaultEncoding("UTF-8");
        cfg.setLocale(Locale.ROOT);
        cfg.setNumberFormat("computer");
        cfg.setLogTemplateExceptions(false);
        return cfg;
    }

}
