package fun.fengwk.fleet.core.mcp;

import freemarker.template.Template;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.StringWriter;
import java.util.Map;

/**
 * Renders tool replies from FreeMarker templates. The model is exposed to templates as {@code data}.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class McpFormatter {

    private final freemarker.template.Configuration mcpTemplateConfiguration;

    public McpFormatter(@Qualifier("mcpTemplateConfiguration") freemarker.template.Configuration mcpTemplateConfiguration) {
        this.mcpTemplateConfiguration = mcpTemplateConfiguration;
    }

    public String format(String templateName, Object model) {
        if (model == null) {
            return "empty response";
        }
        StringWriter result = new StringWriter(1024);
        try {
            Template template = mcpTemplateConfiguration.getTemplate(templateName);
            template.process(Map.of("data", model), result);
            return result.toString();
        } catch (Exception ex) {
            log.warn("render tool reply failed, template={}, error={}", templateName, ex.getMessage());
            return "format error: " + ex.getMessage();
        }
    }

}
