package fun.fengwk.fleet.core.utils;

import org.springframework.ai.tool.execution.ToolCallResultConverter;

import java.lang.reflect.Type;

/**
 * Passes rendered text through as the tool result instead of json-encoding it.
 *
 * @author fengwk
 */
public class PlainTextToolCallResultConverter implements ToolCallResultConverter {

    @Override
    public String convert(Object result, Type returnType) {
        if (result == null) {
            return "";
        }
        if (result instanceof CharSequence text) {
            return text.toString();
        }
        throw new IllegalStateException("tool result must be text, got " + result.getClass().getName());
    }

}
