package com.relaycast.services.messaging.template;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

/**
 * Evaluates dotted variable references such as {@code @contact.name}. A map value is
 * rendered through its {@code __default__} key. {@code @@} is a literal @.
 */
@Slf4j
@Component
public class ExpressionTemplateEvaluator implements TemplateEvaluator {

    static final String DEFAULT_KEY = "__default__";

    private static final Pattern EXPRESSION = Pattern.compile("@@|@([a-zA-Z_][\\w]*(?:\\.[a-zA-Z_][\\w]*)*)");

    @Override
    public EvaluatedTemplate evaluate(String text, Map<String, Object> context) {
        if (text == null || text.indexOf('@') < 0) {
            return new EvaluatedTemplate(text, List.of());
        }

        List<String> unresolved = new ArrayList<>();
        StringBuilder out = new StringBuilder(text.length());
        Matcher matcher = EXPRESSION.matcher(text);

        while (matcher.find()) {
            String replacement;
            if (matcher.group(1) == null) {
                replacement = "@";
            } else {
                Object value = lookup(context, matcher.group(1));
                if (value == null) {
                    unresolved.add(matcher.group(1));
                    replacement = matcher.group();
                } else {
                    replacement = value.toString();
                }
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);

        if (!unresolved.isEmpty()) {
            log.debug("Unresolved expressions left in text: {}", unresolved);
        }
        return new EvaluatedTemplate(out.toString(), unresolved);
    }

    private Object lookup(Map<String, Object> context, String path) {
        if (context == null) {
            return null;
        }
        Object current = context;
        for (String key : path.split("\\.")) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = caseInsensitiveGet((Map<?, ?>) current, key);
            if (current == null) {
                return null;
            }
        }
        if (current instanceof Map) {
            return ((Map<?, ?>) current).get(DEFAULT_KEY);
        }
        return current;
    }

    private Object caseInsensitiveGet(Map<?, ?> map, String key) {
        Object value = map.get(key);
        if (value != null) {
            return value;
        }
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (entry.getKey() instanceof String && ((String) entry.getKey()).equalsIgnoreCase(key)) {
                return entry.getValue();
            }
        }
        return null;
    }
}
