package com.relaycast.services.messaging.template;

import java.util.Map;

public interface TemplateEvaluator {

    /**
     * Substitutes @expressions in text from the context. Expressions that can't be resolved are left as written.
     */
    EvaluatedTemplate evaluate(String text, Map<String, Object> context);
}
