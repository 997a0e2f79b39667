package com.relaycast.services.messaging.template;

import java.util.List;

public record EvaluatedTemplate(String text, List<String> unresolved) {

    public boolean hasUnresolved() {
        return unresolved != null && !unresolved.isEmpty();
    }
}
