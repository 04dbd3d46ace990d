package com.williamcallahan.hidden_gem.service.provider;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Null-tolerant accessors for provider JSON payloads
 */
final class ProviderJson {

    private ProviderJson() {
    }

    /**
     * Text of a field, or null when it is missing, null or blank
     */
    static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
