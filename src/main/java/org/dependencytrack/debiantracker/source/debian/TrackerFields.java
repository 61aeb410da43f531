package org.dependencytrack.debiantracker.source.debian;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

// A field of unexpected type reads as absent, it never fails the entry it belongs to.
final class TrackerFields {

    private static final Logger LOGGER = LoggerFactory.getLogger(TrackerFields.class);

    private TrackerFields() {
    }

    static String text(final JsonNode parentNode, final String fieldName) {
        final JsonNode node = parentNode.get(fieldName);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isNumber()) {
            return node.asText();
        }

        LOGGER.debug("Ignoring field {} of type {}", fieldName, node.getNodeType());
        return null;
    }

    static Long integer(final JsonNode parentNode, final String fieldName) {
        final JsonNode node = parentNode.get(fieldName);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return node.longValue();
        }
        if (node.isTextual()) {
            try {
                return Long.parseLong(node.textValue().trim());
            } catch (NumberFormatException e) {
                LOGGER.debug("Ignoring non-numeric field {}: {}", fieldName, node.textValue());
                return null;
            }
        }

        LOGGER.debug("Ignoring field {} of type {}", fieldName, node.getNodeType());
        return null;
    }

    static Map<String, String> textMap(final JsonNode parentNode, final String fieldName) {
        final JsonNode node = parentNode.get(fieldName);
        if (node == null || node.isNull()) {
            return Collections.emptyMap();
        }
        if (!node.isObject()) {
            LOGGER.debug("Ignoring field {} of type {}", fieldName, node.getNodeType());
            return Collections.emptyMap();
        }

        final var values = new LinkedHashMap<String, String>(node.size());
        node.fields().forEachRemaining(entry -> {
            if (entry.getValue().isTextual()) {
                values.put(entry.getKey(), entry.getValue().textValue());
            } else {
                LOGGER.debug("Ignoring entry {} of field {} of type {}",
                        entry.getKey(), fieldName, entry.getValue().getNodeType());
            }
        });

        return values;
    }

    static boolean isScalarOrAbsent(final JsonNode parentNode, final String fieldName) {
        final JsonNode node = parentNode.get(fieldName);
        return node == null || node.isNull() || node.isTextual() || node.isNumber();
    }

}
