package com.podconfig.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Factory for creating a Pod from a Kubernetes pod manifest in JSON form.
 * Unknown fields are ignored, missing ones map to null or empty values.
 */
public class PodFactory {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private PodFactory() {
    }

    /**
     * Create a Pod from its JSON manifest.
     *
     * @param json Pod manifest, as served by the API server or read by a file source
     * @return the parsed pod
     * @throws IllegalArgumentException if the text is not a JSON object
     */
    public static Pod fromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("Pod manifest cannot be null or empty");
        }
        JsonNode root = parseJson(json);
        if (!root.isObject()) {
            throw new IllegalArgumentException("Pod manifest must be a JSON object");
        }
        return new Pod(parseMetadata(root.path("metadata")), parseSpec(root.path("spec")));
    }

    private static JsonNode parseJson(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid pod manifest: " + e.getOriginalMessage(), e);
        }
    }

    private static Pod.Metadata parseMetadata(JsonNode node) {
        Map<String, String> annotations = new LinkedHashMap<>();
        JsonNode annotationsNode = node.path("annotations");
        Iterator<Map.Entry<String, JsonNode>> fields = annotationsNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            // a null value still marks the key as present
            annotations.put(entry.getKey(), entry.getValue().isNull() ? "" : entry.getValue().asText());
        }
        return new Pod.Metadata(
                text(node, "name"),
                node.hasNonNull("namespace") ? node.get("namespace").asText() : Pod.NAMESPACE_DEFAULT,
                text(node, "uid"),
                annotations);
    }

    private static Pod.Spec parseSpec(JsonNode node) {
        return new Pod.Spec(
                parsePriority(node.get("priority")),
                text(node, "priorityClassName"),
                parseContainers(node.path("initContainers")),
                parseContainers(node.path("containers")));
    }

    private static Integer parsePriority(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new IllegalArgumentException("Invalid pod manifest: spec.priority must be a 32-bit integer, got " + node);
        }
        return node.intValue();
    }

    private static List<Pod.Container> parseContainers(JsonNode node) {
        if (!node.isArray()) {
            return List.of();
        }
        List<Pod.Container> containers = new ArrayList<>();
        for (JsonNode item : node) {
            containers.add(new Pod.Container(
                    text(item, "name"),
                    text(item, "image"),
                    text(item, "restartPolicy")));
        }
        return containers;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
