package com.vtb.rca.extractors;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Безопасное чтение полей из JSON артефактов
 */
final class JsonFields {
    
    static final String UNKNOWN = "unknown";
    
    private JsonFields() {
    }
    
    /**
     * Тело отчета: Trivy и CIS кладут данные в объект "report", SBOM нет
     */
    static JsonNode reportBody(JsonNode root) {
        if (root == null) {
            return null;
        }
        JsonNode report = root.get("report");
        return report != null && report.isObject() ? report : root;
    }
    
    static String text(JsonNode node, String field) {
        String value = optionalText(node, field);
        return value != null ? value : UNKNOWN;
    }
    
    static String optionalText(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
    
    /**
     * Объекты массива; отсутствующее поле или не массив дают пустой список
     */
    static List<JsonNode> objects(JsonNode node, String field) {
        List<JsonNode> result = new ArrayList<>();
        if (node == null) {
            return result;
        }
        JsonNode array = node.get(field);
        if (array == null || !array.isArray()) {
            return result;
        }
        for (JsonNode element : array) {
            if (element != null && element.isObject()) {
                result.add(element);
            }
        }
        return result;
    }
    
    static List<String> strings(JsonNode node, String field) {
        List<String> result = new ArrayList<>();
        JsonNode array = node != null ? node.get(field) : null;
        if (array == null || !array.isArray()) {
            return result;
        }
        for (JsonNode element : array) {
            if (element != null && element.isValueNode()) {
                result.add(element.asText());
            }
        }
        return result;
    }
}
