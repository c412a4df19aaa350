package com.scrapesentinel.service.extract;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import com.scrapesentinel.core.error.ExtractionException;
import com.scrapesentinel.core.model.ExtractionResult;
import com.scrapesentinel.core.model.FieldValue;
import com.scrapesentinel.core.model.ItemRecord;
import com.scrapesentinel.core.model.SelectorSpec;
import com.scrapesentinel.core.util.JsonUtils;
import com.scrapesentinel.monitors.api.Extractor;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Extracts items from JSON endpoints. The item selector is a JSON pointer to an array (empty for
 * the document root) and each field selector is a JSON pointer evaluated against one element.
 * With no field selectors, every scalar member of an element becomes a field.
 */
public class JsonItemExtractor implements Extractor {
    private final Clock clock;

    public JsonItemExtractor(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ExtractionResult extract(String sourceKey, String content, SelectorSpec selectors) {
        JsonNode root;
        try {
            root = JsonUtils.objectMapper().readTree(content);
        } catch (IOException e) {
            throw new ExtractionException(sourceKey, "Response from " + sourceKey + " is not valid JSON", e);
        }
        if (root == null || root.isMissingNode()) {
            throw new ExtractionException(sourceKey, "Response from " + sourceKey + " is empty");
        }

        JsonNode array = root.at(pointer(sourceKey, selectors.itemSelector()));
        if (!array.isArray()) {
            throw new ExtractionException(sourceKey, "Item selector '" + selectors.itemSelector()
                    + "' does not point to an array in " + sourceKey);
        }

        Map<String, JsonPointer> fields = new TreeMap<>();
        selectors.fields().forEach((name, selector) -> fields.put(name, pointer(sourceKey, selector)));

        List<ItemRecord> items = new ArrayList<>();
        for (JsonNode element : array) {
            Map<String, FieldValue> values = fields.isEmpty() ? scalarMembers(element) : selected(element, fields);
            if (!values.isEmpty()) {
                items.add(new ItemRecord(values));
            }
        }
        return new ExtractionResult(sourceKey, items, clock.instant());
    }

    private static Map<String, FieldValue> selected(JsonNode element, Map<String, JsonPointer> fields) {
        Map<String, FieldValue> values = new LinkedHashMap<>();
        fields.forEach((name, pointer) -> {
            FieldValue value = toFieldValue(element.at(pointer));
            if (value != null) {
                values.put(name, value);
            }
        });
        return values;
    }

    private static Map<String, FieldValue> scalarMembers(JsonNode element) {
        Map<String, FieldValue> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> members = element.fields();
        while (members.hasNext()) {
            Map.Entry<String, JsonNode> member = members.next();
            if (member.getValue().isValueNode()) {
                FieldValue value = toFieldValue(member.getValue());
                if (value != null) {
                    values.put(member.getKey(), value);
                }
            }
        }
        return values;
    }

    private static FieldValue toFieldValue(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return new FieldValue.Decimal(node.decimalValue());
        }
        if (node.isBoolean()) {
            return new FieldValue.Bool(node.booleanValue());
        }
        if (node.isTextual()) {
            return new FieldValue.Text(node.textValue());
        }
        return new FieldValue.Text(node.toString());
    }

    private static JsonPointer pointer(String sourceKey, String selector) {
        try {
            return JsonPointer.compile(selector == null ? "" : selector);
        } catch (IllegalArgumentException e) {
            throw new ExtractionException(sourceKey, "Invalid JSON pointer '" + selector + "' for " + sourceKey, e);
        }
    }
}
