package com.scrapesentinel.core.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scrapesentinel.core.model.ItemRecord;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;

class JsonUtilsTest {
    @Test
    void objectMapperIsSharedAndLenient() throws Exception {
        ObjectMapper mapper = JsonUtils.objectMapper();

        assertSame(mapper, JsonUtils.objectMapper());
        assertFalse(mapper.isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));

        Payload parsed = mapper.readValue(
                "{\"name\":\"ok\",\"at\":\"2026-02-01T00:00:00Z\",\"every\":\"PT30S\",\"unknown\":1}",
                Payload.class
        );
        assertEquals(Instant.parse("2026-02-01T00:00:00Z"), parsed.at());
        assertEquals(Duration.ofSeconds(30), parsed.every());
    }

    @Test
    void instantsAreWrittenAsIsoStrings() throws Exception {
        String json = JsonUtils.objectMapper().writeValueAsString(
                new Payload("ok", Instant.parse("2026-02-01T00:00:00Z"), null));

        JsonNode tree = JsonUtils.objectMapper().readTree(json);
        assertEquals("2026-02-01T00:00:00Z", tree.get("at").asText());
        assertFalse(tree.has("every"));
    }

    @Test
    void itemRecordsSerializeAsPlainObjects() throws Exception {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("name", "Widget");
        values.put("price", new BigDecimal("9.99"));
        values.put("inStock", true);

        JsonNode tree = JsonUtils.objectMapper().valueToTree(ItemRecord.of(values));

        assertEquals("Widget", tree.get("name").asText());
        assertEquals(new BigDecimal("9.99"), tree.get("price").decimalValue());
        assertEquals(true, tree.get("inStock").asBoolean());
    }

    private record Payload(String name, Instant at, Duration every) {
    }
}
