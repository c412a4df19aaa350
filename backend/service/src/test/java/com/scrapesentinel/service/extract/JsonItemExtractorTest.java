package com.scrapesentinel.service.extract;

import com.scrapesentinel.core.error.ExtractionException;
import com.scrapesentinel.core.model.ExtractionResult;
import com.scrapesentinel.core.model.FieldValue;
import com.scrapesentinel.core.model.ItemRecord;
import com.scrapesentinel.core.model.SelectorSpec;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonItemExtractorTest {
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String CATALOG = """
            {
              "products": [
                {"title": "Widget", "price": 9.99, "stock": {"available": true}, "tags": ["a"]},
                {"title": "Gadget", "price": "$19.99", "stock": {"available": false}},
                {"title": "Gizmo", "price": null}
              ]
            }
            """;

    private final JsonItemExtractor extractor = new JsonItemExtractor(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void selectsFieldsWithJsonPointers() {
        SelectorSpec selectors = new SelectorSpec("/products", Map.of(
                "name", "/title",
                "price", "/price",
                "inStock", "/stock/available"
        ));

        ExtractionResult result = extractor.extract("shop", CATALOG, selectors);

        assertEquals("shop", result.sourceKey());
        assertEquals(NOW, result.extractedAt());
        assertEquals(3, result.items().size());
        ItemRecord widget = result.items().get(0);
        assertEquals(new FieldValue.Text("Widget"), widget.get("name").orElseThrow());
        assertEquals(new FieldValue.Decimal(new BigDecimal("9.99")), widget.get("price").orElseThrow());
        assertEquals(new FieldValue.Bool(true), widget.get("inStock").orElseThrow());
        assertEquals(new FieldValue.Text("$19.99"), result.items().get(1).get("price").orElseThrow());
        assertTrue(result.items().get(2).get("price").isEmpty());
    }

    @Test
    void withoutFieldSelectorsTakesScalarMembers() {
        ExtractionResult result = extractor.extract("shop", CATALOG, new SelectorSpec("/products", Map.of()));

        ItemRecord widget = result.items().get(0);
        assertEquals(Map.of("title", "Widget", "price", new BigDecimal("9.99")), widget.plainValues());
        assertFalse(widget.get("stock").isPresent());
    }

    @Test
    void rootArrayIsSelectedByEmptyPointer() {
        ExtractionResult result = extractor.extract("todos", "[{\"id\":1,\"done\":false},{\"id\":2,\"done\":true}]",
                new SelectorSpec("", Map.of()));

        assertEquals(2, result.items().size());
        assertEquals(new FieldValue.Bool(true), result.items().get(1).get("done").orElseThrow());
    }

    @Test
    void malformedContentOrSelectorIsAnExtractionFailure() {
        SelectorSpec selectors = new SelectorSpec("/products", Map.of());

        ExtractionException notJson = assertThrows(ExtractionException.class,
                () -> extractor.extract("shop", "<html>maintenance</html>", selectors));
        ExtractionException notArray = assertThrows(ExtractionException.class,
                () -> extractor.extract("shop", "{\"products\":{}}", selectors));
        assertThrows(ExtractionException.class,
                () -> extractor.extract("shop", CATALOG, new SelectorSpec("products", Map.of())));

        assertTrue(notJson.retryable());
        assertEquals("shop", notArray.sourceKey());
        assertTrue(notArray.getMessage().contains("/products"));
    }
}
