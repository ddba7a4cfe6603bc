package com.enrichreview.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

import com.enrichreview.engine.core.edit.EditingOverlay;
import com.enrichreview.engine.core.edit.ValueCoercion;
import com.enrichreview.engine.core.path.FieldPath;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;

public class ValueCoercionTest {

    private final ObjectMapper om = new ObjectMapper();

    @Test
    void numberField_parsesNumbers_orFallsBackToString() {
        JsonNode pre = IntNode.valueOf(45);

        assertEquals(IntNode.valueOf(50), ValueCoercion.coerce(pre, "50"));
        assertEquals(IntNode.valueOf(50), ValueCoercion.coerce(pre, " 50 "));
        assertEquals(84.5, ValueCoercion.coerce(pre, "84.5").doubleValue());
        assertTrue(ValueCoercion.coerce(pre, "1e3").isNumber());
        assertEquals(9_000_000_000L, ValueCoercion.coerce(pre, "9000000000").longValue());
        assertEquals(TextNode.valueOf("about 50"), ValueCoercion.coerce(pre, "about 50"));
        assertEquals(TextNode.valueOf(""), ValueCoercion.coerce(pre, ""));
    }

    @Test
    void booleanField_mapsTrueFalseIgnoringCase() {
        JsonNode pre = BooleanNode.TRUE;

        assertEquals(BooleanNode.FALSE, ValueCoercion.coerce(pre, "FALSE"));
        assertEquals(BooleanNode.TRUE, ValueCoercion.coerce(pre, "True"));
        assertEquals(TextNode.valueOf("yes"), ValueCoercion.coerce(pre, "yes"));
    }

    @Test
    void nullField_acceptsNullLiteral() {
        assertEquals(NullNode.getInstance(), ValueCoercion.coerce(NullNode.getInstance(), "NULL"));
        assertEquals(TextNode.valueOf("Black"), ValueCoercion.coerce(NullNode.getInstance(), "Black"));
    }

    @Test
    void stringField_keepsRawText() throws Exception {
        assertEquals(TextNode.valueOf("42"), ValueCoercion.coerce(TextNode.valueOf("TSH-900X"), "42"));
        assertEquals(TextNode.valueOf("true"), ValueCoercion.coerce(om.readTree("{}"), "true"));
    }

    @Test
    void displayText_unquotesStrings() throws Exception {
        assertEquals("Black", ValueCoercion.displayText(TextNode.valueOf("Black")));
        assertEquals("79.99", ValueCoercion.displayText(om.readTree("79.99")));
        assertEquals("[\"a\"]", ValueCoercion.displayText(om.readTree("[\"a\"]")));
    }

    @Test
    void overlay_holdsOneEditAtATime() throws Exception {
        JsonNode doc = om.readTree("{\"offers\":{\"price\":79.99},\"color\":\"Black\"}");
        EditingOverlay overlay = new EditingOverlay();

        overlay.startEdit(FieldPath.of("color"), doc.get("color"));
        overlay.startEdit(FieldPath.of("offers", "price"), doc.at("/offers/price"));
        assertEquals(FieldPath.of("offers", "price"), overlay.current().orElseThrow().path());
        assertEquals("79.99", overlay.current().orElseThrow().text());

        overlay.updateEdit("84.5");
        JsonNode next = overlay.commitEdit(doc).orElseThrow();

        assertEquals(84.5, next.at("/offers/price").doubleValue());
        assertEquals(79.99, doc.at("/offers/price").doubleValue());
        assertTrue(overlay.current().isEmpty());
        assertTrue(overlay.commitEdit(next).isEmpty());
    }

    @Test
    void overlay_cancelDiscardsEdit() throws Exception {
        EditingOverlay overlay = new EditingOverlay();
        overlay.startEdit(FieldPath.of("color"), TextNode.valueOf("Black"));

        overlay.cancelEdit();

        assertTrue(overlay.current().isEmpty());
        assertTrue(overlay.commitEdit(om.readTree("{}")).isEmpty());
    }
}
