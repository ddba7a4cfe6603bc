package com.enrichreview.engine;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

import com.enrichreview.engine.core.diff.DiffKind;
import com.enrichreview.engine.core.path.FieldPath;
import com.enrichreview.engine.core.pipeline.DocumentPair;
import com.enrichreview.engine.core.session.ExportNotReadyException;
import com.enrichreview.engine.core.session.ReviewSession;
import com.enrichreview.engine.core.validation.EffectiveState;
import com.enrichreview.engine.core.validation.ValidationDecision;
import com.enrichreview.engine.core.validation.ValidationState;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

public class ReviewSessionTest {

    private final ObjectMapper om = new ObjectMapper();

    private ReviewSession open(String original, String enriched) throws Exception {
        return ReviewSession.open(new DocumentPair(om.readTree(original), om.readTree(enriched)));
    }

    @Test
    void export_isGatedOnPendingFields() throws Exception {
        ReviewSession s = open("{\"name\":\"A\",\"price\":10}", "{\"name\":\"A\",\"price\":12,\"color\":\"red\"}");

        assertEquals(List.of("price", "color"), s.collectPendingFields());
        assertFalse(s.isExportReady());
        ExportNotReadyException e = assertThrows(ExportNotReadyException.class, s::export);
        assertEquals(List.of("price", "color"), e.pendingFields());
        assertEquals("2 fields pending validation", e.getMessage());

        s.decide(ValidationDecision.approve("price"));
        s.decide(ValidationDecision.decline("color"));

        assertTrue(s.isExportReady());
        assertEquals(om.readTree("{\"name\":\"A\",\"price\":12}"), s.export());
    }

    @Test
    void queries_reportDiffAndDecisions() throws Exception {
        ReviewSession s = open("{\"offers\":{\"price\":10,\"currency\":\"USD\"}}",
                "{\"offers\":{\"price\":12,\"currency\":\"USD\"}}");

        FieldPath price = FieldPath.of("offers", "price");
        assertEquals(DiffKind.MODIFIED, s.getDiffKind(price));
        assertEquals(DiffKind.UNCHANGED, s.getDiffKind(FieldPath.of("offers", "currency")));
        assertEquals(10, s.getOriginalValue(price).orElseThrow().intValue());
        assertEquals(ValidationState.PENDING, s.getValidationState(price));

        s.decide(ValidationDecision.approve("offers.price"));
        assertEquals(ValidationState.APPROVED, s.getValidationState(price));
        assertEquals(EffectiveState.MIXED, s.getEffectiveState(FieldPath.of("offers")));

        assertEquals(2, s.approveAll(FieldPath.of("offers")));
        assertEquals(EffectiveState.FULLY_APPROVED, s.getEffectiveState(FieldPath.of("offers")));
    }

    @Test
    void approveAll_onChangedArrayAndNewObject_opensExport() throws Exception {
        ReviewSession s = open("{\"image\":[\"a\"]}", "{\"image\":[\"a\",\"b\"],\"offers\":{\"price\":1}}");
        assertEquals(List.of("image", "offers"), s.collectPendingFields());

        s.approveAll(FieldPath.of("image"));
        s.approveAll(FieldPath.of("offers"));

        assertTrue(s.collectPendingFields().isEmpty());
        assertTrue(s.isExportReady());
        assertEquals(EffectiveState.FULLY_APPROVED, s.getEffectiveState(FieldPath.of("image")));
        assertEquals(EffectiveState.FULLY_APPROVED, s.getEffectiveState(FieldPath.of("offers")));
        assertEquals(om.readTree("{\"image\":[\"a\",\"b\"],\"offers\":{\"price\":1}}"), s.export());
    }

    @Test
    void approvingOnlyElements_ofNewObject_keepsItPending() throws Exception {
        ReviewSession s = open("{}", "{\"offers\":{\"price\":1}}");

        s.decide(ValidationDecision.approve("offers.price"));

        assertEquals(List.of("offers"), s.collectPendingFields());
        assertEquals(EffectiveState.MIXED, s.getEffectiveState(FieldPath.of("offers")));
    }

    @Test
    void commitEdit_rediffs_andKeepsDecisions() throws Exception {
        ReviewSession s = open("{\"price\":10,\"name\":\"A\"}", "{\"price\":12,\"name\":\"A\"}");
        s.decide(ValidationDecision.approve("price"));

        s.startEdit(FieldPath.of("price"));
        assertEquals("12", s.editingCursor().orElseThrow().text());
        s.updateEdit("10");
        assertTrue(s.commitEdit());

        assertEquals(10, s.enrichedDoc().get("price").intValue());
        assertEquals(DiffKind.UNCHANGED, s.getDiffKind(FieldPath.of("price")));
        assertEquals(ValidationState.APPROVED, s.getValidationState(FieldPath.of("price")));
        assertTrue(s.editingCursor().isEmpty());
        assertFalse(s.commitEdit());
    }

    @Test
    void editToNewPath_createsIntermediates_andShowsAsNew() throws Exception {
        ReviewSession s = open("{\"name\":\"A\"}", "{\"name\":\"A\"}");

        s.startEdit(FieldPath.of("weight", "unitCode"), null);
        s.updateEdit("GRM");
        s.commitEdit();

        assertEquals("GRM", s.enrichedDoc().at("/weight/unitCode").asText());
        assertEquals(DiffKind.NEW, s.getDiffKind(FieldPath.of("weight")));
        assertEquals(List.of("weight"), s.collectPendingFields());
    }

    @Test
    void removeField_rediffs_andClearsCursor() throws Exception {
        ReviewSession s = open("{\"name\":\"A\"}", "{\"name\":\"A\",\"color\":\"red\",\"image\":[\"a\",\"b\"]}");
        s.startEdit(FieldPath.of("name"));

        s.removeField(FieldPath.of("color"));
        s.removeField(FieldPath.parse("image.[0]"));

        assertFalse(s.enrichedDoc().has("color"));
        assertEquals(om.readTree("[\"b\"]"), s.enrichedDoc().get("image"));
        assertEquals(List.of("image"), s.collectPendingFields());
        assertTrue(s.editingCursor().isEmpty());
    }

    @Test
    void removeField_missingPath_changesNothing() throws Exception {
        ReviewSession s = open("{\"name\":\"A\"}", "{\"name\":\"A\",\"color\":\"red\"}");
        JsonNode before = s.enrichedDoc();
        s.startEdit(FieldPath.of("color"));

        s.removeField(FieldPath.of("offers", "price"));

        assertSame(before, s.enrichedDoc());
        assertTrue(s.editingCursor().isPresent());
    }

    @Test
    void resetValidation_restoresOpeningState() throws Exception {
        ReviewSession s = open("{\"price\":10}", "{\"price\":12,\"color\":\"red\"}");
        s.decide(ValidationDecision.decline("price"));
        s.removeField(FieldPath.of("color"));

        s.resetValidation();

        assertEquals(ValidationState.PENDING, s.getValidationState(FieldPath.of("price")));
        assertEquals("red", s.enrichedDoc().get("color").asText());
        assertEquals(List.of("price", "color"), s.collectPendingFields());
    }

    @Test
    void open_copiesTheCallersDocuments() throws Exception {
        JsonNode enriched = om.readTree("{\"price\":12}");
        ReviewSession s = ReviewSession.open(new DocumentPair(om.readTree("{\"price\":10}"), enriched));

        ((ObjectNode) enriched).put("price", 99);

        assertEquals(12, s.enrichedDoc().get("price").intValue());
    }

    @Test
    void generate_ignoresGate() throws Exception {
        ReviewSession s = open("{\"price\":10}", "{\"price\":12}");

        assertEquals(12, s.generate().get("price").intValue());
    }
}
