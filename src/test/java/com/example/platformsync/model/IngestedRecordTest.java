package com.example.platformsync.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class IngestedRecordTest {

    private static final Instant NOW = Instant.parse("2024-01-01T12:00:00Z");

    @Test
    void compositeKeyIsStageWorkOrderDocumentNumberIdlpn() {
        IngestedRecord record = IngestedRecord.of(event(Map.of("qty", 10)), EventKind.DECLARE_PT, "qa", NOW);

        assertEquals(List.of("stage", "work_order", "document_number", "idlpn"),
                List.copyOf(record.compositeKey().keySet()));
        assertEquals(Map.of("stage", "qa", "work_order", "OT100", "document_number", "D1", "idlpn", "LPN1"),
                record.compositeKey());
    }

    @Test
    void documentCarriesPayloadAndProvenance() {
        Map<String, Object> document = IngestedRecord.of(event(Map.of("qty", 10)), EventKind.DECLARE_PT, "qa", NOW)
                .toDocument();

        assertEquals(10, document.get("qty"));
        assertEquals("declare_pt/2024-01-01/evt1.json", document.get("source_s3_key"));
        assertEquals(Date.from(NOW), document.get("ingested_at"));
        assertEquals("DECLARE_PT", document.get("tipoEvento"));
        assertEquals("qa", document.get("stage"));
        assertEquals("OT100", document.get("work_order"));
    }

    @Test
    void systemFieldsOverridePayloadValues() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("stage", "prod");
        payload.put("tipoEvento", "declarept");
        payload.put("source_s3_key", "elsewhere.json");

        Map<String, Object> document = IngestedRecord.of(event(payload), EventKind.DECLARE_PT, "qa", NOW).toDocument();

        assertEquals("qa", document.get("stage"));
        assertEquals("DECLARE_PT", document.get("tipoEvento"));
        assertEquals("declare_pt/2024-01-01/evt1.json", document.get("source_s3_key"));
    }

    @Test
    void identityFieldsAreStoredAsTheTextUsedInTheFilter() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("work_order", 100);
        payload.put("document_number", 7);
        payload.put("idlpn", "LPN1");
        ParsedEvent numeric = new ParsedEvent("declare_pt/evt1.json", "100", "7", "LPN1", payload);

        IngestedRecord record = IngestedRecord.of(numeric, EventKind.DECLARE_PT, "qa", NOW);
        Map<String, Object> document = record.toDocument();

        assertEquals("100", document.get("work_order"));
        assertEquals("7", document.get("document_number"));
        record.compositeKey().forEach((field, value) -> assertEquals(value, document.get(field)));
    }

    private static ParsedEvent event(Map<String, Object> payload) {
        return new ParsedEvent("declare_pt/2024-01-01/evt1.json", "OT100", "D1", "LPN1", payload);
    }
}
