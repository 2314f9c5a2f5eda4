package com.example.platformsync.parse;

import com.example.platformsync.exception.MalformedPayloadException;
import com.example.platformsync.model.ParsedEvent;
import com.example.platformsync.model.RawObject;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class EventParserTest {

    private final EventParser parser = new EventParser(new ObjectMapper());

    @Test
    void extractsRequiredFieldsAndKeepsTheRest() {
        ParsedEvent event = parser.parse(raw("""
                {"work_order":"OT100","document_number":"D1","idlpn":"LPN1","qty":10,
                 "items":[{"sku":"A","qty":2}],"meta":{"origin":"wms"}}
                """));

        assertEquals("declare_pt/2024-01-01/evt1.json", event.sourceKey());
        assertEquals("OT100", event.workOrder());
        assertEquals("D1", event.documentNumber());
        assertEquals("LPN1", event.idlpn());
        assertEquals(10, event.payload().get("qty"));
        assertEquals(List.of(Map.of("sku", "A", "qty", 2)), event.payload().get("items"));
        assertEquals(Map.of("origin", "wms"), event.payload().get("meta"));
    }

    @Test
    void numericIdentityFieldsBecomeText() {
        ParsedEvent event = parser.parse(raw("{\"work_order\":100,\"document_number\":7,\"idlpn\":\" LPN1 \"}"));

        assertEquals("100", event.workOrder());
        assertEquals("7", event.documentNumber());
        assertEquals("LPN1", event.idlpn());
    }

    @Test
    void dropsStoreOwnedId() {
        ParsedEvent event = parser.parse(raw(
                "{\"_id\":\"abc\",\"work_order\":\"OT1\",\"document_number\":\"D1\",\"idlpn\":\"L1\"}"));

        assertFalse(event.payload().containsKey("_id"));
    }

    @Test
    void rejectsInvalidJson() {
        assertThrows(MalformedPayloadException.class, () -> parser.parse(raw("{\"work_order\": ")));
    }

    @Test
    void rejectsNonObjectPayloads() {
        assertThrows(MalformedPayloadException.class, () -> parser.parse(raw("[1,2,3]")));
        assertThrows(MalformedPayloadException.class, () -> parser.parse(raw("\"text\"")));
        assertThrows(MalformedPayloadException.class, () -> parser.parse(raw("null")));
        assertThrows(MalformedPayloadException.class, () -> parser.parse(raw("")));
    }

    @Test
    void rejectsMissingOrBlankRequiredFields() {
        assertThrows(MalformedPayloadException.class,
                () -> parser.parse(raw("{\"work_order\":\"OT1\",\"document_number\":\"D1\"}")));
        assertThrows(MalformedPayloadException.class,
                () -> parser.parse(raw("{\"work_order\":\"OT1\",\"document_number\":\"  \",\"idlpn\":\"L1\"}")));
        assertThrows(MalformedPayloadException.class,
                () -> parser.parse(raw("{\"work_order\":{\"id\":1},\"document_number\":\"D1\",\"idlpn\":\"L1\"}")));
    }

    private static RawObject raw(String json) {
        return new RawObject("declare_pt/2024-01-01/evt1.json", json.getBytes(StandardCharsets.UTF_8), Instant.now());
    }
}
