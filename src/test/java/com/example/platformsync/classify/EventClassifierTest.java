package com.example.platformsync.classify;

import com.example.platformsync.exception.UnclassifiableEventException;
import com.example.platformsync.model.EventKind;
import com.example.platformsync.model.ParsedEvent;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class EventClassifierTest {

    private final EventClassifier classifier = new EventClassifier();

    @Test
    void explicitTipoEventoDecides() {
        assertEquals(EventKind.DECLARE_PT, classifier.classify(event("PLATAFORMA/a.json", "DECLARE_PT")));
        assertEquals(EventKind.CONSUMIR_VASOT, classifier.classify(event("PLATAFORMA/b.json", "CONSUMIR_VASOT")));
    }

    @Test
    void tipoEventoIsCaseAndWhitespaceInsensitive() {
        assertEquals(EventKind.CONSUMIR_VASOT, classifier.classify(event("PLATAFORMA/b.json", "  consumir_vasot ")));
        assertEquals(EventKind.DECLARE_PT, classifier.classify(event("PLATAFORMA/b.json", "DeclarePT")));
    }

    @Test
    void explicitTipoEventoWinsOverKeyPath() {
        assertEquals(EventKind.CONSUMIR_VASOT,
                classifier.classify(event("declare_pt/2024-01-01/evt1.json", "CONSUMIR_VASOT")));
    }

    @Test
    void unknownTipoEventoIsRejectedEvenWhenKeyNamesAKind() {
        assertThrows(UnclassifiableEventException.class,
                () -> classifier.classify(event("declare_pt/2024-01-01/evt1.json", "AJUSTE_STOCK")));
    }

    @Test
    void directorySegmentClassifiesWhenTipoEventoMissing() {
        assertEquals(EventKind.DECLARE_PT, classifier.classify(event("declare_pt/2024-01-01/evt1.json", null)));
        assertEquals(EventKind.CONSUMIR_VASOT, classifier.classify(event("consumir_vasot/evt9.json", null)));
    }

    @Test
    void fileNamePrefixClassifiesWhenTipoEventoMissing() {
        assertEquals(EventKind.DECLARE_PT,
                classifier.classify(event("2/wms/PLATAFORMA/DECLAREPT_OT100_LPN1.json", null)));
        assertEquals(EventKind.CONSUMIR_VASOT,
                classifier.classify(event("2/wms/PLATAFORMA/CONSUMIRVASOT_OT100_LPN2.json", null)));
    }

    @Test
    void underscoredKindNameAtStartOfFileNameClassifies() {
        assertEquals(EventKind.DECLARE_PT,
                classifier.classify(event("2/wms/PLATAFORMA/DECLARE_PT_OT1_LPN1.json", null)));
        assertEquals(EventKind.CONSUMIR_VASOT,
                classifier.classify(event("2/wms/PLATAFORMA/consumir_vasot_OT1_LPN1.json", null)));
    }

    @Test
    void kindNameInsideFileNameIsNotADiscriminator() {
        assertThrows(UnclassifiableEventException.class,
                () -> classifier.classify(event("2/wms/PLATAFORMA/OT1_DECLARE_PT_LPN1.json", null)));
    }

    @Test
    void noDiscriminatorIsRejected() {
        assertThrows(UnclassifiableEventException.class,
                () -> classifier.classify(event("2/wms/PLATAFORMA/evt1.json", null)));
    }

    @Test
    void conflictingKeyHintsAreRejected() {
        assertThrows(UnclassifiableEventException.class,
                () -> classifier.classify(event("declare_pt/consumir_vasot/evt1.json", null)));
    }

    private static ParsedEvent event(String key, String tipoEvento) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("work_order", "OT100");
        if (tipoEvento != null) {
            payload.put("tipoEvento", tipoEvento);
        }
        return new ParsedEvent(key, "OT100", "D1", "LPN1", payload);
    }
}
