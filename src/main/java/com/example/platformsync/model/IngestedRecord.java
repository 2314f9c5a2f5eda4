package com.example.platformsync.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Document persisted for one platform event.
 * Identity is the composite key (stage, work_order, document_number, idlpn).
 */
@Data
@Builder
public class IngestedRecord {

    public static final String STAGE = "stage";
    public static final String WORK_ORDER = "work_order";
    public static final String DOCUMENT_NUMBER = "document_number";
    public static final String IDLPN = "idlpn";
    public static final String SOURCE_S3_KEY = "source_s3_key";
    public static final String INGESTED_AT = "ingested_at";
    public static final String TIPO_EVENTO = "tipoEvento";

    private String stage;

    private String workOrder;

    private String documentNumber;

    private String idlpn;

    private String sourceS3Key;

    private Instant ingestedAt;

    private EventKind tipoEvento;

    // opaque passthrough of the original payload
    private Map<String, Object> payload;

    public static IngestedRecord of(ParsedEvent event, EventKind kind, String stage, Instant ingestedAt) {
        return IngestedRecord.builder()
                .stage(stage)
                .workOrder(event.workOrder())
                .documentNumber(event.documentNumber())
                .idlpn(event.idlpn())
                .sourceS3Key(event.sourceKey())
                .ingestedAt(ingestedAt)
                .tipoEvento(kind)
                .payload(event.payload())
                .build();
    }

    public Map<String, Object> compositeKey() {
        Map<String, Object> filter = new LinkedHashMap<>();
        filter.put(STAGE, stage);
        filter.put(WORK_ORDER, workOrder);
        filter.put(DOCUMENT_NUMBER, documentNumber);
        filter.put(IDLPN, idlpn);
        return filter;
    }

    /**
     * Full replacement document: payload fields first, system fields on top.
     *
     * <p>{@code work_order}, {@code document_number} and {@code idlpn} are always stored as text,
     * even when the payload carried them as numbers. The stored values must equal the
     * {@link #compositeKey()} filter, since a replace-upsert inserts the replacement as-is; a numeric
     * value would never match the text filter on the next run and the record would be duplicated.</p>
     */
    public Map<String, Object> toDocument() {
        Map<String, Object> document = new LinkedHashMap<>();
        if (payload != null) {
            document.putAll(payload);
        }
        document.put(WORK_ORDER, workOrder);
        document.put(DOCUMENT_NUMBER, documentNumber);
        document.put(IDLPN, idlpn);
        document.put(SOURCE_S3_KEY, sourceS3Key);
        document.put(INGESTED_AT, Date.from(ingestedAt));
        document.put(TIPO_EVENTO, tipoEvento.name());
        document.put(STAGE, stage);
        return document;
    }
}
