package com.example.platformsync.parse;

import com.example.platformsync.exception.MalformedPayloadException;
import com.example.platformsync.model.IngestedRecord;
import com.example.platformsync.model.ParsedEvent;
import com.example.platformsync.model.RawObject;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes a platform JSON file. Only the identity fields are validated; everything else is
 * passed through untouched.
 */
@Component
@RequiredArgsConstructor
public class EventParser {

    private static final TypeReference<LinkedHashMap<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private static final List<String> REQUIRED_FIELDS = List.of(
            IngestedRecord.WORK_ORDER, IngestedRecord.DOCUMENT_NUMBER, IngestedRecord.IDLPN);

    private final ObjectMapper objectMapper;

    public ParsedEvent parse(RawObject raw) {
        if (raw.bytes() == null || raw.bytes().length == 0) {
            throw new MalformedPayloadException("Empty payload in " + raw.key());
        }

        LinkedHashMap<String, Object> payload;
        try {
            payload = objectMapper.readValue(raw.bytes(), PAYLOAD_TYPE);
        } catch (IOException e) {
            throw new MalformedPayloadException("Invalid JSON object in " + raw.key() + ": " + e.getMessage(), e);
        }
        if (payload == null) {
            throw new MalformedPayloadException("Payload in " + raw.key() + " is not a JSON object");
        }

        Map<String, String> required = new LinkedHashMap<>();
        for (String field : REQUIRED_FIELDS) {
            required.put(field, requiredText(payload, field, raw.key()));
        }
        payload.remove("_id");

        return new ParsedEvent(
                raw.key(),
                required.get(IngestedRecord.WORK_ORDER),
                required.get(IngestedRecord.DOCUMENT_NUMBER),
                required.get(IngestedRecord.IDLPN),
                payload);
    }

    private static String requiredText(Map<String, Object> payload, String field, String key) {
        Object value = payload.get(field);
        if (!(value instanceof String) && !(value instanceof Number)) {
            throw new MalformedPayloadException("Missing required field '" + field + "' in " + key);
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            throw new MalformedPayloadException("Blank required field '" + field + "' in " + key);
        }
        return text;
    }
}
