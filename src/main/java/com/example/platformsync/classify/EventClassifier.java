package com.example.platformsync.classify;

import com.example.platformsync.exception.UnclassifiableEventException;
import com.example.platformsync.model.EventKind;
import com.example.platformsync.model.IngestedRecord;
import com.example.platformsync.model.ParsedEvent;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/**
 * Maps a parsed event to exactly one {@link EventKind}.
 *
 * <p>An explicit {@code tipoEvento} field always decides. Without it, the source key is the
 * discriminator: a directory segment naming a kind, or a file name starting with a kind
 * alias followed by {@code _}, e.g. {@code declare_pt/2024-01-01/evt1.json} or
 * {@code PLATAFORMA/DECLARE_PT_OT100_LPN1.json}. Anything ambiguous or unknown is rejected,
 * never guessed.</p>
 */
@Component
public class EventClassifier {

    public EventKind classify(ParsedEvent event) {
        Object declared = event.payload() == null ? null : event.payload().get(IngestedRecord.TIPO_EVENTO);
        if (declared != null) {
            return EventKind.fromCode(declared.toString())
                    .orElseThrow(() -> new UnclassifiableEventException(
                            "Unknown tipoEvento '" + declared + "' in " + event.sourceKey()));
        }

        Set<EventKind> matches = kindsNamedByKey(event.sourceKey());
        if (matches.size() == 1) {
            return matches.iterator().next();
        }
        throw new UnclassifiableEventException(matches.isEmpty()
                ? "No event discriminator in " + event.sourceKey()
                : "Ambiguous event discriminator " + matches + " in " + event.sourceKey());
    }

    private static Set<EventKind> kindsNamedByKey(String key) {
        Set<EventKind> matches = EnumSet.noneOf(EventKind.class);
        if (key == null) {
            return matches;
        }
        String[] segments = key.split("/");
        for (int i = 0; i < segments.length - 1; i++) {
            EventKind.fromCode(segments[i]).ifPresent(matches::add);
        }
        String fileName = segments[segments.length - 1];
        for (EventKind kind : EventKind.values()) {
            if (kind.namesFile(fileName)) {
                matches.add(kind);
            }
        }
        return matches;
    }
}
