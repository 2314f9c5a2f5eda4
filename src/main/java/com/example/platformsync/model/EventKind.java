package com.example.platformsync.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

public enum EventKind {

    DECLARE_PT("DECLARE_PT", "DECLAREPT"),
    CONSUMIR_VASOT("CONSUMIR_VASOT", "CONSUMIRVASOT");

    private final Set<String> aliases;

    EventKind(String... aliases) {
        this.aliases = Set.of(aliases);
    }

    /**
     * Whether the file name starts with one of this kind's aliases followed by {@code _},
     * e.g. {@code DECLARE_PT_OT100_LPN1.json} or {@code DECLAREPT_OT100_LPN1.json}.
     */
    public boolean namesFile(String fileName) {
        String normalized = fileName.toUpperCase(Locale.ROOT);
        return aliases.stream().anyMatch(alias -> normalized.startsWith(alias + "_"));
    }

    /**
     * Resolves a discriminator value (case and surrounding whitespace ignored).
     */
    public static Optional<EventKind> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(kind -> kind.aliases.contains(normalized))
                .findFirst();
    }
}
