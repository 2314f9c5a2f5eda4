package com.example.platformsync.exception;

import lombok.Getter;

/**
 * A copy-then-delete move did not complete.
 *
 * <p>When {@link #isDuplicated()} is true the copy landed at {@link #getDestinationKey()} but the
 * source could not be deleted, so the object now exists under both prefixes. The source stays
 * listed and is re-ingested on the next run, which the composite-key upsert makes a no-op.</p>
 */
@Getter
public class ArchiveException extends IngestionException {

    private final String sourceKey;
    private final String destinationKey;
    private final boolean duplicated;

    public ArchiveException(String sourceKey, String destinationKey, boolean duplicated, Throwable cause) {
        super((duplicated ? "Copied but failed to delete source " : "Failed to copy ")
                + sourceKey + " -> " + destinationKey, cause);
        this.sourceKey = sourceKey;
        this.destinationKey = destinationKey;
        this.duplicated = duplicated;
    }
}
