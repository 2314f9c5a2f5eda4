package com.example.platformsync.storage;

import com.example.platformsync.exception.ArchiveException;
import com.example.platformsync.exception.ObjectNotFoundException;
import com.example.platformsync.model.RawObject;

import java.util.stream.Stream;

public interface ObjectStoreClient {

    /**
     * Lazily lists object keys under {@code prefix}. Pages are requested as the stream is consumed;
     * directory markers are never returned. The stream must be closed.
     */
    Stream<String> list(String prefix);

    /**
     * @throws ObjectNotFoundException if the key no longer exists
     */
    RawObject fetch(String key);

    /**
     * Copies {@code sourceKey} under {@code destPrefix} (keeping its path relative to the source
     * prefix), then deletes the source. Not atomic.
     *
     * @return the destination key
     * @throws ArchiveException if either phase fails; {@code duplicated} is set when only the delete failed
     * @throws ObjectNotFoundException if the source vanished before the copy
     */
    String move(String sourceKey, String destPrefix);
}
