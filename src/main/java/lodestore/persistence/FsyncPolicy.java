package lodestore.persistence;

import java.util.Locale;

/**
 * When buffered AOF bytes are forced to disk. Mirrors Redis' appendfsync setting.
 */
public enum FsyncPolicy {
    /** Flush and fsync inside every append. */
    ALWAYS,
    /** Flush and fsync from the background flusher. */
    EVERYSEC,
    /** Flush from the background flusher, let the OS decide when to sync. */
    NO;

    public static FsyncPolicy parse(String value) {
        if (value == null) return EVERYSEC;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown appendfsync policy: " + value, e);
        }
    }
}
