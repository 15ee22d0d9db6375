package de.mirkosertic.imagelocator.store;

import java.time.Instant;
import java.util.Locale;

/**
 * A known lookup key imported from an external list.
 *
 * @param text       trimmed identifier text as supplied
 * @param importedAt time of import
 */
public record ReferenceIdentifier(String text, Instant importedAt) {

    /**
     * The key used for duplicate detection. Identifiers differing only in case are duplicates.
     */
    public String key() {
        return keyOf(text);
    }

    public static String keyOf(final String text) {
        return text.trim().toLowerCase(Locale.ROOT);
    }
}
