package de.mirkosertic.imagelocator.store;

/**
 * Outcome of a batch upsert. Records that were already present are skipped, not failed.
 */
public record UpsertResult(int inserted, int skipped) {

    public static final UpsertResult EMPTY = new UpsertResult(0, 0);

    public UpsertResult plus(final UpsertResult other) {
        return new UpsertResult(inserted + other.inserted, skipped + other.skipped);
    }
}
