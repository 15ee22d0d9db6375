package de.mirkosertic.imagelocator.store;

import de.mirkosertic.imagelocator.StorageException;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Durable storage for indexed files and reference identifiers.
 * <p>
 * Implementations must be safe for concurrent use: writers are serialized and
 * readers never observe a partially applied batch.
 */
public interface IndexStore extends AutoCloseable {

    /**
     * Inserts the file if no record with the same path exists.
     *
     * @return true if a new record was created
     */
    default boolean upsertFile(final String path, final String name, final Instant discoveredAt) throws StorageException {
        return upsertFiles(List.of(new IndexedFile(path, name, discoveredAt))).inserted() > 0;
    }

    UpsertResult upsertFiles(Collection<IndexedFile> files) throws StorageException;

    /**
     * Inserts the identifier if no record with the same case-insensitive text exists.
     *
     * @return true if a new record was created
     */
    default boolean upsertReferenceId(final String text, final Instant importedAt) throws StorageException {
        return upsertReferenceIds(List.of(new ReferenceIdentifier(text, importedAt))).inserted() > 0;
    }

    UpsertResult upsertReferenceIds(Collection<ReferenceIdentifier> identifiers) throws StorageException;

    /**
     * Full snapshot of all indexed files, in no particular order.
     */
    List<IndexedFile> listFiles() throws StorageException;

    long countFiles() throws StorageException;

    long countReferenceIds() throws StorageException;

    /**
     * Removes every indexed file and reference identifier.
     */
    void clearAll() throws StorageException;

    /**
     * Changes whenever a write modified the stored content. Equal values mean equal content.
     */
    long generation();

    @Override
    void close() throws StorageException;
}
