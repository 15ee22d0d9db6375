package de.mirkosertic.imagelocator.store;

import java.time.Instant;

/**
 * One image file discovered below a scanned root.
 *
 * @param path         absolute path, unique across the store
 * @param name         file name as displayed to the user
 * @param discoveredAt time of first discovery
 */
public record IndexedFile(String path, String name, Instant discoveredAt) {
}
