package de.mirkosertic.imagelocator;

/**
 * Categories of user-visible failures.
 */
public enum ErrorKind {
    STORAGE,
    SCAN,
    VALIDATION,
    BUSY,
    UNEXPECTED
}
