package de.mirkosertic.imagelocator;

/**
 * The index directory is unreachable, locked by another process or corrupt.
 */
public class StorageException extends LocatorException {

    public StorageException(final String message) {
        super(ErrorKind.STORAGE, message);
    }

    public StorageException(final String message, final Throwable cause) {
        super(ErrorKind.STORAGE, message, cause);
    }
}
