package de.mirkosertic.imagelocator;

/**
 * The scan root does not exist, is not a directory or cannot be read.
 */
public class ScanException extends LocatorException {

    public ScanException(final String message) {
        super(ErrorKind.SCAN, message);
    }

    public ScanException(final String message, final Throwable cause) {
        super(ErrorKind.SCAN, message, cause);
    }
}
