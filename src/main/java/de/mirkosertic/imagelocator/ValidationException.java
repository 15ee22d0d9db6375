package de.mirkosertic.imagelocator;

/**
 * Malformed input, raised before any work begins.
 */
public class ValidationException extends LocatorException {

    public ValidationException(final String message) {
        super(ErrorKind.VALIDATION, message);
    }

    public ValidationException(final String message, final Throwable cause) {
        super(ErrorKind.VALIDATION, message, cause);
    }
}
