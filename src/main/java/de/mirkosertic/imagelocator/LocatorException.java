package de.mirkosertic.imagelocator;

/**
 * Base class of all failures surfaced to the interactive layer.
 * The message is shown to the user as is.
 */
public abstract class LocatorException extends Exception {

    private final ErrorKind kind;

    protected LocatorException(final ErrorKind kind, final String message) {
        super(message);
        this.kind = kind;
    }

    protected LocatorException(final ErrorKind kind, final String message, final Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
