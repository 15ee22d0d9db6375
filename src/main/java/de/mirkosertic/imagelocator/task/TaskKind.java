package de.mirkosertic.imagelocator.task;

/**
 * The kinds of background work. At most one task of each kind runs at a time.
 */
public enum TaskKind {

    SCAN("scan"),
    IMPORT("import"),
    SEARCH("search"),
    CLEAR("cache clear");

    private final String displayName;

    TaskKind(final String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
