package de.mirkosertic.imagelocator.search;

import java.util.Arrays;

/**
 * A file name or query after normalization, together with the positions that start a token
 * in the original text.
 */
public final class NormalizedName {

    private final String original;
    private final String text;
    private final boolean[] boundaries;

    NormalizedName(final String original, final String text, final boolean[] boundaries) {
        if (text.length() != boundaries.length) {
            throw new IllegalArgumentException("Boundary flags must cover every normalized character");
        }
        this.original = original;
        this.text = text;
        this.boundaries = boundaries;
    }

    public String original() {
        return original;
    }

    public String text() {
        return text;
    }

    public int length() {
        return text.length();
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }

    public char charAt(final int index) {
        return text.charAt(index);
    }

    /**
     * True if the character at the given position starts a token in the original text.
     */
    public boolean isBoundary(final int index) {
        return boundaries[index];
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof final NormalizedName that)) {
            return false;
        }
        return text.equals(that.text) && Arrays.equals(boundaries, that.boundaries);
    }

    @Override
    public int hashCode() {
        return 31 * text.hashCode() + Arrays.hashCode(boundaries);
    }

    @Override
    public String toString() {
        return text;
    }
}
