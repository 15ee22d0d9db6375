package de.mirkosertic.imagelocator.search;

import java.util.Arrays;
import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Brings file names and queries into the form they are compared in.
 * <p>
 * One trailing recognised extension is removed, separators ({@code _ - .} and whitespace)
 * are dropped and every character is folded to lower case. Token boundaries of the
 * original text are kept alongside: the first character, the character after a separator,
 * letter/digit changes and lower-to-upper case changes.
 */
public class FilenameNormalizer {

    private final Set<String> extensions;

    public FilenameNormalizer(final Collection<String> extensions) {
        this.extensions = extensions.stream()
                .map(extension -> extension.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public NormalizedName normalize(final String name) {
        final String base = stripExtension(name);
        final StringBuilder text = new StringBuilder(base.length());
        final boolean[] boundaries = new boolean[base.length()];

        boolean afterSeparator = false;
        char previous = 0;
        for (int i = 0; i < base.length(); i++) {
            final char c = base.charAt(i);
            if (isSeparator(c)) {
                afterSeparator = true;
                continue;
            }
            final int position = text.length();
            boundaries[position] = position == 0
                    || afterSeparator
                    || isLetterDigitChange(previous, c)
                    || (Character.isLowerCase(previous) && Character.isUpperCase(c));
            text.append(Character.toLowerCase(c));
            previous = c;
            afterSeparator = false;
        }

        return new NormalizedName(name, text.toString(), Arrays.copyOf(boundaries, text.length()));
    }

    public static boolean isSeparator(final char c) {
        return c == '_' || c == '-' || c == '.' || Character.isWhitespace(c);
    }

    private static boolean isLetterDigitChange(final char previous, final char current) {
        return (Character.isLetter(previous) && Character.isDigit(current))
                || (Character.isDigit(previous) && Character.isLetter(current));
    }

    private String stripExtension(final String name) {
        final int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return name;
        }
        final String extension = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        return extensions.contains(extension) ? name.substring(0, dot) : name;
    }
}
