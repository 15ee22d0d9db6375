package de.mirkosertic.imagelocator.search;

import de.mirkosertic.imagelocator.ValidationException;

/**
 * One identifier to look up and the minimum similarity a file name must reach.
 */
public record SearchQuery(String text, double threshold) {

    public static final double MIN_THRESHOLD = 0.5;
    public static final double MAX_THRESHOLD = 1.0;

    /**
     * Create a validated query.
     *
     * @throws ValidationException if the text is blank, consists of separators only,
     *                             or the threshold lies outside [0.5, 1.0]
     */
    public static SearchQuery of(final String text, final double threshold) throws ValidationException {
        if (text == null || text.isBlank()) {
            throw new ValidationException("Please enter an identifier to search for");
        }
        if (text.chars().allMatch(c -> FilenameNormalizer.isSeparator((char) c))) {
            throw new ValidationException("Search text '" + text + "' contains no searchable characters");
        }
        if (!(threshold >= MIN_THRESHOLD && threshold <= MAX_THRESHOLD)) {
            throw new ValidationException("Similarity threshold must be between "
                    + MIN_THRESHOLD + " and " + MAX_THRESHOLD + ", was " + threshold);
        }
        return new SearchQuery(text.trim(), threshold);
    }
}
