package de.mirkosertic.imagelocator.search;

import de.mirkosertic.imagelocator.store.IndexedFile;

import java.util.Comparator;

/**
 * An indexed file that cleared the threshold of one search, with its score.
 */
public record MatchResult(IndexedFile file, String normalizedName, double score) {

    /**
     * Score descending, then normalized name, then path.
     */
    public static final Comparator<MatchResult> RANKING = Comparator
            .comparingDouble(MatchResult::score).reversed()
            .thenComparing(MatchResult::normalizedName)
            .thenComparing(result -> result.file().path());
}
