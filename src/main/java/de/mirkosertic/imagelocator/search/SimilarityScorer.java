package de.mirkosertic.imagelocator.search;

/**
 * Scores how well a normalized query matches a normalized file name, in [0.0, 1.0].
 * <p>
 * Every query character must appear in order in the candidate, otherwise the score is 0.0.
 * Matched characters score {@value #MATCH_SCORE}, plus {@value #RUN_OR_BOUNDARY_BONUS} when they
 * continue a contiguous run or start a token. Gaps cost {@value #GAP_OPEN_PENALTY} for the first
 * skipped character and {@value #GAP_EXTEND_PENALTY} for every further one. The result is divided by
 * the best possible score for the query length.
 * <p>
 * Two strategies are evaluated and the better one wins:
 * <ul>
 *   <li>Whole name: the alignment is scored against the candidate's own token boundaries.</li>
 *   <li>Best window: the alignment is scored as if the contiguous window it spans were the whole
 *       name, so the window start counts as a token boundary. This finds an identifier that is
 *       glued to a prefix, as in {@code scanHH001}.</li>
 * </ul>
 * An exact match after normalization scores 1.0.
 */
public class SimilarityScorer {

    static final int MATCH_SCORE = 16;
    static final int RUN_OR_BOUNDARY_BONUS = 8;
    static final int GAP_OPEN_PENALTY = 3;
    static final int GAP_EXTEND_PENALTY = 1;

    private static final int NO_ALIGNMENT = Integer.MIN_VALUE / 2;

    public double score(final NormalizedName query, final NormalizedName candidate) {
        if (query.isEmpty() || candidate.isEmpty()) {
            return 0.0;
        }
        final double best = Math.max(subsequenceScore(query, candidate), windowScore(query, candidate));
        return Math.max(0.0, Math.min(1.0, best));
    }

    double subsequenceScore(final NormalizedName query, final NormalizedName candidate) {
        return normalize(bestAlignment(query, candidate, false), query.length());
    }

    double windowScore(final NormalizedName query, final NormalizedName candidate) {
        return normalize(bestAlignment(query, candidate, true), query.length());
    }

    private static double normalize(final int alignment, final int queryLength) {
        if (alignment <= NO_ALIGNMENT / 2) {
            return 0.0;
        }
        final double maximum = (double) queryLength * (MATCH_SCORE + RUN_OR_BOUNDARY_BONUS);
        return Math.max(0.0, alignment / maximum);
    }

    /**
     * Best raw alignment score, or {@link #NO_ALIGNMENT} if the query is not a subsequence.
     * With {@code windowStart} the first matched character always earns the boundary bonus.
     */
    private static int bestAlignment(final NormalizedName query, final NormalizedName candidate,
                                     final boolean windowStart) {
        if (query.isEmpty()) {
            return NO_ALIGNMENT;
        }
        final int m = query.length();
        final int n = candidate.length();
        if (m > n) {
            return NO_ALIGNMENT;
        }

        // previous[j] / current[j]: best score with query[i] matched exactly at candidate[j]
        int[] previous = new int[n];
        int[] current = new int[n];

        for (int j = 0; j < n; j++) {
            previous[j] = query.charAt(0) == candidate.charAt(j)
                    ? MATCH_SCORE + (windowStart || candidate.isBoundary(j) ? RUN_OR_BOUNDARY_BONUS : 0)
                    : NO_ALIGNMENT;
        }

        for (int i = 1; i < m; i++) {
            final char q = query.charAt(i);
            // best score of an alignment ending before j - 1, with the gap up to j already paid
            int gapBest = NO_ALIGNMENT;
            current[0] = NO_ALIGNMENT;
            for (int j = 1; j < n; j++) {
                if (j >= 2) {
                    gapBest = Math.max(gapBest - GAP_EXTEND_PENALTY, previous[j - 2] - GAP_OPEN_PENALTY);
                }
                if (q != candidate.charAt(j)) {
                    current[j] = NO_ALIGNMENT;
                    continue;
                }
                final int contiguous = previous[j - 1] + MATCH_SCORE + RUN_OR_BOUNDARY_BONUS;
                final int afterGap = gapBest + MATCH_SCORE + (candidate.isBoundary(j) ? RUN_OR_BOUNDARY_BONUS : 0);
                final int value = Math.max(contiguous, afterGap);
                current[j] = value < NO_ALIGNMENT / 2 ? NO_ALIGNMENT : value;
            }
            final int[] swap = previous;
            previous = current;
            current = swap;
        }

        int best = NO_ALIGNMENT;
        for (int j = 0; j < n; j++) {
            best = Math.max(best, previous[j]);
        }
        return best;
    }
}
