package de.mirkosertic.imagelocator.search;

import java.util.List;

public record SearchOutcome(
        SearchQuery query,
        List<MatchResult> results,
        int candidatesScored,
        long elapsedMs
) {

    public SearchOutcome {
        results = List.copyOf(results);
    }
}
