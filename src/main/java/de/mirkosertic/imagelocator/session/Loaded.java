package de.mirkosertic.imagelocator.session;

import de.mirkosertic.imagelocator.search.MatchResult;
import de.mirkosertic.imagelocator.search.SearchQuery;

import java.util.List;

/**
 * Results of one completed search and the page being displayed.
 */
public record Loaded(
        SearchQuery query,
        List<MatchResult> results,
        ResultPaginator<MatchResult> paginator,
        int currentPage
) implements SearchResultState {

    public static Loaded of(final SearchQuery query, final List<MatchResult> results, final int pageSize) {
        return new Loaded(query, results, new ResultPaginator<>(results, pageSize), 0);
    }

    @Override
    public boolean hasResults() {
        return !results.isEmpty();
    }

    /**
     * The same results showing another page. The page is clamped to the existing ones.
     */
    public Loaded withPage(final int page) {
        final int lastPage = Math.max(0, paginator.pageCount() - 1);
        return new Loaded(query, results, paginator, Math.max(0, Math.min(page, lastPage)));
    }

    public List<MatchResult> currentPageResults() {
        return paginator.page(currentPage);
    }
}
