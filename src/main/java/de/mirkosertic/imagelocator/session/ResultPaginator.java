package de.mirkosertic.imagelocator.session;

import java.util.Collections;
import java.util.List;

/**
 * Fixed-size pages over a result list. Pages are views of the list, nothing is copied.
 */
public final class ResultPaginator<T> {

    private final List<T> items;
    private final int pageSize;

    public ResultPaginator(final List<T> items, final int pageSize) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("Page size must be positive, was " + pageSize);
        }
        this.items = Collections.unmodifiableList(items);
        this.pageSize = pageSize;
    }

    public int pageCount() {
        return (items.size() + pageSize - 1) / pageSize;
    }

    /**
     * The items of the given zero-based page. Page 0 of an empty list is empty.
     *
     * @throws IndexOutOfBoundsException if the page does not exist
     */
    public List<T> page(final int pageIndex) {
        if (pageIndex == 0 && items.isEmpty()) {
            return List.of();
        }
        if (pageIndex < 0 || pageIndex >= pageCount()) {
            throw new IndexOutOfBoundsException("Page " + pageIndex + " out of range, " + pageCount() + " pages available");
        }
        final int from = pageIndex * pageSize;
        return items.subList(from, Math.min(items.size(), from + pageSize));
    }

    public int pageSize() {
        return pageSize;
    }

    public int totalItems() {
        return items.size();
    }

    public List<T> items() {
        return items;
    }
}
