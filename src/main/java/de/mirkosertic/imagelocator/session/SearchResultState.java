package de.mirkosertic.imagelocator.session;

/**
 * What the result table currently shows: nothing yet, or the results of the latest completed search.
 */
public interface SearchResultState {

    boolean hasResults();
}
