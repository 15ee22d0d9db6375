package de.mirkosertic.imagelocator.session;

public record NoSearchYet() implements SearchResultState {

    @Override
    public boolean hasResults() {
        return false;
    }
}
