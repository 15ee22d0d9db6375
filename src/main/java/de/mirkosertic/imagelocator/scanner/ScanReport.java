package de.mirkosertic.imagelocator.scanner;

/**
 * Outcome of one directory scan.
 *
 * @param root            the scanned root directory
 * @param filesVisited    regular files seen while walking
 * @param imageFilesFound files with a recognised image extension
 * @param newlyIndexed    files that were not in the index before this scan
 * @param totalIndexed    indexed files after the scan
 * @param elapsedMs       wall clock duration
 */
public record ScanReport(
        String root,
        long filesVisited,
        long imageFilesFound,
        long newlyIndexed,
        long totalIndexed,
        long elapsedMs
) {
}
