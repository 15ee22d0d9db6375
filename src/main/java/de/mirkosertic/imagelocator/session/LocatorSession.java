package de.mirkosertic.imagelocator.session;

import de.mirkosertic.imagelocator.BusyException;
import de.mirkosertic.imagelocator.ValidationException;
import de.mirkosertic.imagelocator.export.ResultExporter;
import de.mirkosertic.imagelocator.export.ResultRow;
import de.mirkosertic.imagelocator.importer.ImportReport;
import de.mirkosertic.imagelocator.reveal.FileRevealer;
import de.mirkosertic.imagelocator.scanner.ScanReport;
import de.mirkosertic.imagelocator.search.MatchResult;
import de.mirkosertic.imagelocator.search.SearchOutcome;
import de.mirkosertic.imagelocator.search.SearchQuery;
import de.mirkosertic.imagelocator.task.ClearReport;
import de.mirkosertic.imagelocator.task.TaskCompleted;
import de.mirkosertic.imagelocator.task.TaskFailed;
import de.mirkosertic.imagelocator.task.TaskKind;
import de.mirkosertic.imagelocator.task.TaskMessage;
import de.mirkosertic.imagelocator.task.TaskOrchestrator;
import de.mirkosertic.imagelocator.task.TaskProgress;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * State of the interactive layer.
 * <p>
 * Owns the displayed results, the page cursor and the status texts. All methods are meant to be
 * called from the interactive thread only; background work is reached through the
 * {@link TaskOrchestrator} and its results arrive via {@link #pump()}.
 */
public class LocatorSession {

    private static final Logger logger = LoggerFactory.getLogger(LocatorSession.class);

    private final TaskOrchestrator orchestrator;
    private final ResultExporter exporter;
    private final FileRevealer revealer;
    private final int pageSize;
    private final double defaultThreshold;

    private SearchResultState resultState = new NoSearchYet();
    private @Nullable ScanReport lastScanReport;
    private @Nullable ImportReport lastImportReport;
    private long indexedFileCount;
    private long referenceIdCount;
    private @Nullable String progressText;
    private @Nullable String statusMessage;
    private @Nullable String errorMessage;

    public LocatorSession(final TaskOrchestrator orchestrator,
                          final ResultExporter exporter,
                          final FileRevealer revealer,
                          final int pageSize,
                          final double defaultThreshold) {
        this.orchestrator = orchestrator;
        this.exporter = exporter;
        this.revealer = revealer;
        this.pageSize = pageSize;
        this.defaultThreshold = defaultThreshold;
    }

    /**
     * Handle all messages delivered since the last call. Never blocks.
     *
     * @return the number of messages handled
     */
    public int pump() {
        final List<TaskMessage> messages = orchestrator.drain();
        for (final TaskMessage message : messages) {
            dispatch(message);
        }
        return messages.size();
    }

    private void dispatch(final TaskMessage message) {
        if (message instanceof final TaskProgress progress) {
            progressText = progress.ticket().kind().displayName() + ": " + progress.processed()
                    + " / " + progress.total() + " (" + progress.percent() + "%)";
        } else if (message instanceof final TaskCompleted completed) {
            progressText = null;
            onCompleted(completed);
        } else if (message instanceof final TaskFailed failed) {
            progressText = null;
            statusMessage = null;
            errorMessage = failed.message();
            logger.debug("Showing {} failure: {}", failed.ticket().kind().displayName(), failed.message());
        } else {
            logger.warn("Ignoring unknown message {}", message);
        }
    }

    private void onCompleted(final TaskCompleted completed) {
        switch (completed.ticket().kind()) {
            case SCAN -> {
                lastScanReport = completed.payload(ScanReport.class);
                indexedFileCount = lastScanReport.totalIndexed();
                statusMessage = "Scan finished: " + lastScanReport.newlyIndexed() + " new files, "
                        + lastScanReport.totalIndexed() + " indexed";
            }
            case IMPORT -> {
                lastImportReport = completed.payload(ImportReport.class);
                referenceIdCount += lastImportReport.imported();
                statusMessage = "Import finished: " + lastImportReport.imported() + " imported, "
                        + lastImportReport.skippedDuplicates() + " duplicates skipped";
                if (lastImportReport.hasErrors()) {
                    errorMessage = lastImportReport.rejected() + " records rejected, first: "
                            + lastImportReport.errors().get(0);
                }
            }
            case SEARCH -> {
                final SearchOutcome outcome = completed.payload(SearchOutcome.class);
                resultState = Loaded.of(outcome.query(), outcome.results(), pageSize);
                statusMessage = outcome.results().isEmpty()
                        ? "No matches found for '" + outcome.query().text() + "'"
                        : "Found " + outcome.results().size() + " matches for '" + outcome.query().text() + "'";
            }
            case CLEAR -> {
                final ClearReport report = completed.payload(ClearReport.class);
                resultState = new NoSearchYet();
                lastScanReport = null;
                lastImportReport = null;
                indexedFileCount = 0;
                referenceIdCount = 0;
                statusMessage = "Cache cleared: " + report.removedFiles() + " files and "
                        + report.removedReferenceIds() + " identifiers removed";
            }
        }
    }

    public boolean requestScan(final Path root) {
        return request(() -> orchestrator.submitScan(root), "Scanning " + root + "...");
    }

    public boolean requestImport(final List<String> identifiers) {
        return request(() -> orchestrator.submitImport(identifiers), "Importing identifiers...");
    }

    public boolean requestImportCsv(final Path csvFile, final String column) {
        return request(() -> orchestrator.submitImportCsv(csvFile, column), "Importing " + csvFile + "...");
    }

    public boolean requestSearch(final String text) {
        return requestSearch(text, defaultThreshold);
    }

    public boolean requestSearch(final String text, final double threshold) {
        final SearchQuery query;
        try {
            query = SearchQuery.of(text, threshold);
        } catch (final ValidationException e) {
            errorMessage = e.getMessage();
            return false;
        }
        return request(() -> orchestrator.submitSearch(query), "Searching for '" + query.text() + "'...");
    }

    public boolean requestClear() {
        return request(orchestrator::submitClear, "Clearing cache...");
    }

    @FunctionalInterface
    private interface Submission {
        void submit() throws BusyException;
    }

    private boolean request(final Submission submission, final String pendingStatus) {
        try {
            submission.submit();
            errorMessage = null;
            statusMessage = pendingStatus;
            return true;
        } catch (final BusyException e) {
            errorMessage = e.getMessage();
            return false;
        }
    }

    public boolean nextPage() {
        return goToPage(currentPage() + 1);
    }

    public boolean previousPage() {
        return goToPage(currentPage() - 1);
    }

    /**
     * Show another page of the current results.
     *
     * @return true if the displayed page changed
     */
    public boolean goToPage(final int page) {
        if (!(resultState instanceof final Loaded loaded)) {
            return false;
        }
        final Loaded moved = loaded.withPage(page);
        if (moved.currentPage() == loaded.currentPage()) {
            return false;
        }
        resultState = moved;
        return true;
    }

    public int currentPage() {
        return resultState instanceof final Loaded loaded ? loaded.currentPage() : 0;
    }

    public int pageCount() {
        return resultState instanceof final Loaded loaded ? loaded.paginator().pageCount() : 0;
    }

    public List<ResultRow> currentPageRows() {
        if (resultState instanceof final Loaded loaded) {
            return loaded.currentPageResults().stream().map(ResultRow::of).toList();
        }
        return List.of();
    }

    public List<ResultRow> allRows() {
        if (resultState instanceof final Loaded loaded) {
            return loaded.results().stream().map(ResultRow::of).toList();
        }
        return List.of();
    }

    /**
     * Write the complete current result list as CSV.
     *
     * @return false if there was nothing to export or writing failed, see {@link #getErrorMessage()}
     */
    public boolean exportResults(final Path target) {
        if (!resultState.hasResults()) {
            errorMessage = "No search results to export";
            return false;
        }
        try {
            exporter.export(allRows(), target);
            errorMessage = null;
            statusMessage = "Results exported to " + target;
            return true;
        } catch (final IOException e) {
            logger.error("Failed to export results to {}", target, e);
            errorMessage = "Failed to export results: " + e.getMessage();
            return false;
        }
    }

    public void revealFile(final MatchResult result) {
        try {
            revealer.reveal(Path.of(result.file().path()));
        } catch (final IOException e) {
            logger.warn("Could not reveal {}: {}", result.file().path(), e.getMessage());
        }
    }

    /**
     * Counts known when the session starts; afterwards they follow the completed tasks.
     */
    public void setIndexCounts(final long indexedFiles, final long referenceIds) {
        this.indexedFileCount = indexedFiles;
        this.referenceIdCount = referenceIds;
    }

    public boolean isBusy(final TaskKind kind) {
        return orchestrator.isRunning(kind);
    }

    public boolean isIdle() {
        return !orchestrator.isAnyRunning();
    }

    public SearchResultState getResultState() {
        return resultState;
    }

    public @Nullable ScanReport getLastScanReport() {
        return lastScanReport;
    }

    public @Nullable ImportReport getLastImportReport() {
        return lastImportReport;
    }

    public long getIndexedFileCount() {
        return indexedFileCount;
    }

    public long getReferenceIdCount() {
        return referenceIdCount;
    }

    public @Nullable String getProgressText() {
        return progressText;
    }

    public @Nullable String getStatusMessage() {
        return statusMessage;
    }

    public @Nullable String getErrorMessage() {
        return errorMessage;
    }
}
