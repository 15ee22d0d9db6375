package de.mirkosertic.imagelocator;

import de.mirkosertic.imagelocator.config.ApplicationConfig;
import de.mirkosertic.imagelocator.config.BuildInfo;
import de.mirkosertic.imagelocator.config.LoggingConfigurator;
import de.mirkosertic.imagelocator.export.ResultExporter;
import de.mirkosertic.imagelocator.export.ResultRow;
import de.mirkosertic.imagelocator.importer.CsvIdentifierReader;
import de.mirkosertic.imagelocator.importer.IdentifierImporter;
import de.mirkosertic.imagelocator.reveal.DesktopFileRevealer;
import de.mirkosertic.imagelocator.scanner.DirectoryScanner;
import de.mirkosertic.imagelocator.scanner.ImageFileMatcher;
import de.mirkosertic.imagelocator.search.FilenameNormalizer;
import de.mirkosertic.imagelocator.search.SearchEngine;
import de.mirkosertic.imagelocator.search.SimilarityScorer;
import de.mirkosertic.imagelocator.session.LocatorSession;
import de.mirkosertic.imagelocator.store.LuceneIndexStore;
import de.mirkosertic.imagelocator.task.TaskOrchestrator;
import de.mirkosertic.imagelocator.task.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Main entry point of the image locator.
 * Wires all services and runs one command through the interactive session.
 */
public class ImageLocatorApplication {

    private static final Logger logger = LoggerFactory.getLogger(ImageLocatorApplication.class);

    private final ApplicationConfig config;
    private final LuceneIndexStore indexStore;
    private final WorkerPool workerPool;
    private final TaskOrchestrator orchestrator;
    private final LocatorSession session;

    public ImageLocatorApplication(final ApplicationConfig config) {
        this.config = config;

        // Initialize services in dependency order
        this.indexStore = new LuceneIndexStore(Paths.get(config.getIndexPath()));
        this.workerPool = new WorkerPool("worker", config.getWorkerPoolSize());
        final WorkerPool taskPool = new WorkerPool("task", config.getTaskPoolSize());

        final DirectoryScanner scanner = new DirectoryScanner(
                indexStore,
                workerPool,
                new ImageFileMatcher(config.getImageExtensions(), config.getExcludePatterns()),
                config.getScanBatchSize()
        );

        final IdentifierImporter importer = new IdentifierImporter(indexStore);

        final SearchEngine searchEngine = new SearchEngine(
                indexStore,
                workerPool,
                new FilenameNormalizer(config.getImageExtensions()),
                new SimilarityScorer()
        );

        this.orchestrator = new TaskOrchestrator(
                indexStore,
                scanner,
                importer,
                new CsvIdentifierReader(),
                searchEngine,
                taskPool
        );

        this.session = new LocatorSession(
                orchestrator,
                new ResultExporter(),
                new DesktopFileRevealer(),
                config.getPageSize(),
                config.getDefaultThreshold()
        );
    }

    /**
     * Open the index. An index written with another schema version is cleared, it is rebuilt by scanning again.
     */
    public void init() throws StorageException {
        logger.info("Initializing image locator {}...", BuildInfo.current().version());
        indexStore.init();

        if (indexStore.isSchemaUpgradeRequired()) {
            logger.warn("Index schema version changed from {} - clearing the cache, please scan again",
                    indexStore.getSchemaVersionAtOpen());
            indexStore.clearAll();
        }

        session.setIndexCounts(indexStore.countFiles(), indexStore.countReferenceIds());
        logger.info("Index contains {} files and {} identifiers",
                session.getIndexedFileCount(), session.getReferenceIdCount());
    }

    /**
     * Run one command and print its outcome.
     *
     * @return the process exit code
     */
    public int run(final String[] args, final PrintStream out) throws InterruptedException {
        if (args.length == 0) {
            printUsage(out);
            return 2;
        }

        final String command = args[0].toLowerCase(Locale.ROOT);
        final boolean accepted = switch (command) {
            case "scan" -> args.length >= 2 && session.requestScan(Paths.get(args[1]));
            case "import" -> args.length >= 2 && session.requestImportCsv(Paths.get(args[1]),
                    args.length >= 3 ? args[2] : config.getIdentifierColumn());
            case "search", "export" -> requestSearch(command, args);
            case "clear" -> session.requestClear();
            case "stats" -> {
                out.println("Indexed files:          " + session.getIndexedFileCount());
                out.println("Reference identifiers:  " + session.getReferenceIdCount());
                out.println("Index path:             " + config.getIndexPath());
                out.println("Version:                " + BuildInfo.current().version() + " (" + BuildInfo.current().buildTimestamp() + ")");
                yield true;
            }
            default -> false;
        };

        if (!accepted) {
            if (session.getErrorMessage() != null) {
                out.println("Error: " + session.getErrorMessage());
            } else {
                printUsage(out);
            }
            return 2;
        }

        awaitIdle(out);

        if (session.getErrorMessage() != null) {
            out.println("Error: " + session.getErrorMessage());
        }
        if (session.getStatusMessage() != null && !"stats".equals(command)) {
            out.println(session.getStatusMessage());
        }

        if ("search".equals(command)) {
            printResults(out);
        } else if ("export".equals(command) && session.getResultState().hasResults()) {
            if (!session.exportResults(Paths.get(args[2]))) {
                out.println("Error: " + session.getErrorMessage());
                return 1;
            }
            out.println(session.getStatusMessage());
        }
        return session.getErrorMessage() == null ? 0 : 1;
    }

    private boolean requestSearch(final String command, final String[] args) {
        final int thresholdIndex = "export".equals(command) ? 3 : 2;
        if (args.length < thresholdIndex) {
            return false;
        }
        if (args.length > thresholdIndex) {
            try {
                return session.requestSearch(args[1], Double.parseDouble(args[thresholdIndex]));
            } catch (final NumberFormatException e) {
                return session.requestSearch(args[1], Double.NaN);
            }
        }
        return session.requestSearch(args[1]);
    }

    private void awaitIdle(final PrintStream out) throws InterruptedException {
        String lastProgress = null;
        while (true) {
            // Idle is checked before draining, the terminal message is queued before the task counts as finished
            final boolean idle = session.isIdle();
            session.pump();
            final String progress = session.getProgressText();
            if (progress != null && !progress.equals(lastProgress)) {
                out.println(progress);
                lastProgress = progress;
            }
            if (idle) {
                return;
            }
            Thread.sleep(config.getPollIntervalMs());
        }
    }

    private void printResults(final PrintStream out) {
        int page = 0;
        do {
            for (final ResultRow row : session.currentPageRows()) {
                out.println(row.similarity() + "\t" + row.name() + "\t" + row.path());
            }
            page++;
        } while (page < session.pageCount() && session.nextPage());
    }

    private static void printUsage(final PrintStream out) {
        out.println("Usage: image-locator <command>");
        out.println("  scan <directory>                       index all image files below the directory");
        out.println("  import <csv-file> [column]             import reference identifiers from a CSV column");
        out.println("  search <identifier> [threshold]        list files matching the identifier");
        out.println("  export <identifier> <out.csv> [threshold]  write matching files as CSV");
        out.println("  clear                                  remove all indexed files and identifiers");
        out.println("  stats                                  show index statistics");
    }

    /**
     * Shutdown all services gracefully.
     */
    public void shutdown() {
        logger.info("Shutting down image locator...");

        // Shutdown in reverse order of initialization
        try {
            orchestrator.close();
        } catch (final Exception e) {
            logger.error("Error shutting down task orchestrator", e);
        }

        try {
            workerPool.shutdown();
        } catch (final Exception e) {
            logger.error("Error shutting down worker pool", e);
        }

        try {
            indexStore.close();
        } catch (final Exception e) {
            logger.error("Error closing index store", e);
        }

        logger.info("Image locator shutdown complete");
    }

    public LocatorSession getSession() {
        return session;
    }

    public static void main(final String[] args) {
        int exitCode;
        try {
            // Configure logging FIRST, before any other code that might log
            final boolean deployedMode = "deployed".equals(System.getProperty("profile"));
            LoggingConfigurator.configure(deployedMode);

            final ApplicationConfig config = ApplicationConfig.load();
            if (!deployedMode) {
                logger.info("Running in development mode (console logging enabled)");
                logger.info("Index path: {}", config.getIndexPath());
            }

            final ImageLocatorApplication app = new ImageLocatorApplication(config);
            try {
                app.init();
                exitCode = app.run(args, System.out);
            } finally {
                app.shutdown();
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            System.err.println("Interrupted");
            exitCode = 1;
        } catch (final Exception e) {
            System.err.println("Failed to run image locator: " + e.getMessage());
            e.printStackTrace(System.err);
            exitCode = 1;
        }
        System.exit(exitCode);
    }
}
