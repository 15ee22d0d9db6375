package de.mirkosertic.imagelocator.task;

import de.mirkosertic.imagelocator.BusyException;
import de.mirkosertic.imagelocator.ErrorKind;
import de.mirkosertic.imagelocator.LocatorException;
import de.mirkosertic.imagelocator.ProgressListener;
import de.mirkosertic.imagelocator.importer.CsvIdentifierReader;
import de.mirkosertic.imagelocator.importer.IdentifierImporter;
import de.mirkosertic.imagelocator.scanner.DirectoryScanner;
import de.mirkosertic.imagelocator.search.SearchEngine;
import de.mirkosertic.imagelocator.search.SearchQuery;
import de.mirkosertic.imagelocator.store.IndexStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs scans, imports, searches and cache clearing on the task pool and reports back through
 * one FIFO message channel.
 * <p>
 * At most one task per {@link TaskKind} runs at a time; a second request of the same kind is
 * rejected with a {@link BusyException}, never queued. Every accepted task delivers exactly one
 * terminal message, {@link TaskCompleted} or {@link TaskFailed}, possibly preceded by
 * {@link TaskProgress} messages. The consumer reads the channel with {@link #poll()} or
 * {@link #drain()}, which never block.
 */
public class TaskOrchestrator implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(TaskOrchestrator.class);

    private final IndexStore indexStore;
    private final DirectoryScanner scanner;
    private final IdentifierImporter importer;
    private final CsvIdentifierReader csvReader;
    private final SearchEngine searchEngine;
    private final WorkerPool taskPool;

    private final BlockingQueue<TaskMessage> channel = new LinkedBlockingQueue<>();
    private final AtomicLong ticketCounter = new AtomicLong(0);

    // Guards running, statuses and closed. Releasing a slot and publishing the terminal message happen together.
    private final Object stateLock = new Object();
    private final Set<TaskKind> running = EnumSet.noneOf(TaskKind.class);
    private final Map<TaskKind, TaskStatus> statuses = new EnumMap<>(TaskKind.class);
    private boolean closed;

    @FunctionalInterface
    interface TaskBody {
        Object run(TaskTicket ticket) throws LocatorException;
    }

    public TaskOrchestrator(final IndexStore indexStore,
                            final DirectoryScanner scanner,
                            final IdentifierImporter importer,
                            final CsvIdentifierReader csvReader,
                            final SearchEngine searchEngine,
                            final WorkerPool taskPool) {
        this.indexStore = indexStore;
        this.scanner = scanner;
        this.importer = importer;
        this.csvReader = csvReader;
        this.searchEngine = searchEngine;
        this.taskPool = taskPool;
    }

    public TaskTicket submitScan(final Path root) throws BusyException {
        return submit(TaskKind.SCAN, ticket -> scanner.scan(root, progressFor(ticket)));
    }

    public TaskTicket submitImport(final List<String> identifiers) throws BusyException {
        final List<String> values = new ArrayList<>(identifiers);
        return submit(TaskKind.IMPORT, ticket -> importer.importIdentifiers(values));
    }

    public TaskTicket submitImportRecords(final List<Map<String, String>> records, final String field) throws BusyException {
        final List<Map<String, String>> values = List.copyOf(records);
        return submit(TaskKind.IMPORT, ticket -> importer.importRecords(values, field));
    }

    /**
     * Read the CSV file and import the given column, both on the task pool.
     */
    public TaskTicket submitImportCsv(final Path csvFile, final String field) throws BusyException {
        return submit(TaskKind.IMPORT, ticket -> importer.importRecords(csvReader.read(csvFile), field));
    }

    public TaskTicket submitSearch(final SearchQuery query) throws BusyException {
        return submit(TaskKind.SEARCH, ticket -> searchEngine.search(query));
    }

    public TaskTicket submitClear() throws BusyException {
        return submit(TaskKind.CLEAR, ticket -> {
            final long files = indexStore.countFiles();
            final long referenceIds = indexStore.countReferenceIds();
            indexStore.clearAll();
            return new ClearReport(files, referenceIds);
        });
    }

    TaskTicket submit(final TaskKind kind, final TaskBody body) throws BusyException {
        final TaskTicket ticket;
        synchronized (stateLock) {
            if (closed) {
                throw new IllegalStateException("Task orchestrator is closed");
            }
            if (running.contains(kind)) {
                logger.warn("Rejecting {} request, another one is still running", kind.displayName());
                throw new BusyException(kind);
            }
            ticket = new TaskTicket(ticketCounter.incrementAndGet(), kind, Instant.now());
            running.add(kind);
            statuses.put(kind, new TaskStatus(ticket, TaskState.REQUESTED));
        }

        try {
            taskPool.submit(() -> {
                execute(ticket, body);
                return null;
            });
        } catch (final RejectedExecutionException e) {
            synchronized (stateLock) {
                running.remove(kind);
                statuses.put(kind, new TaskStatus(ticket, TaskState.FAILED));
            }
            throw new IllegalStateException("Task pool rejected the " + kind.displayName() + " task", e);
        }

        logger.debug("Submitted {} task #{}", kind.displayName(), ticket.id());
        return ticket;
    }

    private void execute(final TaskTicket ticket, final TaskBody body) {
        synchronized (stateLock) {
            statuses.put(ticket.kind(), new TaskStatus(ticket, TaskState.RUNNING));
        }

        TaskMessage outcome = null;
        try {
            final Object payload = body.run(ticket);
            outcome = new TaskCompleted(ticket, payload);
            logger.info("{} task #{} completed", ticket.kind().displayName(), ticket.id());
        } catch (final LocatorException e) {
            logger.error("{} task #{} failed: {}", ticket.kind().displayName(), ticket.id(), e.getMessage(), e);
            outcome = new TaskFailed(ticket, e.getMessage(), e.getKind());
        } catch (final RuntimeException e) {
            logger.error("{} task #{} failed unexpectedly", ticket.kind().displayName(), ticket.id(), e);
            outcome = new TaskFailed(ticket, "Unexpected error: " + e.getMessage(), ErrorKind.UNEXPECTED);
        } catch (final Error e) {
            logger.error("{} task #{} aborted by an error", ticket.kind().displayName(), ticket.id(), e);
            outcome = new TaskFailed(ticket, "Unexpected error: " + e, ErrorKind.UNEXPECTED);
            throw e;
        } finally {
            // Exactly one terminal message per task
            complete(ticket, outcome != null ? outcome
                    : new TaskFailed(ticket, "Task ended without a result", ErrorKind.UNEXPECTED));
        }
    }

    private void complete(final TaskTicket ticket, final TaskMessage outcome) {
        synchronized (stateLock) {
            running.remove(ticket.kind());
            statuses.put(ticket.kind(), new TaskStatus(ticket,
                    outcome instanceof TaskFailed ? TaskState.FAILED : TaskState.COMPLETED));
            channel.add(outcome);
        }
    }

    private ProgressListener progressFor(final TaskTicket ticket) {
        return (processed, total) -> channel.add(new TaskProgress(ticket, processed, total));
    }

    /**
     * Take the next message if one is available. Never blocks.
     */
    public Optional<TaskMessage> poll() {
        return Optional.ofNullable(channel.poll());
    }

    /**
     * Take all messages available right now, in delivery order. Never blocks.
     */
    public List<TaskMessage> drain() {
        final List<TaskMessage> messages = new ArrayList<>();
        channel.drainTo(messages);
        return messages;
    }

    public boolean isRunning(final TaskKind kind) {
        synchronized (stateLock) {
            return running.contains(kind);
        }
    }

    public boolean isAnyRunning() {
        synchronized (stateLock) {
            return !running.isEmpty();
        }
    }

    /**
     * State of the latest task of the given kind, empty if none was submitted yet.
     */
    public Optional<TaskStatus> status(final TaskKind kind) {
        synchronized (stateLock) {
            return Optional.ofNullable(statuses.get(kind));
        }
    }

    /**
     * Stop accepting tasks and shut the task pool down. Running tasks get a short grace period.
     */
    @Override
    public void close() {
        synchronized (stateLock) {
            if (closed) {
                return;
            }
            closed = true;
        }
        taskPool.shutdown();
    }
}
