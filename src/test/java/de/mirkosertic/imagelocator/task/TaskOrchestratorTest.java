package de.mirkosertic.imagelocator.task;

import de.mirkosertic.imagelocator.BusyException;
import de.mirkosertic.imagelocator.ErrorKind;
import de.mirkosertic.imagelocator.ProgressListener;
import de.mirkosertic.imagelocator.StorageException;
import de.mirkosertic.imagelocator.importer.CsvIdentifierReader;
import de.mirkosertic.imagelocator.importer.IdentifierImporter;
import de.mirkosertic.imagelocator.scanner.DirectoryScanner;
import de.mirkosertic.imagelocator.scanner.ScanReport;
import de.mirkosertic.imagelocator.search.SearchEngine;
import de.mirkosertic.imagelocator.search.SearchOutcome;
import de.mirkosertic.imagelocator.search.SearchQuery;
import de.mirkosertic.imagelocator.store.IndexStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("TaskOrchestrator Tests")
class TaskOrchestratorTest {

    private IndexStore store;
    private DirectoryScanner scanner;
    private IdentifierImporter importer;
    private SearchEngine searchEngine;
    private TaskOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        store = mock(IndexStore.class);
        scanner = mock(DirectoryScanner.class);
        importer = mock(IdentifierImporter.class);
        searchEngine = mock(SearchEngine.class);
        orchestrator = new TaskOrchestrator(store, scanner, importer, mock(CsvIdentifierReader.class),
                searchEngine, new WorkerPool("test-task", 4));
    }

    @AfterEach
    void tearDown() {
        orchestrator.close();
    }

    /**
     * Poll until the terminal message of the given ticket arrives, collecting everything received.
     */
    private List<TaskMessage> awaitTerminal(final TaskTicket ticket) throws InterruptedException {
        final List<TaskMessage> received = new ArrayList<>();
        final long deadline = System.currentTimeMillis() + 10_000;
        while (System.currentTimeMillis() < deadline) {
            for (final TaskMessage message : orchestrator.drain()) {
                received.add(message);
                if (message.ticket().equals(ticket) && (message instanceof TaskCompleted || message instanceof TaskFailed)) {
                    return received;
                }
            }
            Thread.sleep(5);
        }
        return fail("No terminal message for task #" + ticket.id() + ", received " + received);
    }

    private static SearchOutcome emptyOutcome(final SearchQuery query) {
        return new SearchOutcome(query, List.of(), 0, 1);
    }

    @Test
    @DisplayName("Second search while one is running should be rejected with BusyException")
    void secondSearchIsRejected() throws Exception {
        // Given: a search that blocks until released
        final CountDownLatch started = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        final SearchQuery query = SearchQuery.of("HH001", 0.7);
        when(searchEngine.search(any())).thenAnswer(invocation -> {
            started.countDown();
            release.await(10, TimeUnit.SECONDS);
            return emptyOutcome(query);
        });

        final TaskTicket first = orchestrator.submitSearch(query);
        assertThat(started.await(10, TimeUnit.SECONDS)).isTrue();

        // When / Then
        assertThatThrownBy(() -> orchestrator.submitSearch(query))
                .isInstanceOf(BusyException.class)
                .satisfies(e -> assertThat(((BusyException) e).getKind()).isEqualTo(ErrorKind.BUSY))
                .hasMessageContaining("search");
        assertThat(orchestrator.status(TaskKind.SEARCH))
                .map(TaskStatus::state)
                .contains(TaskState.RUNNING);

        // And: after the first search finished, a new one is accepted right away
        release.countDown();
        awaitTerminal(first);
        final TaskTicket second = orchestrator.submitSearch(query);
        assertThat(second.id()).isGreaterThan(first.id());
        awaitTerminal(second);
    }

    @Test
    @DisplayName("Tasks of different kinds should run side by side")
    void differentKindsRunConcurrently() throws Exception {
        final CountDownLatch release = new CountDownLatch(1);
        when(scanner.scan(any(), any())).thenAnswer(invocation -> {
            release.await(10, TimeUnit.SECONDS);
            return new ScanReport("/scans", 0, 0, 0, 0, 1);
        });
        final SearchQuery query = SearchQuery.of("HH001", 0.7);
        when(searchEngine.search(query)).thenReturn(emptyOutcome(query));

        final TaskTicket scan = orchestrator.submitScan(Path.of("/scans"));
        final TaskTicket search = orchestrator.submitSearch(query);

        final List<TaskMessage> searchMessages = awaitTerminal(search);
        assertThat(searchMessages).last().isInstanceOf(TaskCompleted.class);
        assertThat(orchestrator.isRunning(TaskKind.SCAN)).isTrue();

        release.countDown();
        assertThat(awaitTerminal(scan)).last().isInstanceOf(TaskCompleted.class);
    }

    @Test
    @DisplayName("Completed task should deliver its payload")
    void completedTaskDeliversPayload() throws Exception {
        final SearchQuery query = SearchQuery.of("HH001", 0.7);
        final SearchOutcome outcome = emptyOutcome(query);
        when(searchEngine.search(query)).thenReturn(outcome);

        final TaskTicket ticket = orchestrator.submitSearch(query);
        final TaskMessage terminal = awaitTerminal(ticket).get(0);

        assertThat(terminal).isInstanceOf(TaskCompleted.class);
        assertThat(((TaskCompleted) terminal).payload(SearchOutcome.class)).isSameAs(outcome);
        assertThat(orchestrator.status(TaskKind.SEARCH)).map(TaskStatus::state).contains(TaskState.COMPLETED);
        assertThat(orchestrator.isAnyRunning()).isFalse();
    }

    @Test
    @DisplayName("Failed task should deliver the cause as message with its error kind")
    void failureIsDelivered() throws Exception {
        final SearchQuery query = SearchQuery.of("HH001", 0.7);
        when(searchEngine.search(query)).thenThrow(new StorageException("Index at /tmp/index is locked by another process"));

        final TaskTicket ticket = orchestrator.submitSearch(query);
        final TaskMessage terminal = awaitTerminal(ticket).get(0);

        assertThat(terminal).isInstanceOfSatisfying(TaskFailed.class, failed -> {
            assertThat(failed.message()).isEqualTo("Index at /tmp/index is locked by another process");
            assertThat(failed.errorKind()).isEqualTo(ErrorKind.STORAGE);
        });
        assertThat(orchestrator.status(TaskKind.SEARCH)).map(TaskStatus::state).contains(TaskState.FAILED);
    }

    @Test
    @DisplayName("Unexpected runtime exception should become an UNEXPECTED failure")
    void runtimeExceptionIsDelivered() throws Exception {
        final SearchQuery query = SearchQuery.of("HH001", 0.7);
        when(searchEngine.search(query)).thenThrow(new IllegalStateException("boom"));

        final TaskMessage terminal = awaitTerminal(orchestrator.submitSearch(query)).get(0);

        assertThat(terminal).isInstanceOfSatisfying(TaskFailed.class, failed -> {
            assertThat(failed.message()).contains("boom");
            assertThat(failed.errorKind()).isEqualTo(ErrorKind.UNEXPECTED);
        });
        assertThat(orchestrator.isRunning(TaskKind.SEARCH)).isFalse();
    }

    @Test
    @DisplayName("Error thrown by a task should release its slot and become an UNEXPECTED failure")
    void errorReleasesSlot() throws Exception {
        // Given
        final TaskTicket ticket = orchestrator.submit(TaskKind.SEARCH, t -> {
            throw new StackOverflowError();
        });

        // When
        final TaskMessage terminal = awaitTerminal(ticket).get(0);

        // Then
        assertThat(terminal).isInstanceOfSatisfying(TaskFailed.class, failed -> {
            assertThat(failed.message()).contains("StackOverflowError");
            assertThat(failed.errorKind()).isEqualTo(ErrorKind.UNEXPECTED);
        });
        assertThat(orchestrator.isRunning(TaskKind.SEARCH)).as("Slot released").isFalse();
        assertThat(orchestrator.status(TaskKind.SEARCH)).map(TaskStatus::state).contains(TaskState.FAILED);

        // And the same kind is accepted again
        final SearchQuery query = SearchQuery.of("HH001", 0.7);
        when(searchEngine.search(query)).thenReturn(emptyOutcome(query));
        assertThat(awaitTerminal(orchestrator.submitSearch(query))).last().isInstanceOf(TaskCompleted.class);
    }

    @Test
    @DisplayName("Progress messages should arrive before the terminal message")
    void progressPrecedesCompletion() throws Exception {
        doAnswer(invocation -> {
            final ProgressListener listener = invocation.getArgument(1);
            listener.onProgress(0, 2);
            listener.onProgress(2, 2);
            return new ScanReport("/scans", 2, 2, 2, 2, 1);
        }).when(scanner).scan(any(), any());

        final List<TaskMessage> messages = awaitTerminal(orchestrator.submitScan(Path.of("/scans")));

        assertThat(messages).hasSize(3);
        assertThat(messages.get(0)).isInstanceOf(TaskProgress.class);
        assertThat(((TaskProgress) messages.get(1)).percent()).isEqualTo(100);
        assertThat(messages.get(2)).isInstanceOf(TaskCompleted.class);
    }

    @Test
    @DisplayName("Clear should report the removed records")
    void clearReportsRemovedRecords() throws Exception {
        when(store.countFiles()).thenReturn(12L);
        when(store.countReferenceIds()).thenReturn(3L);

        final TaskMessage terminal = awaitTerminal(orchestrator.submitClear()).get(0);

        assertThat(((TaskCompleted) terminal).payload(ClearReport.class)).isEqualTo(new ClearReport(12, 3));
        verify(store).clearAll();
    }

    @Test
    @DisplayName("Polling an empty channel should return immediately")
    void pollNeverBlocks() {
        final long start = System.nanoTime();

        final Optional<TaskMessage> message = orchestrator.poll();

        assertThat(message).isEmpty();
        assertThat(orchestrator.drain()).isEmpty();
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isLessThan(1000);
    }

    @Test
    @DisplayName("Submitting after close should fail")
    void submitAfterCloseFails() {
        orchestrator.close();

        assertThatThrownBy(() -> orchestrator.submitClear()).isInstanceOf(IllegalStateException.class);
    }
}
