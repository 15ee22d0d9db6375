package de.mirkosertic.imagelocator.task;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("WorkerPool Tests")
class WorkerPoolTest {

    private WorkerPool pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdown();
        }
    }

    @Test
    @DisplayName("Should return results in submission order regardless of completion order")
    void shouldKeepSubmissionOrder() throws Exception {
        // Given
        pool = new WorkerPool("test-order", 4);
        final List<Callable<Integer>> tasks = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            final int value = i;
            tasks.add(() -> {
                // Earlier tasks finish later
                Thread.sleep((8 - value) * 5L);
                return value;
            });
        }

        // When
        final List<Integer> results = pool.invokeAll(tasks);

        // Then
        assertThat(results).containsExactly(0, 1, 2, 3, 4, 5, 6, 7);
    }

    @Test
    @DisplayName("Should propagate the first failure and cancel the remaining tasks")
    void shouldPropagateFailure() {
        // Given
        pool = new WorkerPool("test-failure", 2);
        final CountDownLatch neverReleased = new CountDownLatch(1);
        final List<Callable<String>> tasks = List.of(
                () -> {
                    throw new IllegalStateException("broken partition");
                },
                () -> {
                    neverReleased.await(10, TimeUnit.SECONDS);
                    return "late";
                });

        // When / Then
        assertThatThrownBy(() -> pool.invokeAll(tasks))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(IllegalStateException.class)
                .hasMessageContaining("broken partition");
    }

    @Test
    @DisplayName("Should run tasks on named daemon threads")
    void shouldUseNamedDaemonThreads() throws Exception {
        // Given
        pool = new WorkerPool("test-named", 1);

        // When
        final Thread thread = pool.submit(Thread::currentThread).get(5, TimeUnit.SECONDS);

        // Then
        assertThat(thread.getName()).as("Thread name").startsWith("test-named-");
        assertThat(thread.isDaemon()).as("Daemon thread").isTrue();
    }

    @Test
    @DisplayName("Should use at least one thread")
    void shouldUseAtLeastOneThread() {
        pool = new WorkerPool("test-size", 0);

        assertThat(pool.getPoolSize()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should report shutdown")
    void shouldReportShutdown() {
        pool = new WorkerPool("test-shutdown", 1);
        assertThat(pool.isShutdown()).isFalse();

        pool.shutdown();

        assertThat(pool.isShutdown()).isTrue();
    }
}
