package de.mirkosertic.imagelocator.scanner;

import de.mirkosertic.imagelocator.ScanException;
import de.mirkosertic.imagelocator.StorageException;
import de.mirkosertic.imagelocator.store.IndexedFile;
import de.mirkosertic.imagelocator.store.LuceneIndexStore;
import de.mirkosertic.imagelocator.task.WorkerPool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

@DisplayName("DirectoryScanner Tests")
class DirectoryScannerTest {

    @TempDir
    Path tempDir;

    private Path root;
    private LuceneIndexStore store;
    private WorkerPool workerPool;
    private DirectoryScanner scanner;

    @BeforeEach
    void setUp() throws IOException, StorageException {
        root = Files.createDirectories(tempDir.resolve("scans"));
        store = new LuceneIndexStore(tempDir.resolve("index"));
        store.init();
        workerPool = new WorkerPool("test-worker", 2);
        scanner = new DirectoryScanner(store, workerPool,
                new ImageFileMatcher(List.of("tif", "tiff"), List.of()), 2);
    }

    @AfterEach
    void tearDown() throws StorageException {
        workerPool.shutdown();
        store.close();
    }

    private Path createFile(final String relativePath) throws IOException {
        final Path file = root.resolve(relativePath);
        Files.createDirectories(file.getParent());
        return Files.writeString(file, "image");
    }

    @Test
    @DisplayName("Should index image files recursively and ignore other files")
    void indexesImageFilesRecursively() throws Exception {
        // Given
        createFile("HH001_document.tif");
        createFile("2020/ABC123-file.TIF");
        createFile("2020/deep/document_ABC123.tiff");
        createFile("notes.txt");
        createFile("2020/readme.md");

        // When
        final ScanReport report = scanner.scan(root, (processed, total) -> {
        });

        // Then
        assertThat(report.filesVisited()).isEqualTo(5);
        assertThat(report.imageFilesFound()).isEqualTo(3);
        assertThat(report.newlyIndexed()).isEqualTo(3);
        assertThat(report.totalIndexed()).isEqualTo(3);
        assertThat(store.listFiles())
                .extracting(IndexedFile::name)
                .containsExactlyInAnyOrder("HH001_document.tif", "ABC123-file.TIF", "document_ABC123.tiff");
        assertThat(store.listFiles())
                .extracting(IndexedFile::path)
                .allSatisfy(path -> assertThat(Path.of(path)).isAbsolute());
    }

    @Test
    @DisplayName("Scanning twice should not create duplicates or recount existing files")
    void scanningIsIdempotent() throws Exception {
        createFile("a.tif");
        createFile("b/b.tiff");
        createFile("b/c.tif");

        final ScanReport first = scanner.scan(root, (processed, total) -> {
        });
        final ScanReport second = scanner.scan(root, (processed, total) -> {
        });

        assertThat(first.newlyIndexed()).isEqualTo(3);
        assertThat(second.newlyIndexed())
                .as("Files already in the index are not recounted")
                .isZero();
        assertThat(second.totalIndexed()).isEqualTo(first.totalIndexed());
        assertThat(store.countFiles()).isEqualTo(3);
    }

    @Test
    @DisplayName("A new file should be the only one counted on rescan")
    void rescanCountsOnlyNewFiles() throws Exception {
        createFile("a.tif");
        scanner.scan(root, (processed, total) -> {
        });

        createFile("b.tif");
        final ScanReport report = scanner.scan(root, (processed, total) -> {
        });

        assertThat(report.newlyIndexed()).isEqualTo(1);
        assertThat(report.totalIndexed()).isEqualTo(2);
    }

    @Test
    @DisplayName("Progress should be reported per batch and end at the total")
    void reportsProgress() throws Exception {
        for (int i = 0; i < 5; i++) {
            createFile("file" + i + ".tif");
        }
        final List<long[]> updates = new ArrayList<>();

        scanner.scan(root, (processed, total) -> updates.add(new long[]{processed, total}));

        // Batch size 2: start, 2, 4, 5
        assertThat(updates).hasSize(4);
        assertThat(updates.get(updates.size() - 1)).containsExactly(5L, 5L);
    }

    @Test
    @DisplayName("Missing root should fail with ScanException")
    void missingRootFails() {
        assertThatThrownBy(() -> scanner.scan(tempDir.resolve("missing"), (processed, total) -> {
        }))
                .isInstanceOf(ScanException.class)
                .hasMessageContaining("does not exist");
    }

    @Test
    @DisplayName("A file as root should fail with ScanException")
    void fileRootFails() throws IOException {
        final Path file = createFile("a.tif");

        assertThatThrownBy(() -> scanner.scan(file, (processed, total) -> {
        }))
                .isInstanceOf(ScanException.class)
                .hasMessageContaining("not a directory");
    }

    @Test
    @DisplayName("Empty root should produce an empty report")
    void emptyRoot() throws Exception {
        final ScanReport report = scanner.scan(root, (processed, total) -> {
        });

        assertThat(report.filesVisited()).isZero();
        assertThat(report.newlyIndexed()).isZero();
    }

    @Test
    @DisplayName("Symbolic links to directories should be followed")
    void followsSymbolicLinks() throws Exception {
        final Path outside = Files.createDirectories(tempDir.resolve("outside"));
        Files.writeString(outside.resolve("linked.tif"), "image");
        try {
            Files.createSymbolicLink(root.resolve("link"), outside);
        } catch (final IOException | UnsupportedOperationException e) {
            assumeTrue(false, "Symbolic links not supported: " + e.getMessage());
        }

        final ScanReport report = scanner.scan(root, (processed, total) -> {
        });

        assertThat(report.newlyIndexed()).isEqualTo(1);
        assertThat(store.listFiles())
                .extracting(IndexedFile::name)
                .containsExactly("linked.tif");
    }
}
