package de.mirkosertic.imagelocator.scanner;

import de.mirkosertic.imagelocator.ProgressListener;
import de.mirkosertic.imagelocator.ScanException;
import de.mirkosertic.imagelocator.StorageException;
import de.mirkosertic.imagelocator.store.IndexStore;
import de.mirkosertic.imagelocator.store.IndexedFile;
import de.mirkosertic.imagelocator.store.UpsertResult;
import de.mirkosertic.imagelocator.task.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;

/**
 * Walks a root directory and adds every image file below it to the index.
 * <p>
 * Scanning is incremental: files already in the index are skipped by the store, so
 * repeating a scan never creates duplicates. Batches committed before a failure stay in the index.
 */
public class DirectoryScanner {

    private static final Logger logger = LoggerFactory.getLogger(DirectoryScanner.class);

    static final int MIN_PARTITION_SIZE = 512;

    private final IndexStore indexStore;
    private final WorkerPool workerPool;
    private final ImageFileMatcher matcher;
    private final int batchSize;

    public DirectoryScanner(final IndexStore indexStore,
                            final WorkerPool workerPool,
                            final ImageFileMatcher matcher,
                            final int batchSize) {
        this.indexStore = indexStore;
        this.workerPool = workerPool;
        this.matcher = matcher;
        this.batchSize = Math.max(1, batchSize);
    }

    public ScanReport scan(final Path root, final ProgressListener progressListener) throws ScanException, StorageException {
        final long startTime = System.currentTimeMillis();
        final Path scanRoot = validateRoot(root);
        logger.info("Scanning directory: {}", scanRoot);

        final List<Path> visited = walk(scanRoot);
        final List<Path> imageFiles = filter(visited);
        logger.info("Found {} image files among {} files below {}", imageFiles.size(), visited.size(), scanRoot);

        final Instant discoveredAt = Instant.now();
        final long total = imageFiles.size();
        long newlyIndexed = 0;
        long processed = 0;
        progressListener.onProgress(0, total);

        for (int offset = 0; offset < imageFiles.size(); offset += batchSize) {
            final List<Path> batch = imageFiles.subList(offset, Math.min(imageFiles.size(), offset + batchSize));
            final List<IndexedFile> files = new ArrayList<>(batch.size());
            for (final Path file : batch) {
                files.add(new IndexedFile(file.toString(), file.getFileName().toString(), discoveredAt));
            }
            final UpsertResult result = indexStore.upsertFiles(files);
            newlyIndexed += result.inserted();
            processed += batch.size();
            progressListener.onProgress(processed, total);
        }

        final long totalIndexed = indexStore.countFiles();
        final long elapsed = System.currentTimeMillis() - startTime;
        logger.info("Scan of {} finished in {}ms: {} new files, {} indexed in total",
                scanRoot, elapsed, newlyIndexed, totalIndexed);

        return new ScanReport(scanRoot.toString(), visited.size(), imageFiles.size(), newlyIndexed, totalIndexed, elapsed);
    }

    private static Path validateRoot(final Path root) throws ScanException {
        if (!Files.exists(root)) {
            throw new ScanException("Directory does not exist: " + root);
        }
        if (!Files.isDirectory(root)) {
            throw new ScanException("Path is not a directory: " + root);
        }
        if (!Files.isReadable(root)) {
            throw new ScanException("Directory is not readable: " + root);
        }
        return root.toAbsolutePath().normalize();
    }

    private List<Path> walk(final Path root) throws ScanException {
        final List<Path> files = new ArrayList<>();
        try {
            Files.walkFileTree(root, EnumSet.of(FileVisitOption.FOLLOW_LINKS), Integer.MAX_VALUE,
                    new SimpleFileVisitor<>() {
                        @Override
                        public FileVisitResult visitFile(final Path file, final BasicFileAttributes attrs) {
                            if (attrs.isRegularFile()) {
                                files.add(file);
                            }
                            return FileVisitResult.CONTINUE;
                        }

                        @Override
                        public FileVisitResult visitFileFailed(final Path file, final IOException exc) {
                            // Unreadable entries and symlink loops are skipped
                            logger.warn("Skipping unreadable entry {}: {}", file, exc.toString());
                            return FileVisitResult.CONTINUE;
                        }
                    });
        } catch (final IOException e) {
            throw new ScanException("Error scanning directory " + root + ": " + e.getMessage(), e);
        }
        return files;
    }

    private List<Path> filter(final List<Path> visited) throws ScanException {
        if (visited.isEmpty()) {
            return List.of();
        }
        final int partitionSize = Math.max(MIN_PARTITION_SIZE,
                (visited.size() + workerPool.getPoolSize() - 1) / workerPool.getPoolSize());

        final List<Callable<List<Path>>> partitions = new ArrayList<>();
        for (int offset = 0; offset < visited.size(); offset += partitionSize) {
            final List<Path> partition = visited.subList(offset, Math.min(visited.size(), offset + partitionSize));
            partitions.add(() -> partition.stream().filter(matcher::shouldInclude).toList());
        }

        try {
            final List<Path> imageFiles = new ArrayList<>();
            for (final List<Path> filtered : workerPool.invokeAll(partitions)) {
                imageFiles.addAll(filtered);
            }
            return imageFiles;
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScanException("Scan was interrupted", e);
        } catch (final ExecutionException e) {
            throw new ScanException("Failed to filter scanned files: " + e.getCause().getMessage(), e.getCause());
        }
    }
}
