package de.mirkosertic.imagelocator.search;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import de.mirkosertic.imagelocator.StorageException;
import de.mirkosertic.imagelocator.ValidationException;
import de.mirkosertic.imagelocator.store.IndexStore;
import de.mirkosertic.imagelocator.store.IndexedFile;
import de.mirkosertic.imagelocator.task.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;

/**
 * Scores one query against every indexed file name and returns the ranked matches above the threshold.
 * <p>
 * The normalized file names are cached per index generation, so repeated searches against an
 * unchanged index neither read the store nor normalize again. Scoring runs partitioned on the
 * worker pool; the sorted partitions are merged with {@link MatchResult#RANKING}.
 */
public class SearchEngine {

    private static final Logger logger = LoggerFactory.getLogger(SearchEngine.class);

    static final int MIN_PARTITION_SIZE = 256;

    private final IndexStore indexStore;
    private final WorkerPool workerPool;
    private final FilenameNormalizer normalizer;
    private final SimilarityScorer scorer;
    private final Cache<Long, List<Candidate>> snapshotCache;

    public SearchEngine(final IndexStore indexStore,
                        final WorkerPool workerPool,
                        final FilenameNormalizer normalizer,
                        final SimilarityScorer scorer) {
        this.indexStore = indexStore;
        this.workerPool = workerPool;
        this.normalizer = normalizer;
        this.scorer = scorer;
        this.snapshotCache = Caffeine.newBuilder()
                .maximumSize(1)
                .build();
    }

    public SearchOutcome search(final SearchQuery query) throws ValidationException, StorageException {
        final long startTime = System.currentTimeMillis();

        final NormalizedName normalizedQuery = normalizer.normalize(query.text());
        if (normalizedQuery.isEmpty()) {
            throw new ValidationException("Search text '" + query.text() + "' contains no searchable characters");
        }

        final List<Candidate> candidates = snapshot();
        if (candidates.isEmpty()) {
            logger.info("Search for '{}' skipped, no files are indexed", query.text());
            return new SearchOutcome(query, List.of(), 0, System.currentTimeMillis() - startTime);
        }

        final int partitionSize = Math.max(MIN_PARTITION_SIZE,
                (candidates.size() + workerPool.getPoolSize() - 1) / workerPool.getPoolSize());
        final List<Callable<List<MatchResult>>> partitions = new ArrayList<>();
        for (int offset = 0; offset < candidates.size(); offset += partitionSize) {
            final List<Candidate> partition = candidates.subList(offset, Math.min(candidates.size(), offset + partitionSize));
            partitions.add(() -> scorePartition(normalizedQuery, partition, query.threshold()));
        }

        final List<MatchResult> results = merge(runPartitions(partitions));
        final long elapsed = System.currentTimeMillis() - startTime;
        logger.info("Search for '{}' (threshold {}) found {} of {} files in {}ms using {} partitions",
                query.text(), query.threshold(), results.size(), candidates.size(), elapsed, partitions.size());

        return new SearchOutcome(query, results, candidates.size(), elapsed);
    }

    private List<MatchResult> scorePartition(final NormalizedName query,
                                             final List<Candidate> partition,
                                             final double threshold) {
        final List<MatchResult> matches = new ArrayList<>();
        for (final Candidate candidate : partition) {
            final double score = scorer.score(query, candidate.name());
            if (score >= threshold) {
                matches.add(new MatchResult(candidate.file(), candidate.name().text(), score));
            }
        }
        matches.sort(MatchResult.RANKING);
        return matches;
    }

    private List<List<MatchResult>> runPartitions(final List<Callable<List<MatchResult>>> partitions) {
        try {
            return workerPool.invokeAll(partitions);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Search was interrupted", e);
        } catch (final ExecutionException e) {
            if (e.getCause() instanceof final RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException("Scoring failed: " + e.getCause().getMessage(), e.getCause());
        }
    }

    /**
     * K-way merge of partitions that are each sorted by {@link MatchResult#RANKING}.
     */
    static List<MatchResult> merge(final List<List<MatchResult>> sortedPartitions) {
        if (sortedPartitions.size() == 1) {
            return sortedPartitions.get(0);
        }

        int total = 0;
        final PriorityQueue<PartitionCursor> heads = new PriorityQueue<>(
                Math.max(1, sortedPartitions.size()),
                Comparator.comparing(PartitionCursor::current, MatchResult.RANKING));
        for (final List<MatchResult> partition : sortedPartitions) {
            total += partition.size();
            if (!partition.isEmpty()) {
                heads.add(new PartitionCursor(partition));
            }
        }

        final List<MatchResult> merged = new ArrayList<>(total);
        while (!heads.isEmpty()) {
            final PartitionCursor cursor = heads.poll();
            merged.add(cursor.current());
            if (cursor.advance()) {
                heads.add(cursor);
            }
        }
        return merged;
    }

    private List<Candidate> snapshot() throws StorageException {
        final long generation = indexStore.generation();
        try {
            return snapshotCache.get(generation, key -> loadSnapshot());
        } catch (final SnapshotLoadException e) {
            throw e.getCause();
        }
    }

    private List<Candidate> loadSnapshot() {
        try {
            final List<IndexedFile> files = indexStore.listFiles();
            final List<Candidate> candidates = new ArrayList<>(files.size());
            for (final IndexedFile file : files) {
                candidates.add(new Candidate(file, normalizer.normalize(file.name())));
            }
            logger.debug("Loaded search snapshot with {} files", candidates.size());
            return List.copyOf(candidates);
        } catch (final StorageException e) {
            throw new SnapshotLoadException(e);
        }
    }

    private record Candidate(IndexedFile file, NormalizedName name) {
    }

    private static final class PartitionCursor {

        private final List<MatchResult> partition;
        private int position;

        PartitionCursor(final List<MatchResult> partition) {
            this.partition = partition;
        }

        MatchResult current() {
            return partition.get(position);
        }

        boolean advance() {
            position++;
            return position < partition.size();
        }
    }

    /**
     * Carries a {@link StorageException} out of the cache loader.
     */
    private static final class SnapshotLoadException extends RuntimeException {

        SnapshotLoadException(final StorageException cause) {
            super(cause);
        }

        @Override
        public synchronized StorageException getCause() {
            return (StorageException) super.getCause();
        }
    }
}
