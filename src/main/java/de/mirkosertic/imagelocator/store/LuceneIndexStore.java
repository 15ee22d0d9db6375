package de.mirkosertic.imagelocator.store;

import de.mirkosertic.imagelocator.StorageException;
import de.mirkosertic.imagelocator.config.BuildInfo;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.SegmentInfos;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.apache.lucene.store.LockObtainFailedException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Lucene backed {@link IndexStore}.
 * <p>
 * One {@link IndexWriter} lives for the lifetime of the store. All writes are serialized
 * by a single lock; every batch is committed and the {@link SearcherManager} is refreshed
 * only afterwards, so readers acquire point-in-time searchers that never expose half a batch.
 */
public class LuceneIndexStore implements IndexStore {

    private static final Logger logger = LoggerFactory.getLogger(LuceneIndexStore.class);

    static final String SCHEMA_VERSION_KEY = "schema_version";
    static final String SOFTWARE_VERSION_KEY = "software_version";

    private static final int NO_EXISTING_INDEX = -1;

    private final Path indexPath;
    private final ReentrantLock writeLock = new ReentrantLock();
    private final AtomicLong generation = new AtomicLong(0);

    private Directory directory;
    private IndexWriter indexWriter;
    private SearcherManager searcherManager;
    private volatile boolean open;

    private int storedSchemaVersion = NO_EXISTING_INDEX;

    public LuceneIndexStore(final Path indexPath) {
        this.indexPath = indexPath;
    }

    /**
     * Open or create the index. Must be called before using the store.
     */
    public void init() throws StorageException {
        try {
            if (!Files.exists(indexPath)) {
                Files.createDirectories(indexPath);
                logger.info("Created index directory: {}", indexPath.toAbsolutePath());
            }

            directory = FSDirectory.open(indexPath);
            storedSchemaVersion = readStoredSchemaVersion(directory);

            final IndexWriterConfig config = new IndexWriterConfig(new StandardAnalyzer());
            config.setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
            indexWriter = new IndexWriter(directory, config);

            // Commit to ensure index files and the current schema version are present
            indexWriter.setLiveCommitData(commitData().entrySet());
            indexWriter.commit();

            searcherManager = new SearcherManager(indexWriter, null);
            open = true;

            logger.info("Index store opened at: {} (stored schema version {}, current {})",
                    indexPath.toAbsolutePath(), storedSchemaVersion, StoreDocuments.SCHEMA_VERSION);
        } catch (final LockObtainFailedException e) {
            releaseResources();
            throw new StorageException("Index at " + indexPath + " is locked by another process", e);
        } catch (final IOException e) {
            releaseResources();
            throw new StorageException("Failed to open index at " + indexPath + ": " + e.getMessage(), e);
        }
    }

    private static int readStoredSchemaVersion(final Directory directory) throws IOException {
        if (!DirectoryReader.indexExists(directory)) {
            return NO_EXISTING_INDEX;
        }
        final Map<String, String> userData = SegmentInfos.readLatestCommit(directory).getUserData();
        final String version = userData.get(SCHEMA_VERSION_KEY);
        if (version == null) {
            return 0;
        }
        try {
            return Integer.parseInt(version);
        } catch (final NumberFormatException e) {
            logger.warn("Unreadable schema version '{}' in index commit data", version);
            return 0;
        }
    }

    private static Map<String, String> commitData() {
        return Map.of(
                SCHEMA_VERSION_KEY, Integer.toString(StoreDocuments.SCHEMA_VERSION),
                SOFTWARE_VERSION_KEY, BuildInfo.current().version());
    }

    /**
     * True if the index was written with a different schema version than the current one.
     * A freshly created index never requires an upgrade.
     */
    public boolean isSchemaUpgradeRequired() {
        return storedSchemaVersion != NO_EXISTING_INDEX && storedSchemaVersion != StoreDocuments.SCHEMA_VERSION;
    }

    /**
     * Schema version found in the index when it was opened, -1 for a new index.
     */
    public int getSchemaVersionAtOpen() {
        return storedSchemaVersion;
    }

    /**
     * Schema version of the latest commit.
     */
    public int getIndexSchemaVersion() throws StorageException {
        final String version = latestCommitData().get(SCHEMA_VERSION_KEY);
        try {
            return version == null ? 0 : Integer.parseInt(version);
        } catch (final NumberFormatException e) {
            throw new StorageException("Unreadable schema version in index commit data: " + version, e);
        }
    }

    /**
     * Software version that wrote the latest commit.
     */
    public @Nullable String getIndexSoftwareVersion() throws StorageException {
        return latestCommitData().get(SOFTWARE_VERSION_KEY);
    }

    private Map<String, String> latestCommitData() throws StorageException {
        ensureOpen();
        try {
            return SegmentInfos.readLatestCommit(directory).getUserData();
        } catch (final IOException e) {
            throw new StorageException("Failed to read index commit data: " + e.getMessage(), e);
        }
    }

    public Path getIndexPath() {
        return indexPath;
    }

    @Override
    public UpsertResult upsertFiles(final Collection<IndexedFile> files) throws StorageException {
        return upsert(files, IndexedFile::path,
                file -> StoreDocuments.fileKey(file.path()),
                StoreDocuments::createFileDocument,
                "files");
    }

    @Override
    public UpsertResult upsertReferenceIds(final Collection<ReferenceIdentifier> identifiers) throws StorageException {
        return upsert(identifiers, ReferenceIdentifier::key,
                StoreDocuments::referenceKey,
                StoreDocuments::createReferenceDocument,
                "reference identifiers");
    }

    private <T> UpsertResult upsert(final Collection<T> records,
                                    final Function<T, String> keyFunction,
                                    final Function<T, Term> termFunction,
                                    final Function<T, Document> documentFunction,
                                    final String recordKind) throws StorageException {
        if (records.isEmpty()) {
            return UpsertResult.EMPTY;
        }
        ensureOpen();

        writeLock.lock();
        try {
            int inserted = 0;
            int skipped = 0;
            final Set<String> seenInBatch = new HashSet<>();

            final IndexSearcher searcher = searcherManager.acquire();
            try {
                for (final T record : records) {
                    if (!seenInBatch.add(keyFunction.apply(record))
                            || searcher.count(new TermQuery(termFunction.apply(record))) > 0) {
                        skipped++;
                        continue;
                    }
                    indexWriter.addDocument(documentFunction.apply(record));
                    inserted++;
                }
            } finally {
                searcherManager.release(searcher);
            }

            commitAndRefresh(inserted > 0);
            logger.debug("Upserted {} {}: {} inserted, {} already present", records.size(), recordKind, inserted, skipped);
            return new UpsertResult(inserted, skipped);
        } catch (final IOException e) {
            throw new StorageException("Failed to store " + recordKind + ": " + e.getMessage(), e);
        } finally {
            writeLock.unlock();
        }
    }

    private void commitAndRefresh(final boolean contentChanged) throws IOException {
        indexWriter.setLiveCommitData(commitData().entrySet());
        indexWriter.commit();
        searcherManager.maybeRefreshBlocking();
        if (contentChanged) {
            generation.incrementAndGet();
        }
    }

    @Override
    public List<IndexedFile> listFiles() throws StorageException {
        ensureOpen();
        try {
            final IndexSearcher searcher = searcherManager.acquire();
            try {
                final Query query = StoreDocuments.allOfType(StoreDocuments.TYPE_FILE);
                final int count = searcher.count(query);
                if (count == 0) {
                    return List.of();
                }
                final TopDocs topDocs = searcher.search(query, count);
                final StoredFields storedFields = searcher.storedFields();
                final List<IndexedFile> files = new ArrayList<>(topDocs.scoreDocs.length);
                for (final ScoreDoc scoreDoc : topDocs.scoreDocs) {
                    files.add(StoreDocuments.toIndexedFile(storedFields.document(scoreDoc.doc)));
                }
                return files;
            } finally {
                searcherManager.release(searcher);
            }
        } catch (final IOException e) {
            throw new StorageException("Failed to read indexed files: " + e.getMessage(), e);
        }
    }

    @Override
    public long countFiles() throws StorageException {
        return count(StoreDocuments.TYPE_FILE);
    }

    @Override
    public long countReferenceIds() throws StorageException {
        return count(StoreDocuments.TYPE_REFERENCE);
    }

    private long count(final String recordType) throws StorageException {
        ensureOpen();
        try {
            final IndexSearcher searcher = searcherManager.acquire();
            try {
                return searcher.count(StoreDocuments.allOfType(recordType));
            } finally {
                searcherManager.release(searcher);
            }
        } catch (final IOException e) {
            throw new StorageException("Failed to count records: " + e.getMessage(), e);
        }
    }

    @Override
    public void clearAll() throws StorageException {
        ensureOpen();
        writeLock.lock();
        try {
            indexWriter.deleteAll();
            commitAndRefresh(true);
            logger.info("Cleared all indexed files and reference identifiers");
        } catch (final IOException e) {
            throw new StorageException("Failed to clear the cache: " + e.getMessage(), e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public long generation() {
        return generation.get();
    }

    private void ensureOpen() throws StorageException {
        if (!open) {
            throw new StorageException("Index store at " + indexPath + " is not open");
        }
    }

    /**
     * Close the store and release all resources.
     */
    @Override
    public void close() throws StorageException {
        writeLock.lock();
        try {
            if (!open) {
                return;
            }
            open = false;
            searcherManager.close();
            indexWriter.close();
            directory.close();
            logger.info("Index store closed");
        } catch (final IOException e) {
            throw new StorageException("Failed to close index at " + indexPath + ": " + e.getMessage(), e);
        } finally {
            writeLock.unlock();
        }
    }

    private void releaseResources() {
        try {
            if (indexWriter != null) {
                indexWriter.close();
            }
        } catch (final IOException e) {
            logger.warn("Failed to close index writer after failed open", e);
        }
        try {
            if (directory != null) {
                directory.close();
            }
        } catch (final IOException e) {
            logger.warn("Failed to close index directory after failed open", e);
        }
        indexWriter = null;
        directory = null;
    }
}
