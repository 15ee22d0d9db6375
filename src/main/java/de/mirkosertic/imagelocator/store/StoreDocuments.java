package de.mirkosertic.imagelocator.store;

import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.IndexableField;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.TermQuery;

import java.time.Instant;

/**
 * Creates and reads Lucene documents with a consistent field schema for both record sets.
 */
public final class StoreDocuments {

    /**
     * Schema version for the index.
     * MUST be incremented whenever the index schema changes (fields added/removed/modified).
     * Version 1: files and reference identifiers in one index, discriminated by record_type.
     */
    public static final int SCHEMA_VERSION = 1;

    public static final String RECORD_TYPE = "record_type";
    public static final String TYPE_FILE = "file";
    public static final String TYPE_REFERENCE = "reference";

    public static final String FILE_PATH = "file_path";
    public static final String FILE_NAME = "file_name";
    public static final String DISCOVERED_AT = "discovered_at";

    public static final String REFERENCE_KEY = "reference_key";
    public static final String REFERENCE_TEXT = "reference_text";
    public static final String IMPORTED_AT = "imported_at";

    private StoreDocuments() {
    }

    public static Document createFileDocument(final IndexedFile file) {
        final Document doc = new Document();
        doc.add(new StringField(RECORD_TYPE, TYPE_FILE, Field.Store.NO));

        // file_path - unique ID (not analyzed, stored)
        doc.add(new StringField(FILE_PATH, file.path(), Field.Store.YES));
        doc.add(new StoredField(FILE_NAME, file.name()));
        doc.add(new StoredField(DISCOVERED_AT, file.discoveredAt().toEpochMilli()));
        return doc;
    }

    public static Document createReferenceDocument(final ReferenceIdentifier identifier) {
        final Document doc = new Document();
        doc.add(new StringField(RECORD_TYPE, TYPE_REFERENCE, Field.Store.NO));

        // reference_key - case folded unique ID, the original spelling is kept in reference_text
        doc.add(new StringField(REFERENCE_KEY, identifier.key(), Field.Store.NO));
        doc.add(new StoredField(REFERENCE_TEXT, identifier.text().trim()));
        doc.add(new StoredField(IMPORTED_AT, identifier.importedAt().toEpochMilli()));
        return doc;
    }

    public static IndexedFile toIndexedFile(final Document doc) {
        return new IndexedFile(
                doc.get(FILE_PATH),
                doc.get(FILE_NAME),
                readInstant(doc, DISCOVERED_AT));
    }

    public static Term fileKey(final String path) {
        return new Term(FILE_PATH, path);
    }

    public static Term referenceKey(final ReferenceIdentifier identifier) {
        return new Term(REFERENCE_KEY, identifier.key());
    }

    public static Query allOfType(final String recordType) {
        return new TermQuery(new Term(RECORD_TYPE, recordType));
    }

    private static Instant readInstant(final Document doc, final String fieldName) {
        final IndexableField field = doc.getField(fieldName);
        if (field == null || field.numericValue() == null) {
            return Instant.EPOCH;
        }
        return Instant.ofEpochMilli(field.numericValue().longValue());
    }
}
