package de.mirkosertic.imagelocator.importer;

import de.mirkosertic.imagelocator.StorageException;
import de.mirkosertic.imagelocator.ValidationException;
import de.mirkosertic.imagelocator.store.IndexStore;
import de.mirkosertic.imagelocator.store.ReferenceIdentifier;
import de.mirkosertic.imagelocator.store.UpsertResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates externally supplied identifiers and stores the new ones.
 */
public class IdentifierImporter {

    private static final Logger logger = LoggerFactory.getLogger(IdentifierImporter.class);

    private final IndexStore indexStore;

    public IdentifierImporter(final IndexStore indexStore) {
        this.indexStore = indexStore;
    }

    /**
     * Import one identifier per value. Values are trimmed; empty values are rejected and reported
     * with their 1-based line number.
     */
    public ImportReport importIdentifiers(final List<String> values) throws ValidationException, StorageException {
        return importValues(values, 1);
    }

    private ImportReport importValues(final List<String> values, final int firstLine)
            throws ValidationException, StorageException {
        if (values.isEmpty()) {
            throw new ValidationException("No identifier records found in the input");
        }

        final Instant importedAt = Instant.now();
        final List<ReferenceIdentifier> identifiers = new ArrayList<>(values.size());
        final List<String> errors = new ArrayList<>();

        for (int i = 0; i < values.size(); i++) {
            final String value = values.get(i);
            if (value == null || value.isBlank()) {
                errors.add("Line " + (firstLine + i) + ": Empty identifier value");
                continue;
            }
            identifiers.add(new ReferenceIdentifier(value.trim(), importedAt));
        }

        final UpsertResult result = indexStore.upsertReferenceIds(identifiers);
        final ImportReport report = new ImportReport(values.size(), result.inserted(), result.skipped(), errors.size(), errors);

        logger.info("Imported {} identifiers ({} duplicates skipped, {} rejected)",
                report.imported(), report.skippedDuplicates(), report.rejected());
        if (!errors.isEmpty()) {
            logger.warn("Rejected {} identifier records, first: {}", errors.size(), errors.get(0));
        }
        return report;
    }

    /**
     * Import the identifiers found in the given field of each record. The field name is matched
     * case-insensitively against the record keys. Rejected records are reported with their line in
     * the headed source file.
     */
    public ImportReport importRecords(final List<Map<String, String>> records, final String field)
            throws ValidationException, StorageException {
        if (records.isEmpty()) {
            throw new ValidationException("No identifier records found in the input");
        }

        final String column = resolveColumn(records, field);
        final List<String> values = new ArrayList<>(records.size());
        for (final Map<String, String> record : records) {
            values.add(record.get(column));
        }
        // Line 1 is the header
        return importValues(values, 2);
    }

    private static String resolveColumn(final List<Map<String, String>> records, final String field)
            throws ValidationException {
        final String wanted = field == null ? "" : field.trim();
        final Set<String> available = new LinkedHashSet<>();
        for (final Map<String, String> record : records) {
            available.addAll(record.keySet());
        }
        for (final String column : available) {
            if (column != null && column.trim().equalsIgnoreCase(wanted)) {
                return column;
            }
        }
        throw new ValidationException("Input must contain a '" + wanted + "' column, found: " + available);
    }
}
