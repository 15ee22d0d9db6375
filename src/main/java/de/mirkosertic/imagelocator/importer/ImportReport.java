package de.mirkosertic.imagelocator.importer;

import java.util.List;

/**
 * Outcome of one identifier import.
 *
 * @param processed         records looked at
 * @param imported          identifiers that were new to the index
 * @param skippedDuplicates identifiers already known, or repeated within the input
 * @param rejected          records without a usable identifier
 * @param errors            one message per rejected record
 */
public record ImportReport(
        long processed,
        long imported,
        long skippedDuplicates,
        long rejected,
        List<String> errors
) {

    public ImportReport {
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
