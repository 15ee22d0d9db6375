package de.mirkosertic.imagelocator.importer;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import de.mirkosertic.imagelocator.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Reads a CSV file with a header line into one map per record, keyed by column name.
 */
public class CsvIdentifierReader {

    private static final Logger logger = LoggerFactory.getLogger(CsvIdentifierReader.class);

    private final CsvMapper csvMapper;

    public CsvIdentifierReader() {
        this.csvMapper = new CsvMapper();
        this.csvMapper.enable(CsvParser.Feature.TRIM_SPACES);
        this.csvMapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    }

    public List<Map<String, String>> read(final Path csvFile) throws ValidationException {
        if (!Files.isRegularFile(csvFile)) {
            throw new ValidationException("CSV file does not exist: " + csvFile);
        }

        final CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (final InputStream is = Files.newInputStream(csvFile);
             final MappingIterator<Map<String, String>> iterator = csvMapper
                     .readerForMapOf(String.class)
                     .with(schema)
                     .readValues(is)) {
            final List<Map<String, String>> records = iterator.readAll();
            logger.info("Read {} records from {}", records.size(), csvFile);
            return records;
        } catch (final IOException e) {
            throw new ValidationException("Failed to read CSV file " + csvFile + ": " + e.getMessage(), e);
        }
    }
}
