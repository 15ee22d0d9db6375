package de.mirkosertic.imagelocator.export;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes result rows as CSV with the columns {@code file_name, file_path, similarity}.
 */
public class ResultExporter {

    private static final Logger logger = LoggerFactory.getLogger(ResultExporter.class);

    private final CsvMapper csvMapper;
    private final CsvSchema schema;

    public ResultExporter() {
        // Quote only where the format requires it, so "87.50%" stays unquoted
        this.csvMapper = CsvMapper.builder()
                .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
                .enable(JsonGenerator.Feature.IGNORE_UNKNOWN)
                .build();
        this.schema = CsvSchema.builder()
                .addColumn("file_name")
                .addColumn("file_path")
                .addColumn("similarity")
                .setUseHeader(true)
                .build();
    }

    public void export(final List<ResultRow> rows, final Path target) throws IOException {
        final Path parent = target.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }

        try (final OutputStream os = Files.newOutputStream(target);
             final SequenceWriter writer = csvMapper.writer(schema).writeValues(os)) {
            writer.writeAll(rows);
        }
        logger.info("Exported {} results to {}", rows.size(), target);
    }
}
