package de.mirkosertic.imagelocator.export;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import de.mirkosertic.imagelocator.search.MatchResult;

import java.util.Locale;

/**
 * One row of the result table: file name, score and absolute path.
 */
@JsonPropertyOrder({"file_name", "file_path", "similarity"})
public record ResultRow(
        @JsonProperty("file_name") String name,
        @JsonIgnore double score,
        @JsonProperty("file_path") String path
) {

    public static ResultRow of(final MatchResult result) {
        return new ResultRow(result.file().name(), result.score(), result.file().path());
    }

    /**
     * The score as a percentage with two decimals, e.g. {@code 87.50%}.
     */
    @JsonProperty("similarity")
    public String similarity() {
        return String.format(Locale.ROOT, "%.2f%%", score * 100.0);
    }
}
