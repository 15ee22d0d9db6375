package de.mirkosertic.imagelocator.search;

import de.mirkosertic.imagelocator.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SearchQuery Tests")
class SearchQueryTest {

    @Test
    @DisplayName("Valid query should keep the trimmed text")
    void validQuery() throws ValidationException {
        final SearchQuery query = SearchQuery.of("  HH001 ", 0.7);

        assertThat(query.text()).isEqualTo("HH001");
        assertThat(query.threshold()).isEqualTo(0.7);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "_-.", " _ "})
    @DisplayName("Text without searchable characters should be rejected")
    void rejectsEmptyText(final String text) {
        assertThatThrownBy(() -> SearchQuery.of(text, 0.7))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Null text should be rejected")
    void rejectsNullText() {
        assertThatThrownBy(() -> SearchQuery.of(null, 0.7))
                .isInstanceOf(ValidationException.class);
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.49, 1.01, -1.0, Double.NaN})
    @DisplayName("Threshold outside [0.5, 1.0] should be rejected")
    void rejectsThresholdOutOfRange(final double threshold) {
        assertThatThrownBy(() -> SearchQuery.of("HH001", threshold))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("threshold");
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.5, 0.75, 1.0})
    @DisplayName("Thresholds on and inside the bounds should be accepted")
    void acceptsThresholdInRange(final double threshold) throws ValidationException {
        assertThat(SearchQuery.of("HH001", threshold).threshold()).isEqualTo(threshold);
    }
}
