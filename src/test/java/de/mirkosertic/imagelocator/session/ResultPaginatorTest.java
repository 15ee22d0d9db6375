package de.mirkosertic.imagelocator.session;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ResultPaginator Tests")
class ResultPaginatorTest {

    @ParameterizedTest(name = "{0} items, page size {1}")
    @CsvSource({
            "0, 500",
            "1, 500",
            "499, 500",
            "500, 500",
            "501, 500",
            "1234, 500",
            "10, 1",
            "17, 4"
    })
    @DisplayName("Pages should cover the list exactly once and page count should be ceil(L / P)")
    void pagesCoverList(final int size, final int pageSize) {
        final List<Integer> items = IntStream.range(0, size).boxed().toList();
        final ResultPaginator<Integer> paginator = new ResultPaginator<>(items, pageSize);

        final List<Integer> collected = new ArrayList<>();
        for (int page = 0; page < paginator.pageCount(); page++) {
            final List<Integer> content = paginator.page(page);
            assertThat(content).hasSizeBetween(1, pageSize);
            collected.addAll(content);
        }

        assertThat(paginator.pageCount()).isEqualTo((size + pageSize - 1) / pageSize);
        assertThat(collected).containsExactlyElementsOf(items);
    }

    @Test
    @DisplayName("First page of an empty list should be empty")
    void emptyListHasEmptyFirstPage() {
        final ResultPaginator<String> paginator = new ResultPaginator<>(List.of(), 500);

        assertThat(paginator.pageCount()).isZero();
        assertThat(paginator.page(0)).isEmpty();
    }

    @Test
    @DisplayName("Pages outside the range should be rejected")
    void outOfRange() {
        final ResultPaginator<String> paginator = new ResultPaginator<>(List.of("a", "b", "c"), 2);

        assertThatThrownBy(() -> paginator.page(2)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> paginator.page(-1)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    @DisplayName("Pages should not be modifiable")
    void pagesAreReadOnly() {
        final ResultPaginator<String> paginator = new ResultPaginator<>(new ArrayList<>(List.of("a", "b")), 1);

        assertThatThrownBy(() -> paginator.page(0).add("c")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Non-positive page size should be rejected")
    void invalidPageSize() {
        assertThatThrownBy(() -> new ResultPaginator<>(List.of(), 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
