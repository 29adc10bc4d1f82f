package com.finpulse.ingest.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("LoadResult Unit Tests")
class LoadResultTest {

    @Test
    @DisplayName("Should fold outcomes into counts with 1-based error positions")
    void shouldFoldOutcomes() {
        List<RowOutcome> outcomes = List.of(
                new RowOutcome.Inserted("a"),
                new RowOutcome.Duplicate("b"),
                new RowOutcome.Failed("amount is missing"),
                new RowOutcome.Inserted("c"));

        LoadResult result = LoadResult.fold(outcomes);

        assertThat(result.saved()).isEqualTo(2);
        assertThat(result.duplicates()).isEqualTo(1);
        assertThat(result.errors()).containsExactly(new RowError(3, "amount is missing"));
    }

    @Test
    @DisplayName("Should expose an immutable error list")
    void shouldExposeImmutableErrors() {
        List<RowError> errors = new ArrayList<>();
        errors.add(new RowError(1, "bad"));
        LoadResult result = new LoadResult(0, 0, errors);

        errors.clear();

        assertThat(result.errors()).hasSize(1);
        assertThatThrownBy(() -> result.errors().add(new RowError(2, "worse")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should render row errors with their position")
    void shouldRenderRowErrors() {
        assertThat(new RowError(4, "amount 'abc' is not numeric"))
                .hasToString("Row 4: amount 'abc' is not numeric");
    }
}
