package com.argus.validation.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExistenceQueryTest {

    @Test
    @DisplayName("Should default a missing filter to NoFilter")
    void shouldDefaultFilter() {
        ExistenceQuery query = new ExistenceQuery("users", "email", "a@b.com", null, null);

        assertThat(query.filter()).isInstanceOf(RowFilter.NoFilter.class);
        assertThat(new ExistenceQuery("users", "email", "a@b.com").filter()).isSameAs(RowFilter.none());
    }

    @Test
    @DisplayName("Should require table and column")
    void shouldRequireTableAndColumn() {
        assertThatThrownBy(() -> new ExistenceQuery(null, "email", "x"))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new ExistenceQuery("users", null, "x"))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Filters compare by column and value")
    void filtersCompareByValue() {
        assertThat(RowFilter.excluding("id", "5")).isEqualTo(new RowFilter.Excluding("id", "5"));
        assertThat(RowFilter.excluding("id", "5")).isNotEqualTo(RowFilter.requiring("id", "5"));
    }
}
