package com.argus.validation.core.params;

import com.argus.validation.api.RuleSpecificationException;
import com.argus.validation.api.model.RowFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleParameterParserTest {

    private RuleParameterParser parser;

    @BeforeEach
    void setUp() {
        parser = new RuleParameterParser(100);
    }

    @Test
    @DisplayName("Field list drops blanks and trims names")
    void fieldList() {
        assertThat(parser.fieldList(" phone , ,address.city ").fields())
                .containsExactly("phone", "address.city");
    }

    @Test
    @DisplayName("Length set ignores non-numeric entries")
    void lengthSet() {
        LengthSet lengths = parser.lengthSet("5, x ,8");

        assertThat(lengths.accepts(5)).isTrue();
        assertThat(lengths.accepts(8)).isTrue();
        assertThat(lengths.accepts(6)).isFalse();
        assertThat(parser.lengthSet(null).accepts(0)).isFalse();
    }

    @Test
    @DisplayName("Numeric bound parses decimals and flags garbage")
    void numericBound() {
        assertThat(parser.numericBound(" 10.50 ").value()).isEqualByComparingTo(new BigDecimal("10.5"));
        assertThat(parser.numericBound("ten").isNumeric()).isFalse();
        assertThat(parser.numericBound(null)).isSameAs(NumericBound.NOT_NUMERIC);
    }

    @Test
    @DisplayName("Value list keeps empty entries")
    void valueList() {
        assertThat(parser.valueList(" red , ,blue").values()).containsExactly("red", "", "blue");
    }

    @Nested
    @DisplayName("Uniqueness specs")
    class UniqueSpecs {

        @Test
        @DisplayName("table.column without filter")
        void tableColumn() {
            UniqueSpec spec = parser.uniqueSpec("users.email");

            assertThat(spec.table()).isEqualTo("users");
            assertThat(spec.column()).isEqualTo("email");
            assertThat(spec.hasFilter()).isFalse();
            assertThat(spec.exclusion()).isSameAs(RowFilter.none());
        }

        @Test
        @DisplayName("Filter pair becomes exclusion and requirement")
        void filterPair() {
            UniqueSpec spec = parser.uniqueSpec(" users.email , id , 5 ");

            assertThat(spec.exclusion()).isEqualTo(RowFilter.excluding("id", "5"));
            assertThat(spec.requirement()).isEqualTo(RowFilter.requiring("id", "5"));
        }

        @Test
        @DisplayName("Unresolved placeholder means no filter")
        void placeholderMeansNoFilter() {
            assertThat(parser.uniqueSpec("users.email,id,{id}").hasFilter()).isFalse();
            assertThat(parser.uniqueSpec("users.email,id,").hasFilter()).isFalse();
            assertThat(parser.uniqueSpec("users.email,,5").hasFilter()).isFalse();
        }

        @Test
        @DisplayName("Extra dotted segments are ignored")
        void extraSegmentsIgnored() {
            UniqueSpec spec = parser.uniqueSpec("users.email.lower");

            assertThat(spec.table()).isEqualTo("users");
            assertThat(spec.column()).isEqualTo("email");
        }

        @Test
        @DisplayName("Missing column is rejected")
        void missingColumn() {
            assertThatThrownBy(() -> parser.uniqueSpec("users"))
                    .isInstanceOf(RuleSpecificationException.class)
                    .hasMessageContaining("table.column");
            assertThatThrownBy(() -> parser.uniqueSpec("users."))
                    .isInstanceOf(RuleSpecificationException.class);
            assertThatThrownBy(() -> parser.uniqueSpec(" "))
                    .isInstanceOf(RuleSpecificationException.class);
            assertThatThrownBy(() -> parser.uniqueSpec(null))
                    .isInstanceOf(RuleSpecificationException.class);
        }

        @Test
        @DisplayName("SQL-unsafe identifiers are rejected")
        void unsafeIdentifiers() {
            assertThatThrownBy(() -> parser.uniqueSpec("users.email;DROP TABLE users"))
                    .isInstanceOf(RuleSpecificationException.class)
                    .hasMessageContaining("Illegal identifier")
                    .satisfies(e -> assertThat(((RuleSpecificationException) e).getParameter())
                            .isEqualTo("users.email;DROP TABLE users"));
            assertThatThrownBy(() -> parser.uniqueSpec("users.email,id or 1=1,5"))
                    .isInstanceOf(RuleSpecificationException.class);
        }
    }

    @Nested
    @DisplayName("Caching")
    class Caching {

        @Test
        @DisplayName("Same parameter string is parsed once")
        void parsesOnce() {
            UniqueSpec first = parser.uniqueSpec("users.email,id,5");
            UniqueSpec second = parser.uniqueSpec("users.email,id,5");

            assertThat(second).isSameAs(first);
            assertThat(parser.stats().hitCount()).isEqualTo(1);
            assertThat(parser.stats().missCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Same text under different rule kinds is cached separately")
        void kindsAreSeparate() {
            parser.valueList("5,8");
            parser.lengthSet("5,8");

            assertThat(parser.stats().missCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("Parse failures are not cached")
        void failuresNotCached() {
            for (int i = 0; i < 2; i++) {
                assertThatThrownBy(() -> parser.uniqueSpec("no_column"))
                        .isInstanceOf(RuleSpecificationException.class);
            }
            assertThat(parser.cachedParameterCount()).isZero();
        }
    }

    @Test
    @DisplayName("Placeholder detection")
    void placeholderDetection() {
        assertThat(RuleParameterParser.isPlaceholder("{id}")).isTrue();
        assertThat(RuleParameterParser.isPlaceholder("5")).isFalse();
        assertThat(RuleParameterParser.isPlaceholder("{id} ")).isFalse();
        assertThat(RuleParameterParser.isPlaceholder(null)).isFalse();
    }
}
