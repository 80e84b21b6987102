package com.lazyduck.io.parquet;

import com.lazyduck.frame.BinaryOperator;
import com.lazyduck.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for statistics-based pruning decisions.
 *
 * <p>Test ID prefix: TC-PRED-*
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("FilterPredicate Tests")
public class FilterPredicateTest {

    private static final ColumnStatistics TEN_TO_TWENTY = new ColumnStatistics(10L, 20L, 0);

    @ParameterizedTest(name = "x {0} {1} -> {2}")
    @CsvSource({
        "EQUAL, 5, false",
        "EQUAL, 10, true",
        "EQUAL, 15, true",
        "EQUAL, 21, false",
        "NOT_EQUAL, 15, true",
        "LESS_THAN, 10, false",
        "LESS_THAN, 11, true",
        "LESS_THAN_OR_EQUAL, 10, true",
        "GREATER_THAN, 20, false",
        "GREATER_THAN, 19, true",
        "GREATER_THAN_OR_EQUAL, 20, true",
        "GREATER_THAN_OR_EQUAL, 21, false"
    })
    @DisplayName("TC-PRED-001: Fragments are kept only when a row may match")
    void testMayMatch(BinaryOperator operator, long value, boolean expected) {
        assertThat(new FilterPredicate("x", operator, value).mayMatch(TEN_TO_TWENTY)).isEqualTo(expected);
    }

    @Test
    @DisplayName("TC-PRED-002: Not-equal prunes only constant fragments of that value")
    void testNotEqualOnConstant() {
        ColumnStatistics constant = new ColumnStatistics(7L, 7L, 0);

        assertThat(new FilterPredicate("x", BinaryOperator.NOT_EQUAL, 7L).mayMatch(constant)).isFalse();
        assertThat(new FilterPredicate("x", BinaryOperator.NOT_EQUAL, 8L).mayMatch(constant)).isTrue();
    }

    @Test
    @DisplayName("TC-PRED-003: Missing or incomparable statistics never prune")
    void testMissingStatistics() {
        FilterPredicate predicate = new FilterPredicate("x", BinaryOperator.EQUAL, 5L);

        assertThat(predicate.mayMatch(null)).isTrue();
        assertThat(predicate.mayMatch(new ColumnStatistics(null, null, 3))).isTrue();
        assertThat(predicate.mayMatch(new ColumnStatistics("a", "z", 0))).isTrue();
    }

    @Test
    @DisplayName("TC-PRED-004: Row test treats null like the filter kernel does")
    void testRowTest() {
        FilterPredicate greater = new FilterPredicate("x", BinaryOperator.GREATER_THAN, 3L);
        FilterPredicate notEqual = new FilterPredicate("x", BinaryOperator.NOT_EQUAL, 3L);

        assertThat(greater.test(4L)).isTrue();
        assertThat(greater.test(3L)).isFalse();
        assertThat(greater.test(null)).isFalse();
        assertThat(notEqual.test(null)).isTrue();
        assertThat(notEqual.test(3L)).isFalse();
    }

    @Test
    @DisplayName("TC-PRED-007: Not-equal keeps constant fragments that hold nulls")
    void testNotEqualWithNulls() {
        ColumnStatistics constantWithNulls = new ColumnStatistics(7L, 7L, 2);

        assertThat(new FilterPredicate("x", BinaryOperator.NOT_EQUAL, 7L).mayMatch(constantWithNulls)).isTrue();
        assertThat(new FilterPredicate("x", BinaryOperator.EQUAL, 8L).mayMatch(constantWithNulls)).isFalse();
    }

    @Test
    @DisplayName("TC-PRED-008: SQL rendering admits nulls only for not-equal")
    void testToSql() {
        assertThat(new FilterPredicate("x", BinaryOperator.NOT_EQUAL, 5L).toSql())
            .isEqualTo("(\"x\" <> 5 OR \"x\" IS NULL)");
        assertThat(new FilterPredicate("x", BinaryOperator.GREATER_THAN_OR_EQUAL, "k").toSql())
            .isEqualTo("\"x\" >= 'k'");
    }

    @Test
    @DisplayName("TC-PRED-005: Only comparisons can be pushed")
    void testRejectsArithmetic() {
        assertThatThrownBy(() -> new FilterPredicate("x", BinaryOperator.ADD, 1L))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FilterPredicate("x", BinaryOperator.EQUAL, null))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("TC-PRED-006: Equal predicates have equal tokens")
    void testToken() {
        FilterPredicate first = new FilterPredicate("x", BinaryOperator.EQUAL, 5L);
        FilterPredicate second = new FilterPredicate("x", BinaryOperator.EQUAL, 5L);
        FilterPredicate other = new FilterPredicate("x", BinaryOperator.EQUAL, 5.0);

        assertThat(first.token()).isEqualTo(second.token());
        assertThat(first.token()).isNotEqualTo(other.token());
        assertThat(first).hasToString("(x == 5)");
    }
}
