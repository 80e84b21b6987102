package com.lazyduck.expression;

import com.lazyduck.LazyFrames;
import com.lazyduck.exception.ColumnNotFoundException;
import com.lazyduck.exception.DivisionMismatchException;
import com.lazyduck.exception.PlanConstructionException;
import com.lazyduck.exception.UnknownAttributeException;
import com.lazyduck.exception.UnknownCategoriesException;
import com.lazyduck.io.FromTable;
import com.lazyduck.test.Fixtures;
import com.lazyduck.test.TestBase;
import com.lazyduck.test.TestCategories;
import com.lazyduck.types.CategoricalType;
import com.lazyduck.types.LongType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for expression identity, construction and traversal.
 *
 * <p>Test ID prefix: TC-EXPR-*
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Expression Tests")
public class ExprTest extends TestBase {

    private final Expr df = LazyFrames.fromTable(Fixtures.abc(100), 4);

    @Nested
    @DisplayName("Identity")
    class Identity {

        @Test
        @DisplayName("TC-EXPR-001: Equal structure gives equal names")
        void testNameDeterminism() {
            Expr first = df.get("a").add(1);
            Expr second = LazyFrames.fromTable(Fixtures.abc(100), 4).get("a").add(1);

            assertThat(first.name()).isEqualTo(second.name());
            assertThat(first).isEqualTo(second);
            assertThat(first.hashCode()).isEqualTo(second.hashCode());
        }

        @Test
        @DisplayName("TC-EXPR-002: Names start with the kind")
        void testNameHasKindPrefix() {
            assertThat(df.get("a").add(1).name()).startsWith("add-");
            assertThat(df.name()).startsWith("from-table-");
        }

        @Test
        @DisplayName("TC-EXPR-003: Different operands give different names")
        void testNamesDiffer() {
            assertThat(df.get("a").add(1).name()).isNotEqualTo(df.get("a").add(2).name());
            assertThat(df.get("a").add(1).name()).isNotEqualTo(df.get("b").add(1).name());
            assertThat(new Binop.Add(df.get("a"), 1).name()).isNotEqualTo(new Binop.Subtract(df.get("a"), 1).name());
        }

        @Test
        @DisplayName("TC-EXPR-004: Name is memoized")
        void testNameMemoized() {
            Expr expr = df.get("a").multiply(3);
            assertThat(expr.name()).isSameAs(expr.name());
        }
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("TC-EXPR-010: Named operands fill defaults")
        void testNamedConstruction() {
            Head head = Head.SIGNATURE.create(Map.of("frame", df));
            assertThat(head.n()).isEqualTo(5);
            assertThat(head).isEqualTo(new Head(df, 5));
        }

        @Test
        @DisplayName("TC-EXPR-011: Unknown parameter is rejected")
        void testUnknownParameter() {
            assertThatThrownBy(() -> Head.SIGNATURE.create(Map.of("frame", df, "rows", 3)))
                .isInstanceOf(PlanConstructionException.class)
                .hasMessageContaining("rows");
        }

        @Test
        @DisplayName("TC-EXPR-012: Missing required operand is rejected")
        void testMissingOperand() {
            assertThatThrownBy(() -> Projection.SIGNATURE.create(Map.of("frame", df)))
                .isInstanceOf(PlanConstructionException.class)
                .hasMessageContaining("columns");
        }

        @Test
        @DisplayName("TC-EXPR-013: Too many positional operands are rejected")
        void testTooManyOperands() {
            assertThatThrownBy(() -> Binop.Add.SIGNATURE.create(df, 1, 2))
                .isInstanceOf(PlanConstructionException.class);
        }

        @Test
        @DisplayName("TC-EXPR-014: Selecting a missing column fails with the available columns")
        void testMissingColumn() {
            assertThatThrownBy(() -> df.get("z"))
                .isInstanceOf(ColumnNotFoundException.class)
                .satisfies(e -> assertThat(((ColumnNotFoundException) e).getAvailableColumns())
                    .containsExactly("a", "b", "c"));
            assertThatThrownBy(() -> df.get(List.of("a", "z")))
                .isInstanceOf(ColumnNotFoundException.class);
        }

        @Test
        @DisplayName("TC-EXPR-015: Misaligned operands fail on divisions")
        void testDivisionMismatch() {
            Expr other = LazyFrames.fromTable(Fixtures.abc(100), 3);
            Expr sum = df.get("a").add(other.get("a"));

            assertThatThrownBy(sum::divisions).isInstanceOf(DivisionMismatchException.class);
        }

        @Test
        @DisplayName("TC-EXPR-016: Partition selection must be ascending and in range")
        void testPartitionsValidation() {
            assertThatThrownBy(() -> df.partitions(2, 1)).isInstanceOf(PlanConstructionException.class);
            assertThatThrownBy(() -> df.partitions(4)).isInstanceOf(PlanConstructionException.class);
            assertThat(df.partitions(1, 3).npartitions()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Attributes")
    class Attributes {

        @Test
        @DisplayName("TC-EXPR-020: Properties are looked up before operands")
        void testPropertyLookup() {
            Expr head = df.head(3);
            assertThat(head.attribute("npartitions")).isEqualTo(1);
            assertThat(head.attribute("kind")).isEqualTo("head");
            assertThat(head.attribute("n")).isEqualTo(3);
        }

        @Test
        @DisplayName("TC-EXPR-021: Operand named like a builder method is reachable")
        void testOperandCollidingWithMethod() {
            Expr selected = df.partitions(0, 2);
            assertThat(selected.operand("partitions")).isEqualTo(List.of(0, 2));
            assertThat(selected.attribute("partitions")).isEqualTo(List.of(0, 2));
        }

        @Test
        @DisplayName("TC-EXPR-022: Unknown attribute names the kind")
        void testUnknownAttribute() {
            assertThatThrownBy(() -> df.head(3).attribute("nrows"))
                .isInstanceOf(UnknownAttributeException.class)
                .hasMessageContaining("nrows");
        }

        @Test
        @DisplayName("TC-EXPR-023: Categories must be known")
        void testUnknownCategories() {
            Expr categorical = df.get("a").astype(CategoricalType.unknown());

            assertThatThrownBy(categorical::categoryCodes)
                .isInstanceOf(UnknownCategoriesException.class);
            assertThat(categorical.setCategories(List.of("0", "1")).categories()).containsExactly("0", "1");
        }
    }

    @Nested
    @DisplayName("Traversal")
    class Traversal {

        @Test
        @DisplayName("TC-EXPR-030: Dependencies exclude literals")
        void testDependencies() {
            Expr sum = df.get("a").add(1);
            assertThat(sum.dependencies()).hasSize(1);
            assertThat(sum.dependencies().get(0).kind()).isEqualTo("projection");
        }

        @Test
        @DisplayName("TC-EXPR-031: findAll visits shared nodes once")
        void testFindAll() {
            Expr a = df.get("a");
            Expr expr = a.add(a.multiply(2));

            assertThat(expr.findAll(FromTable.class)).hasSize(1);
            assertThat(expr.findAll(Projection.class)).hasSize(1);
            assertThat(expr.findAll(Binop.class)).hasSize(2);
        }

        @Test
        @DisplayName("TC-EXPR-032: Substitute replaces by name and keeps unchanged nodes")
        void testSubstitute() {
            Expr a = df.get("a");
            Expr b = df.get("b");
            Expr expr = a.add(1);

            Expr replaced = expr.substitute(Map.of(a.name(), b));
            assertThat(replaced).isEqualTo(b.add(1));
            assertThat(expr.substitute(Map.of())).isSameAs(expr);
        }

        @Test
        @DisplayName("TC-EXPR-033: withParameters returns the same node when nothing changes")
        void testWithParameters() {
            Expr head = df.head(3);
            assertThat(head.withParameters(Map.of("n", 3))).isSameAs(head);
            assertThat(head.withParameters(Map.of("n", 4))).isEqualTo(df.head(4));
            assertThatThrownBy(() -> head.withParameters(Map.of("rows", 4)))
                .isInstanceOf(UnknownAttributeException.class);
        }

        @Test
        @DisplayName("TC-EXPR-034: explain prints shared nodes once")
        void testExplain() {
            Expr a = df.get("a");
            String explained = a.add(a).explain();
            logData("explain", explained);

            assertThat(explained).startsWith("add");
            assertThat(explained).contains("(shared)");
        }
    }

    @Nested
    @DisplayName("Meta")
    class MetaTests {

        @Test
        @DisplayName("TC-EXPR-040: Blockwise meta is computed from empty inputs")
        void testBlockwiseMeta() {
            Expr expr = df.get("a").add(1);
            assertThat(expr.meta().isSeries()).isTrue();
            assertThat(expr.meta().dataType()).isEqualTo(LongType.get());
            assertThat(expr.ndim()).isEqualTo(1);
        }

        @Test
        @DisplayName("TC-EXPR-041: Reduction of a frame is a series, of a series a scalar")
        void testReductionMeta() {
            assertThat(df.sum().meta().isSeries()).isTrue();
            assertThat(df.get("a").sum().meta().isScalar()).isTrue();
            assertThat(df.sum().npartitions()).isEqualTo(1);
            assertThat(df.sum().knownDivisions()).isFalse();
        }

        @Test
        @DisplayName("TC-EXPR-042: Elementwise operators keep divisions")
        void testDivisionsPassThrough() {
            Expr expr = df.get("a").add(1);
            assertThat(expr.divisions()).isEqualTo(df.divisions());
            assertThat(df.divisions()).containsExactly(0L, 25L, 50L, 75L, 99L);
        }

        @Test
        @DisplayName("TC-EXPR-043: Non-monotonic index mapping clears divisions")
        void testMapIndexDivisions() {
            assertThat(df.mapIndex(v -> -((Long) v), false).knownDivisions()).isFalse();
            assertThat(df.mapIndex(v -> (Long) v * 2, true).divisions())
                .containsExactly(0L, 50L, 100L, 150L, 198L);
        }
    }
}
