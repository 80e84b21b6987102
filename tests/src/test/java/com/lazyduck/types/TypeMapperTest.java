package com.lazyduck.types;

import com.lazyduck.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Test ID prefix: TC-TYPE-*
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Type mapping and coercion Tests")
public class TypeMapperTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
        "SMALLINT, int",
        "integer, int",
        "BIGINT, long",
        "UBIGINT, string",
        "HUGEINT, string",
        "'DECIMAL(18,3)', double",
        "FLOAT, double",
        "BOOLEAN, boolean",
        "VARCHAR, string",
        "TIMESTAMP, string"
    })
    @DisplayName("TC-TYPE-001: DuckDB column types resolve")
    void testFromDuckDBType(String duckdb, String expected) {
        assertThat(TypeMapper.fromDuckDBType(duckdb).typeName()).isEqualTo(expected);
    }

    @Test
    @DisplayName("TC-TYPE-002: Nested column types are rejected")
    void testNestedRejected() {
        assertThatThrownBy(() -> TypeMapper.fromDuckDBType("INTEGER[]"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("TC-TYPE-003: Statistics parse per type, garbage parses to null")
    void testParseValue() {
        assertThat(TypeMapper.parseValue("42", LongType.get())).isEqualTo(42L);
        assertThat(TypeMapper.parseValue(" 7 ", IntegerType.get())).isEqualTo(7);
        assertThat(TypeMapper.parseValue("1.5", DoubleType.get())).isEqualTo(1.5d);
        assertThat(TypeMapper.parseValue("abc", StringType.get())).isEqualTo("abc");
        assertThat(TypeMapper.parseValue("abc", LongType.get())).isNull();
        assertThat(TypeMapper.parseValue(null, LongType.get())).isNull();
    }

    @Test
    @DisplayName("TC-TYPE-004: Values coerce to the target representation")
    void testCoerce() {
        assertThat(TypeCoercion.coerce(3, LongType.get())).isEqualTo(3L);
        assertThat(TypeCoercion.coerce(true, IntegerType.get())).isEqualTo(1);
        assertThat(TypeCoercion.coerce("2.5", DoubleType.get())).isEqualTo(2.5d);
        assertThat(TypeCoercion.coerce(0L, BooleanType.get())).isEqualTo(false);
        assertThat(TypeCoercion.coerce(12, StringType.get())).isEqualTo("12");
        assertThat(TypeCoercion.coerce(null, LongType.get())).isNull();
        assertThatThrownBy(() -> TypeCoercion.coerce("x", LongType.get()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("TC-TYPE-005: Numeric types unify upward")
    void testUnify() {
        assertThat(TypeCoercion.unifyTypes(IntegerType.get(), LongType.get())).isEqualTo(LongType.get());
        assertThat(TypeCoercion.unifyTypes(LongType.get(), DoubleType.get())).isEqualTo(DoubleType.get());
        assertThat(TypeCoercion.unifyTypes(UnresolvedType.get(), StringType.get())).isEqualTo(StringType.get());
        assertThat(TypeCoercion.unifyTypes(null, BooleanType.get())).isEqualTo(BooleanType.get());
    }

    @Test
    @DisplayName("TC-TYPE-006: Struct columns are unique and ordered")
    void testStructType() {
        StructType schema = new StructType(List.of(
            new StructField("b", LongType.get()), new StructField("a", StringType.get())));

        assertThat(schema.fieldNames()).containsExactly("b", "a");
        assertThat(schema.fieldByName("a").dataType()).isEqualTo(StringType.get());
        assertThat(schema.fieldByName("z")).isNull();
        assertThatThrownBy(() -> new StructType(List.of(
            new StructField("a", LongType.get()), new StructField("a", LongType.get()))))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
