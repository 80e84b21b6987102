package com.lazyduck.integration;

import com.lazyduck.LazyFrames;
import com.lazyduck.expression.Expr;
import com.lazyduck.frame.Kernels;
import com.lazyduck.frame.Series;
import com.lazyduck.frame.Table;
import com.lazyduck.io.parquet.DuckDBParquetReader;
import com.lazyduck.io.parquet.Fragment;
import com.lazyduck.optimizer.Optimizer;
import com.lazyduck.runtime.LocalTaskExecutor;
import com.lazyduck.runtime.PlannerConfig;
import com.lazyduck.runtime.QueryExecutor;
import com.lazyduck.runtime.ThreadPoolTaskExecutor;
import com.lazyduck.test.TestBase;
import com.lazyduck.test.TestCategories;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end reads of Parquet files written by DuckDB.
 *
 * <p>Test ID prefix: TC-DUCKDB-*
 */
@TestCategories.Tier2
@TestCategories.Integration
@DisplayName("DuckDB Parquet Reader Tests")
public class DuckDBParquetReaderTest extends TestBase {

    private static final int ROWS = 10_000;

    @TempDir
    Path tempDir;

    private String path;
    private DuckDBParquetReader reader;

    @BeforeEach
    void writeDataset() throws Exception {
        path = tempDir.resolve("numbers.parquet").toString();
        try (Connection conn = DriverManager.getConnection("jdbc:duckdb:");
             Statement stmt = conn.createStatement()) {
            stmt.execute("SET threads TO 1");
            stmt.execute("COPY (SELECT range AS id, range % 10 AS a, range * 2 AS c FROM range(" + ROWS + ")) "
                + "TO '" + path.replace("'", "''") + "' (FORMAT PARQUET, ROW_GROUP_SIZE 2048)");
        }
        logStep("Wrote " + path);
        reader = new DuckDBParquetReader();
    }

    @AfterEach
    void closeReader() throws Exception {
        reader.close();
    }

    @Test
    @DisplayName("TC-DUCKDB-001: Schema and row groups come from the file metadata")
    void testMetadata() {
        Expr df = LazyFrames.readParquet(path, reader);
        List<Fragment> fragments = reader.fragments(path);

        assertThat(df.columns()).containsExactly("id", "a", "c");
        assertThat(fragments).hasSizeGreaterThan(1);
        assertThat(fragments.stream().mapToLong(Fragment::numRows).sum()).isEqualTo(ROWS);
        assertThat(fragments.get(1).rowOffset()).isEqualTo(fragments.get(0).numRows());
        assertThat(df.npartitions()).isEqualTo(fragments.size());
        assertThat(fragments.get(0).statistics("id").min()).isEqualTo(0L);
    }

    @Test
    @DisplayName("TC-DUCKDB-002: Reductions over every row group")
    void testReductions() {
        Expr df = LazyFrames.readParquet(path, reader);

        try (QueryExecutor executor = new QueryExecutor()) {
            assertThat(executor.compute(df.get("id").sum())).isEqualTo(49_995_000L);
            assertThat(executor.compute(df.get("a").max())).isEqualTo(9L);
            assertThat(executor.compute(df.length())).isEqualTo((long) ROWS);
        }
    }

    @Test
    @DisplayName("TC-DUCKDB-003: Range filters skip row groups")
    void testPruning() {
        Expr df = LazyFrames.readParquet(path, reader);
        Expr tail = df.get(df.get("id").greaterThanOrEqual(9_000L));

        Expr optimized = new Optimizer(PlannerConfig.defaults().withFuse(false)).simplify(tail);
        assertThat(optimized.npartitions()).isLessThan(df.npartitions());
        try (QueryExecutor executor = new QueryExecutor()) {
            Table result = (Table) executor.compute(tail);
            assertThat(result.numRows()).isEqualTo(1_000);
            assertThat(result.index().get(0)).isEqualTo(9_000L);
        }
    }

    @Test
    @DisplayName("TC-DUCKDB-004: Filtered projection matches a direct computation")
    void testFilteredProjection() {
        Expr df = LazyFrames.readParquet(path, reader);
        Expr expr = df.get(df.get("a").equalTo(3L)).get("c");

        PlannerConfig config = PlannerConfig.defaults().withExecutorThreads(4);
        try (QueryExecutor executor = new QueryExecutor(config, new ThreadPoolTaskExecutor(config))) {
            Series c = (Series) executor.compute(expr);
            assertThat(c.size()).isEqualTo(1_000);
            assertThat(c.get(0)).isEqualTo(6L);
            assertThat(executor.compute(expr.sum())).isEqualTo(9_996_000L);
        }
    }

    @Test
    @DisplayName("TC-DUCKDB-005: Index column gives divisions")
    void testIndexDivisions() {
        Expr df = LazyFrames.readParquet(path, reader, "id");

        assertThat(df.columns()).containsExactly("a", "c");
        assertThat(df.knownDivisions()).isTrue();
        assertThat(df.divisions().get(0)).isEqualTo(0L);
        assertThat(df.divisions().get(df.npartitions())).isEqualTo((long) ROWS - 1);

        try (QueryExecutor executor = new QueryExecutor()) {
            Table head = (Table) executor.compute(df.head(3));
            assertThat(head.index().values()).containsExactly(0L, 1L, 2L);
            assertThat(head.column("c").values()).containsExactly(0L, 2L, 4L);
        }
    }

    @Test
    @DisplayName("TC-DUCKDB-006: Mixed column types and nulls survive the Arrow read path")
    void testMixedTypes() throws Exception {
        String mixed = writeMixed();
        Expr df = LazyFrames.readParquet(mixed, reader);

        try (QueryExecutor executor = new QueryExecutor()) {
            Table table = (Table) executor.compute(df);
            assertThat(table.numRows()).isEqualTo(30);
            assertThat(table.column("k").get(0)).isNull();
            assertThat(table.column("k").get(1)).isEqualTo(1L);
            assertThat(table.column("s").get(1)).isEqualTo("row1");
            assertThat(table.column("d").get(3)).isEqualTo(1.5d);
            assertThat(table.column("even").get(0)).isEqualTo(true);
        }
    }

    @Test
    @DisplayName("TC-DUCKDB-007: Pushed not-equal keeps null rows like the unpushed filter")
    void testNotEqualWithNulls() throws Exception {
        Expr df = LazyFrames.readParquet(writeMixed(), reader);
        Expr expr = df.get(df.get("k").notEqual(1L)).get("s");

        Series unoptimized = (Series) Kernels.concat(new LocalTaskExecutor().execute(expr.materialize(), expr.keys()));
        try (QueryExecutor executor = new QueryExecutor()) {
            Series optimized = (Series) executor.compute(expr);
            assertThat(optimized.values()).isEqualTo(unoptimized.values());
            assertThat(optimized.values()).contains("row0").doesNotContain("row1");
        }
    }

    private String writeMixed() throws Exception {
        String mixed = tempDir.resolve("mixed.parquet").toString();
        try (Connection conn = DriverManager.getConnection("jdbc:duckdb:");
             Statement stmt = conn.createStatement()) {
            stmt.execute("COPY (SELECT range AS id, "
                + "CASE WHEN range % 3 = 0 THEN NULL ELSE range % 4 END AS k, "
                + "'row' || range AS s, CAST(range AS DOUBLE) / 2 AS d, range % 2 = 0 AS even "
                + "FROM range(30)) TO '" + mixed.replace("'", "''") + "' (FORMAT PARQUET)");
        }
        return mixed;
    }
}
