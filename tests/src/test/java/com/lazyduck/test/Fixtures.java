package com.lazyduck.test;

import com.lazyduck.frame.Table;
import com.lazyduck.types.LongType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Table builders shared by tests.
 */
public final class Fixtures {

    private Fixtures() {}

    /**
     * Builds a table with long columns {@code a = i % 10}, {@code b = i} and
     * {@code c = 2 * i}, indexed {@code 0..rows-1}.
     *
     * @param rows the number of rows
     * @return the table
     */
    public static Table abc(int rows) {
        return abc(0, rows);
    }

    /**
     * Same as {@link #abc(int)} with row numbers starting at {@code start}.
     */
    public static Table abc(long start, int rows) {
        List<Object> a = new ArrayList<>();
        List<Object> b = new ArrayList<>();
        List<Object> c = new ArrayList<>();
        List<Object> index = new ArrayList<>();
        for (long i = start; i < start + rows; i++) {
            a.add(i % 10);
            b.add(i);
            c.add(2 * i);
            index.add(i);
        }
        return Table.builder()
            .column("a", LongType.get(), a)
            .column("b", LongType.get(), b)
            .column("c", LongType.get(), c)
            .index(null, LongType.get(), index)
            .build();
    }

    /**
     * Builds one row group per block of ten rows, each with {@code a} constant
     * within the block: block {@code g} holds {@code a = g}, so statistics
     * identify exactly one block per value of {@code a}.
     *
     * @param groups the number of row groups
     * @return the row groups
     */
    public static List<Table> blocks(int groups) {
        List<Table> tables = new ArrayList<>();
        for (int g = 0; g < groups; g++) {
            List<Object> a = new ArrayList<>();
            List<Object> b = new ArrayList<>();
            List<Object> c = new ArrayList<>();
            for (long i = 0; i < 10; i++) {
                long row = g * 10L + i;
                a.add((long) g);
                b.add(row);
                c.add(2 * row);
            }
            tables.add(Table.builder()
                .column("a", LongType.get(), a)
                .column("b", LongType.get(), b)
                .column("c", LongType.get(), c)
                .build());
        }
        return tables;
    }

    /**
     * Builds two row groups whose {@code a} column holds nulls:
     * {@code a = [1, null, 5]} and {@code a = [5, 5, null]}, with
     * {@code b = 0..5} across both.
     *
     * @return the row groups
     */
    public static List<Table> withNulls() {
        return List.of(
            Table.builder()
                .column("a", LongType.get(), Arrays.asList(1L, null, 5L))
                .column("b", LongType.get(), List.of(0L, 1L, 2L))
                .build(),
            Table.builder()
                .column("a", LongType.get(), Arrays.asList(5L, 5L, null))
                .column("b", LongType.get(), List.of(3L, 4L, 5L))
                .build());
    }

    /**
     * Builds a single-column table of longs named {@code a}.
     */
    public static Table longs(Long... values) {
        return Table.builder().column("a", LongType.get(), Arrays.asList(values)).build();
    }
}
