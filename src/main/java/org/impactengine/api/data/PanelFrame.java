package org.impactengine.api.data;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.IntPredicate;

/**
 * Immutable, column-oriented rectangular dataset passed between pipeline stages.
 * <p>
 * Every column has a name, a {@link ColumnType} and exactly {@link #rowCount()} values;
 * values may be {@code null}. Column order is preserved. All transforming operations
 * return a new frame and leave the receiver untouched.
 * <p>
 * <strong>Example:</strong>
 * <pre>
 * PanelFrame frame = PanelFrame.builder()
 *     .column("date", ColumnType.DATE)
 *     .column("revenue", ColumnType.DOUBLE)
 *     .row(LocalDate.parse("2024-01-01"), 100.0)
 *     .row(LocalDate.parse("2024-01-02"), 110.0)
 *     .build();
 * </pre>
 */
public final class PanelFrame {

    private static final PanelFrame EMPTY = new PanelFrame(new LinkedHashMap<>(), new LinkedHashMap<>(), 0);

    private final Map<String, ColumnType> types;
    private final Map<String, List<Object>> data;
    private final int rowCount;

    private PanelFrame(Map<String, ColumnType> types, Map<String, List<Object>> data, int rowCount) {
        this.types = types;
        this.data = data;
        this.rowCount = rowCount;
    }

    public static PanelFrame empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> columns() {
        return List.copyOf(types.keySet());
    }

    public boolean hasColumn(String column) {
        return types.containsKey(column);
    }

    public ColumnType type(String column) {
        requireColumn(column);
        return types.get(column);
    }

    public int rowCount() {
        return rowCount;
    }

    public boolean isEmpty() {
        return rowCount == 0;
    }

    public Object get(int row, String column) {
        requireColumn(column);
        return data.get(column).get(row);
    }

    /**
     * Returns one row as an ordered column-to-value map.
     */
    public Map<String, Object> row(int row) {
        Objects.checkIndex(row, rowCount);
        Map<String, Object> result = new LinkedHashMap<>();
        for (String column : types.keySet()) {
            result.put(column, data.get(column).get(row));
        }
        return result;
    }

    /**
     * Returns an unmodifiable view of a column's values.
     */
    public List<Object> column(String column) {
        requireColumn(column);
        return Collections.unmodifiableList(data.get(column));
    }

    /**
     * Returns a numeric column as primitive doubles.
     *
     * @throws IllegalArgumentException if the column is not numeric or contains nulls
     */
    public double[] doubles(String column) {
        ColumnType type = type(column);
        if (!type.isNumeric()) {
            throw new IllegalArgumentException("Column '" + column + "' is not numeric (" + type + ")");
        }
        List<Object> values = data.get(column);
        double[] result = new double[rowCount];
        for (int i = 0; i < rowCount; i++) {
            Object value = values.get(i);
            if (value == null) {
                throw new IllegalArgumentException("Column '" + column + "' has a null value at row " + i);
            }
            result[i] = ((Number) value).doubleValue();
        }
        return result;
    }

    /**
     * Returns the subset of the given columns that this frame lacks, in the given order.
     */
    public List<String> missingColumns(Collection<String> required) {
        List<String> missing = new ArrayList<>();
        for (String column : required) {
            if (!types.containsKey(column)) {
                missing.add(column);
            }
        }
        return missing;
    }

    /**
     * @throws IllegalArgumentException naming every missing column
     */
    public void requireColumns(Collection<String> required) {
        List<String> missing = missingColumns(required);
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Missing required columns: " + missing + ". Available: " + columns());
        }
    }

    /**
     * Returns true if no two rows share the same values in the given key columns.
     */
    public boolean hasUniqueKey(String... keyColumns) {
        requireColumns(Arrays.asList(keyColumns));
        Set<List<Object>> seen = new HashSet<>();
        for (int i = 0; i < rowCount; i++) {
            List<Object> key = new ArrayList<>(keyColumns.length);
            for (String column : keyColumns) {
                key.add(data.get(column).get(i));
            }
            if (!seen.add(key)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Groups row indices by the value of a column, in first-seen order.
     */
    public Map<Object, List<Integer>> groupRows(String column) {
        List<Object> values = column(column);
        Map<Object, List<Integer>> groups = new LinkedHashMap<>();
        for (int i = 0; i < rowCount; i++) {
            groups.computeIfAbsent(values.get(i), k -> new ArrayList<>()).add(i);
        }
        return groups;
    }

    public PanelFrame filter(IntPredicate rowPredicate) {
        List<Integer> kept = new ArrayList<>();
        for (int i = 0; i < rowCount; i++) {
            if (rowPredicate.test(i)) {
                kept.add(i);
            }
        }
        return rows(kept);
    }

    /**
     * Returns a frame made of the given row indices, in the given order.
     */
    public PanelFrame rows(List<Integer> indices) {
        Map<String, List<Object>> selected = new LinkedHashMap<>();
        for (Map.Entry<String, List<Object>> entry : data.entrySet()) {
            List<Object> source = entry.getValue();
            List<Object> values = new ArrayList<>(indices.size());
            for (int index : indices) {
                values.add(source.get(index));
            }
            selected.put(entry.getKey(), values);
        }
        return new PanelFrame(new LinkedHashMap<>(types), selected, indices.size());
    }

    public PanelFrame select(List<String> columns) {
        requireColumns(columns);
        Map<String, ColumnType> selectedTypes = new LinkedHashMap<>();
        Map<String, List<Object>> selected = new LinkedHashMap<>();
        for (String column : columns) {
            selectedTypes.put(column, types.get(column));
            selected.put(column, data.get(column));
        }
        return new PanelFrame(selectedTypes, selected, rowCount);
    }

    /**
     * Returns a frame with the column added, or replaced if it already exists.
     *
     * @throws IllegalArgumentException if the value count differs from the row count
     *                                  or a value does not fit the type
     */
    public PanelFrame withColumn(String column, ColumnType type, List<?> values) {
        if (values.size() != rowCount && !(types.isEmpty() && rowCount == 0)) {
            throw new IllegalArgumentException(String.format(
                "Column '%s' has %d values but frame has %d rows", column, values.size(), rowCount));
        }
        Map<String, ColumnType> newTypes = new LinkedHashMap<>(types);
        Map<String, List<Object>> newData = new LinkedHashMap<>(data);
        newTypes.put(column, type);
        newData.put(column, coerceAll(column, type, values));
        return new PanelFrame(newTypes, newData, types.isEmpty() ? values.size() : rowCount);
    }

    public PanelFrame withConstantColumn(String column, ColumnType type, Object value) {
        return withColumn(column, type, Collections.nCopies(rowCount, value));
    }

    private void requireColumn(String column) {
        if (!types.containsKey(column)) {
            throw new IllegalArgumentException("Unknown column '" + column + "'. Available: " + columns());
        }
    }

    private static List<Object> coerceAll(String column, ColumnType type, List<?> values) {
        List<Object> coerced = new ArrayList<>(values.size());
        for (Object value : values) {
            try {
                coerced.add(type.coerce(value));
            } catch (RuntimeException e) {
                throw new IllegalArgumentException("Column '" + column + "': " + e.getMessage(), e);
            }
        }
        return Collections.unmodifiableList(coerced);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PanelFrame)) return false;
        PanelFrame other = (PanelFrame) o;
        return rowCount == other.rowCount && types.equals(other.types) && data.equals(other.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(types, data, rowCount);
    }

    @Override
    public String toString() {
        return "PanelFrame{columns=" + types + ", rows=" + rowCount + "}";
    }

    /**
     * Row-wise builder. Columns must be declared before the first row is added.
     */
    public static final class Builder {
        private final Map<String, ColumnType> types = new LinkedHashMap<>();
        private final List<Object[]> rows = new ArrayList<>();

        private Builder() {
        }

        public Builder column(String name, ColumnType type) {
            if (!rows.isEmpty()) {
                throw new IllegalStateException("Columns must be declared before rows are added");
            }
            if (types.putIfAbsent(Objects.requireNonNull(name, "name"), Objects.requireNonNull(type, "type")) != null) {
                throw new IllegalArgumentException("Duplicate column '" + name + "'");
            }
            return this;
        }

        public Builder row(Object... values) {
            if (values.length != types.size()) {
                throw new IllegalArgumentException(String.format(
                    "Row has %d values but %d columns are declared", values.length, types.size()));
            }
            rows.add(values.clone());
            return this;
        }

        public PanelFrame build() {
            Map<String, List<Object>> data = new LinkedHashMap<>();
            int index = 0;
            for (Map.Entry<String, ColumnType> entry : types.entrySet()) {
                List<Object> values = new ArrayList<>(rows.size());
                for (Object[] row : rows) {
                    values.add(row[index]);
                }
                data.put(entry.getKey(), coerceAll(entry.getKey(), entry.getValue(), values));
                index++;
            }
            return new PanelFrame(new LinkedHashMap<>(types), data, rows.size());
        }
    }
}
