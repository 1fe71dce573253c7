package org.impactengine.storage;

import org.impactengine.api.data.ColumnType;
import org.impactengine.api.data.PanelFrame;
import org.impactengine.api.storage.StorageFormat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Converts {@link PanelFrame}s to and from Parquet and CSV using an in-memory DuckDB database.
 * <p>
 * Writing materializes the frame as a table and exports it with {@code COPY ... TO} into a
 * temporary file whose bytes are returned. Reading runs {@code read_parquet} or
 * {@code read_csv_auto} over a file and maps the SQL column types back onto
 * {@link ColumnType}s. Types outside the supported set are read as strings.
 */
public final class TabularCodec {

    private static final String TABLE = "frame";

    private TabularCodec() {
        // Utility class - prevent instantiation
    }

    /**
     * Serializes a frame.
     *
     * @param frame         the frame; must have at least one column
     * @param format        {@link StorageFormat#PARQUET} or {@link StorageFormat#CSV}
     * @param tempDirectory directory for the intermediate export file
     * @return the encoded file contents
     */
    public static byte[] encode(PanelFrame frame, StorageFormat format, Path tempDirectory) throws IOException {
        requireTabular(format);
        if (frame.columns().isEmpty()) {
            throw new IllegalArgumentException("Cannot encode a frame without columns");
        }
        Files.createDirectories(tempDirectory);
        Path tempFile = Files.createTempFile(tempDirectory, "frame_", "." + format.extension());
        try (Connection conn = openConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute(createTableSql(frame));
            insertRows(conn, frame);
            stmt.execute(String.format("COPY %s TO '%s' %s", TABLE, sqlPath(tempFile), copyOptions(format)));
            return Files.readAllBytes(tempFile);
        } catch (SQLException e) {
            throw new IOException("Failed to encode frame as " + format.extension() + ": " + e.getMessage(), e);
        } finally {
            Files.deleteIfExists(tempFile);
        }
    }

    /**
     * Deserializes file contents produced by {@link #encode} or any other Parquet/CSV writer.
     */
    public static PanelFrame decode(byte[] bytes, StorageFormat format, Path tempDirectory) throws IOException {
        requireTabular(format);
        Files.createDirectories(tempDirectory);
        Path tempFile = Files.createTempFile(tempDirectory, "frame_", "." + format.extension());
        try {
            Files.write(tempFile, bytes);
            return readFile(tempFile, format);
        } finally {
            Files.deleteIfExists(tempFile);
        }
    }

    /**
     * Reads a Parquet or CSV file. CSV files must have a header row.
     *
     * @throws IOException if the file is missing or cannot be parsed
     */
    public static PanelFrame readFile(Path file, StorageFormat format) throws IOException {
        requireTabular(format);
        if (!Files.isRegularFile(file)) {
            throw new IOException("Data file does not exist: " + file.toAbsolutePath());
        }
        String source = format == StorageFormat.PARQUET
            ? String.format("read_parquet('%s')", sqlPath(file))
            : String.format("read_csv_auto('%s', header = true)", sqlPath(file));

        try (Connection conn = openConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT * FROM " + source)) {
            return toFrame(rs);
        } catch (SQLException e) {
            throw new IOException("Failed to read " + file + ": " + e.getMessage(), e);
        }
    }

    private static Connection openConnection() throws IOException, SQLException {
        try {
            // Load driver explicitly to ensure it's registered
            Class.forName("org.duckdb.DuckDBDriver");
        } catch (ClassNotFoundException e) {
            throw new IOException("DuckDB JDBC driver is not on the classpath", e);
        }
        return DriverManager.getConnection("jdbc:duckdb:");
    }

    private static String createTableSql(PanelFrame frame) {
        StringJoiner columns = new StringJoiner(", ", "CREATE TABLE " + TABLE + " (", ")");
        for (String column : frame.columns()) {
            columns.add(quoteIdentifier(column) + " " + frame.type(column).sqlType());
        }
        return columns.toString();
    }

    private static void insertRows(Connection conn, PanelFrame frame) throws SQLException {
        if (frame.isEmpty()) {
            return;
        }
        List<String> columns = frame.columns();
        StringJoiner placeholders = new StringJoiner(", ", "INSERT INTO " + TABLE + " VALUES (", ")");
        for (String column : columns) {
            placeholders.add(frame.type(column) == ColumnType.DATE ? "CAST(? AS DATE)" : "?");
        }
        try (PreparedStatement ps = conn.prepareStatement(placeholders.toString())) {
            for (int row = 0; row < frame.rowCount(); row++) {
                for (int col = 0; col < columns.size(); col++) {
                    bind(ps, col + 1, frame.type(columns.get(col)), frame.get(row, columns.get(col)));
                }
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private static void bind(PreparedStatement ps, int index, ColumnType type, Object value) throws SQLException {
        if (value == null) {
            ps.setObject(index, null);
            return;
        }
        switch (type) {
            case STRING -> ps.setString(index, (String) value);
            case LONG -> ps.setLong(index, (Long) value);
            case DOUBLE -> ps.setDouble(index, (Double) value);
            case BOOLEAN -> ps.setBoolean(index, (Boolean) value);
            case DATE -> ps.setString(index, value.toString());
        }
    }

    private static PanelFrame toFrame(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int count = meta.getColumnCount();
        ColumnType[] types = new ColumnType[count];
        PanelFrame.Builder builder = PanelFrame.builder();
        for (int i = 1; i <= count; i++) {
            types[i - 1] = toColumnType(meta.getColumnType(i));
            builder.column(meta.getColumnLabel(i), types[i - 1]);
        }

        List<Object> row = new ArrayList<>(count);
        while (rs.next()) {
            row.clear();
            for (int i = 1; i <= count; i++) {
                row.add(readValue(rs, i, types[i - 1]));
            }
            builder.row(row.toArray());
        }
        return builder.build();
    }

    private static Object readValue(ResultSet rs, int index, ColumnType type) throws SQLException {
        Object value = switch (type) {
            case LONG -> rs.getLong(index);
            case DOUBLE -> rs.getDouble(index);
            case BOOLEAN -> rs.getBoolean(index);
            case DATE, STRING -> rs.getString(index);
        };
        if (rs.wasNull()) {
            return null;
        }
        return type == ColumnType.DATE ? LocalDate.parse((String) value) : value;
    }

    private static ColumnType toColumnType(int sqlType) {
        return switch (sqlType) {
            case Types.TINYINT, Types.SMALLINT, Types.INTEGER, Types.BIGINT -> ColumnType.LONG;
            case Types.FLOAT, Types.REAL, Types.DOUBLE, Types.DECIMAL, Types.NUMERIC -> ColumnType.DOUBLE;
            case Types.BOOLEAN, Types.BIT -> ColumnType.BOOLEAN;
            case Types.DATE -> ColumnType.DATE;
            default -> ColumnType.STRING;
        };
    }

    private static String copyOptions(StorageFormat format) {
        return format == StorageFormat.PARQUET ? "(FORMAT PARQUET, CODEC 'ZSTD')" : "(FORMAT CSV, HEADER)";
    }

    private static void requireTabular(StorageFormat format) {
        if (!format.isTabular()) {
            throw new IllegalArgumentException("Not a tabular format: " + format);
        }
    }

    private static String quoteIdentifier(String name) {
        return "\"" + name.replace("\"", "\"\"") + "\"";
    }

    // Escape path for SQL (Windows paths need forward slashes)
    private static String sqlPath(Path path) {
        return path.toAbsolutePath().toString().replace("\\", "/").replace("'", "''");
    }
}
