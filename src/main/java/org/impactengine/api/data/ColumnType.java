package org.impactengine.api.data;

import java.time.LocalDate;

/**
 * Logical column types supported by {@link PanelFrame}.
 */
public enum ColumnType {
    STRING(String.class, "VARCHAR"),
    LONG(Long.class, "BIGINT"),
    DOUBLE(Double.class, "DOUBLE"),
    BOOLEAN(Boolean.class, "BOOLEAN"),
    DATE(LocalDate.class, "DATE");

    private final Class<?> javaType;
    private final String sqlType;

    ColumnType(Class<?> javaType, String sqlType) {
        this.javaType = javaType;
        this.sqlType = sqlType;
    }

    public Class<?> javaType() {
        return javaType;
    }

    /**
     * DuckDB SQL type used when a frame is materialized as a table.
     */
    public String sqlType() {
        return sqlType;
    }

    public boolean isNumeric() {
        return this == LONG || this == DOUBLE;
    }

    /**
     * Coerces a value to this type's Java representation.
     *
     * @throws IllegalArgumentException if the value cannot be represented
     */
    Object coerce(Object value) {
        if (value == null || javaType.isInstance(value)) {
            return value;
        }
        switch (this) {
            case STRING:
                return value.toString();
            case LONG:
                if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
                    return ((Number) value).longValue();
                }
                break;
            case DOUBLE:
                if (value instanceof Number) {
                    return ((Number) value).doubleValue();
                }
                break;
            case DATE:
                if (value instanceof String) {
                    return LocalDate.parse((String) value);
                }
                if (value instanceof java.sql.Date) {
                    return ((java.sql.Date) value).toLocalDate();
                }
                break;
            default:
                break;
        }
        throw new IllegalArgumentException(
            "Value '" + value + "' of type " + value.getClass().getSimpleName() + " is not a valid " + this);
    }

    /**
     * Infers the column type of a Java value.
     */
    public static ColumnType of(Object value) {
        if (value instanceof String) return STRING;
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) return LONG;
        if (value instanceof Number) return DOUBLE;
        if (value instanceof Boolean) return BOOLEAN;
        if (value instanceof LocalDate) return DATE;
        throw new IllegalArgumentException("Unsupported column value type: "
            + (value == null ? "null" : value.getClass().getName()));
    }
}
