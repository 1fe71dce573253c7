package org.impactengine.transforms;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValueType;
import org.impactengine.api.data.ColumnType;
import org.impactengine.api.data.PanelFrame;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;

/**
 * Parameter lookup and aggregation helpers shared by the built-in transforms.
 */
final class Params {

    private Params() {
    }

    static String string(Config params, String key, String defaultValue) {
        return params.hasPath(key) ? params.getString(key) : defaultValue;
    }

    /**
     * Reads a list of strings; a single string is accepted as a one-element list.
     */
    static List<String> stringList(Config params, String key) {
        if (!params.hasPath(key)) {
            return List.of();
        }
        if (params.getValue(key).valueType() == ConfigValueType.STRING) {
            return List.of(params.getString(key));
        }
        return params.getStringList(key);
    }

    /**
     * Sums a numeric column over the given rows, skipping nulls. Returns {@code null} if every
     * value is null; LONG columns stay integral.
     */
    static Object sum(PanelFrame data, String column, List<Integer> rows) {
        boolean integral = data.type(column) == ColumnType.LONG;
        long longSum = 0;
        double doubleSum = 0.0;
        boolean any = false;
        for (int row : rows) {
            Object value = data.get(row, column);
            if (value == null) {
                continue;
            }
            any = true;
            if (integral) {
                longSum += ((Number) value).longValue();
            } else {
                doubleSum += ((Number) value).doubleValue();
            }
        }
        if (!any) {
            return null;
        }
        return integral ? (Object) longSum : (Object) doubleSum;
    }

    /**
     * Natural order of the values of a column of the given type, nulls last.
     */
    static Comparator<Object> keyOrder(ColumnType type) {
        Comparator<Object> order = switch (type) {
            case STRING -> Comparator.comparing((Object value) -> (String) value);
            case LONG -> Comparator.comparing((Object value) -> (Long) value);
            case DOUBLE -> Comparator.comparing((Object value) -> (Double) value);
            case BOOLEAN -> Comparator.comparing((Object value) -> (Boolean) value);
            case DATE -> Comparator.comparing((Object value) -> (LocalDate) value);
        };
        return Comparator.nullsLast(order);
    }
}
