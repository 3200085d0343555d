package io.dbscope;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps the current row of a {@link ResultSet} to a value.
 *
 * @param <T> row type
 */
@FunctionalInterface
public interface RowMapper<T> {

    T map(ResultSet rs) throws SQLException;

    /**
     * Maps each row to an ordered map keyed by lower-cased column label.
     */
    static RowMapper<Map<String, Object>> columnMap() {
        return rs -> {
            ResultSetMetaData meta = rs.getMetaData();
            int columns = meta.getColumnCount();
            Map<String, Object> row = new LinkedHashMap<>(columns * 2);
            for (int i = 1; i <= columns; i++) {
                row.put(meta.getColumnLabel(i).toLowerCase(Locale.ROOT), rs.getObject(i));
            }
            return row;
        };
    }
}
