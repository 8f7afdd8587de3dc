package space.ketterling.climatecache.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Ordered rows of observations together with the value columns they carry.
 *
 * <p>
 * Identity columns (date, place name, grid coordinates) live on every
 * {@link Observation}; {@link #columns()} lists only the value columns.
 * </p>
 */
public final class ObservationTable {
    private final List<String> columns;
    private final List<Observation> rows;

    public ObservationTable(List<String> columns, List<Observation> rows) {
        this.columns = List.copyOf(columns);
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    public static ObservationTable empty(List<String> columns) {
        return new ObservationTable(columns, List.of());
    }

    public static ObservationTable empty() {
        return new ObservationTable(List.of(), List.of());
    }

    /**
     * Builds a table whose columns are the union of the columns seen in the
     * rows, in first-seen order.
     */
    public static ObservationTable of(List<Observation> rows) {
        Set<String> cols = new LinkedHashSet<>();
        for (Observation o : rows)
            cols.addAll(o.values().keySet());
        return new ObservationTable(new ArrayList<>(cols), rows);
    }

    public List<String> columns() {
        return columns;
    }

    public List<Observation> rows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * True when the column is declared or present on every row.
     */
    public boolean hasColumn(String column) {
        if (columns.contains(column))
            return true;
        if (rows.isEmpty())
            return false;
        for (Observation o : rows) {
            if (!o.has(column))
                return false;
        }
        return true;
    }

    /**
     * Fails with {@link MissingColumnException} when the column is absent.
     */
    public void requireColumn(String column, String measure) {
        if (!hasColumn(column)) {
            throw new MissingColumnException(
                    "Missing required column '" + column + "' for measure '" + measure + "'");
        }
    }

    public ObservationTable filter(Predicate<Observation> keep) {
        List<Observation> out = new ArrayList<>();
        for (Observation o : rows) {
            if (keep.test(o))
                out.add(o);
        }
        return new ObservationTable(columns, out);
    }

    /**
     * Appends another table's rows; columns become the union of both.
     */
    public ObservationTable concat(ObservationTable other) {
        if (other == null || (other.isEmpty() && columns.containsAll(other.columns)))
            return this;
        Set<String> cols = new LinkedHashSet<>(columns);
        cols.addAll(other.columns);
        List<Observation> all = new ArrayList<>(rows);
        all.addAll(other.rows);
        return new ObservationTable(new ArrayList<>(cols), all);
    }

    @Override
    public String toString() {
        return "ObservationTable{columns=" + columns + ", rows=" + rows.size() + "}";
    }
}
