package org.moviegraph.models.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * In-memory relation. Rows keep column order of the descriptor and stay mutable so that the
 * re-keying and merge stages can rewrite ids in place.
 */
public final class Table {

    private final TableDescriptor descriptor;
    private final List<Map<String, Object>> rows = new ArrayList<>();

    public Table(TableDescriptor descriptor) {
        this.descriptor = descriptor;
    }

    public TableDescriptor descriptor() {
        return descriptor;
    }

    public String name() {
        return descriptor.name();
    }

    public void add(Map<String, Object> values) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (ColumnDescriptor column : descriptor.columns()) {
            row.put(column.name(), values.get(column.name()));
        }
        for (String key : values.keySet()) {
            if (!row.containsKey(key)) {
                throw new IllegalArgumentException("Table " + name() + " has no column " + key);
            }
        }
        rows.add(row);
    }

    public List<Map<String, Object>> rows() {
        return Collections.unmodifiableList(rows);
    }

    public int size() {
        return rows.size();
    }

    public boolean removeIf(Predicate<Map<String, Object>> filter) {
        return rows.removeIf(filter);
    }

    public List<Object> primaryKeyOf(Map<String, Object> row) {
        List<Object> key = new ArrayList<>(descriptor.primaryKey().size());
        for (String column : descriptor.primaryKey()) {
            key.add(row.get(column));
        }
        return key;
    }

    public Optional<Map<String, Object>> findBy(String column, Object value) {
        return rows.stream()
                .filter(row -> value != null && value.equals(row.get(column)))
                .findFirst();
    }

    public List<Object> columnValues(String column) {
        return rows.stream().map(row -> row.get(column)).toList();
    }

    /**
     * Keeps the first row of every primary key and drops the rest.
     *
     * @return number of rows removed
     */
    public int collapseDuplicateKeys() {
        Set<List<Object>> seen = new HashSet<>();
        int removed = 0;
        Iterator<Map<String, Object>> iterator = rows.iterator();
        while (iterator.hasNext()) {
            if (!seen.add(primaryKeyOf(iterator.next()))) {
                iterator.remove();
                removed++;
            }
        }
        return removed;
    }
}
