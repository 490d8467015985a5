package org.moviegraph.models.table;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered set of tables. Insertion order is dependency order: a table is only added after
 * every table it references.
 */
public final class NormalizedSchema {

    private final Map<String, Table> tables = new LinkedHashMap<>();
    private final Map<String, Map<Object, Object>> mergeLedger = new HashMap<>();

    public Table add(Table table) {
        for (ColumnDescriptor foreignKey : table.descriptor().foreignKeys()) {
            if (!tables.containsKey(foreignKey.referencedTable()) && !foreignKey.referencedTable().equals(table.name())) {
                throw new IllegalStateException("Table " + table.name() + " references " + foreignKey.referencedTable()
                        + " which has not been added yet");
            }
        }
        if (tables.putIfAbsent(table.name(), table) != null) {
            throw new IllegalStateException("Table " + table.name() + " added twice");
        }
        return table;
    }

    public Table table(String name) {
        Table table = tables.get(name);
        if (table == null) {
            throw new IllegalArgumentException("Unknown table " + name);
        }
        return table;
    }

    public boolean contains(String name) {
        return tables.containsKey(name);
    }

    public Collection<Table> tables() {
        return Collections.unmodifiableCollection(tables.values());
    }

    public int totalRows() {
        return tables.values().stream().mapToInt(Table::size).sum();
    }

    /**
     * Every (table, column) pair whose foreign key points at the given table.
     */
    public List<Reference> referencesTo(String tableName) {
        List<Reference> references = new ArrayList<>();
        for (Table table : tables.values()) {
            for (ColumnDescriptor column : table.descriptor().foreignKeys()) {
                if (column.referencedTable().equals(tableName)) {
                    references.add(new Reference(table, column));
                }
            }
        }
        return references;
    }

    /**
     * Remembers that the entity with natural id {@code superseded} was folded into {@code canonical}.
     */
    public void recordMerge(String tableName, Object superseded, Object canonical) {
        mergeLedger.computeIfAbsent(tableName, key -> new HashMap<>()).put(superseded, canonical);
    }

    public Optional<Object> mergedInto(String tableName, Object superseded) {
        return Optional.ofNullable(mergeLedger.getOrDefault(tableName, Map.of()).get(superseded));
    }

    public record Reference(Table table, ColumnDescriptor column) {
    }
}
