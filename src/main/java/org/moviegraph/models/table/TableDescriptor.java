package org.moviegraph.models.table;

import org.moviegraph.models.enums.KeyType;
import org.moviegraph.models.enums.TableKind;

import java.util.List;
import java.util.Objects;

/**
 * Shape of one output table: columns, primary key and, for entity tables, how the key relates
 * to the raw data. Consumed by the assembler, the integrity checks and the schema writer alike.
 */
public record TableDescriptor(String name,
                              TableKind kind,
                              List<ColumnDescriptor> columns,
                              List<String> primaryKey,
                              String naturalIdColumn,
                              KeyType keyType) {

    public TableDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        columns = List.copyOf(columns);
        primaryKey = List.copyOf(primaryKey);
        if (primaryKey.isEmpty()) {
            throw new IllegalArgumentException("Table " + name + " needs a primary key");
        }
        for (String keyColumn : primaryKey) {
            if (columns.stream().noneMatch(column -> column.name().equals(keyColumn))) {
                throw new IllegalArgumentException("Primary key column " + keyColumn + " missing from " + name);
            }
        }
    }

    public static TableDescriptor lookup(String name, List<ColumnDescriptor> columns, String idColumn) {
        return new TableDescriptor(name, TableKind.LOOKUP, columns, List.of(idColumn), null, null);
    }

    public static TableDescriptor entity(String name,
                                         List<ColumnDescriptor> columns,
                                         String idColumn,
                                         String naturalIdColumn,
                                         KeyType keyType) {
        return new TableDescriptor(name, TableKind.ENTITY, columns, List.of(idColumn), naturalIdColumn, keyType);
    }

    public static TableDescriptor link(String name, List<ColumnDescriptor> columns, List<String> primaryKey) {
        return new TableDescriptor(name, TableKind.LINK, columns, primaryKey, null, null);
    }

    public String idColumn() {
        return primaryKey.get(0);
    }

    /**
     * True for entity tables whose ids are generated 1..N and must stay dense.
     */
    public boolean isSurrogateKeyed() {
        return kind == TableKind.ENTITY && keyType != null && keyType.assignsSurrogate();
    }

    public List<ColumnDescriptor> foreignKeys() {
        return columns.stream().filter(ColumnDescriptor::isForeignKey).toList();
    }
}
