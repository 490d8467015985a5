package org.moviegraph.models.table;

import org.moviegraph.models.enums.ColumnType;

import java.util.Objects;

public record ColumnDescriptor(String name,
                               ColumnType type,
                               Integer length,
                               boolean nullable,
                               String referencedTable,
                               String referencedColumn) {

    public ColumnDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    public static ColumnDescriptor of(String name, ColumnType type) {
        return new ColumnDescriptor(name, type, null, true, null, null);
    }

    public static ColumnDescriptor varchar(String name, int length) {
        return new ColumnDescriptor(name, ColumnType.VARCHAR, length, true, null, null);
    }

    public ColumnDescriptor notNull() {
        return new ColumnDescriptor(name, type, length, false, referencedTable, referencedColumn);
    }

    public ColumnDescriptor references(String table, String column) {
        return new ColumnDescriptor(name, type, length, nullable, table, column);
    }

    public boolean isForeignKey() {
        return referencedTable != null;
    }

    public String sqlType() {
        return type.sqlType(length);
    }
}
