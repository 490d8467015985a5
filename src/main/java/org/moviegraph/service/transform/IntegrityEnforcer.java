package org.moviegraph.service.transform;

import lombok.extern.slf4j.Slf4j;
import org.moviegraph.exceptions.IntegrityViolationException;
import org.moviegraph.models.enums.TableKind;
import org.moviegraph.models.table.ColumnDescriptor;
import org.moviegraph.models.table.NormalizedSchema;
import org.moviegraph.models.table.Table;
import org.moviegraph.models.table.TableDescriptor;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Primary-key, natural-key, density and foreign-key constraints over an in-memory schema, plus
 * the cascading delete and key-update rules those foreign keys carry.
 */
@Slf4j
@Component
public class IntegrityEnforcer {

    /**
     * @throws IntegrityViolationException on the first constraint that does not hold
     */
    public void verify(NormalizedSchema schema) {
        int constraints = 0;
        for (Table table : schema.tables()) {
            TableDescriptor descriptor = table.descriptor();
            checkNotNull(table);
            checkUnique(table, descriptor.primaryKey(), "primary key");
            constraints++;
            if (descriptor.kind() == TableKind.ENTITY && descriptor.naturalIdColumn() != null
                    && !descriptor.primaryKey().contains(descriptor.naturalIdColumn())) {
                checkUnique(table, List.of(descriptor.naturalIdColumn()), "natural id");
                constraints++;
            }
            if (descriptor.isSurrogateKeyed()) {
                checkDense(table);
                constraints++;
            }
            for (ColumnDescriptor foreignKey : descriptor.foreignKeys()) {
                checkReference(schema, table, foreignKey);
                constraints++;
            }
        }
        log.info("[integrity] {} constraints hold over {} tables and {} rows",
                constraints, schema.tables().size(), schema.totalRows());
    }

    /**
     * Deletes the rows of {@code tableName} whose {@code column} holds one of {@code values}, and
     * every row that references a deleted row, transitively.
     *
     * @return number of rows removed across all tables
     */
    public int cascadeDelete(NormalizedSchema schema, String tableName, String column, Collection<?> values) {
        if (values.isEmpty()) {
            return 0;
        }
        Set<Object> targets = new HashSet<>(values);
        Table table = schema.table(tableName);
        List<NormalizedSchema.Reference> references = schema.referencesTo(tableName);

        Map<String, Set<Object>> deletedByColumn = new HashMap<>();
        int[] removed = {0};
        table.removeIf(row -> {
            if (!targets.contains(row.get(column))) {
                return false;
            }
            for (NormalizedSchema.Reference reference : references) {
                String referenced = reference.column().referencedColumn();
                deletedByColumn.computeIfAbsent(referenced, key -> new HashSet<>()).add(row.get(referenced));
            }
            removed[0]++;
            return true;
        });

        int total = removed[0];
        for (NormalizedSchema.Reference reference : references) {
            Set<Object> deleted = deletedByColumn.getOrDefault(reference.column().referencedColumn(), Set.of());
            total += cascadeDelete(schema, reference.table().name(), reference.column().name(), deleted);
        }
        return total;
    }

    /**
     * Renumbers the surrogate ids of an entity table to 1..N in current row order and rewrites
     * every referencing column to match.
     *
     * @return old id to new id, for the ids that changed
     */
    public Map<Object, Object> renumber(NormalizedSchema schema, String tableName) {
        Table table = schema.table(tableName);
        TableDescriptor descriptor = table.descriptor();
        if (!descriptor.isSurrogateKeyed()) {
            throw new IllegalArgumentException("Table " + tableName + " does not carry surrogate ids");
        }
        String idColumn = descriptor.idColumn();
        Map<Object, Object> changed = new LinkedHashMap<>();
        int next = 1;
        for (Map<String, Object> row : table.rows()) {
            Object current = row.get(idColumn);
            Integer assigned = next++;
            if (!assigned.equals(current)) {
                changed.put(current, assigned);
            }
        }
        if (changed.isEmpty()) {
            return changed;
        }
        for (Map<String, Object> row : table.rows()) {
            Object current = row.get(idColumn);
            if (changed.containsKey(current)) {
                row.put(idColumn, changed.get(current));
            }
        }
        for (NormalizedSchema.Reference reference : schema.referencesTo(tableName)) {
            String column = reference.column().name();
            for (Map<String, Object> row : reference.table().rows()) {
                Object value = row.get(column);
                if (value != null && changed.containsKey(value)) {
                    row.put(column, changed.get(value));
                }
            }
        }
        log.info("[integrity] {}: {} surrogate ids renumbered", tableName, changed.size());
        return changed;
    }

    private void checkNotNull(Table table) {
        for (ColumnDescriptor column : table.descriptor().columns()) {
            boolean required = !column.nullable() || table.descriptor().primaryKey().contains(column.name());
            if (!required) {
                continue;
            }
            for (Map<String, Object> row : table.rows()) {
                if (row.get(column.name()) == null) {
                    throw violation("%s.%s is null in row %s", table.name(), column.name(), row);
                }
            }
        }
    }

    private void checkUnique(Table table, List<String> columns, String constraint) {
        Set<List<Object>> seen = new HashSet<>();
        for (Map<String, Object> row : table.rows()) {
            List<Object> key = columns.stream().map(row::get).toList();
            if (!seen.add(key)) {
                throw violation("%s %s %s is not unique: %s", table.name(), constraint, columns, key);
            }
        }
    }

    private void checkDense(Table table) {
        String idColumn = table.descriptor().idColumn();
        int size = table.size();
        Set<Object> ids = new HashSet<>(table.columnValues(idColumn));
        for (int id = 1; id <= size; id++) {
            if (!ids.contains(id)) {
                throw violation("%s.%s is not dense: %d missing from 1..%d", table.name(), idColumn, id, size);
            }
        }
    }

    private void checkReference(NormalizedSchema schema, Table table, ColumnDescriptor foreignKey) {
        if (!schema.contains(foreignKey.referencedTable())) {
            throw violation("%s.%s references missing table %s", table.name(), foreignKey.name(),
                    foreignKey.referencedTable());
        }
        Set<Object> targets = new HashSet<>(schema.table(foreignKey.referencedTable())
                .columnValues(foreignKey.referencedColumn()));
        for (Map<String, Object> row : table.rows()) {
            Object value = row.get(foreignKey.name());
            if (value != null && !targets.contains(value)) {
                throw violation("%s.%s = %s has no match in %s.%s", table.name(), foreignKey.name(), value,
                        foreignKey.referencedTable(), foreignKey.referencedColumn());
            }
        }
    }

    private IntegrityViolationException violation(String format, Object... args) {
        String message = String.format(format, args);
        log.error("[integrity] {}", message);
        return new IntegrityViolationException(message);
    }
}
