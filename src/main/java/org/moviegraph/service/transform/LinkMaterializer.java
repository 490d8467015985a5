package org.moviegraph.service.transform;

import lombok.extern.slf4j.Slf4j;
import org.moviegraph.exceptions.DanglingReferenceException;
import org.moviegraph.models.table.ColumnDescriptor;
import org.moviegraph.models.table.Table;
import org.moviegraph.models.table.TableDescriptor;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Re-keys natural-id association rows to surrogate ids and collapses rows that coincide under
 * the surrogate primary key. Every foreign-key column of the target table needs the key map of
 * a fully resolved entity table.
 */
@Slf4j
@Component
public class LinkMaterializer {

    public Table materialize(TableDescriptor descriptor,
                             Stream<Map<String, Object>> naturalRows,
                             Map<String, ? extends SurrogateKeyMap> keyMaps) {
        List<ColumnDescriptor> foreignKeys = descriptor.foreignKeys();
        for (ColumnDescriptor foreignKey : foreignKeys) {
            SurrogateKeyMap keyMap = keyMaps.get(foreignKey.name());
            if (keyMap == null) {
                throw new IllegalStateException("Cannot re-key " + descriptor.name() + "." + foreignKey.name()
                        + " before " + foreignKey.referencedTable() + " is resolved");
            }
            if (!keyMap.entityTable().equals(foreignKey.referencedTable())) {
                throw new IllegalStateException("Key map for " + descriptor.name() + "." + foreignKey.name()
                        + " belongs to " + keyMap.entityTable() + ", expected " + foreignKey.referencedTable());
            }
        }

        Table table = new Table(descriptor);
        Set<List<Object>> seen = new HashSet<>();
        int received = 0;
        int collapsed = 0;
        Iterator<Map<String, Object>> iterator = naturalRows.iterator();
        while (iterator.hasNext()) {
            Map<String, Object> natural = iterator.next();
            received++;
            Map<String, Object> row = new LinkedHashMap<>(natural);
            for (ColumnDescriptor foreignKey : foreignKeys) {
                row.put(foreignKey.name(), rekey(descriptor, foreignKey, keyMaps.get(foreignKey.name()),
                        natural.get(foreignKey.name())));
            }
            List<Object> key = descriptor.primaryKey().stream().map(row::get).toList();
            if (!seen.add(key)) {
                collapsed++;
                continue;
            }
            table.add(row);
        }
        log.info("[link] {}: {} association rows -> {} links ({} duplicates collapsed)",
                descriptor.name(), received, table.size(), collapsed);
        return table;
    }

    private Object rekey(TableDescriptor descriptor, ColumnDescriptor foreignKey, SurrogateKeyMap keyMap, Object naturalId) {
        if (naturalId == null) {
            if (foreignKey.nullable() && !descriptor.primaryKey().contains(foreignKey.name())) {
                return null;
            }
            throw new DanglingReferenceException(descriptor.name(), foreignKey.name(), null);
        }
        return keyMap.surrogateOf(naturalId)
                .orElseThrow(() -> new DanglingReferenceException(descriptor.name(), foreignKey.name(), naturalId));
    }
}
