package org.moviegraph.service.transform;

import org.moviegraph.models.enums.KeyType;
import org.moviegraph.models.table.Table;
import org.moviegraph.models.table.TableDescriptor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Deduplicated entities of one table, in surrogate order, together with the natural to
 * surrogate lookup used when re-keying links. Immutable once built.
 */
public final class ResolvedEntities implements SurrogateKeyMap {

    private final String entityTable;
    private final KeyType keyType;
    private final List<Entity> entities;
    private final Map<Object, Object> surrogateByNatural;

    ResolvedEntities(String entityTable, KeyType keyType, List<Entity> entities) {
        this.entityTable = entityTable;
        this.keyType = keyType;
        this.entities = List.copyOf(entities);
        Map<Object, Object> lookup = new LinkedHashMap<>();
        for (Entity entity : this.entities) {
            lookup.put(entity.naturalId(), entity.surrogateId());
        }
        this.surrogateByNatural = Collections.unmodifiableMap(lookup);
    }

    @Override
    public String entityTable() {
        return entityTable;
    }

    public KeyType keyType() {
        return keyType;
    }

    public List<Entity> entities() {
        return entities;
    }

    public int size() {
        return entities.size();
    }

    @Override
    public Optional<Object> surrogateOf(Object naturalId) {
        Object key;
        try {
            key = keyType.normalize(naturalId);
        } catch (IllegalArgumentException exception) {
            return Optional.empty();
        }
        return key == null ? Optional.empty() : Optional.ofNullable(surrogateByNatural.get(key));
    }

    /**
     * Rows for the given entity table: surrogate id, natural id (when the table keeps one apart
     * from its key and name), name, then attributes.
     */
    public Table toTable(TableDescriptor descriptor, String nameColumn) {
        Table table = new Table(descriptor);
        String idColumn = descriptor.idColumn();
        String naturalIdColumn = descriptor.naturalIdColumn();
        for (Entity entity : entities) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(idColumn, entity.surrogateId());
            if (naturalIdColumn != null && !naturalIdColumn.equals(idColumn) && !naturalIdColumn.equals(nameColumn)) {
                row.put(naturalIdColumn, entity.naturalId());
            }
            row.put(nameColumn, entity.name());
            row.putAll(entity.attributes());
            table.add(row);
        }
        return table;
    }

    public record Entity(Object surrogateId, Object naturalId, String name, Map<String, Object> attributes) {
        public Entity {
            attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        }
    }
}
