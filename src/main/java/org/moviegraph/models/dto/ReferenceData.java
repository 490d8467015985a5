package org.moviegraph.models.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Versioned inputs that are not part of the raw extracts: catalogs that replace incomplete
 * source names, and equivalence maps for duplicate entities, keyed by entity table.
 */
public record ReferenceData(Map<String, List<CatalogEntry>> catalogs,
                            Map<String, List<EquivalencePair>> equivalences) {

    public ReferenceData {
        catalogs = Map.copyOf(catalogs);
        equivalences = Map.copyOf(equivalences);
    }

    public List<CatalogEntry> catalog(String entityTable) {
        return catalogs.getOrDefault(entityTable, List.of());
    }

    public List<EquivalencePair> equivalences(String entityTable) {
        return equivalences.getOrDefault(entityTable, List.of());
    }

    public record CatalogEntry(String id, String name, Map<String, Object> attributes) {
        public CatalogEntry {
            attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        }
    }
}
