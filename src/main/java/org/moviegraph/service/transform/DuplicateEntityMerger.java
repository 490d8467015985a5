package org.moviegraph.service.transform;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.moviegraph.exceptions.InvalidEquivalenceMapException;
import org.moviegraph.exceptions.UnknownSupersededIdException;
import org.moviegraph.models.dto.EquivalencePair;
import org.moviegraph.models.enums.KeyType;
import org.moviegraph.models.table.NormalizedSchema;
import org.moviegraph.models.table.Table;
import org.moviegraph.models.table.TableDescriptor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Folds entities that an explicit equivalence map declares identical into their canonical row.
 * Links are rewritten first, then the superseded rows are deleted, then the surviving ids are
 * renumbered so they stay dense.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DuplicateEntityMerger {

    private final IntegrityEnforcer integrityEnforcer;

    public MergeResult merge(NormalizedSchema schema, String entityTable, Iterable<EquivalencePair> pairs) {
        Table entities = schema.table(entityTable);
        TableDescriptor descriptor = entities.descriptor();
        String idColumn = descriptor.idColumn();
        String naturalIdColumn = descriptor.naturalIdColumn() == null ? idColumn : descriptor.naturalIdColumn();
        KeyType keyType = descriptor.keyType() == null ? KeyType.INTEGER : descriptor.keyType();

        Map<Object, Object> surrogateByNatural = new LinkedHashMap<>();
        for (Map<String, Object> row : entities.rows()) {
            surrogateByNatural.put(row.get(naturalIdColumn), row.get(idColumn));
        }

        Map<Object, Object> canonicalBySuperseded = new LinkedHashMap<>();
        Map<Object, Object> naturalMerges = new LinkedHashMap<>();
        int alreadyMerged = 0;
        for (EquivalencePair pair : pairs) {
            Object superseded = naturalId(entityTable, keyType, pair.supersededId());
            Object canonical = currentCanonical(schema, entityTable, naturalId(entityTable, keyType, pair.canonicalId()));
            Object supersededSurrogate = surrogateByNatural.get(superseded);
            if (supersededSurrogate == null) {
                Optional<Object> mergedInto = schema.mergedInto(entityTable, superseded);
                if (mergedInto.isPresent() && currentCanonical(schema, entityTable, mergedInto.get()).equals(canonical)) {
                    alreadyMerged++;
                    continue;
                }
                throw new UnknownSupersededIdException(entityTable, superseded);
            }
            Object canonicalSurrogate = surrogateByNatural.get(canonical);
            if (canonicalSurrogate == null) {
                throw new UnknownSupersededIdException(entityTable, canonical);
            }
            canonicalBySuperseded.put(supersededSurrogate, canonicalSurrogate);
            naturalMerges.put(superseded, canonical);
        }

        // a -> b together with b -> c folds a straight into c
        canonicalBySuperseded.replaceAll((superseded, canonical) -> followChain(entityTable, canonicalBySuperseded, canonical));
        naturalMerges.replaceAll((superseded, canonical) -> followChain(entityTable, naturalMerges, canonical));

        if (canonicalBySuperseded.isEmpty()) {
            log.info("[merge] {}: nothing to merge ({} pairs already applied)", entityTable, alreadyMerged);
            return new MergeResult(entityTable, 0, alreadyMerged, 0, 0, 0);
        }

        int rewritten = 0;
        int collapsed = 0;
        for (NormalizedSchema.Reference reference : schema.referencesTo(entityTable)) {
            String column = reference.column().name();
            int rewrittenHere = 0;
            for (Map<String, Object> row : reference.table().rows()) {
                Object value = row.get(column);
                if (value != null && canonicalBySuperseded.containsKey(value)) {
                    row.put(column, canonicalBySuperseded.get(value));
                    rewrittenHere++;
                }
            }
            if (rewrittenHere > 0) {
                collapsed += reference.table().collapseDuplicateKeys();
                rewritten += rewrittenHere;
            }
        }

        int deleted = integrityEnforcer.cascadeDelete(schema, entityTable, idColumn, canonicalBySuperseded.keySet());
        naturalMerges.forEach((superseded, canonical) -> schema.recordMerge(entityTable, superseded, canonical));
        if (descriptor.isSurrogateKeyed()) {
            integrityEnforcer.renumber(schema, entityTable);
        }

        log.info("[merge] {}: {} entities merged, {} link rows rewritten, {} collapsed, {} rows deleted",
                entityTable, naturalMerges.size(), rewritten, collapsed, deleted);
        return new MergeResult(entityTable, naturalMerges.size(), alreadyMerged, rewritten, collapsed, deleted);
    }

    private Object naturalId(String entityTable, KeyType keyType, Object raw) {
        Object naturalId;
        try {
            naturalId = keyType.normalize(raw);
        } catch (IllegalArgumentException exception) {
            throw new InvalidEquivalenceMapException(entityTable, exception.getMessage(), exception);
        }
        if (naturalId == null) {
            throw new InvalidEquivalenceMapException(entityTable, "pair with a blank id");
        }
        return naturalId;
    }

    private Object currentCanonical(NormalizedSchema schema, String entityTable, Object naturalId) {
        Object current = naturalId;
        Optional<Object> next = schema.mergedInto(entityTable, current);
        while (next.isPresent()) {
            current = next.get();
            next = schema.mergedInto(entityTable, current);
        }
        return current;
    }

    private Object followChain(String entityTable, Map<Object, Object> mapping, Object start) {
        Object current = start;
        int hops = 0;
        while (mapping.containsKey(current)) {
            current = mapping.get(current);
            if (++hops > mapping.size()) {
                throw new InvalidEquivalenceMapException(entityTable, "cycle through " + start);
            }
        }
        return current;
    }

    public record MergeResult(String entityTable,
                              int merged,
                              int alreadyMerged,
                              int linksRewritten,
                              int linksCollapsed,
                              int rowsDeleted) {
    }
}
