package org.moviegraph.service.transform;

import lombok.extern.slf4j.Slf4j;
import org.moviegraph.exceptions.DuplicateNaturalIdException;
import org.moviegraph.exceptions.MalformedNestedFieldException;
import org.moviegraph.models.dto.EntityCandidate;
import org.moviegraph.models.enums.KeyType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Deduplicates entity observations on their exact natural id and numbers them 1..N in order of
 * first appearance. Code-keyed entities keep their code as id.
 */
@Slf4j
@Component
public class EntityResolver {

    public ResolvedEntities resolve(String entityTable, KeyType keyType, Stream<EntityCandidate> candidates) {
        Map<Object, EntityCandidate> firstSeen = new LinkedHashMap<>();
        int observed = 0;
        Iterator<EntityCandidate> iterator = candidates.iterator();
        while (iterator.hasNext()) {
            EntityCandidate candidate = iterator.next();
            observed++;
            Object naturalId = naturalId(entityTable, keyType, candidate);
            EntityCandidate existing = firstSeen.putIfAbsent(naturalId, candidate);
            if (existing != null) {
                ensureConsistent(entityTable, naturalId, existing, candidate);
            }
        }

        List<ResolvedEntities.Entity> entities = new ArrayList<>(firstSeen.size());
        int next = 1;
        for (Map.Entry<Object, EntityCandidate> entry : firstSeen.entrySet()) {
            Object surrogate = keyType.assignsSurrogate() ? next++ : entry.getKey();
            EntityCandidate candidate = entry.getValue();
            entities.add(new ResolvedEntities.Entity(surrogate, entry.getKey(), clean(candidate.name()),
                    candidate.attributes()));
        }
        log.info("[resolve] {}: {} observations -> {} entities", entityTable, observed, entities.size());
        return new ResolvedEntities(entityTable, keyType, entities);
    }

    static Object naturalId(String entityTable, KeyType keyType, EntityCandidate candidate) {
        Object naturalId;
        try {
            naturalId = keyType.normalize(candidate.naturalId());
        } catch (IllegalArgumentException exception) {
            throw new MalformedNestedFieldException(candidate.naturalId(), entityTable, exception.getMessage(), exception);
        }
        if (naturalId == null) {
            throw new MalformedNestedFieldException(null, entityTable,
                    "entity '" + candidate.name() + "' has no natural id");
        }
        return naturalId;
    }

    private void ensureConsistent(String entityTable, Object naturalId, EntityCandidate existing, EntityCandidate candidate) {
        if (!Objects.equals(clean(existing.name()), clean(candidate.name()))) {
            throw new DuplicateNaturalIdException(entityTable, naturalId,
                    "names '" + existing.name() + "' and '" + candidate.name() + "'");
        }
        if (!Objects.equals(existing.attributes(), candidate.attributes())) {
            throw new DuplicateNaturalIdException(entityTable, naturalId,
                    "attributes " + existing.attributes() + " and " + candidate.attributes());
        }
    }

    private static String clean(String name) {
        return name == null ? null : name.trim();
    }
}
