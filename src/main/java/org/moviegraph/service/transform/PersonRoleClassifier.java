package org.moviegraph.service.transform;

import lombok.extern.slf4j.Slf4j;
import org.moviegraph.exceptions.DuplicateNaturalIdException;
import org.moviegraph.exceptions.MalformedNestedFieldException;
import org.moviegraph.exceptions.RoleClassificationException;
import org.moviegraph.models.dto.EntityCandidate;
import org.moviegraph.models.enums.Gender;
import org.moviegraph.models.enums.KeyType;
import org.moviegraph.models.enums.PersonRole;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Merges people seen in the cast and in the crew lists into one entity set and derives each
 * person's role from where they were seen.
 * <p>
 * Gender is read from the {@value #GENDER} attribute. When the same person carries the
 * "not specified" placeholder in some rows and a real gender in others, the placeholder rows are
 * dropped. Two different real genders, or two different names, for one id are an error.
 */
@Slf4j
@Component
public class PersonRoleClassifier {

    public static final String GENDER = "gender_id";
    public static final String ROLE = "role_id";

    public ResolvedEntities classify(String entityTable, Stream<EntityCandidate> cast, Stream<EntityCandidate> crew) {
        Map<Object, Observation> observations = new LinkedHashMap<>();
        int castRows = observe(entityTable, cast, observations, true);
        int crewRows = observe(entityTable, crew, observations, false);

        List<ResolvedEntities.Entity> people = new ArrayList<>(observations.size());
        int next = 1;
        int placeholdersDropped = 0;
        for (Map.Entry<Object, Observation> entry : observations.entrySet()) {
            Object personId = entry.getKey();
            Observation observation = entry.getValue();
            PersonRole role = PersonRole.of(observation.inCast, observation.inCrew);
            if (role == null) {
                throw new RoleClassificationException(personId);
            }
            int gender = resolveGender(entityTable, personId, observation.genders);
            if (observation.genders.size() > 1) {
                placeholdersDropped++;
                log.debug("[classify] person {} seen with genders {}, keeping {}", personId, observation.genders, gender);
            }
            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put(GENDER, gender);
            attributes.put(ROLE, role.getId());
            people.add(new ResolvedEntities.Entity(next++, personId, observation.name, attributes));
        }
        log.info("[classify] {}: {} cast and {} crew observations -> {} people ({} placeholder genders dropped)",
                entityTable, castRows, crewRows, people.size(), placeholdersDropped);
        return new ResolvedEntities(entityTable, KeyType.INTEGER, people);
    }

    private int observe(String entityTable, Stream<EntityCandidate> candidates,
                        Map<Object, Observation> observations, boolean fromCast) {
        int count = 0;
        Iterator<EntityCandidate> iterator = candidates.iterator();
        while (iterator.hasNext()) {
            EntityCandidate candidate = iterator.next();
            count++;
            Object personId = EntityResolver.naturalId(entityTable, KeyType.INTEGER, candidate);
            String name = candidate.name() == null ? null : candidate.name().trim();
            Observation observation = observations.computeIfAbsent(personId, key -> new Observation(name));
            if (!Objects.equals(observation.name, name)) {
                throw new DuplicateNaturalIdException(entityTable, personId,
                        "names '" + observation.name + "' and '" + name + "'");
            }
            observation.genders.add(genderOf(candidate));
            if (fromCast) {
                observation.inCast = true;
            } else {
                observation.inCrew = true;
            }
        }
        return count;
    }

    private int resolveGender(String entityTable, Object personId, Set<Integer> genders) {
        List<Integer> specified = genders.stream()
                .filter(gender -> !Gender.isPlaceholder(gender))
                .toList();
        if (specified.size() > 1) {
            throw new DuplicateNaturalIdException(entityTable, personId, "conflicting genders " + specified);
        }
        return specified.isEmpty() ? Gender.NOT_SPECIFIED.getId() : specified.get(0);
    }

    private Integer genderOf(EntityCandidate candidate) {
        Object value = candidate.attributes().get(GENDER);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value == null || value.toString().isBlank()) {
            return Gender.NOT_SPECIFIED.getId();
        }
        try {
            return Integer.valueOf(value.toString().trim());
        } catch (NumberFormatException exception) {
            throw new MalformedNestedFieldException(candidate.naturalId(), GENDER,
                    "gender '" + value + "' is not a code", exception);
        }
    }

    private static final class Observation {
        private final String name;
        private final Set<Integer> genders = new LinkedHashSet<>();
        private boolean inCast;
        private boolean inCrew;

        private Observation(String name) {
            this.name = name;
        }
    }
}
