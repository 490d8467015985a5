package org.moviegraph.service.transform;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.moviegraph.exceptions.DuplicateNaturalIdException;
import org.moviegraph.exceptions.MalformedNestedFieldException;
import org.moviegraph.models.dto.EntityCandidate;
import org.moviegraph.models.enums.KeyType;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for EntityResolver.
 */
@DisplayName("EntityResolver Tests")
class EntityResolverTest {

    private final EntityResolver resolver = new EntityResolver();

    @Test
    @DisplayName("Should dedupe on natural id and number in order of first appearance")
    void testResolveGenres() {
        ResolvedEntities genres = resolver.resolve("genres", KeyType.INTEGER, Stream.of(
                EntityCandidate.of(28, "Action"),
                EntityCandidate.of(12, "Adventure"),
                EntityCandidate.of("28", "Action"),
                EntityCandidate.of(14, "Fantasy")));

        assertEquals(3, genres.size());
        assertEquals(List.of(1, 2, 3), genres.entities().stream().map(ResolvedEntities.Entity::surrogateId).toList());
        assertEquals(List.of(28, 12, 14), genres.entities().stream().map(ResolvedEntities.Entity::naturalId).toList());
        assertEquals(1, genres.surrogateOf(28).orElseThrow());
        assertEquals(3, genres.surrogateOf("14").orElseThrow());
        assertTrue(genres.surrogateOf(99).isEmpty());
    }

    @Test
    @DisplayName("Code-keyed entities keep their code as id")
    void testCodeKeys() {
        ResolvedEntities countries = resolver.resolve("countries", KeyType.CODE, Stream.of(
                EntityCandidate.of("US", "United States of America"),
                EntityCandidate.of("GB", "United Kingdom"),
                EntityCandidate.of("US", "United States of America")));

        assertEquals(2, countries.size());
        assertEquals("US", countries.surrogateOf("US").orElseThrow());
        assertEquals("GB", countries.entities().get(1).surrogateId());
    }

    @Test
    @DisplayName("Name-keyed entities dedupe on the trimmed name")
    void testNameKeys() {
        ResolvedEntities departments = resolver.resolve("departments", KeyType.NAME, Stream.of(
                EntityCandidate.of("Directing", "Directing"),
                EntityCandidate.of("Writing", "Writing"),
                EntityCandidate.of("Directing ", "Directing ")));

        assertEquals(2, departments.size());
        assertEquals(2, departments.surrogateOf("Writing").orElseThrow());
    }

    @Test
    @DisplayName("Names differing only in surrounding blanks are the same entity")
    void testTrimmedNames() {
        ResolvedEntities keywords = resolver.resolve("keywords", KeyType.INTEGER, Stream.of(
                EntityCandidate.of(911, " exotic island "),
                EntityCandidate.of(911, "exotic island")));

        assertEquals(1, keywords.size());
        assertEquals("exotic island", keywords.entities().get(0).name());
    }

    @Test
    @DisplayName("Two names for one natural id are rejected")
    void testConflictingNames() {
        DuplicateNaturalIdException exception = assertThrows(DuplicateNaturalIdException.class,
                () -> resolver.resolve("genres", KeyType.INTEGER, Stream.of(
                        EntityCandidate.of(28, "Action"),
                        EntityCandidate.of(28, "Drama"))));
        assertEquals(28, exception.getNaturalId());
        assertEquals("genres", exception.getEntityTable());
    }

    @Test
    @DisplayName("Two attribute sets for one natural id are rejected")
    void testConflictingAttributes() {
        assertThrows(DuplicateNaturalIdException.class,
                () -> resolver.resolve("languages", KeyType.CODE, Stream.of(
                        new EntityCandidate("en", "English", Map.of("language_name_en", "English")),
                        new EntityCandidate("en", "English", Map.of("language_name_en", "Anglais")))));
    }

    @Test
    @DisplayName("An entity without a natural id is malformed")
    void testMissingId() {
        assertThrows(MalformedNestedFieldException.class,
                () -> resolver.resolve("genres", KeyType.INTEGER, Stream.of(EntityCandidate.of(null, "Action"))));
        assertThrows(MalformedNestedFieldException.class,
                () -> resolver.resolve("genres", KeyType.INTEGER, Stream.of(EntityCandidate.of("x", "Action"))));
    }

    @Test
    @DisplayName("An empty input gives an empty table")
    void testEmpty() {
        assertEquals(0, resolver.resolve("genres", KeyType.INTEGER, Stream.empty()).size());
    }
}
