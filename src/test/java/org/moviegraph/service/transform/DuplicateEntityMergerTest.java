package org.moviegraph.service.transform;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.moviegraph.exceptions.ErrorCode;
import org.moviegraph.exceptions.InvalidEquivalenceMapException;
import org.moviegraph.exceptions.UnknownSupersededIdException;
import org.moviegraph.models.dto.EntityCandidate;
import org.moviegraph.models.dto.EquivalencePair;
import org.moviegraph.models.enums.ColumnType;
import org.moviegraph.models.enums.KeyType;
import org.moviegraph.models.table.ColumnDescriptor;
import org.moviegraph.models.table.NormalizedSchema;
import org.moviegraph.models.table.Table;
import org.moviegraph.models.table.TableDescriptor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for DuplicateEntityMerger.
 */
@DisplayName("DuplicateEntityMerger Tests")
class DuplicateEntityMergerTest {

    private static final TableDescriptor MOVIES = TableDescriptor.entity("movie_infos", List.of(
            ColumnDescriptor.of("movie_id", ColumnType.INTEGER),
            ColumnDescriptor.of("movie_id_old", ColumnType.INTEGER).notNull(),
            ColumnDescriptor.varchar("title", 255)), "movie_id", "movie_id_old", KeyType.INTEGER);

    private static final TableDescriptor COMPANIES = TableDescriptor.entity("prod_companies", List.of(
            ColumnDescriptor.of("company_id", ColumnType.INTEGER),
            ColumnDescriptor.of("company_id_old", ColumnType.INTEGER).notNull(),
            ColumnDescriptor.varchar("company_name", 255)), "company_id", "company_id_old", KeyType.INTEGER);

    private static final TableDescriptor MOVIE_COMPANIES = TableDescriptor.link("movie_prod_companies", List.of(
            ColumnDescriptor.of("movie_id", ColumnType.INTEGER).references("movie_infos", "movie_id"),
            ColumnDescriptor.of("company_id", ColumnType.INTEGER).references("prod_companies", "company_id")),
            List.of("movie_id", "company_id"));

    private final IntegrityEnforcer enforcer = new IntegrityEnforcer();
    private final DuplicateEntityMerger merger = new DuplicateEntityMerger(enforcer);
    private NormalizedSchema schema;

    @BeforeEach
    void setUp() {
        EntityResolver resolver = new EntityResolver();
        ResolvedEntities movies = resolver.resolve("movie_infos", KeyType.INTEGER, Stream.of(
                EntityCandidate.of(19995, "Avatar"),
                EntityCandidate.of(285, "Pirates of the Caribbean: At World's End"),
                EntityCandidate.of(99999, "Unknown Film")));
        ResolvedEntities companies = resolver.resolve("prod_companies", KeyType.INTEGER, Stream.of(
                EntityCandidate.of(289, "Ingenious Film Partners"),
                EntityCandidate.of(36390, "Studio Dup"),
                EntityCandidate.of(787, "Studio Canon"),
                EntityCandidate.of(2, "Walt Disney Pictures")));

        schema = new NormalizedSchema();
        schema.add(movies.toTable(MOVIES, "title"));
        schema.add(companies.toTable(COMPANIES, "company_name"));
        schema.add(new LinkMaterializer().materialize(MOVIE_COMPANIES, Stream.of(
                        link(19995, 289), link(19995, 36390), link(19995, 787),
                        link(285, 2), link(285, 787),
                        link(99999, 36390)),
                Map.of("movie_id", movies, "company_id", companies)));
    }

    private static Map<String, Object> link(int movieId, int companyId) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("movie_id", movieId);
        row.put("company_id", companyId);
        return row;
    }

    private Object companyIdOf(int naturalId) {
        return schema.table("prod_companies").findBy("company_id_old", naturalId).orElseThrow().get("company_id");
    }

    @Test
    @DisplayName("Should fold the superseded company into the canonical one and drop it")
    void testMerge() {
        DuplicateEntityMerger.MergeResult result = merger.merge(schema, "prod_companies",
                List.of(new EquivalencePair(36390, 787)));

        Table companies = schema.table("prod_companies");
        assertEquals(List.of(289, 787, 2), companies.columnValues("company_id_old"));
        assertTrue(companies.findBy("company_id_old", 36390).isEmpty());

        Table links = schema.table("movie_prod_companies");
        Object canonical = companyIdOf(787);
        assertEquals(5, links.size());
        assertTrue(links.rows().stream().anyMatch(row -> row.get("movie_id").equals(3) && row.get("company_id").equals(canonical)));

        assertEquals(1, result.merged());
        assertEquals(2, result.linksRewritten());
        assertEquals(1, result.linksCollapsed());
        assertEquals(1, result.rowsDeleted());
        assertDoesNotThrow(() -> enforcer.verify(schema));
    }

    @Test
    @DisplayName("Surviving company ids stay dense after a merge")
    void testDensity() {
        merger.merge(schema, "prod_companies", List.of(new EquivalencePair("36390", "787")));
        assertEquals(List.of(1, 2, 3), schema.table("prod_companies").columnValues("company_id"));
        assertEquals(3, companyIdOf(2));
    }

    @Test
    @DisplayName("Applying the same map twice changes nothing the second time")
    void testIdempotent() {
        List<EquivalencePair> pairs = List.of(new EquivalencePair(36390, 787));
        merger.merge(schema, "prod_companies", pairs);
        List<Map<String, Object>> before = new ArrayList<>();
        for (Map<String, Object> row : schema.table("movie_prod_companies").rows()) {
            before.add(new LinkedHashMap<>(row));
        }

        DuplicateEntityMerger.MergeResult second = merger.merge(schema, "prod_companies", pairs);

        assertEquals(0, second.merged());
        assertEquals(1, second.alreadyMerged());
        assertEquals(before, schema.table("movie_prod_companies").rows());
    }

    @Test
    @DisplayName("A superseded id known nowhere is rejected")
    void testUnknownSuperseded() {
        UnknownSupersededIdException exception = assertThrows(UnknownSupersededIdException.class,
                () -> merger.merge(schema, "prod_companies", List.of(new EquivalencePair(12345, 787))));
        assertEquals(12345, exception.getNaturalId());
    }

    @Test
    @DisplayName("A canonical id known nowhere is rejected")
    void testUnknownCanonical() {
        assertThrows(UnknownSupersededIdException.class,
                () -> merger.merge(schema, "prod_companies", List.of(new EquivalencePair(36390, 54321))));
    }

    @Test
    @DisplayName("Chained pairs fold straight into the last canonical company")
    void testChain() {
        merger.merge(schema, "prod_companies", List.of(
                new EquivalencePair(36390, 787),
                new EquivalencePair(787, 2)));

        Table companies = schema.table("prod_companies");
        assertEquals(List.of(289, 2), companies.columnValues("company_id_old"));
        Object disney = companyIdOf(2);
        assertTrue(schema.table("movie_prod_companies").rows().stream()
                .filter(row -> row.get("movie_id").equals(3))
                .allMatch(row -> row.get("company_id").equals(disney)));
        assertDoesNotThrow(() -> enforcer.verify(schema));
    }

    @Test
    @DisplayName("Several superseded ids may share one canonical id")
    void testManyToOne() {
        merger.merge(schema, "prod_companies", List.of(
                new EquivalencePair(36390, 2),
                new EquivalencePair(787, 2)));

        assertEquals(List.of(289, 2), schema.table("prod_companies").columnValues("company_id_old"));
        assertEquals(4, schema.table("movie_prod_companies").size());
    }

    @Test
    @DisplayName("A pair whose id is not a number is a build error, not a crash")
    void testNonNumericId() {
        InvalidEquivalenceMapException exception = assertThrows(InvalidEquivalenceMapException.class,
                () -> merger.merge(schema, "prod_companies", List.of(new EquivalencePair("36390x", "787"))));
        assertEquals(ErrorCode.INVALID_EQUIVALENCE_MAP, exception.getCode());
        assertEquals("prod_companies", exception.getEntityTable());
        assertEquals(4, schema.table("prod_companies").size());
    }

    @Test
    @DisplayName("Pairs that loop back on themselves are rejected before anything is rewritten")
    void testCycle() {
        InvalidEquivalenceMapException exception = assertThrows(InvalidEquivalenceMapException.class,
                () -> merger.merge(schema, "prod_companies", List.of(
                        new EquivalencePair(36390, 787),
                        new EquivalencePair(787, 36390))));
        assertEquals(ErrorCode.INVALID_EQUIVALENCE_MAP, exception.getCode());
        assertEquals(4, schema.table("prod_companies").size());
        assertEquals(6, schema.table("movie_prod_companies").size());
    }
}
