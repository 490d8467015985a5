package org.moviegraph.service.transform;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.moviegraph.exceptions.DanglingReferenceException;
import org.moviegraph.models.dto.EntityCandidate;
import org.moviegraph.models.enums.ColumnType;
import org.moviegraph.models.enums.KeyType;
import org.moviegraph.models.table.ColumnDescriptor;
import org.moviegraph.models.table.Table;
import org.moviegraph.models.table.TableDescriptor;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for LinkMaterializer.
 */
@DisplayName("LinkMaterializer Tests")
class LinkMaterializerTest {

    private final LinkMaterializer materializer = new LinkMaterializer();
    private final EntityResolver resolver = new EntityResolver();

    private final ResolvedEntities movies = resolver.resolve("movie_infos", KeyType.INTEGER, Stream.of(
            EntityCandidate.of(19995, "Avatar"),
            EntityCandidate.of(285, "Pirates of the Caribbean: At World's End")));
    private final ResolvedEntities genres = resolver.resolve("genres", KeyType.INTEGER, Stream.of(
            EntityCandidate.of(28, "Action"),
            EntityCandidate.of(12, "Adventure")));

    private static final TableDescriptor MOVIE_GENRES = TableDescriptor.link("movie_genres", List.of(
            ColumnDescriptor.of("movie_id", ColumnType.INTEGER).references("movie_infos", "movie_id"),
            ColumnDescriptor.of("genre_id", ColumnType.INTEGER).references("genres", "genre_id")),
            List.of("movie_id", "genre_id"));

    private static Map<String, Object> row(Object movieId, Object genreId) {
        Map<String, Object> row = new HashMap<>();
        row.put("movie_id", movieId);
        row.put("genre_id", genreId);
        return row;
    }

    @Test
    @DisplayName("Should re-key natural ids to surrogates")
    void testRekey() {
        Table links = materializer.materialize(MOVIE_GENRES,
                Stream.of(row(19995, 28), row(19995, 12), row(285, 12)),
                Map.of("movie_id", movies, "genre_id", genres));

        assertEquals(3, links.size());
        assertEquals(List.of(1, 1), links.primaryKeyOf(links.rows().get(0)));
        assertEquals(List.of(1, 2), links.primaryKeyOf(links.rows().get(1)));
        assertEquals(List.of(2, 2), links.primaryKeyOf(links.rows().get(2)));
    }

    @Test
    @DisplayName("Rows coinciding under the surrogate key collapse to one")
    void testCollapse() {
        Table links = materializer.materialize(MOVIE_GENRES,
                Stream.of(row(19995, 28), row("19995", "28"), row(19995, 28)),
                Map.of("movie_id", movies, "genre_id", genres));
        assertEquals(1, links.size());
    }

    @Test
    @DisplayName("A link to a movie that was never unpacked is dangling")
    void testDanglingMovie() {
        DanglingReferenceException exception = assertThrows(DanglingReferenceException.class,
                () -> materializer.materialize(MOVIE_GENRES,
                        Stream.of(row(19995, 28), row(424242, 28)),
                        Map.of("movie_id", movies, "genre_id", genres)));
        assertEquals("movie_genres", exception.getLinkTable());
        assertEquals("movie_id", exception.getColumn());
        assertEquals(424242, exception.getNaturalId());
    }

    @Test
    @DisplayName("A null id inside the primary key is dangling")
    void testNullKey() {
        assertThrows(DanglingReferenceException.class,
                () -> materializer.materialize(MOVIE_GENRES, Stream.of(row(19995, null)),
                        Map.of("movie_id", movies, "genre_id", genres)));
    }

    @Test
    @DisplayName("A null in an optional reference stays null")
    void testOptionalReference() {
        TableDescriptor favourites = TableDescriptor.link("favourite_genres", List.of(
                ColumnDescriptor.of("movie_id", ColumnType.INTEGER).references("movie_infos", "movie_id"),
                ColumnDescriptor.of("genre_id", ColumnType.INTEGER).references("genres", "genre_id")),
                List.of("movie_id"));

        Table links = materializer.materialize(favourites, Stream.of(row(285, null)),
                Map.of("movie_id", movies, "genre_id", genres));
        assertNull(links.rows().get(0).get("genre_id"));
    }

    @Test
    @DisplayName("Links cannot be built before every referenced table is resolved")
    void testMissingKeyMap() {
        assertThrows(IllegalStateException.class,
                () -> materializer.materialize(MOVIE_GENRES, Stream.of(row(19995, 28)), Map.of("movie_id", movies)));
        assertThrows(IllegalStateException.class,
                () -> materializer.materialize(MOVIE_GENRES, Stream.of(row(19995, 28)),
                        Map.of("movie_id", movies, "genre_id", movies)));
    }
}
