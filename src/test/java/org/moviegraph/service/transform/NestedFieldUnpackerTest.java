package org.moviegraph.service.transform;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.moviegraph.exceptions.ErrorCode;
import org.moviegraph.exceptions.MalformedNestedFieldException;
import org.moviegraph.models.dto.RawRow;
import org.moviegraph.models.dto.UnpackedRecord;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for NestedFieldUnpacker.
 */
@DisplayName("NestedFieldUnpacker Tests")
class NestedFieldUnpackerTest {

    private final NestedFieldUnpacker unpacker = new NestedFieldUnpacker(new ObjectMapper());

    private static RawRow movie(String genres) {
        return new RawRow("infos", 19995, Map.of("genres", genres == null ? "" : genres));
    }

    @Test
    @DisplayName("Should emit one record per element in list order")
    void testUnpackGenres() {
        List<UnpackedRecord> records = unpacker.unpack(
                movie("[{\"id\": 28, \"name\": \"Action\"}, {\"id\": 12, \"name\": \"Adventure\"}]"), "genres").toList();

        assertEquals(2, records.size());
        assertEquals(19995, records.get(0).parentId());
        assertEquals(0, records.get(0).position());
        assertEquals(28, records.get(0).value("id"));
        assertEquals("Action", records.get(0).text("name"));
        assertEquals(12, records.get(1).integer("id"));
        assertEquals(1, records.get(1).position());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "[]"})
    @DisplayName("Blank or empty lists give no records")
    void testEmpty(String raw) {
        assertEquals(0, unpacker.unpack(movie(raw), "genres").count());
    }

    @Test
    @DisplayName("Missing sub-fields read as null")
    void testMissingSubField() {
        UnpackedRecord record = unpacker.unpack(movie("[{\"id\": 28}]"), "genres").findFirst().orElseThrow();
        assertNull(record.value("name"));
        assertNull(record.text("name"));
    }

    @Test
    @DisplayName("Should convert scalar JSON values to Java types")
    void testScalarConversion() {
        UnpackedRecord record = unpacker.unpack(
                movie("[{\"i\": 1, \"l\": 12345678901, \"d\": 1.5, \"b\": true, \"n\": null, \"s\": \"x\"}]"), "genres")
                .findFirst().orElseThrow();
        assertEquals(1, record.value("i"));
        assertEquals(12345678901L, record.value("l"));
        assertEquals(1.5d, record.value("d"));
        assertEquals(Boolean.TRUE, record.value("b"));
        assertNull(record.value("n"));
        assertEquals("x", record.value("s"));
    }

    @Test
    @DisplayName("Unparseable JSON is reported with the parent id and field")
    void testUnparseable() {
        MalformedNestedFieldException exception = assertThrows(MalformedNestedFieldException.class,
                () -> unpacker.unpack(movie("[{\"id\": 28,"), "genres"));
        assertEquals(ErrorCode.MALFORMED_NESTED_FIELD, exception.getCode());
        assertEquals(19995, exception.getParentId());
        assertEquals("genres", exception.getField());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "[{\"id\": 28, \"name\": \"Action\"}]]garbage",
            "[{\"id\": 28, \"name\": \"Action\"}] [{\"id\": 12}]",
            "[{\"id\": 28, \"name\": \"Action\"}] x"})
    @DisplayName("Anything after the closing bracket makes the cell malformed")
    void testTrailingContent(String raw) {
        MalformedNestedFieldException exception = assertThrows(MalformedNestedFieldException.class,
                () -> unpacker.unpack(movie(raw), "genres"));
        assertEquals(19995, exception.getParentId());
    }

    @Test
    @DisplayName("A JSON value that is not a list is rejected")
    void testNotAList() {
        assertThrows(MalformedNestedFieldException.class,
                () -> unpacker.unpack(movie("{\"id\": 28}"), "genres"));
    }

    @Test
    @DisplayName("A list element that is not an object is rejected when reached")
    void testNonObjectElement() {
        Stream<UnpackedRecord> records = unpacker.unpack(movie("[{\"id\": 28}, 7]"), "genres");
        assertThrows(MalformedNestedFieldException.class, records::toList);
    }

    @Test
    @DisplayName("Asking for a column the relation does not have is rejected")
    void testUnknownColumn() {
        assertThrows(MalformedNestedFieldException.class, () -> unpacker.unpack(movie("[]"), "keywords"));
    }
}
