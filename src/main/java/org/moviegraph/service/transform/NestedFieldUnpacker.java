package org.moviegraph.service.transform;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.moviegraph.exceptions.MalformedNestedFieldException;
import org.moviegraph.models.dto.RawRow;
import org.moviegraph.models.dto.UnpackedRecord;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Expands a JSON list-of-objects column of a raw row into one {@link UnpackedRecord} per element.
 * The list is parsed up front so that syntax errors, including trailing garbage after the array,
 * surface immediately; elements are converted lazily, in list order.
 */
@Component
@RequiredArgsConstructor
public class NestedFieldUnpacker {

    private final ObjectMapper objectMapper;

    public Stream<UnpackedRecord> unpack(RawRow row, String field) {
        if (!row.values().containsKey(field)) {
            throw new MalformedNestedFieldException(row.naturalId(), field,
                    "relation " + row.relation() + " has no such column");
        }
        String raw = row.value(field);
        if (!StringUtils.hasText(raw)) {
            return Stream.empty();
        }

        JsonNode list;
        try {
            list = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS).readTree(raw);
        } catch (JsonProcessingException exception) {
            throw new MalformedNestedFieldException(row.naturalId(), field,
                    exception.getOriginalMessage(), exception);
        }
        if (list == null || !list.isArray()) {
            throw new MalformedNestedFieldException(row.naturalId(), field,
                    "expected a JSON array but found " + (list == null ? "nothing" : list.getNodeType()));
        }
        return IntStream.range(0, list.size())
                .mapToObj(position -> toRecord(row, field, position, list.get(position)));
    }

    private UnpackedRecord toRecord(RawRow row, String field, int position, JsonNode element) {
        if (!element.isObject()) {
            throw new MalformedNestedFieldException(row.naturalId(), field,
                    "element " + position + " is " + element.getNodeType() + ", not an object");
        }
        Map<String, Object> attributes = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = element.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            attributes.put(entry.getKey(), toJava(entry.getValue()));
        }
        return new UnpackedRecord(row.naturalId(), position, attributes);
    }

    private Object toJava(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToInt() ? (Object) node.intValue() : (Object) node.longValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return objectMapper.convertValue(node, Object.class);
    }
}
