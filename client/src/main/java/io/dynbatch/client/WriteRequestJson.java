// file: client/src/main/java/io/dynbatch/client/WriteRequestJson.java
package io.dynbatch.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.dynbatch.core.AttributeMap;
import io.dynbatch.core.WriteRequest;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON wire form of write requests, batches and bulk-write responses.
 *
 * One request:
 *
 *   {"PutRequest":    {"Item": {"pk": "u1", "name": "ada"}}}
 *   {"DeleteRequest": {"Key":  {"pk": "u1"}}}
 *
 * Batch request body (POST /batch-write):
 *
 *   {"RequestItems": {"users": [ <request>, <request>, ... ]}}
 *
 * Response body:
 *
 *   {"UnprocessedItems": {"users": [ <request>, ... ]}}
 *
 * Attribute values are plain JSON (strings, numbers, booleans, null, arrays,
 * objects) and attribute order is preserved both ways. Numbers decode to
 * Integer/Long/Double the way Jackson binds untyped values.
 */
public final class WriteRequestJson {

    static final String PUT_REQUEST = "PutRequest";
    static final String DELETE_REQUEST = "DeleteRequest";
    static final String ITEM = "Item";
    static final String KEY = "Key";
    static final String REQUEST_ITEMS = "RequestItems";
    static final String UNPROCESSED_ITEMS = "UnprocessedItems";

    private final ObjectMapper mapper;

    public WriteRequestJson() {
        this(new ObjectMapper());
    }

    public WriteRequestJson(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    // ---------- encoding ----------

    public ObjectNode toJson(WriteRequest request) {
        ObjectNode root = mapper.createObjectNode();
        if (request instanceof WriteRequest.Put put) {
            root.putObject(PUT_REQUEST).set(ITEM, attributesToJson(put.item()));
        } else if (request instanceof WriteRequest.Delete delete) {
            root.putObject(DELETE_REQUEST).set(KEY, attributesToJson(delete.key()));
        }
        return root;
    }

    public String encodeBatch(String table, List<WriteRequest> requests) throws JsonProcessingException {
        ObjectNode root = mapper.createObjectNode();
        root.putObject(REQUEST_ITEMS).set(table, requestsToJson(requests));
        return mapper.writeValueAsString(root);
    }

    public String encodeUnprocessed(Map<String, List<WriteRequest>> unprocessed) throws JsonProcessingException {
        ObjectNode root = mapper.createObjectNode();
        ObjectNode items = root.putObject(UNPROCESSED_ITEMS);
        unprocessed.forEach((table, requests) -> items.set(table, requestsToJson(requests)));
        return mapper.writeValueAsString(root);
    }

    private ArrayNode requestsToJson(List<WriteRequest> requests) {
        ArrayNode array = mapper.createArrayNode();
        for (WriteRequest r : requests) {
            array.add(toJson(r));
        }
        return array;
    }

    private ObjectNode attributesToJson(AttributeMap attrs) {
        ObjectNode node = mapper.createObjectNode();
        attrs.asMap().forEach((name, value) -> node.set(name, mapper.valueToTree(value)));
        return node;
    }

    // ---------- decoding ----------

    /**
     * Parse one request, e.g. a line of CLI input.
     *
     * @throws JsonProcessingException  if the text is not JSON
     * @throws IllegalArgumentException if the JSON is not a single Put or Delete request
     */
    public WriteRequest parseRequest(String json) throws JsonProcessingException {
        return fromJson(mapper.readTree(json));
    }

    public WriteRequest fromJson(JsonNode node) throws JsonProcessingException {
        if (node == null || !node.isObject() || node.size() != 1) {
            throw new IllegalArgumentException(
                    "expected an object with exactly one of " + PUT_REQUEST + " or " + DELETE_REQUEST);
        }
        if (node.has(PUT_REQUEST)) {
            return new WriteRequest.Put(attributesFromJson(node.get(PUT_REQUEST), ITEM));
        }
        if (node.has(DELETE_REQUEST)) {
            return new WriteRequest.Delete(attributesFromJson(node.get(DELETE_REQUEST), KEY));
        }
        throw new IllegalArgumentException("unknown request type: " + node.fieldNames().next());
    }

    public Map<String, List<WriteRequest>> decodeBatch(String json) throws JsonProcessingException {
        return decodeTableMap(mapper.readTree(json), REQUEST_ITEMS);
    }

    /** Unprocessed requests per table; empty when the field is absent or null. */
    public Map<String, List<WriteRequest>> decodeUnprocessed(String json) throws JsonProcessingException {
        return decodeTableMap(mapper.readTree(json), UNPROCESSED_ITEMS);
    }

    private Map<String, List<WriteRequest>> decodeTableMap(JsonNode root, String field) throws JsonProcessingException {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("expected a JSON object");
        }
        JsonNode tables = root.get(field);
        Map<String, List<WriteRequest>> out = new LinkedHashMap<>();
        if (tables == null || tables.isNull()) {
            return out;
        }
        if (!tables.isObject()) {
            throw new IllegalArgumentException(field + " must be an object");
        }
        Iterator<Map.Entry<String, JsonNode>> it = tables.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            JsonNode array = e.getValue();
            if (!array.isArray()) {
                throw new IllegalArgumentException(field + "." + e.getKey() + " must be an array");
            }
            List<WriteRequest> requests = new ArrayList<>(array.size());
            for (JsonNode r : array) {
                requests.add(fromJson(r));
            }
            out.put(e.getKey(), requests);
        }
        return out;
    }

    private AttributeMap attributesFromJson(JsonNode wrapper, String field) throws JsonProcessingException {
        JsonNode attrs = wrapper == null ? null : wrapper.get(field);
        if (attrs == null || !attrs.isObject()) {
            throw new IllegalArgumentException("missing object field '" + field + "'");
        }
        AttributeMap.Builder b = AttributeMap.builder();
        Iterator<Map.Entry<String, JsonNode>> it = attrs.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            JsonNode value = e.getValue();
            b.put(e.getKey(), value.isNull() ? null : mapper.treeToValue(value, Object.class));
        }
        return b.build();
    }
}
