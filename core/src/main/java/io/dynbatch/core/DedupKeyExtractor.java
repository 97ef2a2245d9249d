package io.dynbatch.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Pulls the ordered primary-key tuple out of a request.
 * <p>
 * Put and Delete are compared purely on the extracted values, so a Delete
 * of {pk: 1} and a Put of {pk: 1, v: "x"} produce the same tuple.
 */
final class DedupKeyExtractor {

    private final List<String> keyNames;

    DedupKeyExtractor(List<String> keyNames) {
        this.keyNames = List.copyOf(keyNames);
    }

    /**
     * @throws MissingKeyAttributeException if a configured attribute is absent
     */
    List<Object> extract(WriteRequest request) {
        AttributeMap attrs = request.attributes();
        List<Object> values = new ArrayList<>(keyNames.size());
        for (String name : keyNames) {
            if (!attrs.contains(name)) {
                throw new MissingKeyAttributeException(name, request);
            }
            values.add(attrs.get(name));
        }
        // List.of rejects null elements, and null key values are legal here.
        return Collections.unmodifiableList(values);
    }

    /** Like {@link #extract}, but null when a configured attribute is absent. */
    List<Object> extractIfPresent(WriteRequest request) {
        AttributeMap attrs = request.attributes();
        for (String name : keyNames) {
            if (!attrs.contains(name)) {
                return null;
            }
        }
        return extract(request);
    }
}
