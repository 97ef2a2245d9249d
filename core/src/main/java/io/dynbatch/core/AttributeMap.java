// file: core/src/main/java/io/dynbatch/core/AttributeMap.java
package io.dynbatch.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable, insertion-ordered mapping of attribute name to value.
 * <p>
 * Used for both shapes a mutation can carry:
 *  - a full row (the item of a Put), and
 *  - a primary key (the key of a Delete).
 * <p>
 * Values are opaque to the writer. They are only compared with
 * {@link Object#equals(Object)} when extracting dedup keys, so callers
 * should use value types with sensible equality (String, Long, List, ...).
 * Null values are allowed; null attribute names are not.
 * <p>
 * List, Set and Map values (at any depth) are copied into unmodifiable
 * collections on the way in, so a caller changing its own collection later
 * cannot alter a buffered request. Other values are kept as given and
 * should themselves be immutable.
 */
public final class AttributeMap {

    private static final AttributeMap EMPTY = new AttributeMap(new LinkedHashMap<>());

    private final Map<String, Object> attributes;

    private AttributeMap(LinkedHashMap<String, Object> attributes) {
        this.attributes = Collections.unmodifiableMap(attributes);
    }

    /** Copy the given map, keeping its iteration order. */
    public static AttributeMap of(Map<String, ?> attributes) {
        Objects.requireNonNull(attributes, "attributes");
        var copy = new LinkedHashMap<String, Object>(attributes.size());
        for (Map.Entry<String, ?> e : attributes.entrySet()) {
            copy.put(Objects.requireNonNull(e.getKey(), "attribute name"), freeze(e.getValue()));
        }
        return new AttributeMap(copy);
    }

    public static AttributeMap empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean contains(String name) {
        return attributes.containsKey(name);
    }

    /** Value for the attribute, or null if absent (or explicitly null). */
    public Object get(String name) {
        return attributes.get(name);
    }

    public Set<String> names() {
        return attributes.keySet();
    }

    public int size() {
        return attributes.size();
    }

    public boolean isEmpty() {
        return attributes.isEmpty();
    }

    /** Read-only ordered view. */
    public Map<String, Object> asMap() {
        return attributes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AttributeMap other)) return false;
        return attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return attributes.hashCode();
    }

    @Override
    public String toString() {
        return attributes.toString();
    }

    /** Copy collection values into unmodifiable ones, recursively; other values pass through. */
    static Object freeze(Object value) {
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object v : list) {
                copy.add(freeze(v));
            }
            return Collections.unmodifiableList(copy);
        }
        if (value instanceof Set<?> set) {
            Set<Object> copy = new LinkedHashSet<>();
            for (Object v : set) {
                copy.add(freeze(v));
            }
            return Collections.unmodifiableSet(copy);
        }
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                copy.put(e.getKey(), freeze(e.getValue()));
            }
            return Collections.unmodifiableMap(copy);
        }
        return value;
    }

    public static final class Builder {
        private final LinkedHashMap<String, Object> attributes = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String name, Object value) {
            attributes.put(Objects.requireNonNull(name, "name"), freeze(value));
            return this;
        }

        public AttributeMap build() {
            return new AttributeMap(new LinkedHashMap<>(attributes));
        }
    }
}
