// file: core/src/main/java/io/dynbatch/core/WriteRequest.java
package io.dynbatch.core;

import java.util.Map;
import java.util.Objects;

/**
 * A single buffered mutation against one table.
 * <p>
 * Two shapes:
 *  - Put:    write (insert or overwrite) a full item.
 *  - Delete: remove the item identified by a key.
 * <p>
 * Both are immutable. The writer treats them uniformly except when
 * extracting dedup keys: a Put is looked up in its item, a Delete in its key.
 */
public sealed interface WriteRequest permits WriteRequest.Put, WriteRequest.Delete {

    /** Attributes that carry this request's primary key values. */
    AttributeMap attributes();

    static Put put(Map<String, ?> item) {
        return new Put(AttributeMap.of(item));
    }

    static Delete delete(Map<String, ?> key) {
        return new Delete(AttributeMap.of(key));
    }

    record Put(AttributeMap item) implements WriteRequest {
        public Put {
            Objects.requireNonNull(item, "item");
        }

        @Override
        public AttributeMap attributes() {
            return item;
        }
    }

    record Delete(AttributeMap key) implements WriteRequest {
        public Delete {
            Objects.requireNonNull(key, "key");
        }

        @Override
        public AttributeMap attributes() {
            return key;
        }
    }
}
