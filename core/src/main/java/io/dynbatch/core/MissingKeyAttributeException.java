package io.dynbatch.core;

/**
 * A configured dedup key attribute is absent from a submitted item or key.
 * Raised before the buffer is touched.
 */
public final class MissingKeyAttributeException extends IllegalArgumentException {

    private final String attribute;

    public MissingKeyAttributeException(String attribute, WriteRequest request) {
        super("dedup key attribute '%s' missing from %s".formatted(attribute, request));
        this.attribute = attribute;
    }

    public String attribute() {
        return attribute;
    }
}
