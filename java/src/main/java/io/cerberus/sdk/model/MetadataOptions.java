package io.cerberus.sdk.model;

/**
 * Pagination for metadata listing. A zero limit falls back to the service page size of 100.
 */
public record MetadataOptions(int limit, int offset) {

    public static final int DEFAULT_LIMIT = 100;

    public MetadataOptions {
        if (limit < 0) {
            throw new IllegalArgumentException("limit cannot be negative");
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset cannot be negative");
        }
    }

    public static MetadataOptions defaults() {
        return new MetadataOptions(DEFAULT_LIMIT, 0);
    }

    public int effectiveLimit() {
        return limit == 0 ? DEFAULT_LIMIT : limit;
    }
}
