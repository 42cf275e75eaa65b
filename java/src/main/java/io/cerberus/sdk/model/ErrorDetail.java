package io.cerberus.sdk.model;

import java.util.Map;

/**
 * A single problem reported by Cerberus. Metadata is usually {@code field -> name} but the service declares it
 * as an arbitrary object, so values stay untyped.
 */
public record ErrorDetail(int code, String message, Map<String, Object> metadata) {
}
