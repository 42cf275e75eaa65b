package io.cerberus.sdk.internal;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cerberus.sdk.CerberusApiException;
import io.cerberus.sdk.CerberusException;
import io.cerberus.sdk.NoErrorBodyException;
import io.cerberus.sdk.model.ErrorDetail;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Utility for decoding error payloads from Cerberus.
 *
 * <p>
 * The result is always an exception to throw: a {@link CerberusApiException} when the body names an
 * {@code error_id}, a {@link NoErrorBodyException} when there is nothing to decode, and a plain
 * {@link CerberusException} when the body is not JSON at all.
 * </p>
 */
public final class ApiErrorDecoder {

    private static final ObjectMapper MAPPER = Json.mapper();
    private static final TypeReference<Map<String, Object>> METADATA = new TypeReference<>() {
    };

    private ApiErrorDecoder() {
    }

    public static CerberusException decode(int statusCode, InputStream bodyStream) {
        if (bodyStream == null) {
            return new NoErrorBodyException(statusCode);
        }

        byte[] bytes;
        try {
            bytes = bodyStream.readAllBytes();
        } catch (IOException ex) {
            return new CerberusException("read API error response: " + ex.getMessage(), ex);
        }
        if (bytes.length == 0) {
            return new NoErrorBodyException(statusCode);
        }

        JsonNode node;
        try {
            node = MAPPER.readTree(bytes);
        } catch (IOException ex) {
            return new CerberusException("parse API error response: " + ex.getMessage(), ex);
        }
        if (node == null || !node.isObject()) {
            return new NoErrorBodyException(statusCode);
        }

        String errorId = node.hasNonNull("error_id") ? node.get("error_id").asText() : null;
        if (errorId == null || errorId.isBlank()) {
            return new NoErrorBodyException(statusCode);
        }

        List<ErrorDetail> details = new ArrayList<>();
        JsonNode errors = node.path("errors");
        if (errors.isArray()) {
            for (JsonNode item : errors) {
                Map<String, Object> metadata = item.hasNonNull("metadata")
                    ? MAPPER.convertValue(item.get("metadata"), METADATA)
                    : null;
                details.add(new ErrorDetail(
                    item.path("code").asInt(),
                    item.hasNonNull("message") ? item.get("message").asText() : null,
                    metadata
                ));
            }
        }
        return new CerberusApiException(statusCode, errorId, details);
    }
}
