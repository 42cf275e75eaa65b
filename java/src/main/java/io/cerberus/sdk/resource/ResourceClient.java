package io.cerberus.sdk.resource;

import com.fasterxml.jackson.core.type.TypeReference;
import io.cerberus.sdk.CerberusApiException;
import io.cerberus.sdk.CerberusClient;
import io.cerberus.sdk.CerberusException;
import io.cerberus.sdk.internal.ApiErrorDecoder;
import io.cerberus.sdk.internal.HttpUtil;
import io.cerberus.sdk.internal.Json;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpResponse;
import java.util.Locale;
import java.util.Objects;

/**
 * Shared plumbing for the resource accessors: decoding success bodies and turning unexpected statuses into
 * exceptions.
 */
abstract class ResourceClient {

    protected final CerberusClient client;

    ResourceClient(CerberusClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    static <T> T readJson(HttpResponse<InputStream> response, Class<T> type, String action)
        throws CerberusException {
        try (InputStream body = response.body()) {
            return Json.mapper().readValue(body, type);
        } catch (IOException ex) {
            throw new CerberusException("Error while trying to parse " + action + " response: " + ex.getMessage(), ex);
        }
    }

    static <T> T readJson(HttpResponse<InputStream> response, TypeReference<T> type, String action)
        throws CerberusException {
        try (InputStream body = response.body()) {
            return Json.mapper().readValue(body, type);
        } catch (IOException ex) {
            throw new CerberusException("Error while trying to parse " + action + " response: " + ex.getMessage(), ex);
        }
    }

    /**
     * Builds the exception for a status the caller did not expect and releases the body. A 400 is reported
     * exactly as decoded; for any other status a structured API error is kept and everything else is wrapped
     * into a message naming the status code.
     */
    static CerberusException failure(HttpResponse<InputStream> response, String action) {
        int status = response.statusCode();
        CerberusException decoded;
        try (InputStream body = response.body()) {
            decoded = ApiErrorDecoder.decode(status, body);
        } catch (IOException ex) {
            return new CerberusException("Error while trying to " + action + ": " + ex.getMessage(), ex);
        }
        if (status == 400 || decoded instanceof CerberusApiException) {
            return decoded;
        }
        return new CerberusException(String.format(Locale.ROOT,
            "Error while trying to %s. Got HTTP status code %d", action, status), decoded);
    }

    static void discard(HttpResponse<InputStream> response) {
        HttpUtil.closeQuietly(response);
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
