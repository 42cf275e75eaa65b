package io.cerberus.sdk.internal;

import com.fasterxml.jackson.databind.JsonNode;
import io.cerberus.sdk.CerberusException;
import io.cerberus.sdk.SecretStoreException;
import io.cerberus.sdk.model.VaultSecret;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Client for the key/value secret store that Cerberus fronts. It speaks the store's own protocol
 * ({@code /v1/<path>}, {@code X-Vault-Token}) and holds its own copy of the token, which
 * {@link io.cerberus.sdk.CerberusClient} keeps in sync whenever the Cerberus token rotates.
 */
public final class SecretStore {

    static final String TOKEN_HEADER = "X-Vault-Token";

    private final RetryingSender sender;
    private final URI baseUrl;
    private final Duration requestTimeout;
    private final Map<String, String> defaultHeaders;
    private volatile String token;

    public SecretStore(RetryingSender sender, URI baseUrl, Duration requestTimeout, Map<String, String> defaultHeaders) {
        this.sender = Objects.requireNonNull(sender, "sender");
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        this.requestTimeout = requestTimeout;
        this.defaultHeaders = defaultHeaders == null ? Map.of() : Map.copyOf(defaultHeaders);
    }

    public void setToken(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    /**
     * @return the secret, or {@code null} when nothing is stored at {@code path}.
     */
    public VaultSecret read(String path) throws CerberusException {
        HttpResponse<InputStream> response = send("GET", path, Map.of(), null);
        return decode(response, true);
    }

    /**
     * @return the listing ({@code data.keys}), or {@code null} when {@code path} has no children.
     */
    public VaultSecret list(String path) throws CerberusException {
        HttpResponse<InputStream> response = send("GET", path, Map.of("list", "true"), null);
        return decode(response, true);
    }

    /**
     * @return the store's answer, which is {@code null} for plain key/value writes.
     */
    public VaultSecret write(String path, Map<String, Object> data) throws CerberusException {
        byte[] body = Json.encode(data == null ? Map.of() : data, "secret");
        HttpResponse<InputStream> response = send("PUT", path, Map.of(), body);
        return decode(response, false);
    }

    public VaultSecret delete(String path) throws CerberusException {
        HttpResponse<InputStream> response = send("DELETE", path, Map.of(), null);
        return decode(response, false);
    }

    private HttpResponse<InputStream> send(String method, String path, Map<String, String> params, byte[] body)
        throws CerberusException {
        Map<String, String> headers = new HashMap<>(defaultHeaders);
        headers.put("X-Vault-Request", "true");
        if (body != null) {
            headers.put("Content-Type", "application/json");
        }
        String current = token;
        if (current != null && !current.isBlank()) {
            headers.put(TOKEN_HEADER, current);
        }
        URI uri = HttpUtil.resolve(baseUrl, HttpUtil.joinPath("/v1", path), params);
        HttpRequest request = HttpUtil.newRequest(uri, method, body, headers, requestTimeout).build();
        return sender.send(request);
    }

    private static VaultSecret decode(HttpResponse<InputStream> response, boolean notFoundIsEmpty)
        throws CerberusException {
        try (InputStream stream = response.body()) {
            int status = response.statusCode();
            if (status == 404 && notFoundIsEmpty) {
                // a 404 that still names errors is a real failure, an empty one just means "no secret here"
                List<String> errors = errors(stream.readAllBytes());
                if (errors.isEmpty()) {
                    return null;
                }
                throw new SecretStoreException(status, errors);
            }
            if (status >= 400) {
                throw new SecretStoreException(status, errors(stream.readAllBytes()));
            }
            if (status == 204) {
                return null;
            }
            byte[] bytes = stream.readAllBytes();
            if (bytes.length == 0) {
                return null;
            }
            return Json.mapper().readValue(bytes, VaultSecret.class);
        } catch (IOException ex) {
            throw new CerberusException("decode secret store response: " + ex.getMessage(), ex);
        }
    }

    private static List<String> errors(byte[] body) {
        List<String> errors = new ArrayList<>();
        if (body.length == 0) {
            return errors;
        }
        try {
            JsonNode node = Json.mapper().readTree(body);
            JsonNode items = node == null ? null : node.path("errors");
            if (items != null && items.isArray()) {
                items.forEach(item -> errors.add(item.asText()));
            }
        } catch (IOException ex) {
            errors.add(new String(body, StandardCharsets.UTF_8));
        }
        return errors;
    }
}
