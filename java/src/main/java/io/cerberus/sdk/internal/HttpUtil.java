package io.cerberus.sdk.internal;

import io.cerberus.sdk.CerberusException;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Helper methods for building and issuing HTTP requests against Cerberus.
 */
public final class HttpUtil {

    private static final Logger LOGGER = Logger.getLogger(HttpUtil.class.getName());

    public static final String CLIENT_HEADER = "X-Cerberus-Client";
    public static final String CLIENT_VERSION = "CerberusJavaClient/0.4.0";
    public static final String TOKEN_HEADER = "X-Cerberus-Token";

    // HttpClient manages these itself and refuses them on a request builder.
    private static final Set<String> RESTRICTED_HEADERS = Set.of(
        "connection", "content-length", "expect", "host", "upgrade");

    private HttpUtil() {
    }

    /**
     * Parses a Cerberus base URL. Only scheme, host and port are allowed; a single trailing slash is dropped.
     *
     * @throws IllegalArgumentException when the URL is empty, relative, or carries a path or query string.
     */
    public static URI validateBaseUrl(String url) {
        String trimmed = url == null ? "" : url.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Cerberus URL cannot be empty");
        }
        URI uri;
        try {
            uri = new URI(trimmed);
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid Cerberus URL: " + trimmed, ex);
        }
        if (uri.getScheme() == null || uri.getHost() == null) {
            throw new IllegalArgumentException("Cerberus URL must include scheme and host: " + trimmed);
        }
        String path = uri.getRawPath();
        if (path != null && !path.isEmpty() && !"/".equals(path)) {
            throw new IllegalArgumentException(
                "Given URL contained a path: " + path + ". The URL should not have a path");
        }
        if (uri.getRawQuery() != null) {
            throw new IllegalArgumentException(
                "Given URL contained a query string: " + uri.getRawQuery() + ". The URL should not have a query string");
        }
        String base = trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
        return URI.create(base);
    }

    /**
     * Appends {@code path} to the base URL and adds the sorted query. The path is percent-encoded here, so
     * callers pass it unescaped, e.g. {@code /v1/secure-file/app/sdb/my cert.pem}.
     */
    public static URI resolve(URI baseUrl, String path, Map<String, String> params) {
        String fullPath = baseUrl.getPath() == null ? "" : baseUrl.getPath();
        if (path != null && !path.isEmpty()) {
            fullPath += path.startsWith("/") ? path : "/" + path;
        }
        StringBuilder target = new StringBuilder(encodePath(baseUrl, fullPath));
        if (params != null && !params.isEmpty()) {
            StringJoiner query = new StringJoiner("&");
            params.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> query.add(URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8)
                    + "=" + URLEncoder.encode(e.getValue() == null ? "" : e.getValue(), StandardCharsets.UTF_8)));
            target.append('?').append(query);
        }
        return URI.create(target.toString());
    }

    private static String encodePath(URI baseUrl, String path) {
        try {
            return new URI(baseUrl.getScheme(), null, baseUrl.getHost(), baseUrl.getPort(), path, null, null)
                .toASCIIString();
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid request path: " + path, ex);
        }
    }

    public static HttpRequest.Builder newRequest(URI uri, String method, byte[] body, Map<String, String> headers,
                                                 Duration timeout) {
        HttpRequest.Builder builder = HttpRequest.newBuilder().uri(uri);
        if (body == null) {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            builder.method(method, HttpRequest.BodyPublishers.ofByteArray(body));
        }
        if (headers != null) {
            headers.forEach((name, value) -> {
                if (name != null && value != null && !RESTRICTED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                    builder.setHeader(name, value);
                }
            });
        }
        if (timeout != null) {
            builder.timeout(timeout);
        }
        return builder;
    }

    /**
     * Sends a request once, translating transport failures into {@link CerberusException}.
     */
    public static HttpResponse<InputStream> send(HttpClient client, HttpRequest request, String action)
        throws CerberusException {
        try {
            return client.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new CerberusException(action + " interrupted", ex);
        } catch (IOException ex) {
            throw new CerberusException("Problem while performing request to Cerberus: " + ex.getMessage(), ex);
        }
    }

    public static void closeQuietly(HttpResponse<InputStream> response) {
        if (response == null || response.body() == null) {
            return;
        }
        try {
            response.body().close();
        } catch (IOException ex) {
            LOGGER.log(Level.FINE, "[cerberus-sdk] failed to release response body", ex);
        }
    }

    /**
     * Lexically cleans a slash separated path: collapses duplicate separators, drops {@code .} segments and
     * resolves {@code ..} against the preceding segment.
     */
    public static String cleanPath(String path) {
        if (path == null || path.isEmpty()) {
            return "/";
        }
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : path.split("/")) {
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            if ("..".equals(segment)) {
                segments.pollLast();
                continue;
            }
            segments.addLast(segment);
        }
        return "/" + String.join("/", segments);
    }

    public static String joinPath(String base, String child) {
        return cleanPath(base + "/" + (child == null ? "" : child));
    }
}
