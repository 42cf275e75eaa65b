package io.cerberus.sdk;

import io.cerberus.sdk.auth.TokenProvider;
import io.cerberus.sdk.internal.HttpUtil;
import io.cerberus.sdk.internal.Json;
import io.cerberus.sdk.internal.RetryingSender;
import io.cerberus.sdk.internal.SecretStore;
import io.cerberus.sdk.resource.CategoryClient;
import io.cerberus.sdk.resource.MetadataClient;
import io.cerberus.sdk.resource.RoleClient;
import io.cerberus.sdk.resource.SafeDepositBoxClient;
import io.cerberus.sdk.resource.SecretClient;
import io.cerberus.sdk.resource.SecureFileClient;

import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * <p>
 * Primary entry point for interacting with Cerberus. Create one instance per {@link TokenProvider}, call
 * {@link #init()} during startup (or let the first request initialise lazily) and reuse it; the client is
 * safe to share between threads.
 * </p>
 *
 * <h2>Key behaviours</h2>
 * <ul>
 *   <li>Every call carries the provider's headers and is sent under the configured {@link RetryPolicy}.</li>
 *   <li>When Cerberus answers with {@code X-Refresh-Token: true} the provider is refreshed and the new token is
 *       handed to the secret store client before the response is returned.</li>
 *   <li>Resource specific operations live in small accessor objects ({@link #sdb()}, {@link #secret()}, ...) that
 *       share this client's transport and authentication.</li>
 * </ul>
 */
public final class CerberusClient implements AutoCloseable {

    public static final String REFRESH_HEADER = "X-Refresh-Token";

    private static final Logger LOGGER = Logger.getLogger(CerberusClient.class.getName());

    private final Config config;
    private final TokenProvider tokenProvider;
    private final URI baseUrl;
    private final RetryingSender sender;
    private final SecretStore secretStore;

    private final Object initLock = new Object();
    private volatile boolean initialized;
    private boolean initAttempted;
    private CerberusException initFailure;

    /**
     * Constructs a new client. No network call is made until {@link #init()} or the first request.
     *
     * @param config caller-supplied configuration; only the {@link TokenProvider} is mandatory. Defaults are
     *               applied to a copy, so later changes to the builder do not affect this client.
     */
    public CerberusClient(Config config) {
        Objects.requireNonNull(config, "config");
        this.config = config.withDefaults();
        this.tokenProvider = this.config.getTokenProvider();
        this.baseUrl = tokenProvider.baseUrl();
        this.sender = new RetryingSender(this.config.getHttpClient(), this.config.getRetryPolicy());
        this.secretStore = new SecretStore(sender, baseUrl, this.config.getHttpTimeout(), this.config.getDefaultHeaders());
    }

    public static CerberusClient create(TokenProvider tokenProvider) {
        return new CerberusClient(Config.builder().tokenProvider(tokenProvider).build());
    }

    /**
     * Authenticates and seeds the secret store client with the resulting token.
     *
     * <p>
     * The call is idempotent. If the first authentication fails the exception is memoised and rethrown on every
     * later attempt, so a misconfigured client fails the same way each time.
     * </p>
     *
     * @throws CerberusException when the provider cannot obtain a token.
     */
    public void init() throws CerberusException {
        synchronized (initLock) {
            if (initAttempted) {
                if (initFailure != null) {
                    throw initFailure;
                }
                return;
            }
            initAttempted = true;
            try {
                String token = tokenProvider.token(config.getOtpSource());
                secretStore.setToken(token);
                initialized = true;
            } catch (CerberusException ex) {
                initFailure = ex;
                throw ex;
            }
        }
    }

    /**
     * Performs a call, JSON encoding {@code body} when present. This is what every accessor uses and it is
     * exposed for endpoints the SDK does not wrap yet.
     *
     * @return the raw response; the caller owns (and must close) its body.
     * @throws TokenRefreshException when Cerberus asked for a token refresh that failed. The exception carries
     *                               the response of the call itself.
     */
    public HttpResponse<InputStream> execute(String method, String path, Map<String, String> params, Object body)
        throws CerberusException {
        if (body == null) {
            return executeWithBody(method, path, params, null, null);
        }
        return executeWithBody(method, path, params, "application/json", Json.encode(body, "request body"));
    }

    /**
     * Performs a call with a pre-encoded body, for example a multipart upload.
     *
     * @param contentType overrides the provider's {@code Content-Type} when not {@code null}.
     */
    public HttpResponse<InputStream> executeWithBody(String method, String path, Map<String, String> params,
                                                     String contentType, byte[] body) throws CerberusException {
        Objects.requireNonNull(method, "method");
        ensureInitialized();

        Map<String, String> headers = new LinkedHashMap<>(tokenProvider.headers());
        headers.putAll(config.getDefaultHeaders());
        headers.putIfAbsent(HttpUtil.CLIENT_HEADER, HttpUtil.CLIENT_VERSION);
        if (contentType != null && !contentType.isBlank()) {
            headers.put("Content-Type", contentType);
        }

        URI uri = HttpUtil.resolve(baseUrl, path, params);
        HttpRequest request = HttpUtil.newRequest(uri, method.toUpperCase(Locale.ROOT), body, headers,
            config.getHttpTimeout()).build();
        LOGGER.fine(() -> "[cerberus-sdk] " + request.method() + " " + uri.getPath());

        HttpResponse<InputStream> response = sender.send(request);

        boolean refreshRequested = response.headers().firstValue(REFRESH_HEADER)
            .map(value -> "true".equalsIgnoreCase(value.trim()))
            .orElse(false);
        if (refreshRequested) {
            LOGGER.info("[cerberus-sdk] Cerberus requested a token refresh");
            try {
                tokenProvider.refresh();
                secretStore.setToken(tokenProvider.token(null));
            } catch (CerberusException ex) {
                throw new TokenRefreshException(response, ex);
            }
        }
        return response;
    }

    public SafeDepositBoxClient sdb() {
        return new SafeDepositBoxClient(this);
    }

    public RoleClient role() {
        return new RoleClient(this);
    }

    public CategoryClient category() {
        return new CategoryClient(this);
    }

    public MetadataClient metadata() {
        return new MetadataClient(this);
    }

    public SecureFileClient secureFile() {
        return new SecureFileClient(this);
    }

    public SecretClient secret() {
        return new SecretClient(this, secretStore);
    }

    public TokenProvider getTokenProvider() {
        return tokenProvider;
    }

    public URI getBaseUrl() {
        return baseUrl;
    }

    /**
     * @return the token the secret store client currently presents; mainly useful to check that a refresh
     *         propagated.
     */
    public String getSecretStoreToken() {
        return secretStore.token();
    }

    /**
     * Currently a no-op because {@link java.net.http.HttpClient} needs no explicit shutdown; the token is left
     * untouched, call {@link TokenProvider#logout()} to revoke it.
     */
    @Override
    public void close() {
        // httpClient is managed externally; nothing to close.
    }

    void ensureInitialized() throws CerberusException {
        if (initialized) {
            return;
        }
        init();
    }
}
