package io.cerberus.sdk.auth;

import io.cerberus.sdk.CerberusException;
import io.cerberus.sdk.UnauthenticatedException;
import io.cerberus.sdk.internal.HttpUtil;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * State and behaviour shared by all providers: the token slot, the header set derived from it and logout.
 * Every transition of the token slot happens under {@link #lock}.
 */
abstract class AbstractTokenProvider implements TokenProvider {

    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    protected final URI baseUrl;
    protected final HttpClient httpClient;
    protected final Duration requestTimeout;
    protected final ReentrantLock lock = new ReentrantLock();

    private final Map<String, String> baseHeaders;
    private volatile Token current;

    AbstractTokenProvider(URI baseUrl, HttpClient httpClient, Duration requestTimeout, Map<String, String> baseHeaders) {
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        this.httpClient = httpClient == null
            ? HttpClient.newBuilder().connectTimeout(DEFAULT_TIMEOUT).build()
            : httpClient;
        this.requestTimeout = requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()
            ? DEFAULT_TIMEOUT : requestTimeout;
        Map<String, String> headers = new LinkedHashMap<>(baseHeaders);
        headers.putIfAbsent(HttpUtil.CLIENT_HEADER, HttpUtil.CLIENT_VERSION);
        this.baseHeaders = Collections.unmodifiableMap(headers);
    }

    @Override
    public boolean isAuthenticated() {
        Token token = current;
        return token != null && token.isValid(Instant.now());
    }

    @Override
    public Map<String, String> headers() throws CerberusException {
        Token token = current;
        if (token == null || !token.isValid(Instant.now())) {
            throw new UnauthenticatedException();
        }
        Map<String, String> headers = new LinkedHashMap<>(baseHeaders);
        headers.put(HttpUtil.TOKEN_HEADER, token.value());
        return Collections.unmodifiableMap(headers);
    }

    @Override
    public URI baseUrl() {
        return baseUrl;
    }

    @Override
    public Instant expiry() throws CerberusException {
        Token token = current;
        if (token == null || token.value() == null || token.value().isEmpty() || token.expiry() == null) {
            throw new CerberusException("Expiry time not set");
        }
        return token.expiry();
    }

    @Override
    public void logout() throws CerberusException {
        lock.lock();
        try {
            Map<String, String> headers = headers();
            AuthRequests.logout(httpClient, baseUrl, headers, requestTimeout);
            current = null;
        } finally {
            lock.unlock();
        }
    }

    protected Token currentToken() {
        return current;
    }

    protected void store(Token token) {
        current = token;
    }

    protected Map<String, String> baseHeaders() {
        return baseHeaders;
    }
}
