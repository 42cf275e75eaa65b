package io.cerberus.sdk.auth;

import io.cerberus.sdk.CerberusException;
import io.cerberus.sdk.UnauthenticatedException;
import io.cerberus.sdk.internal.HttpUtil;
import io.cerberus.sdk.model.UserAuthResponse;

import java.io.Reader;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;

/**
 * Authenticates with a token the caller already holds. The token is not checked up front, and since its lease
 * is unknown it stays usable until {@link #logout()} is called or the service rejects it.
 */
public final class StaticTokenProvider extends AbstractTokenProvider {

    public StaticTokenProvider(String cerberusUrl, String token) {
        this(cerberusUrl, token, null, null);
    }

    public StaticTokenProvider(String cerberusUrl, String token, HttpClient httpClient, Duration requestTimeout) {
        super(HttpUtil.validateBaseUrl(cerberusUrl), httpClient, requestTimeout, Map.of(
            "Content-Type", "application/json",
            "Accept", "application/json"));
        if (token == null || token.isEmpty()) {
            throw new IllegalArgumentException("Token cannot be empty");
        }
        store(Token.withoutExpiry(token));
    }

    /**
     * Returns the token given at construction time. There is no MFA step, so {@code otpSource} is ignored.
     *
     * @throws UnauthenticatedException after {@link #logout()}.
     */
    @Override
    public String token(Reader otpSource) throws CerberusException {
        Token token = currentToken();
        if (!isAuthenticated() || token == null) {
            throw new UnauthenticatedException();
        }
        return token.value();
    }

    @Override
    public void refresh() throws CerberusException {
        lock.lock();
        try {
            Map<String, String> headers = headers();
            UserAuthResponse response = AuthRequests.refresh(httpClient, baseUrl, headers, requestTimeout);
            store(Token.withoutExpiry(AuthRequests.clientToken(response)));
        } finally {
            lock.unlock();
        }
    }
}
