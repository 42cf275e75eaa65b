package io.cerberus.sdk.auth;

import io.cerberus.sdk.CerberusException;
import io.cerberus.sdk.UnauthorizedException;
import io.cerberus.sdk.internal.HttpUtil;
import io.cerberus.sdk.internal.Json;
import io.cerberus.sdk.model.UserAuthResponse;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Calls that every token can make regardless of how it was obtained.
 */
final class AuthRequests {

    static final String REFRESH_PATH = "/v2/auth/user/refresh";
    static final String LOGOUT_PATH = "/v1/auth";

    private AuthRequests() {
    }

    static UserAuthResponse refresh(HttpClient client, URI baseUrl, Map<String, String> headers, Duration timeout)
        throws CerberusException {
        HttpRequest request = HttpUtil.newRequest(HttpUtil.resolve(baseUrl, REFRESH_PATH, null), "GET", null, headers,
            timeout).build();
        return checkAndParse(HttpUtil.send(client, request, "refresh token"));
    }

    static void logout(HttpClient client, URI baseUrl, Map<String, String> headers, Duration timeout)
        throws CerberusException {
        HttpRequest request = HttpUtil.newRequest(HttpUtil.resolve(baseUrl, LOGOUT_PATH, null), "DELETE", null, headers,
            timeout).build();
        HttpResponse<InputStream> response = HttpUtil.send(client, request, "logout");
        int status = response.statusCode();
        HttpUtil.closeQuietly(response);
        if (status != 204) {
            throw new CerberusException("Unable to log out. Got HTTP response code " + status);
        }
    }

    /**
     * Validates the answer of a user authentication, MFA or refresh call and decodes it.
     */
    static UserAuthResponse checkAndParse(HttpResponse<InputStream> response) throws CerberusException {
        try (InputStream body = response.body()) {
            int status = response.statusCode();
            if (status == 401 || status == 403) {
                throw new UnauthorizedException();
            }
            if (status != 200) {
                throw new CerberusException("Error while trying to authenticate. Got HTTP response code " + status);
            }
            return Json.mapper().readValue(body, UserAuthResponse.class);
        } catch (IOException ex) {
            throw new CerberusException("Error while trying to parse response from Cerberus: " + ex.getMessage(), ex);
        }
    }

    static String clientToken(UserAuthResponse response) throws CerberusException {
        if (response == null || response.data() == null || response.data().clientToken() == null
            || response.data().clientToken().clientToken() == null
            || response.data().clientToken().clientToken().isBlank()) {
            throw new CerberusException("authentication response missing client_token");
        }
        return response.data().clientToken().clientToken();
    }
}
