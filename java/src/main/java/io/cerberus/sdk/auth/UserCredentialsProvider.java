package io.cerberus.sdk.auth;

import io.cerberus.sdk.CerberusException;
import io.cerberus.sdk.internal.HttpUtil;
import io.cerberus.sdk.internal.Json;
import io.cerberus.sdk.model.AuthStatus;
import io.cerberus.sdk.model.UserAuthResponse;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/**
 * Username and password login, including the one-time passcode step required for users enrolled in MFA.
 *
 * <p>
 * The Cerberus URL can be overridden with the {@code cerberus.url} system property or the {@code CERBERUS_URL}
 * environment variable, which take precedence over the constructor argument.
 * </p>
 */
public final class UserCredentialsProvider extends AbstractTokenProvider {

    static final String URL_PROPERTY = "cerberus.url";
    static final String URL_ENV = "CERBERUS_URL";
    static final String LOGIN_PATH = "/v2/auth/user";
    static final String MFA_PATH = "/v2/auth/mfa_check";

    private static final Logger LOGGER = Logger.getLogger(UserCredentialsProvider.class.getName());

    private final String username;
    private final String password;

    public UserCredentialsProvider(String cerberusUrl, String username, String password) {
        this(cerberusUrl, username, password, null, null);
    }

    public UserCredentialsProvider(String cerberusUrl, String username, String password, HttpClient httpClient,
                                   Duration requestTimeout) {
        super(HttpUtil.validateBaseUrl(validated(resolveUrl(cerberusUrl, System::getenv), username, password)), httpClient,
            requestTimeout, Map.of("Content-Type", "application/json"));
        this.username = username;
        this.password = password;
    }

    @Override
    public String token(Reader otpSource) throws CerberusException {
        Token token = currentToken();
        if (token != null && token.isValid(Instant.now())) {
            return token.value();
        }
        lock.lock();
        try {
            token = currentToken();
            if (token != null && token.isValid(Instant.now())) {
                return token.value();
            }
            Token fresh = authenticate(otpSource);
            store(fresh);
            return fresh.value();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void refresh() throws CerberusException {
        lock.lock();
        try {
            Map<String, String> headers = headers();
            UserAuthResponse response = AuthRequests.refresh(httpClient, baseUrl, headers, requestTimeout);
            store(Token.withLease(AuthRequests.clientToken(response), response.data().clientToken().leaseDuration()));
        } finally {
            lock.unlock();
        }
    }

    private Token authenticate(Reader otpSource) throws CerberusException {
        String credentials = Base64.getEncoder()
            .encodeToString((username + ":" + password).getBytes(StandardCharsets.UTF_8));
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Authorization", "Basic " + credentials);
        headers.put(HttpUtil.CLIENT_HEADER, HttpUtil.CLIENT_VERSION);

        HttpRequest request = HttpUtil.newRequest(HttpUtil.resolve(baseUrl, LOGIN_PATH, null), "GET", null, headers,
            requestTimeout).build();
        UserAuthResponse response = AuthRequests.checkAndParse(HttpUtil.send(httpClient, request, "user login"));

        if (response.status() == AuthStatus.MFA_REQUIRED) {
            List<UserAuthResponse.MfaDevice> devices = response.data() == null ? null : response.data().devices();
            if (devices == null || devices.isEmpty()) {
                throw new CerberusException("MFA is required but no MFA device is enrolled for " + username);
            }
            // Cerberus always challenges the first enrolled device.
            UserAuthResponse.MfaDevice device = devices.get(0);
            LOGGER.info(() -> "[cerberus-sdk] MFA required, challenging device " + device.name());
            response = verifyMfa(response.data().stateToken(), device.id(), otpSource);
        }

        Token token = Token.withLease(AuthRequests.clientToken(response), response.data().clientToken().leaseDuration());
        LOGGER.info(() -> "[cerberus-sdk] Successfully authenticated with Cerberus as " + username);
        return token;
    }

    private UserAuthResponse verifyMfa(String stateToken, String deviceId, Reader otpSource) throws CerberusException {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("device_id", deviceId);
        body.put("state_token", stateToken);
        body.put("otp_token", readOtp(otpSource));

        byte[] json = Json.encode(body, "MFA response");
        Map<String, String> headers = Map.of(
            "Content-Type", "application/json",
            HttpUtil.CLIENT_HEADER, HttpUtil.CLIENT_VERSION);
        HttpRequest request = HttpUtil.newRequest(HttpUtil.resolve(baseUrl, MFA_PATH, null), "POST", json, headers,
            requestTimeout).build();
        return AuthRequests.checkAndParse(HttpUtil.send(httpClient, request, "MFA check"));
    }

    private static String readOtp(Reader otpSource) throws CerberusException {
        BufferedReader reader;
        if (otpSource == null) {
            System.out.print("Enter token from device: ");
            System.out.flush();
            // System.in stays open for the rest of the process
            reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        } else if (otpSource instanceof BufferedReader) {
            reader = (BufferedReader) otpSource;
        } else {
            reader = new BufferedReader(otpSource);
        }
        try {
            String line = reader.readLine();
            return line == null ? "" : line.trim();
        } catch (IOException ex) {
            throw new CerberusException("read one-time passcode: " + ex.getMessage(), ex);
        }
    }

    // cerberus.url wins over CERBERUS_URL; a blank value counts as unset.
    static String resolveUrl(String cerberusUrl, UnaryOperator<String> environment) {
        return Optional.ofNullable(System.getProperty(URL_PROPERTY))
            .filter(value -> !value.isBlank())
            .or(() -> Optional.ofNullable(environment.apply(URL_ENV)).filter(value -> !value.isBlank()))
            .orElse(cerberusUrl);
    }

    private static String validated(String cerberusUrl, String username, String password) {
        if (username == null || username.isEmpty()) {
            throw new IllegalArgumentException("Username cannot be empty");
        }
        if (password == null || password.isEmpty()) {
            throw new IllegalArgumentException("Password cannot be empty");
        }
        if (cerberusUrl == null || cerberusUrl.isEmpty()) {
            throw new IllegalArgumentException("Cerberus URL cannot be empty");
        }
        return cerberusUrl;
    }
}
