package io.cerberus.sdk.auth;

import io.cerberus.sdk.CerberusApiException;
import io.cerberus.sdk.CerberusException;
import io.cerberus.sdk.UnauthenticatedException;
import io.cerberus.sdk.UnauthorizedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkClientException;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class StsIdentityProviderTest {

    private static final AwsCredentialsProvider CREDENTIALS =
        StaticCredentialsProvider.create(AwsBasicCredentials.create("AKIDEXAMPLE", "wJalrXUtnFEMI/K7MDENG"));

    private static final String IAM_SUCCESS = "{\"client_token\":\"iam-token\",\"policies\":[\"app-read\"],"
        + "\"metadata\":{\"iam_principal_arn\":\"arn:aws:iam::111122223333:role/app\",\"is_admin\":\"false\"},"
        + "\"lease_duration\":3600,\"renewable\":false}";

    private HttpServer server;
    private URI baseUri;
    private final AtomicInteger authCount = new AtomicInteger();
    private final AtomicReference<String> authorization = new AtomicReference<>();
    private final AtomicReference<String> amzDate = new AtomicReference<>();
    private final AtomicReference<String> body = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.start();
        baseUri = URI.create("http://localhost:" + server.getAddress().getPort());
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void exchangesSignedCallerIdentityForToken() throws Exception {
        registerAuth(200, IAM_SUCCESS);
        StsIdentityProvider provider = newProvider("us-west-2");

        String token = provider.token(null);

        assertEquals("iam-token", token);
        assertEquals(1, authCount.get());
        assertNotNull(authorization.get());
        assertTrue(authorization.get().startsWith("AWS4-HMAC-SHA256 Credential=AKIDEXAMPLE/"), authorization.get());
        assertTrue(authorization.get().contains("/us-west-2/sts/aws4_request"), authorization.get());
        assertNotNull(amzDate.get());
        assertEquals(StsIdentityProvider.GET_CALLER_IDENTITY, body.get());
        assertTrue(provider.isAuthenticated());
        assertEquals("iam-token", provider.headers().get("X-Cerberus-Token"));

        provider.token(null);
        assertEquals(1, authCount.get());
    }

    @Test
    void refreshReauthenticates() throws Exception {
        registerAuth(200, IAM_SUCCESS);
        StsIdentityProvider provider = newProvider("us-east-1");
        provider.token(null);

        provider.refresh();

        assertEquals(2, authCount.get());
        assertEquals("iam-token", provider.token(null));
    }

    @Test
    void refreshRequiresExistingToken() {
        registerAuth(200, IAM_SUCCESS);
        StsIdentityProvider provider = newProvider("us-east-1");

        assertThrows(UnauthenticatedException.class, provider::refresh);
        assertEquals(0, authCount.get());
    }

    @Test
    void forbiddenHintsAtAwsCli() {
        registerAuth(403, "");
        StsIdentityProvider provider = newProvider("us-west-2");

        UnauthorizedException ex = assertThrows(UnauthorizedException.class, () -> provider.token(null));
        assertTrue(ex.getMessage().contains("aws sts get-caller-identity"), ex.getMessage());
    }

    @Test
    void serverErrorCarriesDecodedApiError() {
        registerAuth(400, "{\"error_id\":\"err-1\",\"errors\":[{\"code\":99225,"
            + "\"message\":\"The provided IAM principal is not authorized\",\"metadata\":{}}]}");
        StsIdentityProvider provider = newProvider("us-west-2");

        CerberusException ex = assertThrows(CerberusException.class, () -> provider.token(null));

        assertEquals("Error while trying to authenticate. Got HTTP response code 400", ex.getMessage());
        CerberusApiException apiError = assertInstanceOf(CerberusApiException.class, ex.getCause());
        assertEquals("err-1", apiError.getErrorId());
        assertEquals(99225, apiError.getErrors().get(0).code());
    }

    @Test
    void missingCredentialsAreReported() {
        registerAuth(200, IAM_SUCCESS);
        AwsCredentialsProvider none = () -> {
            throw SdkClientException.create("Unable to load credentials");
        };
        StsIdentityProvider provider =
            new StsIdentityProvider(baseUri.toString(), "us-west-2", none, null, null);

        CerberusException ex = assertThrows(CerberusException.class, () -> provider.token(null));
        assertTrue(ex.getMessage().startsWith("Credentials are required and cannot be found"), ex.getMessage());
        assertEquals(0, authCount.get());
    }

    @Test
    void chinaRegionsUseChinaEndpoint() {
        assertEquals("https://sts.cn-north-1.amazonaws.com.cn", newProvider("cn-north-1").stsEndpoint());
        assertEquals("https://sts.cn-northwest-1.amazonaws.com.cn", newProvider("cn-northwest-1").stsEndpoint());
        assertEquals("https://sts.eu-west-1.amazonaws.com", newProvider("eu-west-1").stsEndpoint());
    }

    @Test
    void signedHeadersTargetRegionalEndpoint() throws Exception {
        Map<String, String> headers = newProvider("eu-west-1").signedHeaders();

        assertEquals("sts.eu-west-1.amazonaws.com", headers.get("Host"));
        assertTrue(headers.containsKey("X-Amz-Date"));
        assertTrue(headers.get("Authorization").contains("/eu-west-1/sts/aws4_request"));
    }

    @Test
    void rejectsUnknownRegionAndEmptyArguments() {
        assertThrows(IllegalArgumentException.class, () -> newProvider("mars-north-1"));
        assertThrows(IllegalArgumentException.class,
            () -> new StsIdentityProvider(baseUri.toString(), "", CREDENTIALS, null, null));
        assertThrows(IllegalArgumentException.class,
            () -> new StsIdentityProvider("", "us-west-2", CREDENTIALS, null, null));
    }

    private StsIdentityProvider newProvider(String region) {
        return new StsIdentityProvider(baseUri.toString(), region, CREDENTIALS, null, null);
    }

    private void registerAuth(int status, String response) {
        server.createContext("/v2/auth/sts-identity", exchange -> {
            authCount.incrementAndGet();
            authorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            amzDate.set(exchange.getRequestHeaders().getFirst("X-Amz-Date"));
            body.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            respond(exchange, status, response);
        });
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body == null ? new byte[0] : body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
