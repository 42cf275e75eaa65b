package io.cerberus.sdk.auth;

import io.cerberus.sdk.CerberusException;
import io.cerberus.sdk.UnauthenticatedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class StaticTokenProviderTest {

    private HttpServer server;
    private URI baseUri;
    private final AtomicReference<String> seenToken = new AtomicReference<>();
    private final AtomicReference<String> seenMethod = new AtomicReference<>();

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
    void exposesTokenAndHeadersWithoutNetwork() throws Exception {
        StaticTokenProvider provider = new StaticTokenProvider(baseUri + "/", "a-token");

        assertTrue(provider.isAuthenticated());
        assertEquals("a-token", provider.token());
        assertEquals(baseUri, provider.baseUrl());

        Map<String, String> headers = provider.headers();
        assertEquals("a-token", headers.get("X-Cerberus-Token"));
        assertEquals("application/json", headers.get("Content-Type"));
        assertEquals("application/json", headers.get("Accept"));
        assertEquals("CerberusJavaClient/0.4.0", headers.get("X-Cerberus-Client"));

        CerberusException ex = assertThrows(CerberusException.class, provider::expiry);
        assertEquals("Expiry time not set", ex.getMessage());
    }

    @Test
    void rejectsInvalidArguments() {
        IllegalArgumentException empty = assertThrows(IllegalArgumentException.class,
            () -> new StaticTokenProvider(baseUri.toString(), ""));
        assertEquals("Token cannot be empty", empty.getMessage());

        assertThrows(IllegalArgumentException.class, () -> new StaticTokenProvider("", "a-token"));
        assertThrows(IllegalArgumentException.class,
            () -> new StaticTokenProvider("https://cerberus.example.com/v1", "a-token"));
        assertThrows(IllegalArgumentException.class,
            () -> new StaticTokenProvider("https://cerberus.example.com?x=1", "a-token"));
    }

    @Test
    void refreshReplacesToken() throws Exception {
        server.createContext("/v2/auth/user/refresh", exchange -> {
            seenToken.set(exchange.getRequestHeaders().getFirst("X-Cerberus-Token"));
            respond(exchange, 200, "{\"status\":\"success\",\"data\":{\"client_token\":"
                + "{\"client_token\":\"b-token\",\"lease_duration\":3600}}}");
        });
        StaticTokenProvider provider = new StaticTokenProvider(baseUri.toString(), "a-token");

        provider.refresh();

        assertEquals("a-token", seenToken.get());
        assertEquals("b-token", provider.token());
        assertEquals("b-token", provider.headers().get("X-Cerberus-Token"));
    }

    @Test
    void refreshFailureKeepsCurrentToken() throws Exception {
        server.createContext("/v2/auth/user/refresh", exchange -> respond(exchange, 500, ""));
        StaticTokenProvider provider = new StaticTokenProvider(baseUri.toString(), "a-token");

        CerberusException ex = assertThrows(CerberusException.class, provider::refresh);

        assertEquals("Error while trying to authenticate. Got HTTP response code 500", ex.getMessage());
        assertEquals("a-token", provider.token());
    }

    @Test
    void logoutClearsToken() throws Exception {
        server.createContext("/v1/auth", exchange -> {
            seenMethod.set(exchange.getRequestMethod());
            seenToken.set(exchange.getRequestHeaders().getFirst("X-Cerberus-Token"));
            respond(exchange, 204, null);
        });
        StaticTokenProvider provider = new StaticTokenProvider(baseUri.toString(), "a-token");

        provider.logout();

        assertEquals("DELETE", seenMethod.get());
        assertEquals("a-token", seenToken.get());
        assertFalse(provider.isAuthenticated());
        assertThrows(UnauthenticatedException.class, provider::token);
        assertThrows(UnauthenticatedException.class, provider::headers);
        assertThrows(UnauthenticatedException.class, provider::refresh);
    }

    @Test
    void logoutReportsUnexpectedStatus() {
        server.createContext("/v1/auth", exchange -> respond(exchange, 500, ""));
        StaticTokenProvider provider = new StaticTokenProvider(baseUri.toString(), "a-token");

        CerberusException ex = assertThrows(CerberusException.class, provider::logout);

        assertEquals("Unable to log out. Got HTTP response code 500", ex.getMessage());
        assertTrue(provider.isAuthenticated());
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
