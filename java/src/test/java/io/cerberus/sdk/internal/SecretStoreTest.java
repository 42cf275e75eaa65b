package io.cerberus.sdk.internal;

import com.fasterxml.jackson.databind.JsonNode;
import io.cerberus.sdk.RetryPolicy;
import io.cerberus.sdk.SecretStoreException;
import io.cerberus.sdk.model.VaultSecret;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class SecretStoreTest {

    private HttpServer server;
    private SecretStore store;
    private final AtomicReference<String> method = new AtomicReference<>();
    private final AtomicReference<String> path = new AtomicReference<>();
    private final AtomicReference<String> query = new AtomicReference<>();
    private final AtomicReference<String> vaultToken = new AtomicReference<>();
    private final AtomicReference<String> team = new AtomicReference<>();
    private final AtomicReference<String> body = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.start();
        URI baseUri = URI.create("http://localhost:" + server.getAddress().getPort());
        RetryingSender sender = new RetryingSender(HttpClient.newHttpClient(), RetryPolicy.none());
        store = new SecretStore(sender, baseUri, Duration.ofSeconds(5), Map.of("X-Team", "payments"));
        store.setToken("vault-token");
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void readReturnsSecretData() throws Exception {
        register(200, "{\"request_id\":\"req-1\",\"lease_duration\":3600,\"renewable\":false,"
            + "\"data\":{\"password\":\"hunter2\"},\"warnings\":null}");

        VaultSecret secret = store.read("secret/app/my-sdb/db");

        assertEquals("GET", method.get());
        assertEquals("/v1/secret/app/my-sdb/db", path.get());
        assertNull(query.get());
        assertEquals("vault-token", vaultToken.get());
        assertEquals("payments", team.get());
        assertEquals("req-1", secret.requestId());
        assertEquals("hunter2", secret.data().get("password"));
        assertEquals(3600, secret.leaseDuration());
    }

    @Test
    void readOfMissingSecretIsNull() throws Exception {
        register(404, "{\"errors\":[]}");

        assertNull(store.read("secret/app/my-sdb/missing"));
    }

    @Test
    void notFoundWithErrorsIsAFailure() {
        register(404, "{\"errors\":[\"no handler for route\"]}");

        SecretStoreException ex = assertThrows(SecretStoreException.class, () -> store.read("secret/nowhere"));
        assertEquals(404, ex.getStatusCode());
        assertEquals(List.of("no handler for route"), ex.getErrors());
    }

    @Test
    void listUsesListQuery() throws Exception {
        register(200, "{\"data\":{\"keys\":[\"db\",\"api/\"]}}");

        VaultSecret secret = store.list("secret/app/my-sdb");

        assertEquals("GET", method.get());
        assertEquals("list=true", query.get());
        assertEquals(List.of("db", "api/"), secret.data().get("keys"));
    }

    @Test
    void writeSendsJsonAndAcceptsNoContent() throws Exception {
        register(204, null);

        VaultSecret result = store.write("secret/app/my-sdb/db", Map.of("password", "hunter2"));

        assertNull(result);
        assertEquals("PUT", method.get());
        JsonNode sent = Json.mapper().readTree(body.get());
        assertEquals("hunter2", sent.path("password").asText());
    }

    @Test
    void deleteFailureCarriesErrors() {
        register(403, "{\"errors\":[\"permission denied\"]}");

        SecretStoreException ex = assertThrows(SecretStoreException.class, () -> store.delete("secret/app/my-sdb/db"));
        assertEquals(403, ex.getStatusCode());
        assertEquals(List.of("permission denied"), ex.getErrors());
        assertEquals("DELETE", method.get());
    }

    @Test
    void tokenCanBeReplaced() throws Exception {
        register(204, null);
        store.setToken("rotated");

        store.delete("secret/app/my-sdb/db");

        assertEquals("rotated", store.token());
        assertEquals("rotated", vaultToken.get());
    }

    private void register(int status, String response) {
        server.createContext("/v1/secret", exchange -> {
            method.set(exchange.getRequestMethod());
            path.set(exchange.getRequestURI().getPath());
            query.set(exchange.getRequestURI().getRawQuery());
            vaultToken.set(exchange.getRequestHeaders().getFirst("X-Vault-Token"));
            team.set(exchange.getRequestHeaders().getFirst("X-Team"));
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
