package io.cerberus.sdk.resource;

import io.cerberus.sdk.CerberusClient;
import io.cerberus.sdk.CerberusException;
import io.cerberus.sdk.Config;
import io.cerberus.sdk.RetryPolicy;
import io.cerberus.sdk.auth.StaticTokenProvider;
import io.cerberus.sdk.model.Role;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RoleClientTest {

    private HttpServer server;
    private CerberusClient client;
    private volatile int nextStatus = 200;
    private volatile String nextBody = "";

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/v1/role", exchange -> respond(exchange, nextStatus, nextBody));
        server.start();
        client = new CerberusClient(Config.builder()
            .tokenProvider(new StaticTokenProvider("http://localhost:" + server.getAddress().getPort(), "token"))
            .retryPolicy(RetryPolicy.none())
            .build());
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void listDecodesRoles() throws Exception {
        nextBody = "[{\"id\":\"role-owner\",\"name\":\"owner\",\"created_ts\":\"2016-04-05T04:19:51Z\","
            + "\"last_updated_ts\":\"2016-04-05T04:19:51Z\",\"created_by\":\"system\",\"last_updated_by\":\"system\"},"
            + "{\"id\":\"role-read\",\"name\":\"read\"}]";

        List<Role> roles = client.role().list();

        assertEquals(2, roles.size());
        assertEquals("owner", roles.get(0).name());
        assertEquals(OffsetDateTime.parse("2016-04-05T04:19:51Z"), roles.get(0).created());
        assertEquals("system", roles.get(0).createdBy());
        assertNull(roles.get(1).created());
    }

    @Test
    void unexpectedStatusNamesCode() {
        nextStatus = 401;

        CerberusException ex = assertThrows(CerberusException.class, () -> client.role().list());
        assertEquals("Error while trying to GET roles. Got HTTP status code 401", ex.getMessage());
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
