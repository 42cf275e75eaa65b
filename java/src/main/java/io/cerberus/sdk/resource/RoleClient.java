package io.cerberus.sdk.resource;

import com.fasterxml.jackson.core.type.TypeReference;
import io.cerberus.sdk.CerberusClient;
import io.cerberus.sdk.CerberusException;
import io.cerberus.sdk.model.Role;

import java.io.InputStream;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;

public final class RoleClient extends ResourceClient {

    static final String BASE_PATH = "/v1/role";

    private static final TypeReference<List<Role>> ROLE_LIST = new TypeReference<>() {
    };

    public RoleClient(CerberusClient client) {
        super(client);
    }

    public List<Role> list() throws CerberusException {
        HttpResponse<InputStream> response = client.execute("GET", BASE_PATH, Map.of(), null);
        if (response.statusCode() != 200) {
            throw failure(response, "GET roles");
        }
        List<Role> roles = readJson(response, ROLE_LIST, "role list");
        return roles == null ? List.of() : roles;
    }
}
