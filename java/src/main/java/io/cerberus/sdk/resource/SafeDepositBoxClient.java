package io.cerberus.sdk.resource;

import com.fasterxml.jackson.core.type.TypeReference;
import io.cerberus.sdk.CerberusClient;
import io.cerberus.sdk.CerberusException;
import io.cerberus.sdk.NotFoundException;
import io.cerberus.sdk.model.SafeDepositBox;

import java.io.InputStream;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * CRUD operations on safe deposit boxes.
 */
public final class SafeDepositBoxClient extends ResourceClient {

    static final String BASE_PATH = "/v2/safe-deposit-box";
    static final String NOT_FOUND = "Unable to find Safe Deposit Box";

    private static final TypeReference<List<SafeDepositBox>> BOX_LIST = new TypeReference<>() {
    };

    public SafeDepositBoxClient(CerberusClient client) {
        super(client);
    }

    /**
     * @return every box visible to the current identity, never {@code null}.
     */
    public List<SafeDepositBox> list() throws CerberusException {
        HttpResponse<InputStream> response = client.execute("GET", BASE_PATH, Map.of(), null);
        if (response.statusCode() != 200) {
            throw failure(response, "GET SDB list");
        }
        List<SafeDepositBox> boxes = readJson(response, BOX_LIST, "SDB list");
        return boxes == null ? List.of() : boxes;
    }

    /**
     * @throws NotFoundException when {@code id} is blank or no box carries it.
     */
    public SafeDepositBox get(String id) throws CerberusException {
        if (isBlank(id)) {
            throw new NotFoundException(NOT_FOUND);
        }
        HttpResponse<InputStream> response = client.execute("GET", BASE_PATH + "/" + id.trim(), Map.of(), null);
        if (response.statusCode() == 404) {
            discard(response);
            throw new NotFoundException(NOT_FOUND);
        }
        if (response.statusCode() != 200) {
            throw failure(response, "GET SDB");
        }
        return readJson(response, SafeDepositBox.class, "SDB");
    }

    /**
     * Looks a box up by its display name. The service has no lookup by name, so this scans {@link #list()}.
     */
    public SafeDepositBox getByName(String name) throws CerberusException {
        if (isBlank(name)) {
            throw new NotFoundException(NOT_FOUND);
        }
        for (SafeDepositBox box : list()) {
            if (name.equals(box.name())) {
                return box;
            }
        }
        throw new NotFoundException(NOT_FOUND);
    }

    public SafeDepositBox create(SafeDepositBox box) throws CerberusException {
        Objects.requireNonNull(box, "box");
        HttpResponse<InputStream> response = client.execute("POST", BASE_PATH, Map.of(), box);
        if (response.statusCode() != 201) {
            throw failure(response, "create SDB");
        }
        return readJson(response, SafeDepositBox.class, "SDB");
    }

    public SafeDepositBox update(String id, SafeDepositBox box) throws CerberusException {
        Objects.requireNonNull(box, "box");
        if (isBlank(id)) {
            throw new NotFoundException(NOT_FOUND);
        }
        HttpResponse<InputStream> response = client.execute("PUT", BASE_PATH + "/" + id.trim(), Map.of(), box);
        if (response.statusCode() == 404) {
            discard(response);
            throw new NotFoundException(NOT_FOUND);
        }
        if (response.statusCode() != 200) {
            throw failure(response, "update SDB");
        }
        return readJson(response, SafeDepositBox.class, "SDB");
    }

    public void delete(String id) throws CerberusException {
        if (isBlank(id)) {
            throw new NotFoundException(NOT_FOUND);
        }
        HttpResponse<InputStream> response = client.execute("DELETE", BASE_PATH + "/" + id.trim(), Map.of(), null);
        if (response.statusCode() == 404) {
            discard(response);
            throw new NotFoundException(NOT_FOUND);
        }
        if (response.statusCode() != 204) {
            throw failure(response, "delete SDB");
        }
        discard(response);
    }
}
