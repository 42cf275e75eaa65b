package io.cerberus.sdk.resource;

import io.cerberus.sdk.CerberusClient;
import io.cerberus.sdk.CerberusException;
import io.cerberus.sdk.model.MetadataOptions;
import io.cerberus.sdk.model.MetadataResponse;

import java.io.InputStream;
import java.net.http.HttpResponse;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Paged access to the administrative metadata of every safe deposit box. Requires an admin identity.
 */
public final class MetadataClient extends ResourceClient {

    static final String BASE_PATH = "/v1/metadata";

    public MetadataClient(CerberusClient client) {
        super(client);
    }

    public MetadataResponse list() throws CerberusException {
        return list(MetadataOptions.defaults());
    }

    /**
     * @param options page to fetch; {@code null} means the first page of default size.
     */
    public MetadataResponse list(MetadataOptions options) throws CerberusException {
        MetadataOptions resolved = options == null ? MetadataOptions.defaults() : options;
        Map<String, String> params = new LinkedHashMap<>();
        params.put("limit", Integer.toString(resolved.effectiveLimit()));
        params.put("offset", Integer.toString(resolved.offset()));

        HttpResponse<InputStream> response = client.execute("GET", BASE_PATH, params, null);
        if (response.statusCode() != 200) {
            throw failure(response, "GET metadata");
        }
        return readJson(response, MetadataResponse.class, "metadata");
    }
}
