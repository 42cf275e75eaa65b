package io.cerberus.sdk.resource;

import com.fasterxml.jackson.core.type.TypeReference;
import io.cerberus.sdk.CerberusClient;
import io.cerberus.sdk.CerberusException;
import io.cerberus.sdk.model.Category;

import java.io.InputStream;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;

public final class CategoryClient extends ResourceClient {

    static final String BASE_PATH = "/v1/category";

    private static final TypeReference<List<Category>> CATEGORY_LIST = new TypeReference<>() {
    };

    public CategoryClient(CerberusClient client) {
        super(client);
    }

    public List<Category> list() throws CerberusException {
        HttpResponse<InputStream> response = client.execute("GET", BASE_PATH, Map.of(), null);
        if (response.statusCode() != 200) {
            throw failure(response, "GET categories");
        }
        List<Category> categories = readJson(response, CATEGORY_LIST, "category list");
        return categories == null ? List.of() : categories;
    }
}
