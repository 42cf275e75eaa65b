package io.cerberus.sdk.resource;

import io.cerberus.sdk.CerberusClient;
import io.cerberus.sdk.CerberusException;
import io.cerberus.sdk.NotFoundException;
import io.cerberus.sdk.internal.HttpUtil;
import io.cerberus.sdk.internal.Multipart;
import io.cerberus.sdk.model.SecureFilesResponse;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.http.HttpResponse;
import java.util.Map;
import java.util.Objects;

/**
 * Upload, download and listing of secure files, the binary counterpart of secrets.
 *
 * <p>
 * Paths are relative to the owning box, for example {@code app/my-sdb/cert.pem}.
 * </p>
 */
public final class SecureFileClient extends ResourceClient {

    static final String FILE_PATH = "/v1/secure-file";
    static final String LIST_PATH = "/v1/secure-files";
    static final String FILE_FIELD = "file-content";

    public SecureFileClient(CerberusClient client) {
        super(client);
    }

    public SecureFilesResponse list(String rootPath) throws CerberusException {
        // the listing endpoint only answers on the trailing-slash form
        String path = HttpUtil.joinPath(LIST_PATH, rootPath);
        if (!path.endsWith("/")) {
            path = path + "/";
        }
        HttpResponse<InputStream> response = client.execute("GET", path, Map.of("list", "true"), null);
        if (response.statusCode() != 200) {
            throw failure(response, "list secure files");
        }
        return readJson(response, SecureFilesResponse.class, "secure file list");
    }

    /**
     * Streams the content of the file at {@code path} into {@code output}. The sink is not closed.
     */
    public void get(String path, OutputStream output) throws CerberusException {
        Objects.requireNonNull(output, "output");
        HttpResponse<InputStream> response = client.execute("GET", HttpUtil.joinPath(FILE_PATH, path), Map.of(), null);
        if (response.statusCode() == 404) {
            discard(response);
            throw new NotFoundException("Unable to find secure file " + path);
        }
        if (response.statusCode() != 200) {
            throw failure(response, "download secure file " + path);
        }
        try (InputStream body = response.body()) {
            body.transferTo(output);
        } catch (IOException ex) {
            throw new CerberusException("Error while downloading secure file " + path + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Uploads {@code content} as {@code filename} to {@code path}, replacing any existing file. The stream is
     * read fully but not closed.
     */
    public void put(String path, String filename, InputStream content) throws CerberusException {
        Objects.requireNonNull(filename, "filename");
        Objects.requireNonNull(content, "content");
        Multipart multipart;
        try {
            multipart = Multipart.ofFile(FILE_FIELD, filename, content);
        } catch (IOException ex) {
            throw new CerberusException("Error creating upload body: " + ex.getMessage(), ex);
        }
        HttpResponse<InputStream> response = client.executeWithBody("POST", HttpUtil.joinPath(FILE_PATH, path),
            Map.of(), multipart.contentType(), multipart.body());
        if (response.statusCode() != 204) {
            throw failure(response, "upload secure file " + path);
        }
        discard(response);
    }

    public void delete(String path) throws CerberusException {
        HttpResponse<InputStream> response = client.execute("DELETE", HttpUtil.joinPath(FILE_PATH, path), Map.of(), null);
        if (response.statusCode() == 404) {
            discard(response);
            throw new NotFoundException("Unable to find secure file " + path);
        }
        if (response.statusCode() != 204) {
            throw failure(response, "delete secure file " + path);
        }
        discard(response);
    }
}
