package io.cerberus.sdk.resource;

import io.cerberus.sdk.CerberusClient;
import io.cerberus.sdk.CerberusException;
import io.cerberus.sdk.internal.SecretStore;
import io.cerberus.sdk.model.VaultSecret;

import java.util.Map;
import java.util.Objects;

/**
 * Key/value secrets. Every path is taken relative to the {@code secret/} mount and must not start with a
 * slash, e.g. {@code app/my-sdb/db}.
 *
 * <p>
 * Calls go to the key/value protocol rather than the Cerberus API, so they are authenticated with the token
 * the owning {@link CerberusClient} obtained during {@link CerberusClient#init()} and after every refresh.
 * </p>
 */
public final class SecretClient {

    static final String PATH_PREFIX = "secret/";

    private final CerberusClient client;
    private final SecretStore store;

    public SecretClient(CerberusClient client, SecretStore store) {
        this.client = Objects.requireNonNull(client, "client");
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * @return the secret, or {@code null} when nothing is stored at {@code path}.
     */
    public VaultSecret read(String path) throws CerberusException {
        client.init();
        return store.read(PATH_PREFIX + path);
    }

    /**
     * @return the child keys under {@code data.keys}, or {@code null} when {@code path} has no children.
     */
    public VaultSecret list(String path) throws CerberusException {
        client.init();
        return store.list(PATH_PREFIX + path);
    }

    public VaultSecret write(String path, Map<String, Object> data) throws CerberusException {
        client.init();
        return store.write(PATH_PREFIX + path, data);
    }

    public VaultSecret delete(String path) throws CerberusException {
        client.init();
        return store.delete(PATH_PREFIX + path);
    }
}
