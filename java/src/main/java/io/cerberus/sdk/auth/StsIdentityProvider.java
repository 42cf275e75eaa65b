package io.cerberus.sdk.auth;

import io.cerberus.sdk.CerberusException;
import io.cerberus.sdk.UnauthorizedException;
import io.cerberus.sdk.internal.ApiErrorDecoder;
import io.cerberus.sdk.internal.HttpUtil;
import io.cerberus.sdk.internal.Json;
import io.cerberus.sdk.model.IamAuthResponse;
import software.amazon.awssdk.auth.credentials.AwsCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.signer.Aws4Signer;
import software.amazon.awssdk.auth.signer.params.Aws4SignerParams;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.http.SdkHttpFullRequest;
import software.amazon.awssdk.http.SdkHttpMethod;
import software.amazon.awssdk.regions.Region;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Authenticates with the caller's AWS identity. A {@code sts:GetCallerIdentity} request is signed with SigV4
 * using the ambient AWS credentials and Cerberus exchanges the signed headers for a token; no AWS call is made
 * from the client itself.
 */
public final class StsIdentityProvider extends AbstractTokenProvider {

    static final String AUTH_PATH = "/v2/auth/sts-identity";
    static final String GET_CALLER_IDENTITY = "Action=GetCallerIdentity&Version=2011-06-15";

    private static final Duration STS_TIMEOUT = Duration.ofSeconds(10);
    private static final Set<String> CHINA_REGIONS = Set.of("cn-north-1", "cn-northwest-1");
    private static final Logger LOGGER = Logger.getLogger(StsIdentityProvider.class.getName());

    private final Region region;
    private final AwsCredentialsProvider credentialsProvider;
    private final Aws4Signer signer = Aws4Signer.create();

    public StsIdentityProvider(String cerberusUrl, String region) {
        this(cerberusUrl, region, DefaultCredentialsProvider.create(), null, STS_TIMEOUT);
    }

    public StsIdentityProvider(String cerberusUrl, String region, AwsCredentialsProvider credentialsProvider,
                               HttpClient httpClient, Duration requestTimeout) {
        super(HttpUtil.validateBaseUrl(validated(cerberusUrl, region)), httpClient, requestTimeout,
            Map.of("Content-Type", "application/json"));
        this.region = Region.of(region);
        if (!Region.regions().contains(this.region)) {
            throw new IllegalArgumentException(
                "Endpoint could not be created. Confirm that region, " + region + ", is a valid AWS region");
        }
        this.credentialsProvider = Objects.requireNonNull(credentialsProvider, "credentialsProvider");
    }

    /**
     * Returns the current token or authenticates. There is no MFA step, so {@code otpSource} is ignored.
     */
    @Override
    public String token(Reader otpSource) throws CerberusException {
        Token token = currentToken();
        if (token != null && token.isValid(Instant.now())) {
            return token.value();
        }
        lock.lock();
        try {
            token = currentToken();
            if (token != null && token.isValid(Instant.now())) {
                return token.value();
            }
            Token fresh = authenticate();
            store(fresh);
            return fresh.value();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Re-authenticates instead of calling the refresh endpoint. Cerberus caps how many times an IAM token can be
     * refreshed and asks for a refresh after every box creation, so automation would hit that cap.
     */
    @Override
    public void refresh() throws CerberusException {
        lock.lock();
        try {
            headers();
            store(authenticate());
        } finally {
            lock.unlock();
        }
    }

    String stsEndpoint() {
        String endpoint = "https://sts." + region.id() + ".amazonaws.com";
        if (CHINA_REGIONS.contains(region.id())) {
            endpoint += ".cn";
        }
        return endpoint;
    }

    Map<String, String> signedHeaders() throws CerberusException {
        AwsCredentials credentials;
        try {
            credentials = credentialsProvider.resolveCredentials();
        } catch (SdkClientException ex) {
            throw new CerberusException("Credentials are required and cannot be found: " + ex.getMessage(), ex);
        }
        byte[] payload = GET_CALLER_IDENTITY.getBytes(StandardCharsets.UTF_8);
        SdkHttpFullRequest unsigned = SdkHttpFullRequest.builder()
            .method(SdkHttpMethod.POST)
            .uri(URI.create(stsEndpoint()))
            .contentStreamProvider(() -> new ByteArrayInputStream(payload))
            .build();
        Aws4SignerParams params = Aws4SignerParams.builder()
            .awsCredentials(credentials)
            .signingName("sts")
            .signingRegion(region)
            .build();
        SdkHttpFullRequest signed = signer.sign(unsigned, params);

        Map<String, String> headers = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : signed.headers().entrySet()) {
            if (!entry.getValue().isEmpty()) {
                headers.put(entry.getKey(), entry.getValue().get(0));
            }
        }
        return headers;
    }

    private Token authenticate() throws CerberusException {
        Map<String, String> headers = signedHeaders();
        headers.put(HttpUtil.CLIENT_HEADER, HttpUtil.CLIENT_VERSION);
        HttpRequest request = HttpUtil.newRequest(HttpUtil.resolve(baseUrl, AUTH_PATH, null), "POST",
            GET_CALLER_IDENTITY.getBytes(StandardCharsets.UTF_8), headers, requestTimeout).build();
        HttpResponse<InputStream> response = HttpUtil.send(httpClient, request, "sts authentication");

        IamAuthResponse auth;
        try (InputStream body = response.body()) {
            int status = response.statusCode();
            if (status == 401 || status == 403) {
                throw new UnauthorizedException("Invalid credentials given. Verify that the role you are currently "
                    + "using is valid with the AWS CLI ($ aws sts get-caller-identity) or with gimme-aws-creds.");
            }
            if (status != 200) {
                CerberusException apiError = ApiErrorDecoder.decode(status, body);
                throw new CerberusException(
                    "Error while trying to authenticate. Got HTTP response code " + status, apiError);
            }
            auth = Json.mapper().readValue(body, IamAuthResponse.class);
        } catch (IOException ex) {
            throw new CerberusException("Error while trying to parse response from Cerberus: " + ex.getMessage(), ex);
        }
        if (auth == null || auth.clientToken() == null || auth.clientToken().isBlank()) {
            throw new CerberusException("authentication response missing client_token");
        }

        String identity = identity(auth.metadata());
        LOGGER.info(() -> "[cerberus-sdk] Successfully authenticated with Cerberus as " + identity);
        return Token.withLease(auth.clientToken(), auth.leaseDuration());
    }

    private static String identity(Map<String, String> metadata) {
        if (metadata == null) {
            return "unknown";
        }
        if (metadata.get("iam_principal_arn") != null) {
            return metadata.get("iam_principal_arn");
        }
        if (metadata.get("username") != null) {
            return metadata.get("username");
        }
        return "unknown";
    }

    private static String validated(String cerberusUrl, String region) {
        if (region == null || region.isEmpty()) {
            throw new IllegalArgumentException("Region cannot be empty");
        }
        if (cerberusUrl == null || cerberusUrl.isEmpty()) {
            throw new IllegalArgumentException("Cerberus URL cannot be empty");
        }
        return cerberusUrl;
    }
}
