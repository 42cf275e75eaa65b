package io.cerberus.sdk;

import io.cerberus.sdk.auth.TokenProvider;

import java.io.Reader;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable configuration container used to bootstrap {@link CerberusClient} instances.
 */
public final class Config {

    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);

    private final TokenProvider tokenProvider;
    private final Reader otpSource;
    private final HttpClient httpClient;
    private final Duration httpTimeout;
    private final Map<String, String> defaultHeaders;
    private final RetryPolicy retryPolicy;

    private Config(Builder builder) {
        this.tokenProvider = builder.tokenProvider;
        this.otpSource = builder.otpSource;
        this.httpClient = builder.httpClient;
        this.httpTimeout = builder.httpTimeout;
        this.defaultHeaders = builder.defaultHeaders == null ? null : new LinkedHashMap<>(builder.defaultHeaders);
        this.retryPolicy = builder.retryPolicy;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Config withDefaults() {
        if (tokenProvider == null) {
            throw new IllegalArgumentException("TokenProvider is required");
        }

        Duration resolvedTimeout = Optional.ofNullable(httpTimeout).orElse(DEFAULT_HTTP_TIMEOUT);
        if (resolvedTimeout.isNegative() || resolvedTimeout.isZero()) {
            resolvedTimeout = DEFAULT_HTTP_TIMEOUT;
        }

        HttpClient resolvedClient = httpClient;
        if (resolvedClient == null) {
            resolvedClient = HttpClient.newBuilder()
                .connectTimeout(resolvedTimeout)
                .build();
        }

        Map<String, String> resolvedHeaders = new LinkedHashMap<>();
        if (defaultHeaders != null) {
            defaultHeaders.forEach((name, value) -> {
                if (name != null && !name.isBlank() && value != null) {
                    resolvedHeaders.put(name.trim(), value);
                }
            });
        }

        return new Builder()
            .tokenProvider(tokenProvider)
            .otpSource(otpSource)
            .httpClient(resolvedClient)
            .httpTimeout(resolvedTimeout)
            .defaultHeaders(resolvedHeaders)
            .retryPolicy(Optional.ofNullable(retryPolicy).orElse(RetryPolicy.defaults()))
            .buildInternal();
    }

    public TokenProvider getTokenProvider() {
        return tokenProvider;
    }

    /**
     * @return source of the MFA one-time passcode, {@code null} to prompt on the console.
     */
    public Reader getOtpSource() {
        return otpSource;
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    /**
     * @return headers added to every call; they replace provider headers of the same name.
     */
    public Map<String, String> getDefaultHeaders() {
        return defaultHeaders == null ? Map.of() : Collections.unmodifiableMap(defaultHeaders);
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public static final class Builder {
        private TokenProvider tokenProvider;
        private Reader otpSource;
        private HttpClient httpClient;
        private Duration httpTimeout;
        private Map<String, String> defaultHeaders;
        private RetryPolicy retryPolicy;

        public Builder tokenProvider(TokenProvider tokenProvider) {
            this.tokenProvider = tokenProvider;
            return this;
        }

        public Builder otpSource(Reader otpSource) {
            this.otpSource = otpSource;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = httpTimeout;
            return this;
        }

        public Builder defaultHeaders(Map<String, String> defaultHeaders) {
            this.defaultHeaders = defaultHeaders == null ? null : new LinkedHashMap<>(defaultHeaders);
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Config build() {
            return new Config(this).withDefaults();
        }

        private Config buildInternal() {
            return new Config(this);
        }
    }
}
