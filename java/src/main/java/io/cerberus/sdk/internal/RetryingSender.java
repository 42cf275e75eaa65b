package io.cerberus.sdk.internal;

import io.cerberus.sdk.CerberusException;
import io.cerberus.sdk.RetryPolicy;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Sends a request under a {@link RetryPolicy}. Transport failures and 5xx answers are retried; every other
 * answer is handed back untouched so the caller can classify it.
 */
public final class RetryingSender {

    private static final Logger LOGGER = Logger.getLogger(RetryingSender.class.getName());

    private final HttpClient httpClient;
    private final RetryPolicy policy;

    public RetryingSender(HttpClient httpClient, RetryPolicy policy) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /**
     * @return the first non-5xx response, or the last 5xx response once the retry window is spent.
     * @throws CerberusException when the final attempt failed below HTTP (connection refused, reset, timeout).
     */
    public HttpResponse<InputStream> send(HttpRequest request) throws CerberusException {
        long started = System.nanoTime();
        int attempt = 0;
        while (true) {
            attempt++;
            HttpResponse<InputStream> response = null;
            IOException failure = null;
            try {
                response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new CerberusException(request.method() + " " + request.uri().getPath() + " interrupted", ex);
            } catch (IOException ex) {
                failure = ex;
            }

            if (response != null && response.statusCode() < 500) {
                if (response.statusCode() >= 400) {
                    int status = response.statusCode();
                    LOGGER.info(() -> String.format(Locale.ROOT,
                        "[cerberus-sdk] Cerberus returned an error when executing %s %s; status code %d",
                        request.method(), request.uri().getPath(), status));
                }
                return response;
            }

            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
            if (elapsed.compareTo(policy.maxElapsedTime()) >= 0) {
                int attempts = attempt;
                if (response != null) {
                    int status = response.statusCode();
                    LOGGER.info(() -> String.format(Locale.ROOT,
                        "[cerberus-sdk] Cerberus returned an error when executing %s %s; status code %d after %d attempt(s)",
                        request.method(), request.uri().getPath(), status, attempts));
                    return response;
                }
                String message = failure.getMessage();
                LOGGER.info(() -> String.format(Locale.ROOT,
                    "[cerberus-sdk] An error was thrown when executing %s %s after %d attempt(s): %s",
                    request.method(), request.uri().getPath(), attempts, message));
                throw new CerberusException("Problem while performing request to Cerberus: " + message, failure);
            }

            Duration delay = policy.delayAfter(attempt);
            int current = attempt;
            LOGGER.fine(() -> String.format(Locale.ROOT,
                "[cerberus-sdk] attempt %d of %s %s failed; retrying in %d ms",
                current, request.method(), request.uri().getPath(), delay.toMillis()));
            HttpUtil.closeQuietly(response);
            sleep(delay);
        }
    }

    private static void sleep(Duration delay) throws CerberusException {
        if (delay.isZero()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new CerberusException("retry backoff interrupted", ex);
        }
    }
}
