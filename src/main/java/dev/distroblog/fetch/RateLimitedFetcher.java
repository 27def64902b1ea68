package dev.distroblog.fetch;

import java.io.IOException;
import java.io.InputStream;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

/**
 * The single HTTP entry point for talking to third-party sites.
 *
 * <ul>
 *   <li>At least {@code min-domain-spacing-ms} between two requests to the same host.</li>
 *   <li>429: retried after {@code base × 2^(attempt-1)}.</li>
 *   <li>5xx and transport failures: retried after {@code base × attempt}.</li>
 *   <li>Other 4xx: thrown immediately.</li>
 * </ul>
 *
 * Retries run through a Spring Retry {@link RetryTemplate}; all waiting goes through the injected
 * {@link Sleeper} so tests run without real delays.
 */
@Component
public class RateLimitedFetcher {

    private static final Logger log = LoggerFactory.getLogger(RateLimitedFetcher.class);

    private static final String ACCEPT =
            "text/html,application/xhtml+xml,application/xml;q=0.9,application/rss+xml,application/atom+xml,"
                    + "application/feed+json,application/json;q=0.8,*/*;q=0.7";

    private final RestClient.Builder restClientBuilder;
    private final FetchProperties properties;
    private final Clock clock;
    private final Sleeper sleeper;
    private final RetryTemplate retryTemplate;

    private final ConcurrentHashMap<String, Instant> lastRequestByHost = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Duration, RestClient> clientsByTimeout = new ConcurrentHashMap<>();

    public RateLimitedFetcher(RestClient.Builder restClientBuilder, FetchProperties properties,
                              Clock clock, Sleeper sleeper) {
        this.restClientBuilder = restClientBuilder;
        this.properties = properties;
        this.clock = clock;
        this.sleeper = sleeper;
        this.retryTemplate = new RetryTemplate();
        this.retryTemplate.setRetryPolicy(new FetchRetryPolicy(properties.retry().maxAttempts()));
        this.retryTemplate.setBackOffPolicy(new FetchBackOffPolicy(properties.retry().baseDelayMs(), sleeper));
    }

    public FetchResponse get(String url) {
        return get(url, Duration.ofMillis(properties.defaultTimeoutMs()));
    }

    /**
     * GET with per-host spacing and retries.
     *
     * @throws FetchException when the request ultimately fails
     */
    public FetchResponse get(String url, Duration timeout) {
        URI uri = toUri(url);
        return withDomainSlot(uri, () -> retryTemplate.execute(
                context -> exchange(HttpMethod.GET, uri, timeout)));
    }

    /**
     * Single-attempt HEAD, used to reject HTML content types before a full download.
     *
     * @throws FetchException on any failure, including servers that refuse HEAD
     */
    public FetchResponse head(String url) {
        URI uri = toUri(url);
        Duration timeout = Duration.ofMillis(properties.headTimeoutMs());
        return withDomainSlot(uri, () -> exchange(HttpMethod.HEAD, uri, timeout));
    }

    /** Delay before retry number {@code attempt} (1-based) after the given failure. */
    static long backOffDelay(FetchException failure, int attempt, long baseDelayMs) {
        if (failure.isRateLimited()) {
            return baseDelayMs * (1L << Math.max(0, attempt - 1));
        }
        return baseDelayMs * attempt;
    }

    private FetchResponse withDomainSlot(URI uri, Supplier<FetchResponse> call) {
        String host = uri.getHost().toLowerCase();
        awaitDomainSlot(host);
        try {
            return call.get();
        } finally {
            lastRequestByHost.put(host, clock.instant());
        }
    }

    private void awaitDomainSlot(String host) {
        Instant last = lastRequestByHost.get(host);
        if (last == null) {
            return;
        }
        long elapsed = Duration.between(last, clock.instant()).toMillis();
        long wait = properties.minDomainSpacingMs() - elapsed;
        if (wait <= 0) {
            return;
        }
        log.debug("Waiting {}ms before next request to {}", wait, host);
        try {
            sleeper.sleep(wait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw FetchException.network(host, e);
        }
    }

    private FetchResponse exchange(HttpMethod method, URI uri, Duration timeout) {
        String url = uri.toString();
        FetchResponse response;
        try {
            response = clientFor(timeout)
                    .method(method)
                    .uri(uri)
                    .header(HttpHeaders.USER_AGENT, properties.userAgent())
                    .header(HttpHeaders.ACCEPT, ACCEPT)
                    .exchange((request, clientResponse) -> read(url, method, clientResponse));
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                throw FetchException.timeout(url, e);
            }
            throw FetchException.network(url, e);
        }
        if (response == null) {
            throw FetchException.network(url, null);
        }
        if (response.status() >= 400) {
            if (response.status() == 429 || response.status() >= 500) {
                log.info("{} {} returned {}", method, url, response.status());
            }
            throw FetchException.httpStatus(url, response.status());
        }
        return response;
    }

    private FetchResponse read(String url, HttpMethod method, ClientHttpResponse clientResponse) throws IOException {
        int status = clientResponse.getStatusCode().value();
        MediaType contentType = clientResponse.getHeaders().getContentType();
        String contentTypeValue = contentType == null ? null : contentType.toString();
        if (status >= 400 || method == HttpMethod.HEAD) {
            return new FetchResponse(url, status, contentTypeValue, new byte[0]);
        }
        try (InputStream in = clientResponse.getBody()) {
            byte[] body = in.readNBytes(properties.maxBodyBytes());
            return new FetchResponse(url, status, contentTypeValue, body);
        }
    }

    private RestClient clientFor(Duration timeout) {
        return clientsByTimeout.computeIfAbsent(timeout, readTimeout -> {
            var requestFactory = new SimpleClientHttpRequestFactory();
            requestFactory.setConnectTimeout(Duration.ofMillis(properties.connectTimeoutMs()));
            requestFactory.setReadTimeout(readTimeout);
            return restClientBuilder.clone()
                    .requestFactory(requestFactory)
                    .build();
        });
    }

    private static URI toUri(String url) {
        try {
            URI uri = URI.create(url.trim());
            if (uri.getHost() == null || uri.getScheme() == null) {
                throw FetchException.network(url, new IllegalArgumentException("URL has no host"));
            }
            return uri;
        } catch (IllegalArgumentException e) {
            throw FetchException.network(url, e);
        }
    }

    /** Retries only failures that {@link FetchException#isRetryable()} allows. */
    static final class FetchRetryPolicy extends SimpleRetryPolicy {

        FetchRetryPolicy(int maxAttempts) {
            super(maxAttempts);
        }

        @Override
        public boolean canRetry(RetryContext context) {
            Throwable last = context.getLastThrowable();
            if (last == null) {
                return true;
            }
            return last instanceof FetchException failure
                    && failure.isRetryable()
                    && context.getRetryCount() < getMaxAttempts();
        }
    }

    /** Exponential for 429, linear for everything else. */
    static final class FetchBackOffPolicy implements BackOffPolicy {

        private final long baseDelayMs;
        private final Sleeper sleeper;

        FetchBackOffPolicy(long baseDelayMs, Sleeper sleeper) {
            this.baseDelayMs = baseDelayMs;
            this.sleeper = sleeper;
        }

        @Override
        public BackOffContext start(RetryContext context) {
            return new AttemptContext(context);
        }

        @Override
        public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
            RetryContext context = ((AttemptContext) backOffContext).retryContext();
            if (!(context.getLastThrowable() instanceof FetchException failure)) {
                return;
            }
            int attempt = context.getRetryCount();
            long delay = backOffDelay(failure, attempt, baseDelayMs);
            log.info("Retrying {} in {}ms (attempt {} failed: {})",
                    failure.getUrl(), delay, attempt, failure.getMessage());
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BackOffInterruptedException("Interrupted during fetch back-off", e);
            }
        }
    }

    private record AttemptContext(RetryContext retryContext) implements BackOffContext {}
}
