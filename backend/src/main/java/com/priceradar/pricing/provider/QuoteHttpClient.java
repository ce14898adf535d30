package com.priceradar.pricing.provider;

import io.github.resilience4j.core.exception.AcquirePermissionCancelledException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Single GET helper shared by every provider adapter: explicit per-request deadline, capped body size,
 * per-host local rate limit. Failures surface as {@link QuoteFetchException}.
 */
public class QuoteHttpClient {

    /** Generic browser user agent; several providers reject requests without one. */
    public static final String BROWSER_USER_AGENT = "Mozilla/5.0";

    private final WebClient webClient;
    private final Duration timeout;
    private final int maxResponseBytes;
    private final RateLimiterRegistry rateLimiters;

    public QuoteHttpClient(WebClient.Builder builder, Duration timeout, int maxResponseBytes,
                           RateLimiterConfig limiterConfig) {
        this.webClient = builder.build();
        this.timeout = timeout;
        this.maxResponseBytes = maxResponseBytes;
        this.rateLimiters = RateLimiterRegistry.of(limiterConfig);
    }

    /**
     * GET the URL with the given headers and return the body as text.
     *
     * @throws QuoteFetchException TRANSPORT on network/timeout/non-2xx/rate-limit, SIZE_EXCEEDED when the body
     *                             is larger than the cap
     */
    public String get(String url, Map<String, String> headers) {
        URI uri = toUri(url);
        acquirePermit(uri);
        try {
            return webClient.get()
                    .uri(uri)
                    .headers(h -> headers.forEach(h::set))
                    .exchangeToMono(response -> {
                        if (!response.statusCode().is2xxSuccessful()) {
                            int status = response.statusCode().value();
                            return response.releaseBody().then(Mono.error(new QuoteFetchException(
                                    QuoteFetchException.Kind.TRANSPORT, "http status " + status)));
                        }
                        Charset charset = response.headers().contentType()
                                .map(MediaType::getCharset)
                                .orElse(StandardCharsets.UTF_8);
                        return DataBufferUtils.join(response.bodyToFlux(DataBuffer.class), maxResponseBytes)
                                .map(buffer -> readAndRelease(buffer, charset))
                                .defaultIfEmpty("");
                    })
                    .timeout(timeout)
                    .block();
        } catch (QuoteFetchException e) {
            throw e;
        } catch (RuntimeException e) {
            throw translate(Exceptions.unwrap(e), uri);
        }
    }

    private static URI toUri(String url) {
        try {
            return URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new QuoteFetchException(QuoteFetchException.Kind.TRANSPORT, "invalid request url: " + url, e);
        }
    }

    private void acquirePermit(URI uri) {
        String host = Objects.requireNonNullElse(uri.getHost(), "unknown-host");
        RateLimiter limiter = rateLimiters.rateLimiter(host);
        try {
            RateLimiter.waitForPermission(limiter);
        } catch (RequestNotPermitted e) {
            throw new QuoteFetchException(QuoteFetchException.Kind.TRANSPORT, "local rate limit for " + host, e);
        } catch (AcquirePermissionCancelledException e) {
            Thread.currentThread().interrupt();
            throw new QuoteFetchException(QuoteFetchException.Kind.TRANSPORT,
                    "interrupted waiting for rate limit permit for " + host, e);
        }
    }

    private static String readAndRelease(DataBuffer buffer, Charset charset) {
        try {
            return buffer.toString(charset);
        } finally {
            DataBufferUtils.release(buffer);
        }
    }

    private static QuoteFetchException translate(Throwable error, URI uri) {
        if (error instanceof QuoteFetchException q) {
            return q;
        }
        if (error instanceof DataBufferLimitException) {
            return new QuoteFetchException(QuoteFetchException.Kind.SIZE_EXCEEDED,
                    "response from " + uri.getHost() + " exceeds size limit", error);
        }
        if (error instanceof TimeoutException) {
            return new QuoteFetchException(QuoteFetchException.Kind.TRANSPORT,
                    "timeout calling " + uri.getHost(), error);
        }
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new QuoteFetchException(QuoteFetchException.Kind.TRANSPORT, message, error);
    }
}
