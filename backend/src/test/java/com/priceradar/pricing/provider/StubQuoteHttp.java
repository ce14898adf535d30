package com.priceradar.pricing.provider;

import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * {@link QuoteHttpClient} over a canned exchange function; records every request it sees.
 */
public class StubQuoteHttp {

    public final List<ClientRequest> requests = new ArrayList<>();
    public final QuoteHttpClient client;

    public StubQuoteHttp(Function<ClientRequest, ClientResponse> responder) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(req -> {
            requests.add(req);
            return Mono.just(responder.apply(req));
        });
        client = new QuoteHttpClient(builder, Duration.ofSeconds(2), 1 << 20, RateLimiterConfig.ofDefaults());
    }

    public static StubQuoteHttp ok(String body) {
        return new StubQuoteHttp(req -> response(HttpStatus.OK, body));
    }

    public static ClientResponse response(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header("Content-Type", "text/plain;charset=UTF-8")
                .body(body)
                .build();
    }

    public String lastUrl() {
        return requests.get(requests.size() - 1).url().toString();
    }
}
