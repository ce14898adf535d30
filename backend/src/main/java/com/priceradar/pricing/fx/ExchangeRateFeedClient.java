package com.priceradar.pricing.fx;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.priceradar.pricing.config.PricingProperties;
import com.priceradar.pricing.provider.QuoteFetchException;
import com.priceradar.pricing.provider.QuoteHttpClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Fetches live FX rates: Frankfurter first, then open.er-api. First usable rate wins.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ExchangeRateFeedClient {

    static final String FRANKFURTER = "frankfurter";
    static final String OPEN_ER_API = "open_er_api";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Map<String, String> HEADERS = Map.of("User-Agent", "PriceRadar/1.0");

    private final QuoteHttpClient httpClient;
    private final PricingProperties pricingProperties;

    /**
     * @throws QuoteFetchException when every feed failed; the message lists each feed's error
     */
    public BigDecimal fetchRate(String fromCurrency, String toCurrency) {
        List<String> errors = new ArrayList<>();
        try {
            return fetchFrankfurter(fromCurrency, toCurrency);
        } catch (QuoteFetchException e) {
            errors.add(FRANKFURTER + ": " + e.getMessage());
        }
        try {
            return fetchOpenErApi(fromCurrency, toCurrency);
        } catch (QuoteFetchException e) {
            errors.add(OPEN_ER_API + ": " + e.getMessage());
        }
        log.warn("FX feeds failed for {}/{}: {}", fromCurrency, toCurrency, errors);
        throw new QuoteFetchException(QuoteFetchException.Kind.TRANSPORT,
                "all providers failed (" + String.join("; ", errors) + ")");
    }

    BigDecimal fetchFrankfurter(String fromCurrency, String toCurrency) {
        String url = pricingProperties.getFx().getFrankfurterBaseUrl()
                + "/latest?from=" + fromCurrency + "&to=" + toCurrency;
        JsonNode root = readTree(httpClient.get(url, HEADERS));
        return positiveRate(root.path("rates").path(toCurrency));
    }

    BigDecimal fetchOpenErApi(String fromCurrency, String toCurrency) {
        String url = pricingProperties.getFx().getOpenErApiBaseUrl() + "/latest/" + fromCurrency;
        JsonNode root = readTree(httpClient.get(url, HEADERS));
        String result = root.path("result").asText("");
        if (!result.isEmpty() && !"success".equalsIgnoreCase(result)) {
            throw new QuoteFetchException(QuoteFetchException.Kind.PARSE, "provider status: " + result);
        }
        return positiveRate(root.path("rates").path(toCurrency));
    }

    private static BigDecimal positiveRate(JsonNode node) {
        if (!node.isNumber() || node.decimalValue().signum() <= 0) {
            throw new QuoteFetchException(QuoteFetchException.Kind.PARSE, "rate missing in response");
        }
        return node.decimalValue();
    }

    private static JsonNode readTree(String json) {
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw QuoteFetchException.parse("decode response: " + e.getOriginalMessage(), e);
        }
    }
}
