package com.priceradar.pricing.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Parsing helpers for provider payloads. Empty strings and "-" placeholders are treated as no data.
 */
final class QuoteValues {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private QuoteValues() {}

    static JsonNode readTree(String json) {
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw QuoteFetchException.parse("malformed JSON payload", e);
        }
    }

    /**
     * Numeric JSON value or numeric string. Missing, null, blank and "-" give empty;
     * any other non-numeric value is a PARSE failure.
     */
    static Optional<BigDecimal> number(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return Optional.empty();
        }
        if (node.isNumber()) {
            return Optional.of(node.decimalValue());
        }
        if (node.isTextual()) {
            String text = node.asText().strip();
            if (isPlaceholder(text)) {
                return Optional.empty();
            }
            try {
                return Optional.of(new BigDecimal(text));
            } catch (NumberFormatException e) {
                throw QuoteFetchException.parse("non-numeric price value '" + text + "'", e);
            }
        }
        throw QuoteFetchException.parse("unexpected price node type " + node.getNodeType(), null);
    }

    /**
     * Field from a delimited text quote; anything that is not a number counts as no data.
     */
    static Optional<BigDecimal> field(String[] fields, int index) {
        if (fields.length <= index) {
            return Optional.empty();
        }
        String text = fields[index].strip();
        if (isPlaceholder(text)) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(text));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static boolean isPlaceholder(String text) {
        return text.isEmpty() || "-".equals(text) || "--".equals(text);
    }
}
