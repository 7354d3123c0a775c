package io.optionsnap.domain.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Latest 24h ticker state for one option symbol.
 *
 * Values are kept as the exchange's decimal text. Only the snapshot filter
 * parses volume and last price.
 */
public record QuoteUpdate(
    String symbol,
    long eventTime,          // E, epoch millis
    String open,             // o
    String high,             // h
    String low,              // l
    String last,             // c
    String volume,           // V, contracts
    String quoteVolume,      // A, quote asset
    String tradeCount,       // n
    String bidPrice,         // bo
    String askPrice,         // ao
    String bidQty,           // bq
    String askQty,           // aq
    String buyImpliedVol,    // b
    String sellImpliedVol,   // a
    String delta,            // d
    String theta,            // t
    String gamma,            // g
    String vega,             // v
    String markImpliedVol,   // vo
    String markPrice         // mp
) {
    /**
     * Build from the {@code data} object of a {@code SYMBOL@ticker} frame.
     * Missing fields become empty strings.
     */
    public static QuoteUpdate fromTicker(JsonNode data) {
        return new QuoteUpdate(
            text(data, "s"),
            data.path("E").asLong(0L),
            text(data, "o"),
            text(data, "h"),
            text(data, "l"),
            text(data, "c"),
            text(data, "V"),
            text(data, "A"),
            text(data, "n"),
            text(data, "bo"),
            text(data, "ao"),
            text(data, "bq"),
            text(data, "aq"),
            text(data, "b"),
            text(data, "a"),
            text(data, "d"),
            text(data, "t"),
            text(data, "g"),
            text(data, "v"),
            text(data, "vo"),
            text(data, "mp")
        );
    }

    private static String text(JsonNode data, String field) {
        JsonNode node = data.get(field);
        if (node == null || node.isNull()) {
            return "";
        }
        return node.asText("");
    }
}
