package io.optionsnap.infrastructure.exchange;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Binance European Options instrument fetcher.
 *
 * URL: https://eapi.binance.com/eapi/v1/exchangeInfo
 *
 * Response (abridged):
 * <pre>
 * {
 *   "optionSymbols": [
 *     {"symbol": "ETH-250301-2200-C", "side": "CALL", "strikePrice": "2200",
 *      "underlying": "ETHUSDT", "expiryDate": 1740816000000, ...}
 *   ]
 * }
 * </pre>
 *
 * Keeps symbols whose underlying, with the quote asset suffix removed, is in
 * the allow-list ("ETHUSDT" → "ETH").
 */
public class BinanceOptionsInstrumentFetcher implements InstrumentFetcher {
    private static final Logger log = LoggerFactory.getLogger(BinanceOptionsInstrumentFetcher.class);

    private final HttpClient httpClient;
    private final URI exchangeInfoUrl;
    private final Set<String> allowedUnderlyings;
    private final String quoteAsset;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public BinanceOptionsInstrumentFetcher(HttpClient httpClient, URI exchangeInfoUrl,
                                           Set<String> allowedUnderlyings, String quoteAsset,
                                           ObjectMapper objectMapper, Duration timeout) {
        this.httpClient = httpClient;
        this.exchangeInfoUrl = exchangeInfoUrl;
        this.allowedUnderlyings = Set.copyOf(allowedUnderlyings);
        this.quoteAsset = quoteAsset;
        this.objectMapper = objectMapper;
        this.timeout = timeout;
    }

    @Override
    public List<String> fetchUniverse() {
        String endpoint = exchangeInfoUrl.toString();
        log.info("[BinanceOptionsInstrumentFetcher] Fetching instruments from {}", endpoint);
        long startTime = System.currentTimeMillis();

        HttpRequest request = HttpRequest.newBuilder()
            .uri(exchangeInfoUrl)
            .timeout(timeout)
            .header("Accept", "application/json")
            .GET()
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TransportException(endpoint, "Request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(endpoint, "Interrupted while fetching instruments", e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new TransportException(endpoint, "Failed to fetch instruments: HTTP " + response.statusCode());
        }

        List<String> symbols = parseSymbols(endpoint, response.body());

        long elapsed = System.currentTimeMillis() - startTime;
        log.info("[BinanceOptionsInstrumentFetcher] Fetched {} symbols for {} in {}ms",
            symbols.size(), allowedUnderlyings, elapsed);
        return symbols;
    }

    @Override
    public String getExchangeCode() {
        return "BINANCE_OPTIONS";
    }

    private List<String> parseSymbols(String endpoint, String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new TransportException(endpoint, "Invalid JSON: " + e.getOriginalMessage(), e);
        }

        JsonNode optionSymbols = root == null ? null : root.get("optionSymbols");
        if (optionSymbols == null || !optionSymbols.isArray() || optionSymbols.isEmpty()) {
            throw new EmptyUniverseException(endpoint);
        }

        Set<String> symbols = new LinkedHashSet<>();
        int skipped = 0;
        for (JsonNode option : optionSymbols) {
            String symbol = option.path("symbol").asText("");
            String underlying = option.path("underlying").asText("");
            if (symbol.isEmpty() || underlying.isEmpty()) {
                skipped++;
                continue;
            }
            if (allowedUnderlyings.contains(baseAsset(underlying))) {
                symbols.add(symbol);
            }
        }

        if (skipped > 0) {
            log.warn("[BinanceOptionsInstrumentFetcher] Skipped {} descriptors without symbol/underlying", skipped);
        }
        return new ArrayList<>(symbols);
    }

    /**
     * "BTCUSDT" → "BTC" for quote asset USDT. Other suffixes are left as-is.
     */
    String baseAsset(String underlying) {
        String upper = underlying.toUpperCase(Locale.ROOT);
        if (upper.endsWith(quoteAsset) && upper.length() > quoteAsset.length()) {
            return upper.substring(0, upper.length() - quoteAsset.length());
        }
        return upper;
    }
}
