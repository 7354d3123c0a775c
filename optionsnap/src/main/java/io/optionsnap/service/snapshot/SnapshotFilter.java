package io.optionsnap.service.snapshot;

import io.optionsnap.domain.model.InstrumentSymbol;
import io.optionsnap.domain.model.QuoteUpdate;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Decides which cached quotes make it into a snapshot.
 *
 * An entry is kept when its symbol parses, the contract has not reached its
 * expiration cutoff, and both volume and last price are numeric and positive.
 */
public final class SnapshotFilter {

    private final LocalTime expirationCutoffUtc;

    public SnapshotFilter(LocalTime expirationCutoffUtc) {
        this.expirationCutoffUtc = expirationCutoffUtc;
    }

    /**
     * Quote paired with its parsed symbol.
     */
    public record Candidate(InstrumentSymbol symbol, QuoteUpdate quote) {}

    /**
     * Outcome of filtering one cache copy.
     *
     * @param accepted Survivors, ordered by symbol text
     * @param collected Entries considered
     * @param unparsable Dropped for a malformed symbol
     * @param expired Dropped for having reached the cutoff
     * @param illiquid Dropped for missing, non-numeric or non-positive volume or last price
     */
    public record FilterResult(List<Candidate> accepted, int collected,
                               int unparsable, int expired, int illiquid) {
        public int dropped() {
            return collected - accepted.size();
        }
    }

    public FilterResult apply(Map<String, QuoteUpdate> quotes, Instant now) {
        List<Candidate> accepted = new ArrayList<>();
        int unparsable = 0;
        int expired = 0;
        int illiquid = 0;

        for (Map.Entry<String, QuoteUpdate> entry : quotes.entrySet()) {
            InstrumentSymbol symbol = InstrumentSymbol.tryParse(entry.getKey()).orElse(null);
            if (symbol == null) {
                unparsable++;
                continue;
            }
            if (symbol.isExpiredAt(now, expirationCutoffUtc)) {
                expired++;
                continue;
            }
            QuoteUpdate quote = entry.getValue();
            if (!isPositive(quote.volume()) || !isPositive(quote.last())) {
                illiquid++;
                continue;
            }
            accepted.add(new Candidate(symbol, quote));
        }

        accepted.sort(Comparator.comparing(c -> c.symbol().toString()));
        return new FilterResult(Collections.unmodifiableList(accepted), quotes.size(),
            unparsable, expired, illiquid);
    }

    /**
     * True for decimal text greater than zero. Blank or malformed text is not positive.
     */
    static boolean isPositive(String value) {
        if (value == null || value.isBlank()) {
            return false;
        }
        try {
            return new BigDecimal(value.trim()).signum() > 0;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
