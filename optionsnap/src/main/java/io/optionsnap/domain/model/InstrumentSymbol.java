package io.optionsnap.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Option contract identifier, e.g. {@code ETH-250301-2200-C}.
 *
 * Format: {@code UNDERLYING-YYMMDD-STRIKE-SIDE}. The raw text of every part is
 * kept so that {@link #toString()} reproduces the exchange symbol exactly.
 */
public record InstrumentSymbol(
    String underlying,       // BTC, ETH
    String expirationCode,   // yyMMdd as sent by the exchange
    String strike,           // strike price text
    OptionSide side
) {
    public static final String DELIMITER = "-";

    /** Plain decimal that fits the strike column, NUMERIC(24, 8). */
    private static final Pattern STRIKE_PATTERN = Pattern.compile("\\d{1,16}(\\.\\d{1,8})?");
    private static final int MAX_UNDERLYING_LENGTH = 16;

    private static final DateTimeFormatter EXPIRATION_FORMAT =
        DateTimeFormatter.ofPattern("uuMMdd").withResolverStyle(ResolverStyle.STRICT);

    /**
     * Parse an exchange symbol.
     *
     * @throws SymbolParseException if the symbol does not have exactly four parts
     *         or any part is malformed
     */
    public static InstrumentSymbol parse(String raw) {
        if (raw == null || raw.isEmpty()) {
            throw new SymbolParseException(raw, "empty symbol");
        }

        String[] parts = raw.split(DELIMITER, -1);
        if (parts.length != 4) {
            throw new SymbolParseException(raw, "expected 4 parts, got " + parts.length);
        }

        String underlying = parts[0];
        if (underlying.isBlank()) {
            throw new SymbolParseException(raw, "missing underlying");
        }
        if (underlying.length() > MAX_UNDERLYING_LENGTH) {
            throw new SymbolParseException(raw, "underlying longer than " + MAX_UNDERLYING_LENGTH + " characters");
        }

        try {
            LocalDate.parse(parts[1], EXPIRATION_FORMAT);
        } catch (DateTimeParseException e) {
            throw new SymbolParseException(raw, "bad expiration '" + parts[1] + "'", e);
        }

        if (!STRIKE_PATTERN.matcher(parts[2]).matches()) {
            throw new SymbolParseException(raw, "bad strike '" + parts[2] + "'");
        }

        OptionSide side;
        try {
            side = OptionSide.fromCode(parts[3]);
        } catch (SymbolParseException e) {
            throw new SymbolParseException(raw, "unknown option side '" + parts[3] + "'", e);
        }

        return new InstrumentSymbol(underlying, parts[1], parts[2], side);
    }

    /**
     * Parse without throwing. Used by filters that count and skip bad symbols.
     */
    public static Optional<InstrumentSymbol> tryParse(String raw) {
        try {
            return Optional.of(parse(raw));
        } catch (SymbolParseException e) {
            return Optional.empty();
        }
    }

    public LocalDate expirationDate() {
        return LocalDate.parse(expirationCode, EXPIRATION_FORMAT);
    }

    public BigDecimal strikePrice() {
        return new BigDecimal(strike);
    }

    /**
     * Instant at which the contract stops being collected: the expiration date
     * at the given UTC time of day.
     */
    public Instant expirationCutoff(LocalTime cutoffUtc) {
        return expirationDate().atTime(cutoffUtc).toInstant(ZoneOffset.UTC);
    }

    /**
     * True once {@code now} has reached the cutoff.
     */
    public boolean isExpiredAt(Instant now, LocalTime cutoffUtc) {
        return !now.isBefore(expirationCutoff(cutoffUtc));
    }

    /**
     * Spot pair used for the underlying price join, e.g. BTC + USDT.
     */
    public String underlyingPair(String quoteAsset) {
        return underlying + quoteAsset;
    }

    @Override
    public String toString() {
        return String.join(DELIMITER, underlying, expirationCode, strike, side.code());
    }
}
