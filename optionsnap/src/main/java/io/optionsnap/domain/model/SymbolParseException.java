package io.optionsnap.domain.model;

/**
 * Thrown when an option symbol does not decompose into
 * underlying, expiration, strike and side.
 */
public class SymbolParseException extends RuntimeException {

    private final String symbol;

    public SymbolParseException(String symbol, String message) {
        super(String.format("Invalid option symbol '%s': %s", symbol, message));
        this.symbol = symbol;
    }

    public SymbolParseException(String symbol, String message, Throwable cause) {
        super(String.format("Invalid option symbol '%s': %s", symbol, message), cause);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
