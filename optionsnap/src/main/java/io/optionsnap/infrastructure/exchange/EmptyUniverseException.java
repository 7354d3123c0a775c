package io.optionsnap.infrastructure.exchange;

/**
 * Exception thrown when the exchange reports no option instruments at all.
 */
public class EmptyUniverseException extends RuntimeException {

    private final String endpoint;

    public EmptyUniverseException(String endpoint) {
        super(String.format("[%s] No option symbols found", endpoint));
        this.endpoint = endpoint;
    }

    public String getEndpoint() {
        return endpoint;
    }
}
