package io.optionsnap.infrastructure.exchange;

/**
 * Exception thrown when an exchange endpoint cannot be reached or returns an
 * unusable response (non-2xx status, undecodable body).
 */
public class TransportException extends RuntimeException {

    private final String endpoint;

    public TransportException(String endpoint, String message) {
        super(String.format("[%s] %s", endpoint, message));
        this.endpoint = endpoint;
    }

    public TransportException(String endpoint, String message, Throwable cause) {
        super(String.format("[%s] %s", endpoint, message), cause);
        this.endpoint = endpoint;
    }

    public String getEndpoint() {
        return endpoint;
    }
}
