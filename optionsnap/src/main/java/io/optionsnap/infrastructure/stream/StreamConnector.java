package io.optionsnap.infrastructure.stream;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Opens one text-frame stream connection.
 *
 * Implementations:
 * - {@link JdkWebSocketConnector}: java.net.http WebSocket
 * - scripted connectors in tests
 */
public interface StreamConnector {

    /**
     * Open a connection.
     *
     * @param uri Stream URL including the subscription query
     * @param listener Receives frames and the terminal close/error callback
     * @return future completed with the open connection, or exceptionally if the handshake fails
     */
    CompletableFuture<StreamConnection> connect(URI uri, StreamListener listener);

    /**
     * Callbacks for one connection. Frames of one connection are delivered sequentially.
     */
    interface StreamListener {

        void onFrame(String text);

        void onClosed(int statusCode, String reason);

        void onError(Throwable error);
    }

    /**
     * Handle to an open connection.
     */
    interface StreamConnection {

        /**
         * Close the connection. Safe to call more than once.
         */
        void close();
    }
}
