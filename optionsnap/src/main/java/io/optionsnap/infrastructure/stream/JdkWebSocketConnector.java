package io.optionsnap.infrastructure.stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * StreamConnector backed by {@link java.net.http.WebSocket}.
 *
 * Text fragments are reassembled before delivery, and the next frame is only
 * requested after the listener returns, so a connection's frames are handled
 * one at a time in arrival order.
 */
public final class JdkWebSocketConnector implements StreamConnector {
    private static final Logger log = LoggerFactory.getLogger(JdkWebSocketConnector.class);

    private final HttpClient httpClient;
    private final Duration connectTimeout;

    public JdkWebSocketConnector(Duration connectTimeout) {
        this(HttpClient.newBuilder().connectTimeout(connectTimeout).build(), connectTimeout);
    }

    public JdkWebSocketConnector(HttpClient httpClient, Duration connectTimeout) {
        this.httpClient = httpClient;
        this.connectTimeout = connectTimeout;
    }

    @Override
    public CompletableFuture<StreamConnection> connect(URI uri, StreamListener listener) {
        return httpClient.newWebSocketBuilder()
            .connectTimeout(connectTimeout)
            .buildAsync(uri, new ListenerAdapter(listener))
            .thenApply(JdkConnection::new);
    }

    private static final class ListenerAdapter implements WebSocket.Listener {
        private final StreamListener listener;
        private final StringBuilder buf = new StringBuilder();

        ListenerAdapter(StreamListener listener) {
            this.listener = listener;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            buf.append(data);
            if (last) {
                String frame = buf.toString();
                buf.setLength(0);
                listener.onFrame(frame);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            listener.onClosed(statusCode, reason);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            listener.onError(error);
        }
    }

    private static final class JdkConnection implements StreamConnection {
        private final WebSocket webSocket;

        JdkConnection(WebSocket webSocket) {
            this.webSocket = webSocket;
        }

        @Override
        public void close() {
            if (webSocket.isOutputClosed()) {
                webSocket.abort();
                return;
            }
            webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "bye")
                .whenComplete((ws, error) -> {
                    if (error != null) {
                        log.debug("[WS] Close handshake failed, aborting: {}", error.getMessage());
                    }
                    webSocket.abort();
                });
        }
    }
}
