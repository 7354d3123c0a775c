package io.optionsnap.infrastructure.stream;

import io.optionsnap.infrastructure.metrics.CollectorMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * One long-lived stream connection with automatic reconnect.
 *
 * Lifecycle:
 *   start() → CONNECTING → CONNECTED → (lost) → WAITING → CONNECTING → ...
 *   stop()  → STOPPED, termination future completes
 *
 * Every connect failure, error or close from the server is handed to the
 * {@link ReconnectionPolicy}; the next attempt is scheduled on the shared
 * scheduler so a waiting session never holds a thread. Sessions share nothing
 * but the scheduler, so one session's outage does not delay another.
 *
 * Frame handler exceptions are logged and counted; they never close the connection.
 */
public final class StreamSession {
    private static final Logger log = LoggerFactory.getLogger(StreamSession.class);

    public enum State { NEW, CONNECTING, CONNECTED, WAITING, STOPPED }

    private final String name;
    private final String streamKind;
    private final URI uri;
    private final StreamConnector connector;
    private final ReconnectionPolicy policy;
    private final ScheduledExecutorService scheduler;
    private final Consumer<String> frameHandler;
    private final CollectorMetrics metrics;

    private final AtomicReference<State> state = new AtomicReference<>(State.NEW);
    private final AtomicReference<Attempt> current = new AtomicReference<>();
    private final CompletableFuture<Void> termination = new CompletableFuture<>();

    /**
     * @param name Label used in logs, e.g. the first and last symbol of a group
     * @param streamKind Metrics label ("options", "underlying")
     */
    public StreamSession(String name, String streamKind, URI uri, StreamConnector connector,
                         ReconnectionPolicy policy, ScheduledExecutorService scheduler,
                         Consumer<String> frameHandler, CollectorMetrics metrics) {
        this.name = name;
        this.streamKind = streamKind;
        this.uri = uri;
        this.connector = connector;
        this.policy = policy;
        this.scheduler = scheduler;
        this.frameHandler = frameHandler;
        this.metrics = metrics;
    }

    /**
     * Begin connecting. Returns a future that completes only when the session is
     * stopped (or a bounded policy gives up).
     */
    public CompletableFuture<Void> start() {
        if (!state.compareAndSet(State.NEW, State.CONNECTING)) {
            throw new IllegalStateException("Session " + name + " already started");
        }
        submit(this::connect, Duration.ZERO);
        return termination;
    }

    /**
     * Close the connection and stop reconnecting.
     */
    public void stop() {
        State previous = state.getAndSet(State.STOPPED);
        if (previous == State.STOPPED) {
            return;
        }
        Attempt attempt = current.getAndSet(null);
        if (attempt != null) {
            attempt.closeQuietly();
        }
        if (previous == State.CONNECTED) {
            metrics.recordStopped(streamKind);
        }
        log.info("[STREAM {}] Stopped", name);
        termination.complete(null);
    }

    public State getState() {
        return state.get();
    }

    public String getName() {
        return name;
    }

    private void connect() {
        if (state.get() == State.STOPPED) {
            return;
        }
        state.set(State.CONNECTING);

        Attempt attempt = new Attempt();
        current.set(attempt);
        log.debug("[STREAM {}] Connecting to {}", name, uri.getHost());

        CompletableFuture<StreamConnector.StreamConnection> future;
        try {
            future = connector.connect(uri, attempt);
        } catch (RuntimeException e) {
            onLost(attempt, "connect_failed", "connect failed: " + e.getMessage());
            return;
        }

        future.whenComplete((connection, error) -> {
            if (error != null) {
                Throwable cause = error.getCause() != null ? error.getCause() : error;
                onLost(attempt, "connect_failed", "connect failed: " + cause.getMessage());
                return;
            }
            attempt.connection = connection;
            if (state.get() == State.STOPPED || attempt.lost.get()) {
                connection.close();
                return;
            }
            if (state.compareAndSet(State.CONNECTING, State.CONNECTED)) {
                attempt.connected = true;
                policy.recordSuccess();
                metrics.recordConnected(streamKind);
                log.info("[STREAM {}] ✓ Connected", name);
            }
        });
    }

    /**
     * Handles the first loss signal of an attempt. Later signals for the same
     * attempt (e.g. onError followed by onClosed) are ignored.
     */
    private void onLost(Attempt attempt, String reasonLabel, String detail) {
        if (!attempt.lost.compareAndSet(false, true)) {
            return;
        }
        if (state.get() == State.STOPPED || current.get() != attempt) {
            return;
        }
        attempt.closeQuietly();

        metrics.recordDisconnected(streamKind, reasonLabel, attempt.connected);
        policy.recordFailure();

        if (!policy.shouldRetry()) {
            log.error("[STREAM {}] {}. Giving up after {} attempts", name, detail, policy.getAttemptCount());
            state.set(State.STOPPED);
            termination.complete(null);
            return;
        }

        Duration delay = policy.getNextDelay();
        state.set(State.WAITING);
        log.error("[STREAM {}] {}. Reconnecting in {}s (attempt #{})",
            name, detail, delay.toSeconds(), policy.getAttemptCount());
        submit(this::connect, delay);
    }

    private void submit(Runnable task, Duration delay) {
        try {
            scheduler.schedule(() -> {
                try {
                    task.run();
                } catch (Exception e) {
                    log.error("[STREAM {}] Unexpected error in connect task: {}", name, e.getMessage(), e);
                }
            }, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("[STREAM {}] Scheduler shut down, session ends", name);
            state.set(State.STOPPED);
            termination.complete(null);
        }
    }

    /**
     * One connection attempt. Also the listener for that connection, so callbacks
     * from a superseded connection can be recognised and ignored.
     */
    private final class Attempt implements StreamConnector.StreamListener {
        private final AtomicBoolean lost = new AtomicBoolean(false);
        private volatile StreamConnector.StreamConnection connection;
        private volatile boolean connected;

        @Override
        public void onFrame(String text) {
            if (lost.get() || state.get() == State.STOPPED) {
                return;
            }
            try {
                frameHandler.accept(text);
            } catch (Exception e) {
                metrics.recordMalformedFrame(streamKind);
                log.debug("[STREAM {}] Dropped frame: {}", name, e.getMessage());
            }
        }

        @Override
        public void onClosed(int statusCode, String reason) {
            onLost(this, "closed", "Connection closed by server (" + statusCode + " " + reason + ")");
        }

        @Override
        public void onError(Throwable error) {
            onLost(this, "error", "Connection error: " + error.getMessage());
        }

        void closeQuietly() {
            StreamConnector.StreamConnection c = connection;
            if (c == null) {
                return;
            }
            try {
                c.close();
            } catch (Exception e) {
                log.debug("[STREAM {}] Error closing connection: {}", name, e.getMessage());
            }
        }
    }
}
