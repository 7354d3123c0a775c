package io.optionsnap.service.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.optionsnap.domain.model.QuoteUpdate;
import io.optionsnap.infrastructure.metrics.CollectorMetrics;
import io.optionsnap.infrastructure.stream.ReconnectionPolicy;
import io.optionsnap.infrastructure.stream.StreamConnector;
import io.optionsnap.infrastructure.stream.StreamSession;
import io.optionsnap.service.QuoteCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Streams ticker updates for the option universe into the quote cache.
 *
 * Symbols are split into groups of at most {@code groupSize}; each group gets
 * its own {@link StreamSession} on
 * {@code <base>?streams=SYM1@ticker/SYM2@ticker/...}. A group that drops
 * reconnects on its own after the reconnect delay; other groups keep streaming.
 *
 * Only subscribed symbols reach the cache. {@link #resubscribe(Collection)}
 * releases delisted symbols and regroups the sessions that carried them.
 *
 * Frame format:
 * <pre>
 * {"stream": "ETH-250314-2900-C@ticker", "data": {"e": "24hrTicker", "s": "ETH-250314-2900-C", "c": "105", ...}}
 * </pre>
 */
public class QuoteStreamManager {
    private static final Logger log = LoggerFactory.getLogger(QuoteStreamManager.class);

    static final String STREAM_KIND = "options";
    private static final String STREAM_SUFFIX = "@ticker";

    private final URI baseUrl;
    private final int groupSize;
    private final Duration reconnectDelay;
    private final StreamConnector connector;
    private final ScheduledExecutorService scheduler;
    private final QuoteCache quoteCache;
    private final ObjectMapper objectMapper;
    private final CollectorMetrics metrics;

    private final List<Group> groups = new CopyOnWriteArrayList<>();
    private final Set<String> subscribed = ConcurrentHashMap.newKeySet();
    private final CompletableFuture<Void> terminated = new CompletableFuture<>();

    public QuoteStreamManager(URI baseUrl, int groupSize, Duration reconnectDelay,
                              StreamConnector connector, ScheduledExecutorService scheduler,
                              QuoteCache quoteCache, ObjectMapper objectMapper, CollectorMetrics metrics) {
        if (groupSize <= 0) {
            throw new IllegalArgumentException("groupSize must be positive: " + groupSize);
        }
        this.baseUrl = baseUrl;
        this.groupSize = groupSize;
        this.reconnectDelay = reconnectDelay;
        this.connector = connector;
        this.scheduler = scheduler;
        this.quoteCache = quoteCache;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    /**
     * Changes made by {@link #resubscribe(Collection)}.
     *
     * @param added Symbols subscribed for the first time, in universe order
     * @param released Symbols no longer streamed, sorted
     * @param regrouped Sessions stopped because they carried a released symbol
     */
    public record Resubscription(List<String> added, List<String> released, int regrouped) {}

    /**
     * Open one session per group of symbols.
     *
     * @return future that completes when every session of this call has been stopped
     */
    public synchronized CompletableFuture<Void> subscribe(Collection<String> symbols) {
        List<String> fresh = new ArrayList<>();
        for (String symbol : symbols) {
            if (subscribed.add(symbol)) {
                fresh.add(symbol);
            }
        }

        CompletableFuture<Void> all = startGroups(fresh);
        log.info("[QUOTE STREAM] Subscribed {} symbols (total {} symbols, {} sessions)",
            fresh.size(), subscribed.size(), groups.size());
        return all;
    }

    /**
     * Make the streamed set equal to {@code universe}.
     *
     * Symbols outside the universe are released first, so their frames are
     * ignored from here on. Every group that carried one is stopped and its
     * remaining symbols are regrouped together with the newly listed ones.
     * Groups made only of current symbols keep their connection.
     */
    public synchronized Resubscription resubscribe(Collection<String> universe) {
        Set<String> current = new HashSet<>(universe);

        List<String> released = new ArrayList<>();
        for (String symbol : subscribed) {
            if (!current.contains(symbol)) {
                released.add(symbol);
            }
        }
        Collections.sort(released);
        released.forEach(subscribed::remove);

        List<String> regroup = new ArrayList<>();
        int stopped = 0;
        for (Group group : groups) {
            if (current.containsAll(group.symbols())) {
                continue;
            }
            group.session().stop();
            groups.remove(group);
            stopped++;
            for (String symbol : group.symbols()) {
                if (current.contains(symbol)) {
                    regroup.add(symbol);
                }
            }
        }

        List<String> added = new ArrayList<>();
        for (String symbol : universe) {
            if (subscribed.add(symbol)) {
                added.add(symbol);
            }
        }
        regroup.addAll(added);
        startGroups(regroup);

        log.info("[QUOTE STREAM] Resubscribed: +{} symbols, -{} symbols, {} sessions regrouped (total {} symbols, {} sessions)",
            added.size(), released.size(), stopped, subscribed.size(), groups.size());
        return new Resubscription(added, released, stopped);
    }

    /**
     * Stop every session. Their termination futures complete.
     */
    public void stop() {
        for (Group group : groups) {
            group.session().stop();
        }
        log.info("[QUOTE STREAM] Stopped {} sessions", groups.size());
        terminated.complete(null);
    }

    /**
     * Completes once {@link #stop()} has run, whatever was subscribed.
     */
    public CompletableFuture<Void> termination() {
        return terminated;
    }

    public synchronized Set<String> subscribedSymbols() {
        return Set.copyOf(subscribed);
    }

    public List<StreamSession> sessions() {
        List<StreamSession> sessions = new ArrayList<>();
        for (Group group : groups) {
            sessions.add(group.session());
        }
        return sessions;
    }

    /**
     * Apply one inbound frame to the quote cache. Frames for symbols that are
     * not subscribed (a released symbol on a session still closing) are ignored.
     *
     * @throws IllegalArgumentException if the frame is not JSON or carries no symbol
     */
    void handleFrame(String text) {
        JsonNode data;
        try {
            data = objectMapper.readTree(text).path("data");
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON frame: " + e.getOriginalMessage(), e);
        }
        String symbol = data.path("s").asText("");
        if (symbol.isEmpty()) {
            throw new IllegalArgumentException("Frame without data.s");
        }

        if (!subscribed.contains(symbol)) {
            return;
        }

        quoteCache.upsert(QuoteUpdate.fromTicker(data));
        // Released while this frame was applied: undo, the refresh prune may already have run
        if (!subscribed.contains(symbol)) {
            quoteCache.remove(symbol);
            return;
        }
        metrics.recordStreamMessage(STREAM_KIND);
    }

    private CompletableFuture<Void> startGroups(List<String> symbols) {
        List<List<String>> parts = partition(symbols, groupSize);
        CompletableFuture<?>[] terminations = new CompletableFuture<?>[parts.size()];
        for (int i = 0; i < parts.size(); i++) {
            terminations[i] = startSession(parts.get(i));
        }
        return CompletableFuture.allOf(terminations);
    }

    private CompletableFuture<Void> startSession(List<String> group) {
        String name = group.get(0) + ".." + group.get(group.size() - 1) + " (" + group.size() + ")";
        StreamSession session = new StreamSession(
            name,
            STREAM_KIND,
            streamUri(baseUrl, group, STREAM_SUFFIX),
            connector,
            ReconnectionPolicy.fixedDelay(reconnectDelay),
            scheduler,
            this::handleFrame,
            metrics
        );
        groups.add(new Group(group, session));
        return session.start();
    }

    private record Group(List<String> symbols, StreamSession session) {}

    /**
     * Split into consecutive groups of at most {@code size}, preserving order.
     */
    public static <T> List<List<T>> partition(List<T> items, int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("size must be positive: " + size);
        }
        List<List<T>> groups = new ArrayList<>();
        for (int from = 0; from < items.size(); from += size) {
            groups.add(List.copyOf(items.subList(from, Math.min(from + size, items.size()))));
        }
        return groups;
    }

    /**
     * Combined-stream URL: {@code base?streams=a<suffix>/b<suffix>}.
     */
    static URI streamUri(URI base, List<String> names, String suffix) {
        StringBuilder sb = new StringBuilder(base.toString()).append("?streams=");
        for (int i = 0; i < names.size(); i++) {
            if (i > 0) {
                sb.append('/');
            }
            sb.append(names.get(i)).append(suffix);
        }
        return URI.create(sb.toString());
    }
}
