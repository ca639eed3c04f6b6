package io.parley.core.session;

import io.parley.core.model.Turn;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * All mutable state belonging to one user conversation. Instances are created and destroyed by
 * {@link SessionRegistry}; the history is only mutated by the agent loop while a
 * {@link SessionScope} for this session is open.
 */
public final class Session {
    private static final Logger LOG = LoggerFactory.getLogger(Session.class);

    private final String sessionId;
    private final String conversationId;
    private final String ownerId;
    private final Clock clock;
    private final Instant createdAt;
    private final Semaphore permit = new Semaphore(1, true);
    private final AtomicInteger pins = new AtomicInteger();
    private final List<Turn> history = new ArrayList<>();
    private final Map<String, Note> notes = new LinkedHashMap<>();
    private final Map<String, Object> clients = new ConcurrentHashMap<>();

    private volatile Instant lastAccessTime;
    private volatile SessionCredentials credentials;
    private volatile boolean closed;

    Session(String ownerId, SessionCredentials credentials, Clock clock) {
        this(UUID.randomUUID().toString(), UUID.randomUUID().toString(), ownerId, credentials, clock);
    }

    Session(String sessionId, String conversationId, String ownerId, SessionCredentials credentials, Clock clock) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId must not be null");
        this.conversationId = Objects.requireNonNull(conversationId, "conversationId must not be null");
        this.ownerId = ownerId == null || ownerId.isBlank() ? null : ownerId;
        this.credentials = credentials == null ? SessionCredentials.empty() : credentials;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.createdAt = clock.instant();
        this.lastAccessTime = createdAt;
    }

    public String sessionId() {
        return sessionId;
    }

    public String conversationId() {
        return conversationId;
    }

    public Optional<String> ownerId() {
        return Optional.ofNullable(ownerId);
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant lastAccessTime() {
        return lastAccessTime;
    }

    public void touch() {
        lastAccessTime = clock.instant();
    }

    public boolean isIdle(Duration timeout, Instant now) {
        return lastAccessTime.plus(timeout).isBefore(now);
    }

    public SessionCredentials credentials() {
        return credentials;
    }

    public void updateCredentials(SessionCredentials update) {
        if (update == null || update.isEmpty()) {
            return;
        }
        credentials = credentials.mergedWith(update);
        touch();
        LOG.debug("Updated credentials for session {}: {}", sessionId, credentials);
    }

    public synchronized List<Turn> history() {
        return List.copyOf(history);
    }

    public synchronized int historySize() {
        return history.size();
    }

    public synchronized void appendTurn(Turn turn) {
        history.add(Objects.requireNonNull(turn, "turn must not be null"));
    }

    public synchronized void replaceHistory(List<Turn> turns) {
        history.clear();
        if (turns != null) {
            turns.stream().filter(Objects::nonNull).forEach(history::add);
        }
    }

    public synchronized Note addNote(String title, String content) {
        String id = String.valueOf(notes.size() + 1);
        Note note = new Note(id, title, content, clock.instant());
        notes.put(id, note);
        return note;
    }

    public synchronized List<Note> notes() {
        return List.copyOf(notes.values());
    }

    /** Returns the client cached under {@code key}, creating it with {@code factory} on first use. */
    @SuppressWarnings("unchecked")
    public <T> T client(String key, Supplier<? extends T> factory) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(factory, "factory must not be null");
        if (closed) {
            throw new IllegalStateException("Session " + sessionId + " is closed");
        }
        touch();
        return (T) clients.computeIfAbsent(key, ignored -> factory.get());
    }

    public boolean isPinned() {
        return pins.get() > 0;
    }

    public boolean isClosed() {
        return closed;
    }

    /** Returns false once the session has been retired by the registry. */
    boolean pin() {
        while (true) {
            int current = pins.get();
            if (current < 0) {
                return false;
            }
            if (pins.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    void unpin() {
        pins.updateAndGet(current -> current > 0 ? current - 1 : current);
    }

    /** Atomically marks an unpinned session as retired; a retired session can never be pinned again. */
    boolean tryRetire() {
        return pins.compareAndSet(0, -1);
    }

    /** One holder at a time; the permit may be released by a different thread than the one that took it. */
    void acquireTurn() {
        permit.acquireUninterruptibly();
    }

    void releaseTurn() {
        permit.release();
    }

    /** Releases everything the session holds. Cached clients that are closeable are closed. */
    void cleanup() {
        closed = true;
        synchronized (this) {
            history.clear();
            notes.clear();
        }
        credentials = SessionCredentials.empty();
        for (Map.Entry<String, Object> entry : clients.entrySet()) {
            if (entry.getValue() instanceof AutoCloseable closeable) {
                try {
                    closeable.close();
                } catch (Exception e) {
                    LOG.warn("Failed to close client {} of session {}", entry.getKey(), sessionId, e);
                }
            }
        }
        clients.clear();
    }

    @Override
    public String toString() {
        return "Session[" + sessionId + ", owner=" + (ownerId == null ? "anonymous" : ownerId) + "]";
    }
}
