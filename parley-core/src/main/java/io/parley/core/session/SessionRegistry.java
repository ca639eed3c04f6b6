package io.parley.core.session;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns every live {@link Session}. One session exists per owner; anonymous callers get a fresh
 * session each time they arrive without a session id.
 *
 * <p>Sessions idle for longer than the configured timeout are expired by {@link #expireIdle()},
 * and the least recently used session is evicted when a new one would exceed capacity. A session
 * with an open {@link SessionScope} is never expired or evicted.
 */
public final class SessionRegistry implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(SessionRegistry.class);

    private final SessionSettings settings;
    private final CredentialProvider credentialProvider;
    private final Clock clock;
    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final Map<String, String> sessionIdByOwner = new ConcurrentHashMap<>();
    private ScheduledExecutorService sweeper;

    public SessionRegistry(SessionSettings settings, CredentialProvider credentialProvider) {
        this(settings, credentialProvider, Clock.systemUTC());
    }

    public SessionRegistry(SessionSettings settings, CredentialProvider credentialProvider, Clock clock) {
        this.settings = settings == null ? SessionSettings.defaults() : settings;
        this.credentialProvider = credentialProvider == null ? CredentialProvider.none() : credentialProvider;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public synchronized Session getOrCreate(String ownerId) {
        String owner = ownerId == null || ownerId.isBlank() ? null : ownerId;
        if (owner != null) {
            Session existing = liveSessionOf(owner);
            if (existing != null) {
                existing.touch();
                return existing;
            }
        }
        while (sessions.size() >= settings.maxSessions()) {
            if (!evictLeastRecentlyUsed()) {
                LOG.warn("Session capacity {} reached and every session is in use; admitting over capacity",
                    settings.maxSessions());
                break;
            }
        }

        SessionCredentials credentials = owner == null
            ? SessionCredentials.empty()
            : credentialProvider.lookup(owner).orElse(SessionCredentials.empty());
        Session session = new Session(owner, credentials, clock);
        sessions.put(session.sessionId(), session);
        if (owner != null) {
            sessionIdByOwner.put(owner, session.sessionId());
        }
        LOG.info("Created session {} for {} ({} active)", session.sessionId(),
            owner == null ? "anonymous" : owner, sessions.size());
        return session;
    }

    /** Looks up a live session by id. A session found idle past the timeout is expired on the spot. */
    public synchronized Optional<Session> find(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return Optional.empty();
        }
        Session session = sessions.get(sessionId);
        if (session == null || session.isClosed()) {
            return Optional.empty();
        }
        if (session.isIdle(settings.timeout(), clock.instant()) && retire(session)) {
            LOG.info("Session {} had expired before lookup", session.sessionId());
            return Optional.empty();
        }
        session.touch();
        return Optional.of(session);
    }

    /**
     * Returns the session named by {@code sessionId} when it is live and belongs to the caller,
     * otherwise the owner's session, creating one if needed.
     */
    public Session resolve(String ownerId, String sessionId) {
        Optional<Session> byId = find(sessionId);
        if (byId.isPresent()) {
            Session session = byId.get();
            boolean sameOwner = ownerId == null || ownerId.isBlank()
                || session.ownerId().map(ownerId::equals).orElse(false);
            if (sameOwner) {
                return session;
            }
            LOG.warn("Session {} does not belong to owner {}; resolving by owner", sessionId, ownerId);
        }
        return getOrCreate(ownerId);
    }

    public SessionScope enter(Session session) {
        return SessionScope.open(session);
    }

    /** Removes every idle, unpinned session and returns how many were removed. */
    public synchronized int expireIdle() {
        Instant now = clock.instant();
        int expired = 0;
        for (Session session : new ArrayList<>(sessions.values())) {
            if (session.isIdle(settings.timeout(), now) && retire(session)) {
                expired++;
                LOG.info("Expired idle session {} (last access {})", session.sessionId(), session.lastAccessTime());
            }
        }
        if (expired > 0) {
            LOG.info("Session sweep removed {} sessions, {} active", expired, sessions.size());
        }
        return expired;
    }

    public synchronized boolean remove(String sessionId) {
        Session session = sessions.get(sessionId);
        return session != null && retire(session);
    }

    public int size() {
        return sessions.size();
    }

    public List<Session> sessions() {
        return sessions.values().stream()
            .sorted(Comparator.comparing(Session::createdAt))
            .toList();
    }

    public SessionSettings settings() {
        return settings;
    }

    public synchronized void start() {
        if (sweeper != null) {
            return;
        }
        sweeper = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "parley-session-sweeper");
            thread.setDaemon(true);
            return thread;
        });
        long periodMs = settings.sweepInterval().toMillis();
        sweeper.scheduleAtFixedRate(this::sweepQuietly, periodMs, periodMs, TimeUnit.MILLISECONDS);
        LOG.info("Session sweeper started (timeout={}, interval={}, max={})",
            settings.timeout(), settings.sweepInterval(), settings.maxSessions());
    }

    @Override
    public synchronized void close() {
        if (sweeper != null) {
            sweeper.shutdownNow();
            sweeper = null;
        }
        for (Session session : new ArrayList<>(sessions.values())) {
            session.cleanup();
        }
        sessions.clear();
        sessionIdByOwner.clear();
    }

    private void sweepQuietly() {
        try {
            expireIdle();
        } catch (RuntimeException e) {
            LOG.error("Session sweep failed", e);
        }
    }

    private Session liveSessionOf(String owner) {
        String sessionId = sessionIdByOwner.get(owner);
        Session session = sessionId == null ? null : sessions.get(sessionId);
        if (session == null) {
            return null;
        }
        if (session.isIdle(settings.timeout(), clock.instant()) && retire(session)) {
            LOG.info("Session {} of {} had expired; replacing it", session.sessionId(), owner);
            return null;
        }
        return session;
    }

    private boolean evictLeastRecentlyUsed() {
        List<Session> candidates = sessions.values().stream()
            .filter(session -> !session.isPinned())
            .sorted(Comparator.comparing(Session::lastAccessTime))
            .toList();
        for (Session candidate : candidates) {
            if (retire(candidate)) {
                LOG.info("Evicted least recently used session {} (last access {})",
                    candidate.sessionId(), candidate.lastAccessTime());
                return true;
            }
        }
        return false;
    }

    private boolean retire(Session session) {
        if (!session.tryRetire()) {
            return false;
        }
        sessions.remove(session.sessionId());
        session.ownerId().ifPresent(owner -> sessionIdByOwner.remove(owner, session.sessionId()));
        session.cleanup();
        return true;
    }
}
