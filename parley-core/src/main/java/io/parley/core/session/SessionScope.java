package io.parley.core.session;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Binds a session to the current thread for the duration of a try-with-resources block. While the
 * scope is open the session is pinned against expiry and eviction, and its turn permit serializes
 * work on the same session.
 *
 * <p>Work that outlives the scope takes over the pin and the permit through {@link #handOff()}.
 */
public final class SessionScope implements AutoCloseable {
    private final Session session;
    private final Session previous;
    private final AtomicBoolean holding = new AtomicBoolean(true);
    private boolean closed;

    private SessionScope(Session session, Session previous) {
        this.session = session;
        this.previous = previous;
    }

    static SessionScope open(Session session) {
        Objects.requireNonNull(session, "session must not be null");
        if (!session.pin()) {
            throw new IllegalStateException(session + " has expired or been evicted");
        }
        try {
            session.acquireTurn();
        } catch (RuntimeException e) {
            session.unpin();
            throw e;
        }
        session.touch();
        return new SessionScope(session, SessionContext.bind(session));
    }

    public Session session() {
        return session;
    }

    /**
     * Transfers the pin and the turn permit to the caller. Closing the scope afterwards only
     * unbinds the thread; the session stays pinned and serialized until the returned release runs.
     * The release is idempotent.
     */
    public Runnable handOff() {
        if (!holding.compareAndSet(true, false)) {
            throw new IllegalStateException("Scope of " + session + " no longer holds the session");
        }
        AtomicBoolean released = new AtomicBoolean();
        return () -> {
            if (released.compareAndSet(false, true)) {
                release();
            }
        };
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        SessionContext.restore(previous);
        if (holding.compareAndSet(true, false)) {
            release();
        }
    }

    private void release() {
        session.touch();
        session.releaseTurn();
        session.unpin();
    }
}
