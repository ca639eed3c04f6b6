package io.parley.core.session;

import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * The session bound to the calling thread. A binding exists only inside a {@link SessionScope}
 * or inside work wrapped with {@link #wrap(Callable)}.
 */
public final class SessionContext {
    private static final ThreadLocal<Session> CURRENT = new ThreadLocal<>();

    private SessionContext() {
    }

    public static Session current() {
        Session session = CURRENT.get();
        if (session == null) {
            throw new MissingSessionContextException(
                "No session is bound to thread " + Thread.currentThread().getName()
                    + "; enter a SessionScope before running session work"
            );
        }
        return session;
    }

    public static Optional<Session> find() {
        return Optional.ofNullable(CURRENT.get());
    }

    public static boolean isActive() {
        return CURRENT.get() != null;
    }

    /** Captures the current session so {@code task} sees it when run on another thread. */
    public static <T> Callable<T> wrap(Callable<T> task) {
        Session captured = current();
        return () -> {
            Session previous = bind(captured);
            try {
                return task.call();
            } finally {
                restore(previous);
            }
        };
    }

    public static Runnable wrap(Runnable task) {
        Session captured = current();
        return () -> {
            Session previous = bind(captured);
            try {
                task.run();
            } finally {
                restore(previous);
            }
        };
    }

    static Session bind(Session session) {
        Session previous = CURRENT.get();
        CURRENT.set(session);
        return previous;
    }

    static void restore(Session previous) {
        if (previous == null) {
            CURRENT.remove();
        } else {
            CURRENT.set(previous);
        }
    }
}
