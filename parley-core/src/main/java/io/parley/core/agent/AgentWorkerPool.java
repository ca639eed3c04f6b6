package io.parley.core.agent;

import io.parley.core.session.Session;
import io.parley.core.session.SessionContext;
import io.parley.core.session.SessionScope;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs agent work on a bounded pool of worker threads with a per-request deadline. Work is
 * submitted from inside a session scope and sees the same session on the worker thread.
 *
 * <p>When the deadline passes while the work is still running, the caller gets an
 * {@link AgentTimeoutException} at once and the worker takes over the scope's pin and turn permit.
 * The session stays pinned and no other request on it proceeds until the worker has finished.
 */
public final class AgentWorkerPool implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(AgentWorkerPool.class);
    public static final Duration DEFAULT_DEADLINE = Duration.ofMinutes(2);

    private static final int PENDING = 0;
    private static final int RUNNING = 1;
    private static final int FINISHED = 2;
    private static final int ABANDONED = 3;

    private final ExecutorService executor;
    private final Duration deadline;

    public AgentWorkerPool(int workers) {
        this(workers, DEFAULT_DEADLINE);
    }

    public AgentWorkerPool(int workers, Duration deadline) {
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be > 0");
        }
        this.deadline = deadline == null || deadline.isNegative() || deadline.isZero() ? DEFAULT_DEADLINE : deadline;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(workers, runnable -> {
            Thread thread = new Thread(runnable, "parley-agent-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public Duration deadline() {
        return deadline;
    }

    public <T> T run(SessionScope scope, Callable<T> work) throws Exception {
        Objects.requireNonNull(scope, "scope must not be null");
        Session session = SessionContext.current();
        if (session != scope.session()) {
            throw new IllegalStateException("Scope of " + scope.session() + " is not bound to this thread");
        }
        Callable<T> bound = SessionContext.wrap(work);
        AtomicInteger state = new AtomicInteger(PENDING);
        AtomicReference<Runnable> release = new AtomicReference<>();
        Future<T> future = executor.submit(() -> {
            if (!state.compareAndSet(PENDING, RUNNING)) {
                return null;
            }
            try {
                return bound.call();
            } finally {
                if (!state.compareAndSet(RUNNING, FINISHED)) {
                    release.get().run();
                    LOG.info("Abandoned agent work for session {} finished; session released", session.sessionId());
                }
            }
        });
        try {
            return future.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            abandon(scope, state, release);
            LOG.warn("Agent work for session {} exceeded the {}s deadline and was cancelled",
                session.sessionId(), deadline.toSeconds());
            throw new AgentTimeoutException(session.sessionId(), deadline);
        } catch (InterruptedException e) {
            future.cancel(true);
            abandon(scope, state, release);
            Thread.currentThread().interrupt();
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    /** Leaves the session with the worker if it is still running, otherwise releases it here. */
    private static void abandon(SessionScope scope, AtomicInteger state, AtomicReference<Runnable> release) {
        release.set(scope.handOff());
        if (state.getAndSet(ABANDONED) != RUNNING) {
            release.get().run();
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
