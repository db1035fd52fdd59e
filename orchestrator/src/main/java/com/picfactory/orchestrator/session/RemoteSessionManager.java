package com.picfactory.orchestrator.session;

import com.picfactory.orchestrator.config.PicFactoryProperties;
import com.picfactory.orchestrator.event.ListenerRegistry;
import com.picfactory.orchestrator.event.Subscription;
import com.picfactory.orchestrator.model.AuthStage;
import com.picfactory.orchestrator.model.AuthState;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Owns every browser session and the last known login state.
 *
 * All browser work runs on one "browser-driver" thread: Playwright objects
 * must not be shared across threads. Callers hand work to that thread and
 * block for the result.
 *
 * Two kinds of session:
 *   - the manual session: visible, opened on request so a human can log in
 *     and pass verification; kept until it dies
 *   - task sessions: launched per task when no live manual session exists,
 *     closed when the task's lease is released
 *
 * While any task holds a lease the manager reports BUSY instead of probing.
 */
@Service
public class RemoteSessionManager {

    private static final Logger log = LoggerFactory.getLogger(RemoteSessionManager.class);

    static final String MSG_NOT_CHECKED    = "login status not checked yet";
    static final String MSG_BUSY_CHECK     = "A task is running; check the login status again later.";
    static final String MSG_BUSY_OPEN      = "A task is running; the interactive window cannot be opened right now.";
    static final String MSG_NO_SESSION     = "Open the interactive session first and complete verification and login in the visible window.";
    static final String MSG_CHECKING       = "Checking login status...";
    static final String MSG_LOGGED_IN      = "Logged in; tasks can run.";
    static final String MSG_LOGGED_OUT     = "Not logged in or the login expired; open the interactive session and log in.";
    static final String MSG_UNRECOGNIZED   = "Page layout not recognized; open the interactive session to confirm the login status.";

    private final SessionFactory               sessionFactory;
    private final PicFactoryProperties.Browser config;
    private final Clock                        clock;
    private final ExecutorService              driver;
    private final AtomicInteger                runningTasks = new AtomicInteger();
    private final ListenerRegistry<AuthState>  authListeners = new ListenerRegistry<>("auth-state");

    // Driver thread only.
    private RemoteSession manualSession;

    private volatile AuthState authState;

    public RemoteSessionManager(SessionFactory sessionFactory, PicFactoryProperties properties, Clock clock) {
        this.sessionFactory = sessionFactory;
        this.config         = properties.getBrowser();
        this.clock          = clock;
        this.driver         = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "browser-driver");
            t.setDaemon(true);
            return t;
        });
        this.authState = new AuthState(AuthStage.UNKNOWN, clock.instant(), MSG_NOT_CHECKED);
    }

    public Subscription onAuthState(Consumer<? super AuthState> listener) {
        return authListeners.subscribe(listener);
    }

    public AuthState authState() {
        return authState;
    }

    public boolean isBusy() {
        return runningTasks.get() > 0;
    }

    // ------------------------------------------------------------------
    // Login status
    // ------------------------------------------------------------------

    /**
     * Probe the manual session for the login state.
     *
     * Transitions:
     *   task running            → BUSY (no probe)
     *   no live manual session  → UNKNOWN
     *   otherwise               → CHECKING, then LOGGED_IN | LOGGED_OUT | UNKNOWN,
     *                             or ERROR when the probe itself fails
     */
    public AuthState checkAuthStatus() {
        if (isBusy()) {
            return update(AuthStage.BUSY, MSG_BUSY_CHECK);
        }
        return onDriverThread(() -> {
            if (!manualSessionAlive()) {
                manualSession = null;
                return update(AuthStage.UNKNOWN, MSG_NO_SESSION);
            }
            update(AuthStage.CHECKING, MSG_CHECKING);
            try {
                return switch (manualSession.probe()) {
                    case INPUT_READY  -> update(AuthStage.LOGGED_IN, MSG_LOGGED_IN);
                    case LOGIN_PROMPT -> update(AuthStage.LOGGED_OUT, MSG_LOGGED_OUT);
                    case UNRECOGNIZED -> update(AuthStage.UNKNOWN, MSG_UNRECOGNIZED);
                };
            } catch (RuntimeException e) {
                log.warn("Login status probe failed: {}", e.getMessage());
                if (!manualSessionAlive()) {
                    manualSession = null;
                }
                return update(AuthStage.ERROR, SessionErrors.describe("Login status check failed", e));
            }
        });
    }

    /**
     * Open (or re-focus) the visible manual session on the remote surface,
     * then re-probe the login state.
     */
    public AuthState openInteractiveSession() {
        if (isBusy()) {
            return update(AuthStage.BUSY, MSG_BUSY_OPEN);
        }
        AuthState failure = onDriverThread(() -> {
            try {
                if (!manualSessionAlive()) {
                    closeQuietly(manualSession);
                    manualSession = sessionFactory.launch(false);
                }
                manualSession.page(true);
                manualSession.bringToFront();
                return null;
            } catch (RuntimeException e) {
                log.warn("Could not open the interactive session: {}", e.getMessage());
                return update(AuthStage.ERROR, SessionErrors.describe("Opening the remote surface failed", e));
            }
        });
        return failure != null ? failure : checkAuthStatus();
    }

    public AuthState markLoggedIn() {
        return update(AuthStage.LOGGED_IN, MSG_LOGGED_IN);
    }

    public AuthState markLoggedOut(String message) {
        return update(AuthStage.LOGGED_OUT, message);
    }

    // ------------------------------------------------------------------
    // Task sessions
    // ------------------------------------------------------------------

    /**
     * Run {@code work} on the driver thread with a leased session and return
     * its result. Exceptions thrown by {@code work} reach the caller unchanged.
     */
    public <T> T withTaskSession(Function<RemoteSession, T> work) {
        runningTasks.incrementAndGet();
        try {
            return onDriverThread(() -> {
                try (TaskLease lease = acquireForTask()) {
                    return work.apply(lease.session());
                }
            });
        } finally {
            runningTasks.decrementAndGet();
        }
    }

    /**
     * Lease the manual session when it is alive, otherwise a fresh session
     * (headless per configuration) that is closed with the lease.
     * Driver thread only.
     */
    TaskLease acquireForTask() {
        if (manualSessionAlive()) {
            return new TaskLease(manualSession, false);
        }
        manualSession = null;
        return new TaskLease(sessionFactory.launch(config.isHeadless()), true);
    }

    /** A session held for one task attempt. */
    static final class TaskLease implements AutoCloseable {

        private final RemoteSession session;
        private final boolean       temporary;

        private TaskLease(RemoteSession session, boolean temporary) {
            this.session   = session;
            this.temporary = temporary;
        }

        RemoteSession session() {
            return session;
        }

        @Override
        public void close() {
            if (temporary) {
                closeQuietly(session);
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        Future<?> cleanup = driver.submit(() -> {
            closeQuietly(manualSession);
            manualSession = null;
            sessionFactory.shutdown();
        });
        try {
            cleanup.get(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Browser shutdown did not complete cleanly: {}", e.getMessage());
        } finally {
            driver.shutdownNow();
        }
    }

    // ------------------------------------------------------------------
    // Internals
    // ------------------------------------------------------------------

    private boolean manualSessionAlive() {
        return manualSession != null && manualSession.isAlive();
    }

    private AuthState update(AuthStage stage, String message) {
        AuthState next = new AuthState(stage, clock.instant(), message);
        authState = next;
        log.debug("Auth state → {}: {}", stage.wireName(), message);
        authListeners.publish(next);
        return next;
    }

    private <T> T onDriverThread(Callable<T> work) {
        Future<T> future = driver.submit(work);
        try {
            return future.get();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the browser driver", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new IllegalStateException(cause.getMessage(), cause);
        }
    }

    private static void closeQuietly(RemoteSession session) {
        if (session == null) {
            return;
        }
        try {
            session.close();
        } catch (RuntimeException e) {
            log.debug("Closing browser session failed: {}", e.getMessage());
        }
    }
}
