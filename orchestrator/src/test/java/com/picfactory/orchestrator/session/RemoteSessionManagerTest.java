package com.picfactory.orchestrator.session;

import com.microsoft.playwright.PlaywrightException;
import com.picfactory.orchestrator.config.PicFactoryProperties;
import com.picfactory.orchestrator.model.AuthStage;
import com.picfactory.orchestrator.model.AuthState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Login-state transitions of RemoteSessionManager with the browser mocked out.
 */
@ExtendWith(MockitoExtension.class)
class RemoteSessionManagerTest {

    @Mock SessionFactory factory;
    @Mock RemoteSession  session;

    final Clock clock = Clock.fixed(Instant.parse("2025-03-01T10:00:00Z"), ZoneOffset.UTC);

    RemoteSessionManager manager;
    List<AuthState>      pushed = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        manager = new RemoteSessionManager(factory, new PicFactoryProperties(), clock);
        manager.onAuthState(pushed::add);
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
    }

    // ------------------------------------------------------------------
    // checkAuthStatus() / openInteractiveSession()
    // ------------------------------------------------------------------

    @Test
    void initialState_isUnknownNotChecked() {
        assertThat(manager.authState().stage()).isEqualTo(AuthStage.UNKNOWN);
        assertThat(manager.authState().message()).isEqualTo("login status not checked yet");
    }

    @Test
    void check_withoutManualSession_isUnknownAndLaunchesNothing() {
        AuthState state = manager.checkAuthStatus();

        assertThat(state.stage()).isEqualTo(AuthStage.UNKNOWN);
        assertThat(state.checkedAt()).isEqualTo(clock.instant());
        verify(factory, never()).launch(anyBoolean());
    }

    @Test
    void open_launchesVisibleSessionThenReportsLoggedIn() {
        when(factory.launch(false)).thenReturn(session);
        when(session.isAlive()).thenReturn(true);
        when(session.probe()).thenReturn(SurfaceState.INPUT_READY);

        AuthState state = manager.openInteractiveSession();

        assertThat(state.stage()).isEqualTo(AuthStage.LOGGED_IN);
        verify(session).page(true);
        verify(session).bringToFront();
        assertThat(pushed).extracting(AuthState::stage)
                .containsExactly(AuthStage.CHECKING, AuthStage.LOGGED_IN);
    }

    @Test
    void open_loginPromptVisible_reportsLoggedOut() {
        when(factory.launch(false)).thenReturn(session);
        when(session.isAlive()).thenReturn(true);
        when(session.probe()).thenReturn(SurfaceState.LOGIN_PROMPT);

        assertThat(manager.openInteractiveSession().stage()).isEqualTo(AuthStage.LOGGED_OUT);
    }

    @Test
    void open_unrecognizedPage_reportsUnknown() {
        when(factory.launch(false)).thenReturn(session);
        when(session.isAlive()).thenReturn(true);
        when(session.probe()).thenReturn(SurfaceState.UNRECOGNIZED);

        assertThat(manager.openInteractiveSession().stage()).isEqualTo(AuthStage.UNKNOWN);
    }

    @Test
    void probeThrows_reportsErrorAndForgetsDeadSession() {
        when(factory.launch(false)).thenReturn(session);
        when(session.isAlive()).thenReturn(true, false);
        when(session.probe()).thenThrow(new PlaywrightException("Target closed\nstack"));

        AuthState state = manager.openInteractiveSession();

        assertThat(state.stage()).isEqualTo(AuthStage.ERROR);
        assertThat(state.message()).isEqualTo("Login status check failed: Target closed");
        assertThat(manager.checkAuthStatus().stage()).isEqualTo(AuthStage.UNKNOWN);
    }

    @Test
    void launchFails_reportsErrorWithInstallHint() {
        when(factory.launch(false)).thenThrow(new PlaywrightException("Executable doesn't exist at /x/chrome"));

        AuthState state = manager.openInteractiveSession();

        assertThat(state.stage()).isEqualTo(AuthStage.ERROR);
        assertThat(state.message()).contains(SessionErrors.INSTALL_HINT);
    }

    // ------------------------------------------------------------------
    // Task leases
    // ------------------------------------------------------------------

    @Test
    void runningTask_makesManagerBusyAndClosesTemporarySession() throws Exception {
        when(factory.launch(false)).thenReturn(session);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        CompletableFuture<RemoteSession> task = CompletableFuture.supplyAsync(() ->
                manager.withTaskSession(s -> {
                    entered.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return s;
                }));
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(manager.isBusy()).isTrue();
        assertThat(manager.checkAuthStatus().stage()).isEqualTo(AuthStage.BUSY);
        assertThat(manager.openInteractiveSession().stage()).isEqualTo(AuthStage.BUSY);

        release.countDown();
        assertThat(task.get(5, TimeUnit.SECONDS)).isSameAs(session);
        assertThat(manager.isBusy()).isFalse();
        verify(session).close();
    }

    @Test
    void taskLease_reusesLiveManualSession() {
        when(factory.launch(false)).thenReturn(session);
        when(session.isAlive()).thenReturn(true);
        when(session.probe()).thenReturn(SurfaceState.INPUT_READY);
        manager.openInteractiveSession();

        RemoteSession leased = manager.withTaskSession(s -> s);

        assertThat(leased).isSameAs(session);
        verify(factory, times(1)).launch(anyBoolean());
        verify(session, never()).close();
    }

    @Test
    void workFailure_reachesCallerUnchanged() {
        when(factory.launch(false)).thenReturn(session);
        IllegalStateException boom = new IllegalStateException("boom");

        assertThatThrownBy(() -> manager.withTaskSession(s -> {
            throw boom;
        })).isSameAs(boom);
        verify(session).close();
    }
}
