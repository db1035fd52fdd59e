package com.picfactory.orchestrator.api;

import com.picfactory.orchestrator.model.AuthState;
import com.picfactory.orchestrator.session.RemoteSessionManager;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Login state of the remote surface.
 *
 * GET  /auth/state  last known state, no browser work
 * POST /auth/check  probe the interactive session now
 * POST /auth/open   open (or focus) the visible window for a manual login, then probe
 *
 * The POST endpoints block until the browser-driver thread has answered.
 */
@RestController
@RequestMapping("/auth")
public class AuthController {

    private final RemoteSessionManager sessions;

    public AuthController(RemoteSessionManager sessions) {
        this.sessions = sessions;
    }

    @GetMapping("/state")
    public AuthState state() {
        return sessions.authState();
    }

    @PostMapping("/check")
    public AuthState check() {
        return sessions.checkAuthStatus();
    }

    @PostMapping("/open")
    public AuthState open() {
        return sessions.openInteractiveSession();
    }
}
