package com.picfactory.orchestrator.session;

import com.microsoft.playwright.Page;

/**
 * One browser session against the remote surface.
 *
 * Implementations are confined to the session manager's driver thread;
 * callers never touch a session from anywhere else.
 */
public interface RemoteSession {

    /** Actively checks the underlying browser; a cached handle may be dead. */
    boolean isAlive();

    /**
     * The session's working page, navigated to the surface when
     * {@code forceNavigate} is set or the page is elsewhere.
     */
    Page page(boolean forceNavigate);

    SurfaceState probe();

    void bringToFront();

    void close();
}
