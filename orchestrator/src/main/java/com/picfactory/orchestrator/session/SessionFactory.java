package com.picfactory.orchestrator.session;

/**
 * Launches browser sessions. Called only from the session manager's driver thread.
 */
public interface SessionFactory {

    RemoteSession launch(boolean headless);

    /** Release driver-wide resources at shutdown. */
    default void shutdown() {}
}
