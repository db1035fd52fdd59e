package com.picfactory.orchestrator.session;

/** What a probe of the remote page found. */
public enum SurfaceState {
    INPUT_READY,    // prompt input visible: logged in
    LOGIN_PROMPT,   // login call-to-action visible: logged out
    UNRECOGNIZED    // neither within the probe timeout
}
