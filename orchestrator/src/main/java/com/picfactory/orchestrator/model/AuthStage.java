package com.picfactory.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Login state of the remote surface as last observed by the session manager.
 *
 * BUSY is reported instead of probing while a task holds the browser.
 */
public enum AuthStage {
    UNKNOWN("unknown"),
    CHECKING("checking"),
    LOGGED_IN("logged_in"),
    LOGGED_OUT("logged_out"),
    BUSY("busy"),
    ERROR("error");

    private final String wireName;

    AuthStage(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() { return wireName; }
}
