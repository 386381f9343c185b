package com.numaansystems.bridge.service;

/**
 * What happened to a provider callback. Never shown to the browser.
 */
public enum CallbackOutcome {
    /** Login succeeded and the profile reached the client. */
    SUCCESS_DELIVERED,
    /** Login failed and the structured error reached the client. */
    FAILURE_DELIVERED,
    /** The client disconnected or its session expired; the result was dropped. */
    UNDELIVERED,
    /** Another callback already claimed the session; nothing was run. */
    DUPLICATE
}
