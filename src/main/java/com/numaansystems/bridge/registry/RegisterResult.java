package com.numaansystems.bridge.registry;

/**
 * Outcome of {@link ConnectionRegistry#register}.
 */
public enum RegisterResult {
    REGISTERED,
    /** The id already has a live entry; the existing sender was left untouched. */
    ALREADY_REGISTERED
}
