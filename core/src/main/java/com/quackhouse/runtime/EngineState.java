package com.quackhouse.runtime;

/**
 * Lifecycle state of an {@link EngineSession}.
 */
public enum EngineState {
    /** No engine exists; the next acquisition constructs one. */
    UNINITIALIZED,
    /** A construction is in flight; acquirers wait for it. */
    INITIALIZING,
    /** The engine is built and synchronized. */
    READY
}
