package by.greenmobile.psychrocalc.service.physics;

/**
 * Failure categories surfaced by the engine.
 * An empty curve is a valid result, not a failure, so it has no kind here.
 */
public enum FailureKind {
    INVALID_INPUT,
    CONVERGENCE_FAILURE
}
