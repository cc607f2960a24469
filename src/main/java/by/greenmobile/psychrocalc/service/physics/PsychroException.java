package by.greenmobile.psychrocalc.service.physics;

/**
 * Base of every failure raised by the moist air engine.
 * Callers branch on {@link #getKind()}; the UI/HTTP layer decides the wording.
 */
public abstract class PsychroException extends RuntimeException {

    protected PsychroException(String message) {
        super(message);
    }

    public abstract FailureKind getKind();
}
