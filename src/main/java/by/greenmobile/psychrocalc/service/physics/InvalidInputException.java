package by.greenmobile.psychrocalc.service.physics;

/**
 * Out-of-domain or physically inconsistent input: supersaturation, RH outside [0,1],
 * negative mass flow, over-determined parameter sets, unreachable targets.
 */
public class InvalidInputException extends PsychroException {

    public InvalidInputException(String message) {
        super(message);
    }

    @Override
    public FailureKind getKind() {
        return FailureKind.INVALID_INPUT;
    }
}
