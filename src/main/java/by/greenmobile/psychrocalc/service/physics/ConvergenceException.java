package by.greenmobile.psychrocalc.service.physics;

import java.util.Locale;

/**
 * An iterative solve used up its iteration bound without reaching the tolerance.
 */
public class ConvergenceException extends PsychroException {

    private final int iterations;

    public ConvergenceException(String what, int iterations, double residual) {
        super(String.format(Locale.US,
                "%s did not converge in %d iterations (bracket half-width %.3e)", what, iterations, residual));
        this.iterations = iterations;
    }

    @Override
    public FailureKind getKind() {
        return FailureKind.CONVERGENCE_FAILURE;
    }

    public int getIterations() {
        return iterations;
    }
}
