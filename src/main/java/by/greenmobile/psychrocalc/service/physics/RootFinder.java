package by.greenmobile.psychrocalc.service.physics;

import lombok.extern.slf4j.Slf4j;

import java.util.function.DoubleUnaryOperator;

/**
 * Bounded bisection over a known bracket.
 *
 * The bracket must contain a sign change of f. The solve stops when the bracket half-width
 * drops below the tolerance; running out of iterations is a {@link ConvergenceException},
 * never a silently returned approximation.
 */
@Slf4j
public final class RootFinder {

    private final double tolerance;
    private final int maxIterations;

    public RootFinder(double tolerance, int maxIterations) {
        if (!(tolerance > 0) || maxIterations < 1) {
            throw new IllegalArgumentException("tolerance must be > 0 and maxIterations >= 1");
        }
        this.tolerance = tolerance;
        this.maxIterations = maxIterations;
    }

    public double getTolerance() {
        return tolerance;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public double bisect(String what, DoubleUnaryOperator f, double lo, double hi) {
        return bisect(what, f, lo, hi, tolerance);
    }

    /**
     * @param what     name of the solved quantity, used in failure messages
     * @param tol      absolute tolerance on x for this solve
     */
    public double bisect(String what, DoubleUnaryOperator f, double lo, double hi, double tol) {
        if (lo > hi) {
            double t = lo;
            lo = hi;
            hi = t;
        }
        double fLo = f.applyAsDouble(lo);
        double fHi = f.applyAsDouble(hi);

        if (fLo == 0.0) return lo;
        if (fHi == 0.0) return hi;
        if (Double.isNaN(fLo) || Double.isNaN(fHi) || Math.signum(fLo) == Math.signum(fHi)) {
            throw new InvalidInputException(what + ": no solution in ["
                    + lo + ", " + hi + "]");
        }

        for (int it = 0; it < maxIterations; it++) {
            double mid = 0.5 * (lo + hi);
            double half = 0.5 * (hi - lo);
            double fMid = f.applyAsDouble(mid);

            if (fMid == 0.0 || half < tol) {
                log.debug("{} converged in {} iterations, x={}", what, it + 1, mid);
                return mid;
            }

            if (Math.signum(fMid) == Math.signum(fLo)) {
                lo = mid;
                fLo = fMid;
            } else {
                hi = mid;
            }
        }

        log.warn("{}: bisection reached maxIterations={}, half-width={}", what, maxIterations, 0.5 * (hi - lo));
        throw new ConvergenceException(what, maxIterations, 0.5 * (hi - lo));
    }
}
