package by.greenmobile.psychrocalc.service.physics;

import by.greenmobile.psychrocalc.config.PsychroProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Objects;
import java.util.function.DoubleUnaryOperator;

import static by.greenmobile.psychrocalc.service.physics.Psychrometrics.*;

/**
 * Resolves a complete {@link AirState} from dry-bulb plus one other independent property.
 *
 * Supported pairs: {t, RH}, {t, wet-bulb}, {t, dew-point}, {t, W}, {t, h}.
 * Closed forms where they exist; dew-point (inverse of the saturation pressure) and wet-bulb
 * (implicit energy balance) are solved by bounded bisection, see {@link RootFinder}.
 *
 * Either a fully valid state comes back or an {@link InvalidInputException} /
 * {@link ConvergenceException} is thrown. Stateless, safe for concurrent use.
 */
@Component
@Slf4j
public class PropertyConverter {

    /** RH above 1 by less than this is floating noise, not supersaturation. */
    private static final double RH_TOLERANCE = 1e-9;

    private final RootFinder rootFinder;

    public PropertyConverter(PsychroProperties properties) {
        PsychroProperties.Solver s = properties.getSolver();
        this.rootFinder = new RootFinder(s.getTolerance(), s.getMaxIterations());
    }

    public RootFinder getRootFinder() {
        return rootFinder;
    }

    public AirState resolve(AtmosphericContext ctx, double dryBulb, InputPair pair, double value) {
        Objects.requireNonNull(pair, "pair");
        return switch (pair) {
            case RELATIVE_HUMIDITY -> fromRelativeHumidity(ctx, dryBulb, value);
            case WET_BULB -> fromWetBulb(ctx, dryBulb, value);
            case DEW_POINT -> fromDewPoint(ctx, dryBulb, value);
            case HUMIDITY_RATIO -> fromHumidityRatio(ctx, dryBulb, value);
            case ENTHALPY -> fromEnthalpy(ctx, dryBulb, value);
        };
    }

    public AirState fromRelativeHumidity(AtmosphericContext ctx, double dryBulb, double rh) {
        checkDryBulb(dryBulb);
        requireFinite("relative humidity", rh);
        if (rh < 0.0 || rh > 1.0) {
            throw new InvalidInputException("Relative humidity must be within [0, 1], got " + rh);
        }
        double pressure = checkBoiling(ctx, dryBulb);
        double w = humidityRatioFromVaporPressure(rh * saturationPressure(dryBulb), pressure);
        return complete(ctx, dryBulb, w, rh, null, null);
    }

    public AirState fromWetBulb(AtmosphericContext ctx, double dryBulb, double wetBulb) {
        checkDryBulb(dryBulb);
        requireFinite("wet-bulb", wetBulb);
        if (wetBulb > dryBulb) {
            throw new InvalidInputException("Wet-bulb " + wetBulb + " °C exceeds dry-bulb " + dryBulb + " °C");
        }
        if (wetBulb < MIN_DRY_BULB_C) {
            throw new InvalidInputException("Wet-bulb " + wetBulb + " °C is below the correlation range");
        }
        double pressure = checkBoiling(ctx, dryBulb);
        double w = humidityRatioFromWetBulb(dryBulb, wetBulb, pressure);
        if (w < 0.0) {
            throw new InvalidInputException("Wet-bulb " + wetBulb + " °C is too low for dry-bulb "
                    + dryBulb + " °C (negative humidity ratio)");
        }
        return complete(ctx, dryBulb, w, null, wetBulb, null);
    }

    public AirState fromDewPoint(AtmosphericContext ctx, double dryBulb, double dewPoint) {
        checkDryBulb(dryBulb);
        requireFinite("dew-point", dewPoint);
        if (dewPoint > dryBulb) {
            throw new InvalidInputException("Dew-point " + dewPoint + " °C exceeds dry-bulb " + dryBulb + " °C");
        }
        if (dewPoint < MIN_DRY_BULB_C) {
            throw new InvalidInputException("Dew-point " + dewPoint + " °C is below the correlation range");
        }
        double pressure = checkBoiling(ctx, dryBulb);
        double w = humidityRatioFromVaporPressure(saturationPressure(dewPoint), pressure);
        return complete(ctx, dryBulb, w, null, null, dewPoint);
    }

    public AirState fromHumidityRatio(AtmosphericContext ctx, double dryBulb, double humidityRatio) {
        checkDryBulb(dryBulb);
        requireFinite("humidity ratio", humidityRatio);
        if (humidityRatio < 0.0) {
            throw new InvalidInputException("Humidity ratio must be >= 0, got " + humidityRatio);
        }
        checkBoiling(ctx, dryBulb);
        return complete(ctx, dryBulb, humidityRatio, null, null, null);
    }

    public AirState fromEnthalpy(AtmosphericContext ctx, double dryBulb, double enthalpy) {
        checkDryBulb(dryBulb);
        requireFinite("enthalpy", enthalpy);
        checkBoiling(ctx, dryBulb);
        double w = humidityRatioFromEnthalpy(dryBulb, enthalpy);
        if (w < 0.0) {
            throw new InvalidInputException("Enthalpy " + enthalpy + " kJ/kg is below dry air enthalpy at "
                    + dryBulb + " °C");
        }
        return complete(ctx, dryBulb, w, null, null, null);
    }

    /**
     * Dry-bulb at which the given vapour pressure saturates, i.e. the inverse of
     * {@link Psychrometrics#saturationPressure(double)} over [-100 °C, upper].
     */
    public double saturationTemperature(double vaporPressure, double upper) {
        if (!(vaporPressure > 0)) {
            throw new InvalidInputException("Vapour pressure must be > 0, got " + vaporPressure);
        }
        double lnPw = Math.log(vaporPressure);
        return rootFinder.bisect("dew-point",
                t -> Math.log(saturationPressure(t)) - lnPw,
                MIN_DRY_BULB_C, upper);
    }

    // ===== completion =====

    private AirState complete(AtmosphericContext ctx, double t, double w,
                              Double knownRh, Double knownWetBulb, Double knownDewPoint) {
        double p = ctx.getPressure();
        double pws = saturationPressure(t);
        double pw = vaporPressureFromHumidityRatio(w, p);

        double rh = knownRh != null ? knownRh : pw / pws;
        if (rh > 1.0 + RH_TOLERANCE) {
            throw new InvalidInputException(String.format(Locale.US,
                    "Supersaturated: vapour pressure %.1f Pa exceeds saturation %.1f Pa at %.2f °C",
                    pw, pws, t));
        }
        boolean saturated = rh >= 1.0 - RH_TOLERANCE;
        if (saturated) {
            rh = 1.0;
        }

        double dewPoint;
        double wetBulb;
        if (saturated) {
            dewPoint = t;
            wetBulb = t;
        } else {
            dewPoint = knownDewPoint != null ? knownDewPoint : dewPoint(t, w, p);
            wetBulb = knownWetBulb != null ? knownWetBulb : wetBulb(t, w, p, dewPoint);
        }

        double v = specificVolume(t, w, p);
        AirState s = new AirState(t, w, rh, wetBulb, dewPoint, enthalpy(t, w), v, density(w, v), p, pw, pws);
        log.trace("Resolved {}", s);
        return s;
    }

    private double dewPoint(double t, double w, double p) {
        double pw = vaporPressureFromHumidityRatio(Math.max(w, MIN_HUMIDITY_RATIO), p);
        return saturationTemperature(pw, t);
    }

    /**
     * Wet-bulb lies between dew-point and dry-bulb; W*(twb) grows with twb.
     * The dew-point is itself only known to the solver tolerance, so the bracket starts one
     * tolerance below it and the result is clamped back into [dew-point, dry-bulb].
     */
    private double wetBulb(double t, double w, double p, double dewPoint) {
        double target = Math.max(w, MIN_HUMIDITY_RATIO);
        DoubleUnaryOperator f = twb -> humidityRatioFromWetBulb(t, twb, p) - target;
        double lo = dewPoint - rootFinder.getTolerance();
        if (f.applyAsDouble(lo) >= 0.0) {
            // saturated within tolerance
            return dewPoint;
        }
        double twb = rootFinder.bisect("wet-bulb", f, lo, t);
        return Math.min(t, Math.max(dewPoint, twb));
    }

    // ===== validation =====

    private static void checkDryBulb(double t) {
        requireFinite("dry-bulb", t);
        if (t <= ABSOLUTE_ZERO_C) {
            throw new InvalidInputException("Dry-bulb " + t + " °C is at or below absolute zero");
        }
        if (t < MIN_DRY_BULB_C || t > MAX_DRY_BULB_C) {
            throw new InvalidInputException("Dry-bulb " + t + " °C is outside the correlation range ["
                    + MIN_DRY_BULB_C + ", " + MAX_DRY_BULB_C + "]");
        }
    }

    /** Moist air stops being a mixture once water boils at the given pressure. */
    private static double checkBoiling(AtmosphericContext ctx, double t) {
        Objects.requireNonNull(ctx, "atmospheric context");
        double p = ctx.getPressure();
        if (saturationPressure(t) >= p) {
            throw new InvalidInputException("Dry-bulb " + t + " °C is at or above the boiling point at "
                    + p + " Pa");
        }
        return p;
    }

    private static void requireFinite(String name, double value) {
        if (!Double.isFinite(value)) {
            throw new InvalidInputException(name + " must be a finite number, got " + value);
        }
    }
}
