package by.greenmobile.psychrocalc.service.physics;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Atmospheric pressure for a set of calculations, given directly or derived from altitude.
 * Owned by the caller and passed into every conversion.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AtmosphericContext {

    /** Pa. */
    double pressure;

    /** m; null when the pressure was given explicitly. */
    Double altitude;

    /** Above this the barometric formula has no real solution. */
    private static final double MAX_ALTITUDE_M = 44_000.0;

    public static AtmosphericContext standard() {
        return new AtmosphericContext(Psychrometrics.STANDARD_PRESSURE_PA, 0.0);
    }

    public static AtmosphericContext ofPressure(double pressurePa) {
        if (!Double.isFinite(pressurePa) || pressurePa <= 0) {
            throw new InvalidInputException("Atmospheric pressure must be a positive number of Pa, got " + pressurePa);
        }
        return new AtmosphericContext(pressurePa, null);
    }

    public static AtmosphericContext ofAltitude(double altitudeM) {
        if (!Double.isFinite(altitudeM) || altitudeM >= MAX_ALTITUDE_M) {
            throw new InvalidInputException("Altitude must be below " + MAX_ALTITUDE_M + " m, got " + altitudeM);
        }
        return new AtmosphericContext(Psychrometrics.pressureAtAltitude(altitudeM), altitudeM);
    }

    /**
     * Request-side resolution: an explicit pressure overrides altitude; neither means sea level.
     */
    public static AtmosphericContext of(Double pressurePa, Double altitudeM) {
        if (pressurePa != null) {
            return ofPressure(pressurePa);
        }
        if (altitudeM != null) {
            return ofAltitude(altitudeM);
        }
        return standard();
    }
}
