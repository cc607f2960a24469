package by.greenmobile.psychrocalc.service.physics;

/**
 * ASHRAE Handbook Fundamentals (SI) moist air correlations.
 *
 * Units: t in °C, pressures in Pa, humidity ratio W in kg/kg dry air,
 * enthalpy in kJ/kg dry air, specific volume in m³/kg dry air.
 * Pure closed forms only; the inversions that need iteration live in {@link PropertyConverter}.
 */
public final class Psychrometrics {

    private Psychrometrics() {
    }

    public static final double STANDARD_PRESSURE_PA = 101325.0;

    public static final double ABSOLUTE_ZERO_C = -273.15;

    /** Validity range of the saturation pressure correlation, °C. */
    public static final double MIN_DRY_BULB_C = -100.0;
    public static final double MAX_DRY_BULB_C = 200.0;

    /** Triple point: ice formula at or below, liquid water above. */
    public static final double TRIPLE_POINT_C = 0.01;

    /** Molar mass ratio water vapour / dry air. */
    public static final double EPSILON = 0.621945;

    /** Specific gas constant of dry air, J/(kg·K). */
    public static final double R_DRY_AIR = 287.042;

    public static final double CP_DRY_AIR = 1.006;
    public static final double CP_VAPOUR = 1.86;
    public static final double LATENT_HEAT_0C = 2501.0;

    /** Floor for humidity ratio in the dew-point and wet-bulb inversions. */
    public static final double MIN_HUMIDITY_RATIO = 1e-7;

    private static final double KELVIN = 273.15;

    /**
     * Hyland–Wexler saturation vapour pressure over ice (t ≤ 0.01 °C) or liquid water.
     */
    public static double saturationPressure(double t) {
        double tk = t + KELVIN;
        double lnPws;
        if (t <= TRIPLE_POINT_C) {
            lnPws = -5.6745359E+03 / tk + 6.3925247 - 9.677843E-03 * tk + 6.2215701E-07 * tk * tk
                    + 2.0747825E-09 * Math.pow(tk, 3) - 9.484024E-13 * Math.pow(tk, 4)
                    + 4.1635019 * Math.log(tk);
        } else {
            lnPws = -5.8002206E+03 / tk + 1.3914993 - 4.8640239E-02 * tk + 4.1764768E-05 * tk * tk
                    - 1.4452093E-08 * Math.pow(tk, 3) + 6.5459673 * Math.log(tk);
        }
        return Math.exp(lnPws);
    }

    public static double humidityRatioFromVaporPressure(double pw, double pressure) {
        return EPSILON * pw / (pressure - pw);
    }

    public static double vaporPressureFromHumidityRatio(double w, double pressure) {
        return pressure * w / (EPSILON + w);
    }

    public static double enthalpy(double t, double w) {
        return CP_DRY_AIR * t + w * (LATENT_HEAT_0C + CP_VAPOUR * t);
    }

    public static double humidityRatioFromEnthalpy(double t, double h) {
        return (h - CP_DRY_AIR * t) / (LATENT_HEAT_0C + CP_VAPOUR * t);
    }

    /** Inverse of {@link #enthalpy(double, double)} for t at known W. */
    public static double dryBulbFromEnthalpy(double h, double w) {
        return (h - LATENT_HEAT_0C * w) / (CP_DRY_AIR + CP_VAPOUR * w);
    }

    /**
     * dh/dt at constant W, kJ/(kg·K). Every sensible heat figure uses this slope.
     */
    public static double humidSpecificHeat(double w) {
        return CP_DRY_AIR + CP_VAPOUR * w;
    }

    public static double specificVolume(double t, double w, double pressure) {
        return R_DRY_AIR * (t + KELVIN) * (1.0 + 1.607858 * w) / pressure;
    }

    /** Moist air density, kg of moist air per m³. */
    public static double density(double w, double specificVolume) {
        return (1.0 + w) / specificVolume;
    }

    /**
     * W from psychrometric wet-bulb (ASHRAE eq. 33 above freezing, eq. 35 below).
     * May come out negative for a wet-bulb that is too low; callers validate.
     */
    public static double humidityRatioFromWetBulb(double tdb, double twb, double pressure) {
        double wsStar = humidityRatioFromVaporPressure(saturationPressure(twb), pressure);
        if (twb >= 0) {
            return ((2501.0 - 2.326 * twb) * wsStar - 1.006 * (tdb - twb))
                    / (2501.0 + 1.86 * tdb - 4.186 * twb);
        }
        return ((2830.0 - 0.24 * twb) * wsStar - 1.006 * (tdb - twb))
                / (2830.0 + 1.86 * tdb - 2.1 * twb);
    }

    /** Standard atmosphere barometric formula, altitude in m. */
    public static double pressureAtAltitude(double altitudeM) {
        return STANDARD_PRESSURE_PA * Math.pow(1.0 - 2.25577E-05 * altitudeM, 5.2559);
    }
}
