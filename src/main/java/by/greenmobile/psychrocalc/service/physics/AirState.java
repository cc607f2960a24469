package by.greenmobile.psychrocalc.service.physics;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * One fully resolved moist air state at a fixed atmospheric pressure.
 *
 * Instances are produced only by {@link PropertyConverter}; every field is consistent with
 * every other to within the solver tolerance. Units as in {@link Psychrometrics}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PACKAGE)
public class AirState {

    /** °C */
    double dryBulb;

    /** kg water / kg dry air */
    double humidityRatio;

    /** 0..1 */
    double relativeHumidity;

    /** °C */
    double wetBulb;

    /** °C */
    double dewPoint;

    /** kJ/kg dry air */
    double enthalpy;

    /** m³/kg dry air */
    double specificVolume;

    /** kg/m³ moist air */
    double density;

    /** Pa, input */
    double pressure;

    /** Pa */
    double vaporPressure;

    /** Pa, at dry-bulb */
    double saturationVaporPressure;

    public double getHumidityRatioGramsPerKg() {
        return humidityRatio * 1000.0;
    }

    /** kJ/(kg·K), slope of enthalpy with dry-bulb at this humidity ratio. */
    public double getHumidSpecificHeat() {
        return Psychrometrics.humidSpecificHeat(humidityRatio);
    }

    public boolean isSaturated() {
        return relativeHumidity >= 1.0;
    }
}
