package by.greenmobile.psychrocalc.service.weather;

import lombok.Builder;
import lombok.Value;

/**
 * Design-day weather record for one location (ASHRAE HOF 2021, ch. 14).
 *
 * Temperatures in °C, altitude in m, timezone as UTC offset in hours.
 */
@Value
@Builder
public class DesignConditions {

    String location;
    String country;
    double latitude;
    double longitude;
    double altitude;
    int timezone;

    // summer
    /** N=20 years return period dry-bulb and coincident wet-bulb. */
    double coolingDryBulbN20;
    double coolingWetBulbN20;
    /** 0.4% evaporation design dry-bulb and coincident wet-bulb. */
    double coolingDryBulb04;
    double coolingWetBulb04;
    double coolingMeanWetBulb;
    double dehumidDryBulb;
    double dehumidWetBulb;

    // winter
    double heatingDryBulbN20;
    double heatingDryBulb004;
    double heatingMeanWetBulb;

    /**
     * Wet-bulb to pair with a winter dry-bulb. The catalog mean coincident value can exceed the
     * heating dry-bulb (warm humid winters); the state is then taken as saturated.
     */
    public double winterWetBulb(double heatingDryBulb) {
        return Math.min(heatingMeanWetBulb, heatingDryBulb);
    }
}
