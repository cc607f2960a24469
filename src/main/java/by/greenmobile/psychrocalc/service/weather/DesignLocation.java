package by.greenmobile.psychrocalc.service.weather;

import by.greenmobile.psychrocalc.service.physics.InvalidInputException;

import java.util.Locale;

/**
 * Built-in design-day catalog. Adding a location means adding a constant, nothing else.
 *
 * Columns: name, country, lat, lon, altitude m, UTC offset,
 * cooling N=20 db/wb, cooling 0.4% db/wb, cooling mean wb, dehumidification db/wb,
 * heating N=20 db, heating 99.6% db, heating mean wb.
 */
public enum DesignLocation {

    ABU_DHABI("Abu Dhabi", "UAE", 24.43, 54.65, 27, 4,
            47.0, 29.5, 45.2, 28.5, 35.2, 33.6, 30.2, 7.3, 9.5, 14.7),
    DUBAI("Dubai", "UAE", 25.25, 55.33, 5, 4,
            46.2, 30.8, 44.9, 30.0, 35.8, 34.2, 31.2, 10.2, 12.0, 16.0),
    RIYADH("Riyadh", "Saudi Arabia", 24.72, 46.73, 612, 3,
            44.7, 23.2, 43.0, 22.4, 32.0, 31.0, 22.8, 3.2, 5.0, 9.5),
    JOHANNESBURG("Johannesburg", "South Africa", -26.13, 28.23, 1694, 2,
            32.2, 19.3, 30.8, 18.8, 24.5, 23.0, 19.0, 1.4, 3.1, 8.5),
    CAPE_TOWN("Cape Town", "South Africa", -33.97, 18.60, 42, 2,
            35.2, 21.0, 33.1, 20.4, 26.3, 24.8, 20.5, 4.8, 6.2, 11.5),
    LONDON("London", "UK", 51.48, -0.45, 25, 0,
            30.5, 21.0, 28.8, 20.2, 22.8, 21.0, 19.7, -3.5, -1.8, 4.0),
    FRANKFURT("Frankfurt", "Germany", 50.03, 8.55, 113, 1,
            33.2, 21.5, 31.2, 21.0, 23.8, 22.5, 20.5, -10.0, -7.5, 2.0),
    SINGAPORE("Singapore", "Singapore", 1.37, 103.98, 16, 8,
            34.0, 28.3, 33.1, 27.8, 30.1, 29.0, 28.1, 22.3, 22.8, 25.0),
    SYDNEY("Sydney", "Australia", -33.95, 151.18, 6, 10,
            37.8, 24.5, 35.9, 23.5, 28.0, 26.2, 23.8, 4.8, 6.3, 11.0),
    NEW_YORK("New York (JFK)", "USA", 40.63, -73.78, 9, -5,
            33.9, 25.9, 32.6, 25.2, 28.0, 26.8, 25.4, -11.2, -8.9, 2.0),
    CHICAGO("Chicago O'Hare", "USA", 41.98, -87.90, 204, -6,
            34.4, 25.7, 32.6, 25.0, 28.1, 27.0, 25.2, -22.8, -19.2, -2.0),
    HONG_KONG("Hong Kong", "China", 22.32, 114.17, 9, 8,
            34.5, 28.5, 33.3, 28.1, 30.0, 29.2, 28.3, 7.3, 8.8, 14.5),
    MUMBAI("Mumbai", "India", 19.12, 72.85, 14, 5,
            37.0, 29.8, 35.2, 29.0, 31.5, 30.5, 29.2, 14.5, 16.0, 20.0),
    /** Placeholder values for sites outside the catalog; callers normally override them. */
    CUSTOM("Custom Location", "", 0, 0, 0, 0,
            45.0, 28.0, 40.0, 26.0, 32.0, 30.0, 26.0, 5.0, 8.0, 12.0);

    private final DesignConditions conditions;

    DesignLocation(String name, String country, double lat, double lon, double altitude, int tz,
                   double coolDbN20, double coolWbN20, double coolDb04, double coolWb04, double coolMeanWb,
                   double dehumDb, double dehumWb,
                   double heatDbN20, double heatDb004, double heatMeanWb) {
        this.conditions = DesignConditions.builder()
                .location(name)
                .country(country)
                .latitude(lat)
                .longitude(lon)
                .altitude(altitude)
                .timezone(tz)
                .coolingDryBulbN20(coolDbN20)
                .coolingWetBulbN20(coolWbN20)
                .coolingDryBulb04(coolDb04)
                .coolingWetBulb04(coolWb04)
                .coolingMeanWetBulb(coolMeanWb)
                .dehumidDryBulb(dehumDb)
                .dehumidWetBulb(dehumWb)
                .heatingDryBulbN20(heatDbN20)
                .heatingDryBulb004(heatDb004)
                .heatingMeanWetBulb(heatMeanWb)
                .build();
    }

    public DesignConditions getConditions() {
        return conditions;
    }

    public String getDisplayName() {
        return conditions.getLocation();
    }

    /**
     * Lenient lookup: "abu dhabi", "Abu-Dhabi" and "ABU_DHABI" all resolve to {@link #ABU_DHABI}.
     */
    public static DesignLocation fromKey(String key) {
        if (key == null || key.isBlank()) {
            throw new InvalidInputException("Location key is empty");
        }
        String normalized = key.trim().toUpperCase(Locale.ROOT).replaceAll("[\\s-]+", "_");
        for (DesignLocation l : values()) {
            if (l.name().equals(normalized)) {
                return l;
            }
        }
        throw new InvalidInputException("Unknown design location: " + key);
    }
}
