package by.greenmobile.psychrocalc.service.weather;

import java.util.List;

/**
 * Source of design-day weather. The engine treats its output as ordinary dry-bulb / wet-bulb pairs.
 */
public interface DesignConditionsProvider {

    /** Selectable locations, catalog sites alphabetically, CUSTOM last. */
    List<DesignLocation> locations();

    DesignConditions conditionsFor(DesignLocation location);
}
