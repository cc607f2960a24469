package by.greenmobile.psychrocalc.service.physics;

/**
 * The property supplied together with dry-bulb to fix a state.
 */
public enum InputPair {
    /** 0..1 */
    RELATIVE_HUMIDITY,
    /** °C */
    WET_BULB,
    /** °C */
    DEW_POINT,
    /** kg/kg */
    HUMIDITY_RATIO,
    /** kJ/kg dry air */
    ENTHALPY
}
