package by.greenmobile.psychrocalc.service.design;

import by.greenmobile.psychrocalc.service.physics.AirState;
import lombok.Builder;
import lombok.Value;

/**
 * Control setpoints the AHU off-coil states are derived from.
 */
@Value
@Builder
public class OffCoilSetpoints {

    AirState crahOffCoil;

    /** °C, OC Heat is brought up to this. */
    double crahOnDryBulb;

    /** Winter design outdoor state whose humidity ratio OC Heat keeps. */
    AirState winterOutdoor;

    /** K above the CRAH off-coil dew point. */
    double coolMargin;

    /** K above the CRAH off-coil dew point. */
    double dehumMargin;

    /** kJ/kg */
    double enthalpyTarget;
}
