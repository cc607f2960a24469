package by.greenmobile.psychrocalc.service.design;

import by.greenmobile.psychrocalc.service.physics.AirState;
import lombok.Builder;
import lombok.Value;

/**
 * Back-solve the unknown end of a process from a sensible heat ratio.
 *
 * Independent: the known state, its side, the unknown state's dry-bulb and the target ratio.
 * Derived: the unknown state's humidity ratio.
 */
@Value
@Builder
public class ShrPairingRequest {

    AirState known;

    KnownSide knownSide;

    /** °C */
    double unknownDryBulb;

    double targetSensibleHeatRatio;
}
