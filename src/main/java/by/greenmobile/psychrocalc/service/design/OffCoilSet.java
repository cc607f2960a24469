package by.greenmobile.psychrocalc.service.design;

import by.greenmobile.psychrocalc.service.physics.AirState;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class OffCoilSet {

    /** °C, the reference all saturated off-coil states are placed against. */
    double crahOffDewPoint;

    AirState maxCool;

    AirState dehum;

    AirState enthalpy;

    AirState heat;
}
