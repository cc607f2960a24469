package by.greenmobile.psychrocalc.service.design;

import by.greenmobile.psychrocalc.service.physics.AirState;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class FlowSizingRequest {

    AirState crahOnCoil;

    AirState crahOffCoil;

    AirState offCoilDehum;

    /** kW */
    double itLoad;

    /** Multiplier on IT load for lighting, UPS losses and people. */
    double auxLoadFactor;

    /** m³/s; null or non-positive means size from the makeup fraction. */
    Double ahuVolumeFlowOverride;

    /** Pa */
    double ahuPressureDrop;

    /** AHU flow as a fraction of CRAH volume flow. */
    double makeupFraction;
}
