package by.greenmobile.psychrocalc.service.design;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SystemFlows {

    /** kW, IT load including auxiliary heat. */
    double sensibleLoad;

    /** kg/s */
    double crahMassFlow;

    /** m³/s at mean CRAH density. */
    double crahVolumeFlow;

    /** m³/s */
    double ahuVolumeFlow;

    /** kg/s at OC Dehum density. */
    double ahuMassFlow;

    /** kW */
    double fanLoad;

    /** K */
    double fanTemperatureRise;
}
