package by.greenmobile.psychrocalc.service.engine;

import by.greenmobile.psychrocalc.service.physics.AirState;
import lombok.Builder;
import lombok.Value;

/**
 * Heat exchanged between two states for a given dry air mass flow.
 *
 * Signs: positive = added to the airstream. sensible + latent == total by construction.
 */
@Value
@Builder
public class ProcessResult {

    String name;

    AirState entering;

    AirState leaving;

    /** kg/s dry air */
    double massFlow;

    /** kW */
    double sensibleHeat;

    /** kW */
    double latentHeat;

    /** kW */
    double totalHeat;

    /** Qs / Qt; null when |Qt| is too small to give a meaningful ratio. */
    Double sensibleHeatRatio;

    /** g/s, positive = dehumidification. */
    double moistureRemoval;
}
