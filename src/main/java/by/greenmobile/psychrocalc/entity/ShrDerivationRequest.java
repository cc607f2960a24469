package by.greenmobile.psychrocalc.entity;

import by.greenmobile.psychrocalc.service.design.KnownSide;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

/**
 * POST /api/derive/shr.
 */
@Data
public class ShrDerivationRequest {

    private Double pressure;

    private Double altitude;

    @Valid
    @NotNull
    private StateInput known;

    @NotNull
    private KnownSide knownSide;

    @NotNull
    private Double unknownDryBulb;

    @NotNull
    @Positive
    private Double targetSensibleHeatRatio;

    /** kg/s for the returned process loads; 1 kg/s when empty. */
    @PositiveOrZero
    private Double massFlow;
}
