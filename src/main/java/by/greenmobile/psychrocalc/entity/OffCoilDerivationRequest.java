package by.greenmobile.psychrocalc.entity;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * POST /api/derive/off-coil: coil dew point plus one of RH, approach or dry-bulb.
 */
@Data
public class OffCoilDerivationRequest {

    private Double pressure;

    private Double altitude;

    @NotNull
    private Double coilDewPoint;

    private Double targetRelativeHumidity;

    private Double approach;

    private Double dryBulb;
}
