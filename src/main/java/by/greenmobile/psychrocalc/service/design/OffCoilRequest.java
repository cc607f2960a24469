package by.greenmobile.psychrocalc.service.design;

import lombok.Builder;
import lombok.Value;

/**
 * Off-coil state from a coil dew point.
 *
 * Independent: {@code coilDewPoint} plus exactly one of {@code targetRelativeHumidity},
 * {@code approach} (dry-bulb minus dew point, K) or {@code dryBulb}. Extra values are accepted only
 * when they describe the same state.
 */
@Value
@Builder
public class OffCoilRequest {

    double coilDewPoint;

    /** 0..1 */
    Double targetRelativeHumidity;

    /** K */
    Double approach;

    /** °C */
    Double dryBulb;
}
