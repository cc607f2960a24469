package by.greenmobile.psychrocalc.entity;

import by.greenmobile.psychrocalc.service.engine.CurveKind;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * POST /api/curves.
 *
 * {@code samples} and {@code step} are alternatives; with neither the configured chart sample count is used.
 */
@Data
public class CurveRequest {

    private Double pressure;

    private Double altitude;

    @NotNull
    private CurveKind kind;

    /** RH 0..1, kJ/kg or °C; empty for SATURATION. */
    private Double value;

    @NotNull
    private Double minDryBulb;

    @NotNull
    private Double maxDryBulb;

    private Integer samples;

    private Double step;
}
