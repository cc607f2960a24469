package by.greenmobile.psychrocalc.entity;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * POST /api/processes. Exactly one of {@code massFlow} (kg/s dry air) or {@code volumeFlow}
 * (m³/s, converted at the leaving-state density).
 */
@Data
public class ProcessRequest {

    private Double pressure;

    private Double altitude;

    private String name;

    @Valid
    @NotNull
    private StateInput entering;

    @Valid
    @NotNull
    private StateInput leaving;

    private Double massFlow;

    private Double volumeFlow;
}
