package by.greenmobile.psychrocalc.entity;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.Valid;
import lombok.Data;

/**
 * POST /api/states. {@code pressure} (Pa) overrides {@code altitude} (m); neither means 101325 Pa.
 */
@Data
public class StateRequest {

    private Double pressure;

    private Double altitude;

    @Valid
    @NotNull
    private StateInput state;
}
