package by.greenmobile.psychrocalc.entity;

import by.greenmobile.psychrocalc.service.physics.InputPair;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One state as the caller describes it: dry-bulb plus one independent property.
 *
 * Units of {@code value} follow {@code pair}: RH 0..1, °C, kg/kg or kJ/kg.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StateInput {

    /** °C */
    @NotNull
    private Double dryBulb;

    @NotNull
    private InputPair pair;

    @NotNull
    private Double value;
}
