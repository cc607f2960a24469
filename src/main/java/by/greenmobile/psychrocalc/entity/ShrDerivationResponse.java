package by.greenmobile.psychrocalc.entity;

import by.greenmobile.psychrocalc.service.engine.ProcessResult;
import by.greenmobile.psychrocalc.service.physics.AirState;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ShrDerivationResponse {

    private AirState unknown;

    /** Process between the two states, entering to leaving. */
    private ProcessResult process;
}
