package by.greenmobile.psychrocalc.entity;

import by.greenmobile.psychrocalc.service.design.SystemFlows;
import by.greenmobile.psychrocalc.service.engine.ProcessResult;
import by.greenmobile.psychrocalc.service.physics.AirState;
import by.greenmobile.psychrocalc.service.weather.DesignLocation;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Result of a design run: the state table, sized flows and the design processes in run order.
 */
@Data
@Builder
public class DesignResult {

    private DesignLocation location;

    private String locationName;

    /** Pa */
    private double pressure;

    /** m; null when an explicit pressure was used. */
    private Double altitude;

    /** Label → state, in table order. */
    private Map<String, AirState> states;

    /** °C */
    private double crahOffDewPoint;

    private SystemFlows flows;

    private List<ProcessResult> processes;
}
