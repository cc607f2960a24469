package by.greenmobile.psychrocalc.entity;

import by.greenmobile.psychrocalc.service.engine.ChartPoint;
import by.greenmobile.psychrocalc.service.engine.CurveKind;
import by.greenmobile.psychrocalc.service.engine.IsoLine;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * Materialized iso-line for JSON output. {@code points} may be empty.
 */
@Data
@AllArgsConstructor
public class CurveResponse {

    private CurveKind kind;
    private double value;
    private String label;
    private double pressure;
    private List<ChartPoint> points;

    public static CurveResponse from(IsoLine line) {
        return new CurveResponse(line.getKind(), line.getValue(), line.getLabel(), line.getPressure(), line.points());
    }
}
