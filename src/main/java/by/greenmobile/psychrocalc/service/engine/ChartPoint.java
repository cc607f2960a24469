package by.greenmobile.psychrocalc.service.engine;

import lombok.Value;

/**
 * Chart coordinate: dry-bulb (°C) against humidity ratio (kg/kg).
 */
@Value
public class ChartPoint {
    double dryBulb;
    double humidityRatio;
}
