package by.greenmobile.psychrocalc.service.engine;

import by.greenmobile.psychrocalc.config.PsychroProperties;
import by.greenmobile.psychrocalc.service.physics.AtmosphericContext;
import by.greenmobile.psychrocalc.service.physics.InvalidInputException;
import by.greenmobile.psychrocalc.service.physics.PropertyConverter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds iso-lines for the psychrometric chart.
 *
 * Parameters are validated eagerly; the points themselves are produced lazily by {@link IsoLine}.
 */
@Service
@Slf4j
public class CurveGenerator {

    /** Upper bound on samples per line, keeps a single request from sweeping forever. */
    static final int MAX_SAMPLES = 100_000;

    private final PropertyConverter converter;
    private final PsychroProperties.Chart chart;

    public CurveGenerator(PropertyConverter converter, PsychroProperties properties) {
        this.converter = converter;
        this.chart = properties.getChart();
    }

    /**
     * @param value   fixed secondary value; null for {@link CurveKind#SATURATION}
     * @param samples number of dry-bulb samples including both ends, at least 2
     */
    public IsoLine generate(CurveKind kind, Double value, double minDryBulb, double maxDryBulb,
                            int samples, AtmosphericContext ctx) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(ctx, "atmospheric context");
        checkDomain(minDryBulb, maxDryBulb);
        if (samples < 2 || samples > MAX_SAMPLES) {
            throw new InvalidInputException("Sample count must be within [2, " + MAX_SAMPLES + "], got " + samples);
        }
        double fixed = fixedValue(kind, value);
        return new IsoLine(kind, fixed, minDryBulb, maxDryBulb, samples, ctx, converter);
    }

    /**
     * Same as {@link #generate} with a dry-bulb step instead of a sample count. The domain is split
     * into the fewest equal intervals no wider than the step, so both ends are always sampled.
     */
    public IsoLine generateWithStep(CurveKind kind, Double value, double minDryBulb, double maxDryBulb,
                                    double step, AtmosphericContext ctx) {
        checkDomain(minDryBulb, maxDryBulb);
        if (!Double.isFinite(step) || step <= 0) {
            throw new InvalidInputException("Step must be > 0, got " + step);
        }
        double intervals = Math.max(1.0, Math.ceil((maxDryBulb - minDryBulb) / step - 1e-9));
        if (intervals + 1 > MAX_SAMPLES) {
            throw new InvalidInputException("Step " + step + " gives more than " + MAX_SAMPLES + " samples");
        }
        return generate(kind, value, minDryBulb, maxDryBulb, (int) intervals + 1, ctx);
    }

    public IsoLine saturation(AtmosphericContext ctx) {
        return generate(CurveKind.SATURATION, null, chart.getMinDryBulb(), chart.getMaxDryBulb(),
                chart.getSamples(), ctx);
    }

    /**
     * Default chart families over the configured domain: saturation, RH 10..90 %,
     * enthalpy 0..120 kJ/kg, wet-bulb 0..35 °C.
     */
    public List<IsoLine> chartFamilies(AtmosphericContext ctx) {
        double min = chart.getMinDryBulb();
        double max = chart.getMaxDryBulb();
        int n = chart.getSamples();

        List<IsoLine> lines = new ArrayList<>();
        lines.add(saturation(ctx));
        for (int rh = 10; rh <= 90; rh += 10) {
            lines.add(generate(CurveKind.RELATIVE_HUMIDITY, rh / 100.0, min, max, n, ctx));
        }
        for (int h = 0; h <= 120; h += 10) {
            lines.add(generate(CurveKind.ENTHALPY, (double) h, min, max, n, ctx));
        }
        for (int twb = 0; twb <= 35; twb += 5) {
            lines.add(generate(CurveKind.WET_BULB, (double) twb, min, max, n, ctx));
        }
        log.debug("Chart families: {} lines at {} Pa", lines.size(), ctx.getPressure());
        return lines;
    }

    private static void checkDomain(double min, double max) {
        if (!Double.isFinite(min) || !Double.isFinite(max) || min >= max) {
            throw new InvalidInputException("Dry-bulb domain must satisfy min < max, got [" + min + ", " + max + "]");
        }
    }

    private static double fixedValue(CurveKind kind, Double value) {
        if (kind == CurveKind.SATURATION) {
            if (value != null && value != 1.0) {
                throw new InvalidInputException("Saturation curve is RH = 1; got conflicting value " + value);
            }
            return 1.0;
        }
        if (value == null || !Double.isFinite(value)) {
            throw new InvalidInputException(kind + " curve needs a finite fixed value");
        }
        if (kind == CurveKind.RELATIVE_HUMIDITY && (value < 0.0 || value > 1.0)) {
            throw new InvalidInputException("Relative humidity must be within [0, 1], got " + value);
        }
        return value;
    }
}
