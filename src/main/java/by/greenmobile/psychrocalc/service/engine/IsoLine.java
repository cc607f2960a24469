package by.greenmobile.psychrocalc.service.engine;

import by.greenmobile.psychrocalc.service.physics.AirState;
import by.greenmobile.psychrocalc.service.physics.AtmosphericContext;
import by.greenmobile.psychrocalc.service.physics.InvalidInputException;
import by.greenmobile.psychrocalc.service.physics.PropertyConverter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A lazily sampled iso-line.
 *
 * Nothing is computed until iteration; every {@link #iterator()} restarts the sweep from
 * {@code minDryBulb}, so the same line can be walked any number of times with identical output.
 * Infeasible samples (wet-bulb above dry-bulb, supersaturation, negative W) are clipped: leading ones
 * are skipped and the first one after a feasible run ends the line. The result is one contiguous
 * feasible run, possibly empty.
 */
@Slf4j
public final class IsoLine implements Iterable<ChartPoint> {

    private final CurveKind kind;
    private final double value;
    private final double minDryBulb;
    private final double maxDryBulb;
    private final int samples;
    private final AtmosphericContext context;
    private final PropertyConverter converter;

    IsoLine(CurveKind kind, double value, double minDryBulb, double maxDryBulb, int samples,
            AtmosphericContext context, PropertyConverter converter) {
        this.kind = kind;
        this.value = value;
        this.minDryBulb = minDryBulb;
        this.maxDryBulb = maxDryBulb;
        this.samples = samples;
        this.context = context;
        this.converter = converter;
    }

    public CurveKind getKind() {
        return kind;
    }

    /** Fixed secondary value: RH (0..1), kJ/kg or °C depending on kind. */
    public double getValue() {
        return value;
    }

    public double getMinDryBulb() {
        return minDryBulb;
    }

    public double getMaxDryBulb() {
        return maxDryBulb;
    }

    public int getSamples() {
        return samples;
    }

    public double getPressure() {
        return context.getPressure();
    }

    /** Legend text, e.g. "RH 50%", "h 40 kJ/kg", "Twb 20 °C". */
    public String getLabel() {
        return switch (kind) {
            case SATURATION -> kind.getSymbol();
            case RELATIVE_HUMIDITY -> String.format(Locale.US, "RH %.0f%%", value * 100.0);
            case ENTHALPY -> String.format(Locale.US, "h %.0f kJ/kg", value);
            case WET_BULB -> String.format(Locale.US, "Twb %.0f °C", value);
        };
    }

    /** Materialized points, in increasing dry-bulb. */
    public List<ChartPoint> points() {
        List<ChartPoint> out = new ArrayList<>();
        forEach(out::add);
        return out;
    }

    public boolean isEmpty() {
        return !iterator().hasNext();
    }

    public Stream<ChartPoint> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    double sampleAt(int i) {
        if (i == samples - 1) return maxDryBulb;
        return minDryBulb + (maxDryBulb - minDryBulb) * i / (samples - 1);
    }

    @Override
    public Iterator<ChartPoint> iterator() {
        return new Sweep();
    }

    private final class Sweep implements Iterator<ChartPoint> {
        private int index;
        private boolean started;
        private boolean finished;
        private ChartPoint next;

        @Override
        public boolean hasNext() {
            if (next == null && !finished) {
                next = advance();
            }
            return next != null;
        }

        @Override
        public ChartPoint next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            ChartPoint p = next;
            next = null;
            return p;
        }

        private ChartPoint advance() {
            while (index < samples) {
                double t = sampleAt(index++);
                try {
                    AirState s = converter.resolve(context, t, kind.getPair(), value);
                    started = true;
                    return new ChartPoint(t, s.getHumidityRatio());
                } catch (InvalidInputException e) {
                    if (!started) {
                        log.trace("{} skips infeasible {} °C", getLabel(), t);
                    } else {
                        log.debug("{} clipped at {} °C: {}", getLabel(), t, e.getMessage());
                        finished = true;
                        return null;
                    }
                }
            }
            finished = true;
            return null;
        }
    }
}
