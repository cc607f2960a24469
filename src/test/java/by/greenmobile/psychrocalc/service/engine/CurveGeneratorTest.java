package by.greenmobile.psychrocalc.service.engine;

import by.greenmobile.psychrocalc.config.PsychroProperties;
import by.greenmobile.psychrocalc.service.physics.AirState;
import by.greenmobile.psychrocalc.service.physics.AtmosphericContext;
import by.greenmobile.psychrocalc.service.physics.InvalidInputException;
import by.greenmobile.psychrocalc.service.physics.PropertyConverter;
import org.junit.jupiter.api.Test;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CurveGeneratorTest {

    private final PsychroProperties properties = new PsychroProperties();
    private final PropertyConverter converter = new PropertyConverter(properties);
    private final CurveGenerator generator = new CurveGenerator(converter, properties);
    private final AtmosphericContext sea = AtmosphericContext.standard();

    @Test
    void saturationCurveIsTheDewPointWetBulbLocus() {
        IsoLine sat = generator.generate(CurveKind.SATURATION, null, -20.0, 50.0, 71, sea);

        List<ChartPoint> pts = sat.points();
        assertThat(pts).hasSize(71);
        for (ChartPoint p : pts) {
            AirState s = converter.fromHumidityRatio(sea, p.getDryBulb(), p.getHumidityRatio());
            assertThat(s.getDewPoint()).isCloseTo(p.getDryBulb(), within(1e-4));
            assertThat(s.getWetBulb()).isCloseTo(p.getDryBulb(), within(1e-4));
        }
    }

    @Test
    void pointsAscendInDryBulbAndHitBothEnds() {
        List<ChartPoint> pts = generator.generate(CurveKind.RELATIVE_HUMIDITY, 0.5, 0.0, 40.0, 9, sea).points();

        assertThat(pts).extracting(ChartPoint::getDryBulb)
                .containsExactly(0.0, 5.0, 10.0, 15.0, 20.0, 25.0, 30.0, 35.0, 40.0);
        assertThat(pts).extracting(ChartPoint::getHumidityRatio).isSorted();
    }

    @Test
    void higherRelativeHumidityLineLiesAbove() {
        List<ChartPoint> low = generator.generate(CurveKind.RELATIVE_HUMIDITY, 0.3, 0.0, 40.0, 21, sea).points();
        List<ChartPoint> high = generator.generate(CurveKind.RELATIVE_HUMIDITY, 0.6, 0.0, 40.0, 21, sea).points();

        for (int i = 0; i < low.size(); i++) {
            assertThat(high.get(i).getHumidityRatio()).isGreaterThan(low.get(i).getHumidityRatio());
        }
    }

    @Test
    void regeneratingGivesIdenticalCoordinates() {
        IsoLine a = generator.generate(CurveKind.WET_BULB, 18.0, -5.0, 50.0, 56, sea);
        IsoLine b = generator.generate(CurveKind.WET_BULB, 18.0, -5.0, 50.0, 56, sea);

        assertThat(a.points()).isEqualTo(b.points());
        // the same instance restarts on each iteration
        assertThat(a.points()).isEqualTo(a.points());
    }

    @Test
    void nothingIsComputedBeforeIteration() {
        IsoLine line = generator.generate(CurveKind.RELATIVE_HUMIDITY, 0.5, -5.0, 50.0, CurveGenerator.MAX_SAMPLES, sea);

        Iterator<ChartPoint> it = line.iterator();
        assertThat(it.next().getDryBulb()).isEqualTo(-5.0);
        assertThat(it.next().getDryBulb()).isGreaterThan(-5.0);
        assertThat(line.stream().limit(3).count()).isEqualTo(3);
    }

    @Test
    void wetBulbLineSkipsLeadingInfeasibleSamples() {
        List<ChartPoint> pts = generator.generate(CurveKind.WET_BULB, 20.0, 0.0, 50.0, 51, sea).points();

        assertThat(pts.get(0).getDryBulb()).isEqualTo(20.0);
        assertThat(pts.get(pts.size() - 1).getDryBulb()).isEqualTo(50.0);
    }

    @Test
    void enthalpyLineIsClippedAtBothEnds() {
        // h = 10 kJ/kg is supersaturated below ~0.5 °C and needs W < 0 above ~9.94 °C
        List<ChartPoint> pts = generator.generate(CurveKind.ENTHALPY, 10.0, -5.0, 50.0, 111, sea).points();

        assertThat(pts).isNotEmpty();
        assertThat(pts.get(0).getDryBulb()).isBetween(0.0, 1.0);
        assertThat(pts.get(pts.size() - 1).getDryBulb()).isLessThan(10.0);
        assertThat(pts).allSatisfy(p -> assertThat(p.getHumidityRatio()).isGreaterThanOrEqualTo(0.0));
    }

    @Test
    void infeasibleEverywhereIsEmptyNotAnError() {
        IsoLine line = generator.generate(CurveKind.WET_BULB, 60.0, -5.0, 50.0, 56, sea);

        assertThat(line.isEmpty()).isTrue();
        assertThat(line.points()).isEmpty();
        assertThatThrownBy(() -> line.iterator().next()).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void stepIsTurnedIntoEqualIntervals() {
        IsoLine fine = generator.generateWithStep(CurveKind.RELATIVE_HUMIDITY, 0.5, 0.0, 10.0, 0.5, sea);
        IsoLine coarse = generator.generateWithStep(CurveKind.RELATIVE_HUMIDITY, 0.5, 0.0, 10.0, 3.0, sea);

        assertThat(fine.getSamples()).isEqualTo(21);
        assertThat(coarse.points()).extracting(ChartPoint::getDryBulb).containsExactly(0.0, 2.5, 5.0, 7.5, 10.0);
    }

    @Test
    void stepWiderThanTheDomainStillSamplesBothEnds() {
        IsoLine line = generator.generateWithStep(CurveKind.SATURATION, null, 10.0, 20.0, 1e12, sea);

        assertThat(line.getSamples()).isEqualTo(2);
        assertThat(line.points()).extracting(ChartPoint::getDryBulb).containsExactly(10.0, 20.0);
    }

    @Test
    void labelsDescribeTheFixedValue() {
        assertThat(generator.generate(CurveKind.RELATIVE_HUMIDITY, 0.5, 0, 10, 2, sea).getLabel()).isEqualTo("RH 50%");
        assertThat(generator.generate(CurveKind.ENTHALPY, 40.0, 0, 10, 2, sea).getLabel()).isEqualTo("h 40 kJ/kg");
        assertThat(generator.generate(CurveKind.WET_BULB, 20.0, 0, 10, 2, sea).getLabel()).isEqualTo("Twb 20 °C");
        assertThat(generator.saturation(sea).getLabel()).isEqualTo("RH 100%");
    }

    @Test
    void chartFamiliesCoverTheStandardSet() {
        List<IsoLine> lines = generator.chartFamilies(sea);

        assertThat(lines).hasSize(1 + 9 + 13 + 8);
        assertThat(lines.get(0).getKind()).isEqualTo(CurveKind.SATURATION);
        assertThat(lines).allSatisfy(l -> assertThat(l.getMinDryBulb()).isEqualTo(-5.0));
    }

    @Test
    void badParametersAreRejected() {
        assertThatThrownBy(() -> generator.generate(CurveKind.RELATIVE_HUMIDITY, 1.5, 0, 10, 5, sea))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> generator.generate(CurveKind.ENTHALPY, null, 0, 10, 5, sea))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> generator.generate(CurveKind.SATURATION, 0.5, 0, 10, 5, sea))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> generator.generate(CurveKind.WET_BULB, 10.0, 10, 10, 5, sea))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> generator.generate(CurveKind.WET_BULB, 10.0, 0, 10, 1, sea))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> generator.generateWithStep(CurveKind.WET_BULB, 10.0, 0, 10, 0.0, sea))
                .isInstanceOf(InvalidInputException.class);
    }
}
