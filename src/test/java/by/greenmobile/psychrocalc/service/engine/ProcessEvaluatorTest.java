package by.greenmobile.psychrocalc.service.engine;

import by.greenmobile.psychrocalc.config.PsychroProperties;
import by.greenmobile.psychrocalc.service.physics.AirState;
import by.greenmobile.psychrocalc.service.physics.AtmosphericContext;
import by.greenmobile.psychrocalc.service.physics.InvalidInputException;
import by.greenmobile.psychrocalc.service.physics.PropertyConverter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProcessEvaluatorTest {

    private final PropertyConverter converter = new PropertyConverter(new PsychroProperties());
    private final ProcessEvaluator evaluator = new ProcessEvaluator(converter);
    private final AtmosphericContext sea = AtmosphericContext.standard();

    @Test
    void coolingAndDehumidifyingOfficeAir() {
        AirState in = converter.fromRelativeHumidity(sea, 24.0, 0.5);
        AirState out = converter.fromRelativeHumidity(sea, 14.0, 0.95);

        ProcessResult r = evaluator.evaluate("coil", in, out, 1.0);

        assertTrue(r.getTotalHeat() < 0);
        assertEquals(out.getEnthalpy() - in.getEnthalpy(), r.getTotalHeat(), 1e-12);
        assertEquals(-9.8146, r.getTotalHeat(), 1e-3);
        assertEquals(-10.2330, r.getSensibleHeat(), 1e-3);
        assertEquals(r.getTotalHeat(), r.getSensibleHeat() + r.getLatentHeat(), 1e-12);
        assertEquals(r.getSensibleHeat() / r.getTotalHeat(), r.getSensibleHeatRatio(), 1e-12);
    }

    @ParameterizedTest(name = "{0}/{1} -> {2}/{3} at {4} kg/s")
    @CsvSource({
            "24.0, 0.50, 14.0, 0.95, 2.5",
            "-10.0, 0.80, 30.0, 0.10, 0.7",
            "35.0, 0.40, 35.0, 0.70, 1.0",
            "18.0, 0.30, 26.0, 0.30, 12.0",
            "27.0, 0.60, 27.0, 0.60, 3.0"
    })
    void sensiblePlusLatentIsTotal(double t1, double rh1, double t2, double rh2, double m) {
        ProcessResult r = evaluator.evaluate("p", converter.fromRelativeHumidity(sea, t1, rh1),
                converter.fromRelativeHumidity(sea, t2, rh2), m);
        assertEquals(r.getTotalHeat(), r.getSensibleHeat() + r.getLatentHeat(), 1e-9);
    }

    @Test
    void sensibleOnlyProcessMatchesEnthalpyDifference() {
        AirState in = converter.fromRelativeHumidity(sea, 10.0, 0.6);
        AirState out = evaluator.sensible(in, 30.0);

        ProcessResult r = evaluator.evaluate("reheat", in, out, 2.0);

        assertEquals(in.getHumidityRatio(), out.getHumidityRatio(), 1e-15);
        assertEquals(r.getTotalHeat(), r.getSensibleHeat(), 1e-9);
        assertEquals(0.0, r.getLatentHeat(), 1e-9);
        assertEquals(0.0, r.getMoistureRemoval(), 1e-12);
    }

    @Test
    void noLoadHasNoHeatRatio() {
        AirState s = converter.fromRelativeHumidity(sea, 22.0, 0.45);
        ProcessResult r = evaluator.evaluate("idle", s, s, 5.0);

        assertEquals(0.0, r.getTotalHeat());
        assertNull(r.getSensibleHeatRatio());
    }

    @Test
    void moistureRemovalIsPositiveForDehumidification() {
        AirState in = converter.fromRelativeHumidity(sea, 24.0, 0.5);
        AirState out = converter.fromRelativeHumidity(sea, 12.0, 1.0);

        ProcessResult r = evaluator.evaluate("dehum", in, out, 2.0);

        assertEquals(2.0 * (in.getHumidityRatio() - out.getHumidityRatio()) * 1000.0, r.getMoistureRemoval(), 1e-9);
        assertTrue(r.getMoistureRemoval() > 0);
    }

    @Test
    void volumetricFlowUsesLeavingDensity() {
        AirState in = converter.fromRelativeHumidity(sea, 35.0, 0.3);
        AirState out = converter.fromRelativeHumidity(sea, 15.0, 0.9);

        ProcessResult r = evaluator.evaluateVolumetric("vol", in, out, 3.0);

        assertEquals(3.0 * out.getDensity(), r.getMassFlow(), 1e-12);
    }

    @Test
    void negativeMassFlowIsRejected() {
        AirState s = converter.fromRelativeHumidity(sea, 24.0, 0.5);
        assertThrows(InvalidInputException.class, () -> evaluator.evaluate("x", s, s, -5.0));
        assertThrows(InvalidInputException.class, () -> evaluator.evaluateVolumetric("x", s, s, -1.0));
    }

    @Test
    void statesAtDifferentPressuresAreRejected() {
        AirState a = converter.fromRelativeHumidity(sea, 24.0, 0.5);
        AirState b = converter.fromRelativeHumidity(AtmosphericContext.ofAltitude(1000), 24.0, 0.5);
        assertThrows(InvalidInputException.class, () -> evaluator.evaluate("x", a, b, 1.0));
    }

    // ===== mixing =====

    @Test
    void mixingIsMassWeighted() {
        AirState ret = converter.fromWetBulb(sea, 35.0, 25.0);
        AirState oa = converter.fromWetBulb(sea, 5.0, 3.0);

        AirState mix = evaluator.mix(ret, 3.0, oa, 1.0);

        assertEquals((3 * ret.getHumidityRatio() + oa.getHumidityRatio()) / 4, mix.getHumidityRatio(), 1e-12);
        assertEquals((3 * ret.getEnthalpy() + oa.getEnthalpy()) / 4, mix.getEnthalpy(), 1e-9);
        assertTrue(mix.getDryBulb() > oa.getDryBulb() && mix.getDryBulb() < ret.getDryBulb());
    }

    @Test
    void foggyMixtureIsRejected() {
        AirState cold = converter.fromRelativeHumidity(sea, -10.0, 1.0);
        AirState hot = converter.fromRelativeHumidity(sea, 40.0, 1.0);

        assertThrows(InvalidInputException.class, () -> evaluator.mix(cold, 1.0, hot, 1.0));
    }

    @Test
    void emptyMixtureIsRejected() {
        AirState s = converter.fromRelativeHumidity(sea, 20.0, 0.5);
        assertThrows(InvalidInputException.class, () -> evaluator.mix(s, 0.0, s, 0.0));
    }

    // ===== cooling coil =====

    @Test
    void wetCoilMovesTowardApparatusDewPoint() {
        AirState in = converter.fromRelativeHumidity(sea, 24.0, 0.5);

        AirState out = evaluator.coolingCoil(in, 10.0, 0.1);
        AirState adp = converter.fromRelativeHumidity(sea, 10.0, 1.0);

        assertEquals(11.4, out.getDryBulb(), 1e-9);
        assertEquals(adp.getHumidityRatio() + 0.1 * (in.getHumidityRatio() - adp.getHumidityRatio()),
                out.getHumidityRatio(), 1e-12);
        assertTrue(out.getHumidityRatio() < in.getHumidityRatio());
    }

    @Test
    void coilAboveDewPointRunsDry() {
        AirState in = converter.fromRelativeHumidity(sea, 24.0, 0.5);

        AirState out = evaluator.coolingCoil(in, 15.0, 0.2);

        assertEquals(in.getHumidityRatio(), out.getHumidityRatio(), 1e-15);
        assertEquals(16.8, out.getDryBulb(), 1e-9);
    }

    @Test
    void bypassFactorLimits() {
        AirState in = converter.fromRelativeHumidity(sea, 24.0, 0.5);

        AirState full = evaluator.coolingCoil(in, 10.0, 0.0);
        assertTrue(full.isSaturated());
        assertEquals(10.0, full.getDryBulb(), 1e-12);

        assertThrows(InvalidInputException.class, () -> evaluator.coolingCoil(in, 10.0, 1.2));
        assertThrows(InvalidInputException.class, () -> evaluator.coolingCoil(in, 30.0, 0.1));
    }
}
