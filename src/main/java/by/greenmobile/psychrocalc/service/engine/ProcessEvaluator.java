package by.greenmobile.psychrocalc.service.engine;

import by.greenmobile.psychrocalc.service.physics.AirState;
import by.greenmobile.psychrocalc.service.physics.AtmosphericContext;
import by.greenmobile.psychrocalc.service.physics.InvalidInputException;
import by.greenmobile.psychrocalc.service.physics.PropertyConverter;
import by.greenmobile.psychrocalc.service.physics.Psychrometrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Objects;

/**
 * Process loads between air states and the derived states of common AHU processes
 * (mixing, reheat, cooling coil).
 *
 * Q_total = m·(h_out − h_in)
 * Q_sens  = m·cp_in·(t_out − t_in), cp_in = 1.006 + 1.86·W_in (the enthalpy slope at constant W)
 * Q_lat   = Q_total − Q_sens
 * All in kW for m in kg/s and h in kJ/kg.
 */
@Service
@Slf4j
public class ProcessEvaluator {

    /** kW; below this the sensible heat ratio is reported as absent. */
    static final double MIN_TOTAL_FOR_SHR = 0.001;

    /** Pa; states further apart than this are not at the same pressure. */
    private static final double PRESSURE_TOLERANCE = 1e-6;

    private final PropertyConverter converter;

    public ProcessEvaluator(PropertyConverter converter) {
        this.converter = converter;
    }

    public ProcessResult evaluate(String name, AirState entering, AirState leaving, double massFlow) {
        Objects.requireNonNull(entering, "entering state");
        Objects.requireNonNull(leaving, "leaving state");
        if (!Double.isFinite(massFlow) || massFlow < 0) {
            throw new InvalidInputException("Mass flow must be >= 0 kg/s, got " + massFlow);
        }
        checkSamePressure(entering, leaving);

        double total = massFlow * (leaving.getEnthalpy() - entering.getEnthalpy());
        double sensible = massFlow * entering.getHumidSpecificHeat()
                * (leaving.getDryBulb() - entering.getDryBulb());
        double latent = total - sensible;
        Double shr = Math.abs(total) > MIN_TOTAL_FOR_SHR ? sensible / total : null;
        double moisture = massFlow * (entering.getHumidityRatio() - leaving.getHumidityRatio()) * 1000.0;

        log.debug("Process '{}': m={} kg/s Qs={} Ql={} Qt={} kW SHR={}", name, massFlow, sensible, latent, total, shr);

        return ProcessResult.builder()
                .name(name)
                .entering(entering)
                .leaving(leaving)
                .massFlow(massFlow)
                .sensibleHeat(sensible)
                .latentHeat(latent)
                .totalHeat(total)
                .sensibleHeatRatio(shr)
                .moistureRemoval(moisture)
                .build();
    }

    /**
     * Schedule convention: mass flow = volume flow × leaving-state density.
     *
     * @param volumeFlow m³/s
     */
    public ProcessResult evaluateVolumetric(String name, AirState entering, AirState leaving, double volumeFlow) {
        if (!Double.isFinite(volumeFlow) || volumeFlow < 0) {
            throw new InvalidInputException("Volume flow must be >= 0 m³/s, got " + volumeFlow);
        }
        return evaluate(name, entering, leaving, volumeFlow * leaving.getDensity());
    }

    /**
     * Adiabatic mixing of two streams: W and h are mass weighted. A mixture that lands above the
     * saturation curve (fog) is rejected.
     */
    public AirState mix(AirState a, double massFlowA, AirState b, double massFlowB) {
        Objects.requireNonNull(a, "first stream");
        Objects.requireNonNull(b, "second stream");
        checkSamePressure(a, b);
        if (!Double.isFinite(massFlowA) || !Double.isFinite(massFlowB) || massFlowA < 0 || massFlowB < 0) {
            throw new InvalidInputException("Stream mass flows must be >= 0 kg/s");
        }
        double m = massFlowA + massFlowB;
        if (m <= 0) {
            throw new InvalidInputException("Total mass flow of a mixture must be > 0 kg/s");
        }

        double w = (massFlowA * a.getHumidityRatio() + massFlowB * b.getHumidityRatio()) / m;
        double h = (massFlowA * a.getEnthalpy() + massFlowB * b.getEnthalpy()) / m;
        double t = Psychrometrics.dryBulbFromEnthalpy(h, w);

        try {
            return converter.fromHumidityRatio(contextOf(a), t, w);
        } catch (InvalidInputException e) {
            throw new InvalidInputException("Mixed state is not a valid moist air state (fog?): " + e.getMessage());
        }
    }

    /**
     * Heating or cooling at constant humidity ratio (reheat, preheat, dry coil).
     */
    public AirState sensible(AirState entering, double leavingDryBulb) {
        Objects.requireNonNull(entering, "entering state");
        return converter.fromHumidityRatio(contextOf(entering), leavingDryBulb, entering.getHumidityRatio());
    }

    /**
     * Cooling coil by apparatus dew point (ADP) and bypass factor.
     * Leaving state lies on the straight line entering → saturated ADP, a fraction BF from the ADP.
     * If the ADP is not below the entering dew point the coil runs dry and W stays constant.
     */
    public AirState coolingCoil(AirState entering, double apparatusDewPoint, double bypassFactor) {
        Objects.requireNonNull(entering, "entering state");
        if (!Double.isFinite(bypassFactor) || bypassFactor < 0 || bypassFactor > 1) {
            throw new InvalidInputException("Bypass factor must be within [0, 1], got " + bypassFactor);
        }
        if (!Double.isFinite(apparatusDewPoint) || apparatusDewPoint >= entering.getDryBulb()) {
            throw new InvalidInputException("Apparatus dew point " + apparatusDewPoint
                    + " °C must be below entering dry-bulb " + entering.getDryBulb() + " °C");
        }
        AtmosphericContext ctx = contextOf(entering);
        AirState adp = converter.fromRelativeHumidity(ctx, apparatusDewPoint, 1.0);

        double t = apparatusDewPoint + bypassFactor * (entering.getDryBulb() - apparatusDewPoint);
        double w;
        if (adp.getHumidityRatio() >= entering.getHumidityRatio()) {
            log.debug("Coil dry: ADP {} °C above entering dew point {} °C", apparatusDewPoint, entering.getDewPoint());
            w = entering.getHumidityRatio();
        } else {
            w = adp.getHumidityRatio() + bypassFactor * (entering.getHumidityRatio() - adp.getHumidityRatio());
        }
        return converter.fromHumidityRatio(ctx, t, w);
    }

    private static AtmosphericContext contextOf(AirState s) {
        return AtmosphericContext.ofPressure(s.getPressure());
    }

    private static void checkSamePressure(AirState a, AirState b) {
        if (Math.abs(a.getPressure() - b.getPressure()) > PRESSURE_TOLERANCE) {
            throw new InvalidInputException("States are at different pressures: "
                    + a.getPressure() + " Pa vs " + b.getPressure() + " Pa");
        }
    }
}
