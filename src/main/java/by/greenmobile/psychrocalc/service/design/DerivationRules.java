package by.greenmobile.psychrocalc.service.design;

import by.greenmobile.psychrocalc.service.engine.ProcessEvaluator;
import by.greenmobile.psychrocalc.service.physics.AirState;
import by.greenmobile.psychrocalc.service.physics.AtmosphericContext;
import by.greenmobile.psychrocalc.service.physics.InvalidInputException;
import by.greenmobile.psychrocalc.service.physics.PropertyConverter;
import by.greenmobile.psychrocalc.service.physics.RootFinder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Objects;
import java.util.function.DoubleUnaryOperator;

import static by.greenmobile.psychrocalc.service.physics.Psychrometrics.*;

/**
 * Design shortcuts of the AHU / CRAH sheet, layered on the converter and the process evaluator.
 *
 * Every rule takes only independent inputs; derived values are never accepted as input unless they
 * agree with what the rule would compute.
 */
@Service
@Slf4j
public class DerivationRules {

    /** K; two ways of fixing the same dry-bulb must agree this closely. */
    static final double CONSISTENCY_TOLERANCE = 0.01;

    /** kg/kg; absolute tolerance of humidity ratio searches. */
    private static final double HUMIDITY_RATIO_TOLERANCE = 1e-9;

    /** kJ/kg per kg/s; below this a process has no meaningful heat ratio. */
    private static final double MIN_ENTHALPY_DIFFERENCE = 1e-6;

    private final PropertyConverter converter;
    private final ProcessEvaluator processEvaluator;
    private final RootFinder rootFinder;

    public DerivationRules(PropertyConverter converter, ProcessEvaluator processEvaluator) {
        this.converter = converter;
        this.processEvaluator = processEvaluator;
        this.rootFinder = converter.getRootFinder();
    }

    // =====================================================================
    // Off-coil from dew point
    // =====================================================================

    public AirState offCoil(AtmosphericContext ctx, OffCoilRequest request) {
        Objects.requireNonNull(ctx, "atmospheric context");
        Objects.requireNonNull(request, "off-coil request");
        double dp = request.getCoilDewPoint();
        if (!Double.isFinite(dp)) {
            throw new InvalidInputException("Coil dew point must be a finite number, got " + dp);
        }

        Double fromRh = request.getTargetRelativeHumidity() != null
                ? dryBulbForRelativeHumidity(ctx, dp, request.getTargetRelativeHumidity()) : null;
        Double fromApproach = null;
        if (request.getApproach() != null) {
            double a = request.getApproach();
            if (!Double.isFinite(a) || a < 0) {
                throw new InvalidInputException("Approach must be >= 0 K, got " + a);
            }
            fromApproach = dp + a;
        }
        Double fromDryBulb = request.getDryBulb();

        Double t = null;
        for (Double candidate : new Double[]{fromRh, fromApproach, fromDryBulb}) {
            if (candidate == null) continue;
            if (t == null) {
                t = candidate;
            } else if (Math.abs(t - candidate) > CONSISTENCY_TOLERANCE) {
                throw new InvalidInputException(String.format(Locale.US,
                        "Over-determined off-coil state: inputs give dry-bulb %.3f °C and %.3f °C", t, candidate));
            }
        }
        if (t == null) {
            throw new InvalidInputException("Off-coil state needs one of target RH, approach or dry-bulb");
        }

        AirState s = converter.fromDewPoint(ctx, t, dp);
        log.debug("Off-coil from dew point {} °C: {} °C, RH {}", dp, s.getDryBulb(), s.getRelativeHumidity());
        return s;
    }

    /**
     * Dry-bulb at which air holding the coil dew point's saturation humidity ratio has the target RH.
     */
    private double dryBulbForRelativeHumidity(AtmosphericContext ctx, double dewPoint, double rh) {
        if (!Double.isFinite(rh) || rh <= 0.0 || rh > 1.0) {
            throw new InvalidInputException("Target relative humidity must be within (0, 1], got " + rh);
        }
        double wSat = converter.fromRelativeHumidity(ctx, dewPoint, 1.0).getHumidityRatio();
        double pw = vaporPressureFromHumidityRatio(wSat, ctx.getPressure());
        if (rh == 1.0) {
            return dewPoint;
        }
        // bisection noise must not put the dry-bulb under the dew point
        return Math.max(dewPoint, converter.saturationTemperature(pw / rh, MAX_DRY_BULB_C));
    }

    // =====================================================================
    // Saturated at enthalpy
    // =====================================================================

    /**
     * Saturated state with the given enthalpy. h_sat(t) is monotonic below boiling.
     */
    public AirState saturatedAtEnthalpy(AtmosphericContext ctx, double enthalpy) {
        Objects.requireNonNull(ctx, "atmospheric context");
        if (!Double.isFinite(enthalpy)) {
            throw new InvalidInputException("Enthalpy must be a finite number, got " + enthalpy);
        }
        double p = ctx.getPressure();
        double boiling = converter.saturationTemperature(p, MAX_DRY_BULB_C);
        double upper = Math.min(boiling - 0.5, MAX_DRY_BULB_C);

        DoubleUnaryOperator residual = t -> enthalpy(t, humidityRatioFromVaporPressure(saturationPressure(t), p)) - enthalpy;
        double t = rootFinder.bisect("saturated dry-bulb at h=" + enthalpy, residual, MIN_DRY_BULB_C, upper);
        return converter.fromRelativeHumidity(ctx, t, 1.0);
    }

    // =====================================================================
    // AHU off-coil set
    // =====================================================================

    public OffCoilSet offCoilSet(AtmosphericContext ctx, OffCoilSetpoints sp) {
        Objects.requireNonNull(ctx, "atmospheric context");
        Objects.requireNonNull(sp, "setpoints");
        Objects.requireNonNull(sp.getCrahOffCoil(), "CRAH off-coil state");
        Objects.requireNonNull(sp.getWinterOutdoor(), "winter outdoor state");
        if (!(sp.getCoolMargin() >= 0) || !(sp.getDehumMargin() >= 0)) {
            throw new InvalidInputException("Off-coil margins must be >= 0 K");
        }

        double dp = sp.getCrahOffCoil().getDewPoint();
        AirState maxCool = converter.fromRelativeHumidity(ctx, dp + sp.getCoolMargin(), 1.0);
        AirState dehum = converter.fromRelativeHumidity(ctx, dp + sp.getDehumMargin(), 1.0);
        AirState enthalpy = saturatedAtEnthalpy(ctx, sp.getEnthalpyTarget());
        AirState heat = processEvaluator.sensible(sp.getWinterOutdoor(), sp.getCrahOnDryBulb());

        log.debug("Off-coil set: CRAH dp={} °C, max cool {} °C, dehum {} °C, enthalpy {} °C, heat Twb {} °C",
                dp, maxCool.getDryBulb(), dehum.getDryBulb(), enthalpy.getDryBulb(), heat.getWetBulb());

        return OffCoilSet.builder()
                .crahOffDewPoint(dp)
                .maxCool(maxCool)
                .dehum(dehum)
                .enthalpy(enthalpy)
                .heat(heat)
                .build();
    }

    // =====================================================================
    // Sensible heat ratio pairing
    // =====================================================================

    /**
     * Finds the unknown state's humidity ratio in [0, W_sat(t)] so that Qs/Qt equals the target.
     * The residual Qs - SHR·Qt is used instead of Qs/Qt - SHR, which has a pole where Qt = 0.
     */
    public AirState pairBySensibleHeatRatio(ShrPairingRequest request) {
        Objects.requireNonNull(request, "SHR pairing request");
        AirState known = Objects.requireNonNull(request.getKnown(), "known state");
        KnownSide side = Objects.requireNonNull(request.getKnownSide(), "known side");
        double shr = request.getTargetSensibleHeatRatio();
        double tu = request.getUnknownDryBulb();

        if (!Double.isFinite(shr) || shr <= 0) {
            throw new InvalidInputException("Target sensible heat ratio must be > 0, got " + shr);
        }
        if (!Double.isFinite(tu) || Math.abs(tu - known.getDryBulb()) < CONSISTENCY_TOLERANCE) {
            throw new InvalidInputException("Unknown dry-bulb must differ from the known state's dry-bulb "
                    + known.getDryBulb() + " °C, got " + tu);
        }

        AtmosphericContext ctx = AtmosphericContext.ofPressure(known.getPressure());
        double wMax = converter.fromRelativeHumidity(ctx, tu, 1.0).getHumidityRatio();

        DoubleUnaryOperator residual = side == KnownSide.ENTERING
                ? w -> known.getHumidSpecificHeat() * (tu - known.getDryBulb())
                        - shr * (enthalpy(tu, w) - known.getEnthalpy())
                : w -> humidSpecificHeat(w) * (known.getDryBulb() - tu)
                        - shr * (known.getEnthalpy() - enthalpy(tu, w));

        double w;
        try {
            w = rootFinder.bisect("humidity ratio for SHR " + shr, residual, 0.0, wMax, HUMIDITY_RATIO_TOLERANCE);
        } catch (InvalidInputException e) {
            throw new InvalidInputException("SHR " + shr + " is not reachable at " + tu
                    + " °C from the known state: " + e.getMessage());
        }

        AirState unknown = converter.fromHumidityRatio(ctx, tu, w);
        AirState in = side == KnownSide.ENTERING ? known : unknown;
        AirState out = side == KnownSide.ENTERING ? unknown : known;
        if (Math.abs(out.getEnthalpy() - in.getEnthalpy()) < MIN_ENTHALPY_DIFFERENCE) {
            throw new InvalidInputException("SHR pairing collapsed to a zero-enthalpy process");
        }
        log.debug("SHR pairing ({} known): W={} kg/kg at {} °C", side, w, tu);
        return unknown;
    }

    // =====================================================================
    // Airflow sizing
    // =====================================================================

    public SystemFlows sizeAirflows(FlowSizingRequest r) {
        Objects.requireNonNull(r, "flow sizing request");
        AirState on = Objects.requireNonNull(r.getCrahOnCoil(), "CRAH on-coil state");
        AirState off = Objects.requireNonNull(r.getCrahOffCoil(), "CRAH off-coil state");
        AirState dehum = Objects.requireNonNull(r.getOffCoilDehum(), "OC Dehum state");

        if (!(r.getItLoad() >= 0) || !(r.getAuxLoadFactor() > 0)) {
            throw new InvalidInputException("IT load must be >= 0 kW and aux factor > 0");
        }
        if (!(r.getAhuPressureDrop() >= 0) || !(r.getMakeupFraction() >= 0)) {
            throw new InvalidInputException("AHU pressure drop and makeup fraction must be >= 0");
        }
        double dT = on.getDryBulb() - off.getDryBulb();
        if (!(dT > 0)) {
            throw new InvalidInputException("CRAH on-coil dry-bulb must be above off-coil, ΔT=" + dT + " K");
        }

        double qs = r.getItLoad() * r.getAuxLoadFactor();
        double crahMass = qs / (on.getHumidSpecificHeat() * dT);
        double crahVolume = crahMass / ((on.getDensity() + off.getDensity()) / 2.0);

        Double override = r.getAhuVolumeFlowOverride();
        double ahuVolume = override != null && override > 0 ? override : r.getMakeupFraction() * crahVolume;
        double ahuMass = ahuVolume * dehum.getDensity();

        double fan = ahuVolume * r.getAhuPressureDrop() / 1000.0;
        double fanRise = ahuMass > 0 ? fan / (ahuMass * dehum.getHumidSpecificHeat()) : 0.0;

        log.debug("Flows: Qs={} kW, CRAH {} kg/s / {} m³/s, AHU {} m³/s / {} kg/s, fan {} kW (+{} K)",
                qs, crahMass, crahVolume, ahuVolume, ahuMass, fan, fanRise);

        return SystemFlows.builder()
                .sensibleLoad(qs)
                .crahMassFlow(crahMass)
                .crahVolumeFlow(crahVolume)
                .ahuVolumeFlow(ahuVolume)
                .ahuMassFlow(ahuMass)
                .fanLoad(fan)
                .fanTemperatureRise(fanRise)
                .build();
    }
}
