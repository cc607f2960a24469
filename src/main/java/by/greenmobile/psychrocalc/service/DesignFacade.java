package by.greenmobile.psychrocalc.service;

import by.greenmobile.psychrocalc.config.PsychroProperties;
import by.greenmobile.psychrocalc.entity.DesignRequest;
import by.greenmobile.psychrocalc.entity.DesignResult;
import by.greenmobile.psychrocalc.service.design.DerivationRules;
import by.greenmobile.psychrocalc.service.design.FlowSizingRequest;
import by.greenmobile.psychrocalc.service.design.OffCoilSet;
import by.greenmobile.psychrocalc.service.design.OffCoilSetpoints;
import by.greenmobile.psychrocalc.service.design.SystemFlows;
import by.greenmobile.psychrocalc.service.engine.ProcessEvaluator;
import by.greenmobile.psychrocalc.service.engine.ProcessResult;
import by.greenmobile.psychrocalc.service.physics.AirState;
import by.greenmobile.psychrocalc.service.physics.AtmosphericContext;
import by.greenmobile.psychrocalc.service.physics.PropertyConverter;
import by.greenmobile.psychrocalc.service.weather.DesignConditions;
import by.greenmobile.psychrocalc.service.weather.DesignConditionsProvider;
import by.greenmobile.psychrocalc.service.weather.DesignLocation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Single entry point of a design run:
 * - resolves pressure from the request or the location altitude
 * - builds the state table (ASHRAE A1 envelope, CRAH, outdoor design days, AHU off-coil, return air)
 * - sizes CRAH and AHU flows
 * - evaluates the six design processes
 */
@Service
@Slf4j
public class DesignFacade {

    // ASHRAE 2021 A1 recommended envelope corners (dry-bulb / default wet-bulb)
    private static final double[][] ASHRAE_A1 = {{18.0, 6.4}, {18.0, 14.4}, {27.0, 10.27}, {27.0, 13.2}};
    private static final String[] ASHRAE_A1_LABELS = {"ASHRAE 18 Low", "ASHRAE 18 High", "ASHRAE 27 Low", "ASHRAE 27 High"};

    public static final String CRAH_OFF = "CRAH Off-Coil";
    public static final String CRAH_ON = "CRAH On-Coil";
    public static final String OAT_MAX_N20 = "OAT Max N=20";
    public static final String OAT_MAX_04E = "OAT Max 0.4%E";
    public static final String OAT_MAX_04H = "OAT Max 0.4%H";
    public static final String OAT_MIN_N20 = "OAT Min N=20";
    public static final String OAT_MIN_04H = "OAT Min 0.4%H";
    public static final String OC_MAX_COOL = "OC Max Cool";
    public static final String OC_ENTHALPY = "OC Enthalpy";
    public static final String OC_DEHUM = "OC Dehum";
    public static final String OC_HEAT = "OC Heat";
    public static final String RETURN_AIR = "Return Air";

    private final PropertyConverter converter;
    private final ProcessEvaluator processEvaluator;
    private final DerivationRules derivationRules;
    private final DesignConditionsProvider conditionsProvider;
    private final PsychroProperties.Design defaults;

    public DesignFacade(PropertyConverter converter,
                        ProcessEvaluator processEvaluator,
                        DerivationRules derivationRules,
                        DesignConditionsProvider conditionsProvider,
                        PsychroProperties properties) {
        this.converter = converter;
        this.processEvaluator = processEvaluator;
        this.derivationRules = derivationRules;
        this.conditionsProvider = conditionsProvider;
        this.defaults = properties.getDesign();
    }

    public DesignResult solve(DesignRequest req) {
        Objects.requireNonNull(req, "design request");
        DesignLocation location = DesignLocation.fromKey(req.getLocation());
        DesignConditions dc = conditionsProvider.conditionsFor(location);

        AtmosphericContext ctx = req.getPressure() != null
                ? AtmosphericContext.ofPressure(req.getPressure())
                : AtmosphericContext.ofAltitude(or(req.getAltitude(), dc.getAltitude()));

        Map<String, AirState> states = new LinkedHashMap<>();

        // 1) envelope
        Double[] envelopeWetBulbs = {req.getAshrae18LowWetBulb(), req.getAshrae18HighWetBulb(),
                req.getAshrae27LowWetBulb(), req.getAshrae27HighWetBulb()};
        for (int i = 0; i < ASHRAE_A1.length; i++) {
            states.put(ASHRAE_A1_LABELS[i], converter.fromWetBulb(ctx, ASHRAE_A1[i][0],
                    or(envelopeWetBulbs[i], ASHRAE_A1[i][1])));
        }

        // 2) CRAH setpoints
        AirState crahOff = converter.fromWetBulb(ctx,
                or(req.getCrahOffDryBulb(), defaults.getCrahOffDryBulb()),
                or(req.getCrahOffWetBulb(), defaults.getCrahOffWetBulb()));
        double crahOnDb = or(req.getCrahOnDryBulb(), defaults.getCrahOnDryBulb());
        AirState crahOn = converter.fromWetBulb(ctx, crahOnDb,
                or(req.getCrahOnWetBulb(), defaults.getCrahOnWetBulb()));
        states.put(CRAH_OFF, crahOff);
        states.put(CRAH_ON, crahOn);

        // 3) outdoor design days, request values over the catalog
        states.put(OAT_MAX_N20, converter.fromWetBulb(ctx,
                or(req.getOatMaxN20DryBulb(), dc.getCoolingDryBulbN20()),
                or(req.getOatMaxN20WetBulb(), dc.getCoolingWetBulbN20())));
        states.put(OAT_MAX_04E, converter.fromWetBulb(ctx,
                or(req.getOatMax04eDryBulb(), dc.getCoolingDryBulb04()),
                or(req.getOatMax04eWetBulb(), dc.getCoolingWetBulb04())));
        states.put(OAT_MAX_04H, converter.fromWetBulb(ctx,
                or(req.getOatMax04hDryBulb(), dc.getDehumidDryBulb()),
                or(req.getOatMax04hWetBulb(), dc.getDehumidWetBulb())));
        double minN20Db = or(req.getOatMinN20DryBulb(), dc.getHeatingDryBulbN20());
        states.put(OAT_MIN_N20, converter.fromWetBulb(ctx, minN20Db,
                or(req.getOatMinN20WetBulb(), dc.winterWetBulb(minN20Db))));
        double min04hDb = or(req.getOatMin04hDryBulb(), dc.getHeatingDryBulb004());
        AirState winterMinOah = converter.fromWetBulb(ctx, min04hDb,
                or(req.getOatMin04hWetBulb(), dc.winterWetBulb(min04hDb)));
        states.put(OAT_MIN_04H, winterMinOah);

        // 4) AHU off-coil
        OffCoilSet oc = derivationRules.offCoilSet(ctx, OffCoilSetpoints.builder()
                .crahOffCoil(crahOff)
                .crahOnDryBulb(crahOnDb)
                .winterOutdoor(winterMinOah)
                .coolMargin(or(req.getCoolMargin(), defaults.getCoolMargin()))
                .dehumMargin(or(req.getDehumMargin(), defaults.getDehumMargin()))
                .enthalpyTarget(or(req.getEnthalpyTarget(), defaults.getEnthalpyTarget()))
                .build());
        states.put(OC_MAX_COOL, oc.getMaxCool());
        states.put(OC_ENTHALPY, oc.getEnthalpy());
        states.put(OC_DEHUM, oc.getDehum());
        states.put(OC_HEAT, oc.getHeat());

        states.put(RETURN_AIR, converter.fromWetBulb(ctx,
                or(req.getReturnDryBulb(), defaults.getReturnDryBulb()),
                or(req.getReturnWetBulb(), defaults.getReturnWetBulb())));

        // 5) flows
        SystemFlows flows = derivationRules.sizeAirflows(FlowSizingRequest.builder()
                .crahOnCoil(crahOn)
                .crahOffCoil(crahOff)
                .offCoilDehum(oc.getDehum())
                .itLoad(or(req.getItLoadKw(), defaults.getItLoadKw()))
                .auxLoadFactor(or(req.getAuxLoadFactor(), defaults.getAuxLoadFactor()))
                .ahuVolumeFlowOverride(req.getAhuVolumeFlow())
                .ahuPressureDrop(or(req.getAhuPressureDropPa(), defaults.getAhuPressureDropPa()))
                .makeupFraction(or(req.getMakeupFraction(), defaults.getMakeupFraction()))
                .build());

        // 6) processes, in report order
        double vAhu = flows.getAhuVolumeFlow();
        List<ProcessResult> processes = new ArrayList<>();
        processes.add(process("Summer Max Cooling", states, OAT_MAX_N20, OC_MAX_COOL, vAhu));
        processes.add(process("Summer Enthalpy Cooling", states, OAT_MAX_04E, OC_ENTHALPY, vAhu));
        processes.add(process("Summer Dehumidification", states, OAT_MAX_04H, OC_DEHUM, vAhu));
        processes.add(process("CRAH Cooling Loop", states, CRAH_ON, CRAH_OFF, flows.getCrahVolumeFlow()));
        processes.add(process("Winter Heating", states, OAT_MIN_N20, OC_HEAT, vAhu));
        processes.add(process("Winter Min OAH Heating", states, OAT_MIN_04H, OC_HEAT, vAhu));

        log.info("DESIGN: {} at {} Pa, {} states, CRAH {} m³/s, AHU {} m³/s, fan {} kW",
                location, ctx.getPressure(), states.size(), flows.getCrahVolumeFlow(),
                flows.getAhuVolumeFlow(), flows.getFanLoad());

        return DesignResult.builder()
                .location(location)
                .locationName(dc.getLocation())
                .pressure(ctx.getPressure())
                .altitude(ctx.getAltitude())
                .states(states)
                .crahOffDewPoint(oc.getCrahOffDewPoint())
                .flows(flows)
                .processes(processes)
                .build();
    }

    private ProcessResult process(String name, Map<String, AirState> states, String in, String out, double volumeFlow) {
        log.debug("Process {}: {} -> {}", name, in, out);
        return processEvaluator.evaluateVolumetric(name, states.get(in), states.get(out), volumeFlow);
    }

    private static double or(Double value, double fallback) {
        return value != null ? value : fallback;
    }
}
