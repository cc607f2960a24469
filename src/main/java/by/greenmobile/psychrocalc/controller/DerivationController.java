package by.greenmobile.psychrocalc.controller;

import by.greenmobile.psychrocalc.entity.OffCoilDerivationRequest;
import by.greenmobile.psychrocalc.entity.ShrDerivationRequest;
import by.greenmobile.psychrocalc.entity.ShrDerivationResponse;
import by.greenmobile.psychrocalc.entity.StateInput;
import by.greenmobile.psychrocalc.service.design.DerivationRules;
import by.greenmobile.psychrocalc.service.design.KnownSide;
import by.greenmobile.psychrocalc.service.design.OffCoilRequest;
import by.greenmobile.psychrocalc.service.design.ShrPairingRequest;
import by.greenmobile.psychrocalc.service.engine.ProcessEvaluator;
import by.greenmobile.psychrocalc.service.engine.ProcessResult;
import by.greenmobile.psychrocalc.service.physics.AirState;
import by.greenmobile.psychrocalc.service.physics.AtmosphericContext;
import by.greenmobile.psychrocalc.service.physics.PropertyConverter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/derive")
@RequiredArgsConstructor
public class DerivationController {

    private final PropertyConverter converter;
    private final ProcessEvaluator processEvaluator;
    private final DerivationRules derivationRules;

    @PostMapping("/off-coil")
    public AirState offCoil(@Valid @RequestBody OffCoilDerivationRequest r) {
        AtmosphericContext ctx = AtmosphericContext.of(r.getPressure(), r.getAltitude());
        return derivationRules.offCoil(ctx, OffCoilRequest.builder()
                .coilDewPoint(r.getCoilDewPoint())
                .targetRelativeHumidity(r.getTargetRelativeHumidity())
                .approach(r.getApproach())
                .dryBulb(r.getDryBulb())
                .build());
    }

    @PostMapping("/shr")
    public ShrDerivationResponse shr(@Valid @RequestBody ShrDerivationRequest r) {
        AtmosphericContext ctx = AtmosphericContext.of(r.getPressure(), r.getAltitude());
        StateInput k = r.getKnown();
        AirState known = converter.resolve(ctx, k.getDryBulb(), k.getPair(), k.getValue());

        AirState unknown = derivationRules.pairBySensibleHeatRatio(ShrPairingRequest.builder()
                .known(known)
                .knownSide(r.getKnownSide())
                .unknownDryBulb(r.getUnknownDryBulb())
                .targetSensibleHeatRatio(r.getTargetSensibleHeatRatio())
                .build());

        boolean entering = r.getKnownSide() == KnownSide.ENTERING;
        double massFlow = r.getMassFlow() != null ? r.getMassFlow() : 1.0;
        ProcessResult process = processEvaluator.evaluate("SHR " + r.getTargetSensibleHeatRatio(),
                entering ? known : unknown, entering ? unknown : known, massFlow);
        return new ShrDerivationResponse(unknown, process);
    }
}
