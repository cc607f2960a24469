package by.greenmobile.psychrocalc.controller;

import by.greenmobile.psychrocalc.entity.ProcessRequest;
import by.greenmobile.psychrocalc.entity.StateInput;
import by.greenmobile.psychrocalc.service.engine.ProcessEvaluator;
import by.greenmobile.psychrocalc.service.engine.ProcessResult;
import by.greenmobile.psychrocalc.service.physics.AirState;
import by.greenmobile.psychrocalc.service.physics.AtmosphericContext;
import by.greenmobile.psychrocalc.service.physics.InvalidInputException;
import by.greenmobile.psychrocalc.service.physics.PropertyConverter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/processes")
@RequiredArgsConstructor
public class ProcessController {

    private final PropertyConverter converter;
    private final ProcessEvaluator processEvaluator;

    @PostMapping
    public ProcessResult evaluate(@Valid @RequestBody ProcessRequest r) {
        if ((r.getMassFlow() == null) == (r.getVolumeFlow() == null)) {
            throw new InvalidInputException("Give exactly one of massFlow or volumeFlow");
        }
        AtmosphericContext ctx = AtmosphericContext.of(r.getPressure(), r.getAltitude());
        AirState in = resolve(ctx, r.getEntering());
        AirState out = resolve(ctx, r.getLeaving());
        String name = r.getName() != null ? r.getName() : "Process";

        return r.getMassFlow() != null
                ? processEvaluator.evaluate(name, in, out, r.getMassFlow())
                : processEvaluator.evaluateVolumetric(name, in, out, r.getVolumeFlow());
    }

    private AirState resolve(AtmosphericContext ctx, StateInput s) {
        return converter.resolve(ctx, s.getDryBulb(), s.getPair(), s.getValue());
    }
}
