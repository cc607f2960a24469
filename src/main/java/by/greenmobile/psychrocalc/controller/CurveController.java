package by.greenmobile.psychrocalc.controller;

import by.greenmobile.psychrocalc.config.PsychroProperties;
import by.greenmobile.psychrocalc.entity.CurveRequest;
import by.greenmobile.psychrocalc.entity.CurveResponse;
import by.greenmobile.psychrocalc.service.engine.CurveGenerator;
import by.greenmobile.psychrocalc.service.engine.IsoLine;
import by.greenmobile.psychrocalc.service.physics.AtmosphericContext;
import by.greenmobile.psychrocalc.service.physics.InvalidInputException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/curves")
@RequiredArgsConstructor
public class CurveController {

    private final CurveGenerator curveGenerator;
    private final PsychroProperties properties;

    @PostMapping
    public CurveResponse curve(@Valid @RequestBody CurveRequest r) {
        AtmosphericContext ctx = AtmosphericContext.of(r.getPressure(), r.getAltitude());
        if (r.getSamples() != null && r.getStep() != null) {
            throw new InvalidInputException("Give either samples or step, not both");
        }
        IsoLine line;
        if (r.getStep() != null) {
            line = curveGenerator.generateWithStep(r.getKind(), r.getValue(), r.getMinDryBulb(), r.getMaxDryBulb(),
                    r.getStep(), ctx);
        } else {
            int samples = r.getSamples() != null ? r.getSamples() : properties.getChart().getSamples();
            line = curveGenerator.generate(r.getKind(), r.getValue(), r.getMinDryBulb(), r.getMaxDryBulb(),
                    samples, ctx);
        }
        return CurveResponse.from(line);
    }

    /**
     * Default chart families (saturation, RH, enthalpy, wet-bulb) over the configured domain.
     */
    @GetMapping("/chart")
    public List<CurveResponse> chart(@RequestParam(required = false) Double pressure,
                                     @RequestParam(required = false) Double altitude) {
        AtmosphericContext ctx = AtmosphericContext.of(pressure, altitude);
        return curveGenerator.chartFamilies(ctx).stream()
                .map(CurveResponse::from)
                .toList();
    }
}
