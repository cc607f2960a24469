package by.greenmobile.psychrocalc.controller;

import by.greenmobile.psychrocalc.entity.StateInput;
import by.greenmobile.psychrocalc.entity.StateRequest;
import by.greenmobile.psychrocalc.service.physics.AirState;
import by.greenmobile.psychrocalc.service.physics.AtmosphericContext;
import by.greenmobile.psychrocalc.service.physics.PropertyConverter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/states")
@RequiredArgsConstructor
@Slf4j
public class StateController {

    private final PropertyConverter converter;

    @PostMapping
    public AirState resolve(@Valid @RequestBody StateRequest request) {
        AtmosphericContext ctx = AtmosphericContext.of(request.getPressure(), request.getAltitude());
        StateInput s = request.getState();
        log.debug("State: {} °C + {}={} at {} Pa", s.getDryBulb(), s.getPair(), s.getValue(), ctx.getPressure());
        return converter.resolve(ctx, s.getDryBulb(), s.getPair(), s.getValue());
    }
}
