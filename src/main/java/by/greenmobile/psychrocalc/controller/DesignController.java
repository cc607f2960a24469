package by.greenmobile.psychrocalc.controller;

import by.greenmobile.psychrocalc.entity.DesignRequest;
import by.greenmobile.psychrocalc.entity.DesignResult;
import by.greenmobile.psychrocalc.service.DesignFacade;
import by.greenmobile.psychrocalc.service.weather.DesignConditions;
import by.greenmobile.psychrocalc.service.weather.DesignConditionsProvider;
import by.greenmobile.psychrocalc.service.weather.DesignLocation;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class DesignController {

    private final DesignFacade designFacade;
    private final DesignConditionsProvider conditionsProvider;

    /** Catalog key → design-day record, in selection order. */
    @GetMapping("/locations")
    public Map<DesignLocation, DesignConditions> locations() {
        Map<DesignLocation, DesignConditions> out = new LinkedHashMap<>();
        for (DesignLocation l : conditionsProvider.locations()) {
            out.put(l, conditionsProvider.conditionsFor(l));
        }
        return out;
    }

    @PostMapping("/design")
    public DesignResult design(@Valid @RequestBody DesignRequest request) {
        return designFacade.solve(request);
    }
}
