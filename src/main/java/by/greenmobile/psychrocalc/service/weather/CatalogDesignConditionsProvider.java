package by.greenmobile.psychrocalc.service.weather;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

@Component
@Slf4j
public class CatalogDesignConditionsProvider implements DesignConditionsProvider {

    @Override
    public List<DesignLocation> locations() {
        List<DesignLocation> out = new ArrayList<>();
        for (DesignLocation l : DesignLocation.values()) {
            if (l != DesignLocation.CUSTOM) {
                out.add(l);
            }
        }
        out.sort(Comparator.comparing(DesignLocation::getDisplayName));
        out.add(DesignLocation.CUSTOM);
        return out;
    }

    @Override
    public DesignConditions conditionsFor(DesignLocation location) {
        Objects.requireNonNull(location, "location");
        DesignConditions c = location.getConditions();
        log.debug("Design conditions for {}: alt={} m, cooling N=20 {}/{} °C", location,
                c.getAltitude(), c.getCoolingDryBulbN20(), c.getCoolingWetBulbN20());
        return c;
    }
}
