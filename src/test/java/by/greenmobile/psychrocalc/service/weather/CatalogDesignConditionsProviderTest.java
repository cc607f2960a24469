package by.greenmobile.psychrocalc.service.weather;

import by.greenmobile.psychrocalc.service.physics.InvalidInputException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CatalogDesignConditionsProviderTest {

    private final CatalogDesignConditionsProvider provider = new CatalogDesignConditionsProvider();

    @Test
    void locationsAreAlphabeticalWithCustomLast() {
        List<DesignLocation> locations = provider.locations();

        assertThat(locations).hasSize(DesignLocation.values().length);
        assertThat(locations.get(0)).isEqualTo(DesignLocation.ABU_DHABI);
        assertThat(locations.get(locations.size() - 1)).isEqualTo(DesignLocation.CUSTOM);
        assertThat(locations.subList(0, locations.size() - 1))
                .extracting(DesignLocation::getDisplayName)
                .isSorted();
    }

    @Test
    void recordCarriesCatalogValues() {
        DesignConditions london = provider.conditionsFor(DesignLocation.LONDON);

        assertThat(london.getCountry()).isEqualTo("UK");
        assertThat(london.getAltitude()).isEqualTo(25.0);
        assertThat(london.getCoolingDryBulbN20()).isEqualTo(30.5);
        assertThat(london.getHeatingDryBulb004()).isEqualTo(-1.8);
    }

    @ParameterizedTest
    @ValueSource(strings = {"HONG_KONG", "hong kong", "Hong-Kong", "  Hong Kong "})
    void keysAreLenient(String key) {
        assertThat(DesignLocation.fromKey(key)).isEqualTo(DesignLocation.HONG_KONG);
    }

    @Test
    void unknownKeyIsInvalidInput() {
        assertThatThrownBy(() -> DesignLocation.fromKey("Atlantis")).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> DesignLocation.fromKey(" ")).isInstanceOf(InvalidInputException.class);
    }

    @ParameterizedTest
    @EnumSource(DesignLocation.class)
    void catalogIsPhysicallyOrdered(DesignLocation location) {
        DesignConditions c = location.getConditions();

        assertThat(c.getCoolingWetBulbN20()).isLessThanOrEqualTo(c.getCoolingDryBulbN20());
        assertThat(c.getCoolingWetBulb04()).isLessThanOrEqualTo(c.getCoolingDryBulb04());
        assertThat(c.getDehumidWetBulb()).isLessThanOrEqualTo(c.getDehumidDryBulb());
        assertThat(c.getHeatingDryBulbN20()).isLessThanOrEqualTo(c.getHeatingDryBulb004());
    }

    @Test
    void winterWetBulbNeverExceedsDryBulb() {
        DesignConditions london = DesignLocation.LONDON.getConditions();

        assertThat(london.winterWetBulb(-1.8)).isEqualTo(-1.8);
        assertThat(london.winterWetBulb(10.0)).isEqualTo(4.0);
    }
}
