package by.greenmobile.psychrocalc.entity;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Input of a full AHU / CRAH design run.
 *
 * Every empty value falls back to psychro.design.* from application.properties.
 * Temperatures °C, loads kW, flows m³/s, pressures Pa.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DesignRequest {

    /** Catalog key, e.g. "LONDON" or "abu dhabi". */
    @NotBlank
    private String location;

    /** Overrides altitude. */
    private Double pressure;

    /** m; the location's altitude when empty. */
    private Double altitude;

    // ===== ASHRAE A1 envelope wet-bulbs (dry-bulbs fixed at 18 / 27 °C) =====

    private Double ashrae18LowWetBulb;
    private Double ashrae18HighWetBulb;
    private Double ashrae27LowWetBulb;
    private Double ashrae27HighWetBulb;

    // ===== outdoor design days; the location's catalog values when empty =====

    private Double oatMaxN20DryBulb;
    private Double oatMaxN20WetBulb;
    private Double oatMax04eDryBulb;
    private Double oatMax04eWetBulb;
    private Double oatMax04hDryBulb;
    private Double oatMax04hWetBulb;
    private Double oatMinN20DryBulb;
    /** Mean coincident winter wet-bulb, capped at the dry-bulb, when empty. */
    private Double oatMinN20WetBulb;
    private Double oatMin04hDryBulb;
    private Double oatMin04hWetBulb;

    // ===== CRAH / room =====

    private Double crahOffDryBulb;
    private Double crahOffWetBulb;
    private Double crahOnDryBulb;
    private Double crahOnWetBulb;
    private Double returnDryBulb;
    private Double returnWetBulb;

    // ===== AHU off-coil control =====

    @PositiveOrZero
    private Double coolMargin;

    @PositiveOrZero
    private Double dehumMargin;

    private Double enthalpyTarget;

    // ===== loads and flows =====

    @PositiveOrZero
    private Double itLoadKw;

    @Positive
    private Double auxLoadFactor;

    /** Fixed AHU volume flow; sized from the makeup fraction when empty. */
    @Positive
    private Double ahuVolumeFlow;

    @PositiveOrZero
    private Double ahuPressureDropPa;

    @PositiveOrZero
    private Double makeupFraction;
}
