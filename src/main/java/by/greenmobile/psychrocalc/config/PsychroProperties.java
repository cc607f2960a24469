package by.greenmobile.psychrocalc.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Engine settings from application.properties (prefix "psychro").
 *
 * Defaults here are the values the engine runs with when a property is absent,
 * so services can also be built by hand in tests: {@code new PsychroProperties()}.
 */
@Data
@ConfigurationProperties(prefix = "psychro")
public class PsychroProperties {

    private Solver solver = new Solver();
    private Chart chart = new Chart();
    private Design design = new Design();

    @Data
    public static class Solver {
        /** Absolute tolerance of iterative solves, on the solved property (°C for temperatures). */
        private double tolerance = 1e-5;

        /** Iteration bound; exceeding it is a ConvergenceException. */
        private int maxIterations = 100;
    }

    @Data
    public static class Chart {
        private double minDryBulb = -5.0;
        private double maxDryBulb = 50.0;
        private int samples = 111;
    }

    /**
     * Design-sheet defaults, used when a design request leaves a value empty.
     */
    @Data
    public static class Design {
        private double crahOffDryBulb = 25.0;
        private double crahOffWetBulb = 16.5;
        private double crahOnDryBulb = 36.0;
        private double crahOnWetBulb = 19.8;
        private double returnDryBulb = 35.0;
        private double returnWetBulb = 25.0;

        /** K above CRAH off-coil dew point for OC Max Cool. */
        private double coolMargin = 2.0;

        /** K above CRAH off-coil dew point for OC Dehum. */
        private double dehumMargin = 4.0;

        /** kJ/kg, saturated OC Enthalpy target. */
        private double enthalpyTarget = 44.0;

        private double itLoadKw = 1500.0;

        /** Lighting, UPS losses, people on top of IT load. */
        private double auxLoadFactor = 1.055;

        private double ahuPressureDropPa = 600.0;

        /** AHU makeup air as a fraction of CRAH room flow. */
        private double makeupFraction = 0.011;
    }
}
