package by.greenmobile.psychrocalc.service;

import by.greenmobile.psychrocalc.config.PsychroProperties;
import by.greenmobile.psychrocalc.entity.DesignResult;
import by.greenmobile.psychrocalc.service.engine.ChartPoint;
import by.greenmobile.psychrocalc.service.engine.CurveGenerator;
import by.greenmobile.psychrocalc.service.engine.CurveKind;
import by.greenmobile.psychrocalc.service.engine.IsoLine;
import by.greenmobile.psychrocalc.service.engine.ProcessResult;
import by.greenmobile.psychrocalc.service.physics.AirState;
import by.greenmobile.psychrocalc.service.physics.AtmosphericContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * SVG psychrometric chart:
 * - x = dry-bulb °C, y = humidity ratio g/kg (origin bottom left)
 * - iso-line families from {@link CurveGenerator#chartFamilies}
 * - ASHRAE A1 zone, labelled states and process lines when given
 */
@Service
@Slf4j
public class ChartSvgService {

    private static final double WIDTH = 960;
    private static final double HEIGHT = 600;
    private static final double PAD_LEFT = 60;
    private static final double PAD_RIGHT = 30;
    private static final double PAD_TOP = 30;
    private static final double PAD_BOTTOM = 50;

    /** g/kg, top of the plot. */
    private static final double MAX_HUMIDITY_RATIO_G = 32.0;

    private final CurveGenerator curveGenerator;
    private final double minDryBulb;
    private final double maxDryBulb;

    public ChartSvgService(CurveGenerator curveGenerator, PsychroProperties properties) {
        this.curveGenerator = curveGenerator;
        this.minDryBulb = properties.getChart().getMinDryBulb();
        this.maxDryBulb = properties.getChart().getMaxDryBulb();
    }

    public String generateSvg(DesignResult result) {
        return generateSvg(AtmosphericContext.ofPressure(result.getPressure()), result.getStates(), result.getProcesses());
    }

    /**
     * @param states    label → state, may be empty
     * @param processes drawn as arrows entering → leaving, may be empty
     */
    public String generateSvg(AtmosphericContext ctx, Map<String, AirState> states, List<ProcessResult> processes) {
        StringBuilder svg = new StringBuilder();
        svg.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        svg.append("<svg xmlns=\"http://www.w3.org/2000/svg\" ")
                .append("width=\"").append(fmt(WIDTH)).append("\" ")
                .append("height=\"").append(fmt(HEIGHT)).append("\" ")
                .append("viewBox=\"0 0 ").append(fmt(WIDTH)).append(" ").append(fmt(HEIGHT)).append("\" ")
                .append("font-family=\"Helvetica, Arial, sans-serif\">\n");

        svg.append("  <defs>\n");
        svg.append("    <marker id=\"arrow\" markerWidth=\"8\" markerHeight=\"8\" refX=\"7\" refY=\"4\" orient=\"auto\">\n");
        svg.append("      <path d=\"M0,0 L8,4 L0,8 z\" fill=\"#333\" />\n");
        svg.append("    </marker>\n");
        svg.append("    <clipPath id=\"plot\"><rect x=\"").append(fmt(PAD_LEFT)).append("\" y=\"").append(fmt(PAD_TOP))
                .append("\" width=\"").append(fmt(plotWidth())).append("\" height=\"").append(fmt(plotHeight()))
                .append("\" /></clipPath>\n");
        svg.append("  </defs>\n");

        svg.append("  <rect x=\"0\" y=\"0\" width=\"").append(fmt(WIDTH)).append("\" height=\"").append(fmt(HEIGHT))
                .append("\" fill=\"#ffffff\" />\n");

        appendGrid(svg);

        svg.append("  <g clip-path=\"url(#plot)\">\n");
        for (IsoLine line : curveGenerator.chartFamilies(ctx)) {
            appendIsoLine(svg, line);
        }
        if (states != null) {
            appendAshraeZone(svg, states);
        }
        if (processes != null) {
            for (ProcessResult p : processes) {
                appendProcess(svg, p);
            }
        }
        svg.append("  </g>\n");

        if (states != null) {
            for (Map.Entry<String, AirState> e : states.entrySet()) {
                appendState(svg, e.getKey(), e.getValue());
            }
        }

        svg.append("  <text x=\"").append(fmt(WIDTH - PAD_RIGHT)).append("\" y=\"").append(fmt(PAD_TOP - 10))
                .append("\" font-size=\"11\" text-anchor=\"end\" fill=\"#555\">")
                .append(esc(String.format(Locale.US, "p = %.0f Pa", ctx.getPressure())))
                .append("</text>\n");

        svg.append("</svg>\n");
        return svg.toString();
    }

    // ===== layers =====

    private void appendGrid(StringBuilder svg) {
        double x0 = PAD_LEFT;
        double y0 = PAD_TOP + plotHeight();
        svg.append("  <g stroke=\"#e5e5e5\" stroke-width=\"0.5\" font-size=\"10\" fill=\"#555\">\n");
        for (double t = Math.ceil(minDryBulb / 5.0) * 5.0; t <= maxDryBulb; t += 5.0) {
            double x = x(t);
            svg.append("    <line x1=\"").append(fmt(x)).append("\" y1=\"").append(fmt(PAD_TOP))
                    .append("\" x2=\"").append(fmt(x)).append("\" y2=\"").append(fmt(y0)).append("\" />\n");
            svg.append("    <text x=\"").append(fmt(x)).append("\" y=\"").append(fmt(y0 + 14))
                    .append("\" text-anchor=\"middle\" stroke=\"none\">").append(fmt0(t)).append("</text>\n");
        }
        for (double w = 0; w <= MAX_HUMIDITY_RATIO_G; w += 4.0) {
            double y = y(w);
            svg.append("    <line x1=\"").append(fmt(x0)).append("\" y1=\"").append(fmt(y))
                    .append("\" x2=\"").append(fmt(x0 + plotWidth())).append("\" y2=\"").append(fmt(y)).append("\" />\n");
            svg.append("    <text x=\"").append(fmt(x0 - 6)).append("\" y=\"").append(fmt(y + 3))
                    .append("\" text-anchor=\"end\" stroke=\"none\">").append(fmt0(w)).append("</text>\n");
        }
        svg.append("  </g>\n");

        svg.append("  <rect x=\"").append(fmt(x0)).append("\" y=\"").append(fmt(PAD_TOP))
                .append("\" width=\"").append(fmt(plotWidth())).append("\" height=\"").append(fmt(plotHeight()))
                .append("\" fill=\"none\" stroke=\"#333\" stroke-width=\"1\" />\n");
        svg.append("  <text x=\"").append(fmt(x0 + plotWidth() / 2)).append("\" y=\"").append(fmt(HEIGHT - 12))
                .append("\" font-size=\"12\" text-anchor=\"middle\">Dry-bulb temperature, °C</text>\n");
        svg.append("  <text x=\"16\" y=\"").append(fmt(PAD_TOP + plotHeight() / 2))
                .append("\" font-size=\"12\" text-anchor=\"middle\" transform=\"rotate(-90 16 ")
                .append(fmt(PAD_TOP + plotHeight() / 2)).append(")\">Humidity ratio, g/kg</text>\n");
    }

    private void appendIsoLine(StringBuilder svg, IsoLine line) {
        List<ChartPoint> pts = line.points();
        if (pts.size() < 2) {
            log.trace("Chart: {} has no drawable points", line.getLabel());
            return;
        }
        String stroke;
        String width;
        String dash = "";
        switch (line.getKind()) {
            case SATURATION -> { stroke = "#1f1f1f"; width = "2"; }
            case RELATIVE_HUMIDITY -> { stroke = "#9a9a9a"; width = "0.8"; dash = " stroke-dasharray=\"3,3\""; }
            case ENTHALPY -> { stroke = "#6aa8e8"; width = "0.6"; }
            default -> { stroke = "#c8c864"; width = "0.6"; dash = " stroke-dasharray=\"1,3\""; }
        }

        svg.append("    <polyline fill=\"none\" stroke=\"").append(stroke).append("\" stroke-width=\"").append(width)
                .append("\"").append(dash).append(" points=\"");
        for (ChartPoint p : pts) {
            svg.append(fmt(x(p.getDryBulb()))).append(",").append(fmt(y(p.getHumidityRatio() * 1000.0))).append(" ");
        }
        svg.append("\"><title>").append(esc(line.getLabel())).append("</title></polyline>\n");

        if (line.getKind() == CurveKind.RELATIVE_HUMIDITY) {
            ChartPoint last = labelPoint(pts);
            svg.append("    <text x=\"").append(fmt(x(last.getDryBulb()) + 2)).append("\" y=\"")
                    .append(fmt(y(last.getHumidityRatio() * 1000.0) - 2))
                    .append("\" font-size=\"9\" fill=\"#777\">").append(esc(line.getLabel())).append("</text>\n");
        }
    }

    /** Last point still inside the plot. */
    private static ChartPoint labelPoint(List<ChartPoint> pts) {
        ChartPoint best = pts.get(0);
        for (ChartPoint p : pts) {
            if (p.getHumidityRatio() * 1000.0 <= MAX_HUMIDITY_RATIO_G) best = p;
        }
        return best;
    }

    private void appendAshraeZone(StringBuilder svg, Map<String, AirState> states) {
        String[] corners = {"ASHRAE 18 Low", "ASHRAE 27 Low", "ASHRAE 27 High", "ASHRAE 18 High"};
        StringBuilder pts = new StringBuilder();
        for (String c : corners) {
            AirState s = states.get(c);
            if (s == null) return;
            pts.append(fmt(x(s.getDryBulb()))).append(",").append(fmt(y(s.getHumidityRatioGramsPerKg()))).append(" ");
        }
        svg.append("    <polygon points=\"").append(pts).append("\" fill=\"#2ecc71\" fill-opacity=\"0.12\" ")
                .append("stroke=\"#2ecc71\" stroke-width=\"1\"><title>ASHRAE A1</title></polygon>\n");
    }

    private void appendProcess(StringBuilder svg, ProcessResult p) {
        AirState a = p.getEntering();
        AirState b = p.getLeaving();
        svg.append("    <line x1=\"").append(fmt(x(a.getDryBulb()))).append("\" y1=\"").append(fmt(y(a.getHumidityRatioGramsPerKg())))
                .append("\" x2=\"").append(fmt(x(b.getDryBulb()))).append("\" y2=\"").append(fmt(y(b.getHumidityRatioGramsPerKg())))
                .append("\" stroke=\"#333\" stroke-width=\"1.2\" marker-end=\"url(#arrow)\"><title>")
                .append(esc(p.getName())).append("</title></line>\n");
    }

    private void appendState(StringBuilder svg, String label, AirState s) {
        double x = x(s.getDryBulb());
        double y = y(s.getHumidityRatioGramsPerKg());
        if (x < PAD_LEFT || x > PAD_LEFT + plotWidth() || y < PAD_TOP || y > PAD_TOP + plotHeight()) {
            log.debug("Chart: state '{}' outside plot ({} °C, {} g/kg)", label, s.getDryBulb(), s.getHumidityRatioGramsPerKg());
            return;
        }
        svg.append("  <circle cx=\"").append(fmt(x)).append("\" cy=\"").append(fmt(y))
                .append("\" r=\"4\" fill=\"").append(colorOf(label)).append("\" stroke=\"#222\" stroke-width=\"0.5\">")
                .append("<title>").append(esc(label)).append("</title></circle>\n");
        svg.append("  <text x=\"").append(fmt(x + 6)).append("\" y=\"").append(fmt(y - 6))
                .append("\" font-size=\"9\" fill=\"#222\">").append(esc(label)).append("</text>\n");
    }

    private static String colorOf(String label) {
        if (label.startsWith("ASHRAE")) return "#2ecc71";
        if (label.startsWith("CRAH")) return "#e74c3c";
        if (label.startsWith("OAT")) return "#f39c12";
        if (label.startsWith("OC")) return "#00c3ff";
        if (label.startsWith("Return")) return "#9b59b6";
        return "#555555";
    }

    // ===== coordinates =====

    private double plotWidth() {
        return WIDTH - PAD_LEFT - PAD_RIGHT;
    }

    private double plotHeight() {
        return HEIGHT - PAD_TOP - PAD_BOTTOM;
    }

    private double x(double dryBulb) {
        return PAD_LEFT + (dryBulb - minDryBulb) / (maxDryBulb - minDryBulb) * plotWidth();
    }

    private double y(double humidityRatioG) {
        return PAD_TOP + plotHeight() - humidityRatioG / MAX_HUMIDITY_RATIO_G * plotHeight();
    }

    private static String fmt(double v) {
        return String.format(Locale.US, "%.2f", v);
    }

    private static String fmt0(double v) {
        return String.format(Locale.US, "%.0f", v);
    }

    private static String esc(String s) {
        return s.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;").replace("\"", "&quot;");
    }
}
