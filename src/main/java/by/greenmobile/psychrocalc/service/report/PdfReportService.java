package by.greenmobile.psychrocalc.service.report;

import by.greenmobile.psychrocalc.entity.DesignResult;
import by.greenmobile.psychrocalc.service.design.SystemFlows;
import by.greenmobile.psychrocalc.service.engine.ProcessResult;
import by.greenmobile.psychrocalc.service.physics.AirState;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;

/**
 * Engineering report of a design run: summary and flows, state table, process loads, notes.
 * Standard Helvetica, so all text must stay within WinAnsi (see {@link #pdfSafe}).
 */
@Service
public class PdfReportService {

    private static final float M = 40f;
    private static final float W = PDRectangle.A4.getWidth();
    private static final float H = PDRectangle.A4.getHeight();
    private static final float MAX_WIDTH = W - 2 * M;

    private static final float[] STATE_COLUMNS = {0, 120, 170, 220, 270, 320, 375, 430, 485};
    private static final String[] STATE_HEADER =
            {"State", "Tdb °C", "Twb °C", "Tdp °C", "RH %", "W g/kg", "h kJ/kg", "v m³/kg", "rho kg/m³"};

    private static final float[] PROCESS_COLUMNS = {0, 150, 205, 260, 315, 370, 420};
    private static final String[] PROCESS_HEADER =
            {"Process", "m kg/s", "Qs kW", "Ql kW", "Qt kW", "SHR", "Moist. g/s"};

    public byte[] buildDesignReport(DesignResult r) throws IOException {
        try (PDDocument doc = new PDDocument()) {
            Cursor c = new Cursor(doc);
            writeHeader(c, "PSYCHROMETRIC DESIGN REPORT");
            writeSummary(c, r);

            c.newPage();
            writeHeader(c, "AIR STATES");
            writeStateTable(c, r.getStates());

            c.newPage();
            writeHeader(c, "PROCESS LOADS");
            writeProcessTable(c, r);
            writeNotes(c);

            c.close();
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            doc.save(out);
            return out.toByteArray();
        }
    }

    private void writeSummary(Cursor c, DesignResult r) throws IOException {
        float y = c.y;
        y = h2(c, y, "Site");
        y = kv(c, y, "Location", r.getLocationName() + " (" + r.getLocation() + ")");
        y = kv(c, y, "Altitude", r.getAltitude() != null ? fmt(r.getAltitude(), 0) + " m" : "- (pressure given)");
        y = kv(c, y, "Atmospheric pressure", fmt(r.getPressure(), 0) + " Pa");
        y = kv(c, y, "CRAH off-coil dew point", fmt(r.getCrahOffDewPoint(), 2) + " °C");

        SystemFlows f = r.getFlows();
        y -= 8;
        y = h2(c, y, "System flows");
        y = kv(c, y, "Sensible load (IT + aux)", fmt(f.getSensibleLoad(), 1) + " kW");
        y = kv(c, y, "CRAH mass flow", fmt(f.getCrahMassFlow(), 2) + " kg/s");
        y = kv(c, y, "CRAH volume flow", fmt(f.getCrahVolumeFlow(), 2) + " m³/s");
        y = kv(c, y, "AHU volume flow", fmt(f.getAhuVolumeFlow(), 3) + " m³/s");
        y = kv(c, y, "AHU mass flow", fmt(f.getAhuMassFlow(), 3) + " kg/s");
        y = kv(c, y, "AHU fan load", fmt(f.getFanLoad(), 3) + " kW");
        y = kv(c, y, "AHU fan temperature rise", fmt(f.getFanTemperatureRise(), 3) + " K");
        c.y = y;
    }

    private void writeStateTable(Cursor c, Map<String, AirState> states) throws IOException {
        float y = c.y;
        y = row(c, y, STATE_COLUMNS, STATE_HEADER, true);
        for (Map.Entry<String, AirState> e : states.entrySet()) {
            AirState s = e.getValue();
            y = row(c, y, STATE_COLUMNS, new String[]{
                    e.getKey(),
                    fmt(s.getDryBulb(), 2),
                    fmt(s.getWetBulb(), 2),
                    fmt(s.getDewPoint(), 2),
                    fmt(s.getRelativeHumidity() * 100.0, 1),
                    fmt(s.getHumidityRatioGramsPerKg(), 3),
                    fmt(s.getEnthalpy(), 2),
                    fmt(s.getSpecificVolume(), 4),
                    fmt(s.getDensity(), 4)
            }, false);
        }
        c.y = y;
    }

    private void writeProcessTable(Cursor c, DesignResult r) throws IOException {
        float y = c.y;
        y = row(c, y, PROCESS_COLUMNS, PROCESS_HEADER, true);
        for (ProcessResult p : r.getProcesses()) {
            y = row(c, y, PROCESS_COLUMNS, new String[]{
                    p.getName(),
                    fmt(p.getMassFlow(), 3),
                    fmt(p.getSensibleHeat(), 2),
                    fmt(p.getLatentHeat(), 2),
                    fmt(p.getTotalHeat(), 2),
                    p.getSensibleHeatRatio() != null ? fmt(p.getSensibleHeatRatio(), 3) : "-",
                    fmt(p.getMoistureRemoval(), 3)
            }, false);
        }
        c.y = y - 10;
    }

    private void writeNotes(Cursor c) throws IOException {
        float y = c.y;
        y = h2(c, y, "Notes");
        y = paragraph(c, y, "1) Properties per ASHRAE Handbook Fundamentals (SI), Hyland-Wexler saturation pressure. "
                + "Enthalpy and humidity ratio are per kg of dry air.");
        y = paragraph(c, y, "2) Signs: positive heat is added to the airstream. Positive moisture is removed "
                + "(dehumidification). SHR is omitted when the total load is below 0.001 kW.");
        y = paragraph(c, y, "3) Mass flow = volume flow x leaving-state density. Sensible heat uses the humid specific "
                + "heat of the entering state, latent heat = total - sensible.");
        y = paragraph(c, y, "4) Off-coil states: Max Cool and Dehum are saturated at the CRAH off-coil dew point plus "
                + "their margins, Enthalpy is saturated at the target enthalpy, Heat is the winter outdoor air "
                + "heated to the CRAH on-coil dry-bulb.");
        c.y = y;
    }

    // ===== Drawing helpers =====

    private void writeHeader(Cursor c, String title) throws IOException {
        float y = H - 60;
        text(c, c.fontBold, 16, M, y, title);
        text(c, c.font, 9, W - M - 90, y + 4, "Date: " + LocalDate.now().format(DateTimeFormatter.ofPattern("dd.MM.yyyy")));
        c.y = H - 90;
    }

    private float h2(Cursor c, float y, String t) throws IOException {
        y = c.ensureSpace(y, 26);
        text(c, c.fontBold, 12, M, y, t);
        return y - 17;
    }

    private float kv(Cursor c, float y, String key, String value) throws IOException {
        y = c.ensureSpace(y, 16);
        text(c, c.font, 10, M, y, key + ":");
        text(c, c.fontBold, 10, M + 220, y, value);
        return y - 15;
    }

    private float row(Cursor c, float y, float[] columns, String[] cells, boolean header) throws IOException {
        y = c.ensureSpace(y, 15);
        PDFont f = header ? c.fontBold : c.font;
        for (int i = 0; i < cells.length; i++) {
            text(c, f, 8, M + columns[i], y, cells[i]);
        }
        if (header) {
            c.cs.moveTo(M, y - 4);
            c.cs.lineTo(M + MAX_WIDTH, y - 4);
            c.cs.stroke();
        }
        return y - 14;
    }

    private float paragraph(Cursor c, float y, String text) throws IOException {
        y = c.ensureSpace(y, 20);
        int size = 10;
        float leading = 14;
        String[] words = text.split("\\s+");
        StringBuilder line = new StringBuilder();

        for (String word : words) {
            String test = (line.length() == 0) ? word : (line + " " + word);
            float tw = c.font.getStringWidth(pdfSafe(test)) / 1000f * size;
            if (tw > MAX_WIDTH && line.length() > 0) {
                y = c.ensureSpace(y, leading);
                text(c, c.font, size, M, y, line.toString());
                y -= leading;
                line = new StringBuilder(word);
            } else {
                if (line.length() > 0) line.append(" ");
                line.append(word);
            }
        }
        if (line.length() > 0) {
            y = c.ensureSpace(y, leading);
            text(c, c.font, size, M, y, line.toString());
            y -= leading;
        }
        return y - 4;
    }

    private void text(Cursor c, PDFont f, int size, float x, float y, String t) throws IOException {
        c.cs.beginText();
        c.cs.setFont(f, size);
        c.cs.newLineAtOffset(x, y);
        c.cs.showText(pdfSafe(t));
        c.cs.endText();
    }

    // ===== Formatting =====

    private static String fmt(double v, int decimals) {
        return String.format(Locale.US, "%." + decimals + "f", v);
    }

    /** Helvetica is WinAnsi only; Latin-1 passes, the rest is spelled out or replaced. */
    static String pdfSafe(String s) {
        StringBuilder b = new StringBuilder(s.length());
        for (char ch : s.toCharArray()) {
            if (ch == '→') b.append("->");
            else if (ch == 'Δ') b.append("d");
            else if (ch == '≥') b.append(">=");
            else if (ch == '≤') b.append("<=");
            else if (ch >= 0x20 && ch < 0x7F || ch >= 0xA0 && ch <= 0xFF) b.append(ch);
            else b.append('?');
        }
        return b.toString();
    }

    // ===== Cursor / pagination =====

    private static class Cursor {
        final PDDocument doc;
        final PDFont font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
        final PDFont fontBold = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);
        PDPage page;
        PDPageContentStream cs;
        float y;

        Cursor(PDDocument doc) throws IOException {
            this.doc = doc;
            newPage();
        }

        void newPage() throws IOException {
            if (cs != null) cs.close();
            page = new PDPage(PDRectangle.A4);
            doc.addPage(page);
            cs = new PDPageContentStream(doc, page);
            y = H - 90;
        }

        void close() throws IOException {
            if (cs != null) {
                cs.close();
                cs = null;
            }
        }

        float ensureSpace(float currentY, float needed) throws IOException {
            if (currentY - needed < M) {
                newPage();
                return H - 90;
            }
            return currentY;
        }
    }
}
