package by.greenmobile.psychrocalc.service.engine;

import by.greenmobile.psychrocalc.service.physics.InputPair;

/**
 * Iso-line families of the chart. Each sweeps dry-bulb with one secondary property held fixed.
 */
public enum CurveKind {
    SATURATION(InputPair.RELATIVE_HUMIDITY, "RH 100%"),
    RELATIVE_HUMIDITY(InputPair.RELATIVE_HUMIDITY, "RH"),
    ENTHALPY(InputPair.ENTHALPY, "h"),
    WET_BULB(InputPair.WET_BULB, "Twb");

    private final InputPair pair;
    private final String symbol;

    CurveKind(InputPair pair, String symbol) {
        this.pair = pair;
        this.symbol = symbol;
    }

    /** The property held constant along the curve. */
    public InputPair getPair() {
        return pair;
    }

    public String getSymbol() {
        return symbol;
    }
}
