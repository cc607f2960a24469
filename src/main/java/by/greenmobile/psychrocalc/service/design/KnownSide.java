package by.greenmobile.psychrocalc.service.design;

/** Which end of a coil process the caller already knows. */
public enum KnownSide {
    ENTERING,
    LEAVING
}
