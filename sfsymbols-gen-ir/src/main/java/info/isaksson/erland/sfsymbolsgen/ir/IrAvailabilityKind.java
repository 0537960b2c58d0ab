package info.isaksson.erland.sfsymbolsgen.ir;

public enum IrAvailabilityKind {
    PLATFORM_VERSIONS,
    DEPRECATED
}
