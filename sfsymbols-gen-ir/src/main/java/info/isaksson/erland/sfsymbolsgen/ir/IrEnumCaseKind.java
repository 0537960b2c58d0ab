package info.isaksson.erland.sfsymbolsgen.ir;

public enum IrEnumCaseKind {
    NAME_ONLY,
    RAW_VALUE,
    ASSOCIATED_VALUES
}
