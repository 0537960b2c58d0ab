package info.isaksson.erland.sfsymbolsgen.ir;

public enum IrBindingKind {
    VAR("var"),
    LET("let");

    public final String keyword;

    IrBindingKind(String keyword) {
        this.keyword = keyword;
    }
}
