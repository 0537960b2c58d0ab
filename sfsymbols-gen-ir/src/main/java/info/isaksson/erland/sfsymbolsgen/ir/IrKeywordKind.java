package info.isaksson.erland.sfsymbolsgen.ir;

public enum IrKeywordKind {
    RETURN("return"),
    TRY("try"),
    TRY_OPTIONAL("try?"),
    AWAIT("await"),
    THROW("throw"),
    YIELD("yield");

    public final String keyword;

    IrKeywordKind(String keyword) {
        this.keyword = keyword;
    }
}
