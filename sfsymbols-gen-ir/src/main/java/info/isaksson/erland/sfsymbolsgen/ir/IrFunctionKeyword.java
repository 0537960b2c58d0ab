package info.isaksson.erland.sfsymbolsgen.ir;

public enum IrFunctionKeyword {
    THROWS("throws"),
    ASYNC("async");

    public final String keyword;

    IrFunctionKeyword(String keyword) {
        this.keyword = keyword;
    }
}
