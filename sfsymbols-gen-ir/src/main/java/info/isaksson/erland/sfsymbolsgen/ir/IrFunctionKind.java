package info.isaksson.erland.sfsymbolsgen.ir;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Either an initializer ({@code init}, {@code init?}, {@code convenience init}) or a named function.
 */
@JsonPropertyOrder({"initializer","convenience","failable","name","isStatic"})
public final class IrFunctionKind {
    public final boolean initializer;
    public final boolean convenience;
    public final boolean failable;

    /** Function name; {@code null} for initializers. */
    public final String name;
    public final boolean isStatic;

    private IrFunctionKind(boolean initializer, boolean convenience, boolean failable, String name, boolean isStatic) {
        this.initializer = initializer;
        this.convenience = convenience;
        this.failable = failable;
        this.name = name;
        this.isStatic = isStatic;
    }

    public static IrFunctionKind initializer(boolean failable) {
        return new IrFunctionKind(true, false, failable, null, false);
    }

    public static IrFunctionKind convenienceInitializer(boolean failable) {
        return new IrFunctionKind(true, true, failable, null, false);
    }

    public static IrFunctionKind function(String name, boolean isStatic) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("function name must not be blank");
        return new IrFunctionKind(false, false, false, name, isStatic);
    }
}
