package info.isaksson.erland.sfsymbolsgen.ir;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A function parameter. A {@code null} label renders as {@code _}; a name equal to the label is not repeated.
 */
@JsonPropertyOrder({"label","name","type","defaultValue"})
public final class IrParameter {
    public final String label;
    public final String name;
    public final IrTypeRef type;
    public final IrExpression defaultValue;

    public IrParameter(String label, String name, IrTypeRef type, IrExpression defaultValue) {
        this.label = label;
        this.name = name;
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.defaultValue = defaultValue;
    }

    public static IrParameter labeled(String label, String name, IrTypeRef type) {
        return new IrParameter(label, name, type, null);
    }
}
