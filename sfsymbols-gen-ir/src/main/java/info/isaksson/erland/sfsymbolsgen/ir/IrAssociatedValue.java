package info.isaksson.erland.sfsymbolsgen.ir;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** {@code label: Type} inside an enum case; the label is optional. */
@JsonPropertyOrder({"label","type"})
public final class IrAssociatedValue {
    public final String label;
    public final IrTypeRef type;

    public IrAssociatedValue(String label, IrTypeRef type) {
        this.label = label;
        this.type = Objects.requireNonNull(type, "type must not be null");
    }
}
