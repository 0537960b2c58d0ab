package info.isaksson.erland.sfsymbolsgen.ir;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

@JsonPropertyOrder({"name","caseKind","rawValue","associatedValues"})
public final class IrEnumCase extends IrDeclaration {
    public final String name;
    public final IrEnumCaseKind caseKind;
    public final IrLiteral rawValue;
    public final List<IrAssociatedValue> associatedValues;

    private IrEnumCase(String name, IrEnumCaseKind caseKind, IrLiteral rawValue, List<IrAssociatedValue> associatedValues) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.caseKind = caseKind;
        this.rawValue = rawValue;
        this.associatedValues = associatedValues == null ? List.of() : List.copyOf(associatedValues);
    }

    public static IrEnumCase nameOnly(String name) {
        return new IrEnumCase(name, IrEnumCaseKind.NAME_ONLY, null, null);
    }

    public static IrEnumCase withRawValue(String name, IrLiteral rawValue) {
        return new IrEnumCase(name, IrEnumCaseKind.RAW_VALUE, Objects.requireNonNull(rawValue, "rawValue must not be null"), null);
    }

    public static IrEnumCase withAssociatedValues(String name, List<IrAssociatedValue> values) {
        return new IrEnumCase(name, IrEnumCaseKind.ASSOCIATED_VALUES, null, values);
    }

    @Override public IrDeclarationKind kind() {
        return IrDeclarationKind.ENUM_CASE;
    }
}
