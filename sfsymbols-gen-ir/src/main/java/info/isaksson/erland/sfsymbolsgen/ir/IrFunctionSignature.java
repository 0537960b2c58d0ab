package info.isaksson.erland.sfsymbolsgen.ir;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

@JsonPropertyOrder({"accessModifier","kind","parameters","keywords","returnType"})
public final class IrFunctionSignature {
    public final IrAccessModifier accessModifier;
    public final IrFunctionKind kind;
    public final List<IrParameter> parameters;
    public final List<IrFunctionKeyword> keywords;

    /** Rendered as an expression so that type expressions can be composed; {@code null} means no arrow. */
    public final IrExpression returnType;

    public IrFunctionSignature(
            IrAccessModifier accessModifier,
            IrFunctionKind kind,
            List<IrParameter> parameters,
            List<IrFunctionKeyword> keywords,
            IrExpression returnType
    ) {
        this.accessModifier = accessModifier;
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
        this.keywords = keywords == null ? List.of() : List.copyOf(keywords);
        this.returnType = returnType;
    }
}
