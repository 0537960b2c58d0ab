package info.isaksson.erland.sfsymbolsgen.ir;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/** A function or initializer. A {@code null} body renders a bodiless requirement (protocols). */
@JsonPropertyOrder({"signature","body"})
public final class IrFunction extends IrDeclaration {
    public final IrFunctionSignature signature;
    public final List<IrCodeBlock> body;

    public IrFunction(IrFunctionSignature signature, List<IrCodeBlock> body) {
        this.signature = Objects.requireNonNull(signature, "signature must not be null");
        this.body = body == null ? null : List.copyOf(body);
    }

    @Override public IrDeclarationKind kind() {
        return IrDeclarationKind.FUNCTION;
    }
}
