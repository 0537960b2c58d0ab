package info.isaksson.erland.sfsymbolsgen.ir;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * {@code #if condition ... #endif} around declarations. The body keeps the indentation of its container.
 */
@JsonPropertyOrder({"condition","declarations"})
public final class IrConditionalCompilation extends IrDeclaration {
    public final String condition;
    public final List<IrDeclaration> declarations;

    public IrConditionalCompilation(String condition, List<IrDeclaration> declarations) {
        if (condition == null || condition.isBlank()) throw new IllegalArgumentException("condition must not be blank");
        this.condition = condition;
        this.declarations = declarations == null ? List.of() : List.copyOf(declarations);
    }

    /** {@code canImport(A) || canImport(B)} */
    public static String canImport(List<String> modules) {
        Objects.requireNonNull(modules, "modules must not be null");
        StringBuilder sb = new StringBuilder();
        for (String m : modules) {
            if (sb.length() > 0) sb.append(" || ");
            sb.append("canImport(").append(m).append(')');
        }
        return sb.toString();
    }

    @Override public IrDeclarationKind kind() {
        return IrDeclarationKind.CONDITIONAL_COMPILATION;
    }
}
