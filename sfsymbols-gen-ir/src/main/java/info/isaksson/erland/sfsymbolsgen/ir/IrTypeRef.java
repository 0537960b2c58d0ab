package info.isaksson.erland.sfsymbolsgen.ir;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Reference to an existing type.
 *
 * <p>{@code components} is used by {@link IrTypeRefKind#MEMBER}; {@code wrapped} by every other
 * kind; {@code wrapper} only by {@link IrTypeRefKind#GENERIC}.</p>
 */
@JsonPropertyOrder({"kind","components","wrapper","wrapped"})
public final class IrTypeRef {
    public final IrTypeRefKind kind;
    public final List<String> components;
    public final IrTypeRef wrapper;
    public final IrTypeRef wrapped;

    private IrTypeRef(IrTypeRefKind kind, List<String> components, IrTypeRef wrapper, IrTypeRef wrapped) {
        this.kind = kind;
        this.components = components == null ? List.of() : List.copyOf(components);
        this.wrapper = wrapper;
        this.wrapped = wrapped;
    }

    public static IrTypeRef member(String... components) {
        if (components == null || components.length == 0) {
            throw new IllegalArgumentException("member type needs at least one component");
        }
        return new IrTypeRef(IrTypeRefKind.MEMBER, Arrays.asList(components), null, null);
    }

    public static IrTypeRef any(IrTypeRef existential) {
        return new IrTypeRef(IrTypeRefKind.ANY, null, null, Objects.requireNonNull(existential));
    }

    public static IrTypeRef generic(IrTypeRef wrapper, IrTypeRef wrapped) {
        return new IrTypeRef(IrTypeRefKind.GENERIC, null, Objects.requireNonNull(wrapper), Objects.requireNonNull(wrapped));
    }

    public static IrTypeRef optional(IrTypeRef wrapped) {
        return new IrTypeRef(IrTypeRefKind.OPTIONAL, null, null, Objects.requireNonNull(wrapped));
    }

    public static IrTypeRef array(IrTypeRef element) {
        return new IrTypeRef(IrTypeRefKind.ARRAY, null, null, Objects.requireNonNull(element));
    }

    public static IrTypeRef dictionaryValue(IrTypeRef value) {
        return new IrTypeRef(IrTypeRefKind.DICTIONARY_VALUE, null, null, Objects.requireNonNull(value));
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrTypeRef)) return false;
        IrTypeRef that = (IrTypeRef) o;
        return kind == that.kind &&
                Objects.equals(components, that.components) &&
                Objects.equals(wrapper, that.wrapper) &&
                Objects.equals(wrapped, that.wrapped);
    }

    @Override public int hashCode() {
        return Objects.hash(kind, components, wrapper, wrapped);
    }

    @Override public String toString() {
        if (kind == IrTypeRefKind.MEMBER) return String.join(".", components);
        return kind + "(" + (wrapper != null ? wrapper + ", " : "") + wrapped + ")";
    }
}
