package info.isaksson.erland.sfsymbolsgen.ir;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * An {@code @available(...)} attribute.
 *
 * <p>{@link IrAvailabilityKind#PLATFORM_VERSIONS} keeps its platforms in the order given; the
 * trailing {@code *} wildcard is implicit and added by the renderer.
 * {@link IrAvailabilityKind#DEPRECATED} carries an optional message and an optional rename target.</p>
 */
@JsonPropertyOrder({"kind","platforms","message","renamed"})
public final class IrAvailability {
    public final IrAvailabilityKind kind;
    public final List<IrPlatformVersion> platforms;
    public final String message;
    public final String renamed;

    private IrAvailability(IrAvailabilityKind kind, List<IrPlatformVersion> platforms, String message, String renamed) {
        this.kind = kind;
        this.platforms = platforms == null ? List.of() : List.copyOf(platforms);
        this.message = message;
        this.renamed = renamed;
    }

    public static IrAvailability platforms(List<IrPlatformVersion> platforms) {
        if (platforms == null || platforms.isEmpty()) {
            throw new IllegalArgumentException("platforms must not be empty");
        }
        return new IrAvailability(IrAvailabilityKind.PLATFORM_VERSIONS, platforms, null, null);
    }

    public static IrAvailability deprecated(String message, String renamed) {
        return new IrAvailability(IrAvailabilityKind.DEPRECATED, null, message, renamed);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrAvailability)) return false;
        IrAvailability that = (IrAvailability) o;
        return kind == that.kind &&
                Objects.equals(platforms, that.platforms) &&
                Objects.equals(message, that.message) &&
                Objects.equals(renamed, that.renamed);
    }

    @Override public int hashCode() {
        return Objects.hash(kind, platforms, message, renamed);
    }
}
