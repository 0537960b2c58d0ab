package info.isaksson.erland.sfsymbolsgen.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Minimum OS versions for one availability key.
 *
 * <p>Versions are kept as free-form strings; they are copied into generated attributes verbatim.</p>
 */
@JsonPropertyOrder({"iOS","macOS","tvOS","watchOS","visionOS"})
public final class PlatformReleases {
    @JsonProperty("iOS")
    public final String iOS;
    @JsonProperty("macOS")
    public final String macOS;
    @JsonProperty("tvOS")
    public final String tvOS;
    @JsonProperty("watchOS")
    public final String watchOS;
    @JsonProperty("visionOS")
    public final String visionOS;

    @JsonCreator
    public PlatformReleases(
            @JsonProperty("iOS") String iOS,
            @JsonProperty("macOS") String macOS,
            @JsonProperty("tvOS") String tvOS,
            @JsonProperty("watchOS") String watchOS,
            @JsonProperty("visionOS") String visionOS
    ) {
        this.iOS = Objects.requireNonNull(iOS, "iOS must not be null");
        this.macOS = Objects.requireNonNull(macOS, "macOS must not be null");
        this.tvOS = Objects.requireNonNull(tvOS, "tvOS must not be null");
        this.watchOS = Objects.requireNonNull(watchOS, "watchOS must not be null");
        this.visionOS = Objects.requireNonNull(visionOS, "visionOS must not be null");
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PlatformReleases)) return false;
        PlatformReleases that = (PlatformReleases) o;
        return iOS.equals(that.iOS) && macOS.equals(that.macOS) && tvOS.equals(that.tvOS)
                && watchOS.equals(that.watchOS) && visionOS.equals(that.visionOS);
    }

    @Override public int hashCode() {
        return Objects.hash(iOS, macOS, tvOS, watchOS, visionOS);
    }

    @Override public String toString() {
        return "PlatformReleases{iOS=" + iOS + ", macOS=" + macOS + ", tvOS=" + tvOS
                + ", watchOS=" + watchOS + ", visionOS=" + visionOS + "}";
    }
}
