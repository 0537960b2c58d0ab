package info.isaksson.erland.sfsymbolsgen.ir;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** A (platform, minimum version) pair inside an availability attribute. */
@JsonPropertyOrder({"platform","version"})
public final class IrPlatformVersion {
    public final String platform;
    public final String version;

    public IrPlatformVersion(String platform, String version) {
        this.platform = Objects.requireNonNull(platform, "platform must not be null");
        this.version = Objects.requireNonNull(version, "version must not be null");
    }

    public static IrPlatformVersion of(String platform, String version) {
        return new IrPlatformVersion(platform, version);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrPlatformVersion)) return false;
        IrPlatformVersion that = (IrPlatformVersion) o;
        return platform.equals(that.platform) && version.equals(that.version);
    }

    @Override public int hashCode() {
        return Objects.hash(platform, version);
    }

    @Override public String toString() {
        return platform + " " + version;
    }
}
