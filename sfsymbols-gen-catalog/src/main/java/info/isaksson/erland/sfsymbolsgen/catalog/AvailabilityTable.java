package info.isaksson.erland.sfsymbolsgen.catalog;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/** Availability key to per-platform minimum versions. */
public final class AvailabilityTable {

    private final Map<String, PlatformReleases> releases;

    public AvailabilityTable(Map<String, PlatformReleases> releases) {
        Objects.requireNonNull(releases, "releases must not be null");
        this.releases = Collections.unmodifiableMap(new TreeMap<>(releases));
    }

    /** Empty when the entry's key has no release record; the caller decides whether that is fatal. */
    public Optional<PlatformReleases> releaseFor(SymbolEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        return releaseForKey(entry.availabilityKey);
    }

    public Optional<PlatformReleases> releaseForKey(String availabilityKey) {
        return Optional.ofNullable(releases.get(availabilityKey));
    }

    public Map<String, PlatformReleases> asMap() {
        return releases;
    }
}
