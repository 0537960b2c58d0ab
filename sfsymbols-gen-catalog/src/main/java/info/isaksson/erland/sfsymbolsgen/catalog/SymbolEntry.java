package info.isaksson.erland.sfsymbolsgen.catalog;

import java.util.Objects;

/** One catalog symbol: its dotted raw name and the key of its shared availability record. */
public final class SymbolEntry implements Comparable<SymbolEntry> {
    public final String name;
    public final String availabilityKey;

    public SymbolEntry(String name, String availabilityKey) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.availabilityKey = Objects.requireNonNull(availabilityKey, "availabilityKey must not be null");
    }

    @Override public int compareTo(SymbolEntry o) {
        int c = name.compareTo(o.name);
        return c != 0 ? c : availabilityKey.compareTo(o.availabilityKey);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SymbolEntry)) return false;
        SymbolEntry that = (SymbolEntry) o;
        return name.equals(that.name) && availabilityKey.equals(that.availabilityKey);
    }

    @Override public int hashCode() {
        return Objects.hash(name, availabilityKey);
    }

    @Override public String toString() {
        return "SymbolEntry{" + name + " -> " + availabilityKey + "}";
    }
}
