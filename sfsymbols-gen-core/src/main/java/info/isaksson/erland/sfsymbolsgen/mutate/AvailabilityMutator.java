package info.isaksson.erland.sfsymbolsgen.mutate;

import info.isaksson.erland.sfsymbolsgen.catalog.PlatformReleases;
import info.isaksson.erland.sfsymbolsgen.catalog.SymbolCatalog;
import info.isaksson.erland.sfsymbolsgen.ir.IrAvailability;
import info.isaksson.erland.sfsymbolsgen.ir.IrPlatformVersion;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Adds {@code @available(iOS x, macOS y, ..., *)} from the symbol's release record. */
public final class AvailabilityMutator extends AttributeMutator {

    private final SymbolCatalog catalog;

    public AvailabilityMutator(SymbolCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
    }

    @Override
    protected Optional<IrAvailability> attributeFor(String symbolName) {
        return catalog.entry(symbolName)
                .flatMap(catalog.availabilityTable()::releaseFor)
                .map(AvailabilityMutator::platforms);
    }

    /** Fixed platform order; Mac Catalyst follows the iOS release. */
    static IrAvailability platforms(PlatformReleases release) {
        return IrAvailability.platforms(List.of(
                IrPlatformVersion.of("iOS", release.iOS),
                IrPlatformVersion.of("macOS", release.macOS),
                IrPlatformVersion.of("macCatalyst", release.iOS),
                IrPlatformVersion.of("tvOS", release.tvOS),
                IrPlatformVersion.of("visionOS", release.visionOS),
                IrPlatformVersion.of("watchOS", release.watchOS)
        ));
    }
}
