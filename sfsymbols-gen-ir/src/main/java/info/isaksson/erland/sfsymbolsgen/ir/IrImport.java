package info.isaksson.erland.sfsymbolsgen.ir;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * An import statement.
 *
 * <p>{@code moduleTypes}, when present, replaces the plain module import with one
 * {@code import <type>} line per entry. {@code canImportModules} wraps the import in a
 * {@code #if canImport(...)} guard.</p>
 */
@JsonPropertyOrder({"moduleName","moduleTypes","canImportModules","spi","preconcurrency","preconcurrencyOperatingSystems"})
public final class IrImport {
    public final String moduleName;
    public final List<String> moduleTypes;
    public final List<String> canImportModules;
    public final String spi;
    public final IrPreconcurrency preconcurrency;
    public final List<String> preconcurrencyOperatingSystems;

    public IrImport(
            String moduleName,
            List<String> moduleTypes,
            List<String> canImportModules,
            String spi,
            IrPreconcurrency preconcurrency,
            List<String> preconcurrencyOperatingSystems
    ) {
        this.moduleName = Objects.requireNonNull(moduleName, "moduleName must not be null");
        this.moduleTypes = moduleTypes == null ? null : List.copyOf(moduleTypes);
        this.canImportModules = canImportModules == null ? List.of() : List.copyOf(canImportModules);
        this.spi = spi;
        this.preconcurrency = preconcurrency == null ? IrPreconcurrency.NEVER : preconcurrency;
        this.preconcurrencyOperatingSystems = preconcurrencyOperatingSystems == null ? List.of() : List.copyOf(preconcurrencyOperatingSystems);
    }

    public static IrImport of(String moduleName) {
        return new IrImport(moduleName, null, null, null, IrPreconcurrency.NEVER, null);
    }

    /** {@code #if canImport(module) / import module / #endif} */
    public static IrImport guarded(String moduleName) {
        return new IrImport(moduleName, null, List.of(moduleName), null, IrPreconcurrency.NEVER, null);
    }
}
