package info.isaksson.erland.sfsymbolsgen.core;

import info.isaksson.erland.sfsymbolsgen.ir.IrAccessModifier;

import java.util.EnumSet;

/**
 * Options for one generation run.
 *
 * <p>This mirrors the CLI flags in a structured form.</p>
 */
public final class GenerationOptions {
    /** Applied to every generated declaration. */
    public IrAccessModifier accessModifier = IrAccessModifier.INTERNAL;

    public EnumSet<EnabledExtension> enabledExtensions = EnumSet.allOf(EnabledExtension.class);

    /** Also emit accessors named after semantic aliases. */
    public boolean exportSemanticSymbols = true;

    public EnumSet<LocalizationOption> localizationOptions = EnumSet.noneOf(LocalizationOption.class);

    public MissingAvailabilityPolicy missingAvailabilityPolicy = MissingAvailabilityPolicy.FAIL;
}
