package info.isaksson.erland.sfsymbolsgen;

import info.isaksson.erland.sfsymbolsgen.core.EnabledExtension;
import info.isaksson.erland.sfsymbolsgen.core.GenerationException;
import info.isaksson.erland.sfsymbolsgen.core.GenerationOptions;
import info.isaksson.erland.sfsymbolsgen.core.GenerationResult;
import info.isaksson.erland.sfsymbolsgen.core.GenerationWarning;
import info.isaksson.erland.sfsymbolsgen.core.LocalizationFlag;
import info.isaksson.erland.sfsymbolsgen.core.MissingAvailabilityPolicy;
import info.isaksson.erland.sfsymbolsgen.core.SymbolGenerationService;
import info.isaksson.erland.sfsymbolsgen.ir.IrAccessModifier;
import info.isaksson.erland.sfsymbolsgen.ir.IrJson;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.EnumSet;

/**
 * CLI entrypoint: load a symbol catalog and generate the resource source file.
 *
 * Generated source goes to stdout or {@code --output}; the summary and warnings go to stderr.
 */
public final class Main {

    private static final SymbolGenerationService SERVICE = new SymbolGenerationService();

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Testable entrypoint that returns an exit code instead of calling System.exit.
     */
    public static int run(String[] args) {
        CliArgs parsed;
        try {
            parsed = CliArgs.parse(args);
        } catch (IllegalArgumentException ex) {
            System.err.println("Error: " + ex.getMessage());
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        if (parsed.help) {
            CliArgs.printHelp();
            return 0;
        }

        if (parsed.version) {
            System.out.println("sfsymbols-gen " + version());
            return 0;
        }

        if (parsed.catalog == null) {
            System.err.println("Error: --catalog is required.");
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        final Path catalogDir = Paths.get(parsed.catalog).toAbsolutePath().normalize();
        if (!Files.isDirectory(catalogDir)) {
            System.err.println("Error: --catalog must be an existing directory: " + catalogDir);
            return 1;
        }

        final GenerationResult res;
        try {
            res = SERVICE.generate(catalogDir, toCoreOptions(parsed));
        } catch (IOException e) {
            System.err.println("Error: could not load catalog: " + catalogDir);
            System.err.println(e.getMessage());
            return 2;
        } catch (GenerationException e) {
            System.err.println("Error: generation failed.");
            System.err.println(e.getMessage());
            return 2;
        }

        final Path sourceOut = parsed.output == null ? null : Paths.get(parsed.output).toAbsolutePath().normalize();
        try {
            if (sourceOut != null) {
                Path parent = sourceOut.getParent();
                if (parent != null) Files.createDirectories(parent);
                Files.writeString(sourceOut, res.source, StandardCharsets.UTF_8);
            } else {
                System.out.print(res.source);
                System.out.flush();
            }
        } catch (IOException e) {
            System.err.println("Error: could not write source to: " + sourceOut);
            System.err.println(e.getMessage());
            return 2;
        }

        // Optional: IR snapshot of the generated file
        Path irOut = null;
        if (parsed.writeIr != null) {
            irOut = Paths.get(parsed.writeIr).toAbsolutePath().normalize();
            try {
                IrJson.write(res.file, irOut);
            } catch (IOException e) {
                System.err.println("Error: could not write IR to: " + irOut);
                System.err.println(e.getMessage());
                return 2;
            }
        }

        for (GenerationWarning w : res.warnings) {
            System.err.println(w);
        }

        System.err.println(
                "sfsymbols-gen\n" +
                "- Catalog: " + catalogDir + "\n" +
                "- Output: " + (sourceOut == null ? "<stdout>" : sourceOut.toString()) + "\n" +
                (irOut != null ? "- IR: " + irOut + "\n" : "") +
                "- Symbols: " + res.symbolNames.size() + "\n" +
                "- Semantic aliases: " + res.aliasCount + "\n" +
                "- Warnings: " + res.warnings.size()
        );
        return 0;
    }

    static GenerationOptions toCoreOptions(CliArgs parsed) {
        GenerationOptions o = new GenerationOptions();
        o.accessModifier = parsed.accessModifier;
        o.enabledExtensions = parsed.enabledExtensions == null
                ? EnumSet.allOf(EnabledExtension.class)
                : EnumSet.copyOf(parsed.enabledExtensions);
        o.exportSemanticSymbols = parsed.exportSemanticSymbols;
        o.localizationOptions = LocalizationFlag.optionsFor(parsed.localization);
        o.missingAvailabilityPolicy = parsed.missingAvailabilityPolicy;
        return o;
    }

    static String version() {
        String v = Main.class.getPackage().getImplementationVersion();
        return v == null ? "unknown" : v;
    }

    /** Minimal CLI argument parsing without external dependencies. */
    static final class CliArgs {
        boolean help = false;
        boolean version = false;
        String catalog;
        String output;
        String writeIr;

        IrAccessModifier accessModifier = IrAccessModifier.INTERNAL;

        // null until the flag is seen; "none" leaves it empty
        EnumSet<EnabledExtension> enabledExtensions;

        boolean exportSemanticSymbols = true;

        // At most one of -a, -l, -r
        LocalizationFlag localization;

        MissingAvailabilityPolicy missingAvailabilityPolicy = MissingAvailabilityPolicy.FAIL;

        static CliArgs parse(String[] args) {
            CliArgs out = new CliArgs();

            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                if (a == null) continue;

                switch (a) {
                    case "--help":
                    case "-h":
                        out.help = true;
                        break;
                    case "--version":
                    case "-v":
                        out.version = true;
                        break;
                    case "--catalog":
                        out.catalog = requireValue(args, ++i, "--catalog");
                        break;
                    case "--output":
                        out.output = requireValue(args, ++i, "--output");
                        break;
                    case "--write-ir":
                        out.writeIr = requireValue(args, ++i, "--write-ir");
                        break;
                    case "--access-modifier":
                        out.accessModifier = IrAccessModifier.parseCli(requireValue(args, ++i, "--access-modifier"));
                        break;
                    case "--enabled-extensions":
                        out.addEnabledExtension(requireValue(args, ++i, "--enabled-extensions"));
                        break;
                    case "--export-semantic-symbols":
                    case "-s":
                        out.exportSemanticSymbols = true;
                        break;
                    case "--no-export-semantic-symbols":
                        out.exportSemanticSymbols = false;
                        break;
                    case "--export-all-localizations":
                    case "--export-all":
                    case "-a":
                        out.setLocalization(LocalizationFlag.ALL, a);
                        break;
                    case "--export-language-code":
                    case "--export-lang":
                    case "-l":
                        out.setLocalization(LocalizationFlag.LANGUAGE_CODE, a);
                        break;
                    case "--export-right-to-left":
                    case "--export-rtl":
                    case "-r":
                        out.setLocalization(LocalizationFlag.RIGHT_TO_LEFT, a);
                        break;
                    case "--missing-availability":
                        out.missingAvailabilityPolicy = MissingAvailabilityPolicy.parseCli(
                                requireValue(args, ++i, "--missing-availability"));
                        break;
                    default:
                        if (a.startsWith("-")) {
                            throw new IllegalArgumentException("Unknown argument: " + a);
                        }
                        throw new IllegalArgumentException("Unexpected extra argument: " + a);
                }
            }

            return out;
        }

        private void addEnabledExtension(String v) {
            if (enabledExtensions == null) enabledExtensions = EnumSet.noneOf(EnabledExtension.class);
            if (v.trim().equalsIgnoreCase("none")) return;
            enabledExtensions.add(EnabledExtension.parseCli(v));
        }

        private void setLocalization(LocalizationFlag flag, String arg) {
            if (localization != null && localization != flag) {
                throw new IllegalArgumentException("Only one localization flag may be given, found " + arg
                        + " after --" + localizationFlagName(localization));
            }
            localization = flag;
        }

        private static String localizationFlagName(LocalizationFlag flag) {
            switch (flag) {
                case ALL:
                    return "export-all-localizations";
                case LANGUAGE_CODE:
                    return "export-language-code";
                case RIGHT_TO_LEFT:
                    return "export-right-to-left";
                default:
                    throw new IllegalStateException("Unhandled localization flag: " + flag);
            }
        }

        static String requireValue(String[] args, int index, String flag) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            String v = args[index];
            if (v == null || v.isBlank() || v.startsWith("--")) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + v);
            }
            return v;
        }

        static void printHelp() {
            System.out.println(
                    "sfsymbols-gen\n" +
                    "\n" +
                    "Usage:\n" +
                    "  java -jar sfsymbols-gen.jar --catalog <dir> [--output <file>] [options]\n" +
                    "\n" +
                    "Options:\n" +
                    "  --catalog <dir>                 Catalog directory holding the five JSON tables (required)\n" +
                    "  --output <file>                 Write the generated source here (default: stdout)\n" +
                    "  --access-modifier <mode>        public | package | internal | fileprivate | private\n" +
                    "                                  (default: internal)\n" +
                    "  --enabled-extensions <name>     SwiftUI | UIKit | AppKit (repeatable). Use 'none' to disable\n" +
                    "                                  all image extensions. Default: all.\n" +
                    "  -s, --export-semantic-symbols   Export semantic alias accessors (default)\n" +
                    "  --no-export-semantic-symbols    Skip semantic alias accessors\n" +
                    "  -a, --export-all-localizations  Keep language-code and right-to-left variants\n" +
                    "  -l, --export-language-code      Keep language-code variants only\n" +
                    "  -r, --export-right-to-left      Keep right-to-left variants only\n" +
                    "                                  (at most one of -a, -l, -r; default: neither kind)\n" +
                    "  --missing-availability <mode>   fail | skip (default: fail)\n" +
                    "  --write-ir <file>               Also write a JSON snapshot of the generated IR\n" +
                    "  -v, --version                   Show version\n" +
                    "  -h, --help                      Show help\n" +
                    "\n" +
                    "Examples:\n" +
                    "  java -jar target/sfsymbols-gen.jar --catalog catalog --output Sources/SFSymbols.swift\n" +
                    "  java -jar target/sfsymbols-gen.jar --catalog catalog --access-modifier public --enabled-extensions SwiftUI -l\n"
            );
        }
    }
}
