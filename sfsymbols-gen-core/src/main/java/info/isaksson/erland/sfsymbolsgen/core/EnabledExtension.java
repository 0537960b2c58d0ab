package info.isaksson.erland.sfsymbolsgen.core;

/** UI frameworks that get an image extension mirroring the symbol accessors. */
public enum EnabledExtension {
    SWIFT_UI("SwiftUI"),
    UI_KIT("UIKit"),
    APP_KIT("AppKit");

    public final String cliValue;

    EnabledExtension(String cliValue) {
        this.cliValue = cliValue;
    }

    public static EnabledExtension parseCli(String v) {
        if (v == null) throw new IllegalArgumentException("Missing value for --enabled-extensions");
        String s = v.trim();
        for (EnabledExtension e : values()) {
            if (e.cliValue.equalsIgnoreCase(s)) return e;
        }
        throw new IllegalArgumentException("Invalid value for --enabled-extensions: " + v + " (expected one of: SwiftUI|UIKit|AppKit|none)");
    }
}
