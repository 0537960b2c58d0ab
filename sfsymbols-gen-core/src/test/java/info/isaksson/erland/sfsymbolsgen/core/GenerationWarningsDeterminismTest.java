package info.isaksson.erland.sfsymbolsgen.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class GenerationWarningsDeterminismTest {

    @Test
    public void warningsAreSortedDeterministically() {
        GenerationWarnings w = new GenerationWarnings();
        w.warn("B", "bbb", "x", "2", "y", "3");
        w.warn("A", "ccc", "a", "1", "b", "1");
        w.warn("A", "bbb", "z", "9", "b", "1");
        w.warn("A", "bbb", "a", "0", "b", "1");

        List<GenerationWarning> out = w.toDeterministicList();
        assertEquals(4, out.size());
        assertEquals("A", out.get(0).code);
        assertEquals("0", out.get(0).context.get("a"));
        assertEquals("9", out.get(1).context.get("z"));
        assertEquals("ccc", out.get(2).message);
        assertEquals("B", out.get(3).code);
        assertEquals("Warning [B]: bbb", out.get(3).toString());
    }

    @Test
    void cliEnumsParseAndReject() {
        assertEquals(EnabledExtension.UI_KIT, EnabledExtension.parseCli("UIKit"));
        assertEquals(EnabledExtension.SWIFT_UI, EnabledExtension.parseCli("swiftui"));
        assertThrows(IllegalArgumentException.class, () -> EnabledExtension.parseCli("WatchKit"));
        assertEquals(MissingAvailabilityPolicy.SKIP, MissingAvailabilityPolicy.parseCli("SKIP"));
        assertEquals(MissingAvailabilityPolicy.FAIL, MissingAvailabilityPolicy.parseCli(null));
        assertThrows(IllegalArgumentException.class, () -> MissingAvailabilityPolicy.parseCli("ignore"));
    }
}
