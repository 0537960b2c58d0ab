package info.isaksson.erland.sfsymbolsgen.naming;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class IdentifierDeriverTest {

    @Test
    void camelCasesDottedNames() {
        assertEquals("messageCircle", IdentifierDeriver.derive("message.circle"));
        assertEquals("squareAndArrowUpOnSquare", IdentifierDeriver.derive("square.and.arrow.up.on.square"));
        assertEquals("iphoneHomebutton", IdentifierDeriver.derive("iPhone.homebutton"));
        assertEquals("appletvRemoteGen4", IdentifierDeriver.derive("appletv.remote.gen4"));
        assertEquals("aTv", IdentifierDeriver.derive("a.TV"));
    }

    @Test
    void prefixesNumericWords() {
        assertEquals("_0Circle", IdentifierDeriver.derive("0.circle"));
        assertEquals("person_2Fill", IdentifierDeriver.derive("person.2.fill"));
        assertEquals("textformat_123", IdentifierDeriver.derive("textformat.123"));
    }

    @Test
    void prefixesLeadingWordThatStartsWithADigit() {
        assertEquals("_4kTv", IdentifierDeriver.derive("4k.tv"));
        assertEquals("_3dRotate", IdentifierDeriver.derive("3d.rotate"));
        assertEquals("_2hCircle", IdentifierDeriver.derive("2h.circle"));
        assertEquals("appletv4k", IdentifierDeriver.derive("appletv4k"));
        for (String name : new String[] {"4k.tv", "3d.rotate", "0.circle", "2h.circle"}) {
            String id = IdentifierDeriver.derive(name);
            assertFalse(Character.isDigit(id.codePointAt(0)), id);
        }
    }

    @Test
    void escapesKeywordsInsteadOfRespelling() {
        assertEquals("`class`", IdentifierDeriver.derive("class"));
        assertEquals("`public`", IdentifierDeriver.derive("public"));
        assertEquals("`self`", IdentifierDeriver.derive("self"));
        assertEquals("`repeat`", IdentifierDeriver.derive("repeat"));
        assertEquals("repeatCircle", IdentifierDeriver.derive("repeat.circle"));
    }

    @Test
    void dropsSeparatorsOfAnyKind() {
        assertEquals(List.of("a", "b", "c"), IdentifierDeriver.words("a..b-c"));
        assertEquals("aBC", IdentifierDeriver.derive(".a_b c."));
    }

    @Test
    void isDeterministic() {
        for (int i = 0; i < 3; i++) {
            assertEquals("personCropCircleBadgeXmark", IdentifierDeriver.derive("person.crop.circle.badge.xmark"));
        }
    }

    @Test
    void rejectsNamesWithoutWords() {
        assertThrows(IllegalArgumentException.class, () -> IdentifierDeriver.derive("..."));
        assertThrows(IllegalArgumentException.class, () -> IdentifierDeriver.derive(null));
    }

    @Test
    void keywordTableIsComplete() {
        assertEquals(204, SwiftKeywords.size());
        assertTrue(SwiftKeywords.isKeyword("Self"));
        assertTrue(SwiftKeywords.isKeyword("typealias"));
        assertFalse(SwiftKeywords.isKeyword("circle"));
        assertFalse(SwiftKeywords.isKeyword(null));
    }
}
