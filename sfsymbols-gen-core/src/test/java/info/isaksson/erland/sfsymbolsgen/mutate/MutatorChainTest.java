package info.isaksson.erland.sfsymbolsgen.mutate;

import info.isaksson.erland.sfsymbolsgen.catalog.AvailabilityTable;
import info.isaksson.erland.sfsymbolsgen.catalog.PlatformReleases;
import info.isaksson.erland.sfsymbolsgen.catalog.SymbolCatalog;
import info.isaksson.erland.sfsymbolsgen.ir.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class MutatorChainTest {

    private static final PlatformReleases R2019 = new PlatformReleases("13.0", "10.15", "13.0", "6.0", "1.0");

    private static SymbolCatalog catalog() {
        return new SymbolCatalog(
                Map.of("old.name", "2019", "plain", "2019", "orphan", "1999"),
                new AvailabilityTable(Map.of("2019", R2019)),
                Map.of("old.name", "new.name"),
                Map.of(),
                Map.of(),
                Map.of("old.name", "Only for X"));
    }

    private static IrDeclaration accessor() {
        return IrVariable.computed(IrAccessModifier.INTERNAL, true, "x", IrTypeRef.member("SFSymbolResource"), List.of())
                .withComment(IrComment.doc("The \"old.name\" SF Symbol.\n"));
    }

    @Test
    void standardChainKeepsCommentOutermostAndStacksAttributes() {
        IrDeclaration out = MutatorChain.standard(catalog()).apply(accessor(), "old.name");

        IrCommentable commentable = assertInstanceOf(IrCommentable.class, out);
        assertEquals(IrComment.doc("The \"old.name\" SF Symbol.\n\n- Important: Only for X"), commentable.comment);

        IrAttributed platforms = assertInstanceOf(IrAttributed.class, commentable.declaration);
        assertEquals(IrAvailabilityKind.PLATFORM_VERSIONS, platforms.attribute.kind);
        assertEquals(IrPlatformVersion.of("macCatalyst", "13.0"), platforms.attribute.platforms.get(2));
        assertEquals(6, platforms.attribute.platforms.size());

        IrAttributed deprecated = assertInstanceOf(IrAttributed.class, platforms.declaration);
        assertEquals(IrAvailability.deprecated(DeprecationMutator.MESSAGE, "new.name"), deprecated.attribute);
        assertInstanceOf(IrVariable.class, deprecated.declaration);
    }

    @Test
    void anyOrderKeepsTheCommentFirst() {
        SymbolCatalog catalog = catalog();
        MutatorChain reversed = new MutatorChain(List.of(
                new RestrictionMutator(catalog.restrictions()),
                new AvailabilityMutator(catalog),
                new DeprecationMutator(catalog.nameAliases())));
        IrDeclaration bare = IrVariable.computed(null, true, "x", IrTypeRef.member("T"), List.of());

        IrDeclaration out = reversed.apply(bare, "old.name");

        IrCommentable commentable = assertInstanceOf(IrCommentable.class, out);
        assertEquals("- Important: Only for X", commentable.comment.text);
        IrAttributed outer = assertInstanceOf(IrAttributed.class, commentable.declaration);
        assertEquals(IrAvailabilityKind.DEPRECATED, outer.attribute.kind);
        IrAttributed inner = assertInstanceOf(IrAttributed.class, outer.declaration);
        assertEquals(IrAvailabilityKind.PLATFORM_VERSIONS, inner.attribute.kind);
        assertSame(bare, inner.declaration);
    }

    @Test
    void standardChainRunsDeprecationThenAvailabilityThenRestriction() {
        List<DeclarationMutator> mutators = MutatorChain.standard(catalog()).mutators();

        assertEquals(3, mutators.size());
        assertInstanceOf(DeprecationMutator.class, mutators.get(0));
        assertInstanceOf(AvailabilityMutator.class, mutators.get(1));
        assertInstanceOf(RestrictionMutator.class, mutators.get(2));
        assertThrows(UnsupportedOperationException.class, () -> mutators.add(mutators.get(0)));
    }

    @Test
    void lookupMissesPassThroughUnchanged() {
        IrDeclaration decl = accessor();
        assertSame(decl, MutatorChain.standard(catalog()).apply(decl, "unknown"));
        // the key exists but has no release record
        assertSame(decl, new AvailabilityMutator(catalog()).mutate(decl, "orphan"));
    }

    @Test
    void availabilityGoesBelowComment() {
        IrDeclaration out = new AvailabilityMutator(catalog()).mutate(accessor(), "plain");
        IrCommentable commentable = assertInstanceOf(IrCommentable.class, out);
        assertInstanceOf(IrAttributed.class, commentable.declaration);
    }

    @Test
    void restrictionTrimsTrailingBlankLinesBeforeCallout() {
        assertEquals("a\nb", RestrictionMutator.withoutTrailingBlankLines("a\nb\n\n  \n"));
        assertEquals("", RestrictionMutator.withoutTrailingBlankLines("\n"));

        IrDeclaration decl = IrVariable.computed(null, true, "x", IrTypeRef.member("T"), List.of())
                .withComment(IrComment.doc("Body.\n\n\n"));
        IrDeclaration out = new RestrictionMutator(Map.of("s", "Y")).mutate(decl, "s");
        assertEquals("Body.\n\n- Important: Y", ((IrCommentable) out).comment.text);
    }

    @Test
    void restrictionWrapsNonDocCommentInNewDocComment() {
        IrDeclaration decl = IrVariable.computed(null, true, "x", IrTypeRef.member("T"), List.of())
                .withComment(IrComment.inline("note"));
        IrCommentable out = assertInstanceOf(IrCommentable.class, new RestrictionMutator(Map.of("s", "Y")).mutate(decl, "s"));
        assertEquals(IrComment.doc("- Important: Y"), out.comment);
        assertSame(decl, out.declaration);
    }
}
