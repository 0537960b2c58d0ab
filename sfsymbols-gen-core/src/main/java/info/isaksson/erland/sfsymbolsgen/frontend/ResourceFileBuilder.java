package info.isaksson.erland.sfsymbolsgen.frontend;

import info.isaksson.erland.sfsymbolsgen.core.EnabledExtension;
import info.isaksson.erland.sfsymbolsgen.ir.IrAccessModifier;
import info.isaksson.erland.sfsymbolsgen.ir.IrAssignment;
import info.isaksson.erland.sfsymbolsgen.ir.IrBindingKind;
import info.isaksson.erland.sfsymbolsgen.ir.IrCodeBlock;
import info.isaksson.erland.sfsymbolsgen.ir.IrComment;
import info.isaksson.erland.sfsymbolsgen.ir.IrDeclaration;
import info.isaksson.erland.sfsymbolsgen.ir.IrExtension;
import info.isaksson.erland.sfsymbolsgen.ir.IrFile;
import info.isaksson.erland.sfsymbolsgen.ir.IrFunction;
import info.isaksson.erland.sfsymbolsgen.ir.IrFunctionArgument;
import info.isaksson.erland.sfsymbolsgen.ir.IrFunctionCall;
import info.isaksson.erland.sfsymbolsgen.ir.IrFunctionKind;
import info.isaksson.erland.sfsymbolsgen.ir.IrFunctionSignature;
import info.isaksson.erland.sfsymbolsgen.ir.IrIdentifier;
import info.isaksson.erland.sfsymbolsgen.ir.IrImport;
import info.isaksson.erland.sfsymbolsgen.ir.IrLiteral;
import info.isaksson.erland.sfsymbolsgen.ir.IrMemberAccess;
import info.isaksson.erland.sfsymbolsgen.ir.IrParameter;
import info.isaksson.erland.sfsymbolsgen.ir.IrStruct;
import info.isaksson.erland.sfsymbolsgen.ir.IrTypeRef;
import info.isaksson.erland.sfsymbolsgen.ir.IrVariable;
import info.isaksson.erland.sfsymbolsgen.mutate.MutatorChain;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Assembles the file-level IR: the resource struct, the accessor extension and one guarded image
 * extension per enabled framework.
 */
public final class ResourceFileBuilder {

    public static final String FILE_NAME = "SFSymbols.swift";
    public static final String HEADER = "Generated by sfsymbols-gen. Do not edit.";
    public static final String RESOURCE_TYPE_NAME = "SFSymbolResource";

    static final IrTypeRef RESOURCE_TYPE = IrTypeRef.member(RESOURCE_TYPE_NAME);
    private static final IrTypeRef STRING_TYPE = IrTypeRef.member("String");

    private final IrAccessModifier access;
    private final MutatorChain mutators;

    public ResourceFileBuilder(IrAccessModifier access, MutatorChain mutators) {
        this.access = Objects.requireNonNull(access, "access must not be null");
        this.mutators = Objects.requireNonNull(mutators, "mutators must not be null");
    }

    public IrFile build(List<AccessorSpec> accessors, Set<EnabledExtension> extensions) {
        List<ImageExtensionFactory> frameworks = new ArrayList<>();
        for (EnabledExtension e : EnabledExtension.values()) {
            if (extensions.contains(e)) frameworks.add(new ImageExtensionFactory(e));
        }

        List<IrImport> imports = new ArrayList<>();
        imports.add(IrImport.of("Foundation"));
        for (ImageExtensionFactory f : frameworks) imports.add(IrImport.guarded(f.moduleName()));

        List<IrCodeBlock> blocks = new ArrayList<>();
        blocks.add(IrCodeBlock.declaration(resourceStruct()));
        blocks.add(IrCodeBlock.declaration(resourceExtension(accessors)));
        for (ImageExtensionFactory f : frameworks) {
            List<IrDeclaration> mirrored = new ArrayList<>();
            for (AccessorSpec spec : accessors) {
                mirrored.add(mutators.apply(f.accessor(access, spec), spec.mutatorKey));
            }
            blocks.add(IrCodeBlock.declaration(f.extension(access, mirrored)));
        }

        return new IrFile(FILE_NAME, IrComment.inline(HEADER), imports, blocks);
    }

    IrDeclaration resourceStruct() {
        IrDeclaration systemName = IrVariable.stored(access, false, IrBindingKind.LET, "systemName", STRING_TYPE)
                .withComment(IrComment.doc("The SF Symbol system name."));
        IrDeclaration init = new IrFunction(
                new IrFunctionSignature(access, IrFunctionKind.initializer(false),
                        List.of(IrParameter.labeled("systemName", "systemName", STRING_TYPE)), null, null),
                List.of(IrCodeBlock.expression(new IrAssignment(
                        new IrMemberAccess(IrIdentifier.pattern("self"), "systemName"),
                        IrIdentifier.pattern("systemName")))))
                .withComment(IrComment.doc("Creates a resource with the given SF Symbol system name."));
        return new IrStruct(access, RESOURCE_TYPE_NAME, List.of("Hashable", "Sendable"), List.of(systemName, init))
                .withComment(IrComment.doc("A SF Symbol resource."));
    }

    IrDeclaration resourceExtension(List<AccessorSpec> accessors) {
        List<IrDeclaration> members = new ArrayList<>();
        for (AccessorSpec spec : accessors) {
            members.add(mutators.apply(resourceAccessor(spec), spec.mutatorKey));
        }
        return IrExtension.of(RESOURCE_TYPE_NAME, members);
    }

    /** {@code static var id: SFSymbolResource { SFSymbolResource(systemName: "raw") }} */
    IrDeclaration resourceAccessor(AccessorSpec spec) {
        IrFunctionCall construct = IrFunctionCall.of(IrIdentifier.type(RESOURCE_TYPE),
                List.of(IrFunctionArgument.of("systemName", IrLiteral.string(spec.systemName))));
        return IrVariable.computed(access, true, spec.identifier, RESOURCE_TYPE, List.of(IrCodeBlock.expression(construct)))
                .withComment(IrComment.doc(spec.docText));
    }
}
