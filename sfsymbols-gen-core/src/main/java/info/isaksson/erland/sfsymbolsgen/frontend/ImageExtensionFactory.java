package info.isaksson.erland.sfsymbolsgen.frontend;

import info.isaksson.erland.sfsymbolsgen.core.EnabledExtension;
import info.isaksson.erland.sfsymbolsgen.ir.IrAccessModifier;
import info.isaksson.erland.sfsymbolsgen.ir.IrAvailability;
import info.isaksson.erland.sfsymbolsgen.ir.IrCodeBlock;
import info.isaksson.erland.sfsymbolsgen.ir.IrComment;
import info.isaksson.erland.sfsymbolsgen.ir.IrConditionalCompilation;
import info.isaksson.erland.sfsymbolsgen.ir.IrDeclaration;
import info.isaksson.erland.sfsymbolsgen.ir.IrExpression;
import info.isaksson.erland.sfsymbolsgen.ir.IrExtension;
import info.isaksson.erland.sfsymbolsgen.ir.IrForceUnwrap;
import info.isaksson.erland.sfsymbolsgen.ir.IrFunction;
import info.isaksson.erland.sfsymbolsgen.ir.IrFunctionArgument;
import info.isaksson.erland.sfsymbolsgen.ir.IrFunctionCall;
import info.isaksson.erland.sfsymbolsgen.ir.IrFunctionKind;
import info.isaksson.erland.sfsymbolsgen.ir.IrFunctionSignature;
import info.isaksson.erland.sfsymbolsgen.ir.IrIdentifier;
import info.isaksson.erland.sfsymbolsgen.ir.IrLiteral;
import info.isaksson.erland.sfsymbolsgen.ir.IrMemberAccess;
import info.isaksson.erland.sfsymbolsgen.ir.IrParameter;
import info.isaksson.erland.sfsymbolsgen.ir.IrPlatformVersion;
import info.isaksson.erland.sfsymbolsgen.ir.IrTypeRef;
import info.isaksson.erland.sfsymbolsgen.ir.IrVariable;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the guarded extension that lets a UI framework's image type be created from a resource.
 */
final class ImageExtensionFactory {

    private final EnabledExtension framework;

    ImageExtensionFactory(EnabledExtension framework) {
        this.framework = framework;
    }

    String moduleName() {
        return framework.cliValue;
    }

    IrTypeRef imageType() {
        switch (framework) {
            case SWIFT_UI:
                return IrTypeRef.member("SwiftUI", "Image");
            case UI_KIT:
                return IrTypeRef.member("UIKit", "UIImage");
            case APP_KIT:
                return IrTypeRef.member("AppKit", "NSImage");
            default:
                throw new IllegalStateException("Unhandled framework: " + framework);
        }
    }

    String guardCondition() {
        switch (framework) {
            case SWIFT_UI:
                return "canImport(SwiftUI)";
            case UI_KIT:
                return "canImport(UIKit) && !os(watchOS)";
            case APP_KIT:
                return "canImport(AppKit) && !targetEnvironment(macCatalyst)";
            default:
                throw new IllegalStateException("Unhandled framework: " + framework);
        }
    }

    /** Releases that introduced the framework's system-symbol image API. */
    IrAvailability availability() {
        switch (framework) {
            case SWIFT_UI:
                return IrAvailability.platforms(List.of(
                        IrPlatformVersion.of("iOS", "13.0"),
                        IrPlatformVersion.of("macOS", "11.0"),
                        IrPlatformVersion.of("macCatalyst", "13.0"),
                        IrPlatformVersion.of("tvOS", "13.0"),
                        IrPlatformVersion.of("watchOS", "6.0")));
            case UI_KIT:
                return IrAvailability.platforms(List.of(
                        IrPlatformVersion.of("iOS", "13.0"),
                        IrPlatformVersion.of("macCatalyst", "13.0"),
                        IrPlatformVersion.of("tvOS", "13.0")));
            case APP_KIT:
                return IrAvailability.platforms(List.of(IrPlatformVersion.of("macOS", "11.0")));
            default:
                throw new IllegalStateException("Unhandled framework: " + framework);
        }
    }

    /** {@code init(systemSymbolResource resource: SFSymbolResource) { ... }} */
    IrFunction supportInitializer(IrAccessModifier access) {
        IrExpression resourceName = new IrMemberAccess(IrIdentifier.pattern("resource"), "systemName");
        IrExpression selfInit = new IrMemberAccess(IrIdentifier.pattern("self"), "init");
        IrExpression body;
        IrFunctionKind kind;
        switch (framework) {
            case SWIFT_UI:
                kind = IrFunctionKind.initializer(false);
                body = IrFunctionCall.of(selfInit, List.of(IrFunctionArgument.of("systemName", resourceName)));
                break;
            case UI_KIT:
                kind = IrFunctionKind.convenienceInitializer(false);
                body = new IrForceUnwrap(IrFunctionCall.of(selfInit, List.of(IrFunctionArgument.of("systemName", resourceName))));
                break;
            case APP_KIT:
                kind = IrFunctionKind.convenienceInitializer(false);
                body = new IrForceUnwrap(IrFunctionCall.of(selfInit, List.of(
                        IrFunctionArgument.of("systemSymbolName", resourceName),
                        IrFunctionArgument.of("accessibilityDescription", IrLiteral.nil()))));
                break;
            default:
                throw new IllegalStateException("Unhandled framework: " + framework);
        }
        IrFunctionSignature signature = new IrFunctionSignature(access, kind,
                List.of(IrParameter.labeled("systemSymbolResource", "resource", ResourceFileBuilder.RESOURCE_TYPE)),
                null, null);
        return new IrFunction(signature, List.of(IrCodeBlock.expression(body)));
    }

    /** {@code static var id: Image { Image(systemSymbolResource: .id) }} */
    IrDeclaration accessor(IrAccessModifier access, AccessorSpec spec) {
        IrTypeRef type = imageType();
        IrFunctionCall construct = IrFunctionCall.of(IrIdentifier.type(type),
                List.of(IrFunctionArgument.of("systemSymbolResource", IrMemberAccess.dot(spec.identifier))));
        return IrVariable.computed(access, true, spec.identifier, type, List.of(IrCodeBlock.expression(construct)))
                .withComment(IrComment.doc(spec.docText));
    }

    IrDeclaration extension(IrAccessModifier access, List<IrDeclaration> accessors) {
        List<IrDeclaration> members = new ArrayList<>();
        members.add(supportInitializer(access)
                .withComment(IrComment.doc("Creates an image from a SF Symbol resource.")));
        members.addAll(accessors);
        IrDeclaration ext = IrExtension.of(String.join(".", imageType().components), members)
                .withAttribute(availability());
        return new IrConditionalCompilation(guardCondition(), List.of(ext));
    }
}
