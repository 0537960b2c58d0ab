package info.isaksson.erland.sfsymbolsgen.emitter;

import info.isaksson.erland.sfsymbolsgen.ir.IrAccessModifier;
import info.isaksson.erland.sfsymbolsgen.ir.IrAssignment;
import info.isaksson.erland.sfsymbolsgen.ir.IrAssociatedValue;
import info.isaksson.erland.sfsymbolsgen.ir.IrAttributed;
import info.isaksson.erland.sfsymbolsgen.ir.IrAvailability;
import info.isaksson.erland.sfsymbolsgen.ir.IrBinaryOperation;
import info.isaksson.erland.sfsymbolsgen.ir.IrClosureInvocation;
import info.isaksson.erland.sfsymbolsgen.ir.IrCodeBlock;
import info.isaksson.erland.sfsymbolsgen.ir.IrComment;
import info.isaksson.erland.sfsymbolsgen.ir.IrCommentable;
import info.isaksson.erland.sfsymbolsgen.ir.IrConditionalCompilation;
import info.isaksson.erland.sfsymbolsgen.ir.IrDeclaration;
import info.isaksson.erland.sfsymbolsgen.ir.IrDo;
import info.isaksson.erland.sfsymbolsgen.ir.IrEnum;
import info.isaksson.erland.sfsymbolsgen.ir.IrEnumCase;
import info.isaksson.erland.sfsymbolsgen.ir.IrExpression;
import info.isaksson.erland.sfsymbolsgen.ir.IrExtension;
import info.isaksson.erland.sfsymbolsgen.ir.IrFile;
import info.isaksson.erland.sfsymbolsgen.ir.IrForceUnwrap;
import info.isaksson.erland.sfsymbolsgen.ir.IrFunction;
import info.isaksson.erland.sfsymbolsgen.ir.IrFunctionArgument;
import info.isaksson.erland.sfsymbolsgen.ir.IrFunctionCall;
import info.isaksson.erland.sfsymbolsgen.ir.IrFunctionKeyword;
import info.isaksson.erland.sfsymbolsgen.ir.IrFunctionKind;
import info.isaksson.erland.sfsymbolsgen.ir.IrFunctionSignature;
import info.isaksson.erland.sfsymbolsgen.ir.IrIdentifier;
import info.isaksson.erland.sfsymbolsgen.ir.IrIf;
import info.isaksson.erland.sfsymbolsgen.ir.IrIfBranch;
import info.isaksson.erland.sfsymbolsgen.ir.IrImport;
import info.isaksson.erland.sfsymbolsgen.ir.IrInOut;
import info.isaksson.erland.sfsymbolsgen.ir.IrLiteral;
import info.isaksson.erland.sfsymbolsgen.ir.IrMemberAccess;
import info.isaksson.erland.sfsymbolsgen.ir.IrOptionalChaining;
import info.isaksson.erland.sfsymbolsgen.ir.IrParameter;
import info.isaksson.erland.sfsymbolsgen.ir.IrPlatformVersion;
import info.isaksson.erland.sfsymbolsgen.ir.IrProtocol;
import info.isaksson.erland.sfsymbolsgen.ir.IrStruct;
import info.isaksson.erland.sfsymbolsgen.ir.IrSwitch;
import info.isaksson.erland.sfsymbolsgen.ir.IrSwitchCase;
import info.isaksson.erland.sfsymbolsgen.ir.IrTuple;
import info.isaksson.erland.sfsymbolsgen.ir.IrTypeAlias;
import info.isaksson.erland.sfsymbolsgen.ir.IrTypeRef;
import info.isaksson.erland.sfsymbolsgen.ir.IrUnaryKeyword;
import info.isaksson.erland.sfsymbolsgen.ir.IrValueBinding;
import info.isaksson.erland.sfsymbolsgen.ir.IrVariable;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders IR nodes into source text through a {@link CodeWriter}.
 *
 * <p>Rendering is total over well-formed IR. Routines never return text to their caller; partial
 * lines are composed by setting the writer's continuation flag before the next write.</p>
 */
final class TextRenderer {

    private final CodeWriter writer;

    TextRenderer(CodeWriter writer) {
        this.writer = writer;
    }

    String renderedContents() {
        return writer.rendered();
    }

    int currentLevel() {
        return writer.level();
    }

    // ---------------------------------------------------------------------
    // File level
    // ---------------------------------------------------------------------

    void renderFile(IrFile file) {
        if (file.topComment != null) renderComment(file.topComment);
        for (IrImport imp : file.imports) renderImport(imp);
        for (IrCodeBlock block : file.codeBlocks) {
            renderCodeBlock(block);
            writer.writeLine("");
        }
    }

    void renderComment(IrComment comment) {
        String prefix;
        switch (comment.kind) {
            case INLINE:
                prefix = "//";
                break;
            case DOC:
                prefix = "///";
                break;
            case MARK:
                prefix = comment.sectionBreak ? "// MARK: -" : "// MARK:";
                break;
            default:
                throw new IllegalStateException("Unhandled comment kind: " + comment.kind);
        }
        for (String line : comment.text.split("\\R", -1)) {
            writer.writeLine(line.isEmpty() ? prefix : prefix + " " + line);
        }
    }

    void renderImport(IrImport description) {
        switch (description.preconcurrency) {
            case ALWAYS:
                renderImport(description, true);
                break;
            case NEVER:
                renderImport(description, false);
                break;
            case ON_OS:
                writer.writeLine("#if " + joinMapped(description.preconcurrencyOperatingSystems, "os(", ")", " || "));
                renderImport(description, true);
                writer.writeLine("#else");
                renderImport(description, false);
                writer.writeLine("#endif");
                break;
            default:
                throw new IllegalStateException("Unhandled preconcurrency: " + description.preconcurrency);
        }
    }

    private void renderImport(IrImport description, boolean preconcurrency) {
        boolean guarded = !description.canImportModules.isEmpty();
        if (guarded) {
            writer.writeLine("#if " + IrConditionalCompilation.canImport(description.canImportModules));
        }
        String prefix = (preconcurrency ? "@preconcurrency " : "")
                + (description.spi != null ? "@_spi(" + description.spi + ") " : "");
        if (description.moduleTypes != null) {
            for (String type : description.moduleTypes) writer.writeLine(prefix + "import " + type);
        } else {
            writer.writeLine(prefix + "import " + description.moduleName);
        }
        if (guarded) {
            writer.writeLine("#endif");
        }
    }

    void renderCodeBlocks(List<IrCodeBlock> blocks) {
        for (IrCodeBlock block : blocks) renderCodeBlock(block);
    }

    void renderCodeBlock(IrCodeBlock block) {
        if (block.comment != null) renderComment(block.comment);
        if (block.declaration != null) {
            renderDeclaration(block.declaration);
        } else {
            renderExpression(block.expression);
        }
    }

    // ---------------------------------------------------------------------
    // Declarations
    // ---------------------------------------------------------------------

    void renderDeclaration(IrDeclaration declaration) {
        switch (declaration.kind()) {
            case COMMENTABLE: {
                IrCommentable c = (IrCommentable) declaration;
                if (c.comment != null) renderComment(c.comment);
                renderDeclaration(c.declaration);
                break;
            }
            case ATTRIBUTED: {
                IrAttributed a = (IrAttributed) declaration;
                renderAvailability(a.attribute);
                renderDeclaration(a.declaration);
                break;
            }
            case VARIABLE:
                renderVariable((IrVariable) declaration);
                break;
            case EXTENSION:
                renderExtension((IrExtension) declaration);
                break;
            case STRUCT: {
                IrStruct s = (IrStruct) declaration;
                renderTypeHeader(s.accessModifier, "struct " + s.name, s.conformances);
                renderMembers(s.members);
                break;
            }
            case PROTOCOL: {
                IrProtocol p = (IrProtocol) declaration;
                renderTypeHeader(p.accessModifier, "protocol " + p.name, p.conformances);
                renderMembers(p.members);
                break;
            }
            case ENUM:
                renderEnum((IrEnum) declaration);
                break;
            case TYPEALIAS:
                renderTypeAlias((IrTypeAlias) declaration);
                break;
            case FUNCTION:
                renderFunction((IrFunction) declaration);
                break;
            case ENUM_CASE:
                renderEnumCase((IrEnumCase) declaration);
                break;
            case CONDITIONAL_COMPILATION:
                renderConditionalCompilation((IrConditionalCompilation) declaration);
                break;
            default:
                throw new IllegalStateException("Unhandled declaration kind: " + declaration.kind());
        }
    }

    void renderAvailability(IrAvailability attribute) {
        List<String> parts = new ArrayList<>();
        switch (attribute.kind) {
            case PLATFORM_VERSIONS:
                for (IrPlatformVersion p : attribute.platforms) parts.add(p.platform + " " + p.version);
                parts.add("*");
                break;
            case DEPRECATED:
                parts.add("*");
                parts.add("deprecated");
                if (attribute.message != null) parts.add("message: " + renderedStringLiteral(attribute.message));
                if (attribute.renamed != null) parts.add("renamed: " + renderedStringLiteral(attribute.renamed));
                break;
            default:
                throw new IllegalStateException("Unhandled availability kind: " + attribute.kind);
        }
        writer.writeLine("@available(" + String.join(", ", parts) + ")");
    }

    private void renderConditionalCompilation(IrConditionalCompilation block) {
        writer.writeLine("#if " + block.condition);
        for (IrDeclaration d : block.declarations) renderDeclaration(d);
        writer.writeLine("#endif");
    }

    private void renderAccessModifierPrefix(IrAccessModifier accessModifier) {
        if (accessModifier == null) return;
        writer.writeLine(accessModifier.keyword + " ");
        writer.nextLineAppendsToLastLine();
    }

    /** Writes {@code [access ]<head>[: conformances] {} and leaves the line open for the body. */
    private void renderTypeHeader(IrAccessModifier accessModifier, String head, List<String> conformances) {
        renderAccessModifierPrefix(accessModifier);
        writer.writeLine(head);
        writer.nextLineAppendsToLastLine();
        if (!conformances.isEmpty()) {
            writer.writeLine(": " + String.join(", ", conformances));
            writer.nextLineAppendsToLastLine();
        }
        writer.writeLine(" {");
    }

    private void renderMembers(List<IrDeclaration> members) {
        if (!members.isEmpty()) {
            writer.withNestedLevel(() -> {
                for (IrDeclaration member : members) renderDeclaration(member);
            });
        } else {
            writer.nextLineAppendsToLastLine();
        }
        writer.writeLine("}");
    }

    private void renderExtension(IrExtension extension) {
        renderAccessModifierPrefix(extension.accessModifier);
        writer.writeLine("extension " + extension.onType);
        writer.nextLineAppendsToLastLine();
        if (!extension.conformances.isEmpty()) {
            writer.writeLine(": " + String.join(", ", extension.conformances));
            writer.nextLineAppendsToLastLine();
        }
        if (!extension.whereRequirements.isEmpty()) {
            writer.writeLine(" where " + String.join(", ", extension.whereRequirements));
            writer.nextLineAppendsToLastLine();
        }
        writer.writeLine(" {");
        for (IrDeclaration declaration : extension.declarations) {
            writer.withNestedLevel(() -> renderDeclaration(declaration));
        }
        writer.writeLine("}");
    }

    private void renderEnum(IrEnum enumDecl) {
        boolean frozen = enumDecl.isFrozen
                && (enumDecl.accessModifier == IrAccessModifier.PUBLIC || enumDecl.accessModifier == IrAccessModifier.PACKAGE);
        if (frozen) {
            writer.writeLine("@frozen ");
            writer.nextLineAppendsToLastLine();
        }
        renderAccessModifierPrefix(enumDecl.accessModifier);
        if (enumDecl.isIndirect) {
            writer.writeLine("indirect ");
            writer.nextLineAppendsToLastLine();
        }
        renderTypeHeader(null, "enum " + enumDecl.name, enumDecl.conformances);
        renderMembers(enumDecl.members);
    }

    private void renderEnumCase(IrEnumCase enumCase) {
        writer.writeLine("case " + enumCase.name);
        switch (enumCase.caseKind) {
            case NAME_ONLY:
                break;
            case RAW_VALUE:
                writer.nextLineAppendsToLastLine();
                writer.writeLine(" = ");
                writer.nextLineAppendsToLastLine();
                renderLiteral(enumCase.rawValue);
                break;
            case ASSOCIATED_VALUES:
                if (enumCase.associatedValues.isEmpty()) break;
                List<String> values = new ArrayList<>();
                for (IrAssociatedValue v : enumCase.associatedValues) {
                    String type = renderedTypeRef(v.type);
                    values.add(v.label != null ? v.label + ": " + type : type);
                }
                writer.nextLineAppendsToLastLine();
                writer.writeLine("(" + String.join(", ", values) + ")");
                break;
            default:
                throw new IllegalStateException("Unhandled enum case kind: " + enumCase.caseKind);
        }
    }

    private void renderTypeAlias(IrTypeAlias alias) {
        List<String> words = new ArrayList<>();
        if (alias.accessModifier != null) words.add(alias.accessModifier.keyword);
        words.add("typealias");
        words.add(alias.name);
        words.add("=");
        words.add(renderedTypeRef(alias.existingType));
        writer.writeLine(String.join(" ", words));
    }

    private void renderVariable(IrVariable variable) {
        renderAccessModifierPrefix(variable.accessModifier);
        if (variable.isStatic) {
            writer.writeLine("static ");
            writer.nextLineAppendsToLastLine();
        }
        writer.writeLine(variable.bindingKind.keyword + " ");
        writer.nextLineAppendsToLastLine();
        renderExpression(variable.left);
        if (variable.type != null) {
            writer.nextLineAppendsToLastLine();
            writer.writeLine(": " + renderedTypeRef(variable.type));
        }

        if (variable.right != null) {
            writer.nextLineAppendsToLastLine();
            writer.writeLine(" = ");
            writer.nextLineAppendsToLastLine();
            renderExpression(variable.right);
        }

        if (variable.getter == null) return;
        writer.nextLineAppendsToLastLine();
        writer.writeLine(" {");
        writer.withNestedLevel(() -> {
            boolean explicitGetter = !variable.getterEffects.isEmpty() || variable.setter != null || variable.modify != null;
            if (explicitGetter) {
                StringBuilder line = new StringBuilder("get ");
                for (IrFunctionKeyword effect : variable.getterEffects) line.append(effect.keyword).append(' ');
                writer.writeLine(line.append('{').toString());
                writer.withNestedLevel(() -> renderCodeBlocks(variable.getter));
                writer.writeLine("}");
            } else {
                renderCodeBlocks(variable.getter);
            }
            if (variable.modify != null) renderAccessorBlock("_modify", variable.modify);
            if (variable.setter != null) renderAccessorBlock("set", variable.setter);
        });
        writer.writeLine("}");
    }

    private void renderAccessorBlock(String keyword, List<IrCodeBlock> body) {
        writer.writeLine(keyword + " {");
        writer.withNestedLevel(() -> renderCodeBlocks(body));
        writer.writeLine("}");
    }

    private void renderFunction(IrFunction function) {
        renderFunctionSignature(function.signature);
        if (function.body == null) return;
        writer.nextLineAppendsToLastLine();
        writer.writeLine(" {");
        if (!function.body.isEmpty()) {
            writer.withNestedLevel(() -> renderCodeBlocks(function.body));
        } else {
            writer.nextLineAppendsToLastLine();
        }
        writer.writeLine("}");
    }

    private void renderFunctionSignature(IrFunctionSignature signature) {
        renderAccessModifierPrefix(signature.accessModifier);
        writer.writeLine(renderedFunctionKind(signature.kind) + "(");
        List<IrParameter> parameters = signature.parameters;
        if (parameters.size() > 1) {
            writer.withNestedLevel(() -> {
                for (int i = 0; i < parameters.size(); i++) {
                    renderParameter(parameters.get(i));
                    if (i < parameters.size() - 1) {
                        writer.nextLineAppendsToLastLine();
                        writer.writeLine(",");
                    }
                }
            });
        } else {
            writer.nextLineAppendsToLastLine();
            if (!parameters.isEmpty()) renderParameter(parameters.get(0));
            writer.nextLineAppendsToLastLine();
        }
        writer.writeLine(")");

        for (IrFunctionKeyword keyword : signature.keywords) {
            writer.nextLineAppendsToLastLine();
            writer.writeLine(" " + keyword.keyword);
        }

        if (signature.returnType != null) {
            writer.nextLineAppendsToLastLine();
            writer.writeLine(" -> ");
            writer.nextLineAppendsToLastLine();
            renderExpression(signature.returnType);
        }
    }

    private static String renderedFunctionKind(IrFunctionKind kind) {
        if (kind.initializer) {
            return (kind.convenience ? "convenience " : "") + "init" + (kind.failable ? "?" : "");
        }
        return (kind.isStatic ? "static " : "") + "func " + kind.name;
    }

    private void renderParameter(IrParameter parameter) {
        writer.writeLine(parameter.label != null ? parameter.label : "_");
        writer.nextLineAppendsToLastLine();
        if (parameter.name != null && !parameter.name.equals(parameter.label)) {
            writer.writeLine(" " + parameter.name);
            writer.nextLineAppendsToLastLine();
        }
        writer.writeLine(": " + renderedTypeRef(parameter.type));
        if (parameter.defaultValue != null) {
            writer.nextLineAppendsToLastLine();
            writer.writeLine(" = ");
            writer.nextLineAppendsToLastLine();
            renderExpression(parameter.defaultValue);
        }
    }

    static String renderedTypeRef(IrTypeRef type) {
        switch (type.kind) {
            case MEMBER:
                return String.join(".", type.components);
            case ANY:
                return "any " + renderedTypeRef(type.wrapped);
            case GENERIC:
                return renderedTypeRef(type.wrapper) + "<" + renderedTypeRef(type.wrapped) + ">";
            case OPTIONAL:
                return renderedTypeRef(type.wrapped) + "?";
            case ARRAY:
                return "[" + renderedTypeRef(type.wrapped) + "]";
            case DICTIONARY_VALUE:
                return "[String: " + renderedTypeRef(type.wrapped) + "]";
            default:
                throw new IllegalStateException("Unhandled type kind: " + type.kind);
        }
    }

    // ---------------------------------------------------------------------
    // Expressions
    // ---------------------------------------------------------------------

    void renderExpression(IrExpression expression) {
        switch (expression.kind()) {
            case LITERAL:
                renderLiteral((IrLiteral) expression);
                break;
            case IDENTIFIER: {
                IrIdentifier id = (IrIdentifier) expression;
                writer.writeLine(id.pattern != null ? id.pattern : renderedTypeRef(id.type));
                break;
            }
            case MEMBER_ACCESS:
                renderMemberAccess((IrMemberAccess) expression);
                break;
            case FUNCTION_CALL:
                renderFunctionCall((IrFunctionCall) expression);
                break;
            case ASSIGNMENT: {
                IrAssignment a = (IrAssignment) expression;
                renderInfix(a.left, " = ", a.right);
                break;
            }
            case SWITCH:
                renderSwitch((IrSwitch) expression);
                break;
            case IF:
                renderIf((IrIf) expression);
                break;
            case DO:
                renderDo((IrDo) expression);
                break;
            case VALUE_BINDING: {
                IrValueBinding binding = (IrValueBinding) expression;
                writer.writeLine(binding.bindingKind.keyword + " ");
                writer.nextLineAppendsToLastLine();
                renderFunctionCall(binding.value);
                break;
            }
            case UNARY_KEYWORD:
                renderUnaryKeyword((IrUnaryKeyword) expression);
                break;
            case CLOSURE_INVOCATION:
                renderClosureInvocation((IrClosureInvocation) expression);
                break;
            case BINARY_OPERATION: {
                IrBinaryOperation op = (IrBinaryOperation) expression;
                renderInfix(op.left, " " + op.operator.symbol + " ", op.right);
                break;
            }
            case IN_OUT:
                writer.writeLine("&");
                writer.nextLineAppendsToLastLine();
                renderExpression(((IrInOut) expression).referencedExpression);
                break;
            case OPTIONAL_CHAINING:
                renderPostfix(((IrOptionalChaining) expression).referencedExpression, "?");
                break;
            case FORCE_UNWRAP:
                renderPostfix(((IrForceUnwrap) expression).referencedExpression, "!");
                break;
            case TUPLE:
                renderTuple((IrTuple) expression);
                break;
            default:
                throw new IllegalStateException("Unhandled expression kind: " + expression.kind());
        }
    }

    private void renderInfix(IrExpression left, String operator, IrExpression right) {
        renderExpression(left);
        writer.nextLineAppendsToLastLine();
        writer.writeLine(operator);
        writer.nextLineAppendsToLastLine();
        renderExpression(right);
    }

    private void renderPostfix(IrExpression expression, String suffix) {
        renderExpression(expression);
        writer.nextLineAppendsToLastLine();
        writer.writeLine(suffix);
    }

    private void renderMemberAccess(IrMemberAccess memberAccess) {
        if (memberAccess.left != null) {
            renderExpression(memberAccess.left);
            writer.nextLineAppendsToLastLine();
        }
        writer.writeLine("." + memberAccess.right);
    }

    private void renderFunctionCallArgument(IrFunctionArgument argument) {
        if (argument.label != null) {
            writer.writeLine(argument.label + ": ");
            writer.nextLineAppendsToLastLine();
        }
        renderExpression(argument.expression);
    }

    private void renderFunctionCall(IrFunctionCall call) {
        renderExpression(call.calledExpression);
        writer.nextLineAppendsToLastLine();
        writer.writeLine("(");
        List<IrFunctionArgument> arguments = call.arguments;
        if (arguments.size() > 1) {
            writer.withNestedLevel(() -> {
                for (int i = 0; i < arguments.size(); i++) {
                    renderFunctionCallArgument(arguments.get(i));
                    if (i < arguments.size() - 1) {
                        writer.nextLineAppendsToLastLine();
                        writer.writeLine(",");
                    }
                }
            });
        } else {
            writer.nextLineAppendsToLastLine();
            if (!arguments.isEmpty()) renderFunctionCallArgument(arguments.get(0));
            writer.nextLineAppendsToLastLine();
        }
        writer.writeLine(")");
        if (call.trailingClosure != null) {
            writer.nextLineAppendsToLastLine();
            writer.writeLine(" ");
            writer.nextLineAppendsToLastLine();
            renderClosureInvocation(call.trailingClosure);
        }
    }

    private void renderSwitch(IrSwitch switchExpr) {
        writer.writeLine("switch ");
        writer.nextLineAppendsToLastLine();
        renderExpression(switchExpr.switchedExpression);
        writer.nextLineAppendsToLastLine();
        writer.writeLine(" {");
        for (IrSwitchCase switchCase : switchExpr.cases) {
            renderSwitchCaseHead(switchCase);
            writer.nextLineAppendsToLastLine();
            writer.writeLine(":");
            writer.withNestedLevel(() -> renderCodeBlocks(switchCase.body));
        }
        writer.writeLine("}");
    }

    private void renderSwitchCaseHead(IrSwitchCase switchCase) {
        switch (switchCase.caseKind) {
            case CASE: {
                boolean binds = !switchCase.associatedValueNames.isEmpty();
                writer.writeLine(binds ? "case let " : "case ");
                writer.nextLineAppendsToLastLine();
                renderExpression(switchCase.expressions.get(0));
                if (binds) {
                    writer.nextLineAppendsToLastLine();
                    writer.writeLine("(" + String.join(", ", switchCase.associatedValueNames) + ")");
                }
                break;
            }
            case MULTI_CASE: {
                writer.writeLine("case ");
                List<IrExpression> expressions = switchCase.expressions;
                for (int i = 0; i < expressions.size(); i++) {
                    writer.nextLineAppendsToLastLine();
                    renderExpression(expressions.get(i));
                    if (i < expressions.size() - 1) {
                        writer.nextLineAppendsToLastLine();
                        writer.writeLine(", ");
                    }
                }
                break;
            }
            case DEFAULT:
                writer.writeLine("default");
                break;
            default:
                throw new IllegalStateException("Unhandled switch case kind: " + switchCase.caseKind);
        }
    }

    private void renderIf(IrIf ifExpr) {
        writer.writeLine("if ");
        renderConditionalBranch(ifExpr.ifBranch);
        for (IrIfBranch branch : ifExpr.elseIfBranches) {
            writer.nextLineAppendsToLastLine();
            writer.writeLine(" else if ");
            renderConditionalBranch(branch);
        }
        if (ifExpr.elseBody != null) {
            writer.nextLineAppendsToLastLine();
            writer.writeLine(" else {");
            writer.withNestedLevel(() -> renderCodeBlocks(ifExpr.elseBody));
            writer.writeLine("}");
        }
    }

    /** Continues an open {@code if }/{@code else if } line with the condition and the braced body. */
    private void renderConditionalBranch(IrIfBranch branch) {
        writer.nextLineAppendsToLastLine();
        renderExpression(branch.condition);
        writer.nextLineAppendsToLastLine();
        writer.writeLine(" {");
        writer.withNestedLevel(() -> renderCodeBlocks(branch.body));
        writer.writeLine("}");
    }

    private void renderDo(IrDo doExpr) {
        writer.writeLine("do {");
        writer.withNestedLevel(() -> renderCodeBlocks(doExpr.doStatement));
        if (doExpr.catchBody != null) {
            writer.writeLine("} catch {");
            if (!doExpr.catchBody.isEmpty()) {
                writer.withNestedLevel(() -> renderCodeBlocks(doExpr.catchBody));
            } else {
                writer.nextLineAppendsToLastLine();
            }
        }
        writer.writeLine("}");
    }

    private void renderUnaryKeyword(IrUnaryKeyword unary) {
        writer.writeLine(unary.keyword.keyword);
        if (unary.expression == null) return;
        writer.nextLineAppendsToLastLine();
        writer.writeLine(" ");
        writer.nextLineAppendsToLastLine();
        renderExpression(unary.expression);
    }

    private void renderClosureInvocation(IrClosureInvocation closure) {
        writer.writeLine("{");
        if (!closure.argumentNames.isEmpty()) {
            writer.nextLineAppendsToLastLine();
            writer.writeLine(" " + String.join(", ", closure.argumentNames) + " in");
        }
        if (closure.body != null) {
            writer.withNestedLevel(() -> renderCodeBlocks(closure.body));
        }
        writer.writeLine("}");
    }

    private void renderTuple(IrTuple tuple) {
        writer.writeLine("(");
        List<IrExpression> members = tuple.members;
        for (int i = 0; i < members.size(); i++) {
            writer.nextLineAppendsToLastLine();
            renderExpression(members.get(i));
            if (i < members.size() - 1) {
                writer.nextLineAppendsToLastLine();
                writer.writeLine(", ");
            }
        }
        writer.nextLineAppendsToLastLine();
        writer.writeLine(")");
    }

    void renderLiteral(IrLiteral literal) {
        switch (literal.literalKind) {
            case STRING:
                writer.writeLine(renderedStringLiteral(literal.stringValue));
                break;
            case INT:
                writer.writeLine(Long.toString(literal.intValue));
                break;
            case FLOAT:
                writer.writeLine(String.format(Locale.ROOT, "%." + literal.precision + "f", literal.floatValue));
                break;
            case BOOL:
                writer.writeLine(literal.boolValue ? "true" : "false");
                break;
            case NIL:
                writer.writeLine("nil");
                break;
            case ARRAY:
                renderArrayLiteral(literal.items);
                break;
            default:
                throw new IllegalStateException("Unhandled literal kind: " + literal.literalKind);
        }
    }

    private void renderArrayLiteral(List<IrExpression> items) {
        writer.writeLine("[");
        if (!items.isEmpty()) {
            writer.withNestedLevel(() -> {
                for (int i = 0; i < items.size(); i++) {
                    renderExpression(items.get(i));
                    if (i < items.size() - 1) {
                        writer.nextLineAppendsToLastLine();
                        writer.writeLine(",");
                    }
                }
            });
        } else {
            writer.nextLineAppendsToLastLine();
        }
        writer.writeLine("]");
    }

    /**
     * Plain {@code "..."} unless the content contains a quote or backslash; then a raw literal
     * {@code #"..."#} with as many {@code #} as needed so that no {@code "#...} or {@code \#...}
     * sequence inside the content closes the literal or starts an escape.
     *
     * <p>Line breaks and other control characters are always escaped, using the literal's own escape
     * delimiter ({@code \n} or {@code \#n}), so the literal stays on one line.</p>
     */
    static String renderedStringLiteral(String content) {
        String hashes = "";
        if (content.indexOf('"') >= 0 || content.indexOf('\\') >= 0) {
            hashes = "#";
            while (content.contains("\"" + hashes) || content.contains("\\" + hashes)) {
                hashes += "#";
            }
        }
        return hashes + "\"" + escapedControlCharacters(content, "\\" + hashes) + "\"" + hashes;
    }

    private static String escapedControlCharacters(String content, String escape) {
        StringBuilder sb = new StringBuilder(content.length());
        content.codePoints().forEach(cp -> {
            switch (cp) {
                case '\n':
                    sb.append(escape).append('n');
                    break;
                case '\r':
                    sb.append(escape).append('r');
                    break;
                case '\t':
                    sb.append(escape).append('t');
                    break;
                case 0:
                    sb.append(escape).append('0');
                    break;
                default:
                    if (Character.isISOControl(cp) || cp == 0x2028 || cp == 0x2029) {
                        sb.append(escape).append("u{").append(Integer.toHexString(cp).toUpperCase(Locale.ROOT)).append('}');
                    } else {
                        sb.appendCodePoint(cp);
                    }
            }
        });
        return sb.toString();
    }

    private static String joinMapped(List<String> values, String prefix, String suffix, String separator) {
        StringBuilder sb = new StringBuilder();
        for (String v : values) {
            if (sb.length() > 0) sb.append(separator);
            sb.append(prefix).append(v).append(suffix);
        }
        return sb.toString();
    }
}
