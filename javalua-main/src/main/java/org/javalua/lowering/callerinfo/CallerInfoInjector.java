package org.javalua.lowering.callerinfo;

import java.util.Optional;

import com.github.javaparser.Position;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.CompactConstructorDeclaration;
import com.github.javaparser.ast.body.EnumConstantDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.Expression;
import org.javalua.LoweringInvariantException;
import org.javalua.lowering.LoweringContext;
import org.javalua.lowering.LoweringOptions;
import org.javalua.lowering.literal.LiteralBuilder;
import org.javalua.lowering.util.StructuralQueries;
import org.javalua.lua.ast.LuaLiteralExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Supplies the literal for a caller-info parameter that a call leaves out: the call's line, the
 * name of the member containing the call, or the path of the source file.
 * <p>
 * Java has no optional parameters, so "left out" means the call passes a placeholder for it (see
 * {@link #isPlaceholder(Expression)}). Any other argument is an explicit value and wins.
 */
public final class CallerInfoInjector {

    private static final Logger logger = LoggerFactory.getLogger(CallerInfoInjector.class);

    private static final String INSTANCE_INITIALIZER_NAME = "<init>";
    private static final String STATIC_INITIALIZER_NAME = "<clinit>";

    private final LoweringContext context;
    private final LiteralBuilder literals;

    public CallerInfoInjector(LoweringContext context, LiteralBuilder literals) {
        this.context = context;
        this.literals = literals;
    }

    public CallerAttributeKind kindOf(String annotationTypeName) {
        LoweringOptions options = context.getOptions();
        if (options.getCallerLineNumberAnnotation().equals(annotationTypeName)) {
            return CallerAttributeKind.LINE;
        }
        if (options.getCallerMemberNameAnnotation().equals(annotationTypeName)) {
            return CallerAttributeKind.MEMBER;
        }
        if (options.getCallerFilePathAnnotation().equals(annotationTypeName)) {
            return CallerAttributeKind.FILE_PATH;
        }
        return CallerAttributeKind.NONE;
    }

    /**
     * Kind of the first caller-info annotation on {@code parameter}.
     */
    public CallerAttributeKind kindOf(Parameter parameter) {
        for (String typeName : context.getOracle().attributeTypeNames(parameter)) {
            CallerAttributeKind kind = kindOf(typeName);
            if (kind != CallerAttributeKind.NONE) {
                return kind;
            }
        }
        return CallerAttributeKind.NONE;
    }

    public boolean isCallerAttribute(AnnotationExpr annotation) {
        return kindOf(context.getOracle().annotationTypeName(annotation)) != CallerAttributeKind.NONE;
    }

    /**
     * Whether a call argument stands for an omitted caller-info value: {@code null}, {@code ""} or a
     * literal holding its type's default value, such as {@code 0} or {@code false}.
     */
    public static boolean isPlaceholder(Expression argument) {
        if (argument.isNullLiteralExpr()) {
            return true;
        }
        if (argument.isStringLiteralExpr()) {
            return argument.asStringLiteralExpr().getValue().isEmpty();
        }
        if (argument.isBooleanLiteralExpr()) {
            return !argument.asBooleanLiteralExpr().getValue();
        }
        if (argument.isIntegerLiteralExpr()) {
            return argument.asIntegerLiteralExpr().asNumber().longValue() == 0;
        }
        if (argument.isLongLiteralExpr()) {
            return argument.asLongLiteralExpr().asNumber().longValue() == 0;
        }
        if (argument.isDoubleLiteralExpr()) {
            return argument.asDoubleLiteralExpr().asDouble() == 0;
        }
        return false;
    }

    /**
     * @param parameter the declaration of a parameter the call supplies no argument for
     * @param callSite  the call expression
     * @return the literal to pass in its place, or empty when the parameter is not caller-info
     */
    public Optional<LuaLiteralExpression> substituteIfCallerAttribute(Parameter parameter, Node callSite) {
        CallerAttributeKind kind = kindOf(parameter);
        LuaLiteralExpression literal;
        switch (kind) {
            case LINE:
                literal = literals.literalFor(lineOf(callSite));
                break;
            case MEMBER:
                literal = literals.stringLiteral(memberNameOf(callSite));
                break;
            case FILE_PATH:
                literal = literals.stringLiteral(context.getSourcePath());
                break;
            default:
                return Optional.empty();
        }
        logger.debug("Injected {} '{}' for parameter '{}'", kind, literal, parameter.getNameAsString());
        return Optional.of(literal);
    }

    private static int lineOf(Node callSite) {
        return callSite.getBegin()
                .map(position -> position.line)
                .orElseThrow(() -> LoweringInvariantException.at(callSite, "Call site has no source position"));
    }

    static String memberNameOf(Node callSite) {
        BodyDeclaration<?> member = StructuralQueries.enclosingMember(callSite);
        if (member instanceof CallableDeclaration) {
            return ((CallableDeclaration<?>) member).getNameAsString();
        }
        if (member instanceof CompactConstructorDeclaration) {
            return ((CompactConstructorDeclaration) member).getNameAsString();
        }
        if (member instanceof InitializerDeclaration) {
            return ((InitializerDeclaration) member).isStatic() ? STATIC_INITIALIZER_NAME : INSTANCE_INITIALIZER_NAME;
        }
        if (member instanceof FieldDeclaration) {
            return fieldNameOf((FieldDeclaration) member, callSite);
        }
        if (member instanceof EnumConstantDeclaration) {
            return ((EnumConstantDeclaration) member).getNameAsString();
        }
        if (member instanceof TypeDeclaration) {
            return ((TypeDeclaration<?>) member).getNameAsString();
        }
        return member.asAnnotationMemberDeclaration().getNameAsString();
    }

    // int a = f(), b = g(); names the declarator holding the call
    private static String fieldNameOf(FieldDeclaration field, Node callSite) {
        Position begin = callSite.getBegin().orElse(null);
        for (VariableDeclarator variable : field.getVariables()) {
            if (begin != null && variable.getRange().map(range -> range.contains(begin)).orElse(false)) {
                return variable.getNameAsString();
            }
        }
        return field.getVariable(0).getNameAsString();
    }
}
