package org.javalua.lowering;

import java.util.List;
import java.util.Optional;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.CharLiteralExpr;
import com.github.javaparser.ast.expr.DoubleLiteralExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.LongLiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.NullLiteralExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.TextBlockLiteralExpr;
import com.github.javaparser.ast.expr.ThisExpr;
import com.github.javaparser.ast.visitor.GenericVisitorWithDefaults;
import org.javalua.LoweringException;
import org.javalua.lowering.callerinfo.CallerInfoInjector;
import org.javalua.lowering.literal.LiteralBuilder;
import org.javalua.lowering.naming.IdentifierSafety;
import org.javalua.lowering.template.CodeTemplateExpander;
import org.javalua.lua.ast.LuaExpression;
import org.javalua.lua.ast.LuaIdentifierName;
import org.javalua.lua.ast.LuaLiteralExpression;
import org.javalua.lua.ast.LuaParenthesizedExpression;
import org.javalua.symbol.DeclarationSymbol;
import org.javalua.symbol.SymbolOracle;

/**
 * Lowers the expressions whose Lua form follows directly from the core's building blocks: local and
 * parameter names, {@code this}, literals, constant field reads and calls of methods or constructors
 * declared with a code template.
 * <p>
 * A placeholder argument ({@code null}, {@code 0}, {@code ""}) passed for a caller-info parameter is
 * replaced by the caller's line, member name or file path; an explicit argument, such as a wrapper
 * forwarding its own caller-info parameter, is lowered as written. Any other expression raises
 * {@link LoweringException}; lowering it is the job of a fuller pass, which can extend this class.
 */
public class PrimaryExpressionLowering extends GenericVisitorWithDefaults<LuaExpression, Void> implements ExpressionLowering {

    private final LoweringContext context;
    private final IdentifierSafety identifiers;
    private final LiteralBuilder literals;
    private final CallerInfoInjector callerInfo;
    private final CodeTemplateExpander templates;

    public PrimaryExpressionLowering(LoweringContext context, IdentifierSafety identifiers, LiteralBuilder literals,
                                     CallerInfoInjector callerInfo) {
        this.context = context;
        this.identifiers = identifiers;
        this.literals = literals;
        this.callerInfo = callerInfo;
        this.templates = new CodeTemplateExpander(context, this);
    }

    public CodeTemplateExpander getTemplates() {
        return templates;
    }

    @Override
    public LuaExpression lower(Expression expression) {
        Optional<LuaLiteralExpression> injected = callerInfoArgument(expression);
        if (injected.isPresent()) {
            return injected.get();
        }
        return expression.accept(this, null);
    }

    @Override
    public LuaExpression defaultAction(Node n, Void arg) {
        throw new LoweringException("Unsupported expression " + n.getClass().getSimpleName(), n);
    }

    @Override
    public LuaExpression visit(NameExpr n, Void arg) {
        SymbolOracle oracle = context.getOracle();
        Optional<LuaLiteralExpression> constant = oracle.constantFieldOf(n).map(literals::literalFor);
        if (constant.isPresent()) {
            return constant.get();
        }
        DeclarationSymbol symbol = oracle.referencedSymbol(n);
        if (symbol.getDeclaration().getParentNode().filter(FieldDeclaration.class::isInstance).isPresent()) {
            throw new LoweringException("Unsupported implicit field access", n);
        }
        return new LuaIdentifierName(identifiers.resolveName(symbol, n.getNameAsString()));
    }

    @Override
    public LuaExpression visit(FieldAccessExpr n, Void arg) {
        return context.getOracle().constantFieldOf(n)
                .<LuaExpression>map(literals::literalFor)
                .orElseThrow(() -> new LoweringException("Unsupported field access", n));
    }

    @Override
    public LuaExpression visit(ThisExpr n, Void arg) {
        if (n.getTypeName().isPresent()) {
            throw new LoweringException("Unsupported qualified this", n);
        }
        return LuaIdentifierName.THIS;
    }

    @Override
    public LuaExpression visit(EnclosedExpr n, Void arg) {
        return new LuaParenthesizedExpression(lower(n.getInner()));
    }

    @Override
    public LuaExpression visit(MethodCallExpr n, Void arg) {
        return templates.expandCall(n)
                .<LuaExpression>map(expression -> expression)
                .orElseThrow(() -> new LoweringException("Unsupported call of a method without code template", n));
    }

    @Override
    public LuaExpression visit(ObjectCreationExpr n, Void arg) {
        if (n.getAnonymousClassBody().isPresent()) {
            return defaultAction(n, arg);
        }
        return templates.expandCreation(n)
                .<LuaExpression>map(expression -> expression)
                .orElseThrow(() -> new LoweringException("Unsupported creation of a type without code template", n));
    }

    @Override
    public LuaExpression visit(NullLiteralExpr n, Void arg) {
        return literals.literalFor(n);
    }

    @Override
    public LuaExpression visit(BooleanLiteralExpr n, Void arg) {
        return literals.literalFor(n);
    }

    @Override
    public LuaExpression visit(CharLiteralExpr n, Void arg) {
        return literals.literalFor(n);
    }

    @Override
    public LuaExpression visit(StringLiteralExpr n, Void arg) {
        return literals.literalFor(n);
    }

    @Override
    public LuaExpression visit(TextBlockLiteralExpr n, Void arg) {
        return literals.literalFor(n);
    }

    @Override
    public LuaExpression visit(IntegerLiteralExpr n, Void arg) {
        return literals.literalFor(n);
    }

    @Override
    public LuaExpression visit(LongLiteralExpr n, Void arg) {
        return literals.literalFor(n);
    }

    @Override
    public LuaExpression visit(DoubleLiteralExpr n, Void arg) {
        return literals.literalFor(n);
    }

    private Optional<LuaLiteralExpression> callerInfoArgument(Expression expression) {
        if (!CallerInfoInjector.isPlaceholder(expression)) {
            return Optional.empty();
        }
        Node parent = expression.getParentNode().orElse(null);
        Optional<? extends CallableDeclaration<?>> callee;
        List<Expression> arguments;
        if (parent instanceof MethodCallExpr) {
            MethodCallExpr call = (MethodCallExpr) parent;
            if (!isArgument(call.getArguments(), expression)) {
                return Optional.empty();
            }
            callee = context.getOracle().methodOf(call);
            arguments = call.getArguments();
        } else if (parent instanceof ObjectCreationExpr) {
            ObjectCreationExpr creation = (ObjectCreationExpr) parent;
            if (!isArgument(creation.getArguments(), expression)) {
                return Optional.empty();
            }
            callee = context.getOracle().constructorOf(creation);
            arguments = creation.getArguments();
        } else {
            return Optional.empty();
        }
        if (callee.isEmpty()) {
            return Optional.empty();
        }
        int index = indexOf(arguments, expression);
        List<Parameter> parameters = callee.get().getParameters();
        if (index >= parameters.size() || parameters.get(index).isVarArgs()) {
            return Optional.empty();
        }
        return callerInfo.substituteIfCallerAttribute(parameters.get(index), parent);
    }

    private static boolean isArgument(List<Expression> arguments, Expression expression) {
        return indexOf(arguments, expression) >= 0;
    }

    private static int indexOf(List<Expression> arguments, Expression expression) {
        for (int i = 0; i < arguments.size(); i++) {
            if (arguments.get(i) == expression) {
                return i;
            }
        }
        return -1;
    }
}
