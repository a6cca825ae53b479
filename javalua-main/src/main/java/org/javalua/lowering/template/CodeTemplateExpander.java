package org.javalua.lowering.template;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MemberValuePair;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NormalAnnotationExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.SingleMemberAnnotationExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.TextBlockLiteralExpr;
import com.github.javaparser.ast.expr.ThisExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithAnnotations;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.resolution.types.ResolvedType;
import org.javalua.LoweringException;
import org.javalua.LoweringInvariantException;
import org.javalua.lowering.ExpressionLowering;
import org.javalua.lowering.LoweringContext;
import org.javalua.lua.ast.LuaCodeTemplateExpression;
import org.javalua.lua.ast.LuaCodeTemplateParamsExpression;
import org.javalua.lua.ast.LuaExpression;
import org.javalua.lua.ast.LuaIdentifierName;
import org.javalua.lua.ast.LuaLiteralExpression;
import org.javalua.lua.ast.LuaParenthesizedExpression;
import org.javalua.symbol.SymbolOracle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands code templates against a call site: the receiver, the arguments and the type arguments.
 * <p>
 * Placeholders that point past the supplied arguments or type arguments expand to nothing, together
 * with the separator in front of them, so one template serves calls with and without optional
 * trailing arguments.
 */
public final class CodeTemplateExpander {

    private static final Logger logger = LoggerFactory.getLogger(CodeTemplateExpander.class);

    private final LoweringContext context;
    private final ExpressionLowering expressions;

    public CodeTemplateExpander(LoweringContext context, ExpressionLowering expressions) {
        this.context = context;
        this.expressions = expressions;
    }

    public LuaCodeTemplateExpression expand(String template, Expression receiver) {
        return expand(CodeTemplate.of(template), receiver, List.of(), List.of());
    }

    public LuaCodeTemplateExpression expand(String template, Expression receiver,
                                            List<? extends Expression> arguments, List<ResolvedType> typeArguments) {
        return expand(CodeTemplate.of(template), receiver, arguments, typeArguments);
    }

    /**
     * @param receiver      the call's receiver; may be {@code null} when the template uses neither
     *                      {@code {this}} nor {@code {class}}
     * @param arguments     the call's argument expressions, lowered on demand
     * @param typeArguments the call's type arguments
     */
    public LuaCodeTemplateExpression expand(CodeTemplate template, Expression receiver,
                                            List<? extends Expression> arguments, List<ResolvedType> typeArguments) {
        SymbolOracle oracle = context.getOracle();
        List<LuaExpression> codes = new ArrayList<>();
        for (TemplateToken token : template.getTokens()) {
            if (token instanceof TemplateToken.Text) {
                codes.add(new LuaIdentifierName(((TemplateToken.Text) token).text()));
                continue;
            }
            TemplateToken.Placeholder placeholder = (TemplateToken.Placeholder) token;
            int index = placeholder.index();
            switch (placeholder.kind()) {
                case THIS:
                    add(codes, placeholder, memberAccessTarget(requireReceiver(template, receiver)));
                    break;
                case CLASS:
                    add(codes, placeholder, new LuaIdentifierName(oracle.typeDisplayName(requireReceiver(template, receiver))));
                    break;
                case TYPE_ARGUMENT:
                    if (index < typeArguments.size()) {
                        add(codes, placeholder, new LuaIdentifierName(oracle.displayName(typeArguments.get(index))));
                    }
                    break;
                case PARAMS:
                    List<LuaExpression> params = new ArrayList<>();
                    for (int i = index; i < arguments.size(); i++) {
                        params.add(expressions.lower(arguments.get(i)));
                    }
                    if (!params.isEmpty()) {
                        add(codes, placeholder, new LuaCodeTemplateParamsExpression(params));
                    }
                    break;
                case ARGUMENT:
                    if (index < arguments.size()) {
                        add(codes, placeholder, expressions.lower(arguments.get(index)));
                    }
                    break;
                default:
                    throw new IllegalStateException("Unknown placeholder kind " + placeholder.kind());
            }
        }
        return new LuaCodeTemplateExpression(codes);
    }

    /**
     * Expands the template attached to the method a call invokes, if that method carries one.
     */
    public Optional<LuaCodeTemplateExpression> expandCall(MethodCallExpr call) {
        Optional<MethodDeclaration> method = context.getOracle().methodOf(call);
        return method.flatMap(this::templateOf)
                .map(template -> expand(CodeTemplate.of(template), receiverOf(call, method.get()),
                        call.getArguments(), typeArguments(call.getTypeArguments())));
    }

    /**
     * Expands the template attached to the constructor an object creation invokes. Such templates have
     * no receiver.
     */
    public Optional<LuaCodeTemplateExpression> expandCreation(ObjectCreationExpr creation) {
        return context.getOracle().constructorOf(creation)
                .flatMap(this::templateOf)
                .map(template -> expand(CodeTemplate.of(template), null,
                        creation.getArguments(), typeArguments(creation.getTypeArguments())));
    }

    /**
     * Code template declared on the method a call invokes.
     */
    public Optional<String> templateOf(MethodCallExpr call) {
        return context.getOracle().methodOf(call).flatMap(this::templateOf);
    }

    public Optional<String> templateOf(NodeWithAnnotations<?> declaration) {
        String annotationName = context.getOptions().getTemplateAnnotation();
        for (AnnotationExpr annotation : declaration.getAnnotations()) {
            if (annotationName.equals(context.getOracle().annotationTypeName(annotation))) {
                return Optional.of(templateText(annotation));
            }
        }
        return Optional.empty();
    }

    // an unqualified call of an instance method is made on this
    private static Expression receiverOf(MethodCallExpr call, MethodDeclaration method) {
        return call.getScope().orElseGet(() -> method.isStatic() ? null : new ThisExpr());
    }

    private List<ResolvedType> typeArguments(Optional<NodeList<Type>> types) {
        List<ResolvedType> resolved = new ArrayList<>();
        types.ifPresent(list -> {
            for (Type type : list) {
                resolved.add(context.getOracle().resolve(type));
            }
        });
        return resolved;
    }

    private static String templateText(AnnotationExpr annotation) {
        if (annotation instanceof SingleMemberAnnotationExpr) {
            return stringConstant(annotation, ((SingleMemberAnnotationExpr) annotation).getMemberValue());
        }
        if (annotation instanceof NormalAnnotationExpr) {
            for (MemberValuePair pair : ((NormalAnnotationExpr) annotation).getPairs()) {
                if (pair.getNameAsString().equals("value")) {
                    return stringConstant(annotation, pair.getValue());
                }
            }
        }
        throw new LoweringException("Code template annotation has no value", annotation);
    }

    // long templates are often split with +
    private static String stringConstant(AnnotationExpr annotation, Expression value) {
        if (value instanceof StringLiteralExpr) {
            return ((StringLiteralExpr) value).asString();
        }
        if (value instanceof TextBlockLiteralExpr) {
            return ((TextBlockLiteralExpr) value).asString();
        }
        if (value instanceof BinaryExpr && ((BinaryExpr) value).getOperator() == BinaryExpr.Operator.PLUS) {
            BinaryExpr concatenation = (BinaryExpr) value;
            return stringConstant(annotation, concatenation.getLeft()) + stringConstant(annotation, concatenation.getRight());
        }
        throw new LoweringException("Code template must be a string literal", annotation);
    }

    private LuaExpression memberAccessTarget(Expression receiver) {
        LuaExpression target = expressions.lower(receiver);
        if (target instanceof LuaLiteralExpression || target instanceof LuaCodeTemplateExpression) {
            return new LuaParenthesizedExpression(target);
        }
        return target;
    }

    private Expression requireReceiver(CodeTemplate template, Expression receiver) {
        if (receiver == null) {
            throw new LoweringInvariantException("Code template '" + template.getText() + "' refers to a receiver but the call has none",
                    context.getUnitName(), -1, -1, template.getText());
        }
        return receiver;
    }

    private static void add(List<LuaExpression> codes, TemplateToken.Placeholder placeholder, LuaExpression expression) {
        if (!placeholder.separator().isEmpty()) {
            codes.add(new LuaIdentifierName(placeholder.separator()));
        }
        codes.add(expression);
        logger.trace("Substituted {} placeholder with {}", placeholder.kind(), expression);
    }
}
