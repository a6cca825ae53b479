package org.javalua;

import com.github.javaparser.ast.CompilationUnit;
import org.javalua.lowering.LoweringContext;
import org.javalua.lowering.LoweringOptions;
import org.javalua.lowering.PrimaryExpressionLowering;
import org.javalua.lowering.callerinfo.CallerInfoInjector;
import org.javalua.lowering.literal.LiteralBuilder;
import org.javalua.lowering.naming.IdentifierSafety;
import org.javalua.lowering.template.CodeTemplateExpander;
import org.javalua.lowering.util.ConstructorIndexer;
import org.javalua.symbol.SymbolOracle;

/**
 * Entry point of the lowering core: the components wired to one compilation unit.
 *
 * <pre>{@code
 * LuaLowering lowering = LuaLowering.forUnit(unit, JavaParserSymbolOracle.reflective(), LoweringOptions.defaults());
 * String name = lowering.identifiers().ensureSafeName("end", parameter);
 * }</pre>
 */
public final class LuaLowering {

    private final LoweringContext context;
    private final IdentifierSafety identifiers;
    private final LiteralBuilder literals;
    private final CallerInfoInjector callerInfo;
    private final ConstructorIndexer constructors;
    private final PrimaryExpressionLowering expressions;

    private LuaLowering(LoweringContext context) {
        this.context = context;
        this.identifiers = new IdentifierSafety(context);
        this.literals = new LiteralBuilder();
        this.callerInfo = new CallerInfoInjector(context, literals);
        this.constructors = new ConstructorIndexer(context.getOracle());
        this.expressions = new PrimaryExpressionLowering(context, identifiers, literals, callerInfo);
    }

    public static LuaLowering forUnit(CompilationUnit unit, SymbolOracle oracle, LoweringOptions options) {
        return new LuaLowering(new LoweringContext(unit, oracle, options));
    }

    public LoweringContext context() {
        return context;
    }

    public IdentifierSafety identifiers() {
        return identifiers;
    }

    public CodeTemplateExpander templates() {
        return expressions.getTemplates();
    }

    public LiteralBuilder literals() {
        return literals;
    }

    public CallerInfoInjector callerInfo() {
        return callerInfo;
    }

    public ConstructorIndexer constructors() {
        return constructors;
    }

    public PrimaryExpressionLowering expressions() {
        return expressions;
    }
}
