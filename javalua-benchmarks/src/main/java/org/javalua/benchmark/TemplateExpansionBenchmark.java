package org.javalua.benchmark;

import java.util.List;
import java.util.concurrent.TimeUnit;

import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import org.javalua.LuaLowering;
import org.javalua.lowering.LoweringOptions;
import org.javalua.lowering.template.CodeTemplate;
import org.javalua.lowering.template.CodeTemplateExpander;
import org.javalua.lua.ast.LuaCodeTemplateExpression;
import org.javalua.lua.ast.LuaIdentifierName;
import org.javalua.symbol.JavaParserSymbolOracle;
import org.openjdk.jmh.annotations.*;

/**
 * Cost of parsing a code template versus expanding an already parsed one. Parsing happens once per
 * distinct template text; expansion happens at every call site.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Fork(1)
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class TemplateExpansionBenchmark {

    private static final String TEMPLATE = "{this}:Format({0}, {*1})";

    @State(Scope.Thread)
    public static class ExpansionState {

        CodeTemplateExpander expander;
        CodeTemplate parsed;
        final Expression receiver = new NameExpr("builder");
        final List<Expression> arguments = List.of(
                new StringLiteralExpr("{0} of {1}"), new IntegerLiteralExpr("3"), new NameExpr("total"));

        @Setup(Level.Trial)
        public void init() {
            JavaParserSymbolOracle oracle = JavaParserSymbolOracle.reflective();
            LuaLowering lowering = LuaLowering.forUnit(oracle.newParser().parse("class Bench { }").getResult().orElseThrow(),
                    oracle, LoweringOptions.defaults());
            // names are emitted as written; only the template machinery is measured
            expander = new CodeTemplateExpander(lowering.context(), expression -> expression.isNameExpr()
                    ? new LuaIdentifierName(expression.toString())
                    : lowering.literals().literalFor(expression.asLiteralExpr()));
            parsed = CodeTemplate.parse(TEMPLATE);
        }
    }

    @Benchmark
    public CodeTemplate parseTemplate() {
        return CodeTemplate.parse(TEMPLATE);
    }

    @Benchmark
    public LuaCodeTemplateExpression expandParsedTemplate(ExpansionState state) {
        return state.expander.expand(state.parsed, state.receiver, state.arguments, List.of());
    }

    @Benchmark
    public LuaCodeTemplateExpression expandCachedTemplate(ExpansionState state) {
        return state.expander.expand(TEMPLATE, state.receiver, state.arguments, List.of());
    }
}
