package org.javalua.benchmark;

import java.util.List;
import java.util.concurrent.TimeUnit;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.Parameter;
import org.javalua.LuaLowering;
import org.javalua.lowering.LoweringOptions;
import org.javalua.symbol.JavaParserSymbolOracle;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

/**
 * Renaming reserved parameters of a member with many locals. Each invocation starts from a fresh
 * context, so every rename searches the member scope.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(1)
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class SafeNamingBenchmark {

    @State(Scope.Thread)
    public static class UnitState {

        final JavaParserSymbolOracle oracle = JavaParserSymbolOracle.reflective();
        CompilationUnit unit;
        List<Parameter> parameters;

        @Setup(Level.Trial)
        public void init() {
            StringBuilder body = new StringBuilder();
            for (int i = 0; i < 200; i++) {
                body.append("        int local").append(i).append(" = ").append(i).append(";\n");
            }
            String source = "class Scope {\n" +
                            "    void run(int end, int repeat, int until, int end_, String type, Object next) {\n" +
                            body +
                            "    }\n" +
                            "}\n";
            unit = oracle.newParser().parse(source).getResult().orElseThrow();
            parameters = unit.findAll(Parameter.class);
        }
    }

    @Benchmark
    public void renameReservedParameters(UnitState state, Blackhole blackhole) {
        LuaLowering lowering = LuaLowering.forUnit(state.unit, state.oracle, LoweringOptions.defaults());
        for (Parameter parameter : state.parameters) {
            blackhole.consume(lowering.identifiers().safeParameterName(parameter));
        }
    }
}
