package org.circomscan.analysis.impl;

import org.circomscan.analysis.*;
import org.circomscan.analysis.writer.CachedReportWriter;
import org.circomscan.structure.ast.AssignOperator;
import org.circomscan.structure.ast.Declaration;
import org.circomscan.structure.ast.NumberExpression;
import org.circomscan.structure.ast.Return;
import org.circomscan.structure.ast.Statement;
import org.circomscan.structure.ast.Substitution;
import org.circomscan.structure.ast.VariableExpression;
import org.circomscan.structure.ast.VariableType;
import org.circomscan.structure.cfg.Cfg;
import org.circomscan.structure.cfg.SsaLowering;
import org.circomscan.structure.definition.DefinitionKind;
import org.circomscan.structure.definition.FunctionDefinition;
import org.circomscan.structure.report.MessageCategory;
import org.circomscan.structure.report.Report;
import org.circomscan.structure.report.ReportCode;
import org.circomscan.structure.report.ReportCollection;
import org.intellij.lang.annotations.Language;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class TestAnalysisRunner extends CommonTest {

    private AnalysisRunnerImpl runner(AnalysisPass... passes) {
        AnalysisRunnerImpl.ConfigurationBuilder builder = new AnalysisRunnerImpl.ConfigurationBuilder();
        for (AnalysisPass pass : passes) builder.addAnalysisPass(pass);
        return new AnalysisRunnerImpl(definitionStore(), builder.build());
    }

    private static ReportCollection info(String message) {
        return ReportCollection.of(Report.info(message, ReportCode.ANALYSIS_ERROR).build());
    }

    @DisplayName("lookup, take and replace of a function")
    @Test
    public void test1() {
        AnalysisRunnerImpl runner = new AnalysisRunnerImpl(definitionStore());
        CfgCache functions = runner.cache(DefinitionKind.FUNCTION);

        Cfg foo = runner.function("foo");
        assertEquals("foo", foo.name());
        assertTrue(foo.isSsa());
        assertTrue(functions.isCached("foo"));
        assertSame(foo, runner.function("foo"));
        assertEquals(1, functions.loweringCount("foo"));

        Checkout checkout = runner.takeFunction("foo");
        assertSame(foo, checkout.cfg());
        assertTrue(checkout.reports().isEmpty());
        assertFalse(functions.isCached("foo"));
        assertFalse(runner.replaceFunction("foo", checkout.cfg()));
        assertTrue(functions.isCached("foo"));

        AnalysisException e = assertThrows(AnalysisException.class, () -> runner.function("baz"));
        assertEquals(AnalysisException.Kind.UNKNOWN_FUNCTION, e.kind());
        assertEquals("baz", e.name());
        assertFalse(functions.isCached("baz"));
        assertFalse(functions.hasPendingReports("baz"));
        assertEquals(0, functions.loweringCount("baz"));

        // templates and functions live in separate name spaces
        assertThrows(AnalysisException.class, () -> runner.template("foo"));
        assertTrue(runner.isFunction("foo"));
        assertFalse(runner.isTemplate("foo"));
    }

    @DisplayName("failure to lower is remembered, and reported once")
    @Test
    public void test2() {
        AnalysisRunnerImpl runner = new AnalysisRunnerImpl(definitionStore());
        CfgCache functions = runner.cache(DefinitionKind.FUNCTION);

        AnalysisException e = assertThrows(AnalysisException.class, () -> runner.function("bad"));
        assertEquals(AnalysisException.Kind.FAILED_TO_LIFT_FUNCTION, e.kind());
        assertTrue(e.isLiftFailure());
        assertNotNull(e.getCause());
        assertTrue(functions.hasFailed("bad"));
        assertTrue(functions.hasPendingReports("bad"));

        AnalysisException e2 = assertThrows(AnalysisException.class, () -> runner.function("bad"));
        assertEquals(AnalysisException.Kind.FAILED_TO_LIFT_FUNCTION, e2.kind());
        assertEquals(1, functions.loweringCount("bad"));

        CachedReportWriter writer = new CachedReportWriter(MessageCategory.INFO);
        runner.analyzeFunction("bad", writer);
        assertEquals(1, writer.reports().size());
        Report report = writer.reports().get(0);
        assertTrue(report.isError());
        assertEquals("uninitialized-symbol", report.id());
        assertEquals(meta(mainId, "y;").location(), report.primary().get(0).location());

        runner.analyzeFunction("bad", writer);
        assertEquals(1, writer.reports().size());
        assertEquals(1, functions.loweringCount("bad"));
        assertEquals(List.of("analyzing function 'bad'", "analyzing function 'bad'"), writer.messages());
    }

    @DisplayName("lowering reports reach the writer exactly once")
    @Test
    public void test3() {
        AnalysisRunnerImpl runner = new AnalysisRunnerImpl(definitionStore());
        CachedReportWriter writer = new CachedReportWriter(MessageCategory.INFO);
        runner.analyzeFunction("shadow", writer);
        runner.analyzeFunction("shadow", writer);
        assertEquals(1, writer.reports().size());
        assertEquals("shadowing-variable", writer.reports().get(0).id());

        // reports are available to whoever takes the CFG first
        AnalysisRunnerImpl runner2 = new AnalysisRunnerImpl(definitionStore());
        runner2.function("shadow");
        Checkout checkout = runner2.takeFunction("shadow");
        assertEquals(1, checkout.reports().size());
        assertFalse(runner2.replaceFunction("shadow", checkout.cfg()));
        assertTrue(runner2.takeFunction("shadow").reports().isEmpty());
    }

    @DisplayName("a pass asking for the definition under analysis causes it to be lowered again")
    @Test
    public void test4() {
        List<Cfg> seen = new ArrayList<>();
        AnalysisPass recursive = (context, cfg) -> {
            Cfg again = context.function(cfg.name());
            seen.add(cfg);
            seen.add(again);
            return new ReportCollection();
        };
        AnalysisRunnerImpl runner = runner(recursive);
        CfgCache functions = runner.cache(DefinitionKind.FUNCTION);
        CachedReportWriter writer = new CachedReportWriter(MessageCategory.INFO);

        runner.analyzeFunction("shadow", writer);

        assertEquals(2, seen.size());
        assertNotSame(seen.get(0), seen.get(1));
        assertEquals(2, functions.loweringCount("shadow"));
        // the regenerated CFG does not produce its lowering reports a second time
        assertEquals(1, writer.reports().size());
        assertFalse(functions.hasPendingReports("shadow"));
        // the CFG that was analyzed is written back last, and wins
        assertSame(seen.get(0), runner.function("shadow"));
    }

    @DisplayName("the take/replace protocol reports overwrites")
    @Test
    public void test5() {
        AnalysisRunnerImpl runner = new AnalysisRunnerImpl(definitionStore());
        Checkout outer = runner.takeTemplate("Main");
        Checkout inner = runner.takeTemplate("Main");
        assertNotSame(outer.cfg(), inner.cfg());
        assertFalse(runner.replaceTemplate("Main", inner.cfg()));
        assertTrue(runner.replaceTemplate("Main", outer.cfg()));
        assertSame(outer.cfg(), runner.template("Main"));
    }

    @DisplayName("lowering reports first, then each pass in order")
    @Test
    public void test6() {
        AnalysisRunnerImpl runner = runner((context, cfg) -> info("first"), (context, cfg) -> info("second"));
        CachedReportWriter writer = new CachedReportWriter(MessageCategory.INFO);
        runner.analyzeFunctions(writer, false);

        List<String> messages = writer.reports().stream().map(Report::message).toList();
        // lib, foo, bad (lowering failure only), shadow
        assertEquals(List.of("first", "second", "first", "second",
                "Variable `y` is used before it is defined.",
                "Declaration of variable `x` shadows previous declaration.", "first", "second"), messages);

        CachedReportWriter errorsOnly = new CachedReportWriter(MessageCategory.ERROR);
        runner((context, cfg) -> info("ignored")).analyzeFunctions(errorsOnly, true);
        assertEquals(1, errorsOnly.reports().size());
        assertEquals(List.of("analyzing function 'foo'", "analyzing function 'bad'",
                "analyzing function 'shadow'"), errorsOnly.messages());
    }

    @DisplayName("a failing lookup inside a pass does not stop the analysis")
    @Test
    public void test7() {
        AnalysisPass lookup = (context, cfg) -> {
            context.function("missing");
            return info("not reached");
        };
        AnalysisRunnerImpl runner = runner(lookup, (context, cfg) -> info("reached"));
        CachedReportWriter writer = new CachedReportWriter(MessageCategory.INFO);
        runner.analyzeTemplate("Main", writer);
        assertEquals(List.of("reached"), writer.reports().stream().map(Report::message).toList());
        assertTrue(runner.cache(DefinitionKind.TEMPLATE).isCached("Main"));

        runner.analyzeTemplate("Missing", writer);
        assertEquals(1, writer.reports().size());
        assertEquals("analyzing template 'Missing'", writer.messages().get(1));
    }

    @DisplayName("other exceptions propagate, the CFG is returned to the cache")
    @Test
    public void test8() {
        AnalysisRunnerImpl runner = runner((context, cfg) -> {
            throw new UnsupportedOperationException("boom");
        });
        CachedReportWriter writer = new CachedReportWriter(MessageCategory.INFO);
        assertThrows(UnsupportedOperationException.class, () -> runner.analyzeFunction("foo", writer));
        assertTrue(runner.cache(DefinitionKind.FUNCTION).isCached("foo"));
    }

    @DisplayName("user input filter and templates")
    @Test
    public void test9() {
        List<String> analyzed = new ArrayList<>();
        AnalysisRunnerImpl runner = runner((context, cfg) -> {
            analyzed.add(cfg.kind().keyword() + " " + cfg.name());
            assertTrue(context.isFunction("lib"));
            return new ReportCollection();
        });
        assertEquals(List.of("foo", "bad", "shadow"), runner.functionNames(true));
        assertEquals(List.of("lib", "foo", "bad", "shadow"), runner.functionNames(false));
        assertEquals(List.of("Main"), runner.templateNames(true));

        CachedReportWriter writer = new CachedReportWriter(MessageCategory.INFO);
        runner.analyzeTemplates(writer, true);
        runner.analyzeFunctions(writer, true);
        assertEquals(List.of("template Main", "function foo", "function shadow"), analyzed);
    }

    @DisplayName("a custom lowering adds its own reports")
    @Test
    public void test10() {
        AnalysisRunner.Configuration configuration = new AnalysisRunnerImpl.ConfigurationBuilder()
                .setLowering((definition, curve, reports) -> {
                    reports.add(Report.info("lowered " + definition.name(), ReportCode.ANALYSIS_ERROR).build());
                    return SsaLowering.INSTANCE.lower(definition, curve, reports);
                })
                .addAnalysisPasses(List.of((context, cfg) -> info("pass")))
                .build();
        AnalysisRunnerImpl runner = new AnalysisRunnerImpl(definitionStore(), configuration);
        CachedReportWriter writer = new CachedReportWriter(MessageCategory.INFO);
        runner.analyzeFunction("lib", writer);
        assertEquals(List.of("lowered lib", "pass"), writer.reports().stream().map(Report::message).toList());
        assertSame(configuration, runner.configuration());
    }

    @Language("circom")
    private static final String NESTED = """
            function twice() {
                var z = 1;
                {
                    var z = 2;
                    {
                        var z = 3;
                    }
                }
                return z;
            }
            function shadowThenFail() {
                var w = 1;
                {
                    var w = 2;
                }
                return v;
            }
            """;

    private Statement declaration(int fileId, String name, long value) {
        return new Declaration(meta(fileId, "var " + name + " = " + value), VariableType.LOCAL, name);
    }

    private static Statement assign(int fileId, String name, long value) {
        return new Substitution(any(fileId), name, AssignOperator.ASSIGN_VARIABLE,
                new NumberExpression(any(fileId), value));
    }

    private int addNested() {
        int id = fileLibrary.addFile("nested.circom", NESTED, true);
        definitions.add(new FunctionDefinition(meta(id, "function twice"), "twice", List.of(),
                block(id,
                        declaration(id, "z", 1), assign(id, "z", 1),
                        block(id,
                                declaration(id, "z", 2), assign(id, "z", 2),
                                block(id, declaration(id, "z", 3), assign(id, "z", 3))),
                        new Return(any(id), var(id, "z")))));
        definitions.add(new FunctionDefinition(meta(id, "function shadowThenFail"), "shadowThenFail", List.of(),
                block(id,
                        declaration(id, "w", 1), assign(id, "w", 1),
                        block(id, declaration(id, "w", 2), assign(id, "w", 2)),
                        new Return(any(id), new VariableExpression(meta(id, "v;"), "v")))));
        return id;
    }

    @DisplayName("all lowering warnings in lowering order, then the pass reports")
    @Test
    public void test11() {
        int id = addNested();
        AnalysisRunnerImpl runner = runner((context, cfg) -> info("pass"));
        CachedReportWriter writer = new CachedReportWriter(MessageCategory.INFO);
        runner.analyzeFunction("twice", writer);

        assertEquals(List.of("shadowing-variable", "shadowing-variable", "analysis-error"),
                writer.reports().stream().map(Report::id).toList());
        assertEquals(meta(id, "var z = 2").location(), writer.reports().get(0).primary().get(0).location());
        assertEquals(meta(id, "var z = 3").location(), writer.reports().get(1).primary().get(0).location());
        assertEquals("pass", writer.reports().get(2).message());
    }

    @DisplayName("warnings produced before a lowering failure precede it, and are emitted once")
    @Test
    public void test12() {
        int id = addNested();
        AnalysisRunnerImpl runner = runner((context, cfg) -> info("not reached"));
        CachedReportWriter writer = new CachedReportWriter(MessageCategory.INFO);
        runner.analyzeFunction("shadowThenFail", writer);
        runner.analyzeFunction("shadowThenFail", writer);

        assertEquals(List.of("shadowing-variable", "uninitialized-symbol"),
                writer.reports().stream().map(Report::id).toList());
        assertEquals(meta(id, "v;").location(), writer.reports().get(1).primary().get(0).location());
        CfgCache functions = runner.cache(DefinitionKind.FUNCTION);
        assertTrue(functions.hasFailed("shadowThenFail"));
        assertEquals(1, functions.loweringCount("shadowThenFail"));
        assertFalse(functions.hasPendingReports("shadowThenFail"));
    }

    @DisplayName("a pass running a full analysis of the definition under analysis")
    @Test
    public void test13() {
        AtomicInteger passRuns = new AtomicInteger();
        CachedReportWriter inner = new CachedReportWriter(MessageCategory.INFO);
        AnalysisRunnerImpl[] runnerHolder = new AnalysisRunnerImpl[1];
        AnalysisPass reanalyze = (context, cfg) -> {
            if (passRuns.incrementAndGet() == 1) {
                runnerHolder[0].analyzeFunction(cfg.name(), inner);
            }
            return new ReportCollection();
        };
        AnalysisRunnerImpl runner = runner(reanalyze);
        runnerHolder[0] = runner;
        CfgCache functions = runner.cache(DefinitionKind.FUNCTION);
        CachedReportWriter outer = new CachedReportWriter(MessageCategory.INFO);

        runner.analyzeFunction("shadow", outer);

        assertEquals(2, passRuns.get());
        assertEquals(List.of("shadowing-variable"), outer.reports().stream().map(Report::id).toList());
        assertEquals(List.of("analyzing function 'shadow'"), inner.messages());
        assertTrue(inner.reports().isEmpty());
        assertTrue(functions.isCached("shadow"));
        assertEquals(2, functions.loweringCount("shadow"));
        assertFalse(functions.hasPendingReports("shadow"));
    }
}
