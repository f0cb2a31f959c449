package io.github.eutro.flowlint.test;

import io.github.eutro.flowlint.analysis.DomTree;
import io.github.eutro.flowlint.lint.*;
import io.github.eutro.flowlint.source.CompilationUnit;
import io.github.eutro.flowlint.source.Position;
import io.github.eutro.flowlint.source.Program;
import io.github.eutro.flowlint.ssa.Function;
import io.github.eutro.flowlint.ssa.IRBuilder;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class LinterTest {
    private static Rule reportingAt(int... lines) {
        return pass -> IntStream.of(lines).mapToObj(line -> new Diagnostic(
                Position.of(pass.getUnit().getFile(), line, 1),
                "line " + line,
                pass.getRuleId(),
                Severity.WARNING));
    }

    private static Program program(int units) {
        List<CompilationUnit> list = new ArrayList<>();
        for (int i = 0; i < units; i++) {
            list.add(CompilationUnit.builder("unit" + i + ".go").build());
        }
        return new Program(list);
    }

    @Test
    void testUnknownChecksRejected() {
        AtomicInteger runs = new AtomicInteger();
        Registry registry = new Registry()
                .register("A1", pass -> {
                    runs.incrementAndGet();
                    return Stream.empty();
                });
        Linter linter = new Linter(registry, LintConfig.builder()
                .check("A1").check("B2").check("C3")
                .build());
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> linter.run(program(1)));
        assertEquals("unknown checks: B2, C3", e.getMessage());
        assertEquals(0, runs.get());
    }

    @Test
    void testCrashIsolated() {
        Registry registry = new Registry()
                .register("X1", pass -> {
                    throw new IllegalStateException("boom");
                })
                .register("X2", reportingAt(3));
        List<Diagnostic> diagnostics = new Linter(registry).run(program(1));

        assertEquals(2, diagnostics.size());
        Diagnostic crash = diagnostics.get(0);
        assertEquals(Position.ofFile("unit0.go"), crash.getPosition());
        assertEquals(Severity.ERROR, crash.getSeverity());
        assertEquals("X1", crash.getRuleId());
        assertEquals("rule X1 crashed: java.lang.IllegalStateException: boom", crash.getMessage());
        assertEquals("X2", diagnostics.get(1).getRuleId());
        assertEquals(3, diagnostics.get(1).getPosition().getLine());
    }

    @Test
    void testCrashDiscardsPartialOutput() {
        Registry registry = new Registry()
                .register("X1", pass -> Stream.of(1, 2).map(i -> {
                    if (i == 2) throw new IllegalStateException("late");
                    return new Diagnostic(Position.of("unit0.go", 1, 1), "partial", "X1", Severity.WARNING);
                }))
                .register("X2", pass -> {
                    throw new StackOverflowError();
                });
        List<Diagnostic> diagnostics = new Linter(registry).run(program(1));

        assertEquals(2, diagnostics.size());
        for (Diagnostic diagnostic : diagnostics) {
            assertEquals(Severity.ERROR, diagnostic.getSeverity());
            assertTrue(diagnostic.getMessage().startsWith("rule " + diagnostic.getRuleId() + " crashed"));
        }
    }

    @Test
    void testPlaceholderSkipped() {
        Registry registry = new Registry()
                .register("P1", null)
                .register("A1", reportingAt(1));
        assertTrue(new Linter(registry, LintConfig.builder().check("P1").build()).run(program(2)).isEmpty());
        assertEquals(2, new Linter(registry).run(program(2)).size());
    }

    @Test
    void testSorted() {
        Registry registry = new Registry()
                .register("B1", reportingAt(9, 4, 1))
                .register("A1", reportingAt(4));
        List<Diagnostic> diagnostics = new Linter(registry).run(program(2));

        assertEquals(8, diagnostics.size());
        List<String> rendered = new ArrayList<>();
        for (Diagnostic diagnostic : diagnostics) {
            rendered.add(Reporter.format(diagnostic));
        }
        assertEquals("unit0.go:1:1: line 1 (B1)", rendered.get(0));
        assertEquals("unit0.go:4:1: line 4 (A1)", rendered.get(1));
        assertEquals("unit0.go:4:1: line 4 (B1)", rendered.get(2));
        assertEquals("unit0.go:9:1: line 9 (B1)", rendered.get(3));
        assertTrue(rendered.get(4).startsWith("unit1.go:1:1"));
    }

    @Test
    void testParallelMatchesSequential() {
        Registry registry = new Registry();
        for (int i = 0; i < 8; i++) {
            registry.register("R" + i, reportingAt(i + 1, 20 - i, 3));
        }
        Program program = program(10);
        List<Diagnostic> sequential = new Linter(registry, LintConfig.builder().parallelism(1).build()).run(program);
        List<Diagnostic> parallel = new Linter(registry, LintConfig.builder().parallelism(4).build()).run(program);
        assertEquals(8 * 10 * 3, sequential.size());
        assertEquals(sequential, parallel);
    }

    @Test
    void testAnalysisSharedWithinRun() {
        Function fn = new Function("f");
        new IRBuilder(fn).ret();
        CompilationUnit unit = CompilationUnit.builder("a.go").function(fn).build();
        List<DomTree> seen = Collections.synchronizedList(new ArrayList<>());
        Rule recordDoms = pass -> {
            for (Function function : pass.functions()) {
                seen.add(pass.analysis(function).doms());
            }
            return Stream.empty();
        };
        Registry registry = new Registry().register("D1", recordDoms).register("D2", recordDoms);
        Linter linter = new Linter(registry);

        linter.run(Program.of(unit));
        assertEquals(2, seen.size());
        assertSame(seen.get(0), seen.get(1));

        linter.run(Program.of(unit));
        assertEquals(4, seen.size());
        assertNotSame(seen.get(0), seen.get(2));
    }

    @Test
    void testInterrupted() {
        Registry registry = new Registry().register("A1", reportingAt(1));
        Linter linter = new Linter(registry);
        Thread.currentThread().interrupt();
        try {
            assertThrows(CancellationException.class, () -> linter.run(program(1)));
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }
}
