package io.github.eutro.flowlint.lint;

import io.github.eutro.flowlint.analysis.Analysis;
import io.github.eutro.flowlint.source.CompilationUnit;
import io.github.eutro.flowlint.source.Position;
import io.github.eutro.flowlint.source.Program;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs the rules of a {@link Registry} over a {@link Program}.
 * <p>
 * Each run owns a fresh {@link Analysis}, so runs are independent of each other. Within a run, every
 * pair of rule and compilation unit is a separate task; tasks run on the calling thread, or on a
 * fixed pool of worker threads if the configuration asks for more than one.
 */
public final class Linter {
    private static final Logger LOGGER = LoggerFactory.getLogger(Linter.class);

    private final Registry registry;
    private final LintConfig config;

    public Linter(Registry registry, LintConfig config) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.config = Objects.requireNonNull(config, "config");
    }

    public Linter(Registry registry) {
        this(registry, LintConfig.defaults());
    }

    /**
     * Resolve the configured checks against the registry.
     *
     * @return The entries to run, including placeholders.
     * @throws ConfigurationException If any requested identifier is unknown.
     */
    List<Registry.Entry> resolve() {
        List<String> ids = config.getChecks().isEmpty() ? registry.ids() : config.getChecks();
        List<String> unknown = ids.stream()
                .filter(id -> !registry.contains(id))
                .collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            throw new ConfigurationException("unknown checks: " + String.join(", ", unknown));
        }
        List<Registry.Entry> entries = new ArrayList<>(ids.size());
        for (String id : ids) {
            entries.add(registry.entry(id));
        }
        return entries;
    }

    /**
     * Run the configured checks over a program.
     *
     * @param program The program.
     * @return Every diagnostic, sorted by position, ties broken by rule identifier.
     * @throws ConfigurationException If a requested check is unknown. Nothing is analysed in that case.
     * @throws CancellationException  If the calling thread is interrupted. No partial results are returned.
     */
    public List<Diagnostic> run(Program program) {
        List<Registry.Entry> entries = resolve();
        Analysis analysis = new Analysis();
        List<Callable<List<Diagnostic>>> tasks = new ArrayList<>();
        for (Registry.Entry entry : entries) {
            if (entry.rule == null) {
                LOGGER.debug("Skipping disabled check {}", entry.id);
                continue;
            }
            for (CompilationUnit unit : program.getUnits()) {
                tasks.add(() -> runTask(entry, unit, analysis));
            }
        }
        LOGGER.debug("Running {} tasks over {} units with parallelism {}",
                tasks.size(), program.getUnits().size(), config.getParallelism());

        Reporter reporter = new Reporter();
        if (config.getParallelism() <= 1 || tasks.size() <= 1) {
            for (Callable<List<Diagnostic>> task : tasks) {
                if (Thread.interrupted()) throw cancelled();
                reporter.addAll(call(task));
            }
        } else {
            ExecutorService pool = Executors.newFixedThreadPool(Math.min(config.getParallelism(), tasks.size()));
            try {
                for (Future<List<Diagnostic>> future : pool.invokeAll(tasks)) {
                    reporter.addAll(future.get());
                }
            } catch (InterruptedException e) {
                throw cancelled();
            } catch (ExecutionException e) {
                throw propagate(e.getCause());
            } finally {
                pool.shutdownNow();
            }
        }
        List<Diagnostic> diagnostics = reporter.finish();
        LOGGER.debug("Finished with {} diagnostics", diagnostics.size());
        return diagnostics;
    }

    private static List<Diagnostic> runTask(Registry.Entry entry, CompilationUnit unit, Analysis analysis) {
        Pass pass = new Pass(entry.id, entry.severity, unit, analysis);
        try (Stream<Diagnostic> stream = Objects.requireNonNull(entry.rule).check(pass)) {
            return stream.collect(Collectors.toList());
        } catch (RuntimeException | StackOverflowError e) {
            LOGGER.warn("Check {} crashed on {}", entry.id, unit.getFile(), e);
            return Collections.singletonList(new Diagnostic(
                    Position.ofFile(unit.getFile()),
                    String.format("rule %s crashed: %s", entry.id, e),
                    entry.id,
                    Severity.ERROR));
        }
    }

    private static List<Diagnostic> call(Callable<List<Diagnostic>> task) {
        try {
            return task.call();
        } catch (Exception e) {
            throw propagate(e);
        }
    }

    private static CancellationException cancelled() {
        Thread.currentThread().interrupt();
        CancellationException ce = new CancellationException("lint run interrupted");
        LOGGER.debug("Run cancelled");
        return ce;
    }

    private static RuntimeException propagate(Throwable t) {
        if (t instanceof RuntimeException) return (RuntimeException) t;
        if (t instanceof Error) throw (Error) t;
        return new IllegalStateException(t);
    }
}
