package io.github.eutro.flowlint.source;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The whole program under analysis: an ordered list of compilation units.
 */
public final class Program {
    private final List<CompilationUnit> units;

    public Program(List<CompilationUnit> units) {
        this.units = Collections.unmodifiableList(new ArrayList<>(units));
    }

    public static Program of(CompilationUnit... units) {
        return new Program(Arrays.asList(units));
    }

    public List<CompilationUnit> getUnits() {
        return units;
    }

    @Override
    public String toString() {
        return "Program" + units;
    }
}
