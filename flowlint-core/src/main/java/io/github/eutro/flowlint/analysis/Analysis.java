package io.github.eutro.flowlint.analysis;

import io.github.eutro.flowlint.ssa.Function;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The state of one analysis request: a {@link FunctionAnalysis} per function, created on demand.
 * <p>
 * Nothing is shared between requests, so two runs over the same program are independent.
 */
public final class Analysis {
    private final Map<Integer, FunctionAnalysis> functions = new ConcurrentHashMap<>();

    /**
     * Get the analysis of a function.
     *
     * @param function The function, which must have a body.
     * @return The analysis, the same for every call with this function in this request.
     */
    public FunctionAnalysis of(Function function) {
        FunctionAnalysis fa = functions.computeIfAbsent(function.key(), $ -> new FunctionAnalysis(function));
        if (fa.function != function) {
            throw new IllegalStateException("two functions share the key " + function.key());
        }
        return fa;
    }

    /**
     * Get the number of functions analysed so far.
     *
     * @return The number of functions.
     */
    public int size() {
        return functions.size();
    }
}
