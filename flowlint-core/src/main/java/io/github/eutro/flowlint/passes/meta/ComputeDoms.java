package io.github.eutro.flowlint.passes.meta;

import io.github.eutro.flowlint.analysis.DomTree;
import io.github.eutro.flowlint.analysis.FunctionAnalysis;
import io.github.eutro.flowlint.ext.AnalysisExts;
import io.github.eutro.flowlint.passes.InPlaceIRPass;
import io.github.eutro.flowlint.ssa.BasicBlock;
import io.github.eutro.flowlint.ssa.Function;

import java.util.ArrayList;
import java.util.List;

/*
 Thomas Lengauer and Robert Endre Tarjan. A fast algorithm for finding dominators in a flow-graph.
 ACM Transactions on Programming Languages and Systems, 1(1):121-141, July 1979.
*/

/**
 * Computes {@link AnalysisExts#DOMS} for a function.
 * <p>
 * The blocks of the function are left in place; vertex {@code i + 1} is the block with index {@code i},
 * and vertex {@code 0} is the null vertex. Blocks never reached by the depth-first search are
 * left out of the tree.
 */
public final class ComputeDoms implements InPlaceIRPass<FunctionAnalysis> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeDoms INSTANCE = new ComputeDoms();

    private ComputeDoms() {
    }

    @Override
    public void runInPlace(FunctionAnalysis fa) {
        fa.attachExt(AnalysisExts.DOMS, new Runner(fa.function).run());
    }

    private static final class Runner {
        final Function func;
        final int size;
        int n;
        final int[][] succ;
        final int[] dom;
        final int[] parent;
        final int[] ancestor;
        final int[] child;
        final int[] vertex;
        final int[] label;
        final int[] semi;
        final int[] sizes;
        final List<List<Integer>> pred;
        final List<List<Integer>> bucket;
        final int[] scratch;

        Runner(Function func) {
            this.func = func;
            size = func.blockCount();
            succ = new int[size + 1][];
            dom = new int[size + 1];
            parent = new int[size + 1];
            ancestor = new int[size + 1];
            child = new int[size + 1];
            vertex = new int[size + 1];
            label = new int[size + 1];
            semi = new int[size + 1];
            sizes = new int[size + 1];
            scratch = new int[size + 1];
            pred = new ArrayList<>(size + 1);
            bucket = new ArrayList<>(size + 1);
            for (int v = 0; v <= size; v++) {
                pred.add(new ArrayList<>());
                bucket.add(new ArrayList<>());
            }
        }

        void visit(int v) {
            semi[v] = ++n;
            vertex[n] = label[v] = v;
            ancestor[v] = child[v] = 0;
            sizes[v] = 1;
        }

        void dfs(int root) {
            int[] edge = new int[size + 1];
            int[] stack = new int[size + 1];
            int sp = 0;
            visit(root);
            stack[sp++] = root;
            while (sp > 0) {
                int v = stack[sp - 1];
                if (edge[v] < succ[v].length) {
                    int w = succ[v][edge[v]++];
                    if (semi[w] == 0) {
                        parent[w] = v;
                        visit(w);
                        stack[sp++] = w;
                    }
                    if (!pred.get(w).contains(v)) pred.get(w).add(v);
                } else {
                    sp--;
                }
            }
        }

        void compress(int v) {
            int sp = 0;
            while (ancestor[ancestor[v]] != 0) {
                scratch[sp++] = v;
                v = ancestor[v];
            }
            while (sp > 0) {
                v = scratch[--sp];
                if (semi[label[ancestor[v]]] < semi[label[v]]) {
                    label[v] = label[ancestor[v]];
                }
                ancestor[v] = ancestor[ancestor[v]];
            }
        }

        int eval(int v) {
            if (ancestor[v] == 0) {
                return label[v];
            } else {
                compress(v);
                return semi[label[ancestor[v]]] >= semi[label[v]]
                        ? label[v]
                        : label[ancestor[v]];
            }
        }

        void link(int v, int w) {
            int s = w;
            while (semi[label[w]] < semi[label[child[s]]]) {
                if (sizes[s] + sizes[child[child[s]]] >= 2 * sizes[child[s]]) {
                    ancestor[child[s]] = s;
                    child[s] = child[child[s]];
                } else {
                    sizes[child[s]] = sizes[s];
                    s = ancestor[s] = child[s];
                }
            }
            label[s] = label[w];
            sizes[v] += sizes[w];
            if (sizes[v] < 2 * sizes[w]) {
                int t = s;
                s = child[v];
                child[v] = t;
            }
            while (s != 0) {
                ancestor[s] = v;
                s = child[s];
            }
        }

        DomTree run() {
            int[] idom = new int[size];
            if (size == 0) return new DomTree(func, idom);

            List<BasicBlock> blocks = func.getBlocks();
            for (int i = 0; i < size; i++) {
                List<BasicBlock> targets = blocks.get(i).successors();
                int[] s = new int[targets.size()];
                for (int j = 0; j < s.length; j++) {
                    s[j] = targets.get(j).index() + 1;
                }
                succ[i + 1] = s;
            }

            n = 0;
            dfs(1);
            sizes[0] = label[0] = semi[0] = 0;
            for (int i = n; i >= 2; i--) {
                int w = vertex[i];
                for (int v : pred.get(w)) {
                    int u = eval(v);
                    if (semi[u] < semi[w]) {
                        semi[w] = semi[u];
                    }
                }
                bucket.get(vertex[semi[w]]).add(w);
                link(parent[w], w);
                for (int v : bucket.get(parent[w])) {
                    int u = eval(v);
                    dom[v] = semi[u] < semi[v] ? u : parent[w];
                }
                bucket.get(parent[w]).clear();
            }
            for (int i = 2; i <= n; ++i) {
                int w = vertex[i];
                if (dom[w] != vertex[semi[w]]) {
                    dom[w] = dom[dom[w]];
                }
            }
            dom[1] = 0;

            for (int v = 1; v <= size; v++) {
                if (v == 1) {
                    idom[0] = -1;
                } else if (semi[v] == 0) {
                    idom[v - 1] = -2;
                } else {
                    idom[v - 1] = dom[v] - 1;
                }
            }
            return new DomTree(func, idom);
        }
    }
}
