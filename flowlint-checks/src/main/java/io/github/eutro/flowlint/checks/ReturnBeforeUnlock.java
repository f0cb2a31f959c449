package io.github.eutro.flowlint.checks;

import io.github.eutro.flowlint.analysis.Reachability;
import io.github.eutro.flowlint.lint.Diagnostic;
import io.github.eutro.flowlint.lint.Pass;
import io.github.eutro.flowlint.lint.Rule;
import io.github.eutro.flowlint.ssa.BasicBlock;
import io.github.eutro.flowlint.ssa.Control;
import io.github.eutro.flowlint.ssa.Function;
import io.github.eutro.flowlint.ssa.Insn;
import io.github.eutro.flowlint.ssa.Var;
import io.github.eutro.flowlint.util.GraphWalker;
import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.stream.Stream;

/**
 * Flags returns reachable from a {@code Lock} call without passing any matching {@code Unlock}.
 * <p>
 * Only locks the function unlocks somewhere are considered. A lock with a deferred unlock is
 * released on every return, and a deferred call of an unknown function value might unlock anything,
 * so both are left alone. Mutexes are matched by the local slot they live in and the fields
 * leading to them.
 */
public final class ReturnBeforeUnlock implements Rule {
    public static final ReturnBeforeUnlock INSTANCE = new ReturnBeforeUnlock();

    private static final Map<String, String> UNLOCKS;

    static {
        Map<String, String> unlocks = new HashMap<>();
        unlocks.put("Lock", "Unlock");
        unlocks.put("RLock", "RUnlock");
        UNLOCKS = Collections.unmodifiableMap(unlocks);
    }

    private ReturnBeforeUnlock() {
    }

    @Override
    public Stream<Diagnostic> check(Pass pass) {
        return pass.functions().stream().flatMap(fn -> checkFunc(pass, fn).stream());
    }

    private static List<Diagnostic> checkFunc(Pass pass, Function fn) {
        List<BasicBlock> blocks = GraphWalker.blockWalker(fn).preOrder();
        List<Insn.Call> locks = new ArrayList<>();
        List<Insn.Call> unlocks = new ArrayList<>();
        Set<String> deferred = new HashSet<>();
        List<Insn.Return> returns = new ArrayList<>();
        for (BasicBlock block : blocks) {
            for (Insn insn : block.insns()) {
                if (!(insn instanceof Insn.Call)) continue;
                Insn.Call call = (Insn.Call) insn;
                if (call.deferred) {
                    if (call.kind == Insn.CallKind.DYNAMIC) return Collections.emptyList();
                    String key = lockKey(call);
                    if (key != null && UNLOCKS.containsValue(method(call))) deferred.add(method(call) + key);
                    continue;
                }
                if (lockKey(call) == null) continue;
                if (UNLOCKS.containsKey(method(call))) locks.add(call);
                else if (UNLOCKS.containsValue(method(call))) unlocks.add(call);
            }
            Control control = block.getControl();
            if (control != null && control.insn() instanceof Insn.Return) {
                returns.add((Insn.Return) control.insn());
            }
        }

        List<Diagnostic> diagnostics = new ArrayList<>();
        Set<Insn> reported = new HashSet<>();
        for (Insn.Call lock : locks) {
            String key = lockKey(lock);
            String unlockMethod = UNLOCKS.get(method(lock));
            if (deferred.contains(unlockMethod + key)) continue;
            BasicBlock lockBlock = Objects.requireNonNull(lock.block());
            List<BasicBlock> avoiding = new ArrayList<>();
            boolean matched = false;
            boolean releasedInBlock = false;
            for (Insn.Call unlock : unlocks) {
                if (!unlockMethod.equals(method(unlock)) || !Objects.equals(key, lockKey(unlock))) continue;
                matched = true;
                BasicBlock unlockBlock = Objects.requireNonNull(unlock.block());
                if (unlockBlock != lockBlock) {
                    avoiding.add(unlockBlock);
                } else if (unlock.id() > lock.id()) {
                    releasedInBlock = true;
                }
            }
            if (!matched || releasedInBlock) continue;
            for (Insn.Return ret : returns) {
                if (Reachability.reachable(lockBlock, ret, avoiding) && reported.add(ret)) {
                    diagnostics.add(pass.report(ret, "return before mutex unlock"));
                }
            }
        }
        return diagnostics;
    }

    private static String method(Insn.Call call) {
        return call.name.substring(call.name.lastIndexOf('.') + 1);
    }

    /**
     * Identify the mutex a method call is made on, by its local slot and the fields leading to it.
     *
     * @return The key, or null if the call is not a method call on a traceable mutex.
     */
    @Nullable
    private static String lockKey(Insn.Call call) {
        if (call.kind != Insn.CallKind.STATIC && call.kind != Insn.CallKind.INVOKE || call.args().isEmpty()) {
            return null;
        }
        Deque<Integer> fields = new ArrayDeque<>();
        Var var = call.args().get(0);
        Insn def = var.definition();
        while (def instanceof Insn.FieldAddr) {
            fields.push(((Insn.FieldAddr) def).field);
            var = ((Insn.FieldAddr) def).base;
            def = var.definition();
        }
        if (def == null) return null;
        StringBuilder sb = new StringBuilder("@").append(var.index);
        for (int field : fields) {
            sb.append('.').append(field);
        }
        return sb.toString();
    }
}
