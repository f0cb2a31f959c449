package io.github.eutro.flowlint.analysis;

import io.github.eutro.flowlint.ssa.BasicBlock;
import io.github.eutro.flowlint.ssa.Function;
import io.github.eutro.flowlint.ssa.Insn;
import io.github.eutro.flowlint.ssa.Var;

import java.util.*;
import java.util.function.Predicate;

/**
 * The def-use chains of a function: for each variable, the instructions that read it.
 */
public final class DefUse {
    private final Function function;
    private final List<List<Insn>> uses;

    /**
     * Construct def-use chains.
     *
     * @param function The function.
     * @param uses     The users of each variable, indexed by {@link Var#index}, in block order.
     */
    public DefUse(Function function, List<List<Insn>> uses) {
        this.function = function;
        List<List<Insn>> copy = new ArrayList<>(uses.size());
        for (List<Insn> use : uses) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(use)));
        }
        this.uses = Collections.unmodifiableList(copy);
    }

    private int check(Var var) {
        if (var.getFunction() != function) {
            throw new IllegalArgumentException(var + " is not a variable of " + function.name);
        }
        return var.index;
    }

    /**
     * Get every instruction that reads a variable. An instruction reading the variable more than once
     * is listed once.
     *
     * @param var The variable.
     * @return The users.
     */
    public List<Insn> uses(Var var) {
        return uses.get(check(var));
    }

    /**
     * Get the instructions that read a variable for its value: everything but debug references, and
     * the instruction defining the variable itself (a phi in a loop may read its own result).
     *
     * @param var The variable.
     * @return The real users.
     */
    public List<Insn> realUses(Var var) {
        Insn def = var.definition();
        List<Insn> real = new ArrayList<>();
        for (Insn use : uses(var)) {
            if (use instanceof Insn.DebugRef || use == def) continue;
            real.add(use);
        }
        return real;
    }

    /**
     * Get the loads through an address.
     *
     * @param addr The address.
     * @return The loads reading from {@code addr}.
     */
    public List<Insn.Load> loadsFrom(Var addr) {
        List<Insn.Load> loads = new ArrayList<>();
        for (Insn use : uses(addr)) {
            if (use instanceof Insn.Load && ((Insn.Load) use).addr == addr) {
                loads.add((Insn.Load) use);
            }
        }
        return loads;
    }

    /**
     * Get the stores through an address. Stores of the address itself as a value are not included.
     *
     * @param addr The address.
     * @return The stores writing to {@code addr}.
     */
    public List<Insn.Store> storesTo(Var addr) {
        List<Insn.Store> stores = new ArrayList<>();
        for (Insn use : uses(addr)) {
            if (use instanceof Insn.Store && ((Insn.Store) use).addr == addr) {
                stores.add((Insn.Store) use);
            }
        }
        return stores;
    }

    /**
     * Whether any instruction accepted by {@code isRead} lies in a block reachable from the block of
     * {@code write}, including that block itself.
     * <p>
     * Every instruction of each block visited is offered to the predicate, so it is up to the
     * predicate to reject instructions that come before the write, typically by position.
     *
     * @param write  The write.
     * @param isRead Whether an instruction reads what was written.
     * @return Whether some read is reachable.
     */
    public boolean reachesRead(Insn write, Predicate<Insn> isRead) {
        BasicBlock start = write.block();
        if (start == null) throw new IllegalArgumentException(write + " is not inserted");
        if (start.getFunction() != function) {
            throw new IllegalArgumentException(write + " is not an instruction of " + function.name);
        }
        BitSet seen = new BitSet(function.blockCount());
        Deque<BasicBlock> stack = new ArrayDeque<>();
        stack.push(start);
        seen.set(start.index());
        while (!stack.isEmpty()) {
            BasicBlock block = stack.pop();
            for (Insn insn : block.insns()) {
                if (isRead.test(insn)) return true;
            }
            for (BasicBlock succ : block.successors()) {
                if (!seen.get(succ.index())) {
                    seen.set(succ.index());
                    stack.push(succ);
                }
            }
        }
        return false;
    }

    public Function getFunction() {
        return function;
    }
}
