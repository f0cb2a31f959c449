package io.github.eutro.flowlint.analysis;

import io.github.eutro.flowlint.ssa.BasicBlock;
import io.github.eutro.flowlint.ssa.Insn;
import io.github.eutro.flowlint.ssa.Var;

import java.util.*;

/**
 * The locations known to hold the receiver of a method, and whether any of them escapes.
 * <p>
 * The receiver value is the seed. A store of an alias into a local slot makes that slot an alias, and
 * the field addresses of an alias slot are its fields. Any other use of an alias slot or of one of its
 * field addresses, such as passing it to a call, capturing it in a closure, storing it into anything
 * but a local slot, merging it in a phi or putting it on the heap, marks the whole set escaped: reads
 * through such a reference cannot be enumerated locally.
 */
public final class ReceiverAliases {
    private final Var receiver;
    private final Set<Var> slots = new LinkedHashSet<>();
    private final Set<Var> fieldAddrs = new LinkedHashSet<>();
    private boolean escaped = false;

    private ReceiverAliases(Var receiver) {
        this.receiver = receiver;
    }

    /**
     * Trace the aliases of the receiver of a method.
     *
     * @param fa The analysis of the method.
     * @return The aliases.
     * @throws IllegalArgumentException If the function is not a method.
     */
    public static ReceiverAliases trace(FunctionAnalysis fa) {
        Var receiver = fa.function.getReceiver();
        if (receiver == null) throw new IllegalArgumentException(fa.function.name + " is not a method");
        ReceiverAliases aliases = new ReceiverAliases(receiver);
        aliases.trace(fa.uses());
        return aliases;
    }

    private void trace(DefUse uses) {
        Deque<Var> worklist = new ArrayDeque<>();
        for (Insn use : uses.uses(receiver)) {
            if (use instanceof Insn.Store && ((Insn.Store) use).value == receiver) {
                addSlot(((Insn.Store) use).addr, worklist);
            }
        }
        while (!worklist.isEmpty() && !escaped) {
            Var slot = worklist.pop();
            for (Insn use : uses.uses(slot)) {
                if (use instanceof Insn.Load && ((Insn.Load) use).addr == slot) continue;
                if (use instanceof Insn.Store) {
                    Insn.Store store = (Insn.Store) use;
                    if (store.value != slot) continue; // a write into the slot
                    if (store.addr == slot || !isLocalSlot(store.addr)) {
                        escaped = true;
                        break;
                    }
                    addSlot(store.addr, worklist);
                    continue;
                }
                if (use instanceof Insn.FieldAddr && ((Insn.FieldAddr) use).base == slot) {
                    Var field = use.result();
                    if (field != null && fieldAddrs.add(field)) checkField(field, uses);
                    continue;
                }
                escaped = true;
                break;
            }
        }
    }

    private void checkField(Var field, DefUse uses) {
        for (Insn use : uses.uses(field)) {
            if (use instanceof Insn.Load && ((Insn.Load) use).addr == field) continue;
            if (use instanceof Insn.Store && ((Insn.Store) use).addr == field
                    && ((Insn.Store) use).value != field) continue;
            escaped = true;
            return;
        }
    }

    private void addSlot(Var slot, Deque<Var> worklist) {
        if (!isLocalSlot(slot)) {
            escaped = true;
            return;
        }
        if (slots.add(slot)) worklist.push(slot);
    }

    private static boolean isLocalSlot(Var var) {
        Insn def = var.definition();
        return def instanceof Insn.Alloc && !((Insn.Alloc) def).heap;
    }

    public Var getReceiver() {
        return receiver;
    }

    /**
     * Get the local slots holding the receiver.
     *
     * @return The slots.
     */
    public Set<Var> slots() {
        return Collections.unmodifiableSet(slots);
    }

    /**
     * Whether the address is a field of the receiver.
     *
     * @param addr The address.
     * @return Whether it is.
     */
    public boolean isField(Var addr) {
        return fieldAddrs.contains(addr);
    }

    /**
     * Whether the address is one of the slots holding the whole receiver.
     *
     * @param addr The address.
     * @return Whether it is.
     */
    public boolean isSlot(Var addr) {
        return slots.contains(addr);
    }

    /**
     * Whether a reference to the receiver may have escaped.
     *
     * @return Whether it escaped.
     */
    public boolean isEscaped() {
        return escaped;
    }

    /**
     * Get the stores into fields of the receiver.
     *
     * @param uses The def-use chains of the method.
     * @return The stores into fields of the receiver, in block order.
     */
    public List<Insn.Store> fieldStores(DefUse uses) {
        List<Insn.Store> stores = new ArrayList<>();
        for (Var field : fieldAddrs) {
            stores.addAll(uses.storesTo(field));
        }
        stores.sort(Comparator.comparingInt((Insn.Store s) -> blockIndex(s.block())).thenComparingInt(Insn::id));
        return stores;
    }

    private static int blockIndex(BasicBlock block) {
        return block == null ? -1 : block.index();
    }

    @Override
    public String toString() {
        return "ReceiverAliases(" + receiver + ", slots=" + slots + ", escaped=" + escaped + ")";
    }
}
