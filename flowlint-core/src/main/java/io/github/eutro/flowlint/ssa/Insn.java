package io.github.eutro.flowlint.ssa;

import io.github.eutro.flowlint.source.Node;
import io.github.eutro.flowlint.source.Operator;
import io.github.eutro.flowlint.source.Position;
import io.github.eutro.flowlint.types.Type;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An instruction.
 * <p>
 * The set of instruction kinds is closed: every kind is a nested class of this one, and
 * {@link Visitor} has a method for each, so a new kind cannot be added without every
 * visitor being revisited.
 * <p>
 * Non-terminators are placed in a block wrapped in an {@link Effect}, terminators in a {@link Control}.
 * When it is inserted, an instruction is given an {@link #id() id} unique within its function.
 */
public abstract class Insn implements Node {
    private final Position position;
    private int id = -1;
    // Effect or Control
    private Object owner = null;

    Insn(Position position) {
        this.position = Objects.requireNonNull(position, "position");
    }

    /**
     * A visitor over the kinds of instruction.
     *
     * @param <R> The result type.
     */
    public interface Visitor<R> {
        R visitConst(Const insn);

        R visitParam(Param insn);

        R visitAlloc(Alloc insn);

        R visitFieldAddr(FieldAddr insn);

        R visitLoad(Load insn);

        R visitStore(Store insn);

        R visitCall(Call insn);

        R visitBinOp(BinOp insn);

        R visitConvert(Convert insn);

        R visitPhi(Phi insn);

        R visitDebugRef(DebugRef insn);

        R visitMakeClosure(MakeClosure insn);

        R visitJump(Jump insn);

        R visitIf(If insn);

        R visitReturn(Return insn);

        R visitPanic(Panic insn);
    }

    /**
     * Apply a visitor to this instruction.
     *
     * @param visitor The visitor.
     * @param <R>     The result type.
     * @return The result of the visitor.
     */
    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * Get the operands of this instruction.
     *
     * @return The operands.
     */
    public abstract List<Var> args();

    /**
     * Whether this instruction ends a block.
     *
     * @return Whether it does.
     */
    public boolean isTerminator() {
        return false;
    }

    int targetCount() {
        return 0;
    }

    @Override
    public Position position() {
        return position;
    }

    /**
     * Get the id of this instruction, unique within its function.
     *
     * @return The id, or -1 if it has not been inserted.
     */
    public int id() {
        return id;
    }

    void register(Object owner, int id) {
        if (this.owner != null) throw new IllegalStateException("instruction already inserted: " + this);
        this.owner = owner;
        this.id = id;
    }

    /**
     * Create an effect assigning the result of this instruction to the given variables.
     *
     * @param vars The variables.
     * @return The effect.
     */
    public Effect assignTo(Var... vars) {
        return new Effect(Arrays.asList(vars), this);
    }

    /**
     * Create a control instruction jumping to the given targets.
     *
     * @param targets The targets.
     * @return The control instruction.
     */
    public Control jumpsTo(BasicBlock... targets) {
        return new Control(this, Arrays.asList(targets));
    }

    @Nullable
    public Effect getOwningEffect() {
        return owner instanceof Effect ? (Effect) owner : null;
    }

    @Nullable
    public Control getOwningControl() {
        return owner instanceof Control ? (Control) owner : null;
    }

    /**
     * Get the block containing this instruction.
     *
     * @return The block, or null if it has not been inserted.
     */
    @Nullable
    public BasicBlock block() {
        if (owner instanceof Effect) return ((Effect) owner).getBlock();
        if (owner instanceof Control) return ((Control) owner).getBlock();
        return null;
    }

    /**
     * Get the single variable this instruction's result is assigned to.
     *
     * @return The variable, or null if the result is not assigned to exactly one variable.
     */
    @Nullable
    public Var result() {
        Effect effect = getOwningEffect();
        if (effect == null || effect.getAssignsTo().size() != 1) return null;
        return effect.getAssignsTo().get(0);
    }

    abstract String mnemonic();

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(mnemonic());
        for (Var arg : args()) {
            sb.append(' ').append(arg);
        }
        return sb.toString();
    }

    private static List<Var> copy(List<Var> vars) {
        return Collections.unmodifiableList(new ArrayList<>(vars));
    }

    /**
     * Effect: returns the constant. A {@code null} value is nil.
     */
    public static final class Const extends Insn {
        @Nullable
        private final Object value;

        public Const(Position position, @Nullable Object value) {
            super(position);
            this.value = value;
        }

        @Nullable
        public Object getValue() {
            return value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConst(this);
        }

        @Override
        public List<Var> args() {
            return Collections.emptyList();
        }

        @Override
        String mnemonic() {
            return "const";
        }

        @Override
        public String toString() {
            return "const " + (value == null ? "nil" : value instanceof String ? '"' + (String) value + '"' : value);
        }
    }

    /**
     * Effect: returns the {@code index}th parameter of the function. For methods the receiver is parameter 0.
     */
    public static final class Param extends Insn {
        public final int index;
        public final String name;

        public Param(Position position, int index, String name) {
            super(position);
            this.index = index;
            this.name = name;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitParam(this);
        }

        @Override
        public List<Var> args() {
            return Collections.emptyList();
        }

        @Override
        String mnemonic() {
            return "param";
        }

        @Override
        public String toString() {
            return "param " + index + " " + name;
        }
    }

    /**
     * Effect: returns the address of a fresh local slot.
     * <p>
     * A slot whose address may outlive the function is marked {@code heap}.
     */
    public static final class Alloc extends Insn {
        public final String name;
        public final boolean heap;

        public Alloc(Position position, String name, boolean heap) {
            super(position);
            this.name = name;
            this.heap = heap;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAlloc(this);
        }

        @Override
        public List<Var> args() {
            return Collections.emptyList();
        }

        @Override
        String mnemonic() {
            return heap ? "new" : "local";
        }

        @Override
        public String toString() {
            return mnemonic() + " " + name;
        }
    }

    /**
     * Effect: returns the address of field {@code field} of the struct at address {@code base}.
     */
    public static final class FieldAddr extends Insn {
        public final Var base;
        public final int field;
        public final String fieldName;

        public FieldAddr(Position position, Var base, int field, String fieldName) {
            super(position);
            this.base = base;
            this.field = field;
            this.fieldName = fieldName;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFieldAddr(this);
        }

        @Override
        public List<Var> args() {
            return Collections.singletonList(base);
        }

        @Override
        String mnemonic() {
            return "fieldaddr";
        }

        @Override
        public String toString() {
            return "&" + base + "." + fieldName;
        }
    }

    /**
     * Effect: reads the value at an address.
     */
    public static final class Load extends Insn {
        public final Var addr;

        public Load(Position position, Var addr) {
            super(position);
            this.addr = addr;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLoad(this);
        }

        @Override
        public List<Var> args() {
            return Collections.singletonList(addr);
        }

        @Override
        String mnemonic() {
            return "load";
        }
    }

    /**
     * Effect: writes a value to an address. Returns nothing.
     */
    public static final class Store extends Insn {
        public final Var addr;
        public final Var value;

        public Store(Position position, Var addr, Var value) {
            super(position);
            this.addr = addr;
            this.value = value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStore(this);
        }

        @Override
        public List<Var> args() {
            return Arrays.asList(addr, value);
        }

        @Override
        String mnemonic() {
            return "store";
        }
    }

    /**
     * The kind of function a {@link Call} calls.
     */
    public enum CallKind {
        /**
         * A statically known function, possibly declared elsewhere.
         */
        STATIC,
        /**
         * A builtin function, such as {@code append}.
         */
        BUILTIN,
        /**
         * A function value, passed as the first argument.
         */
        DYNAMIC,
        /**
         * An interface method, invoked on the first argument.
         */
        INVOKE,
    }

    /**
     * Effect: calls a function, returning its result.
     * <p>
     * For methods, the receiver is the first argument.
     */
    public static final class Call extends Insn {
        public final CallKind kind;
        public final String name;
        @Nullable
        public final Function target;
        private final List<Var> args;
        public final boolean deferred;

        public Call(Position position, CallKind kind, String name, @Nullable Function target,
                    List<Var> args, boolean deferred) {
            super(position);
            if (kind != CallKind.STATIC && target != null) {
                throw new IllegalArgumentException("only static calls have a target function");
            }
            if ((kind == CallKind.DYNAMIC || kind == CallKind.INVOKE) && args.isEmpty()) {
                throw new IllegalArgumentException(kind + " call needs a callee argument");
            }
            this.kind = kind;
            this.name = Objects.requireNonNull(name, "name");
            this.target = target;
            this.args = copy(args);
            this.deferred = deferred;
        }

        /**
         * Whether this is a direct call of the builtin with the given name.
         *
         * @param builtin The builtin name.
         * @return Whether it is.
         */
        public boolean isBuiltin(String builtin) {
            return kind == CallKind.BUILTIN && name.equals(builtin);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCall(this);
        }

        @Override
        public List<Var> args() {
            return args;
        }

        @Override
        String mnemonic() {
            return (deferred ? "defer " : "") + "call " + name;
        }
    }

    /**
     * Effect: applies a binary operator.
     */
    public static final class BinOp extends Insn {
        public final Operator op;
        public final Var x;
        public final Var y;

        public BinOp(Position position, Operator op, Var x, Var y) {
            super(position);
            if (op == Operator.LAND || op == Operator.LOR) {
                throw new IllegalArgumentException("short-circuit operators are control flow: " + op);
            }
            this.op = op;
            this.x = x;
            this.y = y;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinOp(this);
        }

        @Override
        public List<Var> args() {
            return Arrays.asList(x, y);
        }

        @Override
        String mnemonic() {
            return op.token;
        }

        @Override
        public String toString() {
            return x + " " + op + " " + y;
        }
    }

    /**
     * Effect: converts a value to another type.
     */
    public static final class Convert extends Insn {
        public final Var x;
        @Nullable
        public final Type type;

        public Convert(Position position, Var x, @Nullable Type type) {
            super(position);
            this.x = x;
            this.type = type;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConvert(this);
        }

        @Override
        public List<Var> args() {
            return Collections.singletonList(x);
        }

        @Override
        String mnemonic() {
            return "convert" + (type == null ? "" : " " + type);
        }
    }

    /**
     * Effect: returns the value corresponding to the predecessor control came from.
     * <p>
     * Must precede any other (non-phi) effect instructions within its basic block.
     * Edges may be added after the phi is inserted, since loop back edges refer to values
     * defined later.
     */
    public static final class Phi extends Insn {
        private final List<BasicBlock> preds = new ArrayList<>();
        private final List<Var> values = new ArrayList<>();

        public Phi(Position position) {
            super(position);
        }

        /**
         * Add an incoming edge.
         *
         * @param pred  The predecessor block.
         * @param value The value when coming from {@code pred}.
         * @return This phi.
         */
        public Phi addEdge(BasicBlock pred, Var value) {
            preds.add(pred);
            values.add(value);
            return this;
        }

        public List<BasicBlock> getPreds() {
            return Collections.unmodifiableList(preds);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPhi(this);
        }

        @Override
        public List<Var> args() {
            return Collections.unmodifiableList(values);
        }

        @Override
        String mnemonic() {
            return "phi";
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("phi");
            for (int i = 0; i < preds.size(); i++) {
                sb.append(' ').append(preds.get(i).toTargetString()).append(':').append(values.get(i));
            }
            return sb.toString();
        }
    }

    /**
     * Effect: attaches debug information to a value. Not a real use of the value.
     */
    public static final class DebugRef extends Insn {
        public final Var x;

        public DebugRef(Position position, Var x) {
            super(position);
            this.x = x;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDebugRef(this);
        }

        @Override
        public List<Var> args() {
            return Collections.singletonList(x);
        }

        @Override
        String mnemonic() {
            return "debugref";
        }
    }

    /**
     * Effect: creates a closure of {@code fn}, capturing {@code bindings}.
     */
    public static final class MakeClosure extends Insn {
        public final Function fn;
        private final List<Var> bindings;

        public MakeClosure(Position position, Function fn, List<Var> bindings) {
            super(position);
            this.fn = fn;
            this.bindings = copy(bindings);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMakeClosure(this);
        }

        @Override
        public List<Var> args() {
            return bindings;
        }

        @Override
        String mnemonic() {
            return "closure " + fn.name;
        }
    }

    /**
     * Control: an unconditional jump.
     */
    public static final class Jump extends Insn {
        public Jump(Position position) {
            super(position);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitJump(this);
        }

        @Override
        public List<Var> args() {
            return Collections.emptyList();
        }

        @Override
        public boolean isTerminator() {
            return true;
        }

        @Override
        int targetCount() {
            return 1;
        }

        @Override
        String mnemonic() {
            return "jump";
        }
    }

    /**
     * Control: a conditional branch, to the first target if the condition is true and the second otherwise.
     */
    public static final class If extends Insn {
        public final Var cond;

        public If(Position position, Var cond) {
            super(position);
            this.cond = cond;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIf(this);
        }

        @Override
        public List<Var> args() {
            return Collections.singletonList(cond);
        }

        @Override
        public boolean isTerminator() {
            return true;
        }

        @Override
        int targetCount() {
            return 2;
        }

        @Override
        String mnemonic() {
            return "if";
        }
    }

    /**
     * Control: returns from the function.
     */
    public static final class Return extends Insn {
        private final List<Var> results;

        public Return(Position position, List<Var> results) {
            super(position);
            this.results = copy(results);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitReturn(this);
        }

        @Override
        public List<Var> args() {
            return results;
        }

        @Override
        public boolean isTerminator() {
            return true;
        }

        @Override
        String mnemonic() {
            return "return";
        }

        @Override
        public String toString() {
            return results.isEmpty() ? "return" : results.stream()
                    .map(Objects::toString)
                    .collect(Collectors.joining(", ", "return ", ""));
        }
    }

    /**
     * Control: aborts the function with a value, never returning normally.
     */
    public static final class Panic extends Insn {
        public final Var value;

        public Panic(Position position, Var value) {
            super(position);
            this.value = value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPanic(this);
        }

        @Override
        public List<Var> args() {
            return Collections.singletonList(value);
        }

        @Override
        public boolean isTerminator() {
            return true;
        }

        @Override
        String mnemonic() {
            return "panic";
        }
    }
}
