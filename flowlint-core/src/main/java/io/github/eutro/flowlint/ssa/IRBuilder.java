package io.github.eutro.flowlint.ssa;

import io.github.eutro.flowlint.source.Operator;
import io.github.eutro.flowlint.source.Position;
import io.github.eutro.flowlint.types.Type;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Collections;

/**
 * An IR, or instruction, builder, which encapsulates a position in a function
 * where instructions are being inserted, and the source position they are given.
 */
public class IRBuilder {
    /**
     * The function being inserted into.
     */
    public final Function func;
    private BasicBlock bb;
    private Position position = Position.NONE;

    /**
     * Construct an instruction builder, inserting into
     * a specific basic block.
     *
     * @param func The function.
     * @param bb   One of the function's basic blocks.
     */
    public IRBuilder(Function func, BasicBlock bb) {
        this.func = func;
        this.bb = bb;
    }

    /**
     * Construct an instruction builder inserting into a new entry block of an empty function.
     *
     * @param func The function.
     */
    public IRBuilder(Function func) {
        this(func, newEntry(func));
    }

    private static BasicBlock newEntry(Function func) {
        if (!func.getBlocks().isEmpty()) throw new IllegalArgumentException(func.name + " already has blocks");
        return func.newBb();
    }

    /**
     * Get the block this builder is inserting at the end of.
     *
     * @return The block.
     */
    public BasicBlock getBlock() {
        return bb;
    }

    /**
     * Set the block this builder should insert at the end of.
     *
     * @param bb The block.
     * @return This builder.
     */
    public IRBuilder setBlock(BasicBlock bb) {
        if (bb.getFunction() != func) throw new IllegalArgumentException("block of another function");
        this.bb = bb;
        return this;
    }

    /**
     * Set the source position given to the next instructions.
     *
     * @param position The position.
     * @return This builder.
     */
    public IRBuilder at(Position position) {
        this.position = position;
        return this;
    }

    public Position getPosition() {
        return position;
    }

    /**
     * Insert an effect at the end of the block.
     *
     * @param effect The effect.
     */
    public void insert(Effect effect) {
        bb.addEffect(effect);
    }

    /**
     * Insert an instruction whose result is not used.
     *
     * @param insn The instruction.
     * @param <T>  The type of the instruction.
     * @return The same instruction.
     */
    public <T extends Insn> T insert(T insn) {
        insert(insn.assignTo());
        return insn;
    }

    /**
     * Assign the result of the instruction to a variable,
     * and insert the effect.
     *
     * @param insn The instruction.
     * @param v    The variable.
     * @return The same variable.
     */
    public Var insert(Insn insn, Var v) {
        insert(insn.assignTo(v));
        return v;
    }

    /**
     * Assign the result of the instruction to a new variable,
     * and insert the effect.
     *
     * @param insn The instruction.
     * @param name The name of variable.
     * @return The assigned variable.
     */
    public Var insert(Insn insn, String name) {
        return insert(insn, func.newVar(name));
    }

    /**
     * Insert a control instruction at the end of the current block.
     *
     * @param ctrl The instruction to insert.
     */
    public void insertCtrl(Control ctrl) {
        bb.setControl(ctrl);
    }

    public Var constant(@Nullable Object value) {
        return insert(new Insn.Const(position, value), "k");
    }

    public Var param(String name) {
        Var var = insert(new Insn.Param(position, func.getParams().size(), name), name);
        func.addParam(var, false);
        return var;
    }

    public Var receiver(String name) {
        Var var = insert(new Insn.Param(position, 0, name), name);
        func.addParam(var, true);
        return var;
    }

    public Var alloc(String name) {
        return insert(new Insn.Alloc(position, name, false), name);
    }

    public Var heapAlloc(String name) {
        return insert(new Insn.Alloc(position, name, true), name);
    }

    public Var fieldAddr(Var base, int field, String fieldName) {
        return insert(new Insn.FieldAddr(position, base, field, fieldName), "f");
    }

    public Var load(Var addr) {
        return insert(new Insn.Load(position, addr), "t");
    }

    public Insn.Store store(Var addr, Var value) {
        return insert(new Insn.Store(position, addr, value));
    }

    public Var call(Function target, Var... args) {
        return insert(new Insn.Call(position, Insn.CallKind.STATIC, target.name, target,
                Arrays.asList(args), false), "t");
    }

    public Var callExternal(String name, Var... args) {
        return insert(new Insn.Call(position, Insn.CallKind.STATIC, name, null,
                Arrays.asList(args), false), "t");
    }

    public Var builtin(String name, Var... args) {
        return insert(new Insn.Call(position, Insn.CallKind.BUILTIN, name, null,
                Arrays.asList(args), false), "t");
    }

    public Var invoke(String method, Var receiver, Var... args) {
        Var[] all = new Var[args.length + 1];
        all[0] = receiver;
        System.arraycopy(args, 0, all, 1, args.length);
        return insert(new Insn.Call(position, Insn.CallKind.INVOKE, method, null,
                Arrays.asList(all), false), "t");
    }

    public Insn.Call defer(Insn.CallKind kind, String name, Var... args) {
        return insert(new Insn.Call(position, kind, name, null, Arrays.asList(args), true));
    }

    public Var binOp(Operator op, Var x, Var y) {
        return insert(new Insn.BinOp(position, op, x, y), "t");
    }

    public Var convert(Var x, @Nullable Type type) {
        return insert(new Insn.Convert(position, x, type), "t");
    }

    /**
     * Insert a phi with no edges yet. Add edges with {@link Insn.Phi#addEdge(BasicBlock, Var)}.
     *
     * @param name The name of the merged variable.
     * @return The phi instruction.
     */
    public Insn.Phi phi(String name) {
        Insn.Phi phi = new Insn.Phi(position);
        insert(phi, name);
        return phi;
    }

    public Insn.DebugRef debugRef(Var x) {
        return insert(new Insn.DebugRef(position, x));
    }

    public Var makeClosure(Function fn, Var... bindings) {
        return insert(new Insn.MakeClosure(position, fn, Arrays.asList(bindings)), "closure");
    }

    public Insn.Jump jump(BasicBlock target) {
        Insn.Jump insn = new Insn.Jump(position);
        insertCtrl(insn.jumpsTo(target));
        return insn;
    }

    public Insn.If branch(Var cond, BasicBlock ifTrue, BasicBlock ifFalse) {
        Insn.If insn = new Insn.If(position, cond);
        insertCtrl(insn.jumpsTo(ifTrue, ifFalse));
        return insn;
    }

    public Insn.Return ret(Var... results) {
        Insn.Return insn = new Insn.Return(position, results.length == 0
                ? Collections.emptyList()
                : Arrays.asList(results));
        insertCtrl(insn.jumpsTo());
        return insn;
    }

    public Insn.Panic panic(Var value) {
        Insn.Panic insn = new Insn.Panic(position, value);
        insertCtrl(insn.jumpsTo());
        return insn;
    }
}
