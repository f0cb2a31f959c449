package io.github.eutro.flowlint.ssa;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A function, encapsulating a list of {@link BasicBlock basic blocks}.
 * <p>
 * The first block is the entry block. Blocks, variables and instructions are numbered densely
 * from zero as they are created, so analyses can keep their facts in arrays.
 */
public final class Function {
    private static final AtomicInteger KEY_COUNTER = new AtomicInteger();

    /**
     * The name of the function.
     */
    public final String name;
    private final int key = KEY_COUNTER.getAndIncrement();
    private final List<BasicBlock> blocks = new ArrayList<>();
    private final List<Var> params = new ArrayList<>();
    private boolean method = false;
    private int varCount = 0;
    private int insnCount = 0;

    public Function(String name) {
        this.name = name;
    }

    /**
     * Get the key of this function, unique among all functions created in this run.
     *
     * @return The key.
     */
    public int key() {
        return key;
    }

    /**
     * Create a new variable with the given name.
     *
     * @param name The name.
     * @return The new variable.
     */
    public Var newVar(String name) {
        return new Var(this, name, varCount++);
    }

    /**
     * Creates a new basic block in this function. The first block created is the entry block.
     *
     * @return The new basic block.
     */
    public BasicBlock newBb() {
        BasicBlock bb = new BasicBlock(this, blocks.size());
        blocks.add(bb);
        return bb;
    }

    int nextInsnId() {
        return insnCount++;
    }

    void addParam(Var param, boolean receiver) {
        if (receiver) {
            if (!params.isEmpty()) throw new IllegalStateException("the receiver must be the first parameter");
            method = true;
        }
        params.add(param);
    }

    public List<BasicBlock> getBlocks() {
        return Collections.unmodifiableList(blocks);
    }

    /**
     * Get the entry block.
     *
     * @return The entry block, or null if the function has no body.
     */
    @Nullable
    public BasicBlock getEntry() {
        return blocks.isEmpty() ? null : blocks.get(0);
    }

    /**
     * Get the parameters of the function, starting with the receiver for methods.
     *
     * @return The parameters.
     */
    public List<Var> getParams() {
        return Collections.unmodifiableList(params);
    }

    public boolean isMethod() {
        return method;
    }

    /**
     * Get the receiver of a method.
     *
     * @return The receiver, or null if this is not a method.
     */
    @Nullable
    public Var getReceiver() {
        return method ? params.get(0) : null;
    }

    /**
     * Whether this function has no body, e.g. because it is declared externally.
     *
     * @return Whether it is external.
     */
    public boolean isExternal() {
        return blocks.isEmpty();
    }

    public int varCount() {
        return varCount;
    }

    public int insnCount() {
        return insnCount;
    }

    public int blockCount() {
        return blocks.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("fn ").append(name).append("() {\n");
        for (BasicBlock block : blocks) {
            sb.append(block).append('\n');
        }
        sb.append("}");
        return sb.toString();
    }
}
