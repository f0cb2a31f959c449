package io.github.eutro.flowlint.analysis;

import io.github.eutro.flowlint.source.Operator;
import io.github.eutro.flowlint.ssa.Insn;
import io.github.eutro.flowlint.ssa.Var;
import org.jetbrains.annotations.Nullable;

import java.math.BigInteger;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Resolves variables to the set of constants they may hold.
 * <p>
 * Constants are kept normalized: integral numbers as {@link Long} (or {@link BigInteger} beyond its range),
 * floating point numbers as {@link Double}, and nil as {@link #NULL_SENTINEL}.
 */
public final class Constants {
    /**
     * An object that is a sentinel for nil in constant sets.
     */
    public static final Object NULL_SENTINEL = new Object() {
        @Override
        public String toString() {
            return "nil";
        }
    };

    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private Constants() {
    }

    /**
     * If {@code obj} is null, return {@link #NULL_SENTINEL}, otherwise {@code obj}.
     *
     * @param obj The object.
     * @return {@code obj}, or {@link #NULL_SENTINEL} if it is null.
     */
    public static Object fillNull(@Nullable Object obj) {
        return obj == null ? NULL_SENTINEL : obj;
    }

    /**
     * If {@code obj} is {@link #NULL_SENTINEL}, returns null, otherwise {@code obj}.
     *
     * @param obj The object.
     * @return {@code obj}, or {@code null} if it is {@link #NULL_SENTINEL}.
     */
    @Nullable
    public static Object takeNull(Object obj) {
        return obj == NULL_SENTINEL ? null : obj;
    }

    /**
     * Normalize a constant, so that equal constants are {@link Object#equals(Object) equal}.
     *
     * @param value The constant, null for nil.
     * @return The normalized constant.
     */
    public static Object normalize(@Nullable Object value) {
        if (value instanceof Byte || value instanceof Short || value instanceof Integer) {
            return ((Number) value).longValue();
        }
        if (value instanceof Character) {
            return (long) (Character) value;
        }
        if (value instanceof BigInteger) {
            BigInteger big = (BigInteger) value;
            return big.compareTo(LONG_MIN) >= 0 && big.compareTo(LONG_MAX) <= 0 ? (Object) big.longValue() : big;
        }
        if (value instanceof Float) {
            return ((Float) value).doubleValue();
        }
        return fillNull(value);
    }

    /**
     * Get the constants a variable may hold.
     * <p>
     * A constant resolves to itself, a conversion to the constants of its operand, and a phi to the
     * union of the constants of its operands. A phi already being resolved contributes nothing.
     * Anything else cannot be resolved, and makes the whole query fail.
     *
     * @param var The variable.
     * @return The deduplicated constants, in the order they were found, or empty if not statically known.
     */
    public static Optional<Set<Object>> constantsOf(Var var) {
        Set<Object> out = new LinkedHashSet<>();
        Set<Insn.Phi> visitedPhis = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Var> stack = new ArrayDeque<>();
        stack.push(var);
        Resolver resolver = new Resolver(out, visitedPhis, stack);
        while (!stack.isEmpty()) {
            Insn def = stack.pop().definition();
            if (def == null || !def.accept(resolver)) return Optional.empty();
        }
        return Optional.of(Collections.unmodifiableSet(out));
    }

    /**
     * Evaluate a comparison between two normalized constants.
     *
     * @param op The comparison operator.
     * @param x  The left operand.
     * @param y  The right operand.
     * @return The outcome, or empty if the constants cannot be compared with {@code op}.
     */
    public static Optional<Boolean> compare(Operator op, Object x, Object y) {
        if (!op.isComparison()) throw new IllegalArgumentException(op + " is not a comparison");
        if (x == NULL_SENTINEL || y == NULL_SENTINEL) {
            if (op != Operator.EQL && op != Operator.NEQ) return Optional.empty();
            return Optional.of((x == y) == (op == Operator.EQL));
        }
        if (x instanceof Number && y instanceof Number) {
            if (x instanceof Double || y instanceof Double) {
                return Optional.of(compareDoubles(op, ((Number) x).doubleValue(), ((Number) y).doubleValue()));
            }
            return Optional.of(holds(op, toBig(x).compareTo(toBig(y))));
        }
        if (x instanceof String && y instanceof String) {
            return Optional.of(holds(op, ((String) x).compareTo((String) y)));
        }
        if (x instanceof Boolean && y instanceof Boolean) {
            if (op != Operator.EQL && op != Operator.NEQ) return Optional.empty();
            return Optional.of(x.equals(y) == (op == Operator.EQL));
        }
        return Optional.empty();
    }

    /**
     * Render a set of constants for a message.
     *
     * @param constants The constants.
     * @return The rendered set.
     */
    public static String render(Collection<Object> constants) {
        return constants.stream()
                .map(c -> c instanceof String ? '"' + (String) c + '"' : String.valueOf(c))
                .collect(Collectors.joining(" ", "[", "]"));
    }

    private static BigInteger toBig(Object n) {
        return n instanceof BigInteger ? (BigInteger) n : BigInteger.valueOf(((Number) n).longValue());
    }

    private static boolean compareDoubles(Operator op, double x, double y) {
        switch (op) {
            case EQL:
                return x == y;
            case NEQ:
                return x != y;
            case LSS:
                return x < y;
            case LEQ:
                return x <= y;
            case GTR:
                return x > y;
            case GEQ:
                return x >= y;
            default:
                throw new AssertionError(op);
        }
    }

    private static boolean holds(Operator op, int cmp) {
        switch (op) {
            case EQL:
                return cmp == 0;
            case NEQ:
                return cmp != 0;
            case LSS:
                return cmp < 0;
            case LEQ:
                return cmp <= 0;
            case GTR:
                return cmp > 0;
            case GEQ:
                return cmp >= 0;
            default:
                throw new AssertionError(op);
        }
    }

    /**
     * Resolves one definition, returning whether it could be resolved.
     */
    private static final class Resolver implements Insn.Visitor<Boolean> {
        private final Set<Object> out;
        private final Set<Insn.Phi> visitedPhis;
        private final Deque<Var> stack;

        Resolver(Set<Object> out, Set<Insn.Phi> visitedPhis, Deque<Var> stack) {
            this.out = out;
            this.visitedPhis = visitedPhis;
            this.stack = stack;
        }

        @Override
        public Boolean visitConst(Insn.Const insn) {
            out.add(normalize(insn.getValue()));
            return true;
        }

        @Override
        public Boolean visitConvert(Insn.Convert insn) {
            stack.push(insn.x);
            return true;
        }

        @Override
        public Boolean visitPhi(Insn.Phi insn) {
            // ids are per function, and operands may come from an enclosing one
            if (!visitedPhis.add(insn)) return true;
            List<Var> args = insn.args();
            for (int i = args.size() - 1; i >= 0; i--) {
                stack.push(args.get(i));
            }
            return true;
        }

        @Override
        public Boolean visitParam(Insn.Param insn) {
            return false;
        }

        @Override
        public Boolean visitAlloc(Insn.Alloc insn) {
            return false;
        }

        @Override
        public Boolean visitFieldAddr(Insn.FieldAddr insn) {
            return false;
        }

        @Override
        public Boolean visitLoad(Insn.Load insn) {
            return false;
        }

        @Override
        public Boolean visitStore(Insn.Store insn) {
            return false;
        }

        @Override
        public Boolean visitCall(Insn.Call insn) {
            return false;
        }

        @Override
        public Boolean visitBinOp(Insn.BinOp insn) {
            return false;
        }

        @Override
        public Boolean visitDebugRef(Insn.DebugRef insn) {
            return false;
        }

        @Override
        public Boolean visitMakeClosure(Insn.MakeClosure insn) {
            return false;
        }

        @Override
        public Boolean visitJump(Insn.Jump insn) {
            return false;
        }

        @Override
        public Boolean visitIf(Insn.If insn) {
            return false;
        }

        @Override
        public Boolean visitReturn(Insn.Return insn) {
            return false;
        }

        @Override
        public Boolean visitPanic(Insn.Panic insn) {
            return false;
        }
    }
}
