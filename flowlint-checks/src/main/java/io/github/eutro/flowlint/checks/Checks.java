package io.github.eutro.flowlint.checks;

import io.github.eutro.flowlint.lint.Registry;

/**
 * The flow-sensitive checks, under their catalogue identifiers.
 */
public final class Checks {
    private Checks() {
    }

    /**
     * Create a registry holding every check of this module.
     * <p>
     * {@code SA1009} is a recognised identifier without a check.
     *
     * @return A new registry, which more checks may be registered to.
     */
    public static Registry registry() {
        return new Registry()
                .register("SA1009", null)
                .register("SA2004", ReturnBeforeUnlock.INSTANCE)
                .register("SA4004", IneffectiveLoop.INSTANCE)
                .register("SA4005", IneffectiveFieldAssignments.INSTANCE)
                .register("SA4006", UnreadVariableValues.INSTANCE)
                .register("SA4007", PredeterminedBooleanExprs.INSTANCE)
                .register("SA4008", LoopCondition.INSTANCE)
                .register("SA4009", ArgOverwritten.INSTANCE)
                .register("SA4010", IneffectiveAppend.INSTANCE)
                .register("SA5007", InfiniteRecursion.INSTANCE);
    }
}
