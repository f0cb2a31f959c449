package io.github.eutro.flowlint.checks;

import io.github.eutro.flowlint.analysis.DefUse;
import io.github.eutro.flowlint.analysis.FunctionAnalysis;
import io.github.eutro.flowlint.analysis.ReceiverAliases;
import io.github.eutro.flowlint.lint.Diagnostic;
import io.github.eutro.flowlint.lint.Pass;
import io.github.eutro.flowlint.lint.Rule;
import io.github.eutro.flowlint.source.Position;
import io.github.eutro.flowlint.ssa.Function;
import io.github.eutro.flowlint.ssa.Insn;
import io.github.eutro.flowlint.ssa.Var;
import io.github.eutro.flowlint.tree.FuncDecl;
import io.github.eutro.flowlint.types.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Stream;

/**
 * Flags assignments to fields of a value receiver that are never read afterwards.
 * <p>
 * The method works on a copy of its receiver, so such an assignment is lost when it returns.
 * Only the receiver's local copy is tracked; if a reference to it escapes, the method is skipped.
 */
public final class IneffectiveFieldAssignments implements Rule {
    private static final Logger LOGGER = LoggerFactory.getLogger(IneffectiveFieldAssignments.class);

    public static final IneffectiveFieldAssignments INSTANCE = new IneffectiveFieldAssignments();

    private IneffectiveFieldAssignments() {
    }

    @Override
    public Stream<Diagnostic> check(Pass pass) {
        return pass.funcDecls().stream()
                .filter(decl -> decl.recv != null && decl.ssa != null && !decl.ssa.isExternal())
                .flatMap(decl -> checkMethod(pass, decl).stream());
    }

    private static List<Diagnostic> checkMethod(Pass pass, FuncDecl decl) {
        Function fn = Objects.requireNonNull(decl.ssa);
        Var recv = fn.getReceiver();
        if (recv == null) return Collections.emptyList();
        Type recvType = pass.types().typeOf(recv);
        if (recvType == null || !recvType.is(Type.Kind.STRUCT)) return Collections.emptyList();

        FunctionAnalysis fa = pass.analysis(fn);
        ReceiverAliases aliases = ReceiverAliases.trace(fa);
        if (aliases.isEscaped()) {
            LOGGER.debug("Receiver of {} escapes, skipping", fn.name);
            return Collections.emptyList();
        }
        DefUse uses = fa.uses();
        List<Diagnostic> diagnostics = new ArrayList<>();
        Set<Insn> reported = new HashSet<>();
        for (Insn.Store write : aliases.fieldStores(uses)) {
            Insn.FieldAddr field = (Insn.FieldAddr) Objects.requireNonNull(write.addr.definition());
            if (uses.reachesRead(write, insn -> isRead(insn, field, aliases))) continue;
            if (!reported.add(field)) continue;
            String name = recvType.fieldName(field.field);
            diagnostics.add(pass.report(field, "ineffective assignment to field %s",
                    name == null ? field.fieldName : name));
        }
        return diagnostics;
    }

    private static boolean isRead(Insn insn, Insn.FieldAddr write, ReceiverAliases aliases) {
        if (!(insn instanceof Insn.Load)) return false;
        Var addr = ((Insn.Load) insn).addr;
        Position writePos = write.position();
        if (aliases.isSlot(addr)) {
            // reading the whole receiver reads every field
            return !writePos.isAfter(insn.position());
        }
        if (aliases.isField(addr)) {
            Insn.FieldAddr read = (Insn.FieldAddr) Objects.requireNonNull(addr.definition());
            return read.field == write.field && read.position().isAfter(writePos);
        }
        return false;
    }
}
