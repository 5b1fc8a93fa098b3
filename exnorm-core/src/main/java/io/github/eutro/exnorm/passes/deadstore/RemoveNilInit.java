package io.github.eutro.exnorm.passes.deadstore;

import io.github.eutro.exnorm.analysis.UsageAnalyzer;
import io.github.eutro.exnorm.ast.*;
import io.github.eutro.exnorm.passes.misc.BlockPass;
import io.github.eutro.exnorm.transform.VisitContext;

import java.util.ArrayList;
import java.util.List;

/**
 * A pass which removes {@code x = nil} when {@code x} is bound again later in the same block,
 * and not read in between.
 */
public class RemoveNilInit extends BlockPass {
    /**
     * An instance of this pass.
     */
    public static final RemoveNilInit INSTANCE = new RemoveNilInit();

    private RemoveNilInit() {
        super(false);
    }

    @Override
    protected List<Node> rewrite(List<Node> statements, VisitContext ctx) {
        List<Node> out = null;
        for (int i = 0; i < statements.size(); i++) {
            if (isDeadInit(statements, i)) {
                if (out == null) out = new ArrayList<>(statements.subList(0, i));
            } else if (out != null) {
                out.add(statements.get(i));
            }
        }
        return out == null ? statements : out;
    }

    private static boolean isDeadInit(List<Node> statements, int i) {
        Node statement = statements.get(i);
        if (!(statement instanceof Match)) return false;
        Match init = (Match) statement;
        if (!(init.pattern instanceof PVar) || !(Nodes.unwrapParens(init.value) instanceof Nil)) return false;
        String name = ((PVar) init.pattern).name;
        for (int j = i + 1; j < statements.size(); j++) {
            Node later = statements.get(j);
            if (UsageAnalyzer.isReferencedIn(later, name)) return false;
            if (later instanceof Match && Patterns.binds(((Match) later).pattern, name)) return true;
        }
        return false;
    }
}
