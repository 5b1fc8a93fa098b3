package io.github.eutro.exnorm.passes.chain;

import io.github.eutro.exnorm.analysis.TempNames;
import io.github.eutro.exnorm.ast.Match;
import io.github.eutro.exnorm.ast.Node;
import io.github.eutro.exnorm.ast.Nodes;
import io.github.eutro.exnorm.ast.PVar;
import io.github.eutro.exnorm.conf.NormalizerConfig;
import io.github.eutro.exnorm.passes.misc.BlockPass;
import io.github.eutro.exnorm.transform.VisitContext;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A pass which replaces a body ending in {@code tmp = expr; tmp}, for a compiler temporary
 * {@code tmp}, with one ending in {@code expr}, until the body no longer ends that way.
 */
public class InlineTempReturn extends BlockPass {
    private final NormalizerConfig config;

    public InlineTempReturn(NormalizerConfig config) {
        super(true);
        this.config = config;
    }

    @Override
    protected List<Node> rewrite(List<Node> statements, VisitContext ctx) {
        List<Node> out = statements;
        Match tail;
        while ((tail = tempTail(out)) != null) {
            List<Node> inlined = new ArrayList<>(out.subList(0, out.size() - 2));
            inlined.add(tail.value);
            out = inlined;
        }
        return out;
    }

    @Nullable
    private Match tempTail(List<Node> statements) {
        int size = statements.size();
        if (size < 2) return null;
        Node penultimate = statements.get(size - 2);
        if (!(penultimate instanceof Match)) return null;
        Match match = (Match) penultimate;
        if (!(match.pattern instanceof PVar)) return null;
        String name = ((PVar) match.pattern).name;
        if (!Nodes.isVar(statements.get(size - 1), name) || !TempNames.isTemp(match, name, config)) {
            return null;
        }
        return match;
    }
}
