package io.github.eutro.exnorm.passes.chain;

import io.github.eutro.exnorm.analysis.TempNames;
import io.github.eutro.exnorm.analysis.UsageAnalyzer;
import io.github.eutro.exnorm.ast.*;
import io.github.eutro.exnorm.conf.NormalizerConfig;
import io.github.eutro.exnorm.passes.misc.BlockPass;
import io.github.eutro.exnorm.transform.VisitContext;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A pass which removes compiler temporaries that are only copied into another binding.
 * <p>
 * {@code tmp = expr; dst = tmp} becomes {@code dst = expr}, and {@code dst = (tmp = expr)}
 * becomes {@code dst = expr}, provided {@code tmp} is not read anywhere else in the block.
 * Collapses repeat until none apply, so chains of temporaries collapse in one run.
 */
public class TempChainCollapse extends BlockPass {
    private final NormalizerConfig config;

    public TempChainCollapse(NormalizerConfig config) {
        super(true);
        this.config = config;
    }

    @Override
    protected List<Node> rewrite(List<Node> statements, VisitContext ctx) {
        List<Node> out = new ArrayList<>(statements);
        boolean changed = false;
        int i = 0;
        while (i < out.size()) {
            Node nested = collapseNested(out, i);
            Node pair = nested == null ? collapsePair(out, i) : null;
            if (nested != null) {
                out.set(i, nested);
            } else if (pair != null) {
                out.set(i, pair);
                out.remove(i + 1);
            } else {
                i++;
                continue;
            }
            // a collapse can complete an earlier pair, or drop the last other read of an earlier temp
            changed = true;
            i = 0;
        }
        return changed ? out : statements;
    }

    @Nullable
    private String tempName(Node node) {
        if (!(node instanceof Match)) return null;
        Match match = (Match) node;
        if (!(match.pattern instanceof PVar)) return null;
        String name = ((PVar) match.pattern).name;
        return TempNames.isTemp(match, name, config) ? name : null;
    }

    @Nullable
    private Node collapsePair(List<Node> statements, int i) {
        if (i + 1 >= statements.size()) return null;
        String tmp = tempName(statements.get(i));
        if (tmp == null) return null;
        Node next = statements.get(i + 1);
        if (!(next instanceof Match)) return null;
        Match copy = (Match) next;
        if (!Nodes.isVar(Nodes.unwrapParens(copy.value), tmp)) return null;
        if (UsageAnalyzer.countReads(copy, tmp) != 1) return null;
        if (UsageAnalyzer.isReferenced(statements, i + 2, tmp)) return null;
        return copy.withValue(((Match) statements.get(i)).value);
    }

    @Nullable
    private Node collapseNested(List<Node> statements, int i) {
        Node statement = statements.get(i);
        if (!(statement instanceof Match)) return null;
        Match outer = (Match) statement;
        Node value = Nodes.unwrapParens(outer.value);
        String tmp = tempName(value);
        if (tmp == null) return null;
        if (UsageAnalyzer.isReadInPattern(outer.pattern, tmp)) return null;
        if (UsageAnalyzer.isReferenced(statements, i + 1, tmp)) return null;
        return outer.withValue(((Match) value).value);
    }
}
