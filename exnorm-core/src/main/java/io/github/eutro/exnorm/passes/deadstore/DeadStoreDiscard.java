package io.github.eutro.exnorm.passes.deadstore;

import io.github.eutro.exnorm.analysis.Purity;
import io.github.eutro.exnorm.analysis.UsageIndex;
import io.github.eutro.exnorm.ast.*;
import io.github.eutro.exnorm.conf.NormalizerConfig;
import io.github.eutro.exnorm.ext.CommonExts;
import io.github.eutro.exnorm.ext.NodeRole;
import io.github.eutro.exnorm.passes.misc.BlockPass;
import io.github.eutro.exnorm.transform.VisitContext;

import java.util.ArrayList;
import java.util.List;

/**
 * A pass which turns {@code name = expr} into {@code _ = expr} when {@code name} is never read
 * later in the same scope. The expression is still evaluated.
 * <p>
 * Only statements of scope bodies are considered, and never the last one, which gives the
 * body its value. Reserved names and names already marked as discarded are left alone.
 * In a comprehension body, a store whose expression might have an effect is kept.
 */
public class DeadStoreDiscard extends BlockPass {
    private final NormalizerConfig config;

    public DeadStoreDiscard(NormalizerConfig config) {
        super(true);
        this.config = config;
    }

    @Override
    protected List<Node> rewrite(List<Node> statements, VisitContext ctx) {
        boolean comprehension = ctx.parent() instanceof For
                || CommonExts.hasRole(ctx.original(), NodeRole.COMPREHENSION_BODY);
        UsageIndex index = null;
        List<Node> out = null;
        for (int i = 0; i < statements.size() - 1; i++) {
            Node statement = statements.get(i);
            if (!(statement instanceof Match)) continue;
            Match match = (Match) statement;
            if (!(match.pattern instanceof PVar)) continue;
            String name = ((PVar) match.pattern).name;
            if (name.startsWith("_") || config.isReserved(name)) continue;
            if (comprehension && !Purity.isPure(match.value)) continue;
            if (index == null) index = UsageIndex.of(statements);
            if (index.isReferenced(i + 1, name)) continue;
            if (out == null) out = new ArrayList<>(statements);
            out.set(i, match.withPattern(new PWildcard()));
        }
        return out == null ? statements : out;
    }
}
