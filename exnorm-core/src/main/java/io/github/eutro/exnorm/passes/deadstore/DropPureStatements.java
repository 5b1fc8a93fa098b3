package io.github.eutro.exnorm.passes.deadstore;

import io.github.eutro.exnorm.analysis.Purity;
import io.github.eutro.exnorm.ast.Match;
import io.github.eutro.exnorm.ast.Node;
import io.github.eutro.exnorm.ast.PWildcard;
import io.github.eutro.exnorm.passes.misc.BlockPass;
import io.github.eutro.exnorm.transform.VisitContext;

import java.util.ArrayList;
import java.util.List;

/**
 * A pass which removes statements that have no effect and whose value is unused: pure
 * expressions, and {@code _ = e} with {@code e} pure, other than the last statement of a block.
 */
public class DropPureStatements extends BlockPass {
    /**
     * An instance of this pass.
     */
    public static final DropPureStatements INSTANCE = new DropPureStatements();

    private DropPureStatements() {
        super(false);
    }

    @Override
    protected List<Node> rewrite(List<Node> statements, VisitContext ctx) {
        List<Node> out = null;
        int last = statements.size() - 1;
        for (int i = 0; i < statements.size(); i++) {
            Node statement = statements.get(i);
            boolean drop = i != last && isUselessStatement(statement);
            if (drop && out == null) out = new ArrayList<>(statements.subList(0, i));
            if (out != null && !drop) out.add(statement);
        }
        return out == null ? statements : out;
    }

    private static boolean isUselessStatement(Node statement) {
        if (statement instanceof Match) {
            Match match = (Match) statement;
            return match.pattern instanceof PWildcard && Purity.isPure(match.value);
        }
        return Purity.isPure(statement);
    }
}
