package io.github.eutro.exnorm.passes.hygiene;

import io.github.eutro.exnorm.analysis.Binders;
import io.github.eutro.exnorm.analysis.UsageAnalyzer;
import io.github.eutro.exnorm.ast.*;
import io.github.eutro.exnorm.ext.CommonExts;
import io.github.eutro.exnorm.ext.NodeRole;
import io.github.eutro.exnorm.passes.TreePass;
import io.github.eutro.exnorm.transform.Transformer;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A pass which marks unread parameters of definitions and anonymous functions with a leading
 * underscore.
 * <p>
 * Reads in opaque text count, and so does an {@code @field} access in a template, which reads
 * {@code assigns}. Functions with the {@link NodeRole#TEMPLATE_RENDER} role always keep
 * {@code assigns}.
 */
public class ParameterDiscard implements TreePass {
    /**
     * An instance of this pass.
     */
    public static final ParameterDiscard INSTANCE = new ParameterDiscard();

    private static final String ASSIGNS = "assigns";

    @Override
    public Node run(Node root) {
        return Transformer.transform(root, node -> {
            if (node instanceof Def) {
                Def def = (Def) node;
                return def.withParams(discard(def.params, def.guard, def.body, rendersTemplate(def)));
            }
            if (node instanceof Fn) {
                Fn fn = (Fn) node;
                return fn.withClauses(Nodes.mapAll(fn.clauses, clause -> {
                    List<Pattern> params = discard(clause.params, clause.guard, clause.body, rendersTemplate(fn));
                    return params == clause.params ? clause : new FnClause(params, clause.guard, clause.body);
                }));
            }
            return node;
        });
    }

    private static boolean rendersTemplate(Node node) {
        return CommonExts.hasRole(node, NodeRole.TEMPLATE_RENDER);
    }

    private static List<Pattern> discard(List<Pattern> params, @Nullable Node guard, Node body, boolean keepAssigns) {
        List<String> occurrences = new ArrayList<>();
        for (Pattern param : params) {
            occurrences.addAll(Patterns.binderOccurrences(param));
        }
        List<Pattern> out = params;
        for (String name : new ArrayList<>(occurrences)) {
            if (name.startsWith("_") || Collections.frequency(occurrences, name) > 1) continue;
            if (keepAssigns && name.equals(ASSIGNS)) continue;
            String discarded = "_" + name;
            if (occurrences.contains(discarded)) continue;
            if (isRead(name, params, guard, body) || isMentioned(discarded, guard, body)) continue;
            out = Nodes.mapAll(out, param -> Patterns.renameBinder(param, name, discarded));
        }
        return out;
    }

    private static boolean isRead(String name, List<Pattern> params, @Nullable Node guard, Node body) {
        for (Pattern param : params) {
            if (UsageAnalyzer.isReadInPattern(param, name)) return true;
        }
        return guard != null && UsageAnalyzer.isReferencedIn(guard, name) || UsageAnalyzer.isReferencedIn(body, name);
    }

    private static boolean isMentioned(String name, @Nullable Node guard, Node body) {
        return guard != null && Binders.mentionedIn(guard).contains(name) || Binders.mentionedIn(body).contains(name);
    }
}
