package io.github.eutro.exnorm.passes.hygiene;

import io.github.eutro.exnorm.analysis.Binders;
import io.github.eutro.exnorm.analysis.UsageAnalyzer;
import io.github.eutro.exnorm.ast.*;
import io.github.eutro.exnorm.ext.CommonExts;
import io.github.eutro.exnorm.passes.TreePass;
import io.github.eutro.exnorm.transform.Renamer;
import io.github.eutro.exnorm.transform.Transformer;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * A pass which gives the iteration binders of functions and comprehensions generated from loops
 * back the names they had in the original program, as recorded in
 * {@link CommonExts#LOOP_ORIGIN_NAMES}.
 * <p>
 * A binder is only renamed if the original name is mentioned nowhere in the node. Entries
 * that were applied are removed from the metadata.
 */
public class RestoreLoopNames implements TreePass {
    /**
     * An instance of this pass.
     */
    public static final RestoreLoopNames INSTANCE = new RestoreLoopNames();

    @Override
    public Node run(Node root) {
        return Transformer.transform(root, node -> {
            if (!(node instanceof Fn) && !(node instanceof For)) return node;
            Map<String, String> names = node.getNullable(CommonExts.LOOP_ORIGIN_NAMES);
            if (names == null || names.isEmpty()) return node;
            Map<String, String> remaining = new LinkedHashMap<>(names);
            Node current = node;
            for (Map.Entry<String, String> entry : names.entrySet()) {
                String generated = entry.getKey();
                String original = entry.getValue();
                if (!iterationBinders(current).contains(generated)) continue;
                if (Binders.mentionedIn(current).contains(original)) continue;
                if (current instanceof For && readOutsideBody((For) current, generated)) continue;
                Node renamed = Renamer.rename(current, generated, original);
                if (renamed == null) continue;
                current = renamed;
                remaining.remove(generated);
            }
            if (current == node) return node;
            return current.withMeta(remaining.isEmpty()
                    ? current.meta.without(CommonExts.LOOP_ORIGIN_NAMES)
                    : current.meta.with(CommonExts.LOOP_ORIGIN_NAMES, remaining));
        });
    }

    // a read in a generator source or in into: may refer to an outer binding of the same name
    private static boolean readOutsideBody(For aFor, String name) {
        for (Generator generator : aFor.generators) {
            if (UsageAnalyzer.isReferencedIn(generator.source, name)) return true;
        }
        return aFor.into != null && UsageAnalyzer.isReferencedIn(aFor.into, name);
    }

    private static Set<String> iterationBinders(Node node) {
        Set<String> names = new LinkedHashSet<>();
        node.forEachPattern(pattern -> names.addAll(Patterns.boundNames(pattern)));
        return names;
    }
}
