package io.github.eutro.exnorm.analysis;

import io.github.eutro.exnorm.ast.*;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Enumerates the names a subtree binds or mentions.
 */
public final class Binders {
    private Binders() {
    }

    /**
     * Every name bound by any pattern in the subtree, nested scopes included.
     *
     * @param node The subtree.
     * @return The names.
     */
    public static Set<String> declaredIn(Node node) {
        Set<String> names = new LinkedHashSet<>();
        declared(node, names);
        return names;
    }

    public static Set<String> declaredIn(List<Node> nodes) {
        Set<String> names = new LinkedHashSet<>();
        for (Node node : nodes) {
            declared(node, names);
        }
        return names;
    }

    private static void declared(Node node, Set<String> names) {
        node.forEachPattern(pattern -> names.addAll(Patterns.boundNames(pattern)));
        node.forEachChild(child -> declared(child, names));
    }

    /**
     * Every name the subtree binds, reads, or might refer to from opaque text.
     * A name outside this set can be introduced without capturing anything.
     *
     * @param node The subtree.
     * @return The names.
     */
    public static Set<String> mentionedIn(Node node) {
        Set<String> names = new LinkedHashSet<>();
        mentioned(node, names);
        return names;
    }

    private static void mentioned(Node node, Set<String> names) {
        if (node instanceof Var) {
            names.add(((Var) node).name);
        } else if (node instanceof Raw) {
            names.addAll(TokenScan.identifiers(((Raw) node).code));
        } else if (node instanceof Template) {
            names.addAll(TokenScan.identifiers(((Template) node).text));
            if (TokenScan.hasAttributeAccess(((Template) node).text)) names.add("assigns");
        }
        node.forEachPattern(pattern -> Patterns.walk(pattern, sub -> {
            if (sub instanceof PVar) {
                names.add(((PVar) sub).name);
            } else if (sub instanceof PAlias) {
                names.add(((PAlias) sub).name);
            } else if (sub instanceof PPin) {
                names.add(((PPin) sub).name);
            } else if (sub instanceof PBinary) {
                for (Segment segment : ((PBinary) sub).segments) {
                    if (segment.spec != null) names.addAll(TokenScan.identifiers(segment.spec));
                }
            }
        }));
        node.forEachChild(child -> mentioned(child, names));
    }
}
