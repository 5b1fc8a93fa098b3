package io.github.eutro.exnorm.passes.hygiene;

import io.github.eutro.exnorm.analysis.Binders;
import io.github.eutro.exnorm.analysis.UsageAnalyzer;
import io.github.eutro.exnorm.ast.Def;
import io.github.eutro.exnorm.ast.Node;
import io.github.eutro.exnorm.conf.NormalizerConfig;
import io.github.eutro.exnorm.passes.TreePass;
import io.github.eutro.exnorm.transform.Renamer;
import io.github.eutro.exnorm.transform.Transformer;
import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A pass which strips numeric suffixes that code generation added to keep names apart,
 * one definition at a time.
 * <p>
 * A binder {@code item2} or {@code item_2} is renamed, with all its reads, to {@code item} if
 * that name is mentioned nowhere in the definition. Otherwise the first name of
 * {@link NormalizerConfig#getAlternativeNames()} that is mentioned nowhere is used, and if
 * there is none the binder is left alone. Names that occur in opaque text are never renamed.
 */
public class NumericSuffixRename implements TreePass {
    private static final Pattern SUFFIXED = Pattern.compile("([a-z](?:[a-zA-Z_]*[a-zA-Z])?)_?(\\d+)");
    private static final Set<String> KEYWORDS = new HashSet<>(Arrays.asList(
            "do", "end", "fn", "nil", "true", "false", "when", "and", "or", "not", "in",
            "after", "else", "catch", "rescue"
    ));

    private final NormalizerConfig config;

    public NumericSuffixRename(NormalizerConfig config) {
        this.config = config;
    }

    @Override
    public Node run(Node root) {
        return Transformer.transform(root, node -> node instanceof Def ? renameIn((Def) node) : node);
    }

    private Node renameIn(Def def) {
        Node current = def;
        Set<String> mentioned = Binders.mentionedIn(def);
        for (String name : Binders.declaredIn(def)) {
            String base = baseName(name);
            if (base == null || UsageAnalyzer.occursInOpaque(current, name)) continue;
            String target = chooseName(base, mentioned);
            if (target == null) continue;
            Node renamed = Renamer.rename(current, name, target);
            if (renamed == null) continue;
            current = renamed;
            mentioned.remove(name);
            mentioned.add(target);
        }
        return current;
    }

    @Nullable
    static String baseName(String name) {
        Matcher matcher = SUFFIXED.matcher(name);
        if (!matcher.matches()) return null;
        String base = matcher.group(1);
        return KEYWORDS.contains(base) ? null : base;
    }

    @Nullable
    private String chooseName(String base, Set<String> mentioned) {
        if (!mentioned.contains(base)) return base;
        for (String alternative : config.getAlternativeNames()) {
            if (!mentioned.contains(alternative)) return alternative;
        }
        return null;
    }
}
