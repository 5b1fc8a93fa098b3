package io.github.eutro.exnorm.passes.naming;

import io.github.eutro.exnorm.ast.*;
import io.github.eutro.exnorm.conf.NormalizerConfig;
import io.github.eutro.exnorm.passes.TreePass;
import io.github.eutro.exnorm.transform.Transformer;
import org.jetbrains.annotations.Nullable;

import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A pass which prefixes bare references to project modules, such as {@code Repo}, with the
 * project namespace, giving {@code MyApp.Repo}.
 * <p>
 * A name is left alone inside a module that aliases it. Without a configured project module,
 * this pass does nothing.
 */
public class QualifyAppModules implements TreePass {
    private final NormalizerConfig config;

    public QualifyAppModules(NormalizerConfig config) {
        this.config = config;
    }

    @Override
    public Node run(Node root) {
        String project = config.getProjectModule();
        if (project == null) return root;
        Map<ModuleDef, Set<String>> aliasCache = new IdentityHashMap<>();
        return Transformer.transform(root, (node, ctx) -> {
            if (!(node instanceof ModuleRef)) return node;
            ModuleRef ref = (ModuleRef) node;
            if (!config.getAppLocalModules().contains(ref.name)) return node;
            if (ctx.nearest(Directive.class) != null) return node;
            ModuleDef module = ctx.nearest(ModuleDef.class);
            if (module != null && aliasCache.computeIfAbsent(module, QualifyAppModules::aliasedNames).contains(ref.name)) {
                return node;
            }
            return new ModuleRef(project + "." + ref.name, ref.meta);
        });
    }

    /**
     * The names a module makes available through {@code alias}.
     *
     * @param module The module.
     * @return The short names.
     */
    static Set<String> aliasedNames(ModuleDef module) {
        Set<String> names = new HashSet<>();
        for (Node statement : Nodes.statements(module.body)) {
            if (!(statement instanceof Directive)) continue;
            Directive directive = (Directive) statement;
            if (directive.kind != Directive.Kind.ALIAS) continue;
            String as = aliasOption(directive.options);
            if (as != null) {
                names.add(as);
            } else {
                int dot = directive.module.lastIndexOf('.');
                names.add(directive.module.substring(dot + 1));
            }
        }
        return names;
    }

    @Nullable
    private static String aliasOption(Node options) {
        if (!(options instanceof Keyword)) return null;
        for (Entry pair : ((Keyword) options).pairs) {
            if (pair.key instanceof Atom && "as".equals(((Atom) pair.key).value) && pair.value instanceof ModuleRef) {
                return ((ModuleRef) pair.value).name;
            }
        }
        return null;
    }
}
