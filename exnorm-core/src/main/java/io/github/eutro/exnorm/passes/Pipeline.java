package io.github.eutro.exnorm.passes;

import io.github.eutro.exnorm.ast.Node;
import io.github.eutro.exnorm.conf.NormalizerConfig;
import io.github.eutro.exnorm.ext.CommonExts;
import io.github.eutro.exnorm.ext.Meta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Runs a fixed list of passes over a tree, each exactly once, in order.
 * <p>
 * A pipeline holds no state between runs, so one instance can serve many units,
 * from many threads.
 */
public final class Pipeline implements IRPass<Node, Node> {
    private static final Logger LOGGER = LoggerFactory.getLogger(Pipeline.class);

    private final List<TreePass> passes;

    public Pipeline(List<TreePass> passes) {
        this.passes = Collections.unmodifiableList(new ArrayList<>(passes));
    }

    /**
     * The standard pipeline for a configuration.
     *
     * @param config The configuration.
     * @return The pipeline.
     * @see Passes#pipeline(NormalizerConfig)
     */
    public static Pipeline of(NormalizerConfig config) {
        return new Pipeline(Passes.pipeline(config));
    }

    public List<TreePass> passes() {
        return passes;
    }

    @Override
    public Node run(Node root) {
        return run(root, PassListener.NONE);
    }

    public Node run(Node root, PassListener listener) {
        String unit = root.getExt(CommonExts.SOURCE_FILE).orElse("<unit>");
        LOGGER.debug("Normalizing {} with {} passes, metadata v{}", unit, passes.size(), Meta.VERSION);
        Node acc = root;
        int changes = 0;
        for (int i = 0; i < passes.size(); i++) {
            TreePass pass = passes.get(i);
            Node before = acc;
            try {
                acc = pass.run(before);
            } catch (Throwable t) {
                t.addSuppressed(new RuntimeException("running pass " + pass.name() + " (" + i + ") in pipeline"));
                throw t;
            }
            if (acc != before) {
                changes++;
                if (LOGGER.isTraceEnabled()) {
                    LOGGER.trace("{} rewrote {}:\n{}", pass.name(), unit, acc);
                }
            }
            listener.passApplied(i, pass, before, acc);
        }
        LOGGER.debug("Normalized {}, {} passes changed the tree", unit, changes);
        return acc;
    }
}
