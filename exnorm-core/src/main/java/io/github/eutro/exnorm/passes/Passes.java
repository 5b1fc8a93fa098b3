package io.github.eutro.exnorm.passes;

import io.github.eutro.exnorm.conf.NormalizerConfig;
import io.github.eutro.exnorm.passes.chain.InlineTempReturn;
import io.github.eutro.exnorm.passes.chain.TempChainCollapse;
import io.github.eutro.exnorm.passes.deadstore.DeadStoreDiscard;
import io.github.eutro.exnorm.passes.deadstore.DropPureStatements;
import io.github.eutro.exnorm.passes.deadstore.EliminateSelfAssign;
import io.github.eutro.exnorm.passes.deadstore.RemoveNilInit;
import io.github.eutro.exnorm.passes.dispatch.FlattenNestedCase;
import io.github.eutro.exnorm.passes.fold.AccumulatorAliasUnification;
import io.github.eutro.exnorm.passes.fold.ElementCopyElimination;
import io.github.eutro.exnorm.passes.hygiene.*;
import io.github.eutro.exnorm.passes.naming.QualifyAppModules;
import io.github.eutro.exnorm.passes.shape.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class Passes {
    /**
     * The normalization pipeline, in order.
     * <p>
     * The order matters: later passes rely on the shapes earlier ones produce, and some
     * passes run more than once to repair shapes introduced in between.
     *
     * @param config The configuration, for the passes that need it.
     * @return The passes.
     */
    public static List<TreePass> pipeline(NormalizerConfig config) {
        return Collections.unmodifiableList(Arrays.asList(
                FlattenBlocks.INSTANCE,
                HoistBlockAssignment.INSTANCE,
                CollapseThunkApply.INSTANCE,
                FlattenBlocks.INSTANCE,
                new TempChainCollapse(config),
                new InlineTempReturn(config),
                RemoveNilInit.INSTANCE,
                EliminateSelfAssign.INSTANCE,
                AccumulatorAliasUnification.INSTANCE,
                ElementCopyElimination.INSTANCE,
                FlattenNestedCase.INSTANCE,
                RestoreLoopNames.INSTANCE,
                PromoteDiscardedBinders.INSTANCE,
                new NumericSuffixRename(config),
                new DeadStoreDiscard(config),
                DropPureStatements.INSTANCE,
                MarkUnusedBinders.INSTANCE,
                ParameterDiscard.INSTANCE,
                DropNilElse.INSTANCE,
                IfChainToCond.INSTANCE,
                new QualifyAppModules(config),
                FlattenBlocks.INSTANCE
        ));
    }
}
