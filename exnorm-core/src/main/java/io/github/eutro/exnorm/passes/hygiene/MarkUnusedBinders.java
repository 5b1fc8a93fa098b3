package io.github.eutro.exnorm.passes.hygiene;

import io.github.eutro.exnorm.analysis.Binders;
import io.github.eutro.exnorm.analysis.Scopes;
import io.github.eutro.exnorm.analysis.UsageAnalyzer;
import io.github.eutro.exnorm.analysis.UsageIndex;
import io.github.eutro.exnorm.ast.*;
import io.github.eutro.exnorm.passes.TreePass;
import io.github.eutro.exnorm.transform.Transformer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

/**
 * A pass which marks binders that are never read with a leading underscore.
 * <p>
 * This covers the patterns of case, receive, rescue, catch and else clauses, destructuring
 * matches in scope bodies, {@code with} steps and comprehension generators. Plain
 * {@code x = e} statements are left to {@link io.github.eutro.exnorm.passes.deadstore.DeadStoreDiscard},
 * and parameters to {@link ParameterDiscard}. A name that occurs twice in one pattern asserts
 * equality, and is never renamed.
 */
public class MarkUnusedBinders implements TreePass {
    /**
     * An instance of this pass.
     */
    public static final MarkUnusedBinders INSTANCE = new MarkUnusedBinders();

    @Override
    public Node run(Node root) {
        return Transformer.transform(root, (node, ctx) -> {
            if (node instanceof Block && Scopes.isScopeBody(ctx)) {
                return markStatements((Block) node);
            }
            return node.accept(new NodeVisitor.Default<Node>() {
                @Override
                protected Node visitDefault(Node node) {
                    return node;
                }

                @Override
                public Node visitCase(Case node) {
                    return node.withClauses(markClauses(node.clauses));
                }

                @Override
                public Node visitReceive(Receive node) {
                    List<Clause> clauses = markClauses(node.clauses);
                    if (clauses == node.clauses) return node;
                    return new Receive(clauses, node.afterTimeout, node.afterBody, node.meta);
                }

                @Override
                public Node visitTry(Try node) {
                    List<Clause> rescue = markClauses(node.rescueClauses);
                    List<Clause> caught = markClauses(node.catchClauses);
                    List<Clause> orElse = markClauses(node.elseClauses);
                    if (rescue == node.rescueClauses && caught == node.catchClauses && orElse == node.elseClauses) {
                        return node;
                    }
                    return new Try(node.body, rescue, caught, orElse, node.after, node.meta);
                }

                @Override
                public Node visitWith(With node) {
                    List<Clause> orElse = markClauses(node.elseClauses);
                    List<WithStep> steps = new ArrayList<>(node.steps);
                    boolean changed = orElse != node.elseClauses;
                    for (int i = 0; i < steps.size(); i++) {
                        WithStep step = steps.get(i);
                        if (step.pattern == null) continue;
                        List<Node> later = new ArrayList<>();
                        List<Pattern> laterPatterns = new ArrayList<>();
                        for (WithStep next : steps.subList(i + 1, steps.size())) {
                            later.add(next.expr);
                            if (next.pattern != null) laterPatterns.add(next.pattern);
                        }
                        later.add(node.body);
                        Pattern marked = mark(step.pattern, name -> readIn(later, laterPatterns, name));
                        if (marked != step.pattern) {
                            steps.set(i, new WithStep(marked, step.expr));
                            changed = true;
                        }
                    }
                    return changed ? new With(steps, node.body, orElse, node.meta) : node;
                }

                @Override
                public Node visitFor(For node) {
                    List<Generator> generators = new ArrayList<>(node.generators);
                    boolean changed = false;
                    for (int i = 0; i < generators.size(); i++) {
                        Generator generator = generators.get(i);
                        List<Node> later = new ArrayList<>();
                        List<Pattern> laterPatterns = new ArrayList<>();
                        for (Generator next : generators.subList(i + 1, generators.size())) {
                            later.add(next.source);
                            laterPatterns.add(next.pattern);
                        }
                        later.addAll(node.filters);
                        later.add(node.body);
                        Pattern marked = mark(generator.pattern, name -> readIn(later, laterPatterns, name));
                        if (marked != generator.pattern) {
                            generators.set(i, new Generator(marked, generator.source, generator.bitstring));
                            changed = true;
                        }
                    }
                    return changed ? new For(generators, node.filters, node.into, node.body, node.meta) : node;
                }
            });
        });
    }

    private static Node markStatements(Block block) {
        List<Node> statements = block.statements;
        UsageIndex index = null;
        List<Node> out = null;
        for (int i = 0; i < statements.size(); i++) {
            Node statement = statements.get(i);
            if (!(statement instanceof Match)) continue;
            Match match = (Match) statement;
            if (Patterns.isSimpleBinder(match.pattern)) continue;
            if (index == null) index = UsageIndex.of(statements);
            UsageIndex usages = index;
            int from = i + 1;
            Pattern marked = mark(match.pattern, name -> usages.isReferenced(from, name)
                    || UsageAnalyzer.isReadInPattern(match.pattern, name)
                    || Binders.mentionedIn(block).contains("_" + name));
            if (marked != match.pattern) {
                if (out == null) out = new ArrayList<>(statements);
                out.set(i, match.withPattern(marked));
            }
        }
        return out == null ? block : block.withStatements(out);
    }

    private static List<Clause> markClauses(List<Clause> clauses) {
        return Nodes.mapAll(clauses, clause -> {
            List<Node> scope = new ArrayList<>(2);
            if (clause.guard != null) scope.add(clause.guard);
            scope.add(clause.body);
            return clause.mapPattern(pattern -> mark(pattern, name -> readIn(scope, Collections.singletonList(pattern), name)));
        });
    }

    private static boolean readIn(List<Node> nodes, List<Pattern> patterns, String name) {
        for (Node node : nodes) {
            if (UsageAnalyzer.isReferencedIn(node, name) || Binders.mentionedIn(node).contains("_" + name)) return true;
        }
        for (Pattern pattern : patterns) {
            if (UsageAnalyzer.isReadInPattern(pattern, name) || Patterns.binds(pattern, "_" + name)) return true;
        }
        return false;
    }

    /**
     * Mark the unused binders of a pattern.
     *
     * @param pattern The pattern.
     * @param used    Whether a name is used, or marking it would clash.
     * @return The marked pattern.
     */
    private static Pattern mark(Pattern pattern, Predicate<String> used) {
        List<String> occurrences = Patterns.binderOccurrences(pattern);
        Pattern marked = pattern;
        for (String name : Patterns.boundNames(pattern)) {
            if (name.startsWith("_")) continue;
            if (Collections.frequency(occurrences, name) > 1) continue;
            if (occurrences.contains("_" + name)) continue;
            if (used.test(name)) continue;
            marked = Patterns.renameBinder(marked, name, "_" + name);
        }
        return marked;
    }
}
