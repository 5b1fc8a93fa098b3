package io.github.eutro.exnorm.analysis;

import io.github.eutro.exnorm.ast.*;

import java.util.*;

/**
 * A precomputed answer to {@link UsageAnalyzer#isReferenced(List, int, String)} for one statement
 * list, for passes that query many names against the same statements.
 * <p>
 * Structured reads are indexed by name. Opaque text is kept as is and searched with
 * {@link TokenScan} at query time, so the answers agree with the direct walk.
 */
public final class UsageIndex {
    private final int size;
    private final Map<String, Integer> lastRead = new HashMap<>();
    private final List<List<String>> opaque = new ArrayList<>();

    private UsageIndex(List<Node> statements) {
        size = statements.size();
        for (int i = 0; i < statements.size(); i++) {
            Set<String> reads = new HashSet<>();
            List<String> texts = new ArrayList<>();
            collect(statements.get(i), reads, texts);
            for (String read : reads) {
                lastRead.put(read, i);
            }
            opaque.add(texts);
        }
    }

    public static UsageIndex of(List<Node> statements) {
        return new UsageIndex(statements);
    }

    public int size() {
        return size;
    }

    public boolean isReferenced(int fromIndex, String name) {
        if (fromIndex < 0) throw new IndexOutOfBoundsException("fromIndex " + fromIndex);
        Integer last = lastRead.get(name);
        if (last != null && last >= fromIndex) return true;
        for (int i = fromIndex; i < size; i++) {
            for (String text : opaque.get(i)) {
                if (TokenScan.containsIdentifier(text, name)) return true;
            }
        }
        return false;
    }

    private static void collect(Node node, Set<String> reads, List<String> texts) {
        node.accept(new NodeVisitor.Default<Void>() {
            @Override
            protected Void visitDefault(Node node) {
                node.forEachPattern(pattern -> collect(pattern, reads, texts));
                node.forEachChild(child -> collect(child, reads, texts));
                return null;
            }

            @Override
            public Void visitVar(Var node) {
                reads.add(node.name);
                return null;
            }

            @Override
            public Void visitRaw(Raw node) {
                texts.add(node.code);
                return null;
            }

            @Override
            public Void visitTemplate(Template node) {
                texts.add(node.text);
                if (TokenScan.hasAttributeAccess(node.text)) reads.add("assigns");
                return null;
            }
        });
    }

    private static void collect(Pattern pattern, Set<String> reads, List<String> texts) {
        Patterns.walk(pattern, sub -> {
            if (sub instanceof PPin) {
                reads.add(((PPin) sub).name);
            } else if (sub instanceof PBinary) {
                for (Segment segment : ((PBinary) sub).segments) {
                    if (segment.spec != null) texts.add(segment.spec);
                }
            }
        });
    }
}
