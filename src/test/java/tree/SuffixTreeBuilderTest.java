package tree;

import graph.EdgeDescriptor;
import graph.InvariantViolationException;
import graph.LabeledEdgeGraph;
import org.junit.jupiter.api.Test;
import utilities.SuffixTreeLogger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SuffixTreeBuilderTest {

    private static EdgeDescriptor leaf(int start) {
        return EdgeDescriptor.openLeaf(start);
    }

    private static EdgeDescriptor to(int vertex, int start, int end) {
        return EdgeDescriptor.internal(start, end, vertex);
    }

    private static void assertVertex(SuffixTree<Character> tree, int vertex, int suffixLink,
                                     Map<Character, EdgeDescriptor> expected) {
        assertEquals(expected, Map.copyOf(tree.edges(vertex)), "transitions of vertex " + vertex);
        assertEquals(OptionalInt.of(suffixLink), tree.suffixLink(vertex), "suffix link of vertex " + vertex);
    }

    @Test
    void emptyWordYieldsOnlyTheRoot() {
        SuffixTree<Character> tree = SuffixTreeBuilder.build("");
        assertEquals(1, tree.vertexCount());
        assertEquals(0, tree.edgeCount());
        assertEquals(new ActivePointState(0, 0, 0), tree.activePoint());
        TreeValidator.validate(tree);
    }

    @Test
    void singleSymbolYieldsOneLeafOffTheRoot() {
        SuffixTree<Character> tree = SuffixTreeBuilder.build("x");
        assertEquals(1, tree.vertexCount());
        assertEquals(1, tree.edgeCount());
        assertVertex(tree, 0, 0, Map.of('x', leaf(0)));
    }

    @Test
    void abcacdae() {
        SuffixTree<Character> tree = SuffixTreeBuilder.build("abcacdae");

        assertEquals(3, tree.vertexCount());
        assertVertex(tree, 0, 0, Map.of('a', to(1, 0, 0), 'b', leaf(1), 'c', to(2, 2, 2), 'd', leaf(5), 'e', leaf(7)));
        assertVertex(tree, 1, 0, Map.of('c', leaf(4), 'b', leaf(1), 'e', leaf(7)));
        assertVertex(tree, 2, 0, Map.of('d', leaf(5), 'a', leaf(3)));
        assertEquals(new ActivePointState(0, 0, 0), tree.activePoint());
        TreeValidator.validate(tree);
    }

    @Test
    void abcabxabcd() {
        SuffixTree<Character> tree = SuffixTreeBuilder.build("abcabxabcd");

        assertEquals(6, tree.vertexCount());
        assertVertex(tree, 0, 0, Map.of('a', to(1, 0, 1), 'b', to(2, 1, 1), 'c', to(5, 2, 2), 'x', leaf(5), 'd', leaf(9)));
        assertVertex(tree, 1, 2, Map.of('c', to(3, 2, 2), 'x', leaf(5)));
        assertVertex(tree, 2, 0, Map.of('c', to(4, 2, 2), 'x', leaf(5)));
        assertVertex(tree, 3, 4, Map.of('a', leaf(3), 'd', leaf(9)));
        assertVertex(tree, 4, 5, Map.of('a', leaf(3), 'd', leaf(9)));
        assertVertex(tree, 5, 0, Map.of('a', leaf(3), 'd', leaf(9)));
        TreeValidator.validate(tree);

        assertEquals(List.of('a', 'b', 'c'), tree.factor(3));
        assertEquals(List.of('b', 'c'), tree.factor(4));
        assertEquals(List.of('c'), tree.factor(5));
        assertEquals(List.of('c', 'a', 'b', 'c', 'd'), tree.label(tree.edge(5, 'a').orElseThrow()));
    }

    @Test
    void aabaabbc() {
        SuffixTree<Character> tree = SuffixTreeBuilder.build("aabaabbc");

        assertEquals(5, tree.vertexCount());
        assertVertex(tree, 0, 0, Map.of('a', to(1, 0, 0), 'b', to(4, 2, 2), 'c', leaf(7)));
        assertVertex(tree, 1, 0, Map.of('a', to(2, 1, 2), 'b', to(3, 2, 2)));
        assertVertex(tree, 2, 3, Map.of('a', leaf(3), 'b', leaf(6)));
        assertVertex(tree, 3, 4, Map.of('a', leaf(3), 'b', leaf(6)));
        assertVertex(tree, 4, 0, Map.of('a', leaf(3), 'b', leaf(6), 'c', leaf(7)));
        TreeValidator.validate(tree);
    }

    @Test
    void mississippi() {
        SuffixTree<Character> tree = SuffixTreeBuilder.build("mississippi");

        assertEquals(7, tree.vertexCount());
        assertVertex(tree, 0, 0, Map.of('m', leaf(0), 'i', to(5, 1, 1), 's', to(1, 2, 2), 'p', to(6, 8, 8)));
        assertVertex(tree, 1, 0, Map.of('s', to(3, 3, 4), 'i', to(4, 4, 4)));
        assertVertex(tree, 5, 0, Map.of('s', to(2, 2, 4), 'p', leaf(8)));
        assertVertex(tree, 6, 0, Map.of('p', leaf(9), 'i', leaf(10)));
        assertEquals(new ActivePointState(5, 0, 0), tree.activePoint());
        assertEquals(List.of('i'), tree.longestRepeatedSuffix());
        TreeValidator.validate(tree);
    }

    @Test
    void activePointMayEndInsideAnEdge() {
        SuffixTree<Character> tree = SuffixTreeBuilder.build("abcabdabc");

        assertEquals(3, tree.vertexCount());
        assertEquals(new ActivePointState(1, 8, 1), tree.activePoint());
        assertEquals(List.of('a', 'b', 'c'), tree.longestRepeatedSuffix());
        TreeValidator.validate(tree);
    }

    @Test
    void periodicWordKeepsASingleLeaf() {
        SuffixTree<Character> tree = SuffixTreeBuilder.build("aaaa");

        assertEquals(1, tree.vertexCount());
        assertVertex(tree, 0, 0, Map.of('a', leaf(0)));
        assertEquals(new ActivePointState(0, 1, 3), tree.activePoint());
        assertEquals(List.of('a', 'a', 'a'), tree.longestRepeatedSuffix());
    }

    @Test
    void arbitrarySymbolTypesAreAccepted() {
        List<String> word = List.of("to", "be", "or", "not", "to", "be");
        SuffixTree<String> tree = SuffixTreeBuilder.build(word);

        TreeValidator.validate(tree);
        assertEquals(List.of(0, 4), tree.findOccurrences(List.of("to", "be")));
        assertEquals(List.of("to", "be"), tree.longestRepeatedSuffix());
    }

    @Test
    void fixedLeafEndsPinTheEndToTheLastIndex() {
        SuffixTreeConfiguration fixed = SuffixTreeConfiguration.builder().leafEndMode(LeafEndMode.FIXED).build();
        SuffixTree<Character> tree = SuffixTreeBuilder.build("abcacdae", fixed);

        assertEquals(LeafEndMode.FIXED, tree.leafEndMode());
        assertEquals(3, tree.vertexCount());
        assertEquals(EdgeDescriptor.closedLeaf(4, 7), tree.edge(1, 'c').orElseThrow());
        assertEquals(EdgeDescriptor.internal(0, 0, 1), tree.edge(0, 'a').orElseThrow());
        TreeValidator.validate(tree);
    }

    @Test
    void incrementalBuilderRejectsFixedLeafEnds() {
        SuffixTreeConfiguration fixed = SuffixTreeConfiguration.builder().leafEndMode(LeafEndMode.FIXED).build();
        assertThrows(IllegalArgumentException.class, () -> new SuffixTreeBuilder<Character>(fixed));
    }

    @Test
    void incrementalBuildMatchesEachPrefix() {
        SuffixTreeBuilder<Character> builder = new SuffixTreeBuilder<>();
        for (char c : "abcab".toCharArray()) {
            builder.append(c);
        }
        SuffixTree<Character> prefix = builder.snapshot();
        assertEquals(new ActivePointState(0, 3, 2), prefix.activePoint());
        assertEquals(1, prefix.vertexCount());

        for (char c : "xabcd".toCharArray()) {
            builder.append(c);
        }
        SuffixTree<Character> whole = builder.snapshot();
        assertEquals(SuffixTreeBuilder.build("abcabxabcd").view().edges(), whole.view().edges());

        // The earlier snapshot is a copy and did not grow.
        assertEquals(5, prefix.length());
        assertEquals(1, prefix.vertexCount());
    }

    @Test
    void verifyingConfigurationValidatesSnapshots() {
        SuffixTreeConfiguration verify = SuffixTreeConfiguration.builder()
                .verifyInvariants(true)
                .traceLogging(true)
                .build();
        SuffixTree<Character> tree = SuffixTreeBuilder.build("cacao", verify);
        assertEquals(3, tree.vertexCount());
    }

    @Test
    void statsCountLeavesAndVertices() {
        SuffixTreeBuilder<Character> builder = new SuffixTreeBuilder<>();
        for (char c : "abcabxabcd".toCharArray()) {
            builder.append(c);
        }
        BuildStats stats = builder.stats();
        assertEquals(10, stats.symbols());
        assertEquals(6, stats.vertices());
        assertEquals(10, stats.leaves());
        assertTrue(stats.suffixMoves() <= stats.symbols());
    }

    @Test
    void rejectsNullSymbols() {
        SuffixTreeBuilder<String> builder = new SuffixTreeBuilder<>();
        assertThrows(NullPointerException.class, () -> builder.append(null));
    }

    @Test
    void failedPhaseIsReportedAndStopsTheBuilder() {
        SuffixTreeBuilder<Character> builder = new SuffixTreeBuilder<>();
        for (char c : "aba".toCharArray()) {
            builder.append(c);
        }
        assertEquals(new ActivePointState(0, 2, 1), builder.activePoint());

        // Pin the leaf under the active point to one symbol, so reading 'b' runs off its end.
        builder.graph().setEdge(LabeledEdgeGraph.ROOT, 0, EdgeDescriptor.closedLeaf(0, 0));

        List<LogRecord> records = new ArrayList<>();
        Handler capture = new Handler() {
            @Override
            public void publish(LogRecord record) {
                records.add(record);
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        Logger logger = Logger.getLogger(SuffixTreeLogger.class.getName());
        logger.addHandler(capture);
        try {
            InvariantViolationException e = assertThrows(InvariantViolationException.class, () -> builder.append('b'));
            assertTrue(e.getMessage().startsWith("invariant violated in phase 3 (symbol b, active point (vertex=0, pos=2"),
                    e.getMessage());
            assertTrue(e.getCause() instanceof InvariantViolationException);
            assertTrue(e.getMessage().contains("runs past leaf edge"), e.getMessage());
        } finally {
            logger.removeHandler(capture);
        }

        assertTrue(records.stream().anyMatch(r -> r.getLevel() == Level.SEVERE
                && r.getMessage().contains("phase 3")), records.toString());
        IllegalStateException next = assertThrows(IllegalStateException.class, () -> builder.append('c'));
        assertTrue(next.getMessage().contains("aborted"), next.getMessage());
        assertEquals(4, builder.length());
    }
}
