package tree;

import graph.EdgeDescriptor;
import graph.InvariantViolationException;
import graph.LabeledEdgeGraph;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Structural checks for a finished (or partially built) suffix tree. Spellings are rebuilt
 * edge by edge from the root instead of trusting the tree's own depth index, so the checks
 * cost O(n^2) in the worst case; use them in tests and debugging, not on hot paths.
 */
public final class TreeValidator {

    private TreeValidator() {
    }

    /**
     * @throws InvariantViolationException describing the first broken invariant
     */
    public static void validate(SuffixTree<?> tree) {
        LabeledEdgeGraph graph = tree.graph();
        IntList codes = tree.codes();
        int lastIndex = tree.lastIndex();

        OptionalInt rootLink = graph.suffixLink(LabeledEdgeGraph.ROOT);
        if (rootLink.isEmpty() || rootLink.getAsInt() != LabeledEdgeGraph.ROOT) {
            throw new InvariantViolationException("root suffix link must point to the root");
        }

        // Spelling of every internal vertex, as code sequences.
        Map<Integer, List<Integer>> spelled = new HashMap<>();
        spelled.put(LabeledEdgeGraph.ROOT, new ArrayList<>());
        ArrayDeque<Integer> stack = new ArrayDeque<>();
        stack.push(LabeledEdgeGraph.ROOT);
        while (!stack.isEmpty()) {
            int v = stack.pop();
            List<Integer> prefix = spelled.get(v);
            Int2ObjectMap<EdgeDescriptor> edges = graph.edges(v);
            if (v != LabeledEdgeGraph.ROOT && edges.size() < 2) {
                throw new InvariantViolationException("internal vertex " + v + " has " + edges.size() + " children");
            }
            for (Int2ObjectMap.Entry<EdgeDescriptor> entry : edges.int2ObjectEntrySet()) {
                EdgeDescriptor edge = entry.getValue();
                int end = edge.effectiveEnd(lastIndex);
                if (end > lastIndex || edge.start() > end) {
                    throw new InvariantViolationException("edge " + edge + " of vertex " + v
                            + " lies outside the processed word of length " + (lastIndex + 1));
                }
                if (codes.getInt(edge.start()) != entry.getIntKey()) {
                    throw new InvariantViolationException("edge " + edge + " of vertex " + v
                            + " is keyed by a symbol other than its first one");
                }
                List<Integer> path = new ArrayList<>(prefix);
                for (int i = edge.start(); i <= end; i++) {
                    path.add(codes.getInt(i));
                }
                int at = edge.start() - prefix.size();
                if (at < 0 || !codes.subList(at, end + 1).equals(path)) {
                    throw new InvariantViolationException("path to edge " + edge + " of vertex " + v
                            + " does not spell the word at position " + at);
                }
                if (!edge.isLeaf()) {
                    int child = edge.target().vertex();
                    if (spelled.put(child, path) != null) {
                        throw new InvariantViolationException("vertex " + child + " is reachable twice");
                    }
                    stack.push(child);
                }
            }
        }

        if (spelled.size() != graph.vertexCount()) {
            throw new InvariantViolationException(
                    (graph.vertexCount() - spelled.size()) + " vertices are unreachable from the root");
        }

        for (Map.Entry<Integer, List<Integer>> entry : spelled.entrySet()) {
            int v = entry.getKey();
            if (v == LabeledEdgeGraph.ROOT) {
                continue;
            }
            int link = graph.suffixLink(v).orElseThrow(() ->
                    new InvariantViolationException("vertex " + v + " has no suffix link"));
            List<Integer> factor = entry.getValue();
            if (!spelled.get(link).equals(factor.subList(1, factor.size()))) {
                throw new InvariantViolationException("suffix link " + v + " -> " + link
                        + " does not drop exactly the first symbol");
            }
        }

        validateActivePoint(tree, spelled);
    }

    private static void validateActivePoint(SuffixTree<?> tree, Map<Integer, List<Integer>> spelled) {
        ActivePointState point = tree.activePoint();
        IntList codes = tree.codes();
        List<Integer> prefix = spelled.get(point.vertex());
        if (prefix == null) {
            throw new InvariantViolationException("active point " + point + " refers to an unknown vertex");
        }
        List<Integer> path = new ArrayList<>(prefix);
        if (point.isExplicit()) {
            if (point.pos() != 0) {
                throw new InvariantViolationException("explicit active point " + point + " keeps a position");
            }
        } else {
            int symbol = codes.getInt(point.pos());
            if (!tree.graph().hasEdge(point.vertex(), symbol)) {
                throw new InvariantViolationException("active point " + point + " has no edge to sit on");
            }
            EdgeDescriptor edge = tree.graph().edge(point.vertex(), symbol);
            if (point.len() >= edge.length(tree.lastIndex())) {
                throw new InvariantViolationException("active point " + point + " is not canonical on " + edge);
            }
            for (int i = 0; i < point.len(); i++) {
                path.add(codes.getInt(edge.start() + i));
            }
        }
        int n = codes.size();
        if (path.size() > n || !codes.subList(n - path.size(), n).equals(path)) {
            throw new InvariantViolationException("active point " + point + " does not spell a suffix of the word");
        }
    }
}
