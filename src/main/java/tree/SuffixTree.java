package tree;

import graph.EdgeDescriptor;
import graph.LabeledEdgeGraph;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import render.TreeView;
import utilities.AlphabetMapper;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Suffix tree of a processed word, as produced by {@link SuffixTreeBuilder}.
 *
 * Vertex 0 is the root. Only internal vertices are materialized; leaf edges point to
 * {@link graph.EdgeTarget#LEAF}. Open leaf ends resolve against {@link #length()}.
 *
 * Query:
 *   findOccurrences(pattern) returns all start offsets of the pattern in the word. Suffixes
 *   that end inside the tree (no sentinel) are checked against the word directly, so the
 *   answer is complete.
 */
public final class SuffixTree<S> {

    private static final int NO_PARENT = -1;

    private final LabeledEdgeGraph graph;
    private final List<S> word;
    private final AlphabetMapper<S> mapper;
    private final IntArrayList codes;
    private final ActivePointState activePoint;
    private final LeafEndMode leafEndMode;

    // Per internal vertex: string depth and the inclusive end of the incoming edge.
    private final int[] depth;
    private final int[] incomingEnd;
    private final int[] parent;

    SuffixTree(LabeledEdgeGraph graph, List<S> word, AlphabetMapper<S> mapper, IntArrayList codes,
               ActivePointState activePoint, LeafEndMode leafEndMode) {
        this.graph = graph;
        this.word = Collections.unmodifiableList(word);
        this.mapper = mapper;
        this.codes = codes;
        this.activePoint = activePoint;
        this.leafEndMode = leafEndMode;

        int n = graph.vertexCount();
        this.depth = new int[n];
        this.incomingEnd = new int[n];
        this.parent = new int[n];
        indexVertices();
    }

    // Breadth-first pass from the root recording depth and parent of every internal vertex.
    private void indexVertices() {
        Arrays.fill(parent, NO_PARENT);
        incomingEnd[LabeledEdgeGraph.ROOT] = -1;
        ArrayDeque<Integer> queue = new ArrayDeque<>();
        queue.add(LabeledEdgeGraph.ROOT);
        while (!queue.isEmpty()) {
            int v = queue.poll();
            for (EdgeDescriptor edge : graph.edges(v).values()) {
                if (edge.isLeaf()) {
                    continue;
                }
                int child = edge.target().vertex();
                int end = edge.effectiveEnd(lastIndex());
                depth[child] = depth[v] + (end - edge.start() + 1);
                incomingEnd[child] = end;
                parent[child] = v;
                queue.add(child);
            }
        }
    }

    public int root() {
        return LabeledEdgeGraph.ROOT;
    }

    public int vertexCount() {
        return graph.vertexCount();
    }

    public int edgeCount() {
        return graph.edgeCount();
    }

    // Number of processed symbols.
    public int length() {
        return word.size();
    }

    public List<S> word() {
        return word;
    }

    public ActivePointState activePoint() {
        return activePoint;
    }

    public LeafEndMode leafEndMode() {
        return leafEndMode;
    }

    public Optional<EdgeDescriptor> edge(int vertex, S symbol) {
        checkReachable(vertex);
        int code = mapper.lookup(symbol);
        if (code == AlphabetMapper.UNKNOWN || !graph.hasEdge(vertex, code)) {
            return Optional.empty();
        }
        return Optional.of(graph.edge(vertex, code));
    }

    // Outgoing edges keyed by leading symbol, ordered by edge start.
    public Map<S, EdgeDescriptor> edges(int vertex) {
        checkReachable(vertex);
        List<Int2ObjectMap.Entry<EdgeDescriptor>> entries = new ArrayList<>(graph.edges(vertex).int2ObjectEntrySet());
        entries.sort(Comparator.comparingInt(e -> e.getValue().start()));
        Map<S, EdgeDescriptor> out = new LinkedHashMap<>();
        for (Int2ObjectMap.Entry<EdgeDescriptor> entry : entries) {
            out.put(mapper.symbol(entry.getIntKey()), entry.getValue());
        }
        return Collections.unmodifiableMap(out);
    }

    public OptionalInt suffixLink(int vertex) {
        checkReachable(vertex);
        return graph.suffixLink(vertex);
    }

    // Substring carried by an edge, leaves resolved against the processed length.
    public List<S> label(EdgeDescriptor edge) {
        EdgeDescriptor resolved = edge.resolve(lastIndex());
        return word.subList(resolved.start(), resolved.end() + 1);
    }

    public int depth(int vertex) {
        checkReachable(vertex);
        return depth[vertex];
    }

    public OptionalInt parent(int vertex) {
        checkReachable(vertex);
        return parent[vertex] == NO_PARENT ? OptionalInt.empty() : OptionalInt.of(parent[vertex]);
    }

    // Factor of the word spelled from the root down to the vertex.
    public List<S> factor(int vertex) {
        checkReachable(vertex);
        if (vertex == LabeledEdgeGraph.ROOT) {
            return Collections.emptyList();
        }
        int end = incomingEnd[vertex];
        return word.subList(end - depth[vertex] + 1, end + 1);
    }

    // Longest suffix of the word occurring at least twice, as denoted by the active point.
    public List<S> longestRepeatedSuffix() {
        int length = depth[activePoint.vertex()] + activePoint.len();
        return word.subList(word.size() - length, word.size());
    }

    public boolean contains(List<S> pattern) {
        if (pattern == null || pattern.isEmpty()) {
            return true;
        }
        return locate(pattern) != null;
    }

    /**
     * Find all starting offsets where the pattern occurs, sorted ascending.
     * An empty pattern matches at every boundary 0..length().
     */
    public List<Integer> findOccurrences(List<S> pattern) {
        if (pattern == null || pattern.isEmpty()) {
            List<Integer> all = new ArrayList<>(word.size() + 1);
            for (int i = 0; i <= word.size(); i++) {
                all.add(i);
            }
            return all;
        }
        Match match = locate(pattern);
        if (match == null) {
            return Collections.emptyList();
        }

        IntArrayList starts = new IntArrayList();
        if (match.edge.isLeaf()) {
            starts.add(match.edge.start() - depth[match.vertex]);
        } else {
            collectLeafStarts(match.edge.target().vertex(), starts);
        }

        // Suffixes no longer than the active point never became leaves.
        int implicitFrom = word.size() - (depth[activePoint.vertex()] + activePoint.len());
        int[] q = match.codes;
        for (int start = Math.max(implicitFrom, 0); start + q.length <= word.size(); start++) {
            if (matchesAt(q, start)) {
                starts.add(start);
            }
        }

        int[] sorted = starts.toIntArray();
        Arrays.sort(sorted);
        List<Integer> result = new ArrayList<>(sorted.length);
        for (int start : sorted) {
            result.add(start);
        }
        return result;
    }

    // Walk the pattern down from the root; null when it leaves the tree.
    private Match locate(List<S> pattern) {
        int[] q = new int[pattern.size()];
        for (int i = 0; i < q.length; i++) {
            int code = mapper.lookup(pattern.get(i));
            if (code == AlphabetMapper.UNKNOWN) {
                return null;
            }
            q[i] = code;
        }

        int current = LabeledEdgeGraph.ROOT;
        int patternIndex = 0;
        int last = lastIndex();
        while (true) {
            if (!graph.hasEdge(current, q[patternIndex])) {
                return null;
            }
            EdgeDescriptor edge = graph.edge(current, q[patternIndex]);
            int edgeEnd = edge.effectiveEnd(last);
            int index = edge.start();
            while (index <= edgeEnd && patternIndex < q.length) {
                if (codes.getInt(index) != q[patternIndex]) {
                    return null;
                }
                index++;
                patternIndex++;
            }
            if (patternIndex == q.length) {
                return new Match(current, edge, q);
            }
            // Whole edge consumed with pattern left; leaves have nothing below.
            if (edge.isLeaf()) {
                return null;
            }
            current = edge.target().vertex();
        }
    }

    private boolean matchesAt(int[] q, int start) {
        for (int j = 0; j < q.length; j++) {
            if (codes.getInt(start + j) != q[j]) {
                return false;
            }
        }
        return true;
    }

    // Iterative DFS so long repetitive words do not exhaust the stack.
    private void collectLeafStarts(int vertex, IntArrayList out) {
        ArrayDeque<Integer> stack = new ArrayDeque<>();
        stack.push(vertex);
        while (!stack.isEmpty()) {
            int v = stack.pop();
            for (EdgeDescriptor edge : graph.edges(v).values()) {
                if (edge.isLeaf()) {
                    out.add(edge.start() - depth[v]);
                } else {
                    stack.push(edge.target().vertex());
                }
            }
        }
    }

    /**
     * Read-only projection for rendering: vertices by id, edges ordered by source then start,
     * leaf labels resolved against the processed length.
     */
    public TreeView<S> view() {
        List<TreeView.VertexView> vertices = new ArrayList<>(vertexCount());
        List<TreeView.EdgeView<S>> edges = new ArrayList<>(edgeCount());
        for (int v = 0; v < vertexCount(); v++) {
            vertices.add(new TreeView.VertexView(v, v == LabeledEdgeGraph.ROOT, graph.suffixLink(v)));
            for (EdgeDescriptor edge : edges(v).values()) {
                edges.add(new TreeView.EdgeView<>(v, edge.target(), edge.start(), List.copyOf(label(edge))));
            }
        }
        return new TreeView<>(vertices, edges);
    }

    LabeledEdgeGraph graph() {
        return graph;
    }

    IntList codes() {
        return IntLists.unmodifiable(codes);
    }

    int lastIndex() {
        return word.size() - 1;
    }

    private void checkReachable(int vertex) {
        if (vertex < 0 || vertex >= graph.vertexCount()) {
            throw new IllegalArgumentException("unknown vertex " + vertex);
        }
    }

    private static final class Match {
        final int vertex;
        final EdgeDescriptor edge;
        final int[] codes;

        Match(int vertex, EdgeDescriptor edge, int[] codes) {
            this.vertex = vertex;
            this.edge = edge;
            this.codes = codes;
        }
    }

    @Override
    public String toString() {
        return "SuffixTree{length=" + length() + ", vertices=" + vertexCount() + ", edges=" + edgeCount()
                + ", activePoint=" + activePoint + '}';
    }
}
